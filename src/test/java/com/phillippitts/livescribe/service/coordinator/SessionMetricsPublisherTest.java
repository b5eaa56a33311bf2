package com.phillippitts.livescribe.service.coordinator;

import com.phillippitts.livescribe.service.metrics.SessionMetrics;
import com.phillippitts.livescribe.service.session.SessionRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;

class SessionMetricsPublisherTest {

    @Test
    void noopReportsDisabledAndIgnoresCalls() {
        SessionMetricsPublisher publisher = SessionMetricsPublisher.NOOP;

        assertDoesNotThrow(() -> {
            publisher.recordStarted(null, 0L);
            publisher.recordStartRejected(null);
            publisher.recordFragment(true);
            publisher.recordClosed("stopped", 1L);
            publisher.recordPersistenceFailure();
        });
        assertThat(publisher.isEnabled()).isFalse();
    }

    @Test
    void delegatesToMetricsWhenPresent() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        SessionMetricsPublisher publisher =
                new SessionMetricsPublisher(new SessionMetrics(registry, new SessionRegistry()));

        publisher.recordFragment(true);
        publisher.recordStartRejected("already_active");

        assertThat(publisher.isEnabled()).isTrue();
        assertThat(registry.get("livescribe.session.fragments").tag("kind", "final").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get("livescribe.session.start.rejected").counter().count()).isEqualTo(1.0);
    }
}
