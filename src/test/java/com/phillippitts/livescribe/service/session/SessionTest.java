package com.phillippitts.livescribe.service.session;

import com.phillippitts.livescribe.domain.Identity;
import com.phillippitts.livescribe.domain.SessionState;
import com.phillippitts.livescribe.domain.TranscriptFragment;
import com.phillippitts.livescribe.exception.UpstreamErrorKind;
import com.phillippitts.livescribe.exception.UpstreamException;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionTest {

    private final Session session = new Session("m1", Identity.of("u1"), "c1", Instant.now());

    @Test
    void shouldRequireLockForTransitions() {
        assertThatThrownBy(() -> session.transitionTo(SessionState.STARTING))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("lock not held");
    }

    @Test
    void shouldRejectIllegalTransition() {
        session.lock().lock();
        try {
            assertThatThrownBy(() -> session.transitionTo(SessionState.ACTIVE))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("IDLE -> ACTIVE");
        } finally {
            session.lock().unlock();
        }
    }

    @Test
    void shouldKeepFirstFailure() {
        UpstreamException first = new UpstreamException(UpstreamErrorKind.TRANSIENT, "first");
        UpstreamException second = new UpstreamException(UpstreamErrorKind.UNKNOWN, "second");

        session.lock().lock();
        try {
            session.recordFailure(first);
            session.recordFailure(second);

            assertThat(session.failure()).isSameAs(first);
        } finally {
            session.lock().unlock();
        }
    }

    @Test
    void shouldCountFinalFragmentsWithoutHoldingLock() {
        session.lock().lock();
        try {
            session.transcript().append(TranscriptFragment.finalFragment("m1", "hi", 0.9, 1));
        } finally {
            session.lock().unlock();
        }

        assertThat(session.finalFragmentCount()).isEqualTo(1);
    }

    @Test
    void shouldNotBeOwnedByOtherIdentity() {
        assertThat(session.isOwnedBy(Identity.of("u2"))).isFalse();
        assertThat(session.isOwnedBy(null)).isFalse();
    }
}
