package com.phillippitts.livescribe.service.metrics;

import com.phillippitts.livescribe.service.session.SessionRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for live transcription sessions.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Live session count (gauge over the registry)</li>
 *   <li>Upstream connect latency and session duration</li>
 *   <li>Start rejections and failures by reason</li>
 *   <li>Interim and final fragment throughput</li>
 *   <li>Transcript persistence failures</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class SessionMetrics {

    private static final String METRIC_PREFIX = "livescribe.session";

    private final MeterRegistry registry;

    public SessionMetrics(MeterRegistry registry, SessionRegistry sessions) {
        this.registry = registry;
        Gauge.builder(METRIC_PREFIX + ".active", sessions, SessionRegistry::size)
                .description("Number of live transcription sessions")
                .register(registry);
    }

    /**
     * Records a successful start together with the upstream connect latency.
     *
     * @param provider      recognition provider name
     * @param connectNanos  time spent opening the upstream stream
     */
    public void recordStarted(String provider, long connectNanos) {
        Timer.builder(METRIC_PREFIX + ".connect.latency")
                .description("Time taken to open the upstream recognition stream")
                .tag("provider", provider)
                .register(registry)
                .record(connectNanos, TimeUnit.NANOSECONDS);
        Counter.builder(METRIC_PREFIX + ".started")
                .description("Number of sessions that reached ACTIVE")
                .tag("provider", provider)
                .register(registry)
                .increment();
    }

    /**
     * @param reason stable rejection reason (already_active, unauthorized, upstream_unavailable, ...)
     */
    public void incrementStartRejected(String reason) {
        Counter.builder(METRIC_PREFIX + ".start.rejected")
                .description("Number of start requests that did not produce a session")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementFragment(boolean isFinal) {
        Counter.builder(METRIC_PREFIX + ".fragments")
                .description("Number of fragments delivered to listeners")
                .tag("kind", isFinal ? "final" : "interim")
                .register(registry)
                .increment();
    }

    /**
     * @param outcome       stopped, disconnected, failed or shutdown
     * @param durationNanos time from creation to close
     */
    public void recordClosed(String outcome, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".duration")
                .description("Lifetime of closed sessions")
                .tag("outcome", outcome)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementPersistenceFailure() {
        Counter.builder(METRIC_PREFIX + ".persistence.failure")
                .description("Number of transcripts that could not be persisted")
                .register(registry)
                .increment();
    }
}
