package com.phillippitts.livescribe.service.coordinator;

import com.phillippitts.livescribe.service.metrics.SessionMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

/**
 * Null-safe facade over {@link SessionMetrics} used by the session coordinator.
 *
 * <p>All methods are no-ops when constructed without metrics, which lets the coordinator run
 * in unit tests without a meter registry.
 *
 * @see SessionMetrics
 */
@Component
public final class SessionMetricsPublisher {

    private static final Logger LOG = LogManager.getLogger(SessionMetricsPublisher.class);

    /**
     * Shared no-op instance for tests and builder defaults. Never throws and reports disabled.
     */
    public static final SessionMetricsPublisher NOOP = new SessionMetricsPublisher(null);

    private final SessionMetrics metrics;

    /**
     * @param metrics metrics service (nullable for test mode)
     */
    public SessionMetricsPublisher(SessionMetrics metrics) {
        this.metrics = metrics;
        if (metrics == null) {
            LOG.debug("SessionMetricsPublisher created without metrics (test mode)");
        }
    }

    public void recordStarted(String provider, long connectNanos) {
        if (metrics == null) {
            return;
        }
        metrics.recordStarted(provider, connectNanos);
    }

    public void recordStartRejected(String reason) {
        if (metrics == null) {
            return;
        }
        metrics.incrementStartRejected(reason);
    }

    public void recordFragment(boolean isFinal) {
        if (metrics == null) {
            return;
        }
        metrics.incrementFragment(isFinal);
    }

    public void recordClosed(String outcome, long durationNanos) {
        if (metrics == null) {
            return;
        }
        metrics.recordClosed(outcome, durationNanos);
    }

    public void recordPersistenceFailure() {
        if (metrics == null) {
            return;
        }
        metrics.incrementPersistenceFailure();
    }

    public boolean isEnabled() {
        return metrics != null;
    }
}
