package com.phillippitts.livescribe.service.coordinator;

import com.phillippitts.livescribe.domain.RecognitionConfig;
import com.phillippitts.livescribe.service.collaborator.TranscriptPersistence;
import com.phillippitts.livescribe.service.gateway.Broadcaster;
import com.phillippitts.livescribe.service.recognition.RecognitionClient;
import com.phillippitts.livescribe.service.session.SessionRegistry;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Builder for {@link DefaultSessionCoordinator}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * SessionCoordinator coordinator = DefaultSessionCoordinatorBuilder.builder()
 *     .registry(registry)
 *     .recognitionClient(client)
 *     .broadcaster(broadcaster)
 *     .persistence(persistence)
 *     .sessionExecutor(sessionExecutor)
 *     .lifecycleExecutor(lifecycleExecutor)
 *     .defaultConfig(RecognitionConfig.defaults())
 *     .drainTimeout(Duration.ofSeconds(5))
 *     .shutdownTimeout(Duration.ofSeconds(10))
 *     .metricsPublisher(metricsPublisher)
 *     .publisher(eventPublisher)
 *     .build();
 * }</pre>
 *
 * <p>Metrics publisher and event publisher are optional; the timeouts default to 5 s and 10 s
 * and the recognition config to {@link RecognitionConfig#defaults()}.
 *
 * @since 1.0
 */
public final class DefaultSessionCoordinatorBuilder {

    // Required dependencies
    private SessionRegistry registry;
    private RecognitionClient recognitionClient;
    private Broadcaster broadcaster;
    private TranscriptPersistence persistence;
    private Executor sessionExecutor;
    private Executor lifecycleExecutor;

    // Optional
    private RecognitionConfig defaultConfig = RecognitionConfig.defaults();
    private Duration drainTimeout = Duration.ofSeconds(5);
    private Duration shutdownTimeout = Duration.ofSeconds(10);
    private SessionMetricsPublisher metricsPublisher = SessionMetricsPublisher.NOOP;
    private ApplicationEventPublisher publisher;

    private DefaultSessionCoordinatorBuilder() {
        // Private constructor - use builder() factory method
    }

    public static DefaultSessionCoordinatorBuilder builder() {
        return new DefaultSessionCoordinatorBuilder();
    }

    public DefaultSessionCoordinatorBuilder registry(SessionRegistry registry) {
        this.registry = registry;
        return this;
    }

    public DefaultSessionCoordinatorBuilder recognitionClient(RecognitionClient recognitionClient) {
        this.recognitionClient = recognitionClient;
        return this;
    }

    public DefaultSessionCoordinatorBuilder broadcaster(Broadcaster broadcaster) {
        this.broadcaster = broadcaster;
        return this;
    }

    public DefaultSessionCoordinatorBuilder persistence(TranscriptPersistence persistence) {
        this.persistence = persistence;
        return this;
    }

    /**
     * Sets the executor running one fragment pump per session. It must not run tasks on the
     * calling thread: a pump blocks until its stream ends.
     *
     * @param sessionExecutor pump executor (required)
     * @return this builder
     */
    public DefaultSessionCoordinatorBuilder sessionExecutor(Executor sessionExecutor) {
        this.sessionExecutor = sessionExecutor;
        return this;
    }

    /**
     * Sets the executor for disconnect teardown and parallel shutdown.
     *
     * @param lifecycleExecutor teardown executor (required)
     * @return this builder
     */
    public DefaultSessionCoordinatorBuilder lifecycleExecutor(Executor lifecycleExecutor) {
        this.lifecycleExecutor = lifecycleExecutor;
        return this;
    }

    public DefaultSessionCoordinatorBuilder defaultConfig(RecognitionConfig defaultConfig) {
        this.defaultConfig = defaultConfig;
        return this;
    }

    public DefaultSessionCoordinatorBuilder drainTimeout(Duration drainTimeout) {
        this.drainTimeout = drainTimeout;
        return this;
    }

    public DefaultSessionCoordinatorBuilder shutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
        return this;
    }

    public DefaultSessionCoordinatorBuilder metricsPublisher(SessionMetricsPublisher metricsPublisher) {
        this.metricsPublisher = metricsPublisher;
        return this;
    }

    public DefaultSessionCoordinatorBuilder publisher(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
        return this;
    }

    /**
     * @return configured coordinator
     * @throws NullPointerException if a required dependency is missing
     * @throws IllegalArgumentException if a timeout is negative
     */
    public DefaultSessionCoordinator build() {
        Objects.requireNonNull(registry, "registry is required");
        Objects.requireNonNull(recognitionClient, "recognitionClient is required");
        Objects.requireNonNull(broadcaster, "broadcaster is required");
        Objects.requireNonNull(persistence, "persistence is required");
        Objects.requireNonNull(sessionExecutor, "sessionExecutor is required");
        Objects.requireNonNull(lifecycleExecutor, "lifecycleExecutor is required");
        Objects.requireNonNull(defaultConfig, "defaultConfig is required");
        if (drainTimeout == null || drainTimeout.isNegative()) {
            throw new IllegalArgumentException("drainTimeout must not be negative");
        }
        if (shutdownTimeout == null || shutdownTimeout.isNegative()) {
            throw new IllegalArgumentException("shutdownTimeout must not be negative");
        }
        return new DefaultSessionCoordinator(registry, recognitionClient, broadcaster, persistence,
                sessionExecutor, lifecycleExecutor, defaultConfig, drainTimeout, shutdownTimeout,
                metricsPublisher, publisher);
    }
}
