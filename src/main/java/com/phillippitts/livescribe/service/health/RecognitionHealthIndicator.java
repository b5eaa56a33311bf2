package com.phillippitts.livescribe.service.health;

import com.phillippitts.livescribe.service.coordinator.SessionCoordinator;
import com.phillippitts.livescribe.service.recognition.RecognitionClient;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the upstream recognition provider.
 *
 * <ul>
 *   <li>UP: provider configured and credentials not rejected</li>
 *   <li>DOWN: API key missing or rejected by the provider</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health.
 */
@Component
public class RecognitionHealthIndicator implements HealthIndicator {

    private final RecognitionClient recognitionClient;
    private final SessionCoordinator coordinator;

    public RecognitionHealthIndicator(RecognitionClient recognitionClient, SessionCoordinator coordinator) {
        this.recognitionClient = recognitionClient;
        this.coordinator = coordinator;
    }

    @Override
    public Health health() {
        Health.Builder builder = recognitionClient.isHealthy() ? Health.up() : Health.down();
        return builder
                .withDetail("provider", recognitionClient.getProviderName())
                .withDetail("status", recognitionClient.isHealthy() ? "ready" : "unavailable")
                .withDetail("activeSessions", coordinator.activeSessionCount())
                .build();
    }
}
