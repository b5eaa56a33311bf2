package com.phillippitts.livescribe.config.coordinator;

import com.phillippitts.livescribe.config.properties.SessionProperties;
import com.phillippitts.livescribe.config.recognition.DeepgramProperties;
import com.phillippitts.livescribe.service.collaborator.TranscriptPersistence;
import com.phillippitts.livescribe.service.coordinator.DefaultSessionCoordinatorBuilder;
import com.phillippitts.livescribe.service.coordinator.SessionCoordinator;
import com.phillippitts.livescribe.service.coordinator.SessionMetricsPublisher;
import com.phillippitts.livescribe.service.gateway.Broadcaster;
import com.phillippitts.livescribe.service.recognition.RecognitionClient;
import com.phillippitts.livescribe.service.session.SessionRegistry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Wires the session coordinator explicitly through its builder.
 */
@Configuration
public class CoordinatorConfig {

    @Bean
    public SessionCoordinator sessionCoordinator(SessionRegistry registry,
                                                 RecognitionClient recognitionClient,
                                                 Broadcaster broadcaster,
                                                 TranscriptPersistence persistence,
                                                 @Qualifier("sessionExecutor") ThreadPoolTaskExecutor sessionExecutor,
                                                 @Qualifier("lifecycleExecutor") ThreadPoolTaskExecutor lifecycleExecutor,
                                                 DeepgramProperties deepgramProperties,
                                                 SessionProperties sessionProperties,
                                                 SessionMetricsPublisher metricsPublisher,
                                                 ApplicationEventPublisher publisher) {
        return DefaultSessionCoordinatorBuilder.builder()
                .registry(registry)
                .recognitionClient(recognitionClient)
                .broadcaster(broadcaster)
                .persistence(persistence)
                .sessionExecutor(sessionExecutor)
                .lifecycleExecutor(lifecycleExecutor)
                .defaultConfig(deepgramProperties.toRecognitionConfig())
                .drainTimeout(sessionProperties.drainTimeout())
                .shutdownTimeout(sessionProperties.shutdownTimeout())
                .metricsPublisher(metricsPublisher)
                .publisher(publisher)
                .build();
    }
}
