package com.phillippitts.livescribe.config.recognition;

import com.phillippitts.livescribe.service.recognition.RecognitionClient;
import com.phillippitts.livescribe.service.recognition.deepgram.DeepgramRecognitionClient;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;

/**
 * Wires the upstream recognition client.
 *
 * <p>The Deepgram client connects through Spring's {@link StandardWebSocketClient}, backed by the
 * embedded Tomcat WebSocket container.
 */
@Configuration
public class RecognitionClientConfig {

    private static final Logger LOG = LogManager.getLogger(RecognitionClientConfig.class);

    @Bean
    public WebSocketClient upstreamWebSocketClient() {
        return new StandardWebSocketClient();
    }

    @Bean
    public RecognitionClient recognitionClient(DeepgramProperties properties, WebSocketClient upstreamWebSocketClient) {
        if (!properties.hasApiKey()) {
            LOG.warn("recognition.deepgram.api-key is not set; stream starts will fail until it is configured");
        }
        LOG.info("Recognition provider: deepgram (url={}, model={}, language={})",
                properties.url(), properties.model(), properties.language());
        return new DeepgramRecognitionClient(properties, upstreamWebSocketClient);
    }
}
