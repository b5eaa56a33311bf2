package com.phillippitts.livescribe.config.websocket;

import com.phillippitts.livescribe.config.properties.GatewayProperties;
import com.phillippitts.livescribe.presentation.websocket.TokenHandshakeInterceptor;
import com.phillippitts.livescribe.presentation.websocket.TranscriptionWebSocketHandler;
import com.phillippitts.livescribe.service.gateway.ConnectionGateway;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

/**
 * Registers the transcription endpoint and sizes the servlet WebSocket container.
 *
 * <p>Example application.properties:
 * <pre>
 * livescribe.gateway.path=/ws/transcription
 * livescribe.gateway.max-text-message-bytes=1048576
 * livescribe.gateway.idle-timeout=5m
 * </pre>
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private static final Logger LOG = LogManager.getLogger(WebSocketConfig.class);

    private final GatewayProperties properties;
    private final ConnectionGateway gateway;

    public WebSocketConfig(GatewayProperties properties, ConnectionGateway gateway) {
        this.properties = properties;
        this.gateway = gateway;
    }

    @Bean
    public TranscriptionWebSocketHandler transcriptionWebSocketHandler() {
        return new TranscriptionWebSocketHandler(gateway, properties);
    }

    @Bean
    public TokenHandshakeInterceptor tokenHandshakeInterceptor() {
        return new TokenHandshakeInterceptor(gateway);
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        String[] origins = properties.allowedOrigins().toArray(new String[0]);
        registry.addHandler(transcriptionWebSocketHandler(), properties.path())
                .addInterceptors(tokenHandshakeInterceptor())
                .setAllowedOriginPatterns(origins);
        LOG.info("Transcription endpoint registered at {} (origins={})", properties.path(), properties.allowedOrigins());
    }

    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(properties.maxTextMessageBytes());
        container.setMaxBinaryMessageBufferSize(properties.maxBinaryMessageBytes());
        container.setMaxSessionIdleTimeout(properties.idleTimeout().toMillis());
        container.setAsyncSendTimeout(properties.sendTimeLimit().toMillis());
        return container;
    }
}
