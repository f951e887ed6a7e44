package com.launchpad.socket;

import com.launchpad.bootstrap.MainProcess;
import com.launchpad.config.CorsConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;

/**
 * STOMP over WebSocket for the main process.
 *
 * Clients connect to {@code /api/socket} and subscribe to {@code /topic/jobs}.
 * The in-memory broker only knows this instance's sessions; cross-instance
 * delivery goes through {@link RedisSocketRelay}. The handshake accepts the
 * same origins as the HTTP CORS policy.
 */
@Configuration
@MainProcess
@EnableWebSocketMessageBroker
@RequiredArgsConstructor
@Slf4j
public class WebSocketConfig implements WebSocketMessageBrokerConfigurer {

    private final CorsConfig corsConfig;

    @Value("${app.socket.endpoint:/api/socket}")
    private String endpoint;

    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        String[] origins = corsConfig.getAllowedOriginPatterns().toArray(new String[0]);
        registry.addEndpoint(endpoint).setAllowedOriginPatterns(origins);
        log.info("STOMP endpoint registered at {}", endpoint);
    }

    @Override
    public void configureMessageBroker(MessageBrokerRegistry registry) {
        registry.enableSimpleBroker("/topic");
        registry.setApplicationDestinationPrefixes("/app");
    }
}
