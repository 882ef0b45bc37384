package com.ai.studyengine.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;

/**
 * WebSocketConfig configures the STOMP message broker used to push
 * background generation progress.
 *
 * SockJS falls back to HTTP long-polling when a proxy blocks the WebSocket
 * upgrade.
 */
@Configuration
@EnableWebSocketMessageBroker
public class WebSocketConfig implements WebSocketMessageBrokerConfigurer {

    /**
     * Clients connect to: http://localhost:8080/ws/sessions
     */
    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        registry.addEndpoint("/ws/sessions")
                .setAllowedOriginPatterns("*") // tighten in production
                .withSockJS();
    }

    /**
     * SERVER pushes to: /topic/sessions/{sessionId}
     * CLIENT subscribes to: /topic/sessions/{sessionId}
     */
    @Override
    public void configureMessageBroker(MessageBrokerRegistry registry) {
        registry.enableSimpleBroker("/topic");
        registry.setApplicationDestinationPrefixes("/app");
    }
}
