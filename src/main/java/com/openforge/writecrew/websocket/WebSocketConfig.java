package com.openforge.writecrew.websocket;

import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;

/**
 * Spring STOMP/WebSocket configuration.
 *
 * Client connection flow:
 *   1. Connect to  ws://host/ws  (or SockJS fallback: http://host/ws)
 *   2. STOMP SUBSCRIBE to one or both topics below
 *   3. Receive CollaborationEvent JSON frames
 *
 * Topic design:
 *   /topic/documents/{documentId}     : document_change, in apply order (presentation surface)
 *   /topic/agents/{agentInstanceId}   : approval and permission events (notification sink)
 *
 * Approvals are answered over REST, so nothing is routed to /app yet.
 */
@Configuration
@EnableWebSocketMessageBroker
public class WebSocketConfig implements WebSocketMessageBrokerConfigurer {

    @Override
    public void configureMessageBroker(MessageBrokerRegistry registry) {
        registry.enableSimpleBroker("/topic");
        registry.setApplicationDestinationPrefixes("/app");
    }

    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        registry.addEndpoint("/ws")
                // Word add-in origins vary per tenant; tighten in production
                .setAllowedOriginPatterns("*")
                .withSockJS();
    }
}
