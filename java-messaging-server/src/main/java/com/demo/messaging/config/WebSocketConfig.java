package com.demo.messaging.config;

import com.demo.messaging.handler.RealtimeWebSocketHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final RealtimeWebSocketHandler realtimeWebSocketHandler;
    private final String[] allowedOrigins;

    public WebSocketConfig(RealtimeWebSocketHandler realtimeWebSocketHandler,
                           @Value("${messaging.websocket.allowed-origins:*}") String[] allowedOrigins) {
        this.realtimeWebSocketHandler = realtimeWebSocketHandler;
        this.allowedOrigins = allowedOrigins;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(realtimeWebSocketHandler, "/ws/messaging")
                .setAllowedOrigins(allowedOrigins);
    }
}
