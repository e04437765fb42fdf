package com.demo.messaging.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Frame pushed over the realtime WebSocket: {type, payload}.
 * Realtime events use their wire type name; control frames use their own.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WebSocketMessage {

    public static final String WELCOME = "welcome";
    public static final String PONG = "pong";
    public static final String HEARTBEAT_ACK = "heartbeat_ack";
    public static final String ERROR = "error";

    private String type;
    private Object payload;
    private Instant timestamp;

    public static WebSocketMessage event(RealtimeEvent event) {
        return WebSocketMessage.builder()
            .type(event.getType().wireName())
            .payload(event)
            .timestamp(Instant.now())
            .build();
    }

    public static WebSocketMessage welcome(String connectionId, String userId) {
        return WebSocketMessage.builder()
            .type(WELCOME)
            .payload(Map.of(
                "connectionId", connectionId,
                "userId", userId
            ))
            .timestamp(Instant.now())
            .build();
    }

    public static WebSocketMessage pong() {
        return WebSocketMessage.builder()
            .type(PONG)
            .timestamp(Instant.now())
            .build();
    }

    public static WebSocketMessage heartbeatAck() {
        return WebSocketMessage.builder()
            .type(HEARTBEAT_ACK)
            .timestamp(Instant.now())
            .build();
    }

    public static WebSocketMessage error(String errorMessage) {
        return WebSocketMessage.builder()
            .type(ERROR)
            .payload(Map.of("detail", errorMessage))
            .timestamp(Instant.now())
            .build();
    }
}
