package com.demo.messaging.domain;

import com.demo.messaging.infrastructure.RealtimeSubscription;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.web.socket.WebSocketSession;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebSocketSessionWrapper {
    private String connectionId;
    private WebSocketSession wsSession;
    private String userId;
    private RealtimeSubscription subscription;
    private Instant connectedAt;
    private Instant lastHeartbeat;
}
