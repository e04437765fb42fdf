package com.demo.messaging.handler;

import com.demo.messaging.domain.WebSocketMessage;
import com.demo.messaging.exception.AuthenticationException;
import com.demo.messaging.infrastructure.RealtimeBus;
import com.demo.messaging.infrastructure.RealtimeSubscription;
import com.demo.messaging.infrastructure.SessionManager;
import com.demo.messaging.service.IdentityTokenValidator;
import com.demo.messaging.service.MetricsService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Realtime push connection: /ws/messaging?token=...
 *
 * Authenticates the handshake, subscribes the user to the realtime bus and
 * forwards every event as a {type, payload} frame. Clients send ping or
 * heartbeat frames to keep the connection registered.
 */
@Slf4j
@Component
public class RealtimeWebSocketHandler extends TextWebSocketHandler {

    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int SEND_BUFFER_LIMIT_BYTES = 512 * 1024;

    private final ObjectMapper objectMapper;
    private final SessionManager sessionManager;
    private final RealtimeBus realtimeBus;
    private final IdentityTokenValidator identityTokenValidator;
    private final MetricsService metricsService;

    // Raw session id -> decorated session safe for concurrent sends
    private final ConcurrentHashMap<String, WebSocketSession> outbound = new ConcurrentHashMap<>();

    public RealtimeWebSocketHandler(ObjectMapper objectMapper,
                                    SessionManager sessionManager,
                                    RealtimeBus realtimeBus,
                                    IdentityTokenValidator identityTokenValidator,
                                    MetricsService metricsService) {
        this.objectMapper = objectMapper;
        this.sessionManager = sessionManager;
        this.realtimeBus = realtimeBus;
        this.identityTokenValidator = identityTokenValidator;
        this.metricsService = metricsService;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession wsSession) throws Exception {
        String userId;
        try {
            userId = identityTokenValidator.authenticate(extractToken(wsSession));
        } catch (AuthenticationException e) {
            log.warn("WebSocket authentication failed: wsId={}, reason={}", wsSession.getId(), e.getMessage());
            metricsService.recordWebSocketConnection("anonymous", false);
            send(wsSession, WebSocketMessage.error("Authentication failed"));
            wsSession.close(CloseStatus.POLICY_VIOLATION);
            return;
        }

        WebSocketSession session = new ConcurrentWebSocketSessionDecorator(
            wsSession, SEND_TIME_LIMIT_MS, SEND_BUFFER_LIMIT_BYTES);
        outbound.put(wsSession.getId(), session);

        try {
            RealtimeSubscription subscription = realtimeBus.subscribe(userId,
                event -> send(session, WebSocketMessage.event(event)));
            sessionManager.registerSession(wsSession.getId(), session, userId, subscription);

            metricsService.recordWebSocketConnection(userId, true);
            log.info("WebSocket connected: wsId={}, userId={}", wsSession.getId(), userId);

            send(session, WebSocketMessage.welcome(wsSession.getId(), userId));

        } catch (Exception e) {
            log.error("Error establishing connection: wsId={}", wsSession.getId(), e);
            metricsService.recordError("CONNECTION_ERROR", "RealtimeWebSocketHandler");
            sessionManager.unregisterSession(wsSession.getId());
            outbound.remove(wsSession.getId());
            wsSession.close(CloseStatus.SERVER_ERROR);
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession wsSession, TextMessage message) {
        WebSocketSession session = outbound.getOrDefault(wsSession.getId(), wsSession);
        String payload = message.getPayload();

        if ("ping".equals(payload)) {
            sessionManager.updateHeartbeat(wsSession.getId());
            send(session, WebSocketMessage.pong());
            return;
        }

        String type;
        try {
            JsonNode json = objectMapper.readTree(payload);
            type = json.path("type").asText("");
        } catch (Exception e) {
            log.debug("Ignoring non-JSON frame from {}: {}", wsSession.getId(), e.getMessage());
            send(session, WebSocketMessage.error("Unsupported frame"));
            return;
        }

        switch (type) {
            case "ping" -> {
                sessionManager.updateHeartbeat(wsSession.getId());
                send(session, WebSocketMessage.pong());
            }
            case "heartbeat" -> {
                sessionManager.updateHeartbeat(wsSession.getId());
                send(session, WebSocketMessage.heartbeatAck());
            }
            default -> {
                log.warn("Unknown frame type: wsId={}, type={}", wsSession.getId(), type);
                send(session, WebSocketMessage.error("Unknown frame type: " + type));
            }
        }
    }

    @Override
    public void handleTransportError(WebSocketSession wsSession, Throwable exception) {
        log.error("Transport error: wsId={}", wsSession.getId(), exception);
        metricsService.recordError("TRANSPORT_ERROR", "RealtimeWebSocketHandler");
    }

    @Override
    public void afterConnectionClosed(WebSocketSession wsSession, CloseStatus status) {
        outbound.remove(wsSession.getId());
        sessionManager.unregisterSession(wsSession.getId()).ifPresent(wrapper -> {
            metricsService.recordWebSocketDisconnection(wrapper.getUserId());
            log.info("WebSocket closed: wsId={}, userId={}, status={}",
                wsSession.getId(), wrapper.getUserId(), status);
        });
    }

    private void send(WebSocketSession session, WebSocketMessage frame) {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.sendMessage(new TextMessage(objectMapper.writeValueAsString(frame)));
        } catch (Exception e) {
            log.warn("Failed to send frame: wsId={}, type={}", session.getId(), frame.getType(), e);
            metricsService.recordError("SEND_ERROR", "RealtimeWebSocketHandler");
        }
    }

    private String extractToken(WebSocketSession wsSession) {
        URI uri = wsSession.getUri();
        if (uri != null) {
            String token = UriComponentsBuilder.fromUri(uri).build().getQueryParams().getFirst("token");
            if (token != null && !token.isBlank()) {
                return token;
            }
        }
        return wsSession.getHandshakeHeaders().getFirst(HttpHeaders.AUTHORIZATION);
    }
}
