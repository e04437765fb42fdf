package com.demo.messaging.infrastructure;

import com.demo.messaging.domain.WebSocketSessionWrapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.WebSocketSession;

import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Registry of realtime WebSocket connections on this node.
 *
 * Each connection owns one realtime subscription, closed when the connection
 * is unregistered. Connections without a heartbeat for the timeout are closed.
 */
@Component
@Slf4j
public class SessionManager {

    private final ConcurrentHashMap<String, WebSocketSessionWrapper> activeSessions = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Set<String>> userConnections = new ConcurrentHashMap<>();
    private final Duration heartbeatTimeout;
    private final ScheduledExecutorService cleanupExecutor;

    public SessionManager(@Value("${messaging.websocket.heartbeat-timeout-ms:300000}") long heartbeatTimeoutMs) {
        this.heartbeatTimeout = Duration.ofMillis(heartbeatTimeoutMs);
        this.cleanupExecutor = Executors.newSingleThreadScheduledExecutor();

        cleanupExecutor.scheduleAtFixedRate(this::closeStaleSessions, 30, 30, TimeUnit.SECONDS);
    }

    public void registerSession(String connectionId,
                                WebSocketSession wsSession,
                                String userId,
                                RealtimeSubscription subscription) {
        Instant now = Instant.now();
        WebSocketSessionWrapper wrapper = WebSocketSessionWrapper.builder()
            .connectionId(connectionId)
            .wsSession(wsSession)
            .userId(userId)
            .subscription(subscription)
            .connectedAt(now)
            .lastHeartbeat(now)
            .build();

        activeSessions.put(connectionId, wrapper);
        userConnections.computeIfAbsent(userId, k -> ConcurrentHashMap.newKeySet()).add(connectionId);

        log.info("Session registered: connectionId={}, userId={}, total={}",
            connectionId, userId, activeSessions.size());
    }

    /**
     * Unregister the connection and close its realtime subscription
     */
    public Optional<WebSocketSessionWrapper> unregisterSession(String connectionId) {
        WebSocketSessionWrapper wrapper = activeSessions.remove(connectionId);
        if (wrapper == null) {
            return Optional.empty();
        }

        userConnections.computeIfPresent(wrapper.getUserId(), (userId, connections) -> {
            connections.remove(connectionId);
            return connections.isEmpty() ? null : connections;
        });

        try {
            if (wrapper.getSubscription() != null) {
                wrapper.getSubscription().close();
            }
        } catch (Exception e) {
            log.error("Failed to close realtime subscription: connectionId={}", connectionId, e);
        }

        log.info("Session unregistered: connectionId={}, userId={}, duration={}s",
            connectionId, wrapper.getUserId(),
            Duration.between(wrapper.getConnectedAt(), Instant.now()).getSeconds());
        return Optional.of(wrapper);
    }

    public Optional<String> getUserId(String connectionId) {
        return Optional.ofNullable(activeSessions.get(connectionId)).map(WebSocketSessionWrapper::getUserId);
    }

    public void updateHeartbeat(String connectionId) {
        WebSocketSessionWrapper wrapper = activeSessions.get(connectionId);
        if (wrapper != null) {
            wrapper.setLastHeartbeat(Instant.now());
        }
    }

    public int getUserConnectionCount(String userId) {
        Set<String> connections = userConnections.get(userId);
        return connections != null ? connections.size() : 0;
    }

    public int getActiveSessionCount() {
        return activeSessions.size();
    }

    /**
     * Close connections whose last heartbeat is older than the timeout
     */
    void closeStaleSessions() {
        try {
            Instant cutoff = Instant.now().minus(heartbeatTimeout);
            List<WebSocketSessionWrapper> stale = new ArrayList<>();
            for (WebSocketSessionWrapper wrapper : activeSessions.values()) {
                if (wrapper.getLastHeartbeat().isBefore(cutoff)) {
                    stale.add(wrapper);
                }
            }

            for (WebSocketSessionWrapper wrapper : stale) {
                log.warn("Session timed out: connectionId={}, lastHeartbeat={}",
                    wrapper.getConnectionId(), wrapper.getLastHeartbeat());
                unregisterSession(wrapper.getConnectionId());
                closeQuietly(wrapper.getWsSession());
            }

        } catch (Exception e) {
            log.error("Error during heartbeat check", e);
        }
    }

    private void closeQuietly(WebSocketSession wsSession) {
        if (wsSession == null || !wsSession.isOpen()) {
            return;
        }
        try {
            wsSession.close(CloseStatus.SESSION_NOT_RELIABLE);
        } catch (Exception e) {
            log.warn("Failed to close timed out session: {}", wsSession.getId(), e);
        }
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down SessionManager...");
        cleanupExecutor.shutdown();
        try {
            if (!cleanupExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                cleanupExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            cleanupExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
