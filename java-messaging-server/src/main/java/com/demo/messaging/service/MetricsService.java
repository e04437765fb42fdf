package com.demo.messaging.service;

import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Log-backed metrics for the messaging service.
 *
 * Counters and gauges are kept in memory and written to the log; tagged
 * variants fold the tags into the counter name.
 */
@Service
@Slf4j
public class MetricsService {

    private final ConcurrentHashMap<String, AtomicLong> counters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, AtomicInteger> gauges = new ConcurrentHashMap<>();

    public MetricsService() {
        log.info("MetricsService initialized (log-only mode)");
    }

    // ===== Counters =====

    public void incrementCounter(String name) {
        incrementCounter(name, 1);
    }

    public void incrementCounter(String name, long amount) {
        long count = counters.computeIfAbsent(name, k -> new AtomicLong(0)).addAndGet(amount);
        log.debug("[METRIC] Counter: {} = {}", name, count);
    }

    public void incrementCounter(String name, Tags tags) {
        StringBuilder tagged = new StringBuilder(name);
        for (Tag tag : tags) {
            tagged.append('.').append(tag.getKey()).append('=').append(tag.getValue());
        }
        incrementCounter(name);
        incrementCounter(tagged.toString());
    }

    // ===== Timers =====

    public TimerSample startTimer() {
        return new TimerSample();
    }

    public void recordTimer(String name, Duration duration) {
        log.debug("[METRIC] Timer: {} = {}ms", name, duration.toMillis());
    }

    // ===== Gauges =====

    public void incrementGauge(String name) {
        int value = gauges.computeIfAbsent(name, k -> new AtomicInteger(0)).incrementAndGet();
        log.debug("[METRIC] Gauge: {} = {}", name, value);
    }

    public void decrementGauge(String name) {
        int value = gauges.computeIfAbsent(name, k -> new AtomicInteger(0)).decrementAndGet();
        log.debug("[METRIC] Gauge: {} = {}", name, value);
    }

    // ===== Business Metrics =====

    public void recordConversationCreated(String conversationId) {
        incrementCounter("conversations.created");
        log.info("Conversation created: conversationId={}", conversationId);
    }

    public void recordMessageAppended(String conversationId, Duration latency) {
        incrementCounter("messages.appended");
        recordTimer("messages.append.latency", latency);
        log.debug("Message appended: conversationId={}, latency={}ms", conversationId, latency.toMillis());
    }

    public void recordIdempotentReplay(String conversationId) {
        incrementCounter("messages.idempotent_replays");
        log.info("Idempotent replay resolved: conversationId={}", conversationId);
    }

    public void recordMessagesRead(String conversationId, int count) {
        incrementCounter("messages.read", count);
        if (count == 0) {
            incrementCounter("messages.read.noop");
        }
        log.debug("Messages marked read: conversationId={}, count={}", conversationId, count);
    }

    public void recordUnreadQuery(String strategy, Duration latency) {
        incrementCounter("unread.queries", Tags.of("strategy", strategy));
        recordTimer("unread.query.latency", latency);
    }

    public void recordRealtimePublish(String eventType, long receivers) {
        incrementCounter("realtime.published", Tags.of("type", eventType));
        log.debug("Realtime event published: type={}, receivers={}", eventType, receivers);
    }

    public void recordRealtimeDropped(String reason) {
        incrementCounter("realtime.dropped", Tags.of("reason", reason));
    }

    public void recordWebSocketConnection(String userId, boolean success) {
        incrementCounter("websocket.connections");
        log.info("WebSocket connection: userId={}, success={}", userId, success);

        if (success) {
            incrementGauge("active_connections");
        }
    }

    public void recordWebSocketDisconnection(String userId) {
        incrementCounter("websocket.disconnections");
        decrementGauge("active_connections");
        log.info("WebSocket disconnection: userId={}", userId);
    }

    public void recordAuthenticationAttempt(boolean success) {
        incrementCounter(success ? "authentication.success" : "authentication.failure");
        log.debug("Auth attempt: success={}", success);
    }

    public void recordError(String errorType, String component) {
        incrementCounter("errors", Tags.of("type", errorType));
        log.error("Error: type={}, component={}", errorType, component);
    }

    // ===== Utility Methods =====

    /**
     * Get current counter value (for debugging)
     */
    public long getCounterValue(String name) {
        AtomicLong counter = counters.get(name);
        return counter != null ? counter.get() : 0;
    }

    public static class TimerSample {
        private final long startNanos = System.nanoTime();

        public Duration stop() {
            return Duration.ofNanos(System.nanoTime() - startNanos);
        }
    }
}
