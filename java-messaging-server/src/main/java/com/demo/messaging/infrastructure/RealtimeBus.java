package com.demo.messaging.infrastructure;

import com.demo.messaging.domain.RealtimeEvent;
import com.demo.messaging.service.MetricsService;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BiConsumer;

/**
 * Push channel for row-level messaging changes.
 *
 * Every event is published once per participant on messaging:user:{userId}.
 * Each node listens on the pattern messaging:user:* and hands events to the
 * subscribers registered locally for that user.
 *
 * Redis pub/sub may redeliver after reconnects and gives no ordering across
 * channels, so delivery is filtered per (user, conversation) by sequence:
 * an event whose sequence is not greater than the last one delivered is
 * dropped.
 */
@Component
@Slf4j
public class RealtimeBus implements MessageListener {

    public static final String CHANNEL_PREFIX = "messaging:user:";
    public static final String CHANNEL_PATTERN = CHANNEL_PREFIX + "*";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final MetricsService metricsService;

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<RealtimeListener>> subscribers = new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<BiConsumer<String, RealtimeEvent>> nodeListeners = new CopyOnWriteArrayList<>();

    // user|conversation -> last delivered sequence
    private final Cache<String, Long> lastSequences = Caffeine.newBuilder()
        .maximumSize(100_000)
        .expireAfterAccess(Duration.ofHours(1))
        .build();

    public RealtimeBus(StringRedisTemplate redisTemplate,
                       ObjectMapper objectMapper,
                       MetricsService metricsService) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.metricsService = metricsService;
    }

    /**
     * Fan the event out to every participant's channel.
     * Failures are logged; clients converge through polling.
     */
    public void publish(RealtimeEvent event) {
        if (event.getEventId() == null) {
            event.setEventId(UUID.randomUUID().toString());
        }
        if (event.getOccurredAt() == null) {
            event.setOccurredAt(Instant.now());
        }

        String payload;
        try {
            payload = objectMapper.writeValueAsString(event);
        } catch (Exception e) {
            log.error("Failed to serialize realtime event: type={}, conversationId={}",
                event.getType(), event.getConversationId(), e);
            metricsService.recordError("REALTIME_SERIALIZE_ERROR", "RealtimeBus");
            return;
        }

        for (String userId : event.getParticipantIds()) {
            String channel = CHANNEL_PREFIX + userId;
            try {
                Long receivers = redisTemplate.convertAndSend(channel, payload);
                metricsService.recordRealtimePublish(event.getType().wireName(), receivers != null ? receivers : 0);

                log.debug("Published realtime event: type={}, channel={}, sequence={}, receivers={}",
                    event.getType().wireName(), channel, event.getSequence(), receivers);

            } catch (Exception e) {
                log.error("Failed to publish realtime event: type={}, channel={}",
                    event.getType().wireName(), channel, e);
                metricsService.recordError("REALTIME_PUBLISH_ERROR", "RealtimeBus");
            }
        }
    }

    /**
     * Register a listener for one user's events on this node
     */
    public RealtimeSubscription subscribe(String userId, RealtimeListener listener) {
        subscribers.computeIfAbsent(userId, k -> new CopyOnWriteArrayList<>()).add(listener);
        log.info("Realtime subscriber added: userId={}", userId);

        AtomicBoolean closed = new AtomicBoolean(false);
        return () -> {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            subscribers.computeIfPresent(userId, (key, listeners) -> {
                listeners.remove(listener);
                return listeners.isEmpty() ? null : listeners;
            });
            log.info("Realtime subscriber removed: userId={}", userId);
        };
    }

    /**
     * Register a node-wide listener that sees every delivered event together
     * with the user it was addressed to
     */
    public RealtimeSubscription subscribeAll(BiConsumer<String, RealtimeEvent> listener) {
        nodeListeners.add(listener);
        AtomicBoolean closed = new AtomicBoolean(false);
        return () -> {
            if (closed.compareAndSet(false, true)) {
                nodeListeners.remove(listener);
            }
        };
    }

    public int getSubscriberCount(String userId) {
        List<RealtimeListener> listeners = subscribers.get(userId);
        return listeners != null ? listeners.size() : 0;
    }

    @Override
    public void onMessage(Message message, byte[] pattern) {
        String channel = new String(message.getChannel(), StandardCharsets.UTF_8);
        if (!channel.startsWith(CHANNEL_PREFIX)) {
            log.warn("Ignoring message on unexpected channel: {}", channel);
            return;
        }

        try {
            String body = new String(message.getBody(), StandardCharsets.UTF_8);
            RealtimeEvent event = objectMapper.readValue(body, RealtimeEvent.class);
            deliver(channel.substring(CHANNEL_PREFIX.length()), event);

        } catch (Exception e) {
            log.error("Error processing realtime message from channel {}: {}", channel, e.getMessage(), e);
            metricsService.recordError("REALTIME_RECEIVE_ERROR", "RealtimeBus");
        }
    }

    /**
     * Deliver an event addressed to userId to local subscribers, dropping
     * duplicates and events older than the last one delivered for the same
     * conversation
     */
    void deliver(String userId, RealtimeEvent event) {
        if (!acceptSequence(userId, event)) {
            log.debug("Dropping duplicate or stale event: userId={}, conversationId={}, sequence={}",
                userId, event.getConversationId(), event.getSequence());
            metricsService.recordRealtimeDropped("stale_sequence");
            return;
        }

        for (BiConsumer<String, RealtimeEvent> nodeListener : nodeListeners) {
            try {
                nodeListener.accept(userId, event);
            } catch (Exception e) {
                log.error("Node listener failed: userId={}, type={}", userId, event.getType(), e);
            }
        }

        List<RealtimeListener> listeners = subscribers.get(userId);
        if (listeners == null) {
            return;
        }
        for (RealtimeListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (Exception e) {
                log.error("Realtime listener failed: userId={}, type={}", userId, event.getType(), e);
            }
        }
    }

    private boolean acceptSequence(String userId, RealtimeEvent event) {
        if (event.getConversationId() == null) {
            return true;
        }
        AtomicBoolean accepted = new AtomicBoolean(false);
        lastSequences.asMap().compute(userId + "|" + event.getConversationId(), (key, last) -> {
            if (last == null || event.getSequence() > last) {
                accepted.set(true);
                return event.getSequence();
            }
            return last;
        });
        return accepted.get();
    }
}
