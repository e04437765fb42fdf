package com.demo.messaging.service;

import com.demo.messaging.repository.MessageRepository;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Precomputed per-user unread snapshot.
 *
 * Reads never touch the message table once a user is tracked. Every tracked
 * user is recounted each refresh interval, which bounds how long a write by
 * another node can stay invisible; writes on this node refresh the affected
 * user immediately. Users that stop asking drop out after the idle timeout.
 */
@Component
@Slf4j
@ConditionalOnProperty(name = "messaging.unread.strategy", havingValue = "materialized")
public class MaterializedUnreadCountSource implements UnreadCountSource {

    private final MessageRepository messageRepository;
    private final MetricsService metricsService;
    private final long refreshIntervalMs;
    private final Cache<String, Long> snapshot;
    private final ScheduledExecutorService refreshExecutor;

    public MaterializedUnreadCountSource(
            MessageRepository messageRepository,
            MetricsService metricsService,
            @Value("${messaging.unread.refresh-interval-ms:2000}") long refreshIntervalMs,
            @Value("${messaging.unread.idle-timeout-ms:600000}") long idleTimeoutMs) {
        this.messageRepository = messageRepository;
        this.metricsService = metricsService;
        this.refreshIntervalMs = refreshIntervalMs;
        this.snapshot = Caffeine.newBuilder()
            .expireAfterAccess(Duration.ofMillis(idleTimeoutMs))
            .maximumSize(100_000)
            .build();
        this.refreshExecutor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "unread-refresh");
            thread.setDaemon(true);
            return thread;
        });
    }

    @PostConstruct
    public void start() {
        refreshExecutor.scheduleWithFixedDelay(this::refreshAll, refreshIntervalMs, refreshIntervalMs, TimeUnit.MILLISECONDS);
        log.info("Materialized unread counts enabled: refreshInterval={}ms", refreshIntervalMs);
    }

    @Override
    public long count(String userId) {
        return snapshot.get(userId, this::countNow);
    }

    @Override
    public void refresh(String userId) {
        try {
            snapshot.put(userId, countNow(userId));
        } catch (RuntimeException e) {
            // Untrack so the next read recounts instead of serving the old snapshot
            snapshot.invalidate(userId);
            throw e;
        }
    }

    @Override
    public String strategy() {
        return "materialized";
    }

    /**
     * Recount every tracked user
     */
    void refreshAll() {
        List<String> tracked = new ArrayList<>(snapshot.asMap().keySet());
        int failures = 0;
        for (String userId : tracked) {
            try {
                snapshot.asMap().replace(userId, countNow(userId));
            } catch (Exception e) {
                failures++;
                log.warn("Failed to refresh unread snapshot: userId={}", userId, e);
            }
        }
        if (failures > 0) {
            metricsService.recordError("UNREAD_REFRESH_ERROR", "MaterializedUnreadCountSource");
        }
        log.debug("Refreshed unread snapshot: users={}, failures={}", tracked.size(), failures);
    }

    long trackedUsers() {
        return snapshot.estimatedSize();
    }

    private long countNow(String userId) {
        MetricsService.TimerSample timer = metricsService.startTimer();
        long count = messageRepository.countByRecipientIdAndReadAtIsNull(userId);
        metricsService.recordUnreadQuery(strategy(), timer.stop());
        return count;
    }

    @PreDestroy
    public void shutdown() {
        refreshExecutor.shutdown();
        try {
            if (!refreshExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                refreshExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            refreshExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
