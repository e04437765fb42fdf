package com.demo.messaging.service;

import com.demo.messaging.cache.CacheKeys;
import com.demo.messaging.cache.RequestCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Per-user unread count served through the request cache.
 *
 * The TTL is kept short because users expect the badge to follow their own
 * actions; writes call invalidate() so the next read never sees a value
 * older than the write.
 */
@Service
@Slf4j
public class UnreadAggregator {

    private final RequestCache requestCache;
    private final UnreadCountSource source;
    private final Executor executor;
    private final Duration ttl;

    public UnreadAggregator(RequestCache requestCache,
                            UnreadCountSource source,
                            @Qualifier("messagingExecutor") Executor executor,
                            @Value("${messaging.cache.unread-ttl-ms:5000}") long ttlMs) {
        this.requestCache = requestCache;
        this.source = source;
        this.executor = executor;
        this.ttl = Duration.ofMillis(ttlMs);
        log.info("UnreadAggregator initialized: strategy={}, ttl={}ms", source.strategy(), ttlMs);
    }

    public CompletableFuture<Integer> get(String userId) {
        return requestCache.dedupe(
            CacheKeys.unreadCount(userId),
            Integer.class,
            () -> CompletableFuture.supplyAsync(() -> clamp(source.count(userId)), executor),
            ttl);
    }

    /**
     * Drop the cached count for the user and let the source catch up
     */
    public void invalidate(String userId) {
        requestCache.invalidate(CacheKeys.unreadCount(userId));
        try {
            source.refresh(userId);
        } catch (Exception e) {
            log.warn("Unread source refresh failed, next read will recount: userId={}", userId, e);
        }
    }

    private static int clamp(long count) {
        return (int) Math.max(0, Math.min(Integer.MAX_VALUE, count));
    }
}
