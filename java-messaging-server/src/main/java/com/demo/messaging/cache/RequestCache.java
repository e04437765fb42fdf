package com.demo.messaging.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Request coalescing + TTL cache in front of unread-count and list reads.
 *
 * Behaviour:
 * - Concurrent callers for the same key share one in-flight fetch
 * - A completed fetch is served from memory until its own TTL expires
 * - invalidate() drops both the cached value and any in-flight fetch, so the
 *   next caller always starts a fresh fetch
 * - A failed or timed out fetch falls back to the last known-good value
 *
 * Has no Spring dependency; the server registers it as a bean and the client
 * sync controller owns its own instance.
 */
@Slf4j
public class RequestCache {

    private final Cache<String, CachedValue> entries;
    private final Cache<String, Object> lastKnownGood;
    private final ConcurrentHashMap<String, CompletableFuture<?>> inFlight = new ConcurrentHashMap<>();
    private final Duration fetchTimeout;

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong coalesced = new AtomicLong();
    private final AtomicLong fallbacks = new AtomicLong();
    private final AtomicLong invalidations = new AtomicLong();

    private ScheduledExecutorService statsExecutor;

    public RequestCache(Duration fetchTimeout) {
        this(fetchTimeout, Ticker.systemTicker(), 10_000);
    }

    public RequestCache(Duration fetchTimeout, Ticker ticker, long maximumSize) {
        this.fetchTimeout = fetchTimeout;
        this.entries = Caffeine.newBuilder()
            .maximumSize(maximumSize)
            .ticker(ticker)
            .expireAfter(new PerEntryTtl())
            .executor(Runnable::run)
            .build();
        this.lastKnownGood = Caffeine.newBuilder()
            .maximumSize(maximumSize)
            .ticker(ticker)
            .expireAfterWrite(Duration.ofHours(1))
            .executor(Runnable::run)
            .build();
    }

    /**
     * Return the cached value for key if it is younger than its TTL, otherwise
     * join the in-flight fetch for key or start one with fetchFn.
     */
    public <T> CompletableFuture<T> dedupe(String key, Class<T> type, Supplier<CompletableFuture<T>> fetchFn, Duration ttl) {
        CachedValue cached = entries.getIfPresent(key);
        if (cached != null) {
            hits.incrementAndGet();
            log.debug("Cache hit: key={}", key);
            return CompletableFuture.completedFuture(type.cast(cached.getValue()));
        }

        CompletableFuture<T> promise = new CompletableFuture<>();
        CompletableFuture<?> existing = inFlight.putIfAbsent(key, promise);
        if (existing != null) {
            coalesced.incrementAndGet();
            log.debug("Joined in-flight fetch: key={}", key);
            return existing.thenApply(type::cast);
        }

        misses.incrementAndGet();
        log.debug("Cache miss, fetching: key={}", key);

        CompletableFuture<T> fetch;
        try {
            fetch = fetchFn.get().copy();
        } catch (RuntimeException e) {
            fetch = CompletableFuture.failedFuture(e);
        }

        fetch.orTimeout(fetchTimeout.toMillis(), TimeUnit.MILLISECONDS)
            .whenComplete((value, error) -> {
                if (error == null) {
                    if (value != null) {
                        cacheIfStillCurrent(key, promise, new CachedValue(value, ttl));
                        lastKnownGood.put(key, value);
                    } else {
                        inFlight.remove(key, promise);
                    }
                    promise.complete(value);
                    return;
                }

                inFlight.remove(key, promise);
                Throwable cause = unwrap(error);
                Object fallback = lastKnownGood.getIfPresent(key);
                if (fallback != null) {
                    fallbacks.incrementAndGet();
                    log.warn("Fetch failed, serving last known-good value: key={}, error={}",
                        key, cause.toString());
                    promise.complete(type.cast(fallback));
                } else {
                    log.warn("Fetch failed with no fallback: key={}, error={}", key, cause.toString());
                    promise.completeExceptionally(cause);
                }
            });

        return promise;
    }

    /**
     * Drop the cached value and any in-flight fetch for key
     */
    public void invalidate(String key) {
        // In-flight first: a fetch that completes after this line can no longer cache itself
        inFlight.remove(key);
        entries.invalidate(key);
        invalidations.incrementAndGet();
        log.debug("Invalidated cache key: {}", key);
    }

    /**
     * Drop every cached value and in-flight fetch whose key matches the pattern
     */
    public void invalidate(Pattern pattern) {
        inFlight.keySet().removeIf(key -> pattern.matcher(key).matches());
        entries.asMap().keySet().removeIf(key -> pattern.matcher(key).matches());
        invalidations.incrementAndGet();
        log.debug("Invalidated cache pattern: {}", pattern.pattern());
    }

    public void invalidateAll() {
        inFlight.clear();
        entries.invalidateAll();
        invalidations.incrementAndGet();
        log.warn("Invalidated all request cache entries");
    }

    public Stats getStats() {
        return Stats.builder()
            .size(entries.estimatedSize())
            .inFlight(inFlight.size())
            .hits(hits.get())
            .misses(misses.get())
            .coalesced(coalesced.get())
            .fallbacks(fallbacks.get())
            .invalidations(invalidations.get())
            .build();
    }

    /**
     * Start periodic stats reporting
     */
    public synchronized void startStatsReporting(Duration interval) {
        if (statsExecutor != null) {
            return;
        }
        statsExecutor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "request-cache-stats");
            thread.setDaemon(true);
            return thread;
        });
        long periodMs = interval.toMillis();
        statsExecutor.scheduleAtFixedRate(() -> {
            try {
                Stats stats = getStats();
                log.info("Request cache stats - Size: {}, In-flight: {}, Hits: {}, Misses: {}, Coalesced: {}, "
                        + "Fallbacks: {}, Hit rate: {}%",
                    stats.getSize(),
                    stats.getInFlight(),
                    stats.getHits(),
                    stats.getMisses(),
                    stats.getCoalesced(),
                    stats.getFallbacks(),
                    String.format("%.2f", stats.hitRate() * 100));
            } catch (Exception e) {
                log.error("Error reporting request cache stats", e);
            }
        }, periodMs, periodMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Shutdown cleanup
     */
    public synchronized void shutdown() {
        if (statsExecutor == null) {
            return;
        }
        statsExecutor.shutdown();
        try {
            if (!statsExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                statsExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            statsExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        statsExecutor = null;
    }

    /**
     * Store the value only while promise is still the key's in-flight fetch.
     * Runs under the entry's compute lock, so an invalidate() that races with
     * this either removes the in-flight marker first or drops the stored value
     * afterwards. A value already present came from a newer fetch and is kept.
     */
    private void cacheIfStillCurrent(String key, CompletableFuture<?> promise, CachedValue value) {
        entries.asMap().computeIfAbsent(key, k -> inFlight.remove(key, promise) ? value : null);
        inFlight.remove(key, promise);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    @Data
    @AllArgsConstructor
    private static class CachedValue {
        private Object value;
        private Duration ttl;
    }

    private static class PerEntryTtl implements Expiry<String, CachedValue> {

        @Override
        public long expireAfterCreate(String key, CachedValue value, long currentTime) {
            return value.getTtl().toNanos();
        }

        @Override
        public long expireAfterUpdate(String key, CachedValue value, long currentTime, long currentDuration) {
            return value.getTtl().toNanos();
        }

        @Override
        public long expireAfterRead(String key, CachedValue value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Stats {
        private long size;
        private int inFlight;
        private long hits;
        private long misses;
        private long coalesced;
        private long fallbacks;
        private long invalidations;

        public double hitRate() {
            long requests = hits + misses + coalesced;
            return requests == 0 ? 0.0 : (double) hits / requests;
        }
    }
}
