package com.demo.messaging.config;

import com.demo.messaging.cache.RequestCache;
import com.github.benmanes.caffeine.cache.Ticker;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class CacheConfig {

    @Bean(destroyMethod = "shutdown")
    public RequestCache requestCache(
            @Value("${messaging.cache.fetch-timeout-ms:3000}") long fetchTimeoutMs,
            @Value("${messaging.cache.maximum-size:10000}") long maximumSize,
            @Value("${messaging.cache.stats-interval-ms:300000}") long statsIntervalMs) {
        RequestCache cache = new RequestCache(Duration.ofMillis(fetchTimeoutMs), Ticker.systemTicker(), maximumSize);
        cache.startStatsReporting(Duration.ofMillis(statsIntervalMs));
        return cache;
    }
}
