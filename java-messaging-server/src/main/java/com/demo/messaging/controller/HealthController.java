package com.demo.messaging.controller;

import com.demo.messaging.infrastructure.SessionManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping("/api")
@Slf4j
public class HealthController {

    private final StringRedisTemplate redisTemplate;
    private final DataSource dataSource;
    private final SessionManager sessionManager;

    public HealthController(StringRedisTemplate redisTemplate,
                            DataSource dataSource,
                            SessionManager sessionManager) {
        this.redisTemplate = redisTemplate;
        this.dataSource = dataSource;
        this.sessionManager = sessionManager;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> response = new HashMap<>();

        boolean redisUp = false;
        try (RedisConnection connection = redisTemplate.getRequiredConnectionFactory().getConnection()) {
            connection.ping();
            redisUp = true;
        } catch (Exception e) {
            log.warn("Redis health check failed: {}", e.getMessage());
        }
        response.put("redis", redisUp ? "connected" : "disconnected");

        boolean databaseUp = false;
        try (Connection connection = dataSource.getConnection()) {
            databaseUp = connection.isValid(2);
        } catch (Exception e) {
            log.warn("Database health check failed: {}", e.getMessage());
        }
        response.put("database", databaseUp ? "connected" : "disconnected");

        response.put("websocketSessions", sessionManager.getActiveSessionCount());
        response.put("status", redisUp && databaseUp ? "healthy" : "degraded");
        return response;
    }
}
