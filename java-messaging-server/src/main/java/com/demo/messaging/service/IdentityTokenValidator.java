package com.demo.messaging.service;

import com.demo.messaging.exception.AuthenticationException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.Date;

/**
 * Validates bearer tokens issued by the identity provider and resolves the
 * caller's user id from the subject claim.
 */
@Service
@Slf4j
public class IdentityTokenValidator {

    private static final String BEARER_PREFIX = "Bearer ";

    private final SecretKey secretKey;
    private final long tokenExpirationMs;
    private final MetricsService metricsService;

    public IdentityTokenValidator(
            @Value("${security.jwt.secret:default-secret-key-change-this-in-production-minimum-256-bits}") String secret,
            @Value("${security.jwt.expiration-ms:3600000}") long tokenExpirationMs,
            MetricsService metricsService) {
        this.secretKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.tokenExpirationMs = tokenExpirationMs;
        this.metricsService = metricsService;
    }

    /**
     * Resolve the authenticated user id.
     *
     * @param token raw JWT, with or without a "Bearer " prefix
     * @throws AuthenticationException if the token is missing, invalid or expired
     */
    public String authenticate(String token) {
        if (token == null || token.isBlank()) {
            metricsService.recordAuthenticationAttempt(false);
            throw new AuthenticationException("Missing identity token");
        }

        String raw = token.startsWith(BEARER_PREFIX) ? token.substring(BEARER_PREFIX.length()) : token;

        try {
            Claims claims = Jwts.parser()
                .verifyWith(secretKey)
                .build()
                .parseSignedClaims(raw.trim())
                .getPayload();

            String userId = claims.getSubject();
            if (userId == null || userId.isBlank()) {
                metricsService.recordAuthenticationAttempt(false);
                throw new AuthenticationException("Identity token has no subject");
            }

            metricsService.recordAuthenticationAttempt(true);
            return userId;

        } catch (ExpiredJwtException e) {
            log.warn("Expired JWT token: subject={}", e.getClaims().getSubject());
            metricsService.recordAuthenticationAttempt(false);
            throw new AuthenticationException("Identity token expired", e);
        } catch (JwtException | IllegalArgumentException e) {
            log.warn("Invalid JWT token: {}", e.getMessage());
            metricsService.recordAuthenticationAttempt(false);
            throw new AuthenticationException("Invalid identity token", e);
        }
    }

    /**
     * Generate JWT token (for testing/development)
     */
    public String generateToken(String userId) {
        return Jwts.builder()
            .subject(userId)
            .issuedAt(new Date())
            .expiration(new Date(System.currentTimeMillis() + tokenExpirationMs))
            .signWith(secretKey)
            .compact();
    }
}
