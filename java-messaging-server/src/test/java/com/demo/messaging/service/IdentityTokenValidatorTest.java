package com.demo.messaging.service;

import com.demo.messaging.exception.AuthenticationException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IdentityTokenValidatorTest {

    private static final String SECRET = "test-secret-key-for-messaging-tests-at-least-256-bits-long";

    private final MetricsService metricsService = new MetricsService();
    private final IdentityTokenValidator validator = new IdentityTokenValidator(SECRET, 60_000, metricsService);

    @Test
    void resolvesSubjectFromBearerToken() {
        String token = validator.generateToken("alice");

        assertThat(validator.authenticate("Bearer " + token)).isEqualTo("alice");
        assertThat(validator.authenticate(token)).isEqualTo("alice");
        assertThat(metricsService.getCounterValue("authentication.success")).isEqualTo(2);
    }

    @Test
    void rejectsMissingToken() {
        assertThatThrownBy(() -> validator.authenticate(null)).isInstanceOf(AuthenticationException.class);
        assertThatThrownBy(() -> validator.authenticate("  ")).isInstanceOf(AuthenticationException.class);
    }

    @Test
    void rejectsTokenSignedWithAnotherKey() {
        IdentityTokenValidator other = new IdentityTokenValidator(
            "another-secret-key-that-is-also-at-least-256-bits-long", 60_000, metricsService);

        assertThatThrownBy(() -> validator.authenticate(other.generateToken("alice")))
            .isInstanceOf(AuthenticationException.class)
            .hasMessage("Invalid identity token");
    }

    @Test
    void rejectsExpiredToken() {
        IdentityTokenValidator expiring = new IdentityTokenValidator(SECRET, -60_000, metricsService);

        assertThatThrownBy(() -> validator.authenticate(expiring.generateToken("alice")))
            .isInstanceOf(AuthenticationException.class)
            .hasMessage("Identity token expired");
    }

    @Test
    void rejectsGarbage() {
        assertThatThrownBy(() -> validator.authenticate("Bearer not-a-jwt"))
            .isInstanceOf(AuthenticationException.class);
        assertThat(metricsService.getCounterValue("authentication.failure")).isEqualTo(1);
    }
}
