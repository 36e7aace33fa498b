package com.ryuqq.relay.core.protection;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CircuitBreakerConfig, RateLimiterConfig 테스트.
 *
 * @author Relay Team
 * @since 1.0.0
 */
class CircuitBreakerConfigTest {

    @Test
    void defaults_ReturnsDocumentedValues() {
        // When
        CircuitBreakerConfig config = CircuitBreakerConfig.defaults();

        // Then
        assertEquals(5, config.failureThreshold());
        assertEquals(Duration.ofSeconds(45), config.recoveryTimeout());
        assertEquals(1, config.halfOpenMaxProbes());
    }

    @Test
    void constructor_ThresholdOutOfRange_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> CircuitBreakerConfig.defaults().withFailureThreshold(21)
        );
        assertTrue(exception.getMessage().contains("failureThreshold must be between 1 and 20"));
    }

    @Test
    void constructor_RecoveryTimeoutOutOfRange_ThrowsException() {
        assertThrows(IllegalArgumentException.class,
            () -> CircuitBreakerConfig.defaults().withRecoveryTimeout(Duration.ofSeconds(19)));
        assertThrows(IllegalArgumentException.class,
            () -> CircuitBreakerConfig.defaults().withRecoveryTimeout(Duration.ofSeconds(61)));
        assertDoesNotThrow(() -> CircuitBreakerConfig.defaults().withRecoveryTimeout(Duration.ofSeconds(20)));
    }

    @Test
    void constructor_TooManyProbes_ThrowsException() {
        assertThrows(IllegalArgumentException.class,
            () -> CircuitBreakerConfig.defaults().withHalfOpenMaxProbes(3));
        assertEquals(2, CircuitBreakerConfig.defaults().withHalfOpenMaxProbes(2).halfOpenMaxProbes());
    }

    @Test
    void rateLimiterConfig_Defaults_500PerSecond() {
        // When
        RateLimiterConfig config = RateLimiterConfig.defaults();

        // Then
        assertEquals(500, config.maxOperations());
        assertEquals(Duration.ofSeconds(1), config.window());
    }

    @Test
    void rateLimiterConfig_NonPositiveValues_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new RateLimiterConfig(0, Duration.ofSeconds(1)));
        assertThrows(IllegalArgumentException.class, () -> new RateLimiterConfig(10, Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> new RateLimiterConfig(10, null));
    }

    @Test
    void snapshot_Closed_HasNoOpenedAt() {
        // When
        CircuitBreakerSnapshot snapshot = CircuitBreakerSnapshot.closed("home.local");

        // Then
        assertEquals(CircuitBreakerState.CLOSED, snapshot.state());
        assertNull(snapshot.openedAtNanos());
        assertEquals(0, snapshot.consecutiveFailures());
    }
}
