package com.ryuqq.relay.core.protection;

import java.time.Duration;

/**
 * Rate Limiter 설정.
 *
 * @param maxOperations 창 하나에서 허용하는 최대 오퍼레이션 수 (기본 500)
 * @param window 슬라이딩 창 길이 (기본 1초)
 * @author Relay Team
 * @since 1.0.0
 */
public record RateLimiterConfig(int maxOperations, Duration window) {

    private static final RateLimiterConfig DEFAULTS = new RateLimiterConfig(500, Duration.ofSeconds(1));

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException if maxOperations is not positive
     * @throws IllegalArgumentException if window is null or not positive
     */
    public RateLimiterConfig {
        if (maxOperations <= 0) {
            throw new IllegalArgumentException("maxOperations must be positive (current: " + maxOperations + ")");
        }
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive (current: " + window + ")");
        }
    }

    public static RateLimiterConfig defaults() {
        return DEFAULTS;
    }

    public RateLimiterConfig withMaxOperations(int newMaxOperations) {
        return new RateLimiterConfig(newMaxOperations, window);
    }

    public RateLimiterConfig withWindow(Duration newWindow) {
        return new RateLimiterConfig(maxOperations, newWindow);
    }
}
