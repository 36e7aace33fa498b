package com.ryuqq.relay.core.protection;

import java.time.Duration;

/**
 * Circuit Breaker 설정.
 *
 * <p><strong>허용 범위:</strong></p>
 * <ul>
 *   <li>failureThreshold: 1~20 (기본 5)</li>
 *   <li>recoveryTimeout: 20~60초 (기본 45초)</li>
 *   <li>halfOpenMaxProbes: 1~2 (기본 1)</li>
 * </ul>
 *
 * @param failureThreshold OPEN으로 전이하는 연속 실패 횟수
 * @param recoveryTimeout OPEN 상태에서 프로브를 허용하기까지 대기 시간
 * @param halfOpenMaxProbes HALF_OPEN 상태에서 동시에 허용하는 프로브 수
 * @author Relay Team
 * @since 1.0.0
 */
public record CircuitBreakerConfig(
    int failureThreshold,
    Duration recoveryTimeout,
    int halfOpenMaxProbes
) {

    public static final int MIN_FAILURE_THRESHOLD = 1;
    public static final int MAX_FAILURE_THRESHOLD = 20;
    public static final Duration MIN_RECOVERY_TIMEOUT = Duration.ofSeconds(20);
    public static final Duration MAX_RECOVERY_TIMEOUT = Duration.ofSeconds(60);
    public static final int MAX_HALF_OPEN_PROBES = 2;

    private static final CircuitBreakerConfig DEFAULTS =
        new CircuitBreakerConfig(5, Duration.ofSeconds(45), 1);

    public CircuitBreakerConfig {
        if (failureThreshold < MIN_FAILURE_THRESHOLD || failureThreshold > MAX_FAILURE_THRESHOLD) {
            throw new IllegalArgumentException(
                "failureThreshold must be between " + MIN_FAILURE_THRESHOLD + " and " + MAX_FAILURE_THRESHOLD
                    + " (current: " + failureThreshold + ")");
        }
        if (recoveryTimeout == null) {
            throw new IllegalArgumentException("recoveryTimeout cannot be null");
        }
        if (recoveryTimeout.compareTo(MIN_RECOVERY_TIMEOUT) < 0 || recoveryTimeout.compareTo(MAX_RECOVERY_TIMEOUT) > 0) {
            throw new IllegalArgumentException(
                "recoveryTimeout must be between 20s and 60s (current: " + recoveryTimeout + ")");
        }
        if (halfOpenMaxProbes < 1 || halfOpenMaxProbes > MAX_HALF_OPEN_PROBES) {
            throw new IllegalArgumentException(
                "halfOpenMaxProbes must be between 1 and " + MAX_HALF_OPEN_PROBES + " (current: " + halfOpenMaxProbes + ")");
        }
    }

    /**
     * 기본 설정.
     *
     * @return failureThreshold=5, recoveryTimeout=45s, halfOpenMaxProbes=1
     */
    public static CircuitBreakerConfig defaults() {
        return DEFAULTS;
    }

    public CircuitBreakerConfig withFailureThreshold(int newFailureThreshold) {
        return new CircuitBreakerConfig(newFailureThreshold, recoveryTimeout, halfOpenMaxProbes);
    }

    public CircuitBreakerConfig withRecoveryTimeout(Duration newRecoveryTimeout) {
        return new CircuitBreakerConfig(failureThreshold, newRecoveryTimeout, halfOpenMaxProbes);
    }

    public CircuitBreakerConfig withHalfOpenMaxProbes(int newHalfOpenMaxProbes) {
        return new CircuitBreakerConfig(failureThreshold, recoveryTimeout, newHalfOpenMaxProbes);
    }
}
