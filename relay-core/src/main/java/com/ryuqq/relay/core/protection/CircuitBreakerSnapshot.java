package com.ryuqq.relay.core.protection;

/**
 * 특정 시점의 Circuit Breaker 상태.
 *
 * <p>{@code circuit_breaker.state}, {@code circuit_breaker.list} 오퍼레이션의 반환 값입니다.</p>
 *
 * @param dependencyName 의존 대상 이름
 * @param state 현재 상태
 * @param consecutiveFailures 연속 실패 횟수
 * @param openedAtNanos OPEN으로 전이한 단조 시각 (OPEN/HALF_OPEN이 아니면 null)
 * @param probesInFlight 진행 중인 HALF_OPEN 프로브 수
 * @author Relay Team
 * @since 1.0.0
 */
public record CircuitBreakerSnapshot(
    String dependencyName,
    CircuitBreakerState state,
    int consecutiveFailures,
    Long openedAtNanos,
    int probesInFlight
) {

    public CircuitBreakerSnapshot {
        if (dependencyName == null || dependencyName.isBlank()) {
            throw new IllegalArgumentException("dependencyName cannot be null or blank");
        }
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        if (consecutiveFailures < 0) {
            throw new IllegalArgumentException("consecutiveFailures cannot be negative (current: " + consecutiveFailures + ")");
        }
        if (probesInFlight < 0) {
            throw new IllegalArgumentException("probesInFlight cannot be negative (current: " + probesInFlight + ")");
        }
    }

    /**
     * 닫힌 상태의 초기 스냅샷.
     *
     * @param dependencyName 의존 대상 이름
     * @return CLOSED, 실패 0회
     */
    public static CircuitBreakerSnapshot closed(String dependencyName) {
        return new CircuitBreakerSnapshot(dependencyName, CircuitBreakerState.CLOSED, 0, null, 0);
    }
}
