package com.ryuqq.relay.application.gateway;

/**
 * {@code circuit_breaker} 인터페이스 오퍼레이션.
 *
 * <ul>
 *   <li>STATE, RESET: {@code dependency}</li>
 *   <li>LIST, RESET_ALL: 인자 없음</li>
 * </ul>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public enum CircuitBreakerOperation implements GatewayOperation {
    STATE,
    LIST,
    RESET,
    RESET_ALL
}
