/**
 * Protection SPI의 인메모리 구현.
 *
 * <ul>
 *   <li>{@link com.ryuqq.relay.adapter.inmemory.protection.SlidingWindowRateLimiter}: 타임스탬프 큐 기반 슬라이딩 윈도우</li>
 *   <li>{@link com.ryuqq.relay.adapter.inmemory.protection.ConsecutiveFailureCircuitBreaker}: 연속 실패 기반 3상태 Breaker</li>
 *   <li>{@link com.ryuqq.relay.adapter.inmemory.protection.InMemoryCircuitBreakerProvider}: 의존 대상별 Breaker 지연 생성</li>
 * </ul>
 *
 * <p>모든 시간 판정은 {@link com.ryuqq.relay.core.time.MonotonicClock}을 통해 이루어집니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
package com.ryuqq.relay.adapter.inmemory.protection;
