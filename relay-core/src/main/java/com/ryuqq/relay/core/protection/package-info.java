/**
 * Protection SPI 패키지.
 *
 * <p>원격 홈 오토메이션 서버 호출을 보호하는 확장점을 정의합니다.</p>
 *
 * <h2>Protection 체인 순서</h2>
 *
 * <pre>
 * 1. RateLimiter     → 클라이언트 단위 허용량 초과 시 즉시 실패 (RATE_LIMITED)
 * 2. CircuitBreaker  → 의존 대상이 OPEN이면 I/O 없이 실패 (CIRCUIT_OPEN)
 * 3. 시도 루프       → RetryPolicy에 따라 시도, 분류, Backoff
 * </pre>
 *
 * <p>Rate Limiter와 Circuit Breaker는 최초 호출에서만 검사하며
 * 재시도 루프 도중에는 다시 검사하지 않습니다.</p>
 *
 * <h2>NoOp 구현</h2>
 *
 * <p>{@code noop} 하위 패키지는 모든 요청을 허용하고 상태를 추적하지 않는 구현을 제공합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 * @see com.ryuqq.relay.core.protection.CircuitBreaker
 * @see com.ryuqq.relay.core.protection.RateLimiter
 * @see com.ryuqq.relay.core.protection.RetryPolicy
 */
package com.ryuqq.relay.core.protection;
