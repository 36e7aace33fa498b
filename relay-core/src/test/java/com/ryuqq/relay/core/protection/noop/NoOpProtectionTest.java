package com.ryuqq.relay.core.protection.noop;

import com.ryuqq.relay.core.model.CorrelationId;
import com.ryuqq.relay.core.protection.CircuitBreaker;
import com.ryuqq.relay.core.protection.CircuitBreakerState;
import com.ryuqq.relay.core.protection.RateLimiter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * NoOp Protection 구현 유닛 테스트.
 *
 * @author Relay Team
 * @since 1.0.0
 */
@DisplayName("NoOp Protection 테스트")
class NoOpProtectionTest {

    private final CorrelationId cid = CorrelationId.of("test-op");

    @Test
    @DisplayName("NoOpCircuitBreaker는 실패가 쌓여도 항상 통과시킨다")
    void circuitBreaker_실패_누적에도_항상_통과() {
        // given
        CircuitBreaker cb = new NoOpCircuitBreaker("home.local");

        // when
        for (int i = 0; i < 50; i++) {
            cb.recordFailure(cid, new RuntimeException("boom"));
        }

        // then
        assertTrue(cb.tryAcquire(cid));
        assertEquals(CircuitBreakerState.CLOSED, cb.getState());
        assertEquals("home.local", cb.snapshot().dependencyName());
    }

    @Test
    @DisplayName("NoOpCircuitBreaker는 빈 이름을 거부한다")
    void circuitBreaker_빈_이름_거부() {
        assertThrows(IllegalArgumentException.class, () -> new NoOpCircuitBreaker(" "));
    }

    @Test
    @DisplayName("NoOpRateLimiter는 한도와 관계없이 항상 허용한다")
    void rateLimiter_항상_허용() {
        // given
        RateLimiter limiter = new NoOpRateLimiter();

        // when & then
        for (int i = 0; i < 1_000; i++) {
            assertTrue(limiter.tryAcquire(cid));
        }
        assertEquals(0, limiter.rejectedCount());
        assertEquals(0, limiter.currentWindowSize());
        assertDoesNotThrow(limiter::reset);
    }

    @Test
    @DisplayName("NoOpCircuitBreakerProvider는 Breaker를 기억하지 않는다")
    void provider_기억하지_않음() {
        // given
        NoOpCircuitBreakerProvider provider = new NoOpCircuitBreakerProvider();

        // when
        CircuitBreaker cb = provider.forDependency("home.local");

        // then
        assertTrue(cb.tryAcquire(cid));
        assertTrue(provider.find("home.local").isEmpty());
        assertTrue(provider.snapshots().isEmpty());
        assertEquals(0, provider.resetAll());
    }
}
