package com.ryuqq.relay.adapter.inmemory.protection;

import com.ryuqq.relay.core.model.CorrelationId;
import com.ryuqq.relay.core.protection.RateLimiterConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * SlidingWindowRateLimiter 테스트.
 *
 * @author Relay Team
 * @since 1.0.0
 */
@DisplayName("SlidingWindowRateLimiter 테스트")
class SlidingWindowRateLimiterTest {

    private final AtomicLong nowNanos = new AtomicLong();
    private final CorrelationId cid = CorrelationId.of("rl-test");

    private SlidingWindowRateLimiter limiter(int maxOperations, Duration window) {
        return new SlidingWindowRateLimiter(new RateLimiterConfig(maxOperations, window), nowNanos::get);
    }

    private void advanceMillis(long millis) {
        nowNanos.addAndGet(millis * 1_000_000L);
    }

    @Test
    @DisplayName("한도 2, 창 1초에서 연속 세 번 호출하면 허용, 허용, 거부")
    void tryAcquire_허용_허용_거부() {
        // given
        SlidingWindowRateLimiter limiter = limiter(2, Duration.ofSeconds(1));

        // when
        List<Boolean> decisions = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            decisions.add(limiter.tryAcquire(cid));
        }

        // then
        assertThat(decisions).containsExactly(true, true, false);
        assertThat(limiter.rejectedCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("거부된 요청은 창에 기록되지 않는다")
    void tryAcquire_거부는_기록_안함() {
        // given
        SlidingWindowRateLimiter limiter = limiter(1, Duration.ofSeconds(1));
        limiter.tryAcquire(cid);

        // when
        for (int i = 0; i < 10; i++) {
            limiter.tryAcquire(cid);
        }

        // then
        assertThat(limiter.currentWindowSize()).isEqualTo(1);
        assertThat(limiter.rejectedCount()).isEqualTo(10);
    }

    @Test
    @DisplayName("창이 지나면 다시 허용된다")
    void tryAcquire_창_경과_후_허용() {
        // given
        SlidingWindowRateLimiter limiter = limiter(2, Duration.ofSeconds(1));
        limiter.tryAcquire(cid);
        advanceMillis(500);
        limiter.tryAcquire(cid);
        assertThat(limiter.tryAcquire(cid)).isFalse();

        // when
        advanceMillis(500);

        // then
        assertThat(limiter.tryAcquire(cid)).isTrue();
        assertThat(limiter.tryAcquire(cid)).isFalse();
    }

    @Test
    @DisplayName("어떤 시점에도 창 안의 허용 수는 한도를 넘지 않는다")
    void tryAcquire_한도_불변식() {
        // given
        int max = 5;
        SlidingWindowRateLimiter limiter = limiter(max, Duration.ofMillis(100));

        // when & then
        for (int i = 0; i < 1_000; i++) {
            limiter.tryAcquire(cid);
            assertThat(limiter.currentWindowSize()).isLessThanOrEqualTo(max);
            advanceMillis(7);
        }
    }

    @Test
    @DisplayName("reset은 기록과 거부 카운터를 비운다")
    void reset_초기화() {
        // given
        SlidingWindowRateLimiter limiter = limiter(1, Duration.ofSeconds(1));
        limiter.tryAcquire(cid);
        limiter.tryAcquire(cid);

        // when
        limiter.reset();

        // then
        assertThat(limiter.currentWindowSize()).isZero();
        assertThat(limiter.rejectedCount()).isZero();
        assertThat(limiter.tryAcquire(cid)).isTrue();
    }
}
