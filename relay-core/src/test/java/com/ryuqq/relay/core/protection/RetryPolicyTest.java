package com.ryuqq.relay.core.protection;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * RetryPolicy 테스트.
 *
 * @author Relay Team
 * @since 1.0.0
 */
@DisplayName("RetryPolicy 테스트")
class RetryPolicyTest {

    @Test
    @DisplayName("기본 정책은 3회, 100ms, 2.0배, 408/429/5xx")
    void defaults_기본값_확인() {
        // when
        RetryPolicy policy = RetryPolicy.defaults();

        // then
        assertThat(policy.maxAttempts()).isEqualTo(3);
        assertThat(policy.backoffBaseMs()).isEqualTo(100);
        assertThat(policy.backoffMultiplier()).isEqualTo(2.0);
        assertThat(policy.isRetriable(408)).isTrue();
        assertThat(policy.isRetriable(429)).isTrue();
        assertThat(policy.isRetriable(500)).isTrue();
        assertThat(policy.isRetriable(503)).isTrue();
        assertThat(policy.isRetriable(599)).isTrue();
        assertThat(policy.isRetriable(404)).isFalse();
        assertThat(policy.isRetriable(200)).isFalse();
    }

    @Test
    @DisplayName("Backoff는 base * multiplier^attempt 로 기하급수 증가한다")
    void backoffMs_기하급수_증가() {
        // given
        RetryPolicy policy = RetryPolicy.defaults();

        // when & then
        assertThat(policy.backoffMs(0)).isEqualTo(100);
        assertThat(policy.backoffMs(1)).isEqualTo(200);
        assertThat(policy.backoffMs(2)).isEqualTo(400);
    }

    @Test
    @DisplayName("배수 1.0이면 Backoff가 일정하다")
    void backoffMs_배수_1이면_일정() {
        // given
        RetryPolicy policy = RetryPolicy.defaults().withBackoffMultiplier(1.0).withBackoffBaseMs(250);

        // when & then
        assertThat(policy.backoffMs(0)).isEqualTo(250);
        assertThat(policy.backoffMs(5)).isEqualTo(250);
    }

    @Test
    @DisplayName("totalBackoffMs는 마지막 시도 뒤 대기를 제외한 합계")
    void totalBackoffMs_마지막_시도_제외() {
        // given
        RetryPolicy policy = RetryPolicy.defaults();

        // when & then
        assertThat(policy.totalBackoffMs()).isEqualTo(300);
        assertThat(policy.withMaxAttempts(1).totalBackoffMs()).isZero();
        assertThat(policy.withMaxAttempts(4).totalBackoffMs()).isEqualTo(700);
    }

    @Test
    @DisplayName("worstCaseLatency는 시도 타임아웃 합계에 Backoff 합계를 더한다")
    void worstCaseLatency_상한_계산() {
        // given
        RetryPolicy policy = RetryPolicy.defaults().withAttemptTimeout(Duration.ofSeconds(2));

        // when & then
        assertThat(policy.worstCaseLatency()).isEqualTo(Duration.ofMillis(6_300));
    }

    @Test
    @DisplayName("maxAttempts가 1~10을 벗어나면 예외")
    void constructor_maxAttempts_범위_검증() {
        assertThatThrownBy(() -> RetryPolicy.defaults().withMaxAttempts(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxAttempts must be between 1 and 10");
        assertThatThrownBy(() -> RetryPolicy.defaults().withMaxAttempts(11))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("backoffBaseMs, multiplier 범위를 벗어나면 예외")
    void constructor_backoff_범위_검증() {
        assertThatThrownBy(() -> RetryPolicy.defaults().withBackoffBaseMs(10))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("backoffBaseMs");
        assertThatThrownBy(() -> RetryPolicy.defaults().withBackoffMultiplier(5.5))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("backoffMultiplier");
    }

    @Test
    @DisplayName("잘못된 상태 코드가 포함되면 예외")
    void constructor_상태코드_검증() {
        assertThatThrownBy(() -> RetryPolicy.defaults().withRetriableStatusCodes(Set.of(503, 700)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("700");
    }

    @Test
    @DisplayName("with 메서드는 나머지 필드를 유지한 새 인스턴스를 만든다")
    void with_나머지_필드_유지() {
        // given
        RetryPolicy original = RetryPolicy.defaults();

        // when
        RetryPolicy changed = original.withRetriableStatusCodes(Set.of(503));

        // then
        assertThat(changed).isNotSameAs(original);
        assertThat(changed.retriableStatusCodes()).containsExactly(503);
        assertThat(changed.maxAttempts()).isEqualTo(original.maxAttempts());
        assertThat(original.isRetriable(500)).isTrue();
    }
}
