package com.ryuqq.relay.core.time;

/**
 * 경과 시간 계산용 단조 시계.
 *
 * <p>Rate Limiter 창, Circuit Breaker 복구 대기, 캐시 TTL 판정은
 * 모두 이 시계를 통해 시간을 읽습니다. 벽시계({@code Instant.now()})는
 * 생성 시각 표시 같은 관측 용도로만 사용합니다.</p>
 *
 * <p>값 자체는 의미가 없고, 두 값의 차이만 의미가 있습니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface MonotonicClock {

    /**
     * 단조 증가하는 현재 시각 (나노초).
     *
     * @return 나노초 단위 틱
     */
    long nowNanos();

    /**
     * 기준 시각 이후 경과 시간 (밀리초).
     *
     * @param sinceNanos 기준 시각 ({@link #nowNanos()}로 얻은 값)
     * @return 경과 밀리초
     */
    default long elapsedMillis(long sinceNanos) {
        return (nowNanos() - sinceNanos) / 1_000_000L;
    }
}
