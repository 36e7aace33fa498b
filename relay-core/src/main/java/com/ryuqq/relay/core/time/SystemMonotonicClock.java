package com.ryuqq.relay.core.time;

/**
 * {@link System#nanoTime()} 기반 운영용 {@link MonotonicClock}.
 *
 * <p>NTP 보정이나 수동 시각 변경의 영향을 받지 않습니다.
 * 결정적인 테스트에는 testkit의 {@code ManualMonotonicClock}을 사용합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public enum SystemMonotonicClock implements MonotonicClock {

    INSTANCE;

    @Override
    public long nowNanos() {
        return System.nanoTime();
    }
}
