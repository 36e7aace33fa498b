package com.ryuqq.relay.core.time;

/**
 * Backoff 대기 추상화.
 *
 * <p>재시도 사이의 대기는 모두 이 인터페이스를 거칩니다.
 * 테스트에서는 실제로 잠들지 않고 요청된 지연만 기록하는 구현으로 교체합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * 지정한 시간 동안 대기.
     *
     * @param millis 대기 시간 (밀리초, 0 이하이면 즉시 반환)
     * @throws InterruptedException 대기 중 인터럽트 발생
     */
    void sleep(long millis) throws InterruptedException;
}
