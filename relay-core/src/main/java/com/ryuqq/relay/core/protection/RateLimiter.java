package com.ryuqq.relay.core.protection;

import com.ryuqq.relay.core.model.CorrelationId;

/**
 * Rate Limiter SPI.
 *
 * <p>클라이언트 하나가 일정 시간 창(window) 안에서 수행하는 오퍼레이션 수를 제한합니다.
 * 대기하지 않고 즉시 허용/거부를 판정하며, 거부된 요청은 재시도하지 않습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * if (!limiter.tryAcquire(correlationId)) {
 *     return OperationResult.failure(correlationId, ErrorKind.RATE_LIMITED, "rate limit exceeded");
 * }
 * }</pre>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public interface RateLimiter {

    /**
     * 요청 허용 여부를 판정하고, 허용되면 기록합니다 (비블로킹).
     *
     * <p>거부된 요청은 창에 기록되지 않습니다.</p>
     *
     * @param correlationId 로깅용 CorrelationId
     * @return true: 요청 허용, false: 한도 초과
     */
    boolean tryAcquire(CorrelationId correlationId);

    /**
     * Rate Limiter 설정 정보 조회.
     *
     * @return RateLimiterConfig
     */
    RateLimiterConfig getConfig();

    /**
     * 지금까지 거부한 요청 수.
     *
     * @return 거부 횟수
     */
    long rejectedCount();

    /**
     * 현재 창 안에 기록된 요청 수.
     *
     * @return 창 크기
     */
    int currentWindowSize();

    /**
     * 기록과 거부 카운터를 모두 비웁니다.
     */
    void reset();
}
