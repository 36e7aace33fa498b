package com.ryuqq.relay.adapter.runner.http;

/**
 * HTTP 클라이언트 누적 통계.
 *
 * @param requests 검증을 통과한 요청 수
 * @param successful 성공 응답 수
 * @param failed 실패로 끝난 요청 수 (거절 포함)
 * @param retries 백오프 후 재시도 횟수
 * @param rateLimited Rate Limiter 거절 수
 * @param circuitRejected Circuit Breaker 거절 수
 * @author Relay Team
 * @since 1.0.0
 */
public record HttpClientStats(
    long requests,
    long successful,
    long failed,
    long retries,
    long rateLimited,
    long circuitRejected
) {

    public static HttpClientStats empty() {
        return new HttpClientStats(0, 0, 0, 0, 0, 0);
    }

    /**
     * @return 성공률 (%, 소수 둘째 자리 반올림). 요청이 없으면 0
     */
    public double successRate() {
        if (requests == 0) {
            return 0.0;
        }
        return Math.round(successful * 10_000.0 / requests) / 100.0;
    }
}
