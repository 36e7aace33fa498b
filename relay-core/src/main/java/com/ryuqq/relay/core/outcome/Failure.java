package com.ryuqq.relay.core.outcome;

import com.ryuqq.relay.core.model.CorrelationId;

/**
 * 실패한 오퍼레이션.
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>Rate Limit 초과: {@code RATE_LIMITED}, attempts=0</li>
 *   <li>Circuit OPEN: {@code CIRCUIT_OPEN}, attempts=0</li>
 *   <li>404 수신: {@code HTTP_STATUS}, attempts=1</li>
 *   <li>503 세 번 연속: {@code RETRY_EXHAUSTED}, attempts=3</li>
 * </ul>
 *
 * @param correlationId CorrelationId
 * @param errorKind 실패 분류
 * @param error 사람이 읽을 수 있는 오류 메시지
 * @param attempts 실제로 수행한 I/O 시도 횟수 (I/O 전에 거부되면 0)
 *
 * @author Relay Team
 * @since 1.0.0
 */
public record Failure(
    CorrelationId correlationId,
    ErrorKind errorKind,
    String error,
    int attempts
) implements OperationResult {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 값이 없거나 attempts가 음수인 경우
     */
    public Failure {
        if (correlationId == null) {
            throw new IllegalArgumentException("correlationId cannot be null");
        }
        if (errorKind == null) {
            throw new IllegalArgumentException("errorKind cannot be null");
        }
        if (error == null || error.isBlank()) {
            throw new IllegalArgumentException("error cannot be null or blank");
        }
        if (attempts < 0) {
            throw new IllegalArgumentException("attempts cannot be negative (current: " + attempts + ")");
        }
    }

    /**
     * 시도 횟수를 포함한 Failure 생성.
     *
     * @param correlationId CorrelationId
     * @param errorKind 실패 분류
     * @param error 오류 메시지
     * @param attempts 시도 횟수
     * @return Failure 인스턴스
     */
    public static Failure of(CorrelationId correlationId, ErrorKind errorKind, String error, int attempts) {
        return new Failure(correlationId, errorKind, error, attempts);
    }
}
