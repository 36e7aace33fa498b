package com.ryuqq.relay.core.outcome;

import com.ryuqq.relay.core.model.CorrelationId;

/**
 * Gateway 오퍼레이션 실행 결과.
 *
 * <p>OperationResult는 두 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Success}: 오퍼레이션이 완료되어 데이터를 반환함</li>
 *   <li>{@link Failure}: 오퍼레이션이 실패했으며 {@link ErrorKind}로 원인을 분류함</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 결과가 절반만 채워지는 경우가 없습니다.
 * Gateway 경계를 넘어 예외가 전파되지 않으며, 모든 경로는 이 타입으로 끝납니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * OperationResult result = gateway.execute("cache", "get", args);
 * if (result instanceof Failure failure) {
 *     log.warn("cache lookup failed: {}", failure.errorKind());
 * }
 * }</pre>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public sealed interface OperationResult permits Success, Failure {

    /**
     * 이 결과를 만든 호출의 CorrelationId.
     *
     * @return CorrelationId (null 불가)
     */
    CorrelationId correlationId();

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isSuccess() {
        return this instanceof Success;
    }

    /**
     * 결과가 실패인지 확인.
     *
     * @return 실패 여부
     */
    default boolean isFailure() {
        return this instanceof Failure;
    }

    /**
     * 성공 결과 생성.
     *
     * @param correlationId CorrelationId
     * @param data 반환 데이터
     * @return Success 인스턴스
     */
    static Success success(CorrelationId correlationId, Object data) {
        return new Success(correlationId, data);
    }

    /**
     * 시도 횟수 없는 실패 결과 생성.
     *
     * @param correlationId CorrelationId
     * @param errorKind 실패 분류
     * @param error 오류 메시지
     * @return Failure 인스턴스
     */
    static Failure failure(CorrelationId correlationId, ErrorKind errorKind, String error) {
        return new Failure(correlationId, errorKind, error, 0);
    }
}
