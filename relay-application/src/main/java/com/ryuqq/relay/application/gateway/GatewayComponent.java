package com.ryuqq.relay.application.gateway;

import com.ryuqq.relay.core.model.CorrelationId;
import com.ryuqq.relay.core.outcome.OperationResult;

/**
 * Gateway 인터페이스 하나를 처리하는 컴포넌트.
 *
 * <p>구현체는 레지스트리에 {@link GatewayInterface#componentName()}으로 등록되는 싱글톤이며,
 * {@link #handle}에서 오퍼레이션 enum을 빠짐없이 switch로 처리합니다.</p>
 *
 * <p>인자 오류는 {@link IllegalArgumentException}으로 던져도 됩니다.
 * Gateway가 {@code VALIDATION} 실패로 변환합니다.</p>
 *
 * @param <O> 오퍼레이션 enum 타입
 * @author Relay Team
 * @since 1.0.0
 */
public interface GatewayComponent<O extends Enum<O> & GatewayOperation> {

    /**
     * @return 처리하는 인터페이스
     */
    GatewayInterface gatewayInterface();

    /**
     * @return 오퍼레이션 enum 타입
     */
    Class<O> operationType();

    /**
     * 오퍼레이션 실행.
     *
     * @param operation 오퍼레이션
     * @param arguments 인자
     * @param correlationId CorrelationId
     * @return 실행 결과 (null 불가)
     */
    OperationResult handle(O operation, OperationArguments arguments, CorrelationId correlationId);

    /**
     * 타입이 지워진 오퍼레이션으로 실행.
     *
     * @param operation 오퍼레이션 ({@link #operationType()}의 상수여야 함)
     * @param arguments 인자
     * @param correlationId CorrelationId
     * @return 실행 결과
     * @throws ClassCastException 다른 인터페이스의 오퍼레이션인 경우
     */
    default OperationResult dispatch(GatewayOperation operation, OperationArguments arguments, CorrelationId correlationId) {
        return handle(operationType().cast(operation), arguments, correlationId);
    }
}
