package com.ryuqq.relay.application.gateway;

import com.ryuqq.relay.core.model.CorrelationId;

import java.util.Map;

/**
 * Gateway의 작업 단위.
 *
 * @param interfaceName 인터페이스 이름 (해석 전 원문)
 * @param operation 오퍼레이션 이름 (해석 전 원문)
 * @param arguments 인자
 * @param correlationId 호출자가 지정한 CorrelationId (null이면 Gateway가 발급)
 * @author Relay Team
 * @since 1.0.0
 */
public record OperationRequest(
    String interfaceName,
    String operation,
    OperationArguments arguments,
    CorrelationId correlationId
) {

    /** 인자 맵에서 CorrelationId를 찾을 때 쓰는 키. */
    public static final String CORRELATION_ID_ARGUMENT = "correlation_id";

    public OperationRequest {
        arguments = arguments == null ? OperationArguments.empty() : arguments;
    }

    public static OperationRequest of(String interfaceName, String operation, Map<String, ?> arguments) {
        return new OperationRequest(interfaceName, operation, OperationArguments.of(arguments), null);
    }

    public OperationRequest withCorrelationId(CorrelationId newCorrelationId) {
        return new OperationRequest(interfaceName, operation, arguments, newCorrelationId);
    }
}
