package com.ryuqq.relay.application.gateway;

import com.ryuqq.relay.core.outcome.OperationResult;

import java.util.Map;

/**
 * 모든 인프라 기능의 단일 진입점.
 *
 * <p>호출자는 인터페이스 이름과 오퍼레이션 이름, 인자만으로 캐시, 싱글톤, HTTP/WebSocket 클라이언트,
 * Circuit Breaker 기능을 사용합니다. 결과는 항상 {@link OperationResult}이며 예외를 던지지 않습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * OperationResult result = gateway.execute("http_client", "get",
 *     Map.of("url", "https://home.local/api/states/light.kitchen"));
 *
 * if (result instanceof Failure failure) {
 *     switch (failure.errorKind()) {
 *         case RATE_LIMITED, CIRCUIT_OPEN -&gt; apologizeAndRetryLater();
 *         default -&gt; reportFailure(failure.error());
 *     }
 * }
 * </pre>
 *
 * <p><strong>실패 분류:</strong></p>
 * <ul>
 *   <li>알 수 없는 인터페이스/오퍼레이션: {@code DISPATCH}</li>
 *   <li>잘못된 인자: {@code VALIDATION}</li>
 *   <li>컴포넌트 생성 실패, 예상하지 못한 예외: {@code INTERNAL}</li>
 * </ul>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public interface Gateway {

    /**
     * 이름 기반 오퍼레이션 실행.
     *
     * <p>인터페이스와 오퍼레이션 이름은 대소문자를 구분하지 않습니다.
     * 인자에 {@code correlation_id}가 있으면 사용하고, 없으면 새로 발급합니다.</p>
     *
     * @param interfaceName 인터페이스 이름 (예: "cache")
     * @param operation 오퍼레이션 이름 (예: "get")
     * @param arguments 오퍼레이션 인자 (null이면 빈 인자)
     * @return 실행 결과 (null 불가)
     */
    OperationResult execute(String interfaceName, String operation, Map<String, ?> arguments);

    /**
     * 요청 객체 기반 실행.
     *
     * @param request 요청
     * @return 실행 결과 (null 불가)
     */
    OperationResult execute(OperationRequest request);

    /**
     * 타입 기반 실행.
     *
     * @param gatewayInterface 대상 인터페이스
     * @param operation 해당 인터페이스의 오퍼레이션
     * @param arguments 오퍼레이션 인자
     * @return 실행 결과 (null 불가)
     */
    OperationResult execute(GatewayInterface gatewayInterface, GatewayOperation operation, OperationArguments arguments);

    /**
     * {@code interface.operation}별 호출 통계.
     *
     * @return GatewayStats
     */
    GatewayStats stats();

    /**
     * 호출 통계 초기화.
     */
    void resetStats();
}
