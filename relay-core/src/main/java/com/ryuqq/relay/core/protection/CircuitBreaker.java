package com.ryuqq.relay.core.protection;

import com.ryuqq.relay.core.model.CorrelationId;

/**
 * 의존 대상(dependency) 하나에 대한 Circuit Breaker SPI.
 *
 * <p>연속 실패를 추적하고, 임계값에 도달하면 I/O 없이 빠르게 실패(Fail-Fast)하여
 * 이미 장애가 난 원격 서버로 요청이 계속 쌓이는 것을 막습니다.</p>
 *
 * <p>Breaker는 전송 방식(HTTP, WebSocket)을 알지 못하며
 * 호출자가 전달하는 성공/실패 신호만으로 상태를 갱신합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * CircuitBreaker cb = provider.forDependency("home.example.com");
 *
 * if (!cb.tryAcquire(correlationId)) {
 *     return OperationResult.failure(correlationId, ErrorKind.CIRCUIT_OPEN, "circuit open");
 * }
 *
 * try {
 *     TransportResponse response = transport.send(request);
 *     cb.recordSuccess(correlationId);
 *     return toResult(response);
 * } catch (IOException e) {
 *     cb.recordFailure(correlationId, e);
 *     ...
 * }
 * }</pre>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public interface CircuitBreaker {

    /**
     * 요청 통과 허용 여부 확인.
     *
     * <ul>
     *   <li>CLOSED: 항상 true</li>
     *   <li>OPEN: 복구 대기 시간이 지나지 않았으면 false,
     *       지났으면 HALF_OPEN으로 전이하고 프로브로 허용</li>
     *   <li>HALF_OPEN: 진행 중인 프로브 수가 한도 미만일 때만 true</li>
     * </ul>
     *
     * @param correlationId 로깅용 CorrelationId
     * @return true: 요청 통과 허용, false: 요청 차단
     */
    boolean tryAcquire(CorrelationId correlationId);

    /**
     * 실행 성공 기록.
     *
     * <ul>
     *   <li>연속 실패 카운터를 0으로 초기화</li>
     *   <li>HALF_OPEN: CLOSED로 전이</li>
     * </ul>
     *
     * @param correlationId CorrelationId
     */
    void recordSuccess(CorrelationId correlationId);

    /**
     * 실행 실패 기록.
     *
     * <ul>
     *   <li>CLOSED: 연속 실패가 임계값에 도달하면 OPEN으로 전이</li>
     *   <li>HALF_OPEN: 즉시 OPEN으로 전이하고 복구 대기 시간을 다시 시작</li>
     * </ul>
     *
     * @param correlationId CorrelationId
     * @param cause 실패 원인 (상태 코드 실패처럼 예외가 없으면 null)
     */
    void recordFailure(CorrelationId correlationId, Throwable cause);

    /**
     * 현재 상태 조회.
     *
     * @return CLOSED, OPEN, HALF_OPEN 중 하나
     */
    CircuitBreakerState getState();

    /**
     * 이 Breaker가 보호하는 의존 대상 이름.
     *
     * @return dependency 이름
     */
    String getDependencyName();

    /**
     * 현재 상태의 불변 스냅샷.
     *
     * @return CircuitBreakerSnapshot
     */
    CircuitBreakerSnapshot snapshot();

    /**
     * Circuit Breaker를 CLOSED 상태로 강제 리셋.
     *
     * <p>수동 복구 또는 테스트 목적으로 사용됩니다.</p>
     */
    void reset();
}
