package com.ryuqq.relay.application.gateway;

/**
 * {@code websocket} 인터페이스 오퍼레이션.
 *
 * <ul>
 *   <li>CONNECT: {@code url}, 선택 {@code headers}, {@code timeout_seconds} → 연결 핸들 ID</li>
 *   <li>SEND: {@code connection_id}, {@code message}(JSON 객체)</li>
 *   <li>RECEIVE: {@code connection_id}, 선택 {@code timeout_seconds}</li>
 *   <li>CLOSE: {@code connection_id}</li>
 *   <li>REQUEST: {@code url}, {@code message}, 선택 {@code wait_for_response}. 연결, 전송, 수신 후 항상 종료</li>
 *   <li>STATS: 인자 없음</li>
 * </ul>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public enum WebSocketOperation implements GatewayOperation {
    CONNECT,
    SEND,
    RECEIVE,
    CLOSE,
    REQUEST,
    STATS
}
