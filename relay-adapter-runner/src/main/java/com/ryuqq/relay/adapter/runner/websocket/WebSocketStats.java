package com.ryuqq.relay.adapter.runner.websocket;

/**
 * WebSocket 클라이언트 누적 통계.
 *
 * @param opened 성공한 연결 수
 * @param closed 종료한 연결 수
 * @param sent 전송한 메시지 수
 * @param received 수신한 메시지 수
 * @param errors 연결/전송/수신 오류 수
 * @param open 현재 열린 연결 핸들 수
 * @author Relay Team
 * @since 1.0.0
 */
public record WebSocketStats(long opened, long closed, long sent, long received, long errors, int open) {
}
