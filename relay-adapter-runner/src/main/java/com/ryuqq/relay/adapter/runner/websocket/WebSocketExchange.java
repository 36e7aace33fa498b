package com.ryuqq.relay.adapter.runner.websocket;

/**
 * 연결-전송-수신-종료를 한 번에 수행한 결과.
 *
 * @param url 대상 URL
 * @param sentBytes 전송한 메시지 크기 (UTF-8 바이트)
 * @param responded 응답을 기다렸는지 여부
 * @param response 수신한 응답 (응답을 기다리지 않았으면 빈 문자열)
 * @author Relay Team
 * @since 1.0.0
 */
public record WebSocketExchange(String url, int sentBytes, boolean responded, Object response) {

    public WebSocketExchange {
        response = response == null ? "" : response;
    }
}
