package com.ryuqq.relay.adapter.runner.http;

import java.util.Map;

/**
 * 성공한 HTTP 호출의 결과.
 *
 * @param statusCode 2xx 상태 코드
 * @param body JSON으로 해석된 바디 (해석 불가 시 원문 텍스트)
 * @param headers 응답 헤더
 * @param attemptsUsed 성공까지 사용한 시도 횟수 (1부터)
 * @author Relay Team
 * @since 1.0.0
 */
public record HttpExchange(int statusCode, Object body, Map<String, String> headers, int attemptsUsed) {

    public HttpExchange {
        if (attemptsUsed < 1) {
            throw new IllegalArgumentException("attemptsUsed must be positive (current: " + attemptsUsed + ")");
        }
        body = body == null ? "" : body;
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }
}
