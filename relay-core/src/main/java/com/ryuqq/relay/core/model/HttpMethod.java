package com.ryuqq.relay.core.model;

import java.util.Locale;

/**
 * 네트워크 클라이언트가 지원하는 HTTP 메서드.
 *
 * @author Relay Team
 * @since 1.0.0
 */
public enum HttpMethod {

    GET,
    POST,
    PUT,
    DELETE,
    PATCH,
    HEAD;

    /**
     * 대소문자 구분 없이 메서드 이름을 해석합니다.
     *
     * @param name 메서드 이름 (예: "get", "POST")
     * @return HttpMethod
     * @throws IllegalArgumentException 지원하지 않는 메서드인 경우
     */
    public static HttpMethod from(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("HTTP method cannot be null or blank");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported HTTP method: " + name, e);
        }
    }

    /**
     * 요청 본문을 가질 수 있는 메서드인지 확인.
     *
     * @return POST, PUT, PATCH이면 true
     */
    public boolean allowsBody() {
        return this == POST || this == PUT || this == PATCH;
    }
}
