package com.ryuqq.relay.adapter.runner.http;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HTTP 요청 옵션.
 *
 * @param headers 추가 헤더 (기본 헤더를 덮어씀)
 * @param params 쿼리 파라미터
 * @param body 문자열 또는 JSON으로 직렬화할 객체 (nullable)
 * @param timeout 시도별 타임아웃 (null이면 RetryPolicy의 attemptTimeout)
 * @param dependency Circuit Breaker 의존성 이름 (null이면 URL 호스트)
 * @param useRetry false면 단일 시도
 * @author Relay Team
 * @since 1.0.0
 */
public record HttpRequestOptions(
    Map<String, String> headers,
    Map<String, String> params,
    Object body,
    Duration timeout,
    String dependency,
    boolean useRetry
) {

    private static final HttpRequestOptions DEFAULTS =
        new HttpRequestOptions(Map.of(), Map.of(), null, null, null, true);

    public HttpRequestOptions {
        headers = headers == null ? Map.of() : copyOrdered(headers);
        params = params == null ? Map.of() : copyOrdered(params);
        if (timeout != null && (timeout.isZero() || timeout.isNegative())) {
            throw new IllegalArgumentException("timeout must be positive (current: " + timeout + ")");
        }
        if (dependency != null && dependency.isBlank()) {
            dependency = null;
        }
    }

    public static HttpRequestOptions defaults() {
        return DEFAULTS;
    }

    public HttpRequestOptions withHeaders(Map<String, String> newHeaders) {
        return new HttpRequestOptions(newHeaders, params, body, timeout, dependency, useRetry);
    }

    public HttpRequestOptions withParams(Map<String, String> newParams) {
        return new HttpRequestOptions(headers, newParams, body, timeout, dependency, useRetry);
    }

    public HttpRequestOptions withBody(Object newBody) {
        return new HttpRequestOptions(headers, params, newBody, timeout, dependency, useRetry);
    }

    public HttpRequestOptions withTimeout(Duration newTimeout) {
        return new HttpRequestOptions(headers, params, body, newTimeout, dependency, useRetry);
    }

    public HttpRequestOptions withDependency(String newDependency) {
        return new HttpRequestOptions(headers, params, body, timeout, newDependency, useRetry);
    }

    public HttpRequestOptions withUseRetry(boolean newUseRetry) {
        return new HttpRequestOptions(headers, params, body, timeout, dependency, newUseRetry);
    }

    private static Map<String, String> copyOrdered(Map<String, String> source) {
        Map<String, String> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> {
            if (key == null || value == null) {
                throw new IllegalArgumentException("header and param entries cannot be null");
            }
            copy.put(key, value);
        });
        return Collections.unmodifiableMap(copy);
    }
}
