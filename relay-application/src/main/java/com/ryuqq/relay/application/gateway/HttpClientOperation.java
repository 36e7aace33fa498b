package com.ryuqq.relay.application.gateway;

/**
 * {@code http_client} 인터페이스 오퍼레이션.
 *
 * <ul>
 *   <li>REQUEST: {@code method}, {@code url} 외 요청 옵션</li>
 *   <li>GET, POST, PUT, DELETE: {@code url} 외 요청 옵션</li>
 *   <li>CONFIGURE_RETRY: {@code max_attempts}, {@code backoff_base_ms}, {@code backoff_multiplier},
 *       {@code retriable_status_codes}, {@code attempt_timeout_ms} (생략한 값은 현재 정책 유지)</li>
 *   <li>STATS, RESET_STATS: 인자 없음</li>
 * </ul>
 *
 * <p>요청 옵션: {@code headers}, {@code params}, {@code body}(문자열 또는 JSON으로 직렬화할 객체),
 * {@code timeout_ms}, {@code dependency}, {@code use_retry}.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public enum HttpClientOperation implements GatewayOperation {
    REQUEST,
    GET,
    POST,
    PUT,
    DELETE,
    CONFIGURE_RETRY,
    STATS,
    RESET_STATS
}
