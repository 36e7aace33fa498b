package com.ryuqq.relay.application.gateway;

/**
 * {@code cache} 인터페이스 오퍼레이션.
 *
 * <ul>
 *   <li>GET: {@code key} → {@code CacheLookup} (미스도 성공)</li>
 *   <li>SET: {@code key}, {@code value}, 선택 {@code ttl_seconds}</li>
 *   <li>EXISTS, INVALIDATE: {@code key}</li>
 *   <li>CLEAR, CLEANUP_EXPIRED, MAINTAIN, STATS: 인자 없음</li>
 * </ul>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public enum CacheOperation implements GatewayOperation {
    GET,
    SET,
    EXISTS,
    INVALIDATE,
    CLEAR,
    CLEANUP_EXPIRED,
    MAINTAIN,
    STATS
}
