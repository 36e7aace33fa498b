package com.ryuqq.relay.application.gateway;

/**
 * {@code singleton} 인터페이스 오퍼레이션.
 *
 * <ul>
 *   <li>GET: {@code name}으로 조회 (없으면 {@code Optional.empty()})</li>
 *   <li>GET_OR_CREATE: {@code name}, {@code factory}(Supplier)로 조회 또는 생성</li>
 *   <li>REPLACE: {@code name}, {@code instance}로 교체</li>
 *   <li>EXISTS, DELETE: {@code name}</li>
 *   <li>CLEAR, STATS: 인자 없음</li>
 * </ul>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public enum SingletonOperation implements GatewayOperation {
    GET,
    GET_OR_CREATE,
    REPLACE,
    EXISTS,
    DELETE,
    CLEAR,
    STATS
}
