package com.ryuqq.relay.application.gateway;

import java.util.Locale;

/**
 * 인터페이스별 오퍼레이션 enum이 구현하는 공통 타입.
 *
 * @author Relay Team
 * @since 1.0.0
 */
public interface GatewayOperation {

    /**
     * enum 상수 이름.
     *
     * @return 예: {@code GET_OR_CREATE}
     */
    String name();

    /**
     * 외부에 노출되는 오퍼레이션 이름.
     *
     * @return 예: {@code get_or_create}
     */
    default String operationName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
