package com.ryuqq.relay.application.gateway;

import com.ryuqq.relay.core.outcome.ErrorKind;

import java.util.Map;

/**
 * Gateway 호출 통계.
 *
 * @param totalCalls 전체 호출 수
 * @param callsByOperation {@code interface.operation} → 호출 수 (해석된 호출만)
 * @param failures 실패 결과 수
 * @param failuresByKind ErrorKind → 실패 수
 * @author Relay Team
 * @since 1.0.0
 */
public record GatewayStats(
    long totalCalls,
    Map<String, Long> callsByOperation,
    long failures,
    Map<ErrorKind, Long> failuresByKind
) {

    public GatewayStats {
        callsByOperation = callsByOperation == null ? Map.of() : Map.copyOf(callsByOperation);
        failuresByKind = failuresByKind == null ? Map.of() : Map.copyOf(failuresByKind);
    }

    /**
     * @param key {@code interface.operation} (예: {@code cache.get})
     * @return 호출 수 (없으면 0)
     */
    public long callsOf(String key) {
        return callsByOperation.getOrDefault(key, 0L);
    }
}
