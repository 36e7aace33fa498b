package com.ryuqq.relay.core.protection;

/**
 * Circuit Breaker 상태.
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * CLOSED (정상)
 *   │
 *   ▼ (연속 실패 failureThreshold회)
 * OPEN (차단)
 *   │
 *   ▼ (recoveryTimeout 경과 후 첫 요청)
 * HALF_OPEN (프로브)
 *   │
 *   ├─► 성공 → CLOSED
 *   └─► 실패 → OPEN (openedAt 갱신)
 * </pre>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public enum CircuitBreakerState {

    /** 정상 상태. 연속 실패를 센다. */
    CLOSED,

    /** 차단 상태. I/O 없이 즉시 거부한다. */
    OPEN,

    /** 제한된 수의 프로브 요청만 통과시켜 복구 여부를 확인한다. */
    HALF_OPEN
}
