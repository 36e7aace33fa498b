package com.ryuqq.relay.core.outcome;

/**
 * 실패 결과의 분류.
 *
 * <p>호출자(음성 인터페이스 등)는 이 값만 보고 사과할지, 나중에 다시 시도할지,
 * 영구 실패로 보고할지 결정할 수 있어야 합니다.</p>
 *
 * <p><strong>재시도 관점 분류:</strong></p>
 * <ul>
 *   <li>로컬 거부 (재시도 안 함): {@link #RATE_LIMITED}, {@link #CIRCUIT_OPEN}</li>
 *   <li>전송 계층 실패 (재시도 대상): {@link #CONNECTION}, {@link #TIMEOUT}</li>
 *   <li>최종 실패: {@link #HTTP_STATUS}, {@link #RETRY_EXHAUSTED}</li>
 *   <li>호출 자체의 오류: {@link #VALIDATION}, {@link #DISPATCH}, {@link #INTERNAL}</li>
 * </ul>
 *
 * <p>캐시 미스는 오류가 아니므로 여기에 포함되지 않습니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public enum ErrorKind {

    /** 잘못된 입력 (범위를 벗어난 설정, 누락된 인자 등). */
    VALIDATION,

    /** Rate Limiter가 로컬에서 거부함. 재시도하지 않습니다. */
    RATE_LIMITED,

    /** Circuit Breaker가 OPEN 상태라 I/O 없이 거부함. 재시도하지 않습니다. */
    CIRCUIT_OPEN,

    /** 연결 수준 실패 (연결 거부, 리셋 등). */
    CONNECTION,

    /** 시도 단위 타임아웃 초과. */
    TIMEOUT,

    /** 재시도 대상이 아닌 HTTP 상태 코드 수신 (예: 404). */
    HTTP_STATUS,

    /** 모든 시도를 소진함. 시도 횟수가 함께 기록됩니다. */
    RETRY_EXHAUSTED,

    /** Gateway가 알 수 없는 인터페이스 또는 오퍼레이션. */
    DISPATCH,

    /** 예상하지 못한 내부 오류 (컴포넌트 생성 실패 포함). */
    INTERNAL;

    /**
     * 호출자가 나중에 같은 요청을 다시 보내볼 만한지 여부.
     *
     * @return 일시적 상황으로 분류되면 true
     */
    public boolean isTransient() {
        return this == RATE_LIMITED
            || this == CIRCUIT_OPEN
            || this == CONNECTION
            || this == TIMEOUT
            || this == RETRY_EXHAUSTED;
    }
}
