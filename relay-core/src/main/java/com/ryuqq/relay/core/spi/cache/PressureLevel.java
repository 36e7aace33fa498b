package com.ryuqq.relay.core.spi.cache;

/**
 * 캐시 메모리 압력 단계.
 *
 * @author Relay Team
 * @since 1.0.0
 */
public enum PressureLevel {

    /** warning 미만. 아무것도 하지 않음. */
    NORMAL,

    /** 만료 항목 정리. */
    WARNING,

    /** LRU 제거. */
    CRITICAL,

    /** LRU 제거, WARN 로그. */
    EMERGENCY,

    /** 전체 비움. */
    CLEAR_ALL;

    /**
     * 사용 비율에 해당하는 단계.
     *
     * @param usageRatio 추정 바이트 / maxBytes
     * @param config 단계 경계
     * @return PressureLevel
     */
    public static PressureLevel of(double usageRatio, CacheConfig config) {
        if (usageRatio > config.clearAllRatio()) {
            return CLEAR_ALL;
        }
        if (usageRatio >= config.emergencyRatio()) {
            return EMERGENCY;
        }
        if (usageRatio >= config.criticalRatio()) {
            return CRITICAL;
        }
        if (usageRatio >= config.warningRatio()) {
            return WARNING;
        }
        return NORMAL;
    }
}
