package com.ryuqq.relay.core.spi.cache;

/**
 * Cache 통계.
 *
 * @param entries 현재 항목 수
 * @param estimatedBytes 현재 추정 바이트
 * @param maxBytes 바이트 상한
 * @param hits 적중 횟수
 * @param misses 미스 횟수 (만료 포함)
 * @param expirations 만료로 제거된 항목 수
 * @param evictions 용량/압력으로 제거된 항목 수
 * @param emergencyClears 전체 비움 횟수
 * @param pressureLevel 현재 압력 단계
 * @author Relay Team
 * @since 1.0.0
 */
public record CacheStats(
    int entries,
    long estimatedBytes,
    long maxBytes,
    long hits,
    long misses,
    long expirations,
    long evictions,
    long emergencyClears,
    PressureLevel pressureLevel
) {

    /**
     * @return 적중률 (조회가 없으면 0.0)
     */
    public double hitRate() {
        long lookups = hits + misses;
        return lookups == 0 ? 0.0 : (double) hits / lookups;
    }

    /**
     * @return 추정 바이트 / maxBytes
     */
    public double usageRatio() {
        return (double) estimatedBytes / maxBytes;
    }
}
