package com.ryuqq.relay.core.spi.cache;

/**
 * Cache 설정.
 *
 * <p><strong>압력 단계 (추정 바이트 / maxBytes):</strong></p>
 * <ul>
 *   <li>warningRatio (기본 0.75): 만료 항목 정리</li>
 *   <li>criticalRatio (기본 0.85): warning 아래로 내려갈 때까지 LRU 제거</li>
 *   <li>emergencyRatio (기본 0.95): criticalRatio와 같은 제거, WARN 로그</li>
 *   <li>clearAllRatio (기본 0.98): 제거 후에도 넘으면 전체 비움</li>
 * </ul>
 *
 * @param defaultTtlSeconds TTL 미지정 시 적용 (기본 300)
 * @param maxTtlSeconds TTL 상한 (기본 3600)
 * @param maxEntries 항목 수 상한 (기본 10000)
 * @param maxBytes 추정 바이트 상한 (기본 100MiB)
 * @param warningRatio warning 단계 비율
 * @param criticalRatio critical 단계 비율
 * @param emergencyRatio emergency 단계 비율
 * @param clearAllRatio 전체 비움 비율
 * @author Relay Team
 * @since 1.0.0
 */
public record CacheConfig(
    long defaultTtlSeconds,
    long maxTtlSeconds,
    int maxEntries,
    long maxBytes,
    double warningRatio,
    double criticalRatio,
    double emergencyRatio,
    double clearAllRatio
) {

    private static final CacheConfig DEFAULTS =
        new CacheConfig(300, 3600, 10_000, 100L * 1024 * 1024, 0.75, 0.85, 0.95, 0.98);

    public CacheConfig {
        if (defaultTtlSeconds <= 0) {
            throw new IllegalArgumentException("defaultTtlSeconds must be positive (current: " + defaultTtlSeconds + ")");
        }
        if (maxTtlSeconds < defaultTtlSeconds) {
            throw new IllegalArgumentException(
                "maxTtlSeconds must be >= defaultTtlSeconds (current: " + maxTtlSeconds + " < " + defaultTtlSeconds + ")");
        }
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive (current: " + maxEntries + ")");
        }
        if (maxBytes <= 0) {
            throw new IllegalArgumentException("maxBytes must be positive (current: " + maxBytes + ")");
        }
        if (!(0 < warningRatio && warningRatio < criticalRatio && criticalRatio < emergencyRatio
            && emergencyRatio < clearAllRatio && clearAllRatio <= 1.0)) {
            throw new IllegalArgumentException(
                "pressure ratios must satisfy 0 < warning < critical < emergency < clearAll <= 1 (current: "
                    + warningRatio + ", " + criticalRatio + ", " + emergencyRatio + ", " + clearAllRatio + ")");
        }
    }

    public static CacheConfig defaults() {
        return DEFAULTS;
    }

    /**
     * 요청된 TTL을 실제 적용할 TTL로 변환.
     *
     * @param requestedTtlSeconds 요청 TTL (0 이하이면 기본값)
     * @return 1 이상 maxTtlSeconds 이하의 TTL
     */
    public long effectiveTtlSeconds(long requestedTtlSeconds) {
        if (requestedTtlSeconds <= 0) {
            return defaultTtlSeconds;
        }
        return Math.min(requestedTtlSeconds, maxTtlSeconds);
    }

    public CacheConfig withDefaultTtlSeconds(long newDefaultTtlSeconds) {
        return new CacheConfig(newDefaultTtlSeconds, Math.max(maxTtlSeconds, newDefaultTtlSeconds), maxEntries, maxBytes,
            warningRatio, criticalRatio, emergencyRatio, clearAllRatio);
    }

    public CacheConfig withMaxTtlSeconds(long newMaxTtlSeconds) {
        return new CacheConfig(defaultTtlSeconds, newMaxTtlSeconds, maxEntries, maxBytes,
            warningRatio, criticalRatio, emergencyRatio, clearAllRatio);
    }

    public CacheConfig withMaxEntries(int newMaxEntries) {
        return new CacheConfig(defaultTtlSeconds, maxTtlSeconds, newMaxEntries, maxBytes,
            warningRatio, criticalRatio, emergencyRatio, clearAllRatio);
    }

    public CacheConfig withMaxBytes(long newMaxBytes) {
        return new CacheConfig(defaultTtlSeconds, maxTtlSeconds, maxEntries, newMaxBytes,
            warningRatio, criticalRatio, emergencyRatio, clearAllRatio);
    }

    public CacheConfig withPressureRatios(double warning, double critical, double emergency, double clearAll) {
        return new CacheConfig(defaultTtlSeconds, maxTtlSeconds, maxEntries, maxBytes,
            warning, critical, emergency, clearAll);
    }
}
