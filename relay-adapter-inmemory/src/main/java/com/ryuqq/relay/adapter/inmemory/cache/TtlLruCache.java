package com.ryuqq.relay.adapter.inmemory.cache;

import com.ryuqq.relay.core.spi.cache.Cache;
import com.ryuqq.relay.core.spi.cache.CacheConfig;
import com.ryuqq.relay.core.spi.cache.CacheStats;
import com.ryuqq.relay.core.spi.cache.PressureLevel;
import com.ryuqq.relay.core.time.MonotonicClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * TTL과 LRU 제거, 메모리 압력 단계를 갖춘 인메모리 캐시.
 *
 * <p>{@link LinkedHashMap}의 access-order 모드로 LRU 순서를 유지합니다.
 * 모든 상태는 캐시 인스턴스의 고유 락으로 보호됩니다.</p>
 *
 * <p><strong>만료:</strong> 항목의 나이가 TTL을 초과하면 만료입니다 (TTL과 같으면 아직 유효).
 * 만료 항목은 조회 시점에 제거되고 미스로 처리됩니다.</p>
 *
 * <p><strong>쓰기 후 유지보수 (압력 = 추정 바이트 / maxBytes):</strong></p>
 * <pre>
 * NORMAL     (&lt; warning)    → 없음
 * WARNING    (&gt;= warning)   → 만료 항목 정리
 * CRITICAL   (&gt;= critical)  → 만료 정리 후 warning 미만까지 LRU 제거
 * EMERGENCY  (&gt;= emergency) → CRITICAL과 동일, WARN 로그
 * CLEAR_ALL  (&gt; clearAll)   → 전체 비움
 * </pre>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class TtlLruCache implements Cache {

    private static final Logger log = LoggerFactory.getLogger(TtlLruCache.class);

    private static final long NANOS_PER_SECOND = 1_000_000_000L;

    private final CacheConfig config;
    private final MonotonicClock clock;
    private final CacheSizeEstimator sizeEstimator;

    private LinkedHashMap<String, Entry> entries = newEntryMap();
    private long estimatedBytes;

    private long hits;
    private long misses;
    private long expirations;
    private long evictions;
    private long emergencyClears;

    public TtlLruCache(CacheConfig config, MonotonicClock clock) {
        this(config, clock, CacheSizeEstimator.defaults());
    }

    public TtlLruCache(CacheConfig config, MonotonicClock clock, CacheSizeEstimator sizeEstimator) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (sizeEstimator == null) {
            throw new IllegalArgumentException("sizeEstimator cannot be null");
        }
        this.config = config;
        this.clock = clock;
        this.sizeEstimator = sizeEstimator;
    }

    @Override
    public synchronized Optional<Object> get(String key) {
        validateKey(key);
        Entry entry = entries.get(key);
        if (entry == null) {
            misses++;
            return Optional.empty();
        }
        if (entry.isExpired(clock.nowNanos())) {
            removeEntry(key);
            expirations++;
            misses++;
            log.debug("Cache entry expired on read: key={}", key);
            return Optional.empty();
        }
        hits++;
        return Optional.of(entry.value);
    }

    @Override
    public synchronized boolean set(String key, Object value, long ttlSeconds) {
        validateKey(key);
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }

        long size = Math.max(1, sizeEstimator.estimate(key, value));
        if (size > config.maxBytes()) {
            log.warn("Cache write rejected, value exceeds byte budget: key={}, size={}, maxBytes={}",
                key, size, config.maxBytes());
            return false;
        }

        removeEntry(key);
        if (entries.size() >= config.maxEntries()) {
            evictEldest();
        }

        long ttl = config.effectiveTtlSeconds(ttlSeconds);
        entries.put(key, new Entry(value, clock.nowNanos(), ttl, size));
        estimatedBytes += size;

        runMaintenance(key);
        return true;
    }

    @Override
    public synchronized boolean exists(String key) {
        validateKey(key);
        Entry entry = entries.get(key);
        if (entry == null) {
            return false;
        }
        if (entry.isExpired(clock.nowNanos())) {
            removeEntry(key);
            expirations++;
            return false;
        }
        return true;
    }

    @Override
    public synchronized boolean invalidate(String key) {
        validateKey(key);
        return removeEntry(key);
    }

    @Override
    public synchronized int clear() {
        int removed = entries.size();
        entries = newEntryMap();
        estimatedBytes = 0;
        return removed;
    }

    @Override
    public synchronized int cleanupExpired() {
        long now = clock.nowNanos();
        int removed = 0;
        Iterator<Map.Entry<String, Entry>> iterator = entries.entrySet().iterator();
        while (iterator.hasNext()) {
            Entry entry = iterator.next().getValue();
            if (entry.isExpired(now)) {
                iterator.remove();
                estimatedBytes -= entry.sizeEstimate;
                removed++;
            }
        }
        expirations += removed;
        if (removed > 0) {
            log.debug("Expired cache entries removed: count={}", removed);
        }
        return removed;
    }

    @Override
    public synchronized PressureLevel maintain() {
        return runMaintenance(null);
    }

    @Override
    public synchronized CacheStats stats() {
        return new CacheStats(
            entries.size(),
            estimatedBytes,
            config.maxBytes(),
            hits,
            misses,
            expirations,
            evictions,
            emergencyClears,
            currentLevel()
        );
    }

    @Override
    public CacheConfig getConfig() {
        return config;
    }

    /**
     * 압력 단계별 정리. {@code retainedKey}는 방금 기록한 키로, 어떤 단계에서도 제거하지 않습니다.
     */
    private PressureLevel runMaintenance(String retainedKey) {
        PressureLevel level = currentLevel();
        switch (level) {
            case NORMAL:
                break;
            case WARNING:
                cleanupExpired();
                break;
            case CRITICAL:
                cleanupExpired();
                evictUntilBelowWarning(retainedKey);
                break;
            case EMERGENCY:
                log.warn("Cache memory pressure is at emergency level: bytes={}, maxBytes={}",
                    estimatedBytes, config.maxBytes());
                cleanupExpired();
                evictUntilBelowWarning(retainedKey);
                break;
            case CLEAR_ALL:
                cleanupExpired();
                evictUntilBelowWarning(retainedKey);
                if (currentLevel() == PressureLevel.CLEAR_ALL) {
                    int removed = clearExcept(retainedKey);
                    emergencyClears++;
                    log.warn("Cache cleared under memory pressure: removed={}, retainedKey={}, bytes={}, maxBytes={}",
                        removed, retainedKey, estimatedBytes, config.maxBytes());
                }
                break;
            default:
                throw new IllegalStateException("Unknown pressure level: " + level);
        }
        return level;
    }

    private void evictUntilBelowWarning(String retainedKey) {
        long target = (long) (config.maxBytes() * config.warningRatio());
        int evicted = 0;
        while (estimatedBytes >= target && evictEldestExcept(retainedKey)) {
            evicted++;
        }
        if (evicted > 0) {
            log.info("Cache LRU eviction: evicted={}, bytes={}, maxBytes={}", evicted, estimatedBytes, config.maxBytes());
        }
    }

    private boolean evictEldestExcept(String retainedKey) {
        Iterator<Map.Entry<String, Entry>> iterator = entries.entrySet().iterator();
        while (iterator.hasNext()) {
            Map.Entry<String, Entry> eldest = iterator.next();
            if (eldest.getKey().equals(retainedKey)) {
                continue;
            }
            iterator.remove();
            estimatedBytes -= eldest.getValue().sizeEstimate;
            evictions++;
            return true;
        }
        return false;
    }

    private int clearExcept(String retainedKey) {
        Entry retained = retainedKey == null ? null : entries.get(retainedKey);
        int removed = clear();
        if (retained != null) {
            entries.put(retainedKey, retained);
            estimatedBytes = retained.sizeEstimate;
            removed--;
        }
        return removed;
    }

    private void evictEldest() {
        Iterator<Map.Entry<String, Entry>> iterator = entries.entrySet().iterator();
        if (iterator.hasNext()) {
            Entry eldest = iterator.next().getValue();
            iterator.remove();
            estimatedBytes -= eldest.sizeEstimate;
            evictions++;
        }
    }

    private boolean removeEntry(String key) {
        Entry removed = entries.remove(key);
        if (removed == null) {
            return false;
        }
        estimatedBytes -= removed.sizeEstimate;
        return true;
    }

    private PressureLevel currentLevel() {
        return PressureLevel.of((double) estimatedBytes / config.maxBytes(), config);
    }

    private static void validateKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key cannot be null or blank");
        }
    }

    private static LinkedHashMap<String, Entry> newEntryMap() {
        return new LinkedHashMap<>(16, 0.75f, true);
    }

    private static final class Entry {

        private final Object value;
        private final long insertedAtNanos;
        private final long ttlSeconds;
        private final long sizeEstimate;

        private Entry(Object value, long insertedAtNanos, long ttlSeconds, long sizeEstimate) {
            this.value = value;
            this.insertedAtNanos = insertedAtNanos;
            this.ttlSeconds = ttlSeconds;
            this.sizeEstimate = sizeEstimate;
        }

        private boolean isExpired(long nowNanos) {
            return nowNanos - insertedAtNanos > ttlSeconds * NANOS_PER_SECOND;
        }
    }
}
