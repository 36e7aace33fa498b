package com.ryuqq.relay.core.spi.cache;

import java.util.Optional;

/**
 * Bounded key-value cache with per-entry TTL and pressure-aware eviction.
 *
 * <p>A miss is a normal negative result, never an error. An entry whose age
 * exceeds its TTL is never returned; reading it removes it.</p>
 *
 * <p><strong>Maintenance:</strong> every write runs a maintenance pass staged by
 * memory pressure (see {@link PressureLevel}). {@link #maintain()} runs the same
 * pass on demand.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public interface Cache {

    /**
     * @param key cache key, non-blank
     * @return the live value, or empty on miss or expiry
     */
    Optional<Object> get(String key);

    /**
     * Stores a value with the given TTL.
     *
     * <p>A TTL of zero or less means the configured default. A TTL above
     * {@link CacheConfig#maxTtlSeconds()} is capped.</p>
     *
     * @param key cache key, non-blank
     * @param value value, non-null
     * @param ttlSeconds time to live in seconds
     * @return true if the value was stored, false if it alone exceeds the byte budget
     */
    boolean set(String key, Object value, long ttlSeconds);

    /**
     * Stores a value with the default TTL.
     */
    default boolean set(String key, Object value) {
        return set(key, value, 0);
    }

    /**
     * @return true if a live (non-expired) entry exists
     */
    boolean exists(String key);

    /**
     * @return true if an entry was removed
     */
    boolean invalidate(String key);

    /**
     * Removes every entry.
     *
     * @return number of removed entries
     */
    int clear();

    /**
     * Removes every expired entry.
     *
     * @return number of removed entries
     */
    int cleanupExpired();

    /**
     * Runs the pressure-staged maintenance pass.
     *
     * @return the pressure level observed before the pass
     */
    PressureLevel maintain();

    CacheStats stats();

    CacheConfig getConfig();
}
