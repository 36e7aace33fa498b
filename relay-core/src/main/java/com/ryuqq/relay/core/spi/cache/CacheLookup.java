package com.ryuqq.relay.core.spi.cache;

import java.util.Optional;

/**
 * {@code cache.get} 결과.
 *
 * <p>미스는 오류가 아니므로 성공 결과 안에 {@link #miss()}로 표현됩니다.</p>
 *
 * @param hit 적중 여부
 * @param value 적중 시 값 (미스이면 null)
 * @author Relay Team
 * @since 1.0.0
 */
public record CacheLookup(boolean hit, Object value) {

    private static final CacheLookup MISS = new CacheLookup(false, null);

    public CacheLookup {
        if (hit && value == null) {
            throw new IllegalArgumentException("hit lookup must carry a value");
        }
        if (!hit && value != null) {
            throw new IllegalArgumentException("miss lookup cannot carry a value");
        }
    }

    public static CacheLookup hit(Object value) {
        return new CacheLookup(true, value);
    }

    public static CacheLookup miss() {
        return MISS;
    }

    public static CacheLookup from(Optional<Object> value) {
        return value.map(CacheLookup::hit).orElse(MISS);
    }

    public Optional<Object> asOptional() {
        return Optional.ofNullable(value);
    }
}
