package com.ryuqq.relay.core.spi;

import java.time.Instant;
import java.util.List;

/**
 * Registry statistics.
 *
 * @param instanceCount number of registered instances
 * @param entries one entry per registered name, sorted by name
 * @author Relay Team
 * @since 1.0.0
 */
public record SingletonStats(int instanceCount, List<Entry> entries) {

    public SingletonStats {
        if (instanceCount < 0) {
            throw new IllegalArgumentException("instanceCount cannot be negative (current: " + instanceCount + ")");
        }
        entries = entries == null ? List.of() : List.copyOf(entries);
    }

    /**
     * Per-name statistics.
     *
     * @param name component name
     * @param type simple class name of the instance
     * @param createdAt wall-clock creation time
     * @param accessCount number of lookups that returned this instance
     */
    public record Entry(String name, String type, Instant createdAt, long accessCount) {
    }
}
