package com.ryuqq.relay.adapter.inmemory.config;

import com.ryuqq.relay.core.spi.ConfigProvider;

import java.util.Map;
import java.util.Optional;

/**
 * Map-backed {@link ConfigProvider}.
 *
 * <p>Used by tests and by hosts that assemble configuration themselves.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class InMemoryConfigProvider implements ConfigProvider {

    private final Map<String, String> values;

    public InMemoryConfigProvider(Map<String, String> values) {
        if (values == null) {
            throw new IllegalArgumentException("values cannot be null");
        }
        this.values = Map.copyOf(values);
    }

    public static InMemoryConfigProvider empty() {
        return new InMemoryConfigProvider(Map.of());
    }

    @Override
    public Optional<String> get(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key cannot be null or blank");
        }
        return Optional.ofNullable(values.get(key));
    }
}
