package com.ryuqq.relay.core.spi;

import java.util.Optional;

/**
 * Read-only configuration lookup.
 *
 * <p>Keys are dot separated paths relative to the {@code relay} root
 * (e.g. {@code retry.max-attempts}).</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public interface ConfigProvider {

    /**
     * @param key dot separated key
     * @return raw value, or empty when the key is absent
     */
    Optional<String> get(String key);

    default String getString(String key, String defaultValue) {
        return get(key).orElse(defaultValue);
    }

    /**
     * @throws IllegalArgumentException if the value is present but not an integer
     */
    default int getInt(String key, int defaultValue) {
        Optional<String> value = get(key);
        if (value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.get().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Config key '" + key + "' is not an integer: " + value.get(), e);
        }
    }

    /**
     * @throws IllegalArgumentException if the value is present but not a long
     */
    default long getLong(String key, long defaultValue) {
        Optional<String> value = get(key);
        if (value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.get().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Config key '" + key + "' is not a long: " + value.get(), e);
        }
    }

    /**
     * @throws IllegalArgumentException if the value is present but not a number
     */
    default double getDouble(String key, double defaultValue) {
        Optional<String> value = get(key);
        if (value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.get().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Config key '" + key + "' is not a number: " + value.get(), e);
        }
    }
}
