package com.ryuqq.relay.adapter.runner.config;

import com.ryuqq.relay.core.spi.ConfigProvider;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigValue;

import java.util.Optional;

/**
 * Typesafe Config(HOCON) 기반 {@link ConfigProvider}.
 *
 * <p>키는 HOCON 경로 그대로 사용합니다 (예: {@code relay.retry.max-attempts}).
 * 리스트 값은 쉼표로 이어 붙인 문자열로 반환됩니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class TypesafeConfigProvider implements ConfigProvider {

    private final Config config;

    public TypesafeConfigProvider(Config config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
    }

    /**
     * {@code application.conf}와 {@code reference.conf}를 로드합니다.
     */
    public static TypesafeConfigProvider load() {
        return new TypesafeConfigProvider(ConfigFactory.load());
    }

    @Override
    public Optional<String> get(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key cannot be null or blank");
        }
        try {
            if (!config.hasPath(key)) {
                return Optional.empty();
            }
        } catch (ConfigException.BadPath e) {
            throw new IllegalArgumentException("Config key '" + key + "' is not a valid path", e);
        }

        ConfigValue value = config.getValue(key);
        return switch (value.valueType()) {
            case LIST -> Optional.of(String.join(",", config.getStringList(key)));
            case OBJECT -> throw new IllegalArgumentException("Config key '" + key + "' is an object, not a value");
            default -> Optional.of(String.valueOf(value.unwrapped()));
        };
    }

    public Config getConfig() {
        return config;
    }
}
