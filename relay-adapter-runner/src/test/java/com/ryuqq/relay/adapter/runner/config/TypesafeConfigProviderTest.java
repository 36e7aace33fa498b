package com.ryuqq.relay.adapter.runner.config;

import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * TypesafeConfigProvider 유닛 테스트.
 *
 * @author Relay Team
 * @since 1.0.0
 */
class TypesafeConfigProviderTest {

    private final TypesafeConfigProvider provider = new TypesafeConfigProvider(ConfigFactory.parseString(
        "relay {\n"
            + "  name = kitchen\n"
            + "  retry.max-attempts = 4\n"
            + "  retry.backoff-multiplier = 1.5\n"
            + "  codes = [\"408\", 503]\n"
            + "}"));

    @Test
    void get_스칼라_값은_문자열로_반환() {
        assertThat(provider.get("relay.name")).hasValue("kitchen");
        assertThat(provider.getInt("relay.retry.max-attempts", 3)).isEqualTo(4);
        assertThat(provider.getDouble("relay.retry.backoff-multiplier", 2.0)).isEqualTo(1.5);
    }

    @Test
    void get_리스트는_쉼표로_연결() {
        assertThat(provider.get("relay.codes")).hasValue("408,503");
    }

    @Test
    void get_없는_키는_empty이고_기본값_사용() {
        assertThat(provider.get("relay.missing")).isEmpty();
        assertThat(provider.getLong("relay.missing", 42L)).isEqualTo(42L);
    }

    @Test
    void get_객체_경로는_IllegalArgumentException() {
        assertThatThrownBy(() -> provider.get("relay.retry"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("object");
    }

    @Test
    void get_잘못된_경로는_IllegalArgumentException() {
        assertThatThrownBy(() -> provider.get("relay..name"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void getInt_정수가_아니면_IllegalArgumentException() {
        assertThatThrownBy(() -> provider.getInt("relay.name", 0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("relay.name");
    }
}
