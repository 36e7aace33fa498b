package com.ryuqq.relay.adapter.runner.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * RelaySettings 유닛 테스트.
 *
 * @author Relay Team
 * @since 1.0.0
 */
class RelaySettingsTest {

    @Test
    void fromConfig_reference_conf만_있으면_기본값과_같음() {
        // when
        RelaySettings settings = RelaySettings.fromConfig(ConfigFactory.defaultReference());

        // then
        assertThat(settings).isEqualTo(RelaySettings.defaults());
    }

    @Test
    void fromConfig_지정한_값만_덮어씀() {
        // given
        Config config = ConfigFactory.parseString(
            "relay {\n"
                + "  user-agent = \"Kitchen-Bridge/2.0\"\n"
                + "  retry { max-attempts = 5, retriable-status-codes = [502, 503] }\n"
                + "  rate-limit.window-ms = 2000\n"
                + "  circuit-breaker.recovery-timeout-ms = 30000\n"
                + "  cache.default-ttl-seconds = 60\n"
                + "}")
            .withFallback(ConfigFactory.defaultReference());

        // when
        RelaySettings settings = RelaySettings.fromConfig(config);

        // then
        assertThat(settings.userAgent()).isEqualTo("Kitchen-Bridge/2.0");
        assertThat(settings.retryPolicy().maxAttempts()).isEqualTo(5);
        assertThat(settings.retryPolicy().backoffBaseMs()).isEqualTo(100);
        assertThat(settings.retryPolicy().retriableStatusCodes()).isEqualTo(Set.of(502, 503));
        assertThat(settings.rateLimit().window()).isEqualTo(Duration.ofSeconds(2));
        assertThat(settings.rateLimit().maxOperations()).isEqualTo(500);
        assertThat(settings.circuitBreaker().recoveryTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(settings.cache().defaultTtlSeconds()).isEqualTo(60);
    }

    @Test
    void fromConfig_빈_설정은_레코드_기본값을_사용() {
        // when
        RelaySettings settings = RelaySettings.fromConfig(ConfigFactory.empty());

        // then
        assertThat(settings).isEqualTo(RelaySettings.defaults());
    }

    @Test
    void fromConfig_범위를_벗어난_값은_IllegalArgumentException() {
        // given
        Config config = ConfigFactory.parseString("relay.circuit-breaker.recovery-timeout-ms = 5000");

        // when & then
        assertThatThrownBy(() -> RelaySettings.fromConfig(config))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("recoveryTimeout");
    }

    @Test
    void parseStatusCodes_클래스_표기를_확장() {
        // when
        Set<Integer> codes = RelaySettings.parseStatusCodes("408, 429, 5xx");

        // then
        assertThat(codes).hasSize(102);
        assertThat(codes).contains(408, 429, 500, 503, 599);
        assertThat(codes).doesNotContain(404);
    }

    @Test
    void parseStatusCodes_숫자가_아닌_항목은_IllegalArgumentException() {
        assertThatThrownBy(() -> RelaySettings.parseStatusCodes("503,teapot"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("teapot");
    }
}
