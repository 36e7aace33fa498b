package com.ryuqq.relay.core.spi.cache;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * CacheConfig, PressureLevel, CacheLookup 테스트.
 *
 * @author Relay Team
 * @since 1.0.0
 */
@DisplayName("CacheConfig 테스트")
class CacheConfigTest {

    @Test
    @DisplayName("TTL이 0 이하이면 기본 TTL, 상한을 넘으면 maxTtl로 잘린다")
    void effectiveTtlSeconds_기본값과_상한() {
        // given
        CacheConfig config = CacheConfig.defaults();

        // when & then
        assertThat(config.effectiveTtlSeconds(0)).isEqualTo(300);
        assertThat(config.effectiveTtlSeconds(-5)).isEqualTo(300);
        assertThat(config.effectiveTtlSeconds(60)).isEqualTo(60);
        assertThat(config.effectiveTtlSeconds(999_999)).isEqualTo(3600);
    }

    @Test
    @DisplayName("압력 비율은 warning < critical < emergency < clearAll 순서여야 한다")
    void constructor_압력_비율_순서_검증() {
        assertThatThrownBy(() -> CacheConfig.defaults().withPressureRatios(0.9, 0.85, 0.95, 0.98))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("pressure ratios");
    }

    @Test
    @DisplayName("maxTtl은 기본 TTL보다 작을 수 없다")
    void constructor_maxTtl_검증() {
        assertThatThrownBy(() -> CacheConfig.defaults().withMaxTtlSeconds(10))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("사용 비율에 따라 압력 단계가 결정된다")
    void pressureLevel_비율별_단계() {
        // given
        CacheConfig config = CacheConfig.defaults();

        // when & then
        assertThat(PressureLevel.of(0.10, config)).isEqualTo(PressureLevel.NORMAL);
        assertThat(PressureLevel.of(0.75, config)).isEqualTo(PressureLevel.WARNING);
        assertThat(PressureLevel.of(0.86, config)).isEqualTo(PressureLevel.CRITICAL);
        assertThat(PressureLevel.of(0.95, config)).isEqualTo(PressureLevel.EMERGENCY);
        assertThat(PressureLevel.of(0.98, config)).isEqualTo(PressureLevel.EMERGENCY);
        assertThat(PressureLevel.of(0.99, config)).isEqualTo(PressureLevel.CLEAR_ALL);
    }

    @Test
    @DisplayName("CacheLookup 미스는 값을 가질 수 없다")
    void cacheLookup_미스와_적중() {
        assertThat(CacheLookup.miss().hit()).isFalse();
        assertThat(CacheLookup.from(Optional.empty())).isEqualTo(CacheLookup.miss());
        assertThat(CacheLookup.from(Optional.of("v")).value()).isEqualTo("v");
        assertThatThrownBy(() -> new CacheLookup(false, "v")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CacheLookup(true, null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("CacheStats 적중률과 사용 비율")
    void cacheStats_비율_계산() {
        // given
        CacheStats stats = new CacheStats(2, 50, 100, 3, 1, 0, 0, 0, PressureLevel.NORMAL);

        // when & then
        assertThat(stats.hitRate()).isEqualTo(0.75);
        assertThat(stats.usageRatio()).isEqualTo(0.5);
    }
}
