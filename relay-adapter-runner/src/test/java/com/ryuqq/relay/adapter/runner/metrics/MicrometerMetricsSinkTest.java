package com.ryuqq.relay.adapter.runner.metrics;

import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * MicrometerMetricsSink 유닛 테스트.
 *
 * @author Relay Team
 * @since 1.0.0
 */
class MicrometerMetricsSinkTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final MicrometerMetricsSink sink = new MicrometerMetricsSink(registry);

    @Test
    void increment는_같은_카운터를_누적() {
        // when
        sink.increment("relay.http.requests");
        sink.increment("relay.http.requests");
        sink.record("relay.http.requests", 3, null);

        // then
        assertThat(registry.get("relay.http.requests").counter().count()).isEqualTo(5.0);
    }

    @Test
    void record_count가_아닌_단위는_DistributionSummary() {
        // when
        sink.record("relay.http.duration", 120, "milliseconds");
        sink.record("relay.http.duration", 80, "milliseconds");

        // then
        DistributionSummary summary = registry.get("relay.http.duration").summary();
        assertThat(summary.count()).isEqualTo(2);
        assertThat(summary.totalAmount()).isEqualTo(200.0);
    }

    @Test
    void record_유한하지_않은_값은_무시() {
        // when
        sink.record("relay.cache.usage", Double.NaN, "ratio");

        // then
        assertThat(registry.find("relay.cache.usage").meter()).isNull();
    }

    @Test
    void record_빈_이름은_IllegalArgumentException() {
        assertThatThrownBy(() -> sink.record(" ", 1, "count"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
