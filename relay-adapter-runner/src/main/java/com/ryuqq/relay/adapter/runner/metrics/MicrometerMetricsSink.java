package com.ryuqq.relay.adapter.runner.metrics;

import com.ryuqq.relay.core.spi.MetricsSink;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Micrometer {@link MeterRegistry}로 위임하는 {@link MetricsSink}.
 *
 * <ul>
 *   <li>단위가 {@code count}인 값: {@link Counter} 증가</li>
 *   <li>그 외 단위: 해당 단위를 baseUnit으로 갖는 {@link DistributionSummary} 기록</li>
 * </ul>
 *
 * <p>Micrometer가 이름과 태그로 미터를 캐싱하므로 같은 이름의 반복 기록은 같은 미터를 사용합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class MicrometerMetricsSink implements MetricsSink {

    private static final Logger log = LoggerFactory.getLogger(MicrometerMetricsSink.class);

    private static final String COUNT_UNIT = "count";

    private final MeterRegistry registry;

    public MicrometerMetricsSink(MeterRegistry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        this.registry = registry;
    }

    @Override
    public void record(String name, double value, String unit) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("metric name cannot be null or blank");
        }
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            log.debug("Ignoring non-finite metric value: name={}, value={}", name, value);
            return;
        }

        if (unit == null || COUNT_UNIT.equals(unit)) {
            Counter.builder(name)
                .description("Relay counter " + name)
                .register(registry)
                .increment(value);
            return;
        }

        DistributionSummary.builder(name)
            .baseUnit(unit)
            .description("Relay measurement " + name)
            .register(registry)
            .record(value);
    }

    public MeterRegistry getRegistry() {
        return registry;
    }
}
