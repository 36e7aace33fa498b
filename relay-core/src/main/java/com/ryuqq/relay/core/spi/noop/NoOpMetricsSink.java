package com.ryuqq.relay.core.spi.noop;

import com.ryuqq.relay.core.spi.MetricsSink;

/**
 * Metrics Sink NoOp 구현.
 *
 * <p>모든 측정값을 버립니다. Metrics 백엔드가 설정되지 않았을 때의 기본값입니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class NoOpMetricsSink implements MetricsSink {

    @Override
    public void record(String name, double value, String unit) {
        // NoOp
    }
}
