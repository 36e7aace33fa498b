package com.ryuqq.relay.core.spi;

/**
 * Outbound metrics capability.
 *
 * <p>Components report counters and gauges through this interface without
 * knowing the metrics backend.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public interface MetricsSink {

    /**
     * Records a single measurement.
     *
     * @param name metric name, dot separated (e.g. {@code relay.http.requests})
     * @param value measured value
     * @param unit unit label (e.g. {@code count}, {@code ms}, {@code bytes})
     */
    void record(String name, double value, String unit);

    /**
     * Records a count of one.
     *
     * @param name metric name
     */
    default void increment(String name) {
        record(name, 1.0, "count");
    }
}
