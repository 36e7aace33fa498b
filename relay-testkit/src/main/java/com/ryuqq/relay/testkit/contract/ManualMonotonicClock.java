package com.ryuqq.relay.testkit.contract;

import com.ryuqq.relay.core.time.MonotonicClock;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Monotonic clock that only moves when a test advances it.
 *
 * <p>Lets contract tests cross TTL, window and recovery boundaries deterministically.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class ManualMonotonicClock implements MonotonicClock {

    private final AtomicLong nowNanos = new AtomicLong();

    @Override
    public long nowNanos() {
        return nowNanos.get();
    }

    /**
     * Advances the clock.
     *
     * @param nanos nanoseconds to move forward
     * @throws IllegalArgumentException if nanos is negative
     */
    public void advanceNanos(long nanos) {
        if (nanos < 0) {
            throw new IllegalArgumentException("clock cannot move backwards (current: " + nanos + ")");
        }
        nowNanos.addAndGet(nanos);
    }

    public void advanceMillis(long millis) {
        advanceNanos(Duration.ofMillis(millis).toNanos());
    }

    public void advance(Duration duration) {
        if (duration == null) {
            throw new IllegalArgumentException("duration cannot be null");
        }
        advanceNanos(duration.toNanos());
    }
}
