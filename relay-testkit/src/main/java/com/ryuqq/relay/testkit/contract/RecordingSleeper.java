package com.ryuqq.relay.testkit.contract;

import com.ryuqq.relay.core.time.Sleeper;

import java.util.ArrayList;
import java.util.List;

/**
 * Sleeper that records requested back-off delays instead of blocking.
 *
 * <p>When linked to a {@link ManualMonotonicClock}, each sleep also advances that clock,
 * so time-based protections observe the back-off as elapsed time.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class RecordingSleeper implements Sleeper {

    private final List<Long> sleeps = new ArrayList<>();
    private final ManualMonotonicClock clock;

    public RecordingSleeper() {
        this(null);
    }

    /**
     * @param clock clock to advance on each sleep (nullable)
     */
    public RecordingSleeper(ManualMonotonicClock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized void sleep(long millis) {
        if (millis < 0) {
            throw new IllegalArgumentException("millis cannot be negative (current: " + millis + ")");
        }
        sleeps.add(millis);
        if (clock != null) {
            clock.advanceMillis(millis);
        }
    }

    public synchronized List<Long> sleeps() {
        return List.copyOf(sleeps);
    }

    public synchronized long totalSleptMillis() {
        long total = 0;
        for (Long millis : sleeps) {
            total += millis;
        }
        return total;
    }

    public synchronized void clear() {
        sleeps.clear();
    }
}
