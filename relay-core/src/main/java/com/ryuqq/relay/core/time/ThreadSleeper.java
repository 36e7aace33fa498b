package com.ryuqq.relay.core.time;

/**
 * {@link Thread#sleep(long)} 기반 {@link Sleeper}.
 *
 * @author Relay Team
 * @since 1.0.0
 */
public enum ThreadSleeper implements Sleeper {

    INSTANCE;

    @Override
    public void sleep(long millis) throws InterruptedException {
        if (millis > 0) {
            Thread.sleep(millis);
        }
    }
}
