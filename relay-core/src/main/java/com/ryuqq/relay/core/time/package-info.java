/**
 * Time abstractions.
 *
 * <p>All elapsed-time logic reads {@link com.ryuqq.relay.core.time.MonotonicClock}
 * and all backoff waits go through {@link com.ryuqq.relay.core.time.Sleeper},
 * so every timing decision can be driven deterministically from tests.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
package com.ryuqq.relay.core.time;
