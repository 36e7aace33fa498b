/**
 * Transport SPI: single HTTP exchanges and persistent text connections.
 *
 * <p>Transports perform I/O only. Retry, rate limiting and circuit breaking
 * belong to the clients in {@code relay-adapter-runner}.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
package com.ryuqq.relay.core.spi.transport;
