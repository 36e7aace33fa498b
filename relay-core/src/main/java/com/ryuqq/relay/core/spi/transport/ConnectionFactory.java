package com.ryuqq.relay.core.spi.transport;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Opens persistent (WebSocket) connections.
 *
 * @author Relay Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ConnectionFactory {

    /**
     * Opens a connection, waiting at most {@code connectTimeout}.
     *
     * @param uri {@code ws://} or {@code wss://} URI
     * @param headers handshake headers
     * @param connectTimeout upper bound for the handshake
     * @return an open connection, owned by the caller
     * @throws TimeoutException if the handshake does not finish in time
     * @throws IOException if the handshake fails
     */
    PersistentConnection open(URI uri, Map<String, String> headers, Duration connectTimeout)
        throws IOException, TimeoutException, InterruptedException;
}
