package com.ryuqq.relay.core.spi.transport;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * An open text-message connection.
 *
 * <p>{@link #close()} is idempotent and never throws; the connection is
 * unusable afterwards.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public interface PersistentConnection extends AutoCloseable {

    /**
     * Sends one text message.
     *
     * @throws IOException if the connection is closed or the send fails
     */
    void send(String message) throws IOException;

    /**
     * Waits for the next text message.
     *
     * @param timeout maximum wait
     * @return the message
     * @throws TimeoutException if nothing arrives in time
     * @throws IOException if the connection closes or fails while waiting
     */
    String receive(Duration timeout) throws IOException, TimeoutException, InterruptedException;

    boolean isOpen();

    @Override
    void close();
}
