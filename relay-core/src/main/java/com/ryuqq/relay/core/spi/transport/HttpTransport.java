package com.ryuqq.relay.core.spi.transport;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * Performs exactly one HTTP exchange.
 *
 * <p>Implementations never retry and never interpret status codes: any
 * received response, including 4xx and 5xx, is returned normally. Only
 * transport-level problems are signalled as exceptions.</p>
 *
 * <p><strong>Exception contract:</strong></p>
 * <ul>
 *   <li>{@link TimeoutException}: {@link TransportRequest#timeout()} elapsed</li>
 *   <li>{@link IOException}: connection refused, reset, DNS failure, etc.</li>
 *   <li>{@link InterruptedException}: the calling thread was interrupted</li>
 * </ul>
 *
 * @author Relay Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface HttpTransport {

    /**
     * @param request request to send
     * @return the response, whatever its status code
     */
    TransportResponse send(TransportRequest request) throws IOException, TimeoutException, InterruptedException;
}
