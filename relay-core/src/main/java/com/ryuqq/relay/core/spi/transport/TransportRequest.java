package com.ryuqq.relay.core.spi.transport;

import com.ryuqq.relay.core.model.HttpMethod;

import java.net.URI;
import java.time.Duration;
import java.util.Map;

/**
 * One HTTP request as seen by {@link HttpTransport}.
 *
 * @param method HTTP method
 * @param uri absolute target URI including query string
 * @param headers request headers
 * @param body serialised body, or null
 * @param timeout per-attempt timeout
 * @author Relay Team
 * @since 1.0.0
 */
public record TransportRequest(
    HttpMethod method,
    URI uri,
    Map<String, String> headers,
    String body,
    Duration timeout
) {

    public TransportRequest {
        if (method == null) {
            throw new IllegalArgumentException("method cannot be null");
        }
        if (uri == null || !uri.isAbsolute()) {
            throw new IllegalArgumentException("uri must be absolute (current: " + uri + ")");
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive (current: " + timeout + ")");
        }
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }
}
