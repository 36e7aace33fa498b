package com.ryuqq.relay.core.spi.transport;

import java.util.Map;

/**
 * One HTTP response as returned by {@link HttpTransport}.
 *
 * @param statusCode HTTP status code
 * @param headers response headers (first value per name)
 * @param body response body as text, empty when absent
 * @author Relay Team
 * @since 1.0.0
 */
public record TransportResponse(int statusCode, Map<String, String> headers, String body) {

    public TransportResponse {
        if (statusCode < 100 || statusCode > 599) {
            throw new IllegalArgumentException("statusCode must be between 100 and 599 (current: " + statusCode + ")");
        }
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        body = body == null ? "" : body;
    }

    public static TransportResponse of(int statusCode, String body) {
        return new TransportResponse(statusCode, Map.of(), body);
    }

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }
}
