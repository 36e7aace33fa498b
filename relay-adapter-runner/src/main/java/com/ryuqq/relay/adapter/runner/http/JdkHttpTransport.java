package com.ryuqq.relay.adapter.runner.http;

import com.ryuqq.relay.core.spi.transport.HttpTransport;
import com.ryuqq.relay.core.spi.transport.TransportRequest;
import com.ryuqq.relay.core.spi.transport.TransportResponse;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * {@code java.net.http.HttpClient} 기반 {@link HttpTransport}.
 *
 * <p>단일 시도만 수행하며 상태 코드를 해석하지 않습니다.
 * {@link HttpTimeoutException}은 {@link TimeoutException}으로 변환됩니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class JdkHttpTransport implements HttpTransport {

    private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(5);

    private final HttpClient httpClient;

    public JdkHttpTransport() {
        this(HttpClient.newBuilder()
            .connectTimeout(DEFAULT_CONNECT_TIMEOUT)
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build());
    }

    public JdkHttpTransport(HttpClient httpClient) {
        if (httpClient == null) {
            throw new IllegalArgumentException("httpClient cannot be null");
        }
        this.httpClient = httpClient;
    }

    @Override
    public TransportResponse send(TransportRequest request) throws IOException, TimeoutException, InterruptedException {
        HttpRequest.BodyPublisher publisher = request.body() == null
            ? HttpRequest.BodyPublishers.noBody()
            : HttpRequest.BodyPublishers.ofString(request.body(), StandardCharsets.UTF_8);

        HttpRequest.Builder builder = HttpRequest.newBuilder(request.uri())
            .timeout(request.timeout())
            .method(request.method().name(), publisher);
        request.headers().forEach(builder::header);

        HttpResponse<String> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException e) {
            TimeoutException timeout = new TimeoutException(e.getMessage());
            timeout.initCause(e);
            throw timeout;
        }

        return new TransportResponse(response.statusCode(), firstValues(response.headers().map()), response.body());
    }

    private static Map<String, String> firstValues(Map<String, List<String>> headers) {
        Map<String, String> result = new LinkedHashMap<>();
        headers.forEach((name, values) -> {
            if (!values.isEmpty()) {
                result.put(name, values.get(0));
            }
        });
        return result;
    }
}
