package com.ryuqq.relay.adapter.runner.component;

import com.ryuqq.relay.adapter.runner.http.HttpRequestOptions;
import com.ryuqq.relay.adapter.runner.http.RetryingHttpClient;
import com.ryuqq.relay.application.gateway.GatewayComponent;
import com.ryuqq.relay.application.gateway.GatewayInterface;
import com.ryuqq.relay.application.gateway.HttpClientOperation;
import com.ryuqq.relay.application.gateway.OperationArguments;
import com.ryuqq.relay.core.model.CorrelationId;
import com.ryuqq.relay.core.model.HttpMethod;
import com.ryuqq.relay.core.outcome.OperationResult;
import com.ryuqq.relay.core.protection.RetryPolicy;

import java.time.Duration;

/**
 * {@code http_client} 인터페이스 처리기.
 *
 * <p>요청 오퍼레이션은 {@link RetryingHttpClient}의 결과를 그대로 반환합니다.
 * CONFIGURE_RETRY는 생략된 값을 현재 정책에서 가져와 새 정책으로 통째로 교체합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class HttpClientGatewayComponent implements GatewayComponent<HttpClientOperation> {

    private final RetryingHttpClient httpClient;

    public HttpClientGatewayComponent(RetryingHttpClient httpClient) {
        if (httpClient == null) {
            throw new IllegalArgumentException("httpClient cannot be null");
        }
        this.httpClient = httpClient;
    }

    @Override
    public GatewayInterface gatewayInterface() {
        return GatewayInterface.HTTP_CLIENT;
    }

    @Override
    public Class<HttpClientOperation> operationType() {
        return HttpClientOperation.class;
    }

    @Override
    public OperationResult handle(HttpClientOperation operation, OperationArguments arguments, CorrelationId correlationId) {
        return switch (operation) {
            case REQUEST -> send(HttpMethod.from(arguments.requireString("method")), arguments, correlationId);
            case GET -> send(HttpMethod.GET, arguments, correlationId);
            case POST -> send(HttpMethod.POST, arguments, correlationId);
            case PUT -> send(HttpMethod.PUT, arguments, correlationId);
            case DELETE -> send(HttpMethod.DELETE, arguments, correlationId);
            case CONFIGURE_RETRY -> {
                RetryPolicy updated = retryPolicyFrom(arguments, httpClient.getRetryPolicy());
                httpClient.configureRetry(updated);
                yield OperationResult.success(correlationId, updated);
            }
            case STATS -> OperationResult.success(correlationId, httpClient.stats());
            case RESET_STATS -> OperationResult.success(correlationId, httpClient.resetStats());
        };
    }

    private OperationResult send(HttpMethod method, OperationArguments arguments, CorrelationId correlationId) {
        return httpClient.request(method, arguments.requireString("url"), correlationId, optionsFrom(arguments));
    }

    static HttpRequestOptions optionsFrom(OperationArguments arguments) {
        return new HttpRequestOptions(
            arguments.optionalStringMap("headers"),
            arguments.optionalStringMap("params"),
            arguments.optional("body").orElse(null),
            arguments.optionalLong("timeout_ms").map(Duration::ofMillis).orElse(null),
            arguments.optionalString("dependency").orElse(null),
            arguments.optionalBoolean("use_retry").orElse(Boolean.TRUE)
        );
    }

    static RetryPolicy retryPolicyFrom(OperationArguments arguments, RetryPolicy current) {
        return new RetryPolicy(
            arguments.optionalInt("max_attempts").orElse(current.maxAttempts()),
            arguments.optionalLong("backoff_base_ms").orElse(current.backoffBaseMs()),
            arguments.optionalDouble("backoff_multiplier").orElse(current.backoffMultiplier()),
            arguments.optionalIntSet("retriable_status_codes").orElse(current.retriableStatusCodes()),
            arguments.optionalLong("attempt_timeout_ms").map(Duration::ofMillis).orElse(current.attemptTimeout())
        );
    }
}
