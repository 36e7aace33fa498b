package com.ryuqq.relay.adapter.runner.http;

import com.ryuqq.relay.adapter.runner.json.JsonCodec;
import com.ryuqq.relay.core.model.CorrelationId;
import com.ryuqq.relay.core.model.HttpMethod;
import com.ryuqq.relay.core.outcome.ErrorKind;
import com.ryuqq.relay.core.outcome.Failure;
import com.ryuqq.relay.core.outcome.OperationResult;
import com.ryuqq.relay.core.protection.CircuitBreaker;
import com.ryuqq.relay.core.protection.CircuitBreakerProvider;
import com.ryuqq.relay.core.protection.RateLimiter;
import com.ryuqq.relay.core.protection.RetryPolicy;
import com.ryuqq.relay.core.spi.MetricsSink;
import com.ryuqq.relay.core.spi.transport.HttpTransport;
import com.ryuqq.relay.core.spi.transport.TransportRequest;
import com.ryuqq.relay.core.spi.transport.TransportResponse;
import com.ryuqq.relay.core.time.MonotonicClock;
import com.ryuqq.relay.core.time.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.TimeoutException;

/**
 * Rate Limiter, Circuit Breaker, 재시도를 조합한 HTTP 클라이언트.
 *
 * <p><strong>요청 흐름:</strong></p>
 * <ol>
 *   <li>Rate Limiter 확인: 거절 시 {@code RATE_LIMITED} (재시도 없음)</li>
 *   <li>의존성별 Circuit Breaker 확인: 거절 시 {@code CIRCUIT_OPEN} (I/O 없음)</li>
 *   <li>시도별 타임아웃으로 전송</li>
 *   <li>분류: 2xx는 성공, 재시도 불가 상태 코드는 즉시 {@code HTTP_STATUS},
 *       재시도 가능 상태 코드/연결 오류/타임아웃은 백오프 후 재시도</li>
 *   <li>시도 소진 시 {@code RETRY_EXHAUSTED} (시도 횟수 포함)</li>
 * </ol>
 *
 * <p>Rate Limiter와 Circuit Breaker는 요청당 한 번만 확인하며 재시도 루프 중에는 다시 확인하지 않습니다.
 * 모든 시도의 성공/실패는 Circuit Breaker에 기록됩니다.</p>
 *
 * <p>백오프는 {@link RetryPolicy#backoffMs(int)}로 결정적으로 계산하고 {@link Sleeper}로 대기합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class RetryingHttpClient {

    private static final Logger log = LoggerFactory.getLogger(RetryingHttpClient.class);

    public static final String DEFAULT_USER_AGENT = "Relay-Http-Client/1.0";
    private static final String REDACTED = "***";
    private static final String AUTHORIZATION = "Authorization";

    private final HttpTransport transport;
    private final RateLimiter rateLimiter;
    private final CircuitBreakerProvider circuitBreakers;
    private final Sleeper sleeper;
    private final MonotonicClock clock;
    private final MetricsSink metrics;
    private final JsonCodec jsonCodec;
    private final String userAgent;

    private volatile RetryPolicy retryPolicy;

    private long requests;
    private long successful;
    private long failed;
    private long retries;
    private long rateLimited;
    private long circuitRejected;

    /**
     * 생성자.
     *
     * @param transport HTTP 전송 SPI
     * @param rateLimiter 클라이언트 전용 Rate Limiter
     * @param circuitBreakers 의존성별 Circuit Breaker 제공자
     * @param retryPolicy 초기 재시도 정책
     * @param sleeper 백오프 대기
     * @param clock 지연 시간 측정용 단조 시계
     * @param metrics 메트릭 수집
     * @param jsonCodec 바디 직렬화
     * @param userAgent 기본 User-Agent 헤더 값
     * @throws IllegalArgumentException 인자가 null이거나 userAgent가 빈 문자열인 경우
     */
    public RetryingHttpClient(
        HttpTransport transport,
        RateLimiter rateLimiter,
        CircuitBreakerProvider circuitBreakers,
        RetryPolicy retryPolicy,
        Sleeper sleeper,
        MonotonicClock clock,
        MetricsSink metrics,
        JsonCodec jsonCodec,
        String userAgent
    ) {
        if (transport == null) {
            throw new IllegalArgumentException("transport cannot be null");
        }
        if (rateLimiter == null) {
            throw new IllegalArgumentException("rateLimiter cannot be null");
        }
        if (circuitBreakers == null) {
            throw new IllegalArgumentException("circuitBreakers cannot be null");
        }
        if (retryPolicy == null) {
            throw new IllegalArgumentException("retryPolicy cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("metrics cannot be null");
        }
        if (jsonCodec == null) {
            throw new IllegalArgumentException("jsonCodec cannot be null");
        }
        if (userAgent == null || userAgent.isBlank()) {
            throw new IllegalArgumentException("userAgent cannot be null or blank");
        }
        this.transport = transport;
        this.rateLimiter = rateLimiter;
        this.circuitBreakers = circuitBreakers;
        this.retryPolicy = retryPolicy;
        this.sleeper = sleeper;
        this.clock = clock;
        this.metrics = metrics;
        this.jsonCodec = jsonCodec;
        this.userAgent = userAgent;
    }

    /**
     * HTTP 요청을 실행합니다. 예외를 던지지 않으며 모든 결과는 {@link OperationResult}로 반환됩니다.
     *
     * @param method HTTP 메서드
     * @param url 절대 URL
     * @param correlationId 상관 ID (null이면 생성)
     * @param options 요청 옵션 (null이면 기본값)
     * @return 성공 시 {@link HttpExchange}를 담은 Success, 실패 시 Failure
     */
    public OperationResult request(HttpMethod method, String url, CorrelationId correlationId, HttpRequestOptions options) {
        CorrelationId cid = correlationId == null ? CorrelationId.generate() : correlationId;
        HttpRequestOptions effective = options == null ? HttpRequestOptions.defaults() : options;
        RetryPolicy policy = retryPolicy;

        TransportRequest transportRequest;
        try {
            transportRequest = buildRequest(method, url, effective, policy);
        } catch (IllegalArgumentException e) {
            log.debug("Invalid HTTP request rejected: correlationId={}, reason={}", cid, e.getMessage());
            return OperationResult.failure(cid, ErrorKind.VALIDATION, e.getMessage());
        }

        synchronized (this) {
            requests++;
        }
        metrics.increment("relay.http.requests");

        if (!rateLimiter.tryAcquire(cid)) {
            synchronized (this) {
                rateLimited++;
                failed++;
            }
            metrics.increment("relay.http.rate_limited");
            return OperationResult.failure(cid, ErrorKind.RATE_LIMITED,
                "Rate limit exceeded (" + rateLimiter.getConfig().maxOperations() + " per "
                    + rateLimiter.getConfig().window().toMillis() + "ms)");
        }

        String dependency = effective.dependency() != null ? effective.dependency() : transportRequest.uri().getHost();
        CircuitBreaker breaker = circuitBreakers.forDependency(dependency);
        if (!breaker.tryAcquire(cid)) {
            synchronized (this) {
                circuitRejected++;
                failed++;
            }
            metrics.increment("relay.http.circuit_rejected");
            return OperationResult.failure(cid, ErrorKind.CIRCUIT_OPEN,
                "Circuit breaker is " + breaker.getState() + " for dependency '" + dependency + "'");
        }

        long startedAt = clock.nowNanos();
        OperationResult result = executeWithRetry(transportRequest, policy, effective.useRetry(), breaker, cid);
        metrics.record("relay.http.duration", clock.elapsedMillis(startedAt), "milliseconds");

        synchronized (this) {
            if (result.isSuccess()) {
                successful++;
            } else {
                failed++;
            }
        }
        return result;
    }

    public OperationResult get(String url, CorrelationId correlationId, HttpRequestOptions options) {
        return request(HttpMethod.GET, url, correlationId, options);
    }

    public OperationResult post(String url, CorrelationId correlationId, HttpRequestOptions options) {
        return request(HttpMethod.POST, url, correlationId, options);
    }

    public OperationResult put(String url, CorrelationId correlationId, HttpRequestOptions options) {
        return request(HttpMethod.PUT, url, correlationId, options);
    }

    public OperationResult delete(String url, CorrelationId correlationId, HttpRequestOptions options) {
        return request(HttpMethod.DELETE, url, correlationId, options);
    }

    /**
     * 재시도 정책을 통째로 교체합니다. 진행 중인 요청은 시작 시점의 정책을 유지합니다.
     *
     * @param newPolicy 새 정책
     */
    public void configureRetry(RetryPolicy newPolicy) {
        if (newPolicy == null) {
            throw new IllegalArgumentException("retryPolicy cannot be null");
        }
        this.retryPolicy = newPolicy;
        log.info("Retry policy replaced: maxAttempts={}, backoffBaseMs={}, multiplier={}",
            newPolicy.maxAttempts(), newPolicy.backoffBaseMs(), newPolicy.backoffMultiplier());
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    public synchronized HttpClientStats stats() {
        return new HttpClientStats(requests, successful, failed, retries, rateLimited, circuitRejected);
    }

    /**
     * 통계를 초기화합니다.
     *
     * @return 초기화 직전의 통계
     */
    public synchronized HttpClientStats resetStats() {
        HttpClientStats previous = stats();
        requests = 0;
        successful = 0;
        failed = 0;
        retries = 0;
        rateLimited = 0;
        circuitRejected = 0;
        return previous;
    }

    private OperationResult executeWithRetry(
        TransportRequest request,
        RetryPolicy policy,
        boolean useRetry,
        CircuitBreaker breaker,
        CorrelationId cid
    ) {
        int maxAttempts = useRetry ? policy.maxAttempts() : 1;
        ErrorKind lastKind = ErrorKind.INTERNAL;
        String lastError = "no attempt made";

        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            int attemptsUsed = attempt + 1;
            log.debug("HTTP {} {} attempt {}/{}: correlationId={}, headers={}",
                request.method(), request.uri(), attemptsUsed, maxAttempts, cid, redact(request.headers()));

            try {
                TransportResponse response = transport.send(request);

                if (response.isSuccessful()) {
                    Object body = jsonCodec.read(response.body());
                    breaker.recordSuccess(cid);
                    return OperationResult.success(cid, new HttpExchange(
                        response.statusCode(), body, response.headers(), attemptsUsed));
                }

                breaker.recordFailure(cid, null);
                if (!policy.isRetriable(response.statusCode())) {
                    log.info("HTTP {} {} returned non-retriable status {}: correlationId={}",
                        request.method(), request.uri(), response.statusCode(), cid);
                    return Failure.of(cid, ErrorKind.HTTP_STATUS,
                        "HTTP " + response.statusCode() + " from " + request.uri().getHost(), attemptsUsed);
                }
                lastKind = ErrorKind.HTTP_STATUS;
                lastError = "HTTP " + response.statusCode();
            } catch (TimeoutException e) {
                breaker.recordFailure(cid, e);
                lastKind = ErrorKind.TIMEOUT;
                lastError = "timed out after " + request.timeout().toMillis() + "ms";
            } catch (IOException e) {
                breaker.recordFailure(cid, e);
                lastKind = ErrorKind.CONNECTION;
                lastError = "connection error: " + e.getMessage();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                breaker.recordFailure(cid, e);
                return Failure.of(cid, ErrorKind.INTERNAL, "interrupted during HTTP attempt " + attemptsUsed, attemptsUsed);
            } catch (RuntimeException e) {
                breaker.recordFailure(cid, e);
                log.warn("HTTP {} {} attempt {} rejected by transport: correlationId={}",
                    request.method(), request.uri(), attemptsUsed, cid, e);
                ErrorKind kind = e instanceof IllegalArgumentException ? ErrorKind.VALIDATION : ErrorKind.INTERNAL;
                return Failure.of(cid, kind, "HTTP attempt " + attemptsUsed + " failed: " + e.getMessage(), attemptsUsed);
            }

            log.warn("HTTP {} {} attempt {}/{} failed: correlationId={}, error={}",
                request.method(), request.uri(), attemptsUsed, maxAttempts, cid, lastError);

            if (attemptsUsed < maxAttempts) {
                long backoffMs = policy.backoffMs(attempt);
                synchronized (this) {
                    retries++;
                }
                metrics.increment("relay.http.retries");
                try {
                    sleeper.sleep(backoffMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return Failure.of(cid, ErrorKind.INTERNAL, "interrupted during backoff after attempt " + attemptsUsed,
                        attemptsUsed);
                }
            }
        }

        if (maxAttempts == 1) {
            return Failure.of(cid, lastKind, lastError, 1);
        }
        return Failure.of(cid, ErrorKind.RETRY_EXHAUSTED,
            "HTTP " + request.method() + " " + request.uri().getHost() + " failed after " + maxAttempts
                + " attempts: " + lastError, maxAttempts);
    }

    private TransportRequest buildRequest(HttpMethod method, String url, HttpRequestOptions options, RetryPolicy policy) {
        if (method == null) {
            throw new IllegalArgumentException("method cannot be null");
        }
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url cannot be null or blank");
        }
        URI uri = buildUri(url.trim(), options.params());

        Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        headers.put("Content-Type", "application/json");
        headers.put("User-Agent", userAgent);
        headers.putAll(options.headers());

        String body = jsonCodec.write(options.body());
        Duration timeout = options.timeout() != null ? options.timeout() : policy.attemptTimeout();
        return new TransportRequest(method, uri, headers, body, timeout);
    }

    private static URI buildUri(String url, Map<String, String> params) {
        StringBuilder target = new StringBuilder(url);
        if (!params.isEmpty()) {
            target.append(url.contains("?") ? '&' : '?');
            boolean first = true;
            for (Map.Entry<String, String> param : params.entrySet()) {
                if (!first) {
                    target.append('&');
                }
                target.append(URLEncoder.encode(param.getKey(), StandardCharsets.UTF_8))
                    .append('=')
                    .append(URLEncoder.encode(param.getValue(), StandardCharsets.UTF_8));
                first = false;
            }
        }
        URI uri;
        try {
            uri = new URI(target.toString());
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("url is malformed (current: " + url + ")", e);
        }
        String scheme = uri.getScheme();
        if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
            throw new IllegalArgumentException("url must start with http:// or https:// (current: " + url + ")");
        }
        if (uri.getHost() == null) {
            throw new IllegalArgumentException("url must have a host (current: " + url + ")");
        }
        return uri;
    }

    static Map<String, String> redact(Map<String, String> headers) {
        Map<String, String> safe = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        safe.putAll(headers);
        if (safe.containsKey(AUTHORIZATION)) {
            safe.put(AUTHORIZATION, REDACTED);
        }
        return safe;
    }
}
