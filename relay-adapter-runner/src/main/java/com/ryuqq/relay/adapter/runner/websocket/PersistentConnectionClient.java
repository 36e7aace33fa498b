package com.ryuqq.relay.adapter.runner.websocket;

import com.ryuqq.relay.adapter.runner.json.JsonCodec;
import com.ryuqq.relay.core.model.CorrelationId;
import com.ryuqq.relay.core.outcome.ErrorKind;
import com.ryuqq.relay.core.outcome.Failure;
import com.ryuqq.relay.core.outcome.OperationResult;
import com.ryuqq.relay.core.outcome.Success;
import com.ryuqq.relay.core.protection.CircuitBreaker;
import com.ryuqq.relay.core.protection.CircuitBreakerProvider;
import com.ryuqq.relay.core.protection.RateLimiter;
import com.ryuqq.relay.core.spi.MetricsSink;
import com.ryuqq.relay.core.spi.transport.ConnectionFactory;
import com.ryuqq.relay.core.spi.transport.PersistentConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * WebSocket 클라이언트.
 *
 * <p>열린 연결은 핸들 ID({@code ws-1}, {@code ws-2}, ...)로 추적되어 Gateway 호출자가
 * 이후 SEND/RECEIVE/CLOSE에서 지정할 수 있습니다.</p>
 *
 * <p><strong>검증 규칙:</strong></p>
 * <ul>
 *   <li>URL은 {@code ws://} 또는 {@code wss://}로 시작</li>
 *   <li>타임아웃은 1초 이상 60초 이하</li>
 *   <li>메시지는 JSON 객체(Map)이며 직렬화 결과가 1 MiB 이하</li>
 * </ul>
 *
 * <p>연결 수립(connect, request)은 HTTP 클라이언트와 동일하게 Rate Limiter와
 * 호스트별 Circuit Breaker를 먼저 확인합니다. {@link #request}는 어떤 경로로 끝나든
 * 연결을 정확히 한 번 닫습니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class PersistentConnectionClient {

    private static final Logger log = LoggerFactory.getLogger(PersistentConnectionClient.class);

    public static final int MAX_MESSAGE_BYTES = 1024 * 1024;
    public static final Duration MIN_TIMEOUT = Duration.ofSeconds(1);
    public static final Duration MAX_TIMEOUT = Duration.ofSeconds(60);
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    private static final String HANDLE_PREFIX = "ws-";

    private final ConnectionFactory connectionFactory;
    private final RateLimiter rateLimiter;
    private final CircuitBreakerProvider circuitBreakers;
    private final MetricsSink metrics;
    private final JsonCodec jsonCodec;

    private final Map<String, Handle> handles = new LinkedHashMap<>();
    private final AtomicLong handleSequence = new AtomicLong();

    private long opened;
    private long closed;
    private long sent;
    private long received;
    private long errors;

    public PersistentConnectionClient(
        ConnectionFactory connectionFactory,
        RateLimiter rateLimiter,
        CircuitBreakerProvider circuitBreakers,
        MetricsSink metrics,
        JsonCodec jsonCodec
    ) {
        if (connectionFactory == null) {
            throw new IllegalArgumentException("connectionFactory cannot be null");
        }
        if (rateLimiter == null) {
            throw new IllegalArgumentException("rateLimiter cannot be null");
        }
        if (circuitBreakers == null) {
            throw new IllegalArgumentException("circuitBreakers cannot be null");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("metrics cannot be null");
        }
        if (jsonCodec == null) {
            throw new IllegalArgumentException("jsonCodec cannot be null");
        }
        this.connectionFactory = connectionFactory;
        this.rateLimiter = rateLimiter;
        this.circuitBreakers = circuitBreakers;
        this.metrics = metrics;
        this.jsonCodec = jsonCodec;
    }

    /**
     * 연결을 열고 핸들 ID를 반환합니다.
     *
     * @param url {@code ws://} 또는 {@code wss://} URL
     * @param headers 핸드셰이크 헤더 (nullable)
     * @param timeout 연결 타임아웃 (null이면 10초)
     * @param correlationId 상관 ID
     * @return 성공 시 핸들 ID(String)를 담은 Success
     */
    public OperationResult connect(String url, Map<String, String> headers, Duration timeout, CorrelationId correlationId) {
        CorrelationId cid = orGenerate(correlationId);
        URI uri;
        Duration connectTimeout;
        try {
            uri = validateUrl(url);
            connectTimeout = validateTimeout(timeout);
        } catch (IllegalArgumentException e) {
            return OperationResult.failure(cid, ErrorKind.VALIDATION, e.getMessage());
        }

        OperationResult opening = openGuarded(uri, headers, connectTimeout, cid);
        if (opening instanceof Failure) {
            return opening;
        }
        PersistentConnection connection = ((Success) opening).dataAs(PersistentConnection.class);

        String handleId = HANDLE_PREFIX + handleSequence.incrementAndGet();
        synchronized (this) {
            handles.put(handleId, new Handle(connection, uri.getHost()));
        }
        log.info("WebSocket connected: handle={}, host={}, correlationId={}", handleId, uri.getHost(), cid);
        return OperationResult.success(cid, handleId);
    }

    /**
     * 열린 연결로 메시지를 전송합니다.
     *
     * @return 성공 시 전송 바이트 수(Integer)를 담은 Success
     */
    public OperationResult send(String connectionId, Object message, CorrelationId correlationId) {
        CorrelationId cid = orGenerate(correlationId);
        String payload;
        Handle handle;
        try {
            payload = serialize(message);
            handle = requireHandle(connectionId);
        } catch (IllegalArgumentException e) {
            return OperationResult.failure(cid, ErrorKind.VALIDATION, e.getMessage());
        }

        try {
            handle.connection().send(payload);
        } catch (IOException e) {
            return ioFailure(handle, cid, "send failed: " + e.getMessage(), e);
        }
        synchronized (this) {
            sent++;
        }
        metrics.increment("relay.websocket.messages_sent");
        return OperationResult.success(cid, JsonCodec.utf8Length(payload));
    }

    /**
     * 열린 연결에서 메시지 하나를 수신합니다.
     *
     * @param timeout 수신 타임아웃 (null이면 10초)
     * @return 성공 시 해석된 메시지를 담은 Success, 타임아웃 시 {@code TIMEOUT}
     */
    public OperationResult receive(String connectionId, Duration timeout, CorrelationId correlationId) {
        CorrelationId cid = orGenerate(correlationId);
        Handle handle;
        Duration receiveTimeout;
        try {
            receiveTimeout = validateTimeout(timeout);
            handle = requireHandle(connectionId);
        } catch (IllegalArgumentException e) {
            return OperationResult.failure(cid, ErrorKind.VALIDATION, e.getMessage());
        }
        return receiveFrom(handle, receiveTimeout, cid);
    }

    /**
     * 연결을 닫고 핸들을 제거합니다.
     *
     * @return 핸들이 존재했으면 true를 담은 Success
     */
    public OperationResult close(String connectionId, CorrelationId correlationId) {
        CorrelationId cid = orGenerate(correlationId);
        if (connectionId == null || connectionId.isBlank()) {
            return OperationResult.failure(cid, ErrorKind.VALIDATION, "connection_id cannot be null or blank");
        }
        Handle handle;
        synchronized (this) {
            handle = handles.remove(connectionId);
        }
        if (handle == null) {
            return OperationResult.success(cid, Boolean.FALSE);
        }
        closeConnection(handle.connection());
        log.info("WebSocket closed: handle={}, correlationId={}", connectionId, cid);
        return OperationResult.success(cid, Boolean.TRUE);
    }

    /**
     * 연결, 전송, (선택) 수신을 수행한 뒤 반드시 연결을 닫습니다.
     *
     * @param url 대상 URL
     * @param message JSON 객체 메시지
     * @param headers 핸드셰이크 헤더 (nullable)
     * @param timeout 연결 및 수신 타임아웃 (null이면 10초)
     * @param waitForResponse 응답 수신 여부
     * @param correlationId 상관 ID
     * @return 성공 시 {@link WebSocketExchange}를 담은 Success
     */
    public OperationResult request(
        String url,
        Object message,
        Map<String, String> headers,
        Duration timeout,
        boolean waitForResponse,
        CorrelationId correlationId
    ) {
        CorrelationId cid = orGenerate(correlationId);
        URI uri;
        Duration effectiveTimeout;
        String payload;
        try {
            uri = validateUrl(url);
            effectiveTimeout = validateTimeout(timeout);
            payload = serialize(message);
        } catch (IllegalArgumentException e) {
            return OperationResult.failure(cid, ErrorKind.VALIDATION, e.getMessage());
        }

        OperationResult opening = openGuarded(uri, headers, effectiveTimeout, cid);
        if (opening instanceof Failure) {
            return opening;
        }
        Handle handle = new Handle(((Success) opening).dataAs(PersistentConnection.class), uri.getHost());

        try {
            try {
                handle.connection().send(payload);
            } catch (IOException e) {
                return ioFailure(handle, cid, "send failed: " + e.getMessage(), e);
            }
            synchronized (this) {
                sent++;
            }
            metrics.increment("relay.websocket.messages_sent");

            Object response = "";
            if (waitForResponse) {
                OperationResult reply = receiveFrom(handle, effectiveTimeout, cid);
                if (reply instanceof Failure) {
                    return reply;
                }
                response = ((Success) reply).data();
            }
            return OperationResult.success(cid,
                new WebSocketExchange(url, JsonCodec.utf8Length(payload), waitForResponse, response));
        } finally {
            closeConnection(handle.connection());
        }
    }

    public synchronized WebSocketStats stats() {
        return new WebSocketStats(opened, closed, sent, received, errors, handles.size());
    }

    /**
     * 추적 중인 모든 연결을 닫습니다.
     *
     * @return 닫은 연결 수
     */
    public int closeAll() {
        List<Handle> toClose;
        synchronized (this) {
            toClose = new ArrayList<>(handles.values());
            handles.clear();
        }
        toClose.forEach(handle -> closeConnection(handle.connection()));
        if (!toClose.isEmpty()) {
            log.info("Closed {} tracked WebSocket connections", toClose.size());
        }
        return toClose.size();
    }

    private OperationResult openGuarded(URI uri, Map<String, String> headers, Duration timeout, CorrelationId cid) {
        if (!rateLimiter.tryAcquire(cid)) {
            recordError();
            return OperationResult.failure(cid, ErrorKind.RATE_LIMITED, "Rate limit exceeded for WebSocket connect");
        }
        CircuitBreaker breaker = circuitBreakers.forDependency(uri.getHost());
        if (!breaker.tryAcquire(cid)) {
            recordError();
            return OperationResult.failure(cid, ErrorKind.CIRCUIT_OPEN,
                "Circuit breaker is " + breaker.getState() + " for dependency '" + uri.getHost() + "'");
        }

        try {
            PersistentConnection connection =
                connectionFactory.open(uri, headers == null ? Map.of() : headers, timeout);
            breaker.recordSuccess(cid);
            synchronized (this) {
                opened++;
            }
            metrics.increment("relay.websocket.connections");
            return OperationResult.success(cid, connection);
        } catch (TimeoutException e) {
            breaker.recordFailure(cid, e);
            recordError();
            return OperationResult.failure(cid, ErrorKind.TIMEOUT,
                "WebSocket connect timed out after " + timeout.toSeconds() + "s");
        } catch (IOException e) {
            breaker.recordFailure(cid, e);
            recordError();
            log.warn("WebSocket connect failed: host={}, correlationId={}, error={}", uri.getHost(), cid, e.getMessage());
            return OperationResult.failure(cid, ErrorKind.CONNECTION, "WebSocket connect failed: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            breaker.recordFailure(cid, e);
            recordError();
            return OperationResult.failure(cid, ErrorKind.INTERNAL, "interrupted during WebSocket connect");
        } catch (RuntimeException e) {
            breaker.recordFailure(cid, e);
            recordError();
            log.warn("WebSocket connect rejected by transport: host={}, correlationId={}", uri.getHost(), cid, e);
            ErrorKind kind = e instanceof IllegalArgumentException ? ErrorKind.VALIDATION : ErrorKind.INTERNAL;
            return OperationResult.failure(cid, kind, "WebSocket connect failed: " + e.getMessage());
        }
    }

    private OperationResult receiveFrom(Handle handle, Duration timeout, CorrelationId cid) {
        String raw;
        try {
            raw = handle.connection().receive(timeout);
        } catch (TimeoutException e) {
            circuitBreakers.forDependency(handle.dependency()).recordFailure(cid, e);
            recordError();
            log.warn("WebSocket receive timed out: host={}, correlationId={}, timeout={}s",
                handle.dependency(), cid, timeout.toSeconds());
            return OperationResult.failure(cid, ErrorKind.TIMEOUT,
                "WebSocket receive timed out after " + timeout.toSeconds() + "s");
        } catch (IOException e) {
            return ioFailure(handle, cid, "receive failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            recordError();
            return OperationResult.failure(cid, ErrorKind.INTERNAL, "interrupted during WebSocket receive");
        }
        synchronized (this) {
            received++;
        }
        metrics.increment("relay.websocket.messages_received");
        return OperationResult.success(cid, jsonCodec.read(raw));
    }

    private OperationResult ioFailure(Handle handle, CorrelationId cid, String message, IOException cause) {
        circuitBreakers.forDependency(handle.dependency()).recordFailure(cid, cause);
        recordError();
        log.warn("WebSocket {}: host={}, correlationId={}", message, handle.dependency(), cid);
        return OperationResult.failure(cid, ErrorKind.CONNECTION, "WebSocket " + message);
    }

    private void closeConnection(PersistentConnection connection) {
        connection.close();
        synchronized (this) {
            closed++;
        }
    }

    private synchronized void recordError() {
        errors++;
    }

    private synchronized Handle requireHandle(String connectionId) {
        if (connectionId == null || connectionId.isBlank()) {
            throw new IllegalArgumentException("connection_id cannot be null or blank");
        }
        Handle handle = handles.get(connectionId);
        if (handle == null) {
            throw new IllegalArgumentException("unknown connection_id: " + connectionId);
        }
        return handle;
    }

    private String serialize(Object message) {
        if (message == null) {
            throw new IllegalArgumentException("message is required");
        }
        if (!(message instanceof Map)) {
            throw new IllegalArgumentException(
                "message must be a JSON object (current: " + message.getClass().getSimpleName() + ")");
        }
        String payload = jsonCodec.write(message);
        int size = JsonCodec.utf8Length(payload);
        if (size > MAX_MESSAGE_BYTES) {
            throw new IllegalArgumentException(
                "message exceeds " + MAX_MESSAGE_BYTES + " bytes (current: " + size + ")");
        }
        return payload;
    }

    private static URI validateUrl(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url cannot be null or blank");
        }
        if (!url.startsWith("ws://") && !url.startsWith("wss://")) {
            throw new IllegalArgumentException("url must start with ws:// or wss:// (current: " + url + ")");
        }
        try {
            URI uri = new URI(url);
            if (uri.getHost() == null) {
                throw new IllegalArgumentException("url must have a host (current: " + url + ")");
            }
            return uri;
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("url is malformed (current: " + url + ")", e);
        }
    }

    private static Duration validateTimeout(Duration timeout) {
        if (timeout == null) {
            return DEFAULT_TIMEOUT;
        }
        if (timeout.compareTo(MIN_TIMEOUT) < 0 || timeout.compareTo(MAX_TIMEOUT) > 0) {
            throw new IllegalArgumentException(
                "timeout must be between 1 and 60 seconds (current: " + timeout.toMillis() + "ms)");
        }
        return timeout;
    }

    private static CorrelationId orGenerate(CorrelationId correlationId) {
        return correlationId == null ? CorrelationId.generate() : correlationId;
    }

    private record Handle(PersistentConnection connection, String dependency) {
    }
}
