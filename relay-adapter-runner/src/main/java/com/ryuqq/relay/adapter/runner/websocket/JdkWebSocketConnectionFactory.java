package com.ryuqq.relay.adapter.runner.websocket;

import com.ryuqq.relay.core.spi.transport.ConnectionFactory;
import com.ryuqq.relay.core.spi.transport.PersistentConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpTimeoutException;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@code java.net.http.WebSocket} 기반 {@link ConnectionFactory}.
 *
 * <p>수신한 텍스트 프레임은 메시지 단위로 조립되어 큐에 쌓이고,
 * {@link PersistentConnection#receive(Duration)}가 타임아웃과 함께 꺼냅니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class JdkWebSocketConnectionFactory implements ConnectionFactory {

    private static final Logger log = LoggerFactory.getLogger(JdkWebSocketConnectionFactory.class);

    private final HttpClient httpClient;

    public JdkWebSocketConnectionFactory() {
        this(HttpClient.newHttpClient());
    }

    public JdkWebSocketConnectionFactory(HttpClient httpClient) {
        if (httpClient == null) {
            throw new IllegalArgumentException("httpClient cannot be null");
        }
        this.httpClient = httpClient;
    }

    @Override
    public PersistentConnection open(URI uri, Map<String, String> headers, Duration connectTimeout)
        throws IOException, TimeoutException, InterruptedException {
        QueueingListener listener = new QueueingListener();
        WebSocket.Builder builder = httpClient.newWebSocketBuilder().connectTimeout(connectTimeout);
        headers.forEach(builder::header);

        WebSocket webSocket;
        try {
            webSocket = builder.buildAsync(uri, listener)
                .get(connectTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof HttpTimeoutException) {
                TimeoutException timeout = new TimeoutException(cause.getMessage());
                timeout.initCause(cause);
                throw timeout;
            }
            throw new IOException("WebSocket handshake failed: " + cause.getMessage(), cause);
        }
        return new JdkPersistentConnection(webSocket, listener);
    }

    private static final class QueueingListener implements WebSocket.Listener {

        private final BlockingQueue<String> messages = new LinkedBlockingQueue<>();
        private final StringBuilder partial = new StringBuilder();
        private final AtomicBoolean closedByPeer = new AtomicBoolean();
        private volatile Throwable error;

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            synchronized (partial) {
                partial.append(data);
                if (last) {
                    messages.offer(partial.toString());
                    partial.setLength(0);
                }
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            closedByPeer.set(true);
            log.debug("WebSocket closed by peer: status={}, reason={}", statusCode, reason);
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable failure) {
            error = failure;
            closedByPeer.set(true);
            log.warn("WebSocket error: {}", failure.toString());
        }
    }

    private static final class JdkPersistentConnection implements PersistentConnection {

        private final WebSocket webSocket;
        private final QueueingListener listener;
        private final AtomicBoolean closed = new AtomicBoolean();

        private JdkPersistentConnection(WebSocket webSocket, QueueingListener listener) {
            this.webSocket = webSocket;
            this.listener = listener;
        }

        @Override
        public void send(String message) throws IOException {
            if (!isOpen()) {
                throw new IOException("connection is closed");
            }
            try {
                webSocket.sendText(message, true).get();
            } catch (ExecutionException e) {
                throw new IOException(e.getCause() == null ? e.getMessage() : e.getCause().getMessage(), e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("interrupted while sending", e);
            }
        }

        @Override
        public String receive(Duration timeout) throws IOException, TimeoutException, InterruptedException {
            String message = listener.messages.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (message != null) {
                return message;
            }
            if (listener.error != null) {
                throw new IOException("connection failed: " + listener.error.getMessage(), listener.error);
            }
            if (listener.closedByPeer.get()) {
                throw new IOException("connection closed by peer");
            }
            throw new TimeoutException("no message within " + timeout.toMillis() + "ms");
        }

        @Override
        public boolean isOpen() {
            return !closed.get() && !listener.closedByPeer.get() && !webSocket.isOutputClosed();
        }

        @Override
        public void close() {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            if (webSocket.isOutputClosed()) {
                webSocket.abort();
                return;
            }
            webSocket.sendClose(WebSocket.NORMAL_CLOSURE, "")
                .whenComplete((ignored, failure) -> {
                    if (failure != null) {
                        log.debug("WebSocket close handshake failed, aborting: {}", failure.toString());
                        webSocket.abort();
                    }
                });
        }
    }
}
