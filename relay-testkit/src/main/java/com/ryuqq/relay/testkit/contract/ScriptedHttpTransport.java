package com.ryuqq.relay.testkit.contract;

import com.ryuqq.relay.core.spi.transport.HttpTransport;
import com.ryuqq.relay.core.spi.transport.TransportRequest;
import com.ryuqq.relay.core.spi.transport.TransportResponse;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * HTTP transport that replays a scripted sequence of outcomes.
 *
 * <p>Each call to {@link #send(TransportRequest)} consumes the next scripted step. When the
 * script is exhausted, a {@code 200} response with an empty body is returned. Every request
 * is recorded so tests can assert how much I/O actually happened.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * transport.respond(503).respond(503).respond(200, "{\"state\":\"on\"}");
 * </pre>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class ScriptedHttpTransport implements HttpTransport {

    private final Deque<Step> script = new ArrayDeque<>();
    private final List<TransportRequest> requests = new ArrayList<>();

    public synchronized ScriptedHttpTransport respond(int statusCode) {
        return respond(statusCode, "");
    }

    public synchronized ScriptedHttpTransport respond(int statusCode, String body) {
        TransportResponse response = TransportResponse.of(statusCode, body);
        script.addLast(() -> response);
        return this;
    }

    public synchronized ScriptedHttpTransport timeout() {
        script.addLast(() -> {
            throw new TimeoutException("scripted timeout");
        });
        return this;
    }

    public synchronized ScriptedHttpTransport connectionError() {
        script.addLast(() -> {
            throw new IOException("scripted connection reset");
        });
        return this;
    }

    @Override
    public TransportResponse send(TransportRequest request) throws IOException, TimeoutException {
        Step step;
        synchronized (this) {
            requests.add(request);
            step = script.pollFirst();
        }
        if (step == null) {
            return TransportResponse.of(200, "");
        }
        return step.run();
    }

    public synchronized int requestCount() {
        return requests.size();
    }

    public synchronized List<TransportRequest> requests() {
        return List.copyOf(requests);
    }

    public synchronized int remainingSteps() {
        return script.size();
    }

    public synchronized void clear() {
        script.clear();
        requests.clear();
    }

    @FunctionalInterface
    private interface Step {
        TransportResponse run() throws IOException, TimeoutException;
    }
}
