package com.ryuqq.relay.testkit.contract;

import com.ryuqq.relay.core.spi.transport.ConnectionFactory;
import com.ryuqq.relay.core.spi.transport.PersistentConnection;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Persistent connection factory backed by scripted in-memory connections.
 *
 * <p>Replies queued with {@link #reply(String)} are handed out in order to {@code receive}
 * calls across all connections. An empty queue makes {@code receive} time out. Every opened
 * connection is kept so tests can assert close counts.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class ScriptedConnectionFactory implements ConnectionFactory {

    private final Deque<String> replies = new ArrayDeque<>();
    private final List<ScriptedConnection> opened = new ArrayList<>();
    private boolean refuseConnections;

    public synchronized ScriptedConnectionFactory reply(String message) {
        replies.addLast(message);
        return this;
    }

    public synchronized ScriptedConnectionFactory refuseConnections() {
        this.refuseConnections = true;
        return this;
    }

    @Override
    public synchronized PersistentConnection open(URI uri, Map<String, String> headers, Duration connectTimeout)
        throws IOException {
        if (refuseConnections) {
            throw new IOException("scripted handshake refused: " + uri);
        }
        ScriptedConnection connection = new ScriptedConnection();
        opened.add(connection);
        return connection;
    }

    public synchronized List<ScriptedConnection> openedConnections() {
        return List.copyOf(opened);
    }

    private synchronized String nextReply() {
        return replies.pollFirst();
    }

    /**
     * In-memory connection that records sent messages and close calls.
     */
    public final class ScriptedConnection implements PersistentConnection {

        private final List<String> sent = new ArrayList<>();
        private int closeCount;

        @Override
        public synchronized void send(String message) throws IOException {
            if (closeCount > 0) {
                throw new IOException("connection closed");
            }
            sent.add(message);
        }

        @Override
        public String receive(Duration timeout) throws IOException, TimeoutException {
            synchronized (this) {
                if (closeCount > 0) {
                    throw new IOException("connection closed");
                }
            }
            String reply = nextReply();
            if (reply == null) {
                throw new TimeoutException("no scripted reply within " + timeout);
            }
            return reply;
        }

        @Override
        public synchronized boolean isOpen() {
            return closeCount == 0;
        }

        @Override
        public synchronized void close() {
            closeCount++;
        }

        public synchronized List<String> sentMessages() {
            return List.copyOf(sent);
        }

        public synchronized int closeCount() {
            return closeCount;
        }
    }
}
