package com.ryuqq.relay.adapter.runner.component;

import com.ryuqq.relay.adapter.runner.websocket.PersistentConnectionClient;
import com.ryuqq.relay.application.gateway.GatewayComponent;
import com.ryuqq.relay.application.gateway.GatewayInterface;
import com.ryuqq.relay.application.gateway.OperationArguments;
import com.ryuqq.relay.application.gateway.WebSocketOperation;
import com.ryuqq.relay.core.model.CorrelationId;
import com.ryuqq.relay.core.outcome.OperationResult;

import java.time.Duration;

/**
 * {@code websocket} 인터페이스 처리기.
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class WebSocketGatewayComponent implements GatewayComponent<WebSocketOperation> {

    private final PersistentConnectionClient connectionClient;

    public WebSocketGatewayComponent(PersistentConnectionClient connectionClient) {
        if (connectionClient == null) {
            throw new IllegalArgumentException("connectionClient cannot be null");
        }
        this.connectionClient = connectionClient;
    }

    @Override
    public GatewayInterface gatewayInterface() {
        return GatewayInterface.WEBSOCKET;
    }

    @Override
    public Class<WebSocketOperation> operationType() {
        return WebSocketOperation.class;
    }

    @Override
    public OperationResult handle(WebSocketOperation operation, OperationArguments arguments, CorrelationId correlationId) {
        return switch (operation) {
            case CONNECT -> connectionClient.connect(
                arguments.requireString("url"),
                arguments.optionalStringMap("headers"),
                timeoutOf(arguments),
                correlationId);
            case SEND -> connectionClient.send(
                arguments.requireString("connection_id"),
                arguments.require("message"),
                correlationId);
            case RECEIVE -> connectionClient.receive(
                arguments.requireString("connection_id"),
                timeoutOf(arguments),
                correlationId);
            case CLOSE -> connectionClient.close(arguments.requireString("connection_id"), correlationId);
            case REQUEST -> connectionClient.request(
                arguments.requireString("url"),
                arguments.require("message"),
                arguments.optionalStringMap("headers"),
                timeoutOf(arguments),
                arguments.optionalBoolean("wait_for_response").orElse(Boolean.TRUE),
                correlationId);
            case STATS -> OperationResult.success(correlationId, connectionClient.stats());
        };
    }

    private static Duration timeoutOf(OperationArguments arguments) {
        return arguments.optionalLong("timeout_seconds").map(Duration::ofSeconds).orElse(null);
    }
}
