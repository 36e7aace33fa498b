package com.ryuqq.relay.adapter.runner.component;

import com.ryuqq.relay.application.gateway.GatewayComponent;
import com.ryuqq.relay.application.gateway.GatewayInterface;
import com.ryuqq.relay.application.gateway.OperationArguments;
import com.ryuqq.relay.application.gateway.SingletonOperation;
import com.ryuqq.relay.core.model.CorrelationId;
import com.ryuqq.relay.core.outcome.OperationResult;
import com.ryuqq.relay.core.spi.SingletonRegistry;

import java.util.function.Supplier;

/**
 * {@code singleton} 인터페이스 처리기.
 *
 * <p>GET은 {@code Optional}을, REPLACE는 이전 인스턴스의 {@code Optional}을 반환합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class SingletonGatewayComponent implements GatewayComponent<SingletonOperation> {

    private final SingletonRegistry registry;

    public SingletonGatewayComponent(SingletonRegistry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        this.registry = registry;
    }

    @Override
    public GatewayInterface gatewayInterface() {
        return GatewayInterface.SINGLETON;
    }

    @Override
    public Class<SingletonOperation> operationType() {
        return SingletonOperation.class;
    }

    @Override
    public OperationResult handle(SingletonOperation operation, OperationArguments arguments, CorrelationId correlationId) {
        Object data = switch (operation) {
            case GET -> registry.find(arguments.requireString("name"));
            case GET_OR_CREATE -> registry.getOrCreate(
                arguments.requireString("name"), (Supplier<?>) arguments.require("factory", Supplier.class));
            case REPLACE -> registry.replace(arguments.requireString("name"), arguments.require("instance"));
            case EXISTS -> registry.exists(arguments.requireString("name"));
            case DELETE -> registry.delete(arguments.requireString("name"));
            case CLEAR -> registry.clear();
            case STATS -> registry.stats();
        };
        return OperationResult.success(correlationId, data);
    }
}
