package com.ryuqq.relay.adapter.runner.component;

import com.ryuqq.relay.application.gateway.CircuitBreakerOperation;
import com.ryuqq.relay.application.gateway.GatewayComponent;
import com.ryuqq.relay.application.gateway.GatewayInterface;
import com.ryuqq.relay.application.gateway.OperationArguments;
import com.ryuqq.relay.core.model.CorrelationId;
import com.ryuqq.relay.core.outcome.OperationResult;
import com.ryuqq.relay.core.protection.CircuitBreaker;
import com.ryuqq.relay.core.protection.CircuitBreakerProvider;
import com.ryuqq.relay.core.protection.CircuitBreakerSnapshot;

import java.util.Optional;

/**
 * {@code circuit_breaker} 인터페이스 처리기.
 *
 * <p>STATE는 아직 생성되지 않은 의존성에 대해 CLOSED 스냅샷을 반환하며 Breaker를 생성하지 않습니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class CircuitBreakerGatewayComponent implements GatewayComponent<CircuitBreakerOperation> {

    private final CircuitBreakerProvider circuitBreakers;

    public CircuitBreakerGatewayComponent(CircuitBreakerProvider circuitBreakers) {
        if (circuitBreakers == null) {
            throw new IllegalArgumentException("circuitBreakers cannot be null");
        }
        this.circuitBreakers = circuitBreakers;
    }

    @Override
    public GatewayInterface gatewayInterface() {
        return GatewayInterface.CIRCUIT_BREAKER;
    }

    @Override
    public Class<CircuitBreakerOperation> operationType() {
        return CircuitBreakerOperation.class;
    }

    @Override
    public OperationResult handle(CircuitBreakerOperation operation, OperationArguments arguments, CorrelationId correlationId) {
        Object data = switch (operation) {
            case STATE -> {
                String dependency = arguments.requireString("dependency");
                yield circuitBreakers.find(dependency)
                    .map(CircuitBreaker::snapshot)
                    .orElseGet(() -> CircuitBreakerSnapshot.closed(dependency));
            }
            case LIST -> circuitBreakers.snapshots();
            case RESET -> {
                Optional<CircuitBreaker> breaker = circuitBreakers.find(arguments.requireString("dependency"));
                breaker.ifPresent(CircuitBreaker::reset);
                yield breaker.isPresent();
            }
            case RESET_ALL -> circuitBreakers.resetAll();
        };
        return OperationResult.success(correlationId, data);
    }
}
