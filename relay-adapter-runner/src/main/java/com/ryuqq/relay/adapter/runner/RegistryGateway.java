package com.ryuqq.relay.adapter.runner;

import com.ryuqq.relay.application.gateway.Gateway;
import com.ryuqq.relay.application.gateway.GatewayComponent;
import com.ryuqq.relay.application.gateway.GatewayInterface;
import com.ryuqq.relay.application.gateway.GatewayOperation;
import com.ryuqq.relay.application.gateway.GatewayStats;
import com.ryuqq.relay.application.gateway.OperationArguments;
import com.ryuqq.relay.application.gateway.OperationRequest;
import com.ryuqq.relay.core.model.CorrelationId;
import com.ryuqq.relay.core.outcome.ErrorKind;
import com.ryuqq.relay.core.outcome.Failure;
import com.ryuqq.relay.core.outcome.OperationResult;
import com.ryuqq.relay.core.spi.ComponentCreationException;
import com.ryuqq.relay.core.spi.MetricsSink;
import com.ryuqq.relay.core.spi.SingletonRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Singleton Registry 기반 Gateway 구현체.
 *
 * <p>인터페이스/오퍼레이션 이름을 닫힌 enum으로 해석한 뒤, 해당 인터페이스의 컴포넌트를
 * Registry에서 조회(없으면 등록된 팩토리로 생성)하여 처리를 위임합니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>Correlation ID 결정 (요청 필드 → {@code correlation_id} 인자 → 생성)</li>
 *   <li>MDC에 {@code correlationId} 설정</li>
 *   <li>인터페이스/오퍼레이션 해석: 실패 시 {@code DISPATCH}</li>
 *   <li>Registry에서 컴포넌트 조회/생성: 실패 시 {@code INTERNAL}</li>
 *   <li>컴포넌트 처리: {@link IllegalArgumentException}은 {@code VALIDATION},
 *       그 외 런타임 예외는 {@code INTERNAL}</li>
 *   <li>통계 기록 후 MDC 복원</li>
 * </ol>
 *
 * <p>어떤 경우에도 예외를 던지지 않습니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class RegistryGateway implements Gateway {

    private static final Logger log = LoggerFactory.getLogger(RegistryGateway.class);

    public static final String MDC_CORRELATION_ID = "correlationId";

    private final SingletonRegistry registry;
    private final Map<GatewayInterface, Supplier<? extends GatewayComponent<?>>> factories;
    private final MetricsSink metrics;

    private long totalCalls;
    private long failures;
    private final Map<String, Long> callsByOperation = new LinkedHashMap<>();
    private final Map<ErrorKind, Long> failuresByKind = new EnumMap<>(ErrorKind.class);

    /**
     * 생성자.
     *
     * @param registry 컴포넌트를 소유하는 Singleton Registry
     * @param factories 인터페이스별 컴포넌트 팩토리 (최초 호출 시 한 번 사용)
     * @param metrics 메트릭 수집
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public RegistryGateway(
        SingletonRegistry registry,
        Map<GatewayInterface, Supplier<? extends GatewayComponent<?>>> factories,
        MetricsSink metrics
    ) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (factories == null) {
            throw new IllegalArgumentException("factories cannot be null");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("metrics cannot be null");
        }
        this.registry = registry;
        this.factories = factories.isEmpty()
            ? new EnumMap<>(GatewayInterface.class)
            : new EnumMap<>(factories);
        this.metrics = metrics;
    }

    @Override
    public OperationResult execute(String interfaceName, String operation, Map<String, ?> arguments) {
        OperationArguments parsed;
        try {
            parsed = OperationArguments.of(arguments);
        } catch (IllegalArgumentException e) {
            return record(null, OperationResult.failure(CorrelationId.generate(), ErrorKind.VALIDATION, e.getMessage()));
        }
        return execute(new OperationRequest(interfaceName, operation, parsed, null));
    }

    @Override
    public OperationResult execute(OperationRequest request) {
        if (request == null) {
            return record(null, OperationResult.failure(CorrelationId.generate(), ErrorKind.DISPATCH, "request cannot be null"));
        }

        CorrelationId correlationId;
        try {
            correlationId = resolveCorrelationId(request);
        } catch (IllegalArgumentException e) {
            return record(null, OperationResult.failure(CorrelationId.generate(), ErrorKind.VALIDATION, e.getMessage()));
        }

        Optional<GatewayInterface> gatewayInterface = GatewayInterface.resolve(request.interfaceName());
        if (gatewayInterface.isEmpty()) {
            return record(null, OperationResult.failure(correlationId, ErrorKind.DISPATCH,
                "Unknown interface '" + request.interfaceName() + "' (supported: " + GatewayInterface.interfaceNames() + ")"));
        }

        Optional<GatewayOperation> operation = gatewayInterface.get().resolveOperation(request.operation());
        if (operation.isEmpty()) {
            return record(null, OperationResult.failure(correlationId, ErrorKind.DISPATCH,
                "Unknown operation '" + request.operation() + "' for interface '"
                    + gatewayInterface.get().interfaceName() + "'"));
        }

        return dispatch(gatewayInterface.get(), operation.get(), request.arguments(), correlationId);
    }

    @Override
    public OperationResult execute(GatewayInterface gatewayInterface, GatewayOperation operation, OperationArguments arguments) {
        CorrelationId correlationId;
        try {
            correlationId = fromArgument(arguments).orElseGet(CorrelationId::generate);
        } catch (IllegalArgumentException e) {
            return record(null, OperationResult.failure(CorrelationId.generate(), ErrorKind.VALIDATION, e.getMessage()));
        }
        if (gatewayInterface == null || operation == null) {
            return record(null, OperationResult.failure(correlationId, ErrorKind.DISPATCH,
                "interface and operation are required"));
        }
        if (!gatewayInterface.supports(operation)) {
            return record(null, OperationResult.failure(correlationId, ErrorKind.DISPATCH,
                "Operation " + operation + " does not belong to interface '" + gatewayInterface.interfaceName() + "'"));
        }
        return dispatch(gatewayInterface, operation, arguments == null ? OperationArguments.empty() : arguments, correlationId);
    }

    @Override
    public synchronized GatewayStats stats() {
        return new GatewayStats(totalCalls, callsByOperation, failures, failuresByKind);
    }

    @Override
    public synchronized void resetStats() {
        totalCalls = 0;
        failures = 0;
        callsByOperation.clear();
        failuresByKind.clear();
    }

    private OperationResult dispatch(
        GatewayInterface gatewayInterface,
        GatewayOperation operation,
        OperationArguments arguments,
        CorrelationId correlationId
    ) {
        String key = gatewayInterface.interfaceName() + "." + operation.operationName();
        String previous = MDC.get(MDC_CORRELATION_ID);
        MDC.put(MDC_CORRELATION_ID, correlationId.getValue());
        try {
            log.debug("Dispatching {}: correlationId={}, arguments={}", key, correlationId, arguments);
            return record(key, invoke(gatewayInterface, operation, arguments, correlationId));
        } finally {
            if (previous == null) {
                MDC.remove(MDC_CORRELATION_ID);
            } else {
                MDC.put(MDC_CORRELATION_ID, previous);
            }
        }
    }

    private OperationResult invoke(
        GatewayInterface gatewayInterface,
        GatewayOperation operation,
        OperationArguments arguments,
        CorrelationId correlationId
    ) {
        GatewayComponent<?> component;
        try {
            component = resolveComponent(gatewayInterface);
        } catch (ComponentCreationException e) {
            log.error("Component creation failed for {}: correlationId={}", gatewayInterface.componentName(), correlationId, e);
            return OperationResult.failure(correlationId, ErrorKind.INTERNAL, e.getMessage());
        }
        if (component == null) {
            return OperationResult.failure(correlationId, ErrorKind.DISPATCH,
                "No component registered for interface '" + gatewayInterface.interfaceName() + "'");
        }

        try {
            OperationResult result = component.dispatch(operation, arguments, correlationId);
            if (result == null) {
                return OperationResult.failure(correlationId, ErrorKind.INTERNAL,
                    gatewayInterface.interfaceName() + "." + operation.operationName() + " returned no result");
            }
            return result;
        } catch (IllegalArgumentException e) {
            log.debug("Invalid arguments for {}.{}: {}", gatewayInterface.interfaceName(), operation.operationName(), e.getMessage());
            return OperationResult.failure(correlationId, ErrorKind.VALIDATION, messageOf(e));
        } catch (RuntimeException e) {
            log.error("Unexpected failure in {}.{}: correlationId={}",
                gatewayInterface.interfaceName(), operation.operationName(), correlationId, e);
            return OperationResult.failure(correlationId, ErrorKind.INTERNAL, messageOf(e));
        }
    }

    private GatewayComponent<?> resolveComponent(GatewayInterface gatewayInterface) {
        Supplier<? extends GatewayComponent<?>> factory = factories.get(gatewayInterface);
        if (factory == null) {
            return registry.find(gatewayInterface.componentName())
                .filter(GatewayComponent.class::isInstance)
                .map(instance -> (GatewayComponent<?>) instance)
                .orElse(null);
        }
        GatewayComponent<?> component = registry.getOrCreate(gatewayInterface.componentName(), GatewayComponent.class, factory);
        if (component.gatewayInterface() != gatewayInterface) {
            throw new ComponentCreationException(gatewayInterface.componentName(),
                "registered component serves '" + component.gatewayInterface().interfaceName() + "'");
        }
        return component;
    }

    private CorrelationId resolveCorrelationId(OperationRequest request) {
        if (request.correlationId() != null) {
            return request.correlationId();
        }
        return fromArgument(request.arguments()).orElseGet(CorrelationId::generate);
    }

    private static Optional<CorrelationId> fromArgument(OperationArguments arguments) {
        if (arguments == null) {
            return Optional.empty();
        }
        return arguments.optionalString(OperationRequest.CORRELATION_ID_ARGUMENT).map(CorrelationId::of);
    }

    private synchronized OperationResult record(String key, OperationResult result) {
        totalCalls++;
        if (key != null) {
            callsByOperation.merge(key, 1L, Long::sum);
        }
        if (result instanceof Failure failure) {
            failures++;
            failuresByKind.merge(failure.errorKind(), 1L, Long::sum);
            metrics.increment("relay.gateway.failures");
        }
        metrics.increment("relay.gateway.calls");
        return result;
    }

    private static String messageOf(RuntimeException e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}
