package com.ryuqq.relay.core.protection.noop;

import com.ryuqq.relay.core.model.CorrelationId;
import com.ryuqq.relay.core.protection.CircuitBreaker;
import com.ryuqq.relay.core.protection.CircuitBreakerSnapshot;
import com.ryuqq.relay.core.protection.CircuitBreakerState;

/**
 * Circuit Breaker NoOp 구현.
 *
 * <p>모든 요청을 허용하고 상태를 추적하지 않습니다.
 * 보호 없이 클라이언트를 실행하거나 테스트에서 Breaker 영향을 배제할 때 사용합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class NoOpCircuitBreaker implements CircuitBreaker {

    private final String dependencyName;

    public NoOpCircuitBreaker(String dependencyName) {
        if (dependencyName == null || dependencyName.isBlank()) {
            throw new IllegalArgumentException("dependencyName cannot be null or blank");
        }
        this.dependencyName = dependencyName;
    }

    @Override
    public boolean tryAcquire(CorrelationId correlationId) {
        return true;
    }

    @Override
    public void recordSuccess(CorrelationId correlationId) {
        // NoOp
    }

    @Override
    public void recordFailure(CorrelationId correlationId, Throwable cause) {
        // NoOp
    }

    @Override
    public CircuitBreakerState getState() {
        return CircuitBreakerState.CLOSED;
    }

    @Override
    public String getDependencyName() {
        return dependencyName;
    }

    @Override
    public CircuitBreakerSnapshot snapshot() {
        return CircuitBreakerSnapshot.closed(dependencyName);
    }

    @Override
    public void reset() {
        // NoOp
    }
}
