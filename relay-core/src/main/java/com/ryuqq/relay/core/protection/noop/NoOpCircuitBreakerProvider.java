package com.ryuqq.relay.core.protection.noop;

import com.ryuqq.relay.core.protection.CircuitBreaker;
import com.ryuqq.relay.core.protection.CircuitBreakerConfig;
import com.ryuqq.relay.core.protection.CircuitBreakerProvider;
import com.ryuqq.relay.core.protection.CircuitBreakerSnapshot;

import java.util.List;
import java.util.Optional;

/**
 * 항상 {@link NoOpCircuitBreaker}를 돌려주는 Provider.
 *
 * <p>생성한 Breaker를 기억하지 않으므로 {@link #snapshots()}는 항상 비어 있습니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class NoOpCircuitBreakerProvider implements CircuitBreakerProvider {

    @Override
    public CircuitBreaker forDependency(String dependencyName) {
        return new NoOpCircuitBreaker(dependencyName);
    }

    @Override
    public Optional<CircuitBreaker> find(String dependencyName) {
        return Optional.empty();
    }

    @Override
    public List<CircuitBreakerSnapshot> snapshots() {
        return List.of();
    }

    @Override
    public int resetAll() {
        return 0;
    }

    @Override
    public CircuitBreakerConfig getConfig() {
        return CircuitBreakerConfig.defaults();
    }
}
