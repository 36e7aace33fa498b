package com.ryuqq.relay.adapter.inmemory.protection;

import com.ryuqq.relay.core.protection.CircuitBreaker;
import com.ryuqq.relay.core.protection.CircuitBreakerConfig;
import com.ryuqq.relay.core.protection.CircuitBreakerProvider;
import com.ryuqq.relay.core.protection.CircuitBreakerSnapshot;
import com.ryuqq.relay.core.time.MonotonicClock;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 의존 대상별 {@link ConsecutiveFailureCircuitBreaker} 저장소.
 *
 * <p>{@link ConcurrentHashMap#computeIfAbsent}로 이름당 하나의 Breaker만 생성합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class InMemoryCircuitBreakerProvider implements CircuitBreakerProvider {

    private final CircuitBreakerConfig config;
    private final MonotonicClock clock;
    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();

    public InMemoryCircuitBreakerProvider(CircuitBreakerConfig config, MonotonicClock clock) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.config = config;
        this.clock = clock;
    }

    @Override
    public CircuitBreaker forDependency(String dependencyName) {
        if (dependencyName == null || dependencyName.isBlank()) {
            throw new IllegalArgumentException("dependencyName cannot be null or blank");
        }
        return breakers.computeIfAbsent(dependencyName,
            name -> new ConsecutiveFailureCircuitBreaker(name, config, clock));
    }

    @Override
    public Optional<CircuitBreaker> find(String dependencyName) {
        if (dependencyName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(breakers.get(dependencyName));
    }

    @Override
    public List<CircuitBreakerSnapshot> snapshots() {
        List<CircuitBreakerSnapshot> snapshots = new ArrayList<>();
        for (CircuitBreaker breaker : breakers.values()) {
            snapshots.add(breaker.snapshot());
        }
        snapshots.sort((a, b) -> a.dependencyName().compareTo(b.dependencyName()));
        return snapshots;
    }

    @Override
    public int resetAll() {
        int count = 0;
        for (CircuitBreaker breaker : breakers.values()) {
            breaker.reset();
            count++;
        }
        return count;
    }

    @Override
    public CircuitBreakerConfig getConfig() {
        return config;
    }
}
