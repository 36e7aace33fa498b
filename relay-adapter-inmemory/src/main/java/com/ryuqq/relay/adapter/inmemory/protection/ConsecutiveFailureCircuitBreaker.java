package com.ryuqq.relay.adapter.inmemory.protection;

import com.ryuqq.relay.core.model.CorrelationId;
import com.ryuqq.relay.core.protection.CircuitBreaker;
import com.ryuqq.relay.core.protection.CircuitBreakerConfig;
import com.ryuqq.relay.core.protection.CircuitBreakerSnapshot;
import com.ryuqq.relay.core.protection.CircuitBreakerState;
import com.ryuqq.relay.core.time.MonotonicClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 연속 실패 횟수 기반 Circuit Breaker.
 *
 * <p><strong>상태 전이:</strong></p>
 * <ul>
 *   <li>CLOSED: 실패마다 카운터 증가, 성공 시 0으로 초기화.
 *       카운터가 {@code failureThreshold}에 도달하면 OPEN</li>
 *   <li>OPEN: {@code recoveryTimeout}이 지나기 전까지 모든 요청 거부.
 *       지난 뒤 첫 {@link #tryAcquire}가 HALF_OPEN으로 전이하며 프로브로 허용됨</li>
 *   <li>HALF_OPEN: 최대 {@code halfOpenMaxProbes}개의 프로브만 허용.
 *       성공하면 CLOSED, 실패하면 OPEN으로 돌아가고 {@code openedAt}을 다시 기록</li>
 * </ul>
 *
 * <p>OPEN 상태에서 도착한 늦은 성공 신호는 카운터만 초기화하고 상태는 바꾸지 않습니다.
 * CLOSED로 돌아가는 경로는 HALF_OPEN 프로브 성공과 {@link #reset()}뿐입니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class ConsecutiveFailureCircuitBreaker implements CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(ConsecutiveFailureCircuitBreaker.class);

    private final String dependencyName;
    private final CircuitBreakerConfig config;
    private final MonotonicClock clock;
    private final long recoveryTimeoutNanos;

    private CircuitBreakerState state = CircuitBreakerState.CLOSED;
    private int consecutiveFailures;
    private long openedAtNanos;
    private int probesInFlight;

    public ConsecutiveFailureCircuitBreaker(String dependencyName, CircuitBreakerConfig config, MonotonicClock clock) {
        if (dependencyName == null || dependencyName.isBlank()) {
            throw new IllegalArgumentException("dependencyName cannot be null or blank");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.dependencyName = dependencyName;
        this.config = config;
        this.clock = clock;
        this.recoveryTimeoutNanos = config.recoveryTimeout().toNanos();
    }

    @Override
    public synchronized boolean tryAcquire(CorrelationId correlationId) {
        if (state == CircuitBreakerState.CLOSED) {
            return true;
        }

        if (state == CircuitBreakerState.OPEN) {
            if (clock.nowNanos() - openedAtNanos < recoveryTimeoutNanos) {
                return false;
            }
            transitionTo(CircuitBreakerState.HALF_OPEN);
            probesInFlight = 0;
        }

        if (probesInFlight >= config.halfOpenMaxProbes()) {
            log.debug("Half-open probe rejected: dependency={}, correlationId={}, probesInFlight={}",
                dependencyName, correlationId, probesInFlight);
            return false;
        }
        probesInFlight++;
        log.info("Half-open probe admitted: dependency={}, correlationId={}", dependencyName, correlationId);
        return true;
    }

    @Override
    public synchronized void recordSuccess(CorrelationId correlationId) {
        consecutiveFailures = 0;
        if (state == CircuitBreakerState.HALF_OPEN) {
            probesInFlight = 0;
            transitionTo(CircuitBreakerState.CLOSED);
        }
    }

    @Override
    public synchronized void recordFailure(CorrelationId correlationId, Throwable cause) {
        consecutiveFailures++;

        if (state == CircuitBreakerState.HALF_OPEN) {
            probesInFlight = 0;
            openedAtNanos = clock.nowNanos();
            transitionTo(CircuitBreakerState.OPEN);
            return;
        }

        if (state == CircuitBreakerState.CLOSED && consecutiveFailures >= config.failureThreshold()) {
            openedAtNanos = clock.nowNanos();
            transitionTo(CircuitBreakerState.OPEN);
            log.warn("Circuit opened: dependency={}, correlationId={}, consecutiveFailures={}, cause={}",
                dependencyName, correlationId, consecutiveFailures, cause == null ? "status" : cause.toString());
        }
    }

    @Override
    public synchronized CircuitBreakerState getState() {
        return state;
    }

    @Override
    public String getDependencyName() {
        return dependencyName;
    }

    public CircuitBreakerConfig getConfig() {
        return config;
    }

    @Override
    public synchronized CircuitBreakerSnapshot snapshot() {
        Long openedAt = state == CircuitBreakerState.CLOSED ? null : openedAtNanos;
        return new CircuitBreakerSnapshot(dependencyName, state, consecutiveFailures, openedAt, probesInFlight);
    }

    @Override
    public synchronized void reset() {
        consecutiveFailures = 0;
        probesInFlight = 0;
        openedAtNanos = 0;
        transitionTo(CircuitBreakerState.CLOSED);
    }

    private void transitionTo(CircuitBreakerState next) {
        if (state == next) {
            return;
        }
        CircuitBreakerState previous = state;
        state = next;
        if (next == CircuitBreakerState.OPEN) {
            log.warn("Circuit state changed: dependency={}, {} -> {}", dependencyName, previous, next);
        } else {
            log.info("Circuit state changed: dependency={}, {} -> {}", dependencyName, previous, next);
        }
    }
}
