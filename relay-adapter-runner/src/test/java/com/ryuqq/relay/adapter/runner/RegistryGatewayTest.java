package com.ryuqq.relay.adapter.runner;

import com.ryuqq.relay.adapter.inmemory.cache.TtlLruCache;
import com.ryuqq.relay.adapter.inmemory.registry.InMemorySingletonRegistry;
import com.ryuqq.relay.adapter.runner.component.CacheGatewayComponent;
import com.ryuqq.relay.adapter.runner.component.SingletonGatewayComponent;
import com.ryuqq.relay.application.gateway.CacheOperation;
import com.ryuqq.relay.application.gateway.CircuitBreakerOperation;
import com.ryuqq.relay.application.gateway.GatewayComponent;
import com.ryuqq.relay.application.gateway.GatewayInterface;
import com.ryuqq.relay.application.gateway.GatewayStats;
import com.ryuqq.relay.application.gateway.OperationArguments;
import com.ryuqq.relay.application.gateway.OperationRequest;
import com.ryuqq.relay.application.gateway.SingletonOperation;
import com.ryuqq.relay.core.model.CorrelationId;
import com.ryuqq.relay.core.outcome.ErrorKind;
import com.ryuqq.relay.core.outcome.Failure;
import com.ryuqq.relay.core.outcome.OperationResult;
import com.ryuqq.relay.core.outcome.Success;
import com.ryuqq.relay.core.spi.cache.CacheConfig;
import com.ryuqq.relay.core.spi.cache.CacheLookup;
import com.ryuqq.relay.core.spi.noop.NoOpMetricsSink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * RegistryGateway 유닛 테스트.
 *
 * <p>이름 해석, 컴포넌트 지연 생성, 예외의 결과 변환, Correlation ID/MDC 처리, 통계를 검증합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
class RegistryGatewayTest {

    private final AtomicLong nowNanos = new AtomicLong();
    private final AtomicInteger cacheComponentCreations = new AtomicInteger();

    private InMemorySingletonRegistry registry;
    private Map<GatewayInterface, Supplier<? extends GatewayComponent<?>>> factories;
    private RegistryGateway gateway;

    @BeforeEach
    void setUp() {
        registry = new InMemorySingletonRegistry();
        TtlLruCache cache = new TtlLruCache(CacheConfig.defaults(), nowNanos::get);
        factories = new EnumMap<>(GatewayInterface.class);
        factories.put(GatewayInterface.CACHE, () -> {
            cacheComponentCreations.incrementAndGet();
            return new CacheGatewayComponent(cache);
        });
        factories.put(GatewayInterface.SINGLETON, () -> new SingletonGatewayComponent(registry));
        gateway = new RegistryGateway(registry, factories, new NoOpMetricsSink());
    }

    // ============================================================
    // 1. 이름 해석
    // ============================================================

    @Test
    void execute_알수없는_인터페이스는_DISPATCH() {
        // when
        OperationResult result = gateway.execute("telepathy", "get", Map.of());

        // then
        assertThat(((Failure) result).errorKind()).isEqualTo(ErrorKind.DISPATCH);
        assertThat(((Failure) result).error()).contains("telepathy");
    }

    @Test
    void execute_알수없는_오퍼레이션은_DISPATCH() {
        // when
        OperationResult result = gateway.execute("cache", "explode", Map.of());

        // then
        assertThat(((Failure) result).errorKind()).isEqualTo(ErrorKind.DISPATCH);
        assertThat(((Failure) result).error()).contains("explode");
    }

    @Test
    void execute_이름은_대소문자와_하이픈을_구분하지_않음() {
        // given
        gateway.execute("cache", "set", Map.of("key", "k", "value", "v"));

        // when
        OperationResult result = gateway.execute("CACHE", "Cleanup-Expired", Map.of());

        // then
        assertThat(result.isSuccess()).isTrue();
        assertThat(((Success) result).data()).isEqualTo(0);
    }

    @Test
    void execute_팩토리가_없는_인터페이스는_DISPATCH() {
        // when
        OperationResult result = gateway.execute("circuit_breaker", "list", Map.of());

        // then
        assertThat(((Failure) result).errorKind()).isEqualTo(ErrorKind.DISPATCH);
    }

    @Test
    void execute_다른_인터페이스의_오퍼레이션을_넘기면_DISPATCH() {
        // when
        OperationResult result = gateway.execute(GatewayInterface.CACHE, CircuitBreakerOperation.LIST, OperationArguments.empty());

        // then
        assertThat(((Failure) result).errorKind()).isEqualTo(ErrorKind.DISPATCH);
    }

    // ============================================================
    // 2. 컴포넌트 생성과 위임
    // ============================================================

    @Test
    void execute_컴포넌트는_Registry에_한번만_생성됨() {
        // when
        gateway.execute("cache", "set", Map.of("key", "greeting", "value", "hello"));
        OperationResult result = gateway.execute(GatewayInterface.CACHE, CacheOperation.GET,
            OperationArguments.of(Map.of("key", "greeting")));

        // then
        assertThat(((Success) result).data()).isEqualTo(CacheLookup.hit("hello"));
        assertThat(cacheComponentCreations.get()).isEqualTo(1);
        assertThat(registry.exists(GatewayInterface.CACHE.componentName())).isTrue();
    }

    @Test
    void execute_캐시_미스도_성공() {
        // when
        OperationResult result = gateway.execute("cache", "get", Map.of("key", "absent"));

        // then
        assertThat(result.isSuccess()).isTrue();
        assertThat(((Success) result).data()).isEqualTo(CacheLookup.miss());
    }

    @Test
    void execute_필수_인자가_없으면_VALIDATION() {
        // when
        OperationResult result = gateway.execute("cache", "get", Map.of());

        // then
        assertThat(((Failure) result).errorKind()).isEqualTo(ErrorKind.VALIDATION);
        assertThat(((Failure) result).error()).contains("key");
    }

    @Test
    void execute_컴포넌트_생성_실패는_INTERNAL이고_등록되지_않음() {
        // given
        factories.put(GatewayInterface.CIRCUIT_BREAKER, () -> {
            throw new IllegalStateException("provider unavailable");
        });
        gateway = new RegistryGateway(registry, factories, new NoOpMetricsSink());

        // when
        OperationResult result = gateway.execute("circuit_breaker", "list", Map.of());

        // then
        assertThat(((Failure) result).errorKind()).isEqualTo(ErrorKind.INTERNAL);
        assertThat(((Failure) result).error()).contains("provider unavailable");
        assertThat(registry.exists(GatewayInterface.CIRCUIT_BREAKER.componentName())).isFalse();
    }

    @Test
    void execute_처리중_런타임_예외는_INTERNAL로_변환되고_던지지_않음() {
        // given
        Map<String, Object> arguments = new HashMap<>();
        arguments.put("name", "exploding");
        arguments.put("factory", (Supplier<Object>) () -> {
            throw new IllegalStateException("boom");
        });

        // when
        OperationResult result = gateway.execute("singleton", "get_or_create", arguments);

        // then
        assertThat(((Failure) result).errorKind()).isEqualTo(ErrorKind.INTERNAL);
        assertThat(((Failure) result).error()).contains("boom");
        assertThat(registry.exists("exploding")).isFalse();
    }

    // ============================================================
    // 3. Correlation ID / MDC
    // ============================================================

    @Test
    void execute_correlation_id_인자를_결과에_전파() {
        // when
        OperationResult result = gateway.execute("cache", "stats", Map.of("correlation_id", "alexa-req-42"));

        // then
        assertThat(result.correlationId().getValue()).isEqualTo("alexa-req-42");
    }

    @Test
    void execute_요청의_correlationId가_인자보다_우선() {
        // given
        OperationRequest request = OperationRequest.of("cache", "stats", Map.of("correlation_id", "from-argument"))
            .withCorrelationId(CorrelationId.of("from-request"));

        // when
        OperationResult result = gateway.execute(request);

        // then
        assertThat(result.correlationId().getValue()).isEqualTo("from-request");
    }

    @Test
    void execute_처리중에만_MDC에_correlationId를_둠() {
        // given
        AtomicReference<String> seen = new AtomicReference<>();
        Map<String, Object> arguments = new HashMap<>();
        arguments.put("name", "mdc-probe");
        arguments.put("factory", (Supplier<Object>) () -> {
            seen.set(MDC.get(RegistryGateway.MDC_CORRELATION_ID));
            return "probe";
        });
        arguments.put("correlation_id", "mdc-42");

        // when
        gateway.execute("singleton", "get_or_create", arguments);

        // then
        assertThat(seen.get()).isEqualTo("mdc-42");
        assertThat(MDC.get(RegistryGateway.MDC_CORRELATION_ID)).isNull();
    }

    @Test
    void execute_잘못된_correlation_id는_VALIDATION() {
        // when
        OperationResult result = gateway.execute("cache", "stats", Map.of("correlation_id", "has space"));

        // then
        assertThat(((Failure) result).errorKind()).isEqualTo(ErrorKind.VALIDATION);
    }

    // ============================================================
    // 4. 통계
    // ============================================================

    @Test
    void stats_오퍼레이션별_호출과_실패_종류를_집계() {
        // given
        gateway.execute("cache", "set", Map.of("key", "k", "value", "v"));
        gateway.execute("cache", "get", Map.of("key", "k"));
        gateway.execute("cache", "get", Map.of());
        gateway.execute("nope", "get", Map.of());
        gateway.execute(GatewayInterface.SINGLETON, SingletonOperation.STATS, OperationArguments.empty());

        // when
        GatewayStats stats = gateway.stats();

        // then
        assertThat(stats.totalCalls()).isEqualTo(5);
        assertThat(stats.callsOf("cache.get")).isEqualTo(2);
        assertThat(stats.callsOf("cache.set")).isEqualTo(1);
        assertThat(stats.callsOf("singleton.stats")).isEqualTo(1);
        assertThat(stats.failures()).isEqualTo(2);
        assertThat(stats.failuresByKind())
            .containsEntry(ErrorKind.VALIDATION, 1L)
            .containsEntry(ErrorKind.DISPATCH, 1L);

        gateway.resetStats();
        assertThat(gateway.stats().totalCalls()).isZero();
        assertThat(gateway.stats().callsByOperation()).isEmpty();
    }
}
