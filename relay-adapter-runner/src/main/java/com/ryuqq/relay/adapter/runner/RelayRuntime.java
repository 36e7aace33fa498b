package com.ryuqq.relay.adapter.runner;

import com.ryuqq.relay.adapter.inmemory.cache.TtlLruCache;
import com.ryuqq.relay.adapter.inmemory.protection.InMemoryCircuitBreakerProvider;
import com.ryuqq.relay.adapter.inmemory.protection.SlidingWindowRateLimiter;
import com.ryuqq.relay.adapter.inmemory.registry.InMemorySingletonRegistry;
import com.ryuqq.relay.adapter.runner.component.CacheGatewayComponent;
import com.ryuqq.relay.adapter.runner.component.CircuitBreakerGatewayComponent;
import com.ryuqq.relay.adapter.runner.component.HttpClientGatewayComponent;
import com.ryuqq.relay.adapter.runner.component.SingletonGatewayComponent;
import com.ryuqq.relay.adapter.runner.component.WebSocketGatewayComponent;
import com.ryuqq.relay.adapter.runner.config.RelaySettings;
import com.ryuqq.relay.adapter.runner.http.JdkHttpTransport;
import com.ryuqq.relay.adapter.runner.http.RetryingHttpClient;
import com.ryuqq.relay.adapter.runner.json.JsonCodec;
import com.ryuqq.relay.adapter.runner.websocket.JdkWebSocketConnectionFactory;
import com.ryuqq.relay.adapter.runner.websocket.PersistentConnectionClient;
import com.ryuqq.relay.application.gateway.Gateway;
import com.ryuqq.relay.application.gateway.GatewayComponent;
import com.ryuqq.relay.application.gateway.GatewayInterface;
import com.ryuqq.relay.core.protection.CircuitBreakerProvider;
import com.ryuqq.relay.core.spi.MetricsSink;
import com.ryuqq.relay.core.spi.SingletonRegistry;
import com.ryuqq.relay.core.spi.cache.Cache;
import com.ryuqq.relay.core.spi.noop.NoOpMetricsSink;
import com.ryuqq.relay.core.spi.transport.ConnectionFactory;
import com.ryuqq.relay.core.spi.transport.HttpTransport;
import com.ryuqq.relay.core.time.MonotonicClock;
import com.ryuqq.relay.core.time.Sleeper;
import com.ryuqq.relay.core.time.SystemMonotonicClock;
import com.ryuqq.relay.core.time.ThreadSleeper;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Relay 런타임 조립.
 *
 * <p>프로세스당 한 번 생성되어 웜 스타트 간에 재사용됩니다. 공유 프리미티브
 * (Circuit Breaker 제공자, 캐시, HTTP/WebSocket 클라이언트)와 Gateway 컴포넌트는 모두
 * {@link SingletonRegistry}에 이름으로 등록되며 최초 사용 시 생성됩니다.</p>
 *
 * <pre>{@code
 * RelayRuntime runtime = RelayRuntime.fromConfig(ConfigFactory.load());
 * OperationResult result = runtime.gateway().execute("http_client", "get", Map.of("url", "https://ha.local/api/"));
 * }</pre>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class RelayRuntime implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RelayRuntime.class);

    public static final String CIRCUIT_BREAKERS = "relay.circuit_breakers";
    public static final String CACHE = "relay.cache";
    public static final String HTTP_CLIENT = "relay.http_client";
    public static final String WEBSOCKET_CLIENT = "relay.websocket_client";

    private final RelaySettings settings;
    private final SingletonRegistry registry;
    private final MonotonicClock clock;
    private final Sleeper sleeper;
    private final MetricsSink metrics;
    private final Supplier<HttpTransport> httpTransport;
    private final Supplier<ConnectionFactory> connectionFactory;
    private final JsonCodec jsonCodec;
    private final RegistryGateway gateway;

    private RelayRuntime(Builder builder) {
        this.settings = builder.settings;
        this.registry = builder.registry != null ? builder.registry : new InMemorySingletonRegistry();
        this.clock = builder.clock;
        this.sleeper = builder.sleeper;
        this.metrics = builder.metrics;
        this.httpTransport = builder.httpTransport;
        this.connectionFactory = builder.connectionFactory;
        this.jsonCodec = builder.jsonCodec;
        this.gateway = new RegistryGateway(registry, componentFactories(), metrics);
        log.info("Relay runtime initialized: retry={}, rateLimit={}, circuitBreaker={}",
            settings.retryPolicy(), settings.rateLimit(), settings.circuitBreaker());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * HOCON 설정으로 런타임을 생성합니다.
     *
     * @param config Typesafe Config
     * @return 런타임
     */
    public static RelayRuntime fromConfig(Config config) {
        return builder().settings(RelaySettings.fromConfig(config)).build();
    }

    /**
     * {@code ConfigFactory.load()} 기반 기본 런타임.
     */
    public static RelayRuntime create() {
        return fromConfig(ConfigFactory.load());
    }

    public Gateway gateway() {
        return gateway;
    }

    public SingletonRegistry registry() {
        return registry;
    }

    public RelaySettings settings() {
        return settings;
    }

    public CircuitBreakerProvider circuitBreakers() {
        return registry.getOrCreate(CIRCUIT_BREAKERS, CircuitBreakerProvider.class,
            () -> new InMemoryCircuitBreakerProvider(settings.circuitBreaker(), clock));
    }

    public Cache cache() {
        return registry.getOrCreate(CACHE, Cache.class, () -> new TtlLruCache(settings.cache(), clock));
    }

    public RetryingHttpClient httpClient() {
        return registry.getOrCreate(HTTP_CLIENT, RetryingHttpClient.class, () -> new RetryingHttpClient(
            httpTransport.get(),
            new SlidingWindowRateLimiter(settings.rateLimit(), clock),
            circuitBreakers(),
            settings.retryPolicy(),
            sleeper,
            clock,
            metrics,
            jsonCodec,
            settings.userAgent()));
    }

    public PersistentConnectionClient connectionClient() {
        return registry.getOrCreate(WEBSOCKET_CLIENT, PersistentConnectionClient.class, () -> new PersistentConnectionClient(
            connectionFactory.get(),
            new SlidingWindowRateLimiter(settings.rateLimit(), clock),
            circuitBreakers(),
            metrics,
            jsonCodec));
    }

    /**
     * 추적 중인 WebSocket 연결을 닫습니다. Registry의 다른 인스턴스는 유지됩니다.
     */
    @Override
    public void close() {
        registry.find(WEBSOCKET_CLIENT)
            .filter(PersistentConnectionClient.class::isInstance)
            .map(PersistentConnectionClient.class::cast)
            .ifPresent(PersistentConnectionClient::closeAll);
    }

    private Map<GatewayInterface, Supplier<? extends GatewayComponent<?>>> componentFactories() {
        Map<GatewayInterface, Supplier<? extends GatewayComponent<?>>> factories = new EnumMap<>(GatewayInterface.class);
        factories.put(GatewayInterface.SINGLETON, () -> new SingletonGatewayComponent(registry));
        factories.put(GatewayInterface.CACHE, () -> new CacheGatewayComponent(cache()));
        factories.put(GatewayInterface.HTTP_CLIENT, () -> new HttpClientGatewayComponent(httpClient()));
        factories.put(GatewayInterface.WEBSOCKET, () -> new WebSocketGatewayComponent(connectionClient()));
        factories.put(GatewayInterface.CIRCUIT_BREAKER, () -> new CircuitBreakerGatewayComponent(circuitBreakers()));
        return factories;
    }

    /**
     * {@link RelayRuntime} 빌더. 지정하지 않은 협력 객체는 운영 기본값을 사용합니다.
     */
    public static final class Builder {

        private RelaySettings settings = RelaySettings.defaults();
        private SingletonRegistry registry;
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private Sleeper sleeper = ThreadSleeper.INSTANCE;
        private MetricsSink metrics = new NoOpMetricsSink();
        private Supplier<HttpTransport> httpTransport = JdkHttpTransport::new;
        private Supplier<ConnectionFactory> connectionFactory = JdkWebSocketConnectionFactory::new;
        private JsonCodec jsonCodec = new JsonCodec();

        private Builder() {
        }

        public Builder settings(RelaySettings settings) {
            this.settings = requireNonNull(settings, "settings");
            return this;
        }

        public Builder registry(SingletonRegistry registry) {
            this.registry = requireNonNull(registry, "registry");
            return this;
        }

        public Builder clock(MonotonicClock clock) {
            this.clock = requireNonNull(clock, "clock");
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = requireNonNull(sleeper, "sleeper");
            return this;
        }

        public Builder metrics(MetricsSink metrics) {
            this.metrics = requireNonNull(metrics, "metrics");
            return this;
        }

        public Builder httpTransport(HttpTransport httpTransport) {
            requireNonNull(httpTransport, "httpTransport");
            this.httpTransport = () -> httpTransport;
            return this;
        }

        public Builder connectionFactory(ConnectionFactory connectionFactory) {
            requireNonNull(connectionFactory, "connectionFactory");
            this.connectionFactory = () -> connectionFactory;
            return this;
        }

        public Builder jsonCodec(JsonCodec jsonCodec) {
            this.jsonCodec = requireNonNull(jsonCodec, "jsonCodec");
            return this;
        }

        public RelayRuntime build() {
            return new RelayRuntime(this);
        }

        private static <T> T requireNonNull(T value, String name) {
            if (value == null) {
                throw new IllegalArgumentException(name + " cannot be null");
            }
            return value;
        }
    }
}
