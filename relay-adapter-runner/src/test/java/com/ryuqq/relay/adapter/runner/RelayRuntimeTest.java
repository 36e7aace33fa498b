package com.ryuqq.relay.adapter.runner;

import com.ryuqq.relay.adapter.runner.http.HttpExchange;
import com.ryuqq.relay.application.gateway.GatewayInterface;
import com.ryuqq.relay.core.outcome.ErrorKind;
import com.ryuqq.relay.core.outcome.Failure;
import com.ryuqq.relay.core.outcome.OperationResult;
import com.ryuqq.relay.core.outcome.Success;
import com.ryuqq.relay.core.protection.CircuitBreakerSnapshot;
import com.ryuqq.relay.core.protection.CircuitBreakerState;
import com.ryuqq.relay.core.spi.transport.ConnectionFactory;
import com.ryuqq.relay.core.spi.transport.HttpTransport;
import com.ryuqq.relay.core.spi.transport.PersistentConnection;
import com.ryuqq.relay.core.spi.transport.TransportRequest;
import com.ryuqq.relay.core.spi.transport.TransportResponse;
import com.ryuqq.relay.core.time.MonotonicClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * RelayRuntime 통합 테스트.
 *
 * <p>가짜 전송 계층을 주입한 런타임에서 Gateway 호출이 Registry의 공유 인스턴스를 통해 처리되는지 검증합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class RelayRuntimeTest {

    private static final String URL = "https://ha.example.com/api/states/light.kitchen";

    @Mock
    private ConnectionFactory connectionFactory;

    @Mock
    private PersistentConnection connection;

    private final AtomicLong nowNanos = new AtomicLong();
    private final MonotonicClock clock = nowNanos::get;
    private final List<Long> sleeps = new ArrayList<>();
    private final List<TransportRequest> sentRequests = new ArrayList<>();
    private final List<Integer> scriptedStatuses = new ArrayList<>();

    private RelayRuntime runtime;

    @BeforeEach
    void setUp() {
        HttpTransport transport = request -> {
            sentRequests.add(request);
            int status = scriptedStatuses.isEmpty() ? 200 : scriptedStatuses.remove(0);
            return TransportResponse.of(status, "{\"state\":\"on\"}");
        };
        runtime = RelayRuntime.builder()
            .clock(clock)
            .sleeper(millis -> sleeps.add(millis))
            .httpTransport(transport)
            .connectionFactory(connectionFactory)
            .build();
    }

    @Test
    void gateway_http_get이_공유_클라이언트로_처리됨() {
        // when
        OperationResult result = runtime.gateway().execute("http_client", "get",
            Map.of("url", URL, "correlation_id", "alexa-1"));

        // then
        HttpExchange exchange = ((Success) result).dataAs(HttpExchange.class);
        assertThat(exchange.statusCode()).isEqualTo(200);
        assertThat(exchange.body()).isEqualTo(Map.of("state", "on"));
        assertThat(result.correlationId().getValue()).isEqualTo("alexa-1");
        assertThat(sentRequests).hasSize(1);
        assertThat(runtime.httpClient().stats().successful()).isEqualTo(1);
    }

    @Test
    void gateway_재시도_후_성공하면_백오프만큼_대기() {
        // given
        scriptedStatuses.addAll(List.of(503, 503, 200));

        // when
        OperationResult result = runtime.gateway().execute("http_client", "get", Map.of("url", URL));

        // then
        assertThat(((Success) result).dataAs(HttpExchange.class).attemptsUsed()).isEqualTo(3);
        assertThat(sleeps).containsExactly(100L, 200L);
    }

    @Test
    void registry_공유_인스턴스와_컴포넌트를_이름으로_등록() {
        // when
        runtime.gateway().execute("cache", "set", Map.of("key", "k", "value", "v"));
        runtime.gateway().execute("http_client", "stats", Map.of());

        // then
        assertThat(runtime.registry().names()).contains(
            RelayRuntime.CACHE,
            RelayRuntime.HTTP_CLIENT,
            RelayRuntime.CIRCUIT_BREAKERS,
            GatewayInterface.CACHE.componentName(),
            GatewayInterface.HTTP_CLIENT.componentName());
        assertThat(runtime.cache()).isSameAs(runtime.cache());
        assertThat(runtime.httpClient()).isSameAs(runtime.httpClient());
    }

    @Test
    void http_실패는_circuit_breaker_인터페이스에서_관찰됨() {
        // given
        for (int i = 0; i < 6; i++) {
            scriptedStatuses.add(500);
        }

        // when
        OperationResult first = runtime.gateway().execute("http_client", "get", Map.of("url", URL, "dependency", "home_assistant"));
        OperationResult second = runtime.gateway().execute("http_client", "get", Map.of("url", URL, "dependency", "home_assistant"));
        OperationResult state = runtime.gateway().execute("circuit_breaker", "state", Map.of("dependency", "home_assistant"));

        // then
        assertThat(((Failure) first).errorKind()).isEqualTo(ErrorKind.RETRY_EXHAUSTED);
        assertThat(((Failure) second).errorKind()).isEqualTo(ErrorKind.RETRY_EXHAUSTED);
        assertThat(((Success) state).dataAs(CircuitBreakerSnapshot.class).state()).isEqualTo(CircuitBreakerState.OPEN);

        OperationResult rejected = runtime.gateway().execute("http_client", "get", Map.of("url", URL, "dependency", "home_assistant"));
        assertThat(((Failure) rejected).errorKind()).isEqualTo(ErrorKind.CIRCUIT_OPEN);
        assertThat(sentRequests).hasSize(6);
    }

    @Test
    void close는_추적중인_WebSocket_연결을_닫음() throws Exception {
        // given
        when(connectionFactory.open(any(), anyMap(), any())).thenReturn(connection);
        OperationResult connected = runtime.gateway().execute("websocket", "connect",
            Map.of("url", "wss://ha.example.com/api/websocket"));
        assertThat(connected.isSuccess()).isTrue();

        // when
        runtime.close();

        // then
        verify(connection).close();
        assertThat(runtime.connectionClient().stats().open()).isZero();
    }

    @Test
    void builder_null_협력객체는_IllegalArgumentException() {
        assertThatThrownBy(() -> RelayRuntime.builder().clock(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("clock");
    }
}
