package com.ryuqq.relay.application.gateway;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * GatewayInterface 이름 해석 테스트.
 *
 * @author Relay Team
 * @since 1.0.0
 */
@DisplayName("GatewayInterface 테스트")
class GatewayInterfaceTest {

    @Test
    @DisplayName("인터페이스 이름은 대소문자와 하이픈을 구분하지 않는다")
    void resolve_대소문자_무시() {
        assertThat(GatewayInterface.resolve("cache")).contains(GatewayInterface.CACHE);
        assertThat(GatewayInterface.resolve("HTTP_CLIENT")).contains(GatewayInterface.HTTP_CLIENT);
        assertThat(GatewayInterface.resolve(" http-client ")).contains(GatewayInterface.HTTP_CLIENT);
        assertThat(GatewayInterface.resolve("Circuit_Breaker")).contains(GatewayInterface.CIRCUIT_BREAKER);
    }

    @Test
    @DisplayName("알 수 없는 인터페이스는 empty")
    void resolve_알수없음() {
        assertThat(GatewayInterface.resolve("security")).isEmpty();
        assertThat(GatewayInterface.resolve("")).isEmpty();
        assertThat(GatewayInterface.resolve(null)).isEmpty();
    }

    @Test
    @DisplayName("오퍼레이션은 해당 인터페이스의 enum으로만 해석된다")
    void resolveOperation_인터페이스별() {
        assertThat(GatewayInterface.SINGLETON.resolveOperation("Get_Or_Create"))
            .contains(SingletonOperation.GET_OR_CREATE);
        assertThat(GatewayInterface.CACHE.resolveOperation("cleanup-expired"))
            .contains(CacheOperation.CLEANUP_EXPIRED);
        assertThat(GatewayInterface.CACHE.resolveOperation("post")).isEmpty();
        assertThat(GatewayInterface.HTTP_CLIENT.resolveOperation("post")).contains(HttpClientOperation.POST);
    }

    @Test
    @DisplayName("supports는 다른 인터페이스의 오퍼레이션을 거부한다")
    void supports_타입_검사() {
        assertThat(GatewayInterface.CACHE.supports(CacheOperation.GET)).isTrue();
        assertThat(GatewayInterface.CACHE.supports(HttpClientOperation.GET)).isFalse();
    }

    @Test
    @DisplayName("컴포넌트 이름과 오퍼레이션 목록")
    void componentName_operations() {
        assertThat(GatewayInterface.WEBSOCKET.componentName()).isEqualTo("gateway.websocket");
        assertThat(GatewayInterface.CIRCUIT_BREAKER.operations())
            .extracting(GatewayOperation::operationName)
            .containsExactly("state", "list", "reset", "reset_all");
        assertThat(GatewayInterface.interfaceNames())
            .containsExactly("singleton", "cache", "http_client", "websocket", "circuit_breaker");
    }
}
