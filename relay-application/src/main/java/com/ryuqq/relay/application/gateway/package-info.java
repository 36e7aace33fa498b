/**
 * Gateway 계약.
 *
 * <p>{@link com.ryuqq.relay.application.gateway.Gateway}는 문자열 이름을 닫힌 enum
 * ({@link com.ryuqq.relay.application.gateway.GatewayInterface}와 인터페이스별 오퍼레이션 enum)으로 해석한 뒤
 * 레지스트리에서 얻은 {@link com.ryuqq.relay.application.gateway.GatewayComponent}에 위임합니다.
 * 구현은 {@code relay-adapter-runner} 모듈의 {@code RegistryGateway}입니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
package com.ryuqq.relay.application.gateway;
