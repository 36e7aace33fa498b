/**
 * Runner Adapter Layer - Gateway 구현체와 런타임 조립.
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.relay.adapter.runner.RegistryGateway} - Singleton Registry 기반 디스패처</li>
 *   <li>{@link com.ryuqq.relay.adapter.runner.RelayRuntime} - 설정, Registry, 클라이언트 조립</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (RegistryGateway, RetryingHttpClient, PersistentConnectionClient)
 *   ↓ implements
 * application (Gateway, GatewayComponent)
 *   ↓ depends on
 * core (OperationResult, protection SPI, transport SPI)
 *   ↑ implemented by
 * adapter-inmemory (Registry, RateLimiter, CircuitBreaker, Cache)
 * </pre>
 *
 * @author Relay Team
 * @since 1.0.0
 */
package com.ryuqq.relay.adapter.runner;
