/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the outbound capabilities the Relay runtime consumes.
 * Adapter modules provide the concrete implementations.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.relay.core.spi.SingletonRegistry} - named component lifecycle</li>
 *   <li>{@link com.ryuqq.relay.core.spi.cache.Cache} - bounded TTL cache</li>
 *   <li>{@link com.ryuqq.relay.core.spi.transport.HttpTransport} - one HTTP exchange</li>
 *   <li>{@link com.ryuqq.relay.core.spi.transport.ConnectionFactory} - persistent (WebSocket) connections</li>
 *   <li>{@link com.ryuqq.relay.core.spi.MetricsSink} - {@code record(name, value, unit)}</li>
 *   <li>{@link com.ryuqq.relay.core.spi.ConfigProvider} - {@code get(key)}</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> Core defines interfaces, adapters provide implementations</li>
 *   <li><strong>Dependency Inversion:</strong> Core does not depend on any transport or metrics library</li>
 *   <li><strong>Pluggability:</strong> in-memory and scripted implementations for tests, JDK/Micrometer/Typesafe Config for production</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Relay Team
 */
package com.ryuqq.relay.core.spi;
