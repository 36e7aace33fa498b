/**
 * Cache SPI와 설정, 통계 타입.
 *
 * @author Relay Team
 * @since 1.0.0
 */
package com.ryuqq.relay.core.spi.cache;
