/**
 * Gateway 인터페이스별 {@link com.ryuqq.relay.application.gateway.GatewayComponent} 구현.
 *
 * <p>각 구현은 오퍼레이션 enum에 대한 exhaustive switch로 처리하며,
 * 인자 오류는 {@link IllegalArgumentException}으로 던져 Gateway가 {@code VALIDATION}으로 변환합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
package com.ryuqq.relay.adapter.runner.component;
