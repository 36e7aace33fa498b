/**
 * Relay 전역에서 공유하는 값 타입.
 *
 * <p>모든 타입은 불변이며, 생성 시점에 유효성을 검증하고
 * 실패 시 {@link java.lang.IllegalArgumentException}을 던집니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
package com.ryuqq.relay.core.model;
