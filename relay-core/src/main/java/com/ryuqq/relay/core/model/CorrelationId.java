package com.ryuqq.relay.core.model;

import java.util.UUID;

/**
 * 한 번의 Gateway 호출을 추적하는 상관관계 식별자.
 *
 * <p>호출자가 전달한 값을 그대로 사용하거나, 없으면 {@link #generate()}로 새로 발급합니다.
 * 로그 MDC, 결과 객체, 하위 컴포넌트 호출에 동일한 값이 전파됩니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~128자</li>
 *   <li>공백 문자 포함 불가</li>
 * </ul>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class CorrelationId {

    private static final int MAX_LENGTH = 128;

    private final String value;

    private CorrelationId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("CorrelationId cannot be null or blank");
        }
        if (value.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("CorrelationId length cannot exceed " + MAX_LENGTH + " characters");
        }
        if (value.chars().anyMatch(Character::isWhitespace)) {
            throw new IllegalArgumentException("CorrelationId cannot contain whitespace");
        }
        this.value = value;
    }

    /**
     * CorrelationId 생성.
     *
     * @param value 식별자 값
     * @return CorrelationId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static CorrelationId of(String value) {
        return new CorrelationId(value);
    }

    /**
     * 무작위 UUID 기반 CorrelationId 발급.
     *
     * @return 새 CorrelationId
     */
    public static CorrelationId generate() {
        return new CorrelationId(UUID.randomUUID().toString());
    }

    /**
     * 호출자가 준 값이 있으면 사용하고, 없으면 새로 발급.
     *
     * @param value 호출자가 전달한 값 (null 또는 빈 문자열 허용)
     * @return CorrelationId 인스턴스
     * @throws IllegalArgumentException 값이 있으나 유효하지 않은 경우
     */
    public static CorrelationId ofNullable(String value) {
        if (value == null || value.isBlank()) {
            return generate();
        }
        return new CorrelationId(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CorrelationId that = (CorrelationId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
