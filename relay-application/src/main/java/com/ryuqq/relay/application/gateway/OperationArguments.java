package com.ryuqq.relay.application.gateway;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 오퍼레이션 인자.
 *
 * <p>이름 → 값의 불변 맵입니다. 타입 변환 실패나 필수 인자 누락은
 * {@link IllegalArgumentException}으로 알리며, Gateway가 이를 {@code VALIDATION} 실패로 변환합니다.</p>
 *
 * <p><strong>숫자 변환 규칙:</strong></p>
 * <ul>
 *   <li>{@link Number}: 정수 인자에는 소수부가 없어야 함</li>
 *   <li>{@link String}: 숫자로 파싱 가능해야 함</li>
 * </ul>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class OperationArguments {

    private static final OperationArguments EMPTY = new OperationArguments(Map.of());

    private final Map<String, Object> values;

    private OperationArguments(Map<String, ?> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * @param values 인자 맵 (null이면 빈 인자, null 값 허용)
     * @return OperationArguments
     * @throws IllegalArgumentException 빈 이름의 인자가 있는 경우
     */
    public static OperationArguments of(Map<String, ?> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        for (String key : values.keySet()) {
            if (key == null || key.isBlank()) {
                throw new IllegalArgumentException("argument name cannot be null or blank");
            }
        }
        return new OperationArguments(values);
    }

    public static OperationArguments empty() {
        return EMPTY;
    }

    public boolean has(String name) {
        return values.get(name) != null;
    }

    public Map<String, Object> asMap() {
        return values;
    }

    /**
     * 새 인자를 덧붙인 사본.
     *
     * @param name 인자 이름
     * @param value 인자 값
     * @return 사본
     */
    public OperationArguments with(String name, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.put(name, value);
        return of(copy);
    }

    public Optional<Object> optional(String name) {
        return Optional.ofNullable(values.get(name));
    }

    public Object require(String name) {
        Object value = values.get(name);
        if (value == null) {
            throw new IllegalArgumentException("argument '" + name + "' is required");
        }
        return value;
    }

    public <T> T require(String name, Class<T> type) {
        Object value = require(name);
        if (!type.isInstance(value)) {
            throw new IllegalArgumentException(
                "argument '" + name + "' must be " + type.getSimpleName() + " (current: " + value.getClass().getSimpleName() + ")");
        }
        return type.cast(value);
    }

    public String requireString(String name) {
        String value = require(name).toString();
        if (value.isBlank()) {
            throw new IllegalArgumentException("argument '" + name + "' cannot be blank");
        }
        return value;
    }

    public Optional<String> optionalString(String name) {
        return optional(name).map(Object::toString).filter(value -> !value.isBlank());
    }

    public Optional<Long> optionalLong(String name) {
        return optional(name).map(value -> toLong(name, value));
    }

    public long requireLong(String name) {
        return toLong(name, require(name));
    }

    public Optional<Integer> optionalInt(String name) {
        return optionalLong(name).map(value -> {
            if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
                throw new IllegalArgumentException("argument '" + name + "' is out of int range (current: " + value + ")");
            }
            return value.intValue();
        });
    }

    public Optional<Double> optionalDouble(String name) {
        return optional(name).map(value -> {
            if (value instanceof Number number) {
                return number.doubleValue();
            }
            try {
                return Double.parseDouble(value.toString().trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("argument '" + name + "' must be a number (current: " + value + ")", e);
            }
        });
    }

    public Optional<Boolean> optionalBoolean(String name) {
        return optional(name).map(value -> {
            if (value instanceof Boolean bool) {
                return bool;
            }
            String text = value.toString().trim();
            if ("true".equalsIgnoreCase(text)) {
                return Boolean.TRUE;
            }
            if ("false".equalsIgnoreCase(text)) {
                return Boolean.FALSE;
            }
            throw new IllegalArgumentException("argument '" + name + "' must be a boolean (current: " + value + ")");
        });
    }

    /**
     * 문자열 맵 인자 (헤더, 쿼리 파라미터 등). 값은 {@code toString()}으로 변환합니다.
     *
     * @param name 인자 이름
     * @return 없으면 빈 맵
     */
    public Map<String, String> optionalStringMap(String name) {
        Optional<Object> value = optional(name);
        if (value.isEmpty()) {
            return Map.of();
        }
        if (!(value.get() instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException("argument '" + name + "' must be a map");
        }
        Map<String, String> result = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (entry.getKey() == null || entry.getValue() == null) {
                throw new IllegalArgumentException("argument '" + name + "' cannot contain null keys or values");
            }
            result.put(entry.getKey().toString(), entry.getValue().toString());
        }
        return result;
    }

    /**
     * 정수 집합 인자 (예: 재시도 대상 상태 코드).
     *
     * @param name 인자 이름
     * @return 없으면 empty
     */
    public Optional<Set<Integer>> optionalIntSet(String name) {
        return optional(name).map(value -> {
            if (!(value instanceof Collection<?> collection)) {
                throw new IllegalArgumentException("argument '" + name + "' must be a collection");
            }
            Set<Integer> result = new LinkedHashSet<>();
            for (Object element : collection) {
                if (element == null) {
                    throw new IllegalArgumentException("argument '" + name + "' cannot contain null");
                }
                result.add(Math.toIntExact(toLong(name, element)));
            }
            return result;
        });
    }

    private static long toLong(String name, Object value) {
        if (value instanceof Number number) {
            double asDouble = number.doubleValue();
            if (asDouble != Math.rint(asDouble)) {
                throw new IllegalArgumentException("argument '" + name + "' must be an integer (current: " + value + ")");
            }
            return number.longValue();
        }
        try {
            return Long.parseLong(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("argument '" + name + "' must be an integer (current: " + value + ")", e);
        }
    }

    @Override
    public String toString() {
        return "OperationArguments" + values.keySet();
    }
}
