package com.ryuqq.relay.adapter.inmemory.cache;

import java.util.Collection;
import java.util.Map;

/**
 * 캐시 항목의 메모리 사용량 추정.
 *
 * <p>정확한 힙 측정이 아니라 압력 단계를 판정하기 위한 근사치입니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface CacheSizeEstimator {

    /**
     * @param key 캐시 키
     * @param value 캐시 값
     * @return 추정 바이트 (1 이상)
     */
    long estimate(String key, Object value);

    /**
     * 문자열, 숫자, 바이트 배열, 컬렉션과 맵을 재귀적으로 근사하는 기본 추정기.
     *
     * @return 기본 추정기
     */
    static CacheSizeEstimator defaults() {
        return (key, value) -> Defaults.OBJECT_OVERHEAD + Defaults.sizeOf(key) + Defaults.sizeOf(value);
    }

    /**
     * 기본 추정기 구현.
     */
    final class Defaults {

        static final long OBJECT_OVERHEAD = 48;
        private static final int MAX_DEPTH = 8;

        private Defaults() {
        }

        static long sizeOf(Object value) {
            return sizeOf(value, 0);
        }

        private static long sizeOf(Object value, int depth) {
            if (value == null) {
                return 0;
            }
            if (value instanceof CharSequence text) {
                return 40 + 2L * text.length();
            }
            if (value instanceof byte[] bytes) {
                return 16 + bytes.length;
            }
            if (value instanceof Number || value instanceof Boolean || value instanceof Character) {
                return 16;
            }
            if (depth >= MAX_DEPTH) {
                return OBJECT_OVERHEAD;
            }
            if (value instanceof Map<?, ?> map) {
                long total = OBJECT_OVERHEAD;
                for (Map.Entry<?, ?> entry : map.entrySet()) {
                    total += 32 + sizeOf(entry.getKey(), depth + 1) + sizeOf(entry.getValue(), depth + 1);
                }
                return total;
            }
            if (value instanceof Collection<?> collection) {
                long total = OBJECT_OVERHEAD;
                for (Object element : collection) {
                    total += 8 + sizeOf(element, depth + 1);
                }
                return total;
            }
            return OBJECT_OVERHEAD + 2L * String.valueOf(value).length();
        }
    }
}
