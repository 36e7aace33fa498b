package com.ryuqq.relay.core.outcome;

import com.ryuqq.relay.core.model.CorrelationId;

/**
 * 성공적으로 완료된 오퍼레이션.
 *
 * <p>{@code data}의 타입은 오퍼레이션마다 다릅니다.
 * 예를 들어 {@code cache.get}은 {@code CacheLookup}, {@code http_client.get}은
 * {@code HttpExchange}, {@code singleton.delete}는 {@link Boolean}을 담습니다.</p>
 *
 * @param correlationId CorrelationId
 * @param data 반환 데이터 (null 불가)
 *
 * @author Relay Team
 * @since 1.0.0
 */
public record Success(
    CorrelationId correlationId,
    Object data
) implements OperationResult {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException correlationId 또는 data가 null인 경우
     */
    public Success {
        if (correlationId == null) {
            throw new IllegalArgumentException("correlationId cannot be null");
        }
        if (data == null) {
            throw new IllegalArgumentException("data cannot be null");
        }
    }

    /**
     * 데이터를 지정한 타입으로 꺼냅니다.
     *
     * @param type 기대하는 타입
     * @param <T> 데이터 타입
     * @return 캐스팅된 데이터
     * @throws IllegalStateException 데이터 타입이 일치하지 않는 경우
     */
    public <T> T dataAs(Class<T> type) {
        if (!type.isInstance(data)) {
            throw new IllegalStateException(
                "data is " + data.getClass().getSimpleName() + ", not " + type.getSimpleName());
        }
        return type.cast(data);
    }
}
