package com.ryuqq.relay.adapter.runner.component;

import com.ryuqq.relay.application.gateway.CacheOperation;
import com.ryuqq.relay.application.gateway.GatewayComponent;
import com.ryuqq.relay.application.gateway.GatewayInterface;
import com.ryuqq.relay.application.gateway.OperationArguments;
import com.ryuqq.relay.core.model.CorrelationId;
import com.ryuqq.relay.core.outcome.OperationResult;
import com.ryuqq.relay.core.spi.cache.Cache;
import com.ryuqq.relay.core.spi.cache.CacheLookup;

/**
 * {@code cache} 인터페이스 처리기.
 *
 * <p>GET은 캐시 미스도 실패가 아닌 {@link CacheLookup#miss()}로 반환합니다.
 * 캐시 호출은 재시도와 Circuit Breaker를 거치지 않습니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class CacheGatewayComponent implements GatewayComponent<CacheOperation> {

    private final Cache cache;

    public CacheGatewayComponent(Cache cache) {
        if (cache == null) {
            throw new IllegalArgumentException("cache cannot be null");
        }
        this.cache = cache;
    }

    @Override
    public GatewayInterface gatewayInterface() {
        return GatewayInterface.CACHE;
    }

    @Override
    public Class<CacheOperation> operationType() {
        return CacheOperation.class;
    }

    @Override
    public OperationResult handle(CacheOperation operation, OperationArguments arguments, CorrelationId correlationId) {
        Object data = switch (operation) {
            case GET -> CacheLookup.from(cache.get(arguments.requireString("key")));
            case SET -> cache.set(
                arguments.requireString("key"),
                arguments.require("value"),
                arguments.optionalLong("ttl_seconds").orElse(0L));
            case EXISTS -> cache.exists(arguments.requireString("key"));
            case INVALIDATE -> cache.invalidate(arguments.requireString("key"));
            case CLEAR -> cache.clear();
            case CLEANUP_EXPIRED -> cache.cleanupExpired();
            case MAINTAIN -> cache.maintain();
            case STATS -> cache.stats();
        };
        return OperationResult.success(correlationId, data);
    }
}
