package com.ryuqq.relay.core.protection.noop;

import com.ryuqq.relay.core.model.CorrelationId;
import com.ryuqq.relay.core.protection.RateLimiter;
import com.ryuqq.relay.core.protection.RateLimiterConfig;

/**
 * Rate Limiter NoOp 구현.
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>tryAcquire(): 항상 true 반환</li>
 *   <li>rejectedCount(), currentWindowSize(): 항상 0</li>
 *   <li>getConfig(): 기본 설정 반환 (실제로 적용되지 않음)</li>
 * </ul>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class NoOpRateLimiter implements RateLimiter {

    @Override
    public boolean tryAcquire(CorrelationId correlationId) {
        return true;
    }

    @Override
    public RateLimiterConfig getConfig() {
        return RateLimiterConfig.defaults();
    }

    @Override
    public long rejectedCount() {
        return 0;
    }

    @Override
    public int currentWindowSize() {
        return 0;
    }

    @Override
    public void reset() {
        // NoOp
    }
}
