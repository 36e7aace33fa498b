package com.ryuqq.relay.adapter.inmemory.protection;

import com.ryuqq.relay.core.model.CorrelationId;
import com.ryuqq.relay.core.protection.RateLimiter;
import com.ryuqq.relay.core.protection.RateLimiterConfig;
import com.ryuqq.relay.core.time.MonotonicClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * 슬라이딩 윈도우 Rate Limiter.
 *
 * <p>허용한 요청의 단조 시각을 FIFO 큐에 보관합니다.
 * 판정 전에 창 밖으로 밀려난 시각을 먼저 제거하므로 큐의 모든 항목은 항상 최근 창 안에 있고,
 * 큐 크기는 {@code maxOperations}를 넘지 않습니다.</p>
 *
 * <p><strong>판정 순서:</strong></p>
 * <ol>
 *   <li>{@code now - head >= window}인 항목 제거</li>
 *   <li>큐 크기가 한도 이상이면 기록하지 않고 거부</li>
 *   <li>그렇지 않으면 {@code now}를 기록하고 허용</li>
 * </ol>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class SlidingWindowRateLimiter implements RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(SlidingWindowRateLimiter.class);

    private final RateLimiterConfig config;
    private final MonotonicClock clock;
    private final long windowNanos;

    private final Deque<Long> timestamps = new ArrayDeque<>();
    private long rejected;

    public SlidingWindowRateLimiter(RateLimiterConfig config, MonotonicClock clock) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.config = config;
        this.clock = clock;
        this.windowNanos = config.window().toNanos();
    }

    @Override
    public synchronized boolean tryAcquire(CorrelationId correlationId) {
        long now = clock.nowNanos();
        evictExpired(now);

        if (timestamps.size() >= config.maxOperations()) {
            rejected++;
            log.debug("Rate limit exceeded: correlationId={}, windowSize={}, maxOperations={}",
                correlationId, timestamps.size(), config.maxOperations());
            return false;
        }

        timestamps.addLast(now);
        return true;
    }

    @Override
    public RateLimiterConfig getConfig() {
        return config;
    }

    @Override
    public synchronized long rejectedCount() {
        return rejected;
    }

    @Override
    public synchronized int currentWindowSize() {
        evictExpired(clock.nowNanos());
        return timestamps.size();
    }

    @Override
    public synchronized void reset() {
        timestamps.clear();
        rejected = 0;
    }

    private void evictExpired(long now) {
        while (!timestamps.isEmpty() && now - timestamps.peekFirst() >= windowNanos) {
            timestamps.pollFirst();
        }
    }
}
