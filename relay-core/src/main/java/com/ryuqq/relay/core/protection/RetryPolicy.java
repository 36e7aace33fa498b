package com.ryuqq.relay.core.protection;

import java.time.Duration;
import java.util.Set;
import java.util.TreeSet;

/**
 * 네트워크 클라이언트의 재시도 정책.
 *
 * <p>불변 객체이며, 재설정은 정책 전체를 새 인스턴스로 교체하는 방식으로만 이루어집니다.</p>
 *
 * <p><strong>Backoff 계산:</strong></p>
 * <pre>
 * backoff(attempt) = backoffBaseMs * backoffMultiplier^attempt   (attempt는 0부터)
 *
 * 기본값 (100ms, 2.0, 3회):
 *   1회차 실패 후: 100ms
 *   2회차 실패 후: 200ms
 *   3회차 실패 후: 재시도 없음
 * </pre>
 *
 * <p>지터가 없으므로 전체 재시도 지연은 {@link #totalBackoffMs()}로 미리 계산할 수 있습니다.</p>
 *
 * <p><strong>실패 분류:</strong> 시도가 한 번뿐인 요청({@code maxAttempts == 1} 또는 호출 단위
 * {@code use_retry=false})의 실패는 그 시도의 실제 종류(TIMEOUT, CONNECTION, HTTP_STATUS)를 유지합니다.
 * 두 번 이상 시도한 뒤 모두 실패한 경우에만 RETRY_EXHAUSTED가 됩니다.</p>
 *
 * <p><strong>허용 범위:</strong></p>
 * <ul>
 *   <li>maxAttempts: 1~10 (기본 3)</li>
 *   <li>backoffBaseMs: 50~1000 (기본 100)</li>
 *   <li>backoffMultiplier: 1.0~5.0 (기본 2.0)</li>
 *   <li>retriableStatusCodes: 100~599 범위의 코드 (기본 408, 429, 5xx)</li>
 *   <li>attemptTimeout: 양수 (기본 10초)</li>
 * </ul>
 *
 * @param maxAttempts 최대 시도 횟수 (첫 시도 포함)
 * @param backoffBaseMs Backoff 기준 지연 (밀리초)
 * @param backoffMultiplier 시도마다 곱해지는 배수
 * @param retriableStatusCodes 재시도 대상 HTTP 상태 코드
 * @param attemptTimeout 시도 하나에 허용하는 최대 시간
 * @author Relay Team
 * @since 1.0.0
 */
public record RetryPolicy(
    int maxAttempts,
    long backoffBaseMs,
    double backoffMultiplier,
    Set<Integer> retriableStatusCodes,
    Duration attemptTimeout
) {

    public static final int MAX_ATTEMPTS_LIMIT = 10;
    public static final long MIN_BACKOFF_BASE_MS = 50;
    public static final long MAX_BACKOFF_BASE_MS = 1000;
    public static final double MIN_MULTIPLIER = 1.0;
    public static final double MAX_MULTIPLIER = 5.0;

    private static final RetryPolicy DEFAULTS = new RetryPolicy(
        3, 100, 2.0, defaultRetriableStatusCodes(), Duration.ofSeconds(10));

    public RetryPolicy {
        if (maxAttempts < 1 || maxAttempts > MAX_ATTEMPTS_LIMIT) {
            throw new IllegalArgumentException(
                "maxAttempts must be between 1 and " + MAX_ATTEMPTS_LIMIT + " (current: " + maxAttempts + ")");
        }
        if (backoffBaseMs < MIN_BACKOFF_BASE_MS || backoffBaseMs > MAX_BACKOFF_BASE_MS) {
            throw new IllegalArgumentException(
                "backoffBaseMs must be between " + MIN_BACKOFF_BASE_MS + " and " + MAX_BACKOFF_BASE_MS
                    + " (current: " + backoffBaseMs + ")");
        }
        if (Double.isNaN(backoffMultiplier) || backoffMultiplier < MIN_MULTIPLIER || backoffMultiplier > MAX_MULTIPLIER) {
            throw new IllegalArgumentException(
                "backoffMultiplier must be between " + MIN_MULTIPLIER + " and " + MAX_MULTIPLIER
                    + " (current: " + backoffMultiplier + ")");
        }
        if (retriableStatusCodes == null) {
            throw new IllegalArgumentException("retriableStatusCodes cannot be null");
        }
        for (Integer code : retriableStatusCodes) {
            if (code == null || code < 100 || code > 599) {
                throw new IllegalArgumentException("retriableStatusCodes contains invalid status code: " + code);
            }
        }
        if (attemptTimeout == null || attemptTimeout.isZero() || attemptTimeout.isNegative()) {
            throw new IllegalArgumentException("attemptTimeout must be positive (current: " + attemptTimeout + ")");
        }
        retriableStatusCodes = Set.copyOf(retriableStatusCodes);
    }

    /**
     * 기본 정책.
     *
     * @return maxAttempts=3, backoffBaseMs=100, backoffMultiplier=2.0, 408/429/5xx, attemptTimeout=10s
     */
    public static RetryPolicy defaults() {
        return DEFAULTS;
    }

    /**
     * 408, 429와 500~599 전체.
     *
     * @return 기본 재시도 대상 상태 코드
     */
    public static Set<Integer> defaultRetriableStatusCodes() {
        Set<Integer> codes = new TreeSet<>();
        codes.add(408);
        codes.add(429);
        for (int code = 500; code <= 599; code++) {
            codes.add(code);
        }
        return codes;
    }

    /**
     * 상태 코드가 재시도 대상인지 확인.
     *
     * @param statusCode HTTP 상태 코드
     * @return 재시도 대상이면 true
     */
    public boolean isRetriable(int statusCode) {
        return retriableStatusCodes.contains(statusCode);
    }

    /**
     * 지정한 시도가 실패한 뒤 기다릴 시간.
     *
     * @param attempt 0부터 시작하는 시도 번호
     * @return 지연 (밀리초)
     * @throws IllegalArgumentException attempt가 음수인 경우
     */
    public long backoffMs(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt cannot be negative (current: " + attempt + ")");
        }
        return Math.round(backoffBaseMs * Math.pow(backoffMultiplier, attempt));
    }

    /**
     * 모든 시도가 실패했을 때 누적되는 Backoff 합계.
     *
     * <p>마지막 시도 뒤에는 기다리지 않으므로 {@code maxAttempts - 1}번의 지연을 더합니다.</p>
     *
     * @return 누적 지연 (밀리초)
     */
    public long totalBackoffMs() {
        long total = 0;
        for (int attempt = 0; attempt < maxAttempts - 1; attempt++) {
            total += backoffMs(attempt);
        }
        return total;
    }

    /**
     * 최악의 경우 한 번의 요청이 소비하는 시간 상한 (시도 타임아웃 + Backoff).
     *
     * @return 시간 상한
     */
    public Duration worstCaseLatency() {
        return attemptTimeout.multipliedBy(maxAttempts).plusMillis(totalBackoffMs());
    }

    public RetryPolicy withMaxAttempts(int newMaxAttempts) {
        return new RetryPolicy(newMaxAttempts, backoffBaseMs, backoffMultiplier, retriableStatusCodes, attemptTimeout);
    }

    public RetryPolicy withBackoffBaseMs(long newBackoffBaseMs) {
        return new RetryPolicy(maxAttempts, newBackoffBaseMs, backoffMultiplier, retriableStatusCodes, attemptTimeout);
    }

    public RetryPolicy withBackoffMultiplier(double newBackoffMultiplier) {
        return new RetryPolicy(maxAttempts, backoffBaseMs, newBackoffMultiplier, retriableStatusCodes, attemptTimeout);
    }

    public RetryPolicy withRetriableStatusCodes(Set<Integer> newRetriableStatusCodes) {
        return new RetryPolicy(maxAttempts, backoffBaseMs, backoffMultiplier, newRetriableStatusCodes, attemptTimeout);
    }

    public RetryPolicy withAttemptTimeout(Duration newAttemptTimeout) {
        return new RetryPolicy(maxAttempts, backoffBaseMs, backoffMultiplier, retriableStatusCodes, newAttemptTimeout);
    }
}
