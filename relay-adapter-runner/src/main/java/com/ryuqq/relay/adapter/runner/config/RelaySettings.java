package com.ryuqq.relay.adapter.runner.config;

import com.ryuqq.relay.adapter.runner.http.RetryingHttpClient;
import com.ryuqq.relay.core.protection.CircuitBreakerConfig;
import com.ryuqq.relay.core.protection.RateLimiterConfig;
import com.ryuqq.relay.core.protection.RetryPolicy;
import com.ryuqq.relay.core.spi.ConfigProvider;
import com.ryuqq.relay.core.spi.cache.CacheConfig;
import com.typesafe.config.Config;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Relay 런타임 전체 설정.
 *
 * <p>HOCON 예시 (모든 값의 기본값은 {@code reference.conf}에 있음):</p>
 * <pre>
 * relay {
 *   user-agent = "Relay-Http-Client/1.0"
 *   retry {
 *     max-attempts = 3
 *     backoff-base-ms = 100
 *     backoff-multiplier = 2.0
 *     retriable-status-codes = ["408", "429", "5xx"]
 *     attempt-timeout-ms = 10000
 *   }
 *   rate-limit {
 *     max-operations = 500
 *     window-ms = 1000
 *   }
 *   circuit-breaker {
 *     failure-threshold = 5
 *     recovery-timeout-ms = 45000
 *     half-open-max-probes = 1
 *   }
 *   cache {
 *     default-ttl-seconds = 300
 *     max-ttl-seconds = 3600
 *     max-entries = 10000
 *     max-bytes = 104857600
 *     pressure { warning = 0.75, critical = 0.85, emergency = 0.95, clear-all = 0.98 }
 *   }
 * }
 * </pre>
 *
 * <p>누락된 키는 각 설정 레코드의 {@code defaults()} 값을 사용합니다.
 * {@code 5xx} 같은 클래스 표기는 500~599로 확장됩니다.</p>
 *
 * @param retryPolicy HTTP 재시도 정책
 * @param rateLimit 클라이언트별 Rate Limiter 설정
 * @param circuitBreaker 의존성별 Circuit Breaker 설정
 * @param cache 캐시 설정
 * @param userAgent 기본 User-Agent 헤더
 * @author Relay Team
 * @since 1.0.0
 */
public record RelaySettings(
    RetryPolicy retryPolicy,
    RateLimiterConfig rateLimit,
    CircuitBreakerConfig circuitBreaker,
    CacheConfig cache,
    String userAgent
) {

    private static final String PREFIX = "relay.";

    public RelaySettings {
        if (retryPolicy == null) {
            throw new IllegalArgumentException("retryPolicy cannot be null");
        }
        if (rateLimit == null) {
            throw new IllegalArgumentException("rateLimit cannot be null");
        }
        if (circuitBreaker == null) {
            throw new IllegalArgumentException("circuitBreaker cannot be null");
        }
        if (cache == null) {
            throw new IllegalArgumentException("cache cannot be null");
        }
        if (userAgent == null || userAgent.isBlank()) {
            throw new IllegalArgumentException("userAgent cannot be null or blank");
        }
    }

    public static RelaySettings defaults() {
        return new RelaySettings(RetryPolicy.defaults(), RateLimiterConfig.defaults(), CircuitBreakerConfig.defaults(),
            CacheConfig.defaults(), RetryingHttpClient.DEFAULT_USER_AGENT);
    }

    /**
     * HOCON 설정에서 로드합니다.
     *
     * @param config Typesafe Config (보통 {@code ConfigFactory.load()})
     * @return 설정
     * @throws IllegalArgumentException 값의 형식이나 범위가 잘못된 경우
     */
    public static RelaySettings fromConfig(Config config) {
        return from(new TypesafeConfigProvider(config));
    }

    /**
     * 임의의 {@link ConfigProvider}에서 로드합니다.
     *
     * @param provider 설정 제공자
     * @return 설정
     * @throws IllegalArgumentException 값의 형식이나 범위가 잘못된 경우
     */
    public static RelaySettings from(ConfigProvider provider) {
        if (provider == null) {
            throw new IllegalArgumentException("provider cannot be null");
        }
        RelaySettings defaults = defaults();

        RetryPolicy retryDefaults = defaults.retryPolicy();
        RetryPolicy retryPolicy = new RetryPolicy(
            provider.getInt(PREFIX + "retry.max-attempts", retryDefaults.maxAttempts()),
            provider.getLong(PREFIX + "retry.backoff-base-ms", retryDefaults.backoffBaseMs()),
            provider.getDouble(PREFIX + "retry.backoff-multiplier", retryDefaults.backoffMultiplier()),
            provider.get(PREFIX + "retry.retriable-status-codes")
                .map(RelaySettings::parseStatusCodes)
                .orElse(retryDefaults.retriableStatusCodes()),
            Duration.ofMillis(provider.getLong(PREFIX + "retry.attempt-timeout-ms",
                retryDefaults.attemptTimeout().toMillis()))
        );

        RateLimiterConfig rateDefaults = defaults.rateLimit();
        RateLimiterConfig rateLimit = new RateLimiterConfig(
            provider.getInt(PREFIX + "rate-limit.max-operations", rateDefaults.maxOperations()),
            Duration.ofMillis(provider.getLong(PREFIX + "rate-limit.window-ms", rateDefaults.window().toMillis()))
        );

        CircuitBreakerConfig breakerDefaults = defaults.circuitBreaker();
        CircuitBreakerConfig circuitBreaker = new CircuitBreakerConfig(
            provider.getInt(PREFIX + "circuit-breaker.failure-threshold", breakerDefaults.failureThreshold()),
            Duration.ofMillis(provider.getLong(PREFIX + "circuit-breaker.recovery-timeout-ms",
                breakerDefaults.recoveryTimeout().toMillis())),
            provider.getInt(PREFIX + "circuit-breaker.half-open-max-probes", breakerDefaults.halfOpenMaxProbes())
        );

        CacheConfig cacheDefaults = defaults.cache();
        CacheConfig cache = new CacheConfig(
            provider.getLong(PREFIX + "cache.default-ttl-seconds", cacheDefaults.defaultTtlSeconds()),
            provider.getLong(PREFIX + "cache.max-ttl-seconds", cacheDefaults.maxTtlSeconds()),
            provider.getInt(PREFIX + "cache.max-entries", cacheDefaults.maxEntries()),
            provider.getLong(PREFIX + "cache.max-bytes", cacheDefaults.maxBytes()),
            provider.getDouble(PREFIX + "cache.pressure.warning", cacheDefaults.warningRatio()),
            provider.getDouble(PREFIX + "cache.pressure.critical", cacheDefaults.criticalRatio()),
            provider.getDouble(PREFIX + "cache.pressure.emergency", cacheDefaults.emergencyRatio()),
            provider.getDouble(PREFIX + "cache.pressure.clear-all", cacheDefaults.clearAllRatio())
        );

        String userAgent = provider.getString(PREFIX + "user-agent", defaults.userAgent());
        return new RelaySettings(retryPolicy, rateLimit, circuitBreaker, cache, userAgent);
    }

    /**
     * 쉼표로 구분된 상태 코드 목록을 해석합니다. {@code 5xx}처럼 클래스 표기도 허용합니다.
     *
     * @param text 예: {@code "408,429,5xx"}
     * @return 상태 코드 집합
     * @throws IllegalArgumentException 해석할 수 없는 항목이 있는 경우
     */
    static Set<Integer> parseStatusCodes(String text) {
        Set<Integer> codes = new LinkedHashSet<>();
        for (String raw : text.split(",")) {
            String token = raw.trim().toLowerCase(Locale.ROOT);
            if (token.isEmpty()) {
                continue;
            }
            if (token.length() == 3 && token.endsWith("xx") && Character.isDigit(token.charAt(0))) {
                int base = (token.charAt(0) - '0') * 100;
                for (int code = base; code < base + 100; code++) {
                    codes.add(code);
                }
                continue;
            }
            try {
                codes.add(Integer.parseInt(token));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("invalid status code '" + raw.trim() + "'", e);
            }
        }
        return codes;
    }
}
