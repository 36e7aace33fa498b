/**
 * 재시도 HTTP 클라이언트와 JDK 전송 구현.
 *
 * <pre>
 * RetryingHttpClient
 *   → RateLimiter (fail fast)
 *   → CircuitBreakerProvider.forDependency(host) (fail fast)
 *   → HttpTransport.send (시도별 타임아웃, RetryPolicy 백오프)
 * </pre>
 *
 * @author Relay Team
 * @since 1.0.0
 */
package com.ryuqq.relay.adapter.runner.http;
