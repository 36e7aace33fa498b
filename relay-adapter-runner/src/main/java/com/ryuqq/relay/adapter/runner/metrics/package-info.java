/**
 * Micrometer 메트릭 어댑터.
 *
 * @author Relay Team
 * @since 1.0.0
 */
package com.ryuqq.relay.adapter.runner.metrics;
