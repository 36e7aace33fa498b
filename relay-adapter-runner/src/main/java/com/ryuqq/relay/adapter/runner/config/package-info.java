/**
 * HOCON 설정 로딩.
 *
 * @author Relay Team
 * @since 1.0.0
 */
package com.ryuqq.relay.adapter.runner.config;
