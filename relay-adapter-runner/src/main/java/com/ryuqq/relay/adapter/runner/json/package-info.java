/**
 * Jackson 기반 페이로드 코덱.
 *
 * @author Relay Team
 * @since 1.0.0
 */
package com.ryuqq.relay.adapter.runner.json;
