/**
 * Gateway 오퍼레이션 결과 타입.
 *
 * <p>{@link com.ryuqq.relay.core.outcome.OperationResult}는
 * {@link com.ryuqq.relay.core.outcome.Success}와
 * {@link com.ryuqq.relay.core.outcome.Failure}만 허용하는 sealed 계층입니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
package com.ryuqq.relay.core.outcome;
