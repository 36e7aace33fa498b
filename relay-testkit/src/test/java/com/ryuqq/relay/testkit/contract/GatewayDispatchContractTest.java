package com.ryuqq.relay.testkit.contract;

import com.ryuqq.relay.application.gateway.GatewayInterface;
import com.ryuqq.relay.application.gateway.GatewayOperation;
import com.ryuqq.relay.application.gateway.GatewayStats;
import com.ryuqq.relay.application.gateway.OperationArguments;
import com.ryuqq.relay.core.outcome.ErrorKind;
import com.ryuqq.relay.core.outcome.Failure;
import com.ryuqq.relay.core.outcome.OperationResult;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: gateway dispatch never throws.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Unknown interface or operation → DISPATCH</li>
 *   <li>Every declared operation returns a result, even with empty arguments</li>
 *   <li>Every result carries the caller's correlation id</li>
 * </ul>
 *
 * @author Relay Team
 * @since 1.0.0
 */
class GatewayDispatchContractTest extends AbstractContractTest {

    @Test
    void testGateway_UnknownNames_ReturnDispatch() {
        assertFailure(execute("lights", "turn_on", Map.of()), ErrorKind.DISPATCH);
        assertFailure(execute("cache", "turn_on", Map.of()), ErrorKind.DISPATCH);
        assertFailure(execute(null, null, null), ErrorKind.DISPATCH);
    }

    @Test
    void testGateway_EveryOperationWithEmptyArguments_ReturnsResultWithoutThrowing() {
        for (GatewayInterface gatewayInterface : GatewayInterface.values()) {
            for (GatewayOperation operation : gatewayInterface.operations()) {
                // When
                OperationResult result = assertDoesNotThrow(
                    () -> gateway().execute(gatewayInterface, operation,
                        OperationArguments.of(Map.of("correlation_id", "sweep-1"))),
                    gatewayInterface.interfaceName() + "." + operation.operationName());

                // Then
                assertNotNull(result);
                assertEquals("sweep-1", result.correlationId().getValue());
                if (result instanceof Failure failure) {
                    assertNotEquals(ErrorKind.DISPATCH, failure.errorKind(),
                        "Declared operation must be dispatchable: " + gatewayInterface.interfaceName() + "." + operation.operationName());
                }
            }
        }
        assertEquals(0, transport.requestCount(), "No operation may reach the network without a url");
    }

    @Test
    void testGateway_Stats_CountEveryCall() {
        // Given
        Map<String, Object> arguments = new HashMap<>();
        arguments.put("key", "k");
        execute("cache", "get", arguments);
        execute("cache", "get", Map.of());
        execute("nope", "get", Map.of());

        // When
        GatewayStats stats = gateway().stats();

        // Then
        assertEquals(3, stats.totalCalls());
        assertEquals(2, stats.callsOf("cache.get"));
        assertEquals(2, stats.failures());
    }
}
