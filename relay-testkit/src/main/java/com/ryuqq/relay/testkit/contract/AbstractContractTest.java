package com.ryuqq.relay.testkit.contract;

import com.ryuqq.relay.adapter.runner.RelayRuntime;
import com.ryuqq.relay.adapter.runner.config.RelaySettings;
import com.ryuqq.relay.application.gateway.Gateway;
import com.ryuqq.relay.core.outcome.ErrorKind;
import com.ryuqq.relay.core.outcome.Failure;
import com.ryuqq.relay.core.outcome.OperationResult;
import com.ryuqq.relay.core.outcome.Success;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;

/**
 * Abstract base class for Contract Tests.
 *
 * <p>Wires a complete {@link RelayRuntime} against deterministic test doubles so that
 * contract scenarios run without real time or real I/O.</p>
 *
 * <p><strong>Test Infrastructure:</strong></p>
 * <ul>
 *   <li>ManualMonotonicClock: time only moves when the test (or a back-off) advances it</li>
 *   <li>RecordingSleeper: records back-off delays and advances the clock</li>
 *   <li>ScriptedHttpTransport: replays scripted HTTP responses and failures</li>
 *   <li>ScriptedConnectionFactory: in-memory persistent connections with close counting</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyContractTest extends AbstractContractTest {
 *     {@literal @}Test
 *     void scenario() {
 *         transport.respond(503).respond(200);
 *
 *         OperationResult result = execute("http_client", "get", Map.of("url", URL));
 *
 *         assertSuccess(result);
 *     }
 * }
 * </pre>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public abstract class AbstractContractTest {

    protected ManualMonotonicClock clock;
    protected RecordingSleeper sleeper;
    protected ScriptedHttpTransport transport;
    protected ScriptedConnectionFactory connectionFactory;
    protected RelayRuntime runtime;

    /**
     * Creates fresh test doubles and a runtime built from {@link #settings()}.
     */
    @BeforeEach
    void setUpRuntime() {
        clock = new ManualMonotonicClock();
        sleeper = new RecordingSleeper(clock);
        transport = new ScriptedHttpTransport();
        connectionFactory = new ScriptedConnectionFactory();
        runtime = RelayRuntime.builder()
            .settings(settings())
            .clock(clock)
            .sleeper(sleeper)
            .httpTransport(transport)
            .connectionFactory(connectionFactory)
            .build();
    }

    @AfterEach
    void tearDownRuntime() {
        if (runtime != null) {
            runtime.close();
            runtime.registry().clear();
        }
        if (transport != null) {
            transport.clear();
        }
    }

    /**
     * Settings used to build the runtime. Override to tighten thresholds for a scenario.
     *
     * @return runtime settings
     */
    protected RelaySettings settings() {
        return RelaySettings.defaults();
    }

    protected Gateway gateway() {
        return runtime.gateway();
    }

    protected OperationResult execute(String interfaceName, String operation, Map<String, ?> arguments) {
        return runtime.gateway().execute(interfaceName, operation, arguments);
    }

    /**
     * Asserts the result is a success and returns its payload.
     *
     * @param result operation result
     * @param type expected payload type
     * @return payload
     */
    protected <T> T assertSuccess(OperationResult result, Class<T> type) {
        Success success = assertInstanceOf(Success.class, result,
            () -> "Expected success but was " + result);
        return assertInstanceOf(type, success.data(),
            () -> "Expected payload of type " + type.getSimpleName() + " but was " + success.data());
    }

    /**
     * Asserts the result is a failure of the given kind.
     *
     * @param result operation result
     * @param expectedKind expected error kind
     * @return failure
     */
    protected Failure assertFailure(OperationResult result, ErrorKind expectedKind) {
        Failure failure = assertInstanceOf(Failure.class, result,
            () -> "Expected failure " + expectedKind + " but was " + result);
        assertEquals(expectedKind, failure.errorKind(),
            String.format("Expected error kind %s but was %s (%s)", expectedKind, failure.errorKind(), failure.error()));
        return failure;
    }
}
