package com.ryuqq.relay.application.gateway;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * OperationArguments 테스트.
 *
 * @author Relay Team
 * @since 1.0.0
 */
@DisplayName("OperationArguments 테스트")
class OperationArgumentsTest {

    @Test
    @DisplayName("필수 인자가 없으면 IllegalArgumentException")
    void require_누락() {
        // given
        OperationArguments arguments = OperationArguments.of(Map.of("key", "a"));

        // when & then
        assertThat(arguments.requireString("key")).isEqualTo("a");
        assertThatThrownBy(() -> arguments.requireString("url"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("argument 'url' is required");
    }

    @Test
    @DisplayName("숫자 인자는 Number와 문자열을 모두 받는다")
    void 숫자_변환() {
        // given
        OperationArguments arguments = OperationArguments.of(Map.of(
            "ttl_seconds", 60,
            "timeout_ms", "2500",
            "multiplier", "1.5",
            "whole_double", 3.0
        ));

        // when & then
        assertThat(arguments.optionalLong("ttl_seconds")).contains(60L);
        assertThat(arguments.optionalInt("timeout_ms")).contains(2500);
        assertThat(arguments.optionalDouble("multiplier")).contains(1.5);
        assertThat(arguments.optionalInt("whole_double")).contains(3);
        assertThat(arguments.optionalLong("missing")).isEmpty();
    }

    @Test
    @DisplayName("정수 인자에 소수나 문자가 오면 예외")
    void 숫자_변환_실패() {
        // given
        OperationArguments arguments = OperationArguments.of(Map.of("a", 1.5, "b", "ten"));

        // when & then
        assertThatThrownBy(() -> arguments.optionalLong("a"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("must be an integer");
        assertThatThrownBy(() -> arguments.requireLong("b"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("불리언은 Boolean과 true/false 문자열만 받는다")
    void 불리언_변환() {
        // given
        OperationArguments arguments = OperationArguments.of(Map.of("a", true, "b", "FALSE", "c", "yes"));

        // when & then
        assertThat(arguments.optionalBoolean("a")).contains(true);
        assertThat(arguments.optionalBoolean("b")).contains(false);
        assertThatThrownBy(() -> arguments.optionalBoolean("c")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("맵과 정수 집합 인자")
    void 맵_집합_변환() {
        // given
        OperationArguments arguments = OperationArguments.of(Map.of(
            "headers", Map.of("X-Trace", 7),
            "codes", List.of(503, "504")
        ));

        // when & then
        assertThat(arguments.optionalStringMap("headers")).containsEntry("X-Trace", "7");
        assertThat(arguments.optionalStringMap("missing")).isEmpty();
        assertThat(arguments.optionalIntSet("codes")).hasValueSatisfying(codes -> assertThat(codes).containsExactly(503, 504));
        assertThatThrownBy(() -> OperationArguments.of(Map.of("headers", "x")).optionalStringMap("headers"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("must be a map");
    }

    @Test
    @DisplayName("null 값은 없는 인자로 취급한다")
    void null_값() {
        // given
        Map<String, Object> values = new HashMap<>();
        values.put("key", null);

        // when
        OperationArguments arguments = OperationArguments.of(values);

        // then
        assertThat(arguments.has("key")).isFalse();
        assertThat(arguments.optional("key")).isEmpty();
    }

    @Test
    @DisplayName("with는 원본을 바꾸지 않는다")
    void with_불변() {
        // given
        OperationArguments original = OperationArguments.of(Map.of("a", 1));

        // when
        OperationArguments copy = original.with("b", 2);

        // then
        assertThat(original.has("b")).isFalse();
        assertThat(copy.asMap()).containsKeys("a", "b");
    }

    @Test
    @DisplayName("OperationRequest는 인자가 null이면 빈 인자를 쓴다")
    void operationRequest_빈_인자() {
        // when
        OperationRequest request = new OperationRequest("cache", "stats", null, null);

        // then
        assertThat(request.arguments().asMap()).isEmpty();
        assertThat(request.correlationId()).isNull();
    }
}
