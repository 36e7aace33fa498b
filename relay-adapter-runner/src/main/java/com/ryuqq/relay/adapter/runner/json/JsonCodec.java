package com.ryuqq.relay.adapter.runner.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;

/**
 * 요청 바디와 WebSocket 메시지의 JSON 직렬화/역직렬화.
 *
 * <p>HTTP 클라이언트와 WebSocket 클라이언트가 같은 {@link ObjectMapper}를 공유합니다.</p>
 *
 * <ul>
 *   <li>{@link #write(Object)}: 문자열은 그대로, 그 외 객체는 JSON으로 직렬화</li>
 *   <li>{@link #read(String)}: JSON으로 해석 가능하면 Map/List/값으로, 아니면 원문 텍스트로</li>
 * </ul>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class JsonCodec {

    private static final Logger log = LoggerFactory.getLogger(JsonCodec.class);

    private final ObjectMapper objectMapper;

    public JsonCodec() {
        this(new ObjectMapper().disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES));
    }

    public JsonCodec(ObjectMapper objectMapper) {
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        this.objectMapper = objectMapper;
    }

    /**
     * 페이로드를 전송용 문자열로 변환합니다.
     *
     * @param payload 문자열 또는 직렬화할 객체 (null이면 null 반환)
     * @return 전송 문자열
     * @throws IllegalArgumentException JSON으로 직렬화할 수 없는 경우
     */
    public String write(Object payload) {
        if (payload == null) {
            return null;
        }
        if (payload instanceof String text) {
            return text;
        }
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                "payload cannot be serialized as JSON (type: " + payload.getClass().getSimpleName() + ")", e);
        }
    }

    /**
     * 수신 텍스트를 해석합니다.
     *
     * @param text 응답 바디 또는 수신 메시지
     * @return 해석된 JSON 값, 해석 불가 시 원문 (null/빈 문자열은 빈 문자열)
     */
    public Object read(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        try {
            Object value = objectMapper.readValue(text, Object.class);
            return value == null ? text : value;
        } catch (JsonProcessingException e) {
            log.trace("Payload is not JSON, keeping text: {}", e.getOriginalMessage());
            return text;
        }
    }

    /**
     * @param text 전송 문자열
     * @return UTF-8 기준 바이트 수
     */
    public static int utf8Length(String text) {
        return text == null ? 0 : text.getBytes(StandardCharsets.UTF_8).length;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }
}
