package com.ryuqq.relay.application.gateway;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Gateway가 노출하는 인터페이스의 닫힌 집합.
 *
 * <p>각 인터페이스는 레지스트리에 등록되는 컴포넌트 이름과 오퍼레이션 enum 타입을 가집니다.
 * 문자열 이름은 {@link #resolve(String)}와 {@link #resolveOperation(String)}으로만 해석합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public enum GatewayInterface {

    SINGLETON("singleton", SingletonOperation.class),
    CACHE("cache", CacheOperation.class),
    HTTP_CLIENT("http_client", HttpClientOperation.class),
    WEBSOCKET("websocket", WebSocketOperation.class),
    CIRCUIT_BREAKER("circuit_breaker", CircuitBreakerOperation.class);

    private static final String COMPONENT_PREFIX = "gateway.";

    private final String interfaceName;
    private final Class<? extends GatewayOperation> operationType;

    GatewayInterface(String interfaceName, Class<? extends GatewayOperation> operationType) {
        this.interfaceName = interfaceName;
        this.operationType = operationType;
    }

    public String interfaceName() {
        return interfaceName;
    }

    /**
     * 레지스트리에 등록되는 컴포넌트 이름.
     *
     * @return 예: {@code gateway.http_client}
     */
    public String componentName() {
        return COMPONENT_PREFIX + interfaceName;
    }

    public Class<? extends GatewayOperation> operationType() {
        return operationType;
    }

    /**
     * 이 인터페이스의 모든 오퍼레이션.
     *
     * @return 선언 순서의 오퍼레이션 목록
     */
    public List<GatewayOperation> operations() {
        return List.of(operationType.getEnumConstants());
    }

    /**
     * 오퍼레이션 이름 해석 (대소문자, '-'/'_' 구분 없음).
     *
     * @param operation 오퍼레이션 이름
     * @return 해석된 오퍼레이션, 없으면 empty
     */
    public Optional<GatewayOperation> resolveOperation(String operation) {
        String normalized = normalize(operation);
        if (normalized == null) {
            return Optional.empty();
        }
        for (GatewayOperation candidate : operationType.getEnumConstants()) {
            if (candidate.operationName().equals(normalized)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /**
     * 오퍼레이션이 이 인터페이스에 속하는지 확인.
     *
     * @param operation 오퍼레이션
     * @return 속하면 true
     */
    public boolean supports(GatewayOperation operation) {
        return operationType.isInstance(operation);
    }

    /**
     * 인터페이스 이름 해석 (대소문자, '-'/'_' 구분 없음).
     *
     * @param name 인터페이스 이름
     * @return 해석된 인터페이스, 없으면 empty
     */
    public static Optional<GatewayInterface> resolve(String name) {
        String normalized = normalize(name);
        if (normalized == null) {
            return Optional.empty();
        }
        for (GatewayInterface candidate : values()) {
            if (candidate.interfaceName.equals(normalized)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /**
     * @return 모든 인터페이스 이름
     */
    public static List<String> interfaceNames() {
        List<String> names = new ArrayList<>();
        for (GatewayInterface candidate : values()) {
            names.add(candidate.interfaceName);
        }
        return names;
    }

    private static String normalize(String name) {
        if (name == null || name.isBlank()) {
            return null;
        }
        return name.trim().toLowerCase(Locale.ROOT).replace('-', '_');
    }
}
