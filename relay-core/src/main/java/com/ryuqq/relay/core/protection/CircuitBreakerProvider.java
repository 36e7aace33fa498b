package com.ryuqq.relay.core.protection;

import java.util.List;
import java.util.Optional;

/**
 * 의존 대상별 Circuit Breaker 저장소.
 *
 * <p>Breaker는 의존 대상 이름으로 처음 요청될 때 생성되어 프로세스가 살아있는 동안 유지됩니다.
 * 같은 이름에 대해서는 항상 같은 인스턴스를 반환해야 합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public interface CircuitBreakerProvider {

    /**
     * 의존 대상의 Breaker 조회 (없으면 생성).
     *
     * @param dependencyName 의존 대상 이름 (예: 원격 서버 호스트)
     * @return CircuitBreaker
     * @throws IllegalArgumentException dependencyName이 null이거나 빈 문자열인 경우
     */
    CircuitBreaker forDependency(String dependencyName);

    /**
     * 이미 생성된 Breaker 조회.
     *
     * @param dependencyName 의존 대상 이름
     * @return 생성된 적 없으면 empty
     */
    Optional<CircuitBreaker> find(String dependencyName);

    /**
     * 생성된 모든 Breaker의 스냅샷 (이름 순).
     *
     * @return 스냅샷 목록
     */
    List<CircuitBreakerSnapshot> snapshots();

    /**
     * 생성된 모든 Breaker를 CLOSED로 리셋.
     *
     * @return 리셋한 Breaker 수
     */
    int resetAll();

    /**
     * 새로 생성되는 Breaker에 적용되는 설정.
     *
     * @return CircuitBreakerConfig
     */
    CircuitBreakerConfig getConfig();
}
