package com.example.admission.infrastructure.store;

import java.time.Duration;
import java.util.Optional;

/**
 * 외부 저지연 키-값 저장소에 대한 얇은 추상화
 *
 * SOLID 원칙:
 * - Dependency Inversion: 알고리즘은 저장소 구현(Redis, 인메모리)을 알지 못한다
 * - Interface Segregation: 원자적 트랜잭션과 만료 키 연산만 노출
 *
 * 모든 연산은 실패 시 StoreUnavailableException을 던진다.
 */
public interface SharedStateClient {

    /**
     * 단일 키에 대한 원자적 read-modify-write.
     *
     * 동시에 같은 키로 들어온 두 호출이 같은 상태를 보고 둘 다 커밋하는 일은 없다.
     * 저장소 시계를 쓸 수 있으면 callerNowMillis 대신 저장소 시각이 transition에 전달된다.
     *
     * @param key 저장소 키
     * @param stateType 상태 직렬화 타입
     * @param transition 순수 상태 전이 함수
     * @param callerNowMillis 호출자 시각 (ms)
     * @return transition 결과
     */
    <S, R> R transact(String key, Class<S> stateType, StateTransition<S, R> transition, long callerNowMillis);

    void put(String key, String value, Duration ttl);

    Optional<String> get(String key);

    /**
     * 키의 남은 TTL. 키가 없거나 만료됐으면 empty.
     */
    Optional<Duration> remainingTtl(String key);

    void delete(String... keys);
}
