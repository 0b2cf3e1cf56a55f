package com.example.admission.infrastructure.store;

/**
 * 저장된 상태에 대한 순수 함수: (현재 상태, 현재 시각) → (새 상태, 결과)
 *
 * 저장소는 이 함수를 재시도할 수 있으므로 부작용이 없어야 한다.
 *
 * @param <S> 상태 타입 (상태가 없으면 current는 null)
 * @param <R> 결과 타입
 */
@FunctionalInterface
public interface StateTransition<S, R> {

    StateOutcome<S, R> apply(S current, long nowMillis);
}
