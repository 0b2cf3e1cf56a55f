package com.example.admission.infrastructure.store;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Duration;

/**
 * StateTransition의 결과. write가 false면 저장소에 아무것도 쓰지 않는다.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class StateOutcome<S, R> {

    private final boolean write;
    private final S newState;
    private final Duration ttl;
    private final R result;

    public static <S, R> StateOutcome<S, R> write(S newState, Duration ttl, R result) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("TTL must be positive: " + ttl);
        }
        return new StateOutcome<>(true, newState, ttl, result);
    }

    public static <S, R> StateOutcome<S, R> unchanged(R result) {
        return new StateOutcome<>(false, null, null, result);
    }
}
