package com.example.admission.domain.strategy;

import com.example.admission.domain.model.AlgorithmType;
import com.example.admission.domain.model.RateLimitRule;
import com.example.admission.domain.model.RuleCheckResult;
import com.example.admission.domain.state.FixedWindowState;
import com.example.admission.infrastructure.store.SharedStateClient;
import com.example.admission.infrastructure.store.StateOutcome;

import java.time.Duration;

/**
 * Fixed Window Counter 알고리즘 구현
 *
 * 특징:
 * - floor(now / window) 단위의 고정 윈도우마다 카운터 유지
 * - 저장된 windowStart가 현재 윈도우와 다르면 카운터 초기화
 * - 구현이 가장 간단함
 *
 * 트레이드오프:
 * - 장점: 매우 간단하고 메모리 효율적
 * - 단점: 윈도우 경계에서 burst 발생 가능 (2배 트래픽 가능)
 *
 * 거부된 요청은 카운트하지 않는다.
 */
public class FixedWindowStrategy extends AbstractStateStrategy<FixedWindowState> {

    public FixedWindowStrategy(SharedStateClient stateClient) {
        super(stateClient, FixedWindowState.class);
    }

    @Override
    public StateOutcome<FixedWindowState, RuleCheckResult> evaluate(
            FixedWindowState current, RateLimitRule rule, long nowMillis) {

        long windowMillis = rule.windowSizeMillis();
        long windowStart = Math.floorDiv(nowMillis, windowMillis) * windowMillis;
        long untilBoundary = windowStart + windowMillis - nowMillis;

        long count = 0;
        if (current != null && current.getWindowStartMillis() == windowStart && current.getCount() > 0) {
            count = current.getCount();
        }

        long limit = rule.getLimit();
        if (count + 1 > limit) {
            return StateOutcome.unchanged(RuleCheckResult.rejected(
                    count, limit, ceilSeconds(untilBoundary), untilBoundary / 1000d));
        }

        long incremented = count + 1;
        return StateOutcome.write(
                new FixedWindowState(incremented, windowStart),
                Duration.ofMillis(untilBoundary + 1000L),
                RuleCheckResult.allowed(incremented, limit, ceilSeconds(untilBoundary)));
    }

    @Override
    public AlgorithmType getAlgorithmType() {
        return AlgorithmType.FIXED_WINDOW;
    }
}
