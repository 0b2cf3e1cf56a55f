package com.example.admission.domain.strategy;

import com.example.admission.domain.model.AlgorithmType;
import com.example.admission.domain.model.RateLimitRule;
import com.example.admission.domain.model.RuleCheckResult;
import com.example.admission.domain.state.SlidingWindowState;
import com.example.admission.infrastructure.store.SharedStateClient;
import com.example.admission.infrastructure.store.StateOutcome;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Sliding Window Log 알고리즘 구현
 *
 * 특징:
 * - 허용된 각 요청의 타임스탬프를 로그에 저장
 * - (now - window, now] 구간의 요청만 카운트
 * - 정확한 rate limiting 제공
 *
 * 트레이드오프:
 * - 장점: 가장 정확한 rate limiting, 윈도우 경계 버스트 없음
 * - 단점: 메모리 사용량 높음 (허용된 요청 수만큼 타임스탬프 저장)
 */
public class SlidingWindowStrategy extends AbstractStateStrategy<SlidingWindowState> {

    public SlidingWindowStrategy(SharedStateClient stateClient) {
        super(stateClient, SlidingWindowState.class);
    }

    @Override
    public StateOutcome<SlidingWindowState, RuleCheckResult> evaluate(
            SlidingWindowState current, RateLimitRule rule, long nowMillis) {

        long windowMillis = rule.windowSizeMillis();
        long windowStart = nowMillis - windowMillis;

        // 윈도우 밖의 오래된 요청 제거
        List<Long> timestamps = new ArrayList<>();
        if (current != null && current.getTimestamps() != null) {
            for (Long timestamp : current.getTimestamps()) {
                if (timestamp != null && timestamp > windowStart) {
                    timestamps.add(timestamp);
                }
            }
        }
        timestamps.sort(Long::compare);

        long limit = rule.getLimit();
        if (timestamps.size() >= limit) {
            // 한도가 저장된 개수보다 작아졌으면 (size - limit + 1)개가 빠져야 자리가 난다
            double retryAfterMillis = windowMillis;
            if (limit >= 1) {
                long freesSlot = timestamps.get((int) (timestamps.size() - limit));
                retryAfterMillis = freesSlot + windowMillis - nowMillis;
            }
            return StateOutcome.unchanged(RuleCheckResult.rejected(
                    timestamps.size(), limit, ceilSeconds(retryAfterMillis), retryAfterMillis / 1000d));
        }

        timestamps.add(nowMillis);
        long remainingMillis = timestamps.get(0) + windowMillis - nowMillis;
        return StateOutcome.write(
                new SlidingWindowState(timestamps),
                Duration.ofMillis(windowMillis),
                RuleCheckResult.allowed(timestamps.size(), limit, ceilSeconds(remainingMillis)));
    }

    @Override
    public AlgorithmType getAlgorithmType() {
        return AlgorithmType.SLIDING_WINDOW;
    }

}
