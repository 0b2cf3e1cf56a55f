package com.example.admission.domain.strategy;

import com.example.admission.domain.model.AlgorithmType;
import com.example.admission.domain.model.RateLimitRule;
import com.example.admission.domain.model.RuleCheckResult;
import com.example.admission.domain.state.BucketState;
import com.example.admission.infrastructure.store.SharedStateClient;
import com.example.admission.infrastructure.store.StateOutcome;

import java.time.Duration;

/**
 * Leaky Bucket 알고리즘 구현
 *
 * 특징:
 * - 요청마다 수위(level)가 1 올라가고 leakRate/sec 속도로 빠짐
 * - level + 1 이 bucketSize를 넘으면 거부
 * - 출력 속도가 일정함 (smoothing effect)
 *
 * 트레이드오프:
 * - 장점: 일정한 처리 속도 보장
 * - 단점: 버스트 트래픽 처리 불가
 */
public class LeakyBucketStrategy extends AbstractStateStrategy<BucketState> {

    public LeakyBucketStrategy(SharedStateClient stateClient) {
        super(stateClient, BucketState.class);
    }

    @Override
    public StateOutcome<BucketState, RuleCheckResult> evaluate(BucketState current, RateLimitRule rule, long nowMillis) {
        double capacity = rule.effectiveBucketSize();
        double leakRate = rule.effectiveLeakRate();

        double level = 0d;
        long lastLeak = nowMillis;
        if (current != null && !Double.isNaN(current.getValue()) && current.getValue() > 0d) {
            level = current.getValue();
            lastLeak = current.getLastUpdateMillis();
        }

        // 시간에 따른 누출
        double elapsedSeconds = Math.max(0L, nowMillis - lastLeak) / 1000d;
        double drained = Math.max(0d, level - elapsedSeconds * leakRate);

        long limit = (long) capacity;
        if (drained + 1d > capacity + 1e-9) {
            // 거부는 수위를 바꾸지 않는다
            double retryAfterSeconds = (drained + 1d - capacity) / leakRate;
            return StateOutcome.unchanged(RuleCheckResult.rejected(
                    level(drained), limit, secondsUntilEmpty(drained, leakRate), retryAfterSeconds));
        }

        double newLevel = drained + 1d;
        return StateOutcome.write(
                new BucketState(newLevel, nowMillis),
                Duration.ofMillis((long) Math.ceil(newLevel / leakRate * 1000d) + 1000L),
                RuleCheckResult.allowed(level(newLevel), limit, secondsUntilEmpty(newLevel, leakRate)));
    }

    @Override
    public AlgorithmType getAlgorithmType() {
        return AlgorithmType.LEAKY_BUCKET;
    }

    private static long level(double level) {
        return (long) Math.ceil(level - 1e-9);
    }

    private static long secondsUntilEmpty(double level, double leakRate) {
        return (long) Math.ceil(level / leakRate);
    }
}
