package com.example.admission.domain.strategy;

import com.example.admission.domain.model.AlgorithmType;
import com.example.admission.domain.model.RateLimitRule;
import com.example.admission.domain.model.RuleCheckResult;
import com.example.admission.domain.state.BucketState;
import com.example.admission.infrastructure.store.SharedStateClient;
import com.example.admission.infrastructure.store.StateOutcome;

import java.time.Duration;

/**
 * Token Bucket 알고리즘 구현
 *
 * 특징:
 * - 버킷에 토큰이 일정 속도로 채워짐 (refillRate/sec, 최대 bucketSize)
 * - 요청마다 토큰 1개씩 소비
 * - 버스트 트래픽 허용
 *
 * 트레이드오프:
 * - 장점: 버스트 트래픽 유연하게 처리, 평균 요청률 제어 효과적
 * - 단점: 토큰 수와 마지막 리필 시간 저장, 시간 동기화 필요
 *
 * 새 키는 가득 찬 버킷으로 시작한다. 거부 시 상태를 쓰지 않는다.
 */
public class TokenBucketStrategy extends AbstractStateStrategy<BucketState> {

    public TokenBucketStrategy(SharedStateClient stateClient) {
        super(stateClient, BucketState.class);
    }

    @Override
    public StateOutcome<BucketState, RuleCheckResult> evaluate(BucketState current, RateLimitRule rule, long nowMillis) {
        double capacity = rule.effectiveBucketSize();
        double rate = rule.effectiveRefillRate();

        double tokens = capacity;
        long lastRefill = nowMillis;
        if (isUsable(current)) {
            // 용량이 줄어든 경우(적응형 배수) 상한으로 자른다
            tokens = Math.min(capacity, current.getValue());
            lastRefill = current.getLastUpdateMillis();
        }

        // 경과 시간 계산 및 토큰 리필
        double elapsedSeconds = Math.max(0L, nowMillis - lastRefill) / 1000d;
        double filled = Math.min(capacity, tokens + elapsedSeconds * rate);

        long limit = (long) capacity;
        if (filled < 1d) {
            double retryAfterSeconds = (1d - filled) / rate;
            return StateOutcome.unchanged(RuleCheckResult.rejected(
                    used(capacity, filled), limit, secondsUntilFull(capacity, filled, rate), retryAfterSeconds));
        }

        double remaining = filled - 1d;
        return StateOutcome.write(
                new BucketState(remaining, nowMillis),
                ttl(capacity, rate),
                RuleCheckResult.allowed(used(capacity, remaining), limit, secondsUntilFull(capacity, remaining, rate)));
    }

    @Override
    public AlgorithmType getAlgorithmType() {
        return AlgorithmType.TOKEN_BUCKET;
    }

    /**
     * 음수, NaN 토큰은 빈 상태(새 키)로 취급
     */
    private static boolean isUsable(BucketState state) {
        return state != null
                && !Double.isNaN(state.getValue())
                && state.getValue() >= 0d
                && state.getLastUpdateMillis() > 0L;
    }

    private static long used(double capacity, double tokens) {
        return (long) Math.ceil(capacity - tokens - 1e-9);
    }

    private static long secondsUntilFull(double capacity, double tokens, double rate) {
        return (long) Math.ceil((capacity - tokens) / rate);
    }

    /**
     * 버킷이 완전히 다시 찰 때까지 + 여유 1초. 그 이후 만료되면 새 키(가득 찬 버킷)와 동일하다.
     */
    private static Duration ttl(double capacity, double rate) {
        return Duration.ofMillis((long) Math.ceil(capacity / rate * 1000d) + 1000L);
    }
}
