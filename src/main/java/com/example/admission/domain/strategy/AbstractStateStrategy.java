package com.example.admission.domain.strategy;

import com.example.admission.domain.model.RateLimitRule;
import com.example.admission.domain.model.RuleCheckResult;
import com.example.admission.infrastructure.store.SharedStateClient;
import com.example.admission.infrastructure.store.StateOutcome;

/**
 * 상태 기반 전략의 공통 골격
 *
 * 하위 클래스는 evaluate()만 구현한다. evaluate는 (상태, 시각, 규칙)에 대한 순수 함수이며
 * SharedStateClient가 한 번의 원자적 트랜잭션 안에서 호출한다.
 *
 * @param <S> CounterState 타입
 */
public abstract class AbstractStateStrategy<S> implements RateLimitStrategy {

    protected final SharedStateClient stateClient;
    private final Class<S> stateType;

    protected AbstractStateStrategy(SharedStateClient stateClient, Class<S> stateType) {
        this.stateClient = stateClient;
        this.stateType = stateType;
    }

    @Override
    public RuleCheckResult check(String key, RateLimitRule rule, long nowMillis) {
        // limit = 0 규칙은 저장소를 건드리지 않고 항상 거부
        if (rule.getLimit() <= 0) {
            return RuleCheckResult.rejected(0, 0, rule.getWindowSizeSeconds(), rule.getWindowSizeSeconds());
        }
        return stateClient.transact(key, stateType, (current, now) -> evaluate(current, rule, now), nowMillis);
    }

    @Override
    public RuleCheckResult peek(String key, RateLimitRule rule, long nowMillis) {
        if (rule.getLimit() <= 0) {
            return RuleCheckResult.rejected(0, 0, rule.getWindowSizeSeconds(), rule.getWindowSizeSeconds());
        }
        return stateClient.transact(key, stateType, (current, now) -> {
            RuleCheckResult result = evaluate(current, rule, now).getResult();
            if (!result.isAllowed()) {
                return StateOutcome.unchanged(result);
            }
            return StateOutcome.unchanged(RuleCheckResult.allowed(
                    Math.max(0, result.getCurrent() - 1), result.getLimit(), result.getWindowRemainingSeconds()));
        }, nowMillis);
    }

    @Override
    public void reset(String key) {
        stateClient.delete(key);
    }

    /**
     * 순수 상태 전이. current가 null이면 새 키다.
     */
    public abstract StateOutcome<S, RuleCheckResult> evaluate(S current, RateLimitRule rule, long nowMillis);

    protected static long ceilSeconds(double millis) {
        return (long) Math.ceil(Math.max(0d, millis) / 1000d);
    }
}
