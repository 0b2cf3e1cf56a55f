package com.example.admission.domain.factory;

import com.example.admission.domain.model.AlgorithmType;
import com.example.admission.domain.strategy.FixedWindowStrategy;
import com.example.admission.domain.strategy.LeakyBucketStrategy;
import com.example.admission.domain.strategy.RateLimitStrategy;
import com.example.admission.domain.strategy.SlidingWindowStrategy;
import com.example.admission.domain.strategy.TokenBucketStrategy;
import com.example.admission.infrastructure.store.SharedStateClient;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

/**
 * Rate Limit Strategy를 생성하는 팩토리 클래스
 *
 * SOLID 원칙:
 * - Single Responsibility: Strategy 생성만 담당
 * - Open/Closed: 새로운 알고리즘 추가 시 팩토리만 수정하면 됨
 * - Factory Pattern: 객체 생성 로직을 캡슐화
 *
 * 전략은 상태가 없으므로(규칙은 호출마다 전달) 알고리즘당 하나씩 미리 만들어 둔다.
 */
@Component
public class RateLimitStrategyFactory {

    private final Map<AlgorithmType, RateLimitStrategy> strategies = new EnumMap<>(AlgorithmType.class);

    public RateLimitStrategyFactory(SharedStateClient stateClient) {
        for (AlgorithmType type : AlgorithmType.values()) {
            strategies.put(type, createStrategy(type, stateClient));
        }
    }

    public RateLimitStrategy getStrategy(AlgorithmType type) {
        return strategies.get(type);
    }

    private static RateLimitStrategy createStrategy(AlgorithmType type, SharedStateClient stateClient) {
        return switch (type) {
            case SLIDING_WINDOW -> new SlidingWindowStrategy(stateClient);
            case TOKEN_BUCKET -> new TokenBucketStrategy(stateClient);
            case LEAKY_BUCKET -> new LeakyBucketStrategy(stateClient);
            case FIXED_WINDOW -> new FixedWindowStrategy(stateClient);
        };
    }
}
