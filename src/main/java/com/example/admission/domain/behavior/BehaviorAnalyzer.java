package com.example.admission.domain.behavior;

import com.example.admission.domain.model.RateLimitRequest;
import com.example.admission.domain.model.UserBehaviorProfile;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executor;

/**
 * 사용자 행동 프로필 캐시와 신뢰 점수
 *
 * 판정 경로를 절대 막지 않는다:
 * - 캐시에 있으면 (오래됐더라도) 그 값을 즉시 반환하고, refreshAfterWrite가 지났으면 백그라운드에서 재계산
 * - 캐시에 없으면 neutral 프로필을 반환하고 백그라운드 계산을 예약
 * - invalidate(): 위반/보안 사고 후 즉시 재계산 예약. 재계산이 끝날 때까지는 이전 값을 그대로 쓴다
 */
@Slf4j
public class BehaviorAnalyzer {

    private final LoadingCache<String, UserBehaviorProfile> profiles;
    private final BehaviorProfileCalculator calculator;

    public BehaviorAnalyzer(BehaviorProfileCalculator calculator,
                            Clock clock,
                            Duration profileTtl,
                            Duration refreshAfter,
                            long maxProfiles,
                            Executor executor) {
        this.calculator = calculator;
        this.profiles = Caffeine.newBuilder()
                .expireAfterWrite(profileTtl)
                .refreshAfterWrite(refreshAfter)
                .maximumSize(maxProfiles)
                .ticker(BehaviorHistoryStore.clockTicker(clock))
                .executor(executor)
                .build(this::recompute);
    }

    /**
     * 캐시된 프로필 (없으면 neutral). 블로킹하지 않는다.
     */
    public UserBehaviorProfile profile(String userId) {
        if (userId == null || userId.isBlank()) {
            return UserBehaviorProfile.neutral(RateLimitRequest.ANONYMOUS);
        }
        UserBehaviorProfile cached = profiles.getIfPresent(userId);
        if (cached != null) {
            return cached;
        }
        profiles.refresh(userId);
        return UserBehaviorProfile.neutral(userId);
    }

    public double trustScore(String userId) {
        return TrustScoreCalculator.trustScore(profile(userId));
    }

    /**
     * 재계산을 예약한다. 새 값이 준비되기 전까지 진행 중인 판정은 이전 프로필을 쓴다.
     */
    public void invalidate(String userId) {
        if (userId == null || userId.isBlank()) {
            return;
        }
        profiles.refresh(userId);
    }

    private UserBehaviorProfile recompute(String userId) {
        UserBehaviorProfile profile = calculator.calculate(userId);
        if (log.isDebugEnabled()) {
            log.debug("Profile recomputed - userId: {}, trust: {}", userId, TrustScoreCalculator.trustScore(profile));
        }
        return profile;
    }
}
