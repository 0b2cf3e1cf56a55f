package com.example.admission.domain.adaptive;

import com.example.admission.common.exception.StoreUnavailableException;
import com.example.admission.config.AdmissionProperties;
import com.example.admission.domain.behavior.TrustScoreCalculator;
import com.example.admission.domain.model.AlgorithmType;
import com.example.admission.domain.model.RateLimitRequest;
import com.example.admission.domain.model.RateLimitRule;
import com.example.admission.domain.model.RuleScope;
import com.example.admission.domain.model.UserBehaviorProfile;
import com.example.admission.domain.response.EnforcementStore;
import com.example.admission.domain.rule.DynamicRuleSource;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

/**
 * 적응형 한도 조정
 *
 * multiplier = trust × behavior × timeOfDay × endpointAffinity, 결과는 [floor, ceiling]으로 자른다.
 * 배수는 limit과 bucketSize에만 적용되며 저장된 원본 규칙은 바뀌지 않는다.
 * Fixed Window의 윈도우 경계는 배수와 무관하다.
 *
 * 임시 제한(RATE_LIMIT 조치) 중인 식별자에는 DYNAMIC 규칙을 추가로 공급한다.
 */
@Slf4j
public class AdaptiveLimitAdjuster implements DynamicRuleSource {

    public static final String THROTTLE_RULE_NAME = "abuse-throttle";

    private final AdmissionProperties.Adaptive config;
    private final AdmissionProperties.Enforcement enforcementConfig;
    private final EnforcementStore enforcementStore;
    private final ZoneId zone;

    public AdaptiveLimitAdjuster(AdmissionProperties.Adaptive config,
                                 AdmissionProperties.Enforcement enforcementConfig,
                                 EnforcementStore enforcementStore) {
        this.config = config;
        this.enforcementConfig = enforcementConfig;
        this.enforcementStore = enforcementStore;
        this.zone = ZoneId.of(config.getZone());
    }

    /**
     * 유효 규칙 (배수가 적용된 사본)
     */
    public RateLimitRule adjust(RateLimitRule baseRule, UserBehaviorProfile profile, String endpoint, Instant now) {
        if (!config.isEnabled() || !baseRule.isAdaptive()) {
            return baseRule;
        }
        return baseRule.scaled(multiplier(profile, endpoint, now));
    }

    public double multiplier(UserBehaviorProfile profile, String endpoint, Instant now) {
        double combined = trustModifier(TrustScoreCalculator.trustScore(profile))
                * behaviorModifier(profile)
                * timeOfDayModifier(now)
                * endpointAffinityModifier(profile, endpoint);
        return Math.max(config.getFloor(), Math.min(config.getCeiling(), combined));
    }

    /**
     * 신뢰 점수 [0,1] → [minTrustMultiplier, maxTrustMultiplier] 선형 변환
     */
    double trustModifier(double trustScore) {
        double trust = TrustScoreCalculator.clamp(trustScore);
        return config.getMinTrustMultiplier()
                + trust * (config.getMaxTrustMultiplier() - config.getMinTrustMultiplier());
    }

    double behaviorModifier(UserBehaviorProfile profile) {
        double modifier = 1.0;
        for (int i = 0; i < Math.max(0, profile.getSecurityIncidentCount()); i++) {
            modifier *= config.getIncidentModifier();
            if (modifier <= config.getBehaviorFloor()) {
                break;
            }
        }
        if (profile.getSuccessRate() < 0.5) {
            modifier *= config.getLowSuccessModifier();
        }
        return Math.max(config.getBehaviorFloor(), Math.min(1.0, modifier));
    }

    double timeOfDayModifier(Instant now) {
        int hour = now.atZone(zone).getHour();
        if (inRange(hour, config.getPeakStartHour(), config.getPeakEndHour())) {
            return config.getPeakModifier();
        }
        if (inRange(hour, config.getOffPeakStartHour(), config.getOffPeakEndHour())) {
            return config.getOffPeakModifier();
        }
        return 1.0;
    }

    double endpointAffinityModifier(UserBehaviorProfile profile, String endpoint) {
        if (endpoint == null || profile.getFrequentEndpoints() == null) {
            return 1.0;
        }
        return profile.getFrequentEndpoints().contains(endpoint) ? config.getEndpointAffinityModifier() : 1.0;
    }

    @Override
    public List<RateLimitRule> dynamicRules(RateLimitRequest request) {
        try {
            if (!enforcementStore.isThrottled(request.identity())) {
                return List.of();
            }
        } catch (StoreUnavailableException e) {
            log.debug("Throttle lookup skipped for {}: store unavailable", request.identity());
            return List.of();
        }
        return List.of(RateLimitRule.builder()
                .name(THROTTLE_RULE_NAME)
                .algorithm(AlgorithmType.SLIDING_WINDOW)
                .limit(enforcementConfig.getThrottleLimit())
                .windowSizeSeconds(enforcementConfig.getThrottleWindowSeconds())
                .keyPattern("throttle:{userId}:{ip}")
                .scope(RuleScope.DYNAMIC)
                .adaptive(false)
                .build());
    }

    /**
     * [start, end) 구간. start > end면 자정을 넘는 구간이다.
     */
    private static boolean inRange(int hour, int start, int end) {
        if (start == end) {
            return false;
        }
        if (start < end) {
            return hour >= start && hour < end;
        }
        return hour >= start || hour < end;
    }
}
