package com.example.admission.domain.adaptive;

import com.example.admission.config.AdmissionProperties;
import com.example.admission.domain.model.AlgorithmType;
import com.example.admission.domain.model.RateLimitRequest;
import com.example.admission.domain.model.RateLimitRule;
import com.example.admission.domain.model.RuleScope;
import com.example.admission.domain.model.UserBehaviorProfile;
import com.example.admission.domain.response.EnforcementStore;
import com.example.admission.infrastructure.store.InMemorySharedStateClient;
import com.example.admission.infrastructure.store.StateCodec;
import com.example.admission.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * 적응형 배수 계산과 임시 제한 규칙 테스트
 */
class AdaptiveLimitAdjusterTest {

    private static final Instant NEUTRAL_HOUR = Instant.parse("2024-05-01T07:00:00Z");
    private static final Instant PEAK_HOUR = Instant.parse("2024-05-01T10:00:00Z");
    private static final Instant OFF_PEAK_HOUR = Instant.parse("2024-05-01T03:00:00Z");

    private AdmissionProperties.Adaptive config;
    private AdmissionProperties.Enforcement enforcementConfig;
    private EnforcementStore enforcementStore;
    private AdaptiveLimitAdjuster adjuster;

    private final RateLimitRule rule = RateLimitRule.builder()
            .name("global")
            .algorithm(AlgorithmType.SLIDING_WINDOW)
            .limit(100)
            .windowSizeSeconds(60)
            .keyPattern("g:{userId}")
            .build();

    @BeforeEach
    void setUp() {
        config = new AdmissionProperties.Adaptive();
        enforcementConfig = new AdmissionProperties.Enforcement();
        MutableClock clock = new MutableClock(NEUTRAL_HOUR);
        enforcementStore = new EnforcementStore(new InMemorySharedStateClient(new StateCodec(), clock));
        adjuster = new AdaptiveLimitAdjuster(config, enforcementConfig, enforcementStore);
    }

    @Test
    @DisplayName("neutral 프로필, 평시 시간대: 0.5 + 0.425 × 1.5 = 1.1375")
    void neutralMultiplier() {
        // given
        UserBehaviorProfile neutral = UserBehaviorProfile.neutral("alice");

        // when
        double multiplier = adjuster.multiplier(neutral, "/api/orders", NEUTRAL_HOUR);
        RateLimitRule effective = adjuster.adjust(rule, neutral, "/api/orders", NEUTRAL_HOUR);

        // then
        assertThat(multiplier).isCloseTo(1.1375, within(1e-9));
        assertThat(effective.getLimit()).isEqualTo(113);
        assertThat(rule.getLimit()).isEqualTo(100);
    }

    @Test
    @DisplayName("피크 시간대 0.8, 비피크 시간대 1.2")
    void timeOfDay() {
        assertThat(adjuster.timeOfDayModifier(PEAK_HOUR)).isEqualTo(0.8);
        assertThat(adjuster.timeOfDayModifier(OFF_PEAK_HOUR)).isEqualTo(1.2);
        assertThat(adjuster.timeOfDayModifier(NEUTRAL_HOUR)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("자정을 넘는 비피크 구간")
    void wrappingOffPeakWindow() {
        // given
        config.setOffPeakStartHour(22);
        config.setOffPeakEndHour(4);
        AdaptiveLimitAdjuster wrapping = new AdaptiveLimitAdjuster(config, enforcementConfig, enforcementStore);

        // when & then
        assertThat(wrapping.timeOfDayModifier(Instant.parse("2024-05-01T23:30:00Z"))).isEqualTo(1.2);
        assertThat(wrapping.timeOfDayModifier(Instant.parse("2024-05-01T02:00:00Z"))).isEqualTo(1.2);
        assertThat(wrapping.timeOfDayModifier(Instant.parse("2024-05-01T05:00:00Z"))).isEqualTo(1.0);
    }

    @Test
    @DisplayName("보안 사고와 낮은 성공률은 behavior 하한까지 감소")
    void behaviorModifier() {
        UserBehaviorProfile oneIncident = UserBehaviorProfile.neutral("a").toBuilder().securityIncidentCount(1).build();
        UserBehaviorProfile lowSuccess = UserBehaviorProfile.neutral("b").toBuilder().successRate(0.2).build();
        UserBehaviorProfile terrible = UserBehaviorProfile.neutral("c").toBuilder()
                .securityIncidentCount(10).successRate(0.0).build();

        assertThat(adjuster.behaviorModifier(UserBehaviorProfile.neutral("n"))).isEqualTo(1.0);
        assertThat(adjuster.behaviorModifier(oneIncident)).isCloseTo(0.8, within(1e-9));
        assertThat(adjuster.behaviorModifier(lowSuccess)).isCloseTo(0.8, within(1e-9));
        assertThat(adjuster.behaviorModifier(terrible)).isEqualTo(0.5);
    }

    @Test
    @DisplayName("자주 쓰는 엔드포인트는 1.2 가산")
    void endpointAffinity() {
        UserBehaviorProfile profile = UserBehaviorProfile.neutral("a").toBuilder()
                .frequentEndpoint("/api/orders")
                .build();

        assertThat(adjuster.endpointAffinityModifier(profile, "/api/orders")).isEqualTo(1.2);
        assertThat(adjuster.endpointAffinityModifier(profile, "/api/admin")).isEqualTo(1.0);
        assertThat(adjuster.endpointAffinityModifier(profile, null)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("배수는 [floor, ceiling]으로 잘림")
    void multiplierClamped() {
        // given
        UserBehaviorProfile best = UserBehaviorProfile.builder()
                .userId("best")
                .accountAgeSeconds(365L * 24 * 3600)
                .consistencyScore(1).apiUsageScore(1).geoConsistencyScore(1).deviceConsistencyScore(1)
                .successRate(1).mfaEnabled(true)
                .frequentEndpoint("/api/orders")
                .build();
        UserBehaviorProfile worst = UserBehaviorProfile.neutral("worst").toBuilder()
                .securityIncidentCount(10).successRate(0).build();
        config.setCeiling(2.0);
        config.setFloor(0.4);

        // when & then - 2.0 × 1.0 × 1.2 × 1.2 = 2.88 → 2.0
        assertThat(adjuster.multiplier(best, "/api/orders", OFF_PEAK_HOUR)).isEqualTo(2.0);
        // 0.5 × 0.5 × 0.8 = 0.2 → 0.4
        assertThat(adjuster.multiplier(worst, null, PEAK_HOUR)).isEqualTo(0.4);
    }

    @Test
    @DisplayName("adaptive=false 규칙이나 비활성화 설정이면 원본 그대로")
    void nonAdaptiveRulesUntouched() {
        // given
        RateLimitRule fixed = rule.toBuilder().adaptive(false).build();
        UserBehaviorProfile neutral = UserBehaviorProfile.neutral("alice");

        // when & then
        assertThat(adjuster.adjust(fixed, neutral, null, NEUTRAL_HOUR)).isSameAs(fixed);

        config.setEnabled(false);
        assertThat(adjuster.adjust(rule, neutral, null, NEUTRAL_HOUR)).isSameAs(rule);
    }

    @Test
    @DisplayName("limit 0 규칙은 배수와 무관하게 0 유지, 작은 한도는 최소 1")
    void scalingBoundaries() {
        RateLimitRule closed = rule.toBuilder().limit(0).build();
        RateLimitRule tiny = rule.toBuilder().limit(1).build();

        assertThat(closed.scaled(2.5).getLimit()).isZero();
        assertThat(tiny.scaled(0.25).getLimit()).isEqualTo(1);
    }

    @Test
    @DisplayName("임시 제한 마커가 있으면 DYNAMIC 규칙 공급")
    void throttleRule() {
        // given
        RateLimitRequest request = RateLimitRequest.builder().userId("mallory").ip("203.0.113.9").build();
        assertThat(adjuster.dynamicRules(request)).isEmpty();

        // when
        enforcementStore.throttle(request.identity(), Duration.ofMinutes(15));
        List<RateLimitRule> rules = adjuster.dynamicRules(request);

        // then
        assertThat(rules).singleElement().satisfies(dynamic -> {
            assertThat(dynamic.getName()).isEqualTo(AdaptiveLimitAdjuster.THROTTLE_RULE_NAME);
            assertThat(dynamic.getScope()).isEqualTo(RuleScope.DYNAMIC);
            assertThat(dynamic.getLimit()).isEqualTo(enforcementConfig.getThrottleLimit());
            assertThat(dynamic.isAdaptive()).isFalse();
        });
    }
}
