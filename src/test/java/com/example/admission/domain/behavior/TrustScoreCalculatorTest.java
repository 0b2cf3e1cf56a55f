package com.example.admission.domain.behavior;

import com.example.admission.domain.model.UserBehaviorProfile;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * 신뢰 점수 가중치와 범위 테스트
 */
class TrustScoreCalculatorTest {

    @Test
    @DisplayName("neutral 프로필의 신뢰 점수는 0.425")
    void neutralProfile() {
        double score = TrustScoreCalculator.trustScore(UserBehaviorProfile.neutral("alice"));

        assertThat(score).isCloseTo(0.425, within(1e-9));
    }

    @Test
    @DisplayName("가장 좋은 프로필은 1을 넘지 않음")
    void bestProfileCappedAtOne() {
        // given
        UserBehaviorProfile best = UserBehaviorProfile.builder()
                .userId("veteran")
                .accountAgeSeconds(365L * 24 * 3600)
                .consistencyScore(1.0)
                .apiUsageScore(1.0)
                .geoConsistencyScore(1.0)
                .deviceConsistencyScore(1.0)
                .successRate(1.0)
                .mfaEnabled(true)
                .build();

        // when
        double score = TrustScoreCalculator.trustScore(best);

        // then
        assertThat(score).isEqualTo(1.0);
    }

    @Test
    @DisplayName("보안 사고가 많으면 0으로 잘림")
    void incidentsFloorAtZero() {
        // given
        UserBehaviorProfile worst = UserBehaviorProfile.neutral("mallory").toBuilder()
                .securityIncidentCount(12)
                .build();

        // when & then
        assertThat(TrustScoreCalculator.trustScore(worst)).isZero();
    }

    @Test
    @DisplayName("범위를 벗어난 하위 점수는 가중 전에 잘림")
    void subScoresClampedBeforeWeighting() {
        // given - successRate 5.0이 그대로 쓰이면 1.0을 크게 넘음
        UserBehaviorProfile inflated = UserBehaviorProfile.builder()
                .userId("odd")
                .successRate(5.0)
                .consistencyScore(Double.NaN)
                .accountAgeSeconds(-100)
                .build();

        // when
        double score = TrustScoreCalculator.trustScore(inflated);

        // then - 기본값 0.10 + 성공률 0.20 (나머지 0)
        assertThat(score).isCloseTo(0.30, within(1e-9));
    }

    @Test
    @DisplayName("보안 사고 1건당 0.1 감점")
    void incidentPenalty() {
        UserBehaviorProfile neutral = UserBehaviorProfile.neutral("bob");
        UserBehaviorProfile penalized = neutral.toBuilder().securityIncidentCount(2).build();

        assertThat(TrustScoreCalculator.trustScore(neutral) - TrustScoreCalculator.trustScore(penalized))
                .isCloseTo(0.2, within(1e-9));
    }
}
