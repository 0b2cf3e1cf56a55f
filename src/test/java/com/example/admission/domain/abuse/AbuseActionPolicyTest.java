package com.example.admission.domain.abuse;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * 위험도 → 대응 조치 정책 테스트
 */
class AbuseActionPolicyTest {

    private final AbuseActionPolicy policy = new AbuseActionPolicy();

    private static AbuseDetectionResult result(String name, double score, double confidence) {
        return AbuseDetectionResult.of(name, score, confidence, List.of(), Map.of());
    }

    @Test
    @DisplayName("단일 탐지기 9점 이상이면 BLOCK")
    void highScoreBlocks() {
        assertThat(policy.decide(List.of(result("a", 9.0, 0.1)))).isEqualTo(AbuseAction.BLOCK);
    }

    @Test
    @DisplayName("7점 이상: 강한 신호 2개면 BLOCK, 아니면 CHALLENGE")
    void corroborationDecidesBetweenBlockAndChallenge() {
        List<AbuseDetectionResult> corroborated = List.of(result("a", 7.5, 0.85), result("b", 6.0, 0.8));
        List<AbuseDetectionResult> weakSecond = List.of(result("a", 7.5, 0.85), result("b", 6.0, 0.79));
        List<AbuseDetectionResult> alone = List.of(result("a", 7.0, 0.9), result("b", 2.0, 1.0));

        assertThat(policy.decide(corroborated)).isEqualTo(AbuseAction.BLOCK);
        assertThat(policy.decide(weakSecond)).isEqualTo(AbuseAction.CHALLENGE);
        assertThat(policy.decide(alone)).isEqualTo(AbuseAction.CHALLENGE);
    }

    @Test
    @DisplayName("5점 RATE_LIMIT, 3점 MONITOR, 그 미만 ALLOW")
    void lowerBands() {
        assertThat(policy.decide(List.of(result("a", 5.0, 0.5)))).isEqualTo(AbuseAction.RATE_LIMIT);
        assertThat(policy.decide(List.of(result("a", 6.99, 0.99)))).isEqualTo(AbuseAction.RATE_LIMIT);
        assertThat(policy.decide(List.of(result("a", 3.0, 0.5)))).isEqualTo(AbuseAction.MONITOR);
        assertThat(policy.decide(List.of(result("a", 2.99, 1.0)))).isEqualTo(AbuseAction.ALLOW);
        assertThat(policy.decide(List.of())).isEqualTo(AbuseAction.ALLOW);
    }

    @Test
    @DisplayName("종합 결과: 최댓값, 최댓값 탐지기의 신뢰도, 지표 합집합")
    void combine() {
        // given
        List<AbuseDetectionResult> results = List.of(
                AbuseDetectionResult.of("a", 4.0, 0.9, List.of("x"), Map.of()),
                AbuseDetectionResult.of("b", 12.0, 1.7, List.of("y", "x"), Map.of()),
                AbuseDetectionResult.failed("c", "boom"));

        // when
        AbuseAnalysisResult analysis = AbuseAnalysisResult.combine(results, policy);

        // then
        assertThat(analysis.getRiskScore()).isEqualTo(10.0);
        assertThat(analysis.getConfidence()).isEqualTo(1.0);
        assertThat(analysis.getIndicators()).containsExactlyInAnyOrder("x", "y");
        assertThat(analysis.getAction()).isEqualTo(AbuseAction.BLOCK);
        assertThat(analysis.failedDetectors()).isEqualTo(1);
    }
}
