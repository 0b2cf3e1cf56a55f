package com.example.admission.domain.abuse;

import lombok.Value;

import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 전체 탐지 결과
 *
 * 종합 위험도는 탐지기 점수의 최댓값, 지표는 합집합, 신뢰도는 최댓값을 낸 탐지기의 것이다.
 */
@Value
public class AbuseAnalysisResult {

    List<AbuseDetectionResult> results;
    double riskScore;
    double confidence;
    Set<String> indicators;
    AbuseAction action;

    public static AbuseAnalysisResult combine(List<AbuseDetectionResult> results, AbuseActionPolicy policy) {
        AbuseDetectionResult top = results.stream()
                .max(Comparator.comparingDouble(AbuseDetectionResult::getRiskScore))
                .orElse(null);
        Set<String> indicators = new LinkedHashSet<>();
        results.forEach(result -> indicators.addAll(result.getIndicators()));

        return new AbuseAnalysisResult(
                List.copyOf(results),
                top == null ? 0 : top.getRiskScore(),
                top == null ? 0 : top.getConfidence(),
                Set.copyOf(indicators),
                policy.decide(results));
    }

    public long failedDetectors() {
        return results.stream().filter(AbuseDetectionResult::isFailed).count();
    }
}
