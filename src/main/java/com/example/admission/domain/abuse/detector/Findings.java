package com.example.admission.domain.abuse.detector;

import com.example.admission.domain.abuse.AbuseDetectionResult;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 탐지기 내부 신호 누적. 가장 높은 점수의 신호가 결과 점수와 신뢰도가 된다.
 */
final class Findings {

    private final String detector;
    private final List<String> indicators = new ArrayList<>();
    private final Map<String, Object> details = new LinkedHashMap<>();
    private double riskScore;
    private double confidence;

    Findings(String detector) {
        this.detector = detector;
    }

    Findings signal(String indicator, double score, double signalConfidence) {
        indicators.add(indicator);
        if (score > riskScore) {
            riskScore = score;
            confidence = signalConfidence;
        }
        return this;
    }

    Findings detail(String key, Object value) {
        details.put(key, value);
        return this;
    }

    boolean has(String indicator) {
        return indicators.contains(indicator);
    }

    /**
     * 독립적인 신호가 함께 나타나면 점수를 올린다.
     */
    Findings escalate(double score, double escalatedConfidence) {
        if (score > riskScore) {
            riskScore = score;
            confidence = Math.max(confidence, escalatedConfidence);
        }
        return this;
    }

    AbuseDetectionResult toResult() {
        return AbuseDetectionResult.of(detector, riskScore, confidence, indicators, details);
    }
}
