package com.example.admission.domain.abuse;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * 단일 탐지기 결과
 *
 * riskScore는 [0,10], confidence는 [0,1]로 항상 잘린다.
 */
@Value
@Builder
public class AbuseDetectionResult {

    public static final double MAX_RISK = 10.0;

    String detector;
    double riskScore;
    double confidence;
    @Singular
    List<String> indicators;
    @Singular("detail")
    Map<String, Object> details;
    String error;

    public static AbuseDetectionResult of(String detector, double riskScore, double confidence,
                                          List<String> indicators, Map<String, Object> details) {
        return AbuseDetectionResult.builder()
                .detector(detector)
                .riskScore(clamp(riskScore, MAX_RISK))
                .confidence(clamp(confidence, 1.0))
                .indicators(indicators)
                .details(details)
                .build();
    }

    public static AbuseDetectionResult clean(String detector) {
        return AbuseDetectionResult.builder()
                .detector(detector)
                .riskScore(0)
                .confidence(0)
                .build();
    }

    /**
     * 실패 또는 타임아웃. 위험도 0으로 처리하고 오류만 남긴다.
     */
    public static AbuseDetectionResult failed(String detector, String error) {
        return AbuseDetectionResult.builder()
                .detector(detector)
                .riskScore(0)
                .confidence(0)
                .error(error)
                .build();
    }

    public boolean isFailed() {
        return error != null;
    }

    static double clamp(double value, double max) {
        if (Double.isNaN(value)) {
            return 0;
        }
        return Math.max(0, Math.min(max, value));
    }
}
