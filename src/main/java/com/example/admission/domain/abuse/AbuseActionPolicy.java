package com.example.admission.domain.abuse;

import java.util.List;

/**
 * 위험도 → 대응 조치
 *
 * <pre>
 * max >= 9                                         BLOCK
 * max >= 7, 점수 6 이상·신뢰도 0.8 이상 탐지기 2개 이상  BLOCK
 * max >= 7                                         CHALLENGE
 * max >= 5                                         RATE_LIMIT
 * max >= 3                                         MONITOR
 * 그 외                                             ALLOW
 * </pre>
 */
public class AbuseActionPolicy {

    static final double BLOCK_THRESHOLD = 9.0;
    static final double CHALLENGE_THRESHOLD = 7.0;
    static final double RATE_LIMIT_THRESHOLD = 5.0;
    static final double MONITOR_THRESHOLD = 3.0;
    static final double CORROBORATING_SCORE = 6.0;
    static final double CORROBORATING_CONFIDENCE = 0.8;

    public AbuseAction decide(List<AbuseDetectionResult> results) {
        double max = results.stream().mapToDouble(AbuseDetectionResult::getRiskScore).max().orElse(0);

        if (max >= BLOCK_THRESHOLD) {
            return AbuseAction.BLOCK;
        }
        if (max >= CHALLENGE_THRESHOLD) {
            long corroborating = results.stream()
                    .filter(r -> r.getRiskScore() >= CORROBORATING_SCORE && r.getConfidence() >= CORROBORATING_CONFIDENCE)
                    .count();
            return corroborating >= 2 ? AbuseAction.BLOCK : AbuseAction.CHALLENGE;
        }
        if (max >= RATE_LIMIT_THRESHOLD) {
            return AbuseAction.RATE_LIMIT;
        }
        if (max >= MONITOR_THRESHOLD) {
            return AbuseAction.MONITOR;
        }
        return AbuseAction.ALLOW;
    }
}
