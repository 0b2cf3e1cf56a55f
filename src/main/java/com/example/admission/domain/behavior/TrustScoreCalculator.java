package com.example.admission.domain.behavior;

import com.example.admission.domain.model.UserBehaviorProfile;

/**
 * 행동 프로필 → 신뢰 점수 [0,1]
 *
 * 가중치:
 * - 기본값 0.10
 * - 계정 나이 0.15 (90일에서 상한)
 * - 요청 간격 일관성 0.15
 * - 성공률 0.20
 * - API 사용 건전성 0.10
 * - 지역 일관성 0.10, 기기 일관성 0.10
 * - 강한 인증(MFA) 0.10
 * - 보안 사고 1건당 -0.10
 *
 * 하위 점수는 가중 전에, 최종 점수는 마지막에 [0,1]로 자른다.
 */
public final class TrustScoreCalculator {

    static final double BASE = 0.10;
    static final double AGE_WEIGHT = 0.15;
    static final double CONSISTENCY_WEIGHT = 0.15;
    static final double SUCCESS_WEIGHT = 0.20;
    static final double API_USAGE_WEIGHT = 0.10;
    static final double GEO_WEIGHT = 0.10;
    static final double DEVICE_WEIGHT = 0.10;
    static final double MFA_BONUS = 0.10;
    static final double INCIDENT_PENALTY = 0.10;
    static final long AGE_CAP_SECONDS = 90L * 24 * 3600;

    private TrustScoreCalculator() {
    }

    public static double trustScore(UserBehaviorProfile profile) {
        double ageFactor = clamp((double) Math.max(0L, profile.getAccountAgeSeconds()) / AGE_CAP_SECONDS);

        double score = BASE
                + AGE_WEIGHT * ageFactor
                + CONSISTENCY_WEIGHT * clamp(profile.getConsistencyScore())
                + SUCCESS_WEIGHT * clamp(profile.getSuccessRate())
                + API_USAGE_WEIGHT * clamp(profile.getApiUsageScore())
                + GEO_WEIGHT * clamp(profile.getGeoConsistencyScore())
                + DEVICE_WEIGHT * clamp(profile.getDeviceConsistencyScore())
                + (profile.isMfaEnabled() ? MFA_BONUS : 0d)
                - INCIDENT_PENALTY * Math.max(0, profile.getSecurityIncidentCount());

        return clamp(score);
    }

    /**
     * [0,1]로 자름. NaN은 0으로 본다.
     */
    public static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0d;
        }
        return Math.max(0d, Math.min(1d, value));
    }
}
