package com.example.admission.domain.abuse;

/**
 * 위험도에 따른 대응 조치 (심각도 오름차순)
 */
public enum AbuseAction {
    ALLOW,
    MONITOR,
    RATE_LIMIT,
    CHALLENGE,
    BLOCK;

    public boolean isEnforcing() {
        return this == RATE_LIMIT || this == CHALLENGE || this == BLOCK;
    }
}
