package com.example.admission.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Set;

/**
 * 사용자 행동 프로필
 *
 * 점수 필드는 모두 [0,1] 범위. 익명 요청과 아직 계산되지 않은 사용자는 neutral 프로필을 사용한다.
 */
@Value
@Builder(toBuilder = true)
public class UserBehaviorProfile {

    String userId;
    long accountAgeSeconds;
    double consistencyScore;
    int securityIncidentCount;
    double apiUsageScore;
    double geoConsistencyScore;
    double deviceConsistencyScore;
    boolean mfaEnabled;
    double successRate;
    @Singular
    Set<String> frequentEndpoints;
    Instant lastUpdated;

    public static UserBehaviorProfile neutral(String userId) {
        return UserBehaviorProfile.builder()
                .userId(userId == null ? RateLimitRequest.ANONYMOUS : userId)
                .accountAgeSeconds(0)
                .consistencyScore(0.5)
                .securityIncidentCount(0)
                .apiUsageScore(0.5)
                .geoConsistencyScore(0.5)
                .deviceConsistencyScore(0.5)
                .mfaEnabled(false)
                .successRate(0.5)
                .lastUpdated(Instant.EPOCH)
                .build();
    }
}
