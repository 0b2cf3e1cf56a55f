package com.example.admission.domain.behavior;

import com.example.admission.domain.behavior.IdentityDirectory.IdentityAttributes;
import com.example.admission.domain.model.UserBehaviorProfile;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 활동 기록과 계정 정보로 UserBehaviorProfile을 계산한다.
 */
public class BehaviorProfileCalculator {

    private static final int MIN_CONSISTENCY_SAMPLES = 3;
    private static final long MIN_ENDPOINT_HITS = 5;

    private final BehaviorHistoryStore historyStore;
    private final IdentityDirectory identityDirectory;
    private final Clock clock;
    private final double frequentEndpointShare;

    public BehaviorProfileCalculator(BehaviorHistoryStore historyStore,
                                     IdentityDirectory identityDirectory,
                                     Clock clock,
                                     double frequentEndpointShare) {
        this.historyStore = historyStore;
        this.identityDirectory = identityDirectory;
        this.clock = clock;
        this.frequentEndpointShare = frequentEndpointShare;
    }

    public UserBehaviorProfile calculate(String userId) {
        Instant now = clock.instant();
        Optional<HistorySnapshot> history = historyStore.snapshot(userId);
        Optional<IdentityAttributes> attributes = identityDirectory.lookup(userId);

        if (history.isEmpty() && attributes.isEmpty()) {
            return UserBehaviorProfile.neutral(userId).toBuilder().lastUpdated(now).build();
        }

        long createdAtMillis = attributes.map(a -> a.getCreatedAt().toEpochMilli())
                .orElseGet(() -> history.map(HistorySnapshot::getFirstSeenMillis).orElse(now.toEpochMilli()));

        UserBehaviorProfile.UserBehaviorProfileBuilder builder = UserBehaviorProfile.builder()
                .userId(userId)
                .accountAgeSeconds(Math.max(0L, (now.toEpochMilli() - createdAtMillis) / 1000L))
                .mfaEnabled(attributes.map(IdentityAttributes::isMfaEnabled).orElse(false))
                .lastUpdated(now);

        if (history.isEmpty()) {
            UserBehaviorProfile neutral = UserBehaviorProfile.neutral(userId);
            return builder
                    .consistencyScore(neutral.getConsistencyScore())
                    .apiUsageScore(neutral.getApiUsageScore())
                    .geoConsistencyScore(neutral.getGeoConsistencyScore())
                    .deviceConsistencyScore(neutral.getDeviceConsistencyScore())
                    .successRate(neutral.getSuccessRate())
                    .build();
        }

        HistorySnapshot snapshot = history.get();
        builder.consistencyScore(consistency(snapshot.getRequestTimes()))
                .securityIncidentCount(snapshot.getSecurityIncidents())
                .apiUsageScore(apiUsage(snapshot))
                .geoConsistencyScore(inverseCount(snapshot.getDistinctCountries()))
                .deviceConsistencyScore(inverseCount(snapshot.getDistinctDevices()))
                .successRate(successRate(snapshot));

        long total = snapshot.getEndpointCounts().values().stream().mapToLong(Long::longValue).sum();
        for (Map.Entry<String, Long> entry : snapshot.getEndpointCounts().entrySet()) {
            if (entry.getValue() >= MIN_ENDPOINT_HITS && (double) entry.getValue() / total >= frequentEndpointShare) {
                builder.frequentEndpoint(entry.getKey());
            }
        }
        return builder.build();
    }

    /**
     * 1 - 요청 간격의 변동계수(CV), 하한 0. 표본이 부족하면 0.5.
     */
    static double consistency(List<Long> requestTimes) {
        if (requestTimes.size() < MIN_CONSISTENCY_SAMPLES) {
            return 0.5;
        }
        int intervals = requestTimes.size() - 1;
        double[] gaps = new double[intervals];
        double sum = 0;
        for (int i = 0; i < intervals; i++) {
            gaps[i] = Math.max(0L, requestTimes.get(i + 1) - requestTimes.get(i));
            sum += gaps[i];
        }
        double mean = sum / intervals;
        if (mean == 0d) {
            // 모두 같은 시각: 사람이 아닌 버스트 패턴
            return 0d;
        }
        double variance = 0;
        for (double gap : gaps) {
            variance += (gap - mean) * (gap - mean);
        }
        double cv = Math.sqrt(variance / intervals) / mean;
        return TrustScoreCalculator.clamp(1d - cv);
    }

    private static double apiUsage(HistorySnapshot snapshot) {
        if (snapshot.getRequests() == 0) {
            return 0.5;
        }
        return TrustScoreCalculator.clamp(1d - (double) snapshot.getViolations() / snapshot.getRequests());
    }

    private static double successRate(HistorySnapshot snapshot) {
        long outcomes = snapshot.getSuccesses() + snapshot.getFailures();
        return outcomes == 0 ? 0.5 : (double) snapshot.getSuccesses() / outcomes;
    }

    private static double inverseCount(int distinct) {
        return 1d / Math.max(1, distinct);
    }
}
