package com.example.admission.domain.behavior;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * 사용자별 최근 활동 기록 저장소
 *
 * 프로세스 로컬 캐시이며 프로세스 간 일관성은 best-effort다.
 * 마지막 접근 후 retention이 지나면 기록이 사라진다.
 */
public class BehaviorHistoryStore {

    private final Cache<String, UserHistory> histories;
    private final Clock clock;
    private final int maxSamples;
    private final int maxDistinctValues;

    public BehaviorHistoryStore(Clock clock, Duration retention, long maxUsers, int maxSamples, int maxDistinctValues) {
        this.clock = clock;
        this.maxSamples = maxSamples;
        this.maxDistinctValues = maxDistinctValues;
        this.histories = Caffeine.newBuilder()
                .expireAfterAccess(retention)
                .maximumSize(maxUsers)
                .ticker(clockTicker(clock))
                .build();
    }

    public void recordRequest(String userId, String endpoint, String country, String device) {
        history(userId).recordRequest(endpoint, country, device, clock.millis());
    }

    public void recordViolation(String userId) {
        history(userId).recordViolation();
    }

    public void recordOutcome(String userId, boolean success) {
        history(userId).recordOutcome(success);
    }

    public void recordSecurityIncident(String userId) {
        history(userId).recordSecurityIncident();
    }

    public Optional<HistorySnapshot> snapshot(String userId) {
        UserHistory history = histories.getIfPresent(userId);
        return history == null ? Optional.empty() : Optional.of(history.snapshot());
    }

    private UserHistory history(String userId) {
        return histories.get(userId, id -> new UserHistory(clock.millis(), maxSamples, maxDistinctValues));
    }

    static Ticker clockTicker(Clock clock) {
        return () -> clock.millis() * 1_000_000L;
    }
}
