package com.example.admission.domain.behavior;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 사용자 한 명의 최근 활동 기록 (프로세스 로컬, 인스턴스 단위로 동기화)
 */
class UserHistory {

    private final int maxSamples;
    private final int maxDistinctValues;

    private final Deque<Long> requestTimes = new ArrayDeque<>();
    private final Map<String, Long> endpointCounts = new HashMap<>();
    private final Set<String> countries = new LinkedHashSet<>();
    private final Set<String> devices = new LinkedHashSet<>();
    private final long firstSeenMillis;
    private long requests;
    private long violations;
    private long successes;
    private long failures;
    private int securityIncidents;

    UserHistory(long firstSeenMillis, int maxSamples, int maxDistinctValues) {
        this.firstSeenMillis = firstSeenMillis;
        this.maxSamples = maxSamples;
        this.maxDistinctValues = maxDistinctValues;
    }

    synchronized void recordRequest(String endpoint, String country, String device, long nowMillis) {
        requests++;
        requestTimes.addLast(nowMillis);
        while (requestTimes.size() > maxSamples) {
            requestTimes.removeFirst();
        }
        if (endpoint != null) {
            endpointCounts.merge(endpoint, 1L, Long::sum);
        }
        addBounded(countries, country);
        addBounded(devices, device);
    }

    synchronized void recordViolation() {
        violations++;
    }

    synchronized void recordOutcome(boolean success) {
        if (success) {
            successes++;
        } else {
            failures++;
        }
    }

    synchronized void recordSecurityIncident() {
        securityIncidents++;
    }

    synchronized HistorySnapshot snapshot() {
        return new HistorySnapshot(
                firstSeenMillis,
                List.copyOf(requestTimes),
                Map.copyOf(endpointCounts),
                countries.size(),
                devices.size(),
                requests,
                violations,
                successes,
                failures,
                securityIncidents
        );
    }

    private void addBounded(Set<String> values, String value) {
        if (value == null || value.isBlank() || values.contains(value)) {
            return;
        }
        if (values.size() >= maxDistinctValues) {
            String oldest = values.iterator().next();
            values.remove(oldest);
        }
        values.add(value);
    }
}
