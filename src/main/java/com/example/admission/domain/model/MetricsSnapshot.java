package com.example.admission.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 외부 관측 시스템이 폴링하는 지표 스냅샷
 */
@Value
@Builder
public class MetricsSnapshot {

    long totalRequests;
    long allowedRequests;
    long blockedRequests;
    double blockRate;
    double averageCheckTimeMs;
    long degradedChecks;
    List<RankedCount> topViolatedRules;
    List<RankedCount> topViolatingUsers;

    @Value
    public static class RankedCount {
        String key;
        long count;
    }
}
