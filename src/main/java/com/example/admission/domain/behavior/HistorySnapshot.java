package com.example.admission.domain.behavior;

import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * UserHistory의 불변 스냅샷
 */
@Value
public class HistorySnapshot {
    long firstSeenMillis;
    List<Long> requestTimes;
    Map<String, Long> endpointCounts;
    int distinctCountries;
    int distinctDevices;
    long requests;
    long violations;
    long successes;
    long failures;
    int securityIncidents;
}
