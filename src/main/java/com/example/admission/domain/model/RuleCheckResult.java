package com.example.admission.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * 단일 규칙에 대한 알고리즘 평가 결과
 */
@Value
@Builder
public class RuleCheckResult {

    boolean allowed;
    long current;
    long limit;
    long windowRemainingSeconds;
    /** 거부 시에만 값이 있다 (초 단위, 소수점 포함) */
    Double retryAfterSeconds;

    public static RuleCheckResult allowed(long current, long limit, long windowRemainingSeconds) {
        return RuleCheckResult.builder()
                .allowed(true)
                .current(current)
                .limit(limit)
                .windowRemainingSeconds(windowRemainingSeconds)
                .build();
    }

    public static RuleCheckResult rejected(long current, long limit, long windowRemainingSeconds,
                                           double retryAfterSeconds) {
        return RuleCheckResult.builder()
                .allowed(false)
                .current(current)
                .limit(limit)
                .windowRemainingSeconds(windowRemainingSeconds)
                .retryAfterSeconds(retryAfterSeconds)
                .build();
    }
}
