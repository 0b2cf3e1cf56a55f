package com.example.admission.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * 한도 위반 기록 (한 번 쓰고 집계용으로만 읽는다)
 *
 * User-Agent 같은 원본 헤더나 비밀 값은 포함하지 않는다.
 */
@Value
@Builder
public class Violation {

    Instant timestamp;
    String identity;
    String ip;
    String endpoint;
    String rule;
    long current;
    long limit;
    String reason;

    public static Violation of(Instant timestamp, RateLimitRequest request, RateLimitResult result) {
        return Violation.builder()
                .timestamp(timestamp)
                .identity(request.identity())
                .ip(request.getIp())
                .endpoint(request.getEndpoint())
                .rule(result.getRule())
                .current(result.getCurrent())
                .limit(result.getLimit())
                .reason(result.getReason())
                .build();
    }
}
