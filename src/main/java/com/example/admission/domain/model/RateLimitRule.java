package com.example.admission.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Rate Limit 규칙 (불변)
 *
 * algorithm 값에 따라 필요한 필드가 다르며, 로딩 시점에 RuleValidator가 검증한다.
 * - sliding_window, fixed_window: limit, windowSizeSeconds
 * - token_bucket: bucketSize(기본 limit), refillRate(기본 limit / window)
 * - leaky_bucket: bucketSize(기본 limit), leakRate(기본 limit / window)
 *
 * keyPattern 플레이스홀더: {userId}, {ip}, {endpoint}, {method}, {tier}
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RateLimitRule {

    String name;
    AlgorithmType algorithm;
    long limit;
    long windowSizeSeconds;
    String keyPattern;
    Long bucketSize;
    Double refillRate;
    Double leakRate;

    @Builder.Default
    RuleScope scope = RuleScope.GLOBAL;

    /** ENDPOINT: Ant 경로 패턴, TIER: 티어 이름, IP: IP 또는 CIDR */
    String match;

    @Singular
    List<String> methods;

    /** false면 적응형 배수를 적용하지 않는다 */
    @Builder.Default
    boolean adaptive = true;

    @JsonIgnore
    public long effectiveBucketSize() {
        return bucketSize != null ? bucketSize : limit;
    }

    @JsonIgnore
    public double effectiveRefillRate() {
        return refillRate != null ? refillRate : (double) limit / windowSizeSeconds;
    }

    @JsonIgnore
    public double effectiveLeakRate() {
        return leakRate != null ? leakRate : (double) limit / windowSizeSeconds;
    }

    @JsonIgnore
    public long windowSizeMillis() {
        return windowSizeSeconds * 1000L;
    }

    /**
     * 배수를 적용한 사본. 원본 규칙은 변경하지 않는다.
     * limit이 0이면 항상 거부해야 하므로 그대로 둔다.
     */
    public RateLimitRule scaled(double multiplier) {
        if (limit == 0 || multiplier == 1.0) {
            return this;
        }
        RateLimitRuleBuilder builder = toBuilder().limit(scale(limit, multiplier));
        if (bucketSize != null) {
            builder.bucketSize(scale(bucketSize, multiplier));
        }
        return builder.build();
    }

    private static long scale(long value, double multiplier) {
        return Math.max(1L, (long) Math.floor(value * multiplier));
    }
}
