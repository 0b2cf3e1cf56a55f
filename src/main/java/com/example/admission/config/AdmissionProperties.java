package com.example.admission.config;

import com.example.admission.domain.model.AlgorithmType;
import com.example.admission.domain.model.RateLimitRule;
import com.example.admission.domain.model.RuleScope;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * admission.* 설정
 *
 * 규칙은 여기서 바인딩한 뒤 RateLimitRule로 변환해 RuleRegistry에 올린다.
 * 규칙 자체의 의미 검증은 RuleValidator가 담당한다.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "admission")
public class AdmissionProperties {

    @Valid
    private List<Rule> rules = new ArrayList<>();

    @Valid
    private Store store = new Store();

    @Valid
    private Adaptive adaptive = new Adaptive();

    @Valid
    private Behavior behavior = new Behavior();

    @Valid
    private Enforcement enforcement = new Enforcement();

    @Valid
    private Metrics metrics = new Metrics();

    public List<RateLimitRule> toRules() {
        return rules.stream().map(Rule::toRule).toList();
    }

    @Data
    public static class Rule {
        private String name;
        private String algorithm;
        private long limit;
        private long windowSizeSeconds = 60;
        private String keyPattern;
        private Long bucketSize;
        private Double refillRate;
        private Double leakRate;
        private RuleScope scope = RuleScope.GLOBAL;
        private String match;
        private List<String> methods = new ArrayList<>();
        private boolean adaptive = true;

        public RateLimitRule toRule() {
            return RateLimitRule.builder()
                    .name(name)
                    .algorithm(algorithm == null ? null : AlgorithmType.fromId(algorithm))
                    .limit(limit)
                    .windowSizeSeconds(windowSizeSeconds)
                    .keyPattern(keyPattern)
                    .bucketSize(bucketSize)
                    .refillRate(refillRate)
                    .leakRate(leakRate)
                    .scope(scope)
                    .match(match)
                    .methods(methods == null ? List.of() : methods)
                    .adaptive(adaptive)
                    .build();
        }
    }

    @Data
    public static class Store {
        public enum Type { REDIS, IN_MEMORY }

        @NotNull
        private Type type = Type.REDIS;
        @Min(1)
        private int maxCasAttempts = 64;
        @NotNull
        private Duration maxClockSkew = Duration.ofSeconds(2);
        @NotNull
        private Duration evictionInterval = Duration.ofSeconds(30);
    }

    @Data
    public static class Adaptive {
        private boolean enabled = true;
        @DecimalMin("0.01")
        private double minTrustMultiplier = 0.5;
        @DecimalMin("0.01")
        private double maxTrustMultiplier = 2.0;
        @DecimalMin("0.01")
        private double floor = 0.25;
        @DecimalMin("0.01")
        private double ceiling = 3.0;
        private double incidentModifier = 0.8;
        private double lowSuccessModifier = 0.8;
        private double behaviorFloor = 0.5;
        private String zone = "UTC";
        @Min(0) @Max(24)
        private int peakStartHour = 9;
        @Min(0) @Max(24)
        private int peakEndHour = 18;
        private double peakModifier = 0.8;
        @Min(0) @Max(24)
        private int offPeakStartHour = 0;
        @Min(0) @Max(24)
        private int offPeakEndHour = 6;
        private double offPeakModifier = 1.2;
        private double endpointAffinityModifier = 1.2;
    }

    @Data
    public static class Behavior {
        @NotNull
        private Duration profileTtl = Duration.ofMinutes(10);
        @NotNull
        private Duration refreshAfter = Duration.ofMinutes(1);
        @Min(1)
        private long maxProfiles = 100_000;
        @NotNull
        private Duration historyRetention = Duration.ofHours(24);
        @Min(1)
        private long maxHistories = 100_000;
        @Min(3)
        private int maxSamples = 100;
        @Min(1)
        private int maxDistinctValues = 20;
        private double frequentEndpointShare = 0.2;
        @Min(1)
        private int analyzerThreads = 2;
    }

    @Data
    public static class Enforcement {
        @NotNull
        private Duration blockDuration = Duration.ofMinutes(15);
        @NotNull
        private Duration challengeDuration = Duration.ofMinutes(10);
        @NotNull
        private Duration throttleDuration = Duration.ofMinutes(15);
        @Min(1)
        private long throttleLimit = 10;
        @Min(1)
        private long throttleWindowSeconds = 60;
    }

    @Data
    public static class Metrics {
        @NotNull
        private Duration violationRetention = Duration.ofHours(1);
        @Min(1)
        private int topN = 10;
        @Min(1)
        private long maxViolations = 100_000;
    }
}
