package com.example.admission.presentation.dto;

import com.example.admission.domain.model.AdmissionDecision;
import com.example.admission.domain.model.RateLimitRequest;
import com.example.admission.domain.model.RateLimitResult;
import com.example.admission.domain.model.RateLimitRule;
import com.example.admission.domain.model.UserBehaviorProfile;
import com.example.admission.domain.rule.RuleSet;
import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * API 요청/응답 DTO들
 *
 * SOLID 원칙:
 * - Single Responsibility: 각 DTO는 하나의 요청/응답 타입만 표현
 */
public class AdmissionDto {

    /**
     * 판정 결과 응답 DTO
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class CheckResponse {
        private boolean allowed;
        private AdmissionDecision decision;
        private String reason;
        private Long retryAfterSeconds;
        private String rule;
        private long current;
        private long limit;
        private long remaining;
        private long windowRemainingSeconds;
        private boolean degraded;

        public static CheckResponse from(RateLimitResult result) {
            return CheckResponse.builder()
                    .allowed(result.isAllowed())
                    .decision(result.getDecision())
                    .reason(result.getReason())
                    .retryAfterSeconds(result.getRetryAfterSeconds())
                    .rule(result.getRule())
                    .current(result.getCurrent())
                    .limit(result.getLimit())
                    .remaining(result.getRemaining())
                    .windowRemainingSeconds(result.getWindowRemainingSeconds())
                    .degraded(result.isDegraded())
                    .build();
        }
    }

    /**
     * 처리 결과 피드백 요청 DTO
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class OutcomeRequest {
        @NotNull
        private RateLimitRequest request;
        private boolean success;
    }

    /**
     * 보안 사고 보고 요청 DTO
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class IncidentRequest {
        @NotBlank
        private String userId;
        @NotBlank
        private String type;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RuleSetResponse {
        private long version;
        private Instant loadedAt;
        private List<RateLimitRule> rules;

        public static RuleSetResponse from(RuleSet ruleSet) {
            return RuleSetResponse.builder()
                    .version(ruleSet.getVersion())
                    .loadedAt(ruleSet.getLoadedAt())
                    .rules(ruleSet.getRules())
                    .build();
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TrustResponse {
        private String userId;
        private double trustScore;
        private UserBehaviorProfile profile;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ResetResponse {
        private String identity;
        private int resetKeys;
    }

    /**
     * 에러 응답 DTO
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static class ErrorResponse {
        private int status;
        private String error;
        private String message;
        private List<String> details;
        private Instant timestamp;
    }
}
