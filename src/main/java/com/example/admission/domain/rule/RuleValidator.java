package com.example.admission.domain.rule;

import com.example.admission.common.exception.RuleConfigurationException;
import com.example.admission.domain.model.RateLimitRule;
import com.example.admission.domain.model.RuleScope;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 규칙 세트 검증
 *
 * 알고리즘별 필수/허용 필드를 switch로 검사하므로 새 알고리즘이 추가되면 컴파일 단계에서 드러난다.
 * 오류는 모두 모아서 한 번에 RuleConfigurationException으로 던진다.
 */
public class RuleValidator {

    /** 윈도우와 버킷이 비워지거나 다시 차는 시간의 상한 (30일). 상태 TTL이 이 범위 안에 있어야 한다 */
    static final long MAX_WINDOW_SECONDS = 30L * 24 * 60 * 60;

    public void validate(List<RateLimitRule> rules) {
        List<String> errors = new ArrayList<>();
        Set<String> names = new HashSet<>();

        if (rules == null) {
            throw new RuleConfigurationException(List.of("Rule set must not be null"));
        }

        for (int i = 0; i < rules.size(); i++) {
            RateLimitRule rule = rules.get(i);
            String label = "rule[" + i + "]";
            if (rule == null) {
                errors.add(label + ": must not be null");
                continue;
            }
            if (isBlank(rule.getName())) {
                errors.add(label + ": name is required");
            } else {
                label = "rule '" + rule.getName() + "'";
                if (!names.add(rule.getName())) {
                    errors.add(label + ": duplicate name");
                }
            }
            validateRule(rule, label, errors);
        }

        if (!errors.isEmpty()) {
            throw new RuleConfigurationException(errors);
        }
    }

    void validateRule(RateLimitRule rule, String label, List<String> errors) {
        if (rule.getAlgorithm() == null) {
            errors.add(label + ": algorithm is required");
            return;
        }
        if (rule.getLimit() < 0) {
            errors.add(label + ": limit must not be negative");
        }
        if (rule.getWindowSizeSeconds() <= 0) {
            errors.add(label + ": windowSizeSeconds must be positive");
        } else if (rule.getWindowSizeSeconds() > MAX_WINDOW_SECONDS) {
            errors.add(label + ": windowSizeSeconds must not exceed " + MAX_WINDOW_SECONDS);
        }
        if (isBlank(rule.getKeyPattern())) {
            errors.add(label + ": keyPattern is required");
        } else {
            Set<String> unknown = KeyPatternResolver.unknownPlaceholders(rule.getKeyPattern());
            if (!unknown.isEmpty()) {
                errors.add(label + ": unknown placeholders " + unknown);
            }
        }

        switch (rule.getAlgorithm()) {
            case SLIDING_WINDOW, FIXED_WINDOW -> {
                if (rule.getBucketSize() != null || rule.getRefillRate() != null || rule.getLeakRate() != null) {
                    errors.add(label + ": bucketSize/refillRate/leakRate are not valid for " + rule.getAlgorithm().getId());
                }
            }
            case TOKEN_BUCKET -> {
                requirePositive(rule.getBucketSize(), "bucketSize", label, errors);
                requirePositive(rule.getRefillRate(), "refillRate", label, errors);
                requireBoundedCycle(rule, rule.getRefillRate(), "refill", label, errors);
                if (rule.getLeakRate() != null) {
                    errors.add(label + ": leakRate is not valid for token_bucket");
                }
            }
            case LEAKY_BUCKET -> {
                requirePositive(rule.getBucketSize(), "bucketSize", label, errors);
                requirePositive(rule.getLeakRate(), "leakRate", label, errors);
                requireBoundedCycle(rule, rule.getLeakRate(), "drain", label, errors);
                if (rule.getRefillRate() != null) {
                    errors.add(label + ": refillRate is not valid for leaky_bucket");
                }
            }
        }

        validateScope(rule, label, errors);
    }

    private void validateScope(RateLimitRule rule, String label, List<String> errors) {
        RuleScope scope = rule.getScope() == null ? RuleScope.GLOBAL : rule.getScope();
        switch (scope) {
            case GLOBAL -> {
                if (!isBlank(rule.getMatch())) {
                    errors.add(label + ": match is not valid for GLOBAL scope");
                }
            }
            case ENDPOINT, TIER -> {
                if (isBlank(rule.getMatch())) {
                    errors.add(label + ": match is required for " + scope + " scope");
                }
            }
            case IP -> {
                if (!IpAddresses.isCidrOrLiteral(rule.getMatch())) {
                    errors.add(label + ": match must be an IP address or CIDR block");
                }
            }
            case DYNAMIC -> errors.add(label + ": DYNAMIC rules are generated at runtime and cannot be configured");
        }
    }

    private static void requirePositive(Number value, String field, String label, List<String> errors) {
        if (value != null && !(value.doubleValue() > 0d)) {
            errors.add(label + ": " + field + " must be positive");
        }
    }

    /**
     * bucketSize / rate 가 MAX_WINDOW_SECONDS 이내여야 한다. 잘못된 값은 다른 검사가 보고하므로 건너뛴다.
     */
    private static void requireBoundedCycle(RateLimitRule rule, Double explicitRate, String verb,
                                            String label, List<String> errors) {
        if (rule.getWindowSizeSeconds() <= 0 || rule.getLimit() < 0
                || (rule.getBucketSize() != null && rule.getBucketSize() <= 0)
                || (explicitRate != null && !(explicitRate > 0d))) {
            return;
        }
        double capacity = rule.effectiveBucketSize();
        double rate = explicitRate != null ? explicitRate : (double) rule.getLimit() / rule.getWindowSizeSeconds();
        if (capacity > 0d && rate > 0d && capacity / rate > MAX_WINDOW_SECONDS) {
            errors.add(label + ": bucket takes longer than " + MAX_WINDOW_SECONDS + " seconds to " + verb);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
