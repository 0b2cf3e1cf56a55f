package com.example.admission.domain.rule;

import com.example.admission.domain.model.RateLimitRule;
import com.example.admission.domain.model.RuleScope;
import lombok.Getter;

import java.time.Instant;
import java.util.List;

/**
 * 버전이 붙은 불변 규칙 세트. 리로드는 세트 전체를 교체한다.
 */
@Getter
public final class RuleSet {

    private final long version;
    private final List<RateLimitRule> rules;
    private final Instant loadedAt;

    public RuleSet(long version, List<RateLimitRule> rules, Instant loadedAt) {
        this.version = version;
        this.rules = List.copyOf(rules);
        this.loadedAt = loadedAt;
    }

    public static RuleSet empty() {
        return new RuleSet(0, List.of(), Instant.EPOCH);
    }

    public List<RateLimitRule> rulesOf(RuleScope scope) {
        return rules.stream()
                .filter(rule -> (rule.getScope() == null ? RuleScope.GLOBAL : rule.getScope()) == scope)
                .toList();
    }

    public int size() {
        return rules.size();
    }
}
