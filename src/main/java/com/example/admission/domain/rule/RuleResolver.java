package com.example.admission.domain.rule;

import com.example.admission.domain.model.RateLimitRequest;
import com.example.admission.domain.model.RateLimitRule;
import com.example.admission.domain.model.RuleScope;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.AntPathMatcher;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 요청에 적용할 규칙을 순서대로 모은다.
 *
 * 순서: GLOBAL → ENDPOINT → TIER → IP → DYNAMIC.
 * 같은 저장소 키로 해석되는 규칙은 한 번만 평가한다 (먼저 나온 규칙 우선).
 */
@Slf4j
public class RuleResolver {

    private static final String KEY_PREFIX = "rate_limit:";

    private final RuleRegistry registry;
    private final DynamicRuleSource dynamicRuleSource;
    private final AntPathMatcher pathMatcher = new AntPathMatcher();

    public RuleResolver(RuleRegistry registry, DynamicRuleSource dynamicRuleSource) {
        this.registry = registry;
        this.dynamicRuleSource = dynamicRuleSource;
    }

    public List<ResolvedRule> resolve(RateLimitRequest request) {
        RuleSet ruleSet = registry.current();

        List<RateLimitRule> candidates = new ArrayList<>(ruleSet.rulesOf(RuleScope.GLOBAL));
        ruleSet.rulesOf(RuleScope.ENDPOINT).stream().filter(rule -> matchesEndpoint(rule, request)).forEach(candidates::add);
        ruleSet.rulesOf(RuleScope.TIER).stream().filter(rule -> matchesTier(rule, request)).forEach(candidates::add);
        ruleSet.rulesOf(RuleScope.IP).stream().filter(rule -> IpAddresses.matches(rule.getMatch(), request.getIp())).forEach(candidates::add);
        candidates.addAll(dynamicRuleSource.dynamicRules(request));

        Set<String> seenKeys = new LinkedHashSet<>();
        List<ResolvedRule> resolved = new ArrayList<>(candidates.size());
        for (RateLimitRule rule : candidates) {
            String storeKey = storeKey(rule, request);
            if (seenKeys.add(storeKey)) {
                resolved.add(new ResolvedRule(rule, storeKey));
            } else if (log.isDebugEnabled()) {
                log.debug("Skipping rule {} - key {} already evaluated", rule.getName(), storeKey);
            }
        }
        return resolved;
    }

    public static String storeKey(RateLimitRule rule, RateLimitRequest request) {
        return KEY_PREFIX + rule.getAlgorithm().getId() + ":" + KeyPatternResolver.resolve(rule.getKeyPattern(), request);
    }

    /**
     * 쿼리 문자열 제거
     */
    static String normalizePath(String endpoint) {
        if (endpoint == null) {
            return null;
        }
        int query = endpoint.indexOf('?');
        return query >= 0 ? endpoint.substring(0, query) : endpoint;
    }

    private boolean matchesEndpoint(RateLimitRule rule, RateLimitRequest request) {
        String path = normalizePath(request.getEndpoint());
        if (path == null || !pathMatcher.match(rule.getMatch(), path)) {
            return false;
        }
        List<String> methods = rule.getMethods();
        return methods == null || methods.isEmpty()
                || methods.stream().anyMatch(method -> method.equalsIgnoreCase(request.getMethod()));
    }

    private static boolean matchesTier(RateLimitRule rule, RateLimitRequest request) {
        String tier = request.getTier() == null || request.getTier().isBlank()
                ? KeyPatternResolver.DEFAULT_VALUE
                : request.getTier();
        return rule.getMatch().equalsIgnoreCase(tier);
    }
}
