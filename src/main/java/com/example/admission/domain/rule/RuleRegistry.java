package com.example.admission.domain.rule;

import com.example.admission.domain.model.RateLimitRule;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 활성 규칙 세트 보관소
 *
 * reload는 검증 후 AtomicReference로 통째로 교체한다. 검증에 실패하면 기존 세트를 유지하고
 * RuleConfigurationException을 던진다. 진행 중인 검사는 시작 시점에 읽은 세트를 끝까지 사용한다.
 */
@Slf4j
public class RuleRegistry {

    private final AtomicReference<RuleSet> active = new AtomicReference<>(RuleSet.empty());
    private final RuleValidator validator;
    private final Clock clock;

    public RuleRegistry(RuleValidator validator, Clock clock) {
        this.validator = validator;
        this.clock = clock;
    }

    public RuleSet current() {
        return active.get();
    }

    public RuleSet reload(List<RateLimitRule> rules) {
        validator.validate(rules);
        RuleSet next = active.updateAndGet(previous ->
                new RuleSet(previous.getVersion() + 1, rules, clock.instant()));
        log.info("Rule set reloaded - version: {}, rules: {}", next.getVersion(), next.size());
        return next;
    }
}
