package com.example.admission.domain.rule;

import com.example.admission.domain.model.RateLimitRequest;
import com.example.admission.domain.model.RateLimitRule;

import java.util.List;

/**
 * 런타임에 생성되는 규칙 공급원 (예: 어뷰즈 대응으로 걸린 임시 제한)
 */
public interface DynamicRuleSource {

    List<RateLimitRule> dynamicRules(RateLimitRequest request);
}
