package com.example.admission.domain.rule;

import com.example.admission.domain.model.RateLimitRule;
import lombok.Value;

/**
 * 요청에 대해 해석된 규칙과 저장소 키
 */
@Value
public class ResolvedRule {
    RateLimitRule rule;
    String storeKey;
}
