package com.example.admission.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * 규칙 출처. 선언 순서가 곧 평가 순서다.
 */
public enum RuleScope {
    GLOBAL,
    ENDPOINT,
    TIER,
    IP,
    DYNAMIC;

    @JsonCreator
    public static RuleScope fromValue(String value) {
        if (value == null) {
            return null;
        }
        return RuleScope.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
