package com.example.admission.domain.rule;

import com.example.admission.common.exception.RuleConfigurationException;
import com.example.admission.domain.model.RateLimitRule;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;

import java.util.List;

/**
 * 규칙 목록 YAML 직렬화/역직렬화
 *
 * YAML은 JSON의 상위 집합이므로 JSON 본문도 그대로 읽을 수 있다.
 */
public class RuleSetCodec {

    private static final TypeReference<List<RateLimitRule>> RULE_LIST = new TypeReference<>() {
    };

    private final ObjectMapper yamlMapper = new ObjectMapper(
            new YAMLFactory().disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER))
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);

    public String write(List<RateLimitRule> rules) {
        try {
            return yamlMapper.writeValueAsString(rules);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize rules", e);
        }
    }

    public String write(RateLimitRule rule) {
        try {
            return yamlMapper.writeValueAsString(rule);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize rule " + rule.getName(), e);
        }
    }

    public List<RateLimitRule> read(String document) {
        if (document == null || document.isBlank()) {
            throw new RuleConfigurationException(List.of("Rule document is empty"));
        }
        try {
            List<RateLimitRule> rules = yamlMapper.readValue(document, RULE_LIST);
            return rules == null ? List.of() : rules;
        } catch (JsonProcessingException e) {
            throw new RuleConfigurationException("Malformed rule document: " + e.getOriginalMessage(), e);
        }
    }

    public RateLimitRule readRule(String document) {
        try {
            return yamlMapper.readValue(document, RateLimitRule.class);
        } catch (JsonProcessingException e) {
            throw new RuleConfigurationException("Malformed rule: " + e.getOriginalMessage(), e);
        }
    }
}
