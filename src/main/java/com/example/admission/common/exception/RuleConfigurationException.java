package com.example.admission.common.exception;

import java.util.Collections;
import java.util.List;

/**
 * 규칙 로딩/리로드 시 잘못된 규칙 설정 예외
 *
 * 리로드가 거부되면 기존 규칙 세트가 계속 사용된다.
 */
public class RuleConfigurationException extends RuntimeException {

    private final List<String> errors;

    public RuleConfigurationException(List<String> errors) {
        super("Invalid rule configuration: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public RuleConfigurationException(String message, Throwable cause) {
        super(message, cause);
        this.errors = List.of(message);
    }

    public List<String> getErrors() {
        return Collections.unmodifiableList(errors);
    }
}
