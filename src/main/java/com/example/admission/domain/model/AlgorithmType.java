package com.example.admission.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;

/**
 * 지원하는 Rate Limiting 알고리즘 (닫힌 집합)
 *
 * 설정 파일에서는 소문자 식별자(sliding_window 등)를 사용한다.
 */
public enum AlgorithmType {
    SLIDING_WINDOW("sliding_window"),
    TOKEN_BUCKET("token_bucket"),
    LEAKY_BUCKET("leaky_bucket"),
    FIXED_WINDOW("fixed_window");

    private final String id;

    AlgorithmType(String id) {
        this.id = id;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    /**
     * 설정 식별자 또는 enum 이름으로 변환. 알 수 없는 값이면 IllegalArgumentException.
     */
    @JsonCreator
    public static AlgorithmType fromId(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Algorithm must not be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        return Arrays.stream(values())
                .filter(type -> type.id.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown algorithm: " + value));
    }
}
