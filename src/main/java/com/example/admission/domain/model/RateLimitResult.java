package com.example.admission.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 입장 판정 결과를 나타내는 불변 Value Object
 *
 * SOLID 원칙:
 * - Single Responsibility: 판정 결과 데이터만 담당
 * - Immutable: 반환 후 변경되지 않음
 *
 * 내부 오류 정보는 절대 담지 않는다. reason은 규칙 이름과 카운터 값만 포함한다.
 */
@Getter
@Builder
@ToString
@EqualsAndHashCode
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RateLimitResult {

    private final boolean allowed;
    private final AdmissionDecision decision;
    private final String reason;
    private final Long retryAfterSeconds;
    private final String rule;
    private final long current;
    private final long limit;
    private final long windowRemainingSeconds;
    private final boolean degraded;

    public long getRemaining() {
        return limit < 0 ? -1 : Math.max(0, limit - current);
    }

    /**
     * 허용 결과 생성 (Factory Method Pattern)
     */
    public static RateLimitResult allowed(String rule, long current, long limit, long windowRemainingSeconds) {
        return RateLimitResult.builder()
                .allowed(true)
                .decision(AdmissionDecision.ALLOW)
                .rule(rule)
                .current(current)
                .limit(limit)
                .windowRemainingSeconds(windowRemainingSeconds)
                .build();
    }

    /**
     * 적용할 규칙이 없을 때의 허용 결과
     */
    public static RateLimitResult unrestricted() {
        return allowed(null, 0, -1, 0);
    }

    /**
     * 저장소 장애로 인한 fail-open 결과
     */
    public static RateLimitResult degraded() {
        return RateLimitResult.builder()
                .allowed(true)
                .decision(AdmissionDecision.ALLOW)
                .current(0)
                .limit(-1)
                .degraded(true)
                .build();
    }

    /**
     * 한도 초과 결과 생성
     */
    public static RateLimitResult delayed(String rule, RuleCheckResult check) {
        long retryAfter = (long) Math.ceil(check.getRetryAfterSeconds() == null ? 0 : check.getRetryAfterSeconds());
        return RateLimitResult.builder()
                .allowed(false)
                .decision(AdmissionDecision.DELAY)
                .reason(String.format("%s exceeded: %d/%d", rule, check.getCurrent(), check.getLimit()))
                .retryAfterSeconds(Math.max(1L, retryAfter))
                .rule(rule)
                .current(check.getCurrent())
                .limit(check.getLimit())
                .windowRemainingSeconds(check.getWindowRemainingSeconds())
                .build();
    }

    public static RateLimitResult blocked(long retryAfterSeconds) {
        return RateLimitResult.builder()
                .allowed(false)
                .decision(AdmissionDecision.BLOCK)
                .reason("blocked")
                .retryAfterSeconds(Math.max(1L, retryAfterSeconds))
                .limit(-1)
                .build();
    }

    public static RateLimitResult challenge() {
        return RateLimitResult.builder()
                .allowed(false)
                .decision(AdmissionDecision.CHALLENGE)
                .reason("verification required")
                .limit(-1)
                .build();
    }
}
