package com.example.admission.domain.model;

/**
 * 호출자에게 보이는 최종 결정
 */
public enum AdmissionDecision {
    /** 허용 */
    ALLOW,
    /** 한도 초과, retryAfter 이후 재시도 */
    DELAY,
    /** 추가 인증 필요 */
    CHALLENGE,
    /** 차단 목록에 등록됨 */
    BLOCK
}
