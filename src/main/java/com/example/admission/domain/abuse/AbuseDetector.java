package com.example.admission.domain.abuse;

import com.example.admission.domain.model.RateLimitRequest;

/**
 * 오남용 탐지기
 *
 * 구현체는 자체 최근 기록을 갖고 여러 스레드에서 동시에 호출된다.
 */
public interface AbuseDetector {

    String name();

    AbuseDetectionResult analyze(RateLimitRequest request, long nowMillis);

    /**
     * 요청 처리 결과 피드백 (로그인 실패 등). 필요 없는 탐지기는 무시한다.
     */
    default void recordOutcome(RateLimitRequest request, boolean success, long nowMillis) {
    }
}
