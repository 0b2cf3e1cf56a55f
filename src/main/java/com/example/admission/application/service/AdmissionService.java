package com.example.admission.application.service;

import com.example.admission.domain.model.RateLimitRequest;
import com.example.admission.domain.model.RateLimitResult;

/**
 * 입장 제어 서비스 인터페이스
 *
 * SOLID 원칙:
 * - Interface Segregation: 판정과 피드백에 필요한 메서드만 정의
 * - Dependency Inversion: 구현이 아닌 추상화에 의존
 */
public interface AdmissionService {

    /**
     * 요청 허용 여부 판정. 저장소 장애 시에는 허용(degraded)으로 응답한다.
     *
     * @param request 요청 식별 정보
     * @return 판정 결과
     */
    RateLimitResult check(RateLimitRequest request);

    /**
     * 현재 한도 상태 조회. check와 같은 판정을 계산하지만 카운터를 소비하지 않고 기록도 남기지 않는다.
     */
    RateLimitResult status(RateLimitRequest request);

    /**
     * 요청 처리 결과 피드백 (성공률, 로그인 실패 집계)
     */
    void recordOutcome(RateLimitRequest request, boolean success);

    /**
     * 보안 사고 기록. 신뢰 점수가 즉시 재계산 대상이 된다.
     */
    void recordSecurityIncident(String userId, String type);

    /**
     * 추가 인증 완료 처리
     */
    void completeChallenge(RateLimitRequest request);

    /**
     * 요청에 적용되는 규칙들의 카운터 상태 초기화. 해당 요청 주체의 차단과 추가 인증 마커도 해제한다.
     *
     * @return 초기화한 키 수
     */
    int resetLimits(RateLimitRequest request);
}
