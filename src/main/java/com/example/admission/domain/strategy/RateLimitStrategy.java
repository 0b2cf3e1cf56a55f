package com.example.admission.domain.strategy;

import com.example.admission.domain.model.AlgorithmType;
import com.example.admission.domain.model.RateLimitRule;
import com.example.admission.domain.model.RuleCheckResult;

/**
 * Rate Limiting 전략을 정의하는 인터페이스
 *
 * SOLID 원칙:
 * - Interface Segregation: 클라이언트가 필요한 메서드만 정의
 * - Dependency Inversion: 구체적인 구현이 아닌 추상화에 의존
 * - Strategy Pattern: 알고리즘을 캡슐화하고 상호 교환 가능하게 만듦
 *
 * 규칙 파라미터는 호출마다 전달된다. 적응형 배수가 적용된 규칙이 그대로 들어오기 때문이다.
 */
public interface RateLimitStrategy {

    /**
     * 요청 허용 여부를 판단 (저장소에 대한 단일 원자적 트랜잭션)
     *
     * @param key 해석된 저장소 키
     * @param rule 유효 규칙
     * @param nowMillis 호출자 시각
     * @return 규칙 평가 결과
     */
    RuleCheckResult check(String key, RateLimitRule rule, long nowMillis);

    /**
     * 다음 요청이 허용될지 조회만 한다. 상태는 바꾸지 않는다.
     * 허용이면 current는 소비 전 사용량이다.
     */
    RuleCheckResult peek(String key, RateLimitRule rule, long nowMillis);

    /**
     * 특정 키의 상태 초기화
     *
     * @param key 해석된 저장소 키
     */
    void reset(String key);

    AlgorithmType getAlgorithmType();
}
