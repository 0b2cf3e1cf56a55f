package com.example.admission.domain.behavior;

import lombok.Value;

import java.time.Instant;
import java.util.Optional;

/**
 * 계정 메타데이터 조회 포트 (계정 생성 시각, 강한 인증 사용 여부)
 *
 * 인증 자체는 이 서비스의 책임이 아니므로 외부 협력자가 구현한다.
 */
public interface IdentityDirectory {

    Optional<IdentityAttributes> lookup(String userId);

    @Value
    class IdentityAttributes {
        Instant createdAt;
        boolean mfaEnabled;
    }
}
