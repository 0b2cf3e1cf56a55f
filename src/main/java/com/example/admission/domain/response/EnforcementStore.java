package com.example.admission.domain.response;

import com.example.admission.infrastructure.store.SharedStateClient;

import java.time.Duration;
import java.util.Optional;

/**
 * 대응 조치 마커 (차단 목록, 추가 인증, 임시 제한)
 *
 * 모든 프로세스가 같은 저장소를 보므로 한 프로세스가 차단하면 전체에 적용된다.
 * 마커는 TTL로 자동 해제된다.
 */
public class EnforcementStore {

    private static final String BLOCK_PREFIX = "admission:block:";
    private static final String CHALLENGE_PREFIX = "admission:challenge:";
    private static final String THROTTLE_PREFIX = "admission:throttle:";

    private final SharedStateClient stateClient;

    public EnforcementStore(SharedStateClient stateClient) {
        this.stateClient = stateClient;
    }

    public void block(String subject, Duration duration, String reason) {
        stateClient.put(BLOCK_PREFIX + subject, reason, duration);
    }

    /**
     * 남은 차단 시간. 차단되지 않았으면 empty.
     */
    public Optional<Duration> blockedFor(String subject) {
        return stateClient.remainingTtl(BLOCK_PREFIX + subject);
    }

    public void unblock(String subject) {
        stateClient.delete(BLOCK_PREFIX + subject);
    }

    public void challenge(String subject, Duration duration) {
        stateClient.put(CHALLENGE_PREFIX + subject, "1", duration);
    }

    public boolean isChallenged(String subject) {
        return stateClient.get(CHALLENGE_PREFIX + subject).isPresent();
    }

    public void clearChallenge(String subject) {
        stateClient.delete(CHALLENGE_PREFIX + subject);
    }

    public void throttle(String subject, Duration duration) {
        stateClient.put(THROTTLE_PREFIX + subject, "1", duration);
    }

    public boolean isThrottled(String subject) {
        return stateClient.get(THROTTLE_PREFIX + subject).isPresent();
    }
}
