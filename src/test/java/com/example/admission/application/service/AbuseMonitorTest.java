package com.example.admission.application.service;

import com.example.admission.config.AbuseDetectionProperties;
import com.example.admission.config.AdmissionProperties;
import com.example.admission.domain.abuse.AbuseAction;
import com.example.admission.domain.abuse.AbuseActionPolicy;
import com.example.admission.domain.abuse.AbuseAnalysisResult;
import com.example.admission.domain.abuse.AbuseDetectionEngine;
import com.example.admission.domain.abuse.detector.CredentialStuffingDetector;
import com.example.admission.domain.model.RateLimitRequest;
import com.example.admission.domain.response.EnforcementStore;
import com.example.admission.domain.response.ResponseManager;
import com.example.admission.domain.rule.IpAddresses;
import com.example.admission.infrastructure.store.InMemorySharedStateClient;
import com.example.admission.infrastructure.store.StateCodec;
import com.example.admission.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.*;

/**
 * 비동기 오남용 분석 → 대응 조치 연결 테스트
 */
class AbuseMonitorTest {

    private static final String ATTACKER_IP = "203.0.113.66";

    private MutableClock clock;
    private EnforcementStore enforcementStore;
    private AbuseDetectionEngine engine;
    private ResponseManager responseManager;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T12:00:00Z"));
        enforcementStore = new EnforcementStore(new InMemorySharedStateClient(new StateCodec(), clock));
        CredentialStuffingDetector detector = new CredentialStuffingDetector(
                new AbuseDetectionProperties.CredentialStuffing(), Duration.ofMinutes(10), 1_000);
        engine = new AbuseDetectionEngine(List.of(detector), new AbuseActionPolicy(), Runnable::run, clock,
                Duration.ofMillis(50), Duration.ofMillis(200));
        responseManager = new ResponseManager(enforcementStore, new AdmissionProperties.Enforcement(),
                new SimpleMeterRegistry());
    }

    private static RateLimitRequest login(String account) {
        return RateLimitRequest.builder().userId(account).ip(ATTACKER_IP)
                .endpoint("/api/auth/login").method("POST").build();
    }

    @Test
    @DisplayName("크리덴셜 스터핑이 확인되면 공격 IP 차단")
    void credentialStuffingLeadsToBlock() {
        // given
        AbuseMonitor monitor = new AbuseMonitor(engine, responseManager, Runnable::run, true);
        for (int i = 0; i < 20; i++) {
            monitor.recordOutcome(login("victim" + i), false);
        }

        // when
        AbuseAnalysisResult last = null;
        for (int i = 0; i < 10; i++) {
            last = monitor.analyzeAndRespond(login("victim" + i));
        }

        // then
        assertThat(last.getAction()).isEqualTo(AbuseAction.BLOCK);
        assertThat(enforcementStore.blockedFor("ip:" + IpAddresses.fingerprint(ATTACKER_IP))).isPresent();
        assertThat(enforcementStore.blockedFor("user:victim9")).isPresent();
    }

    @Test
    @DisplayName("정상 트래픽은 조치 없음")
    void cleanTrafficAllowed() {
        AbuseMonitor monitor = new AbuseMonitor(engine, responseManager, Runnable::run, true);

        AbuseAnalysisResult analysis = monitor.analyzeAndRespond(login("alice"));

        assertThat(analysis.getAction()).isEqualTo(AbuseAction.ALLOW);
        assertThat(enforcementStore.blockedFor("ip:" + IpAddresses.fingerprint(ATTACKER_IP))).isEmpty();
    }

    @Test
    @DisplayName("대기열이 가득 차면 분석을 건너뛰고 예외를 전파하지 않음")
    void rejectedSubmissionIsSwallowedWithLog() {
        AbuseMonitor monitor = new AbuseMonitor(engine, responseManager, task -> {
            throw new RejectedExecutionException("queue full");
        }, true);

        assertThatNoException().isThrownBy(() -> monitor.submit(login("alice")));
    }

    @Test
    @DisplayName("비활성화되면 제출과 피드백 모두 무시")
    void disabledMonitor() {
        AbuseMonitor monitor = new AbuseMonitor(engine, responseManager, task -> {
            throw new AssertionError("must not be scheduled");
        }, false);

        monitor.submit(login("alice"));
        monitor.recordOutcome(login("alice"), false);

        assertThat(monitor.isEnabled()).isFalse();
    }
}
