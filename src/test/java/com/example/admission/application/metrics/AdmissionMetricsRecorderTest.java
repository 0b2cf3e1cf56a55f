package com.example.admission.application.metrics;

import com.example.admission.domain.behavior.BehaviorAnalyzer;
import com.example.admission.domain.behavior.BehaviorHistoryStore;
import com.example.admission.domain.behavior.BehaviorProfileCalculator;
import com.example.admission.domain.behavior.HistorySnapshot;
import com.example.admission.domain.behavior.InMemoryIdentityDirectory;
import com.example.admission.domain.model.MetricsSnapshot;
import com.example.admission.domain.model.RateLimitRequest;
import com.example.admission.domain.model.RateLimitResult;
import com.example.admission.domain.model.RuleCheckResult;
import com.example.admission.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

/**
 * 판정 지표와 위반 기록 테스트
 */
class AdmissionMetricsRecorderTest {

    private MutableClock clock;
    private SimpleMeterRegistry meterRegistry;
    private BehaviorHistoryStore historyStore;
    private AdmissionMetricsRecorder recorder;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T12:00:00Z"));
        meterRegistry = new SimpleMeterRegistry();
        historyStore = new BehaviorHistoryStore(clock, Duration.ofHours(24), 1_000, 100, 20);
        BehaviorAnalyzer analyzer = new BehaviorAnalyzer(
                new BehaviorProfileCalculator(historyStore, new InMemoryIdentityDirectory(), clock, 0.2),
                clock, Duration.ofMinutes(10), Duration.ofMinutes(1), 1_000, Runnable::run);
        recorder = new AdmissionMetricsRecorder(meterRegistry, clock, historyStore, analyzer, Duration.ofHours(1), 1_000);
    }

    private static RateLimitRequest request(String userId) {
        return RateLimitRequest.builder().userId(userId).ip("198.51.100.7").endpoint("/api/orders").build();
    }

    private static RateLimitResult delayed(String rule) {
        return RateLimitResult.delayed(rule, RuleCheckResult.rejected(10, 10, 30, 30.0));
    }

    @Test
    @DisplayName("허용/거부/장애 판정 집계와 평균 처리 시간")
    void countsDecisions() {
        // when
        recorder.recordDecision(request("alice"), RateLimitResult.allowed("global", 1, 10, 60), TimeUnit.MILLISECONDS.toNanos(2));
        recorder.recordDecision(request("alice"), delayed("global"), TimeUnit.MILLISECONDS.toNanos(4));
        recorder.recordDecision(request("bob"), RateLimitResult.degraded(), TimeUnit.MILLISECONDS.toNanos(6));
        recorder.recordDecision(request("bob"), RateLimitResult.blocked(30), TimeUnit.MILLISECONDS.toNanos(8));

        // then
        MetricsSnapshot snapshot = recorder.snapshot(10);
        assertThat(snapshot.getTotalRequests()).isEqualTo(4);
        assertThat(snapshot.getAllowedRequests()).isEqualTo(2);
        assertThat(snapshot.getBlockedRequests()).isEqualTo(2);
        assertThat(snapshot.getBlockRate()).isEqualTo(0.5);
        assertThat(snapshot.getDegradedChecks()).isEqualTo(1);
        assertThat(snapshot.getAverageCheckTimeMs()).isCloseTo(5.0, within(1e-9));

        assertThat(meterRegistry.counter("admission.requests", "outcome", "delay").count()).isEqualTo(1.0);
        assertThat(meterRegistry.counter("admission.requests", "outcome", "degraded").count()).isEqualTo(1.0);
        assertThat(meterRegistry.counter("admission.degraded").count()).isEqualTo(1.0);
        assertThat(meterRegistry.timer("admission.check.time").count()).isEqualTo(4);
    }

    @Test
    @DisplayName("DELAY만 위반으로 기록하고 상위 규칙/사용자 순위 계산")
    void ranksViolations() {
        // given
        recorder.recordDecision(request("alice"), delayed("global"), 1_000);
        recorder.recordDecision(request("alice"), delayed("login"), 1_000);
        recorder.recordDecision(request("bob"), delayed("global"), 1_000);
        recorder.recordDecision(request("bob"), RateLimitResult.blocked(10), 1_000);

        // when
        MetricsSnapshot snapshot = recorder.snapshot(1);

        // then
        assertThat(recorder.recentViolations()).hasSize(3);
        assertThat(snapshot.getTopViolatedRules()).singleElement()
                .satisfies(top -> {
                    assertThat(top.getKey()).isEqualTo("global");
                    assertThat(top.getCount()).isEqualTo(2);
                });
        assertThat(snapshot.getTopViolatingUsers()).singleElement()
                .satisfies(top -> assertThat(top.getKey()).isEqualTo("user:alice"));
    }

    @Test
    @DisplayName("위반 기록은 보관 기간이 지나면 사라짐")
    void violationsExpire() {
        recorder.recordDecision(request("alice"), delayed("global"), 1_000);

        clock.advance(Duration.ofHours(1).plusSeconds(1));

        assertThat(recorder.recentViolations()).isEmpty();
    }

    @Test
    @DisplayName("인증된 요청은 행동 기록 갱신, 익명 요청은 제외")
    void updatesBehaviorHistory() {
        // when
        recorder.recordDecision(request("carol"), RateLimitResult.allowed("global", 1, 10, 60), 1_000);
        recorder.recordDecision(request("carol"), delayed("global"), 1_000);
        recorder.recordDecision(RateLimitRequest.builder().ip("198.51.100.8").build(), delayed("global"), 1_000);

        // then
        HistorySnapshot history = historyStore.snapshot("carol").orElseThrow();
        assertThat(history.getRequests()).isEqualTo(2);
        assertThat(history.getViolations()).isEqualTo(1);
        assertThat(historyStore.snapshot("anonymous")).isEmpty();
    }
}
