package com.example.admission.application.metrics;

import com.example.admission.domain.behavior.BehaviorAnalyzer;
import com.example.admission.domain.behavior.BehaviorHistoryStore;
import com.example.admission.domain.model.AdmissionDecision;
import com.example.admission.domain.model.MetricsSnapshot;
import com.example.admission.domain.model.MetricsSnapshot.RankedCount;
import com.example.admission.domain.model.RateLimitRequest;
import com.example.admission.domain.model.RateLimitResult;
import com.example.admission.domain.model.Violation;
import com.example.admission.domain.rule.IpAddresses;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 판정 결과 기록
 *
 * - Micrometer 카운터/타이머
 * - 최근 위반 기록 (retention 동안 보관, 감사 로거로도 출력)
 * - 행동 기록 갱신 (요청, 위반) 및 위반 후 프로필 재계산 예약
 */
@Slf4j
public class AdmissionMetricsRecorder {

    private static final Logger AUDIT = LoggerFactory.getLogger("admission.audit");

    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final BehaviorHistoryStore historyStore;
    private final BehaviorAnalyzer behaviorAnalyzer;
    private final Cache<Long, Violation> violations;
    private final AtomicLong violationSequence = new AtomicLong();

    private final Timer checkTimer;
    private final Counter degradedCounter;
    private final LongAdder totalRequests = new LongAdder();
    private final LongAdder allowedRequests = new LongAdder();
    private final LongAdder blockedRequests = new LongAdder();
    private final LongAdder degradedChecks = new LongAdder();
    private final LongAdder checkNanos = new LongAdder();

    public AdmissionMetricsRecorder(MeterRegistry meterRegistry,
                                    Clock clock,
                                    BehaviorHistoryStore historyStore,
                                    BehaviorAnalyzer behaviorAnalyzer,
                                    Duration violationRetention,
                                    long maxViolations) {
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.historyStore = historyStore;
        this.behaviorAnalyzer = behaviorAnalyzer;
        this.violations = Caffeine.newBuilder()
                .expireAfterWrite(violationRetention)
                .maximumSize(maxViolations)
                .ticker(() -> clock.millis() * 1_000_000L)
                .build();
        this.checkTimer = Timer.builder("admission.check.time")
                .description("Time spent evaluating admission checks")
                .register(meterRegistry);
        this.degradedCounter = Counter.builder("admission.degraded")
                .description("Checks answered fail-open because the shared store was unavailable")
                .register(meterRegistry);
    }

    public void recordDecision(RateLimitRequest request, RateLimitResult result, long elapsedNanos) {
        totalRequests.increment();
        checkNanos.add(elapsedNanos);
        checkTimer.record(elapsedNanos, TimeUnit.NANOSECONDS);
        meterRegistry.counter("admission.requests", "outcome", outcome(result)).increment();

        if (result.isAllowed()) {
            allowedRequests.increment();
        } else {
            blockedRequests.increment();
        }
        if (result.isDegraded()) {
            degradedChecks.increment();
            degradedCounter.increment();
        }

        if (request.isAuthenticated()) {
            historyStore.recordRequest(request.getUserId(), request.getEndpoint(), request.getCountry(), request.getDeviceId());
        }
        if (result.getDecision() == AdmissionDecision.DELAY) {
            recordViolation(request, result);
        }
    }

    private void recordViolation(RateLimitRequest request, RateLimitResult result) {
        Violation violation = Violation.of(clock.instant(), request, result);
        violations.put(violationSequence.incrementAndGet(), violation);
        AUDIT.info("violation identity={} ip={} endpoint={} rule={} current={} limit={}",
                request.identity(), IpAddresses.fingerprint(request.getIp()), violation.getEndpoint(),
                violation.getRule(), violation.getCurrent(), violation.getLimit());

        if (request.isAuthenticated()) {
            historyStore.recordViolation(request.getUserId());
            behaviorAnalyzer.invalidate(request.getUserId());
        }
    }

    public List<Violation> recentViolations() {
        return violations.asMap().entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .map(Map.Entry::getValue)
                .toList();
    }

    public MetricsSnapshot snapshot(int topN) {
        long total = totalRequests.sum();
        long blocked = blockedRequests.sum();
        List<Violation> recent = recentViolations();

        return MetricsSnapshot.builder()
                .totalRequests(total)
                .allowedRequests(allowedRequests.sum())
                .blockedRequests(blocked)
                .blockRate(total == 0 ? 0 : (double) blocked / total)
                .averageCheckTimeMs(total == 0 ? 0 : checkNanos.sum() / (double) total / 1_000_000.0)
                .degradedChecks(degradedChecks.sum())
                .topViolatedRules(top(recent, Violation::getRule, topN))
                .topViolatingUsers(top(recent, Violation::getIdentity, topN))
                .build();
    }

    private static List<RankedCount> top(List<Violation> recent, Function<Violation, String> key, int topN) {
        return recent.stream()
                .map(key)
                .filter(Objects::nonNull)
                .collect(Collectors.groupingBy(Function.identity(), Collectors.counting()))
                .entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(topN)
                .map(entry -> new RankedCount(entry.getKey(), entry.getValue()))
                .toList();
    }

    private static String outcome(RateLimitResult result) {
        if (result.isDegraded()) {
            return "degraded";
        }
        return result.getDecision().name().toLowerCase(Locale.ROOT);
    }
}
