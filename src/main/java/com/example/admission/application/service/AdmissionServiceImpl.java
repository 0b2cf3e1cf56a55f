package com.example.admission.application.service;

import com.example.admission.application.metrics.AdmissionMetricsRecorder;
import com.example.admission.common.exception.InvalidRequestException;
import com.example.admission.common.exception.StoreUnavailableException;
import com.example.admission.domain.adaptive.AdaptiveLimitAdjuster;
import com.example.admission.domain.behavior.BehaviorAnalyzer;
import com.example.admission.domain.behavior.BehaviorHistoryStore;
import com.example.admission.domain.factory.RateLimitStrategyFactory;
import com.example.admission.domain.model.RateLimitRequest;
import com.example.admission.domain.model.RateLimitResult;
import com.example.admission.domain.model.RateLimitRule;
import com.example.admission.domain.model.RuleCheckResult;
import com.example.admission.domain.model.UserBehaviorProfile;
import com.example.admission.domain.response.EnforcementStore;
import com.example.admission.domain.response.ResponseManager;
import com.example.admission.domain.rule.IpAddresses;
import com.example.admission.domain.rule.ResolvedRule;
import com.example.admission.domain.rule.RuleResolver;
import com.example.admission.domain.strategy.RateLimitStrategy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 입장 제어 서비스 구현체
 *
 * SOLID 원칙:
 * - Single Responsibility: 판정 흐름 조율만 담당 (알고리즘은 Strategy, 규칙은 Resolver)
 * - Dependency Inversion: Strategy 인터페이스와 SharedStateClient 추상화에 의존
 *
 * 판정 순서:
 * 1. 요청 검증 (실패 시 카운터를 건드리지 않음)
 * 2. 차단 / 추가 인증 마커 확인
 * 3. 규칙 해석, 적응형 한도 적용, 순서대로 평가 (첫 거부에서 중단)
 * 4. 저장소 장애 시 fail-open
 * 5. 기록 후 비동기 오남용 분석 제출
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AdmissionServiceImpl implements AdmissionService {

    private static final Logger AUDIT = LoggerFactory.getLogger("admission.audit");

    private final Clock clock;
    private final RuleResolver ruleResolver;
    private final RateLimitStrategyFactory strategyFactory;
    private final AdaptiveLimitAdjuster limitAdjuster;
    private final BehaviorAnalyzer behaviorAnalyzer;
    private final BehaviorHistoryStore historyStore;
    private final EnforcementStore enforcementStore;
    private final AdmissionMetricsRecorder metricsRecorder;
    private final AbuseMonitor abuseMonitor;

    @Override
    public RateLimitResult check(RateLimitRequest request) {
        validate(request);
        long started = System.nanoTime();
        long nowMillis = clock.millis();

        RateLimitResult result;
        try {
            result = evaluate(request, nowMillis, true);
        } catch (StoreUnavailableException e) {
            // Fail-open: 저장소 장애 시 요청 허용 (서비스 가용성 우선)
            log.warn("Shared store unavailable, admitting {} in degraded mode: {}", request.identity(), e.getMessage());
            result = RateLimitResult.degraded();
        }

        if (log.isDebugEnabled()) {
            log.debug("Admission check - Identity: {}, Endpoint: {}, Decision: {}, Rule: {}",
                    request.identity(), request.getEndpoint(), result.getDecision(), result.getRule());
        }

        metricsRecorder.recordDecision(request, result, System.nanoTime() - started);
        abuseMonitor.submit(request);
        return result;
    }

    @Override
    public RateLimitResult status(RateLimitRequest request) {
        validate(request);
        try {
            return evaluate(request, clock.millis(), false);
        } catch (StoreUnavailableException e) {
            log.warn("Shared store unavailable, reporting degraded status for {}: {}", request.identity(), e.getMessage());
            return RateLimitResult.degraded();
        }
    }

    /**
     * consume이 false면 카운터를 소비하지 않고 다음 요청에 대한 판정만 계산한다.
     */
    private RateLimitResult evaluate(RateLimitRequest request, long nowMillis, boolean consume) {
        Optional<Duration> blocked = blockedFor(request);
        if (blocked.isPresent()) {
            return RateLimitResult.blocked((long) Math.ceil(blocked.get().toMillis() / 1000d));
        }
        if (enforcementStore.isChallenged(request.identity())) {
            return RateLimitResult.challenge();
        }

        List<ResolvedRule> rules = ruleResolver.resolve(request);
        if (rules.isEmpty()) {
            return RateLimitResult.unrestricted();
        }

        UserBehaviorProfile profile = request.isAuthenticated()
                ? behaviorAnalyzer.profile(request.getUserId())
                : UserBehaviorProfile.neutral(null);
        Instant now = Instant.ofEpochMilli(nowMillis);

        RateLimitResult firstAllowed = null;
        for (ResolvedRule resolved : rules) {
            RateLimitRule rule = limitAdjuster.adjust(resolved.getRule(), profile, request.getEndpoint(), now);
            RateLimitStrategy strategy = strategyFactory.getStrategy(rule.getAlgorithm());
            RuleCheckResult check = consume
                    ? strategy.check(resolved.getStoreKey(), rule, nowMillis)
                    : strategy.peek(resolved.getStoreKey(), rule, nowMillis);

            if (!check.isAllowed()) {
                return RateLimitResult.delayed(rule.getName(), check);
            }
            if (firstAllowed == null) {
                firstAllowed = RateLimitResult.allowed(rule.getName(), check.getCurrent(), check.getLimit(),
                        check.getWindowRemainingSeconds());
            }
        }
        return firstAllowed;
    }

    private Optional<Duration> blockedFor(RateLimitRequest request) {
        for (String subject : ResponseManager.blockSubjects(request)) {
            Optional<Duration> remaining = enforcementStore.blockedFor(subject);
            if (remaining.isPresent()) {
                return remaining;
            }
        }
        return Optional.empty();
    }

    @Override
    public void recordOutcome(RateLimitRequest request, boolean success) {
        validate(request);
        if (request.isAuthenticated()) {
            historyStore.recordOutcome(request.getUserId(), success);
        }
        abuseMonitor.recordOutcome(request, success);
    }

    @Override
    public void recordSecurityIncident(String userId, String type) {
        if (!StringUtils.hasText(userId)) {
            throw new InvalidRequestException("userId is required");
        }
        historyStore.recordSecurityIncident(userId);
        behaviorAnalyzer.invalidate(userId);
        AUDIT.warn("security_incident user={} type={}", userId, type);
    }

    @Override
    public void completeChallenge(RateLimitRequest request) {
        validate(request);
        enforcementStore.clearChallenge(request.identity());
        log.info("Challenge completed - Identity: {}", request.identity());
    }

    @Override
    public int resetLimits(RateLimitRequest request) {
        validate(request);
        List<ResolvedRule> rules = ruleResolver.resolve(request);
        for (ResolvedRule resolved : rules) {
            strategyFactory.getStrategy(resolved.getRule().getAlgorithm()).reset(resolved.getStoreKey());
        }
        // 운영자 초기화는 차단과 추가 인증 마커도 함께 해제한다
        for (String subject : ResponseManager.blockSubjects(request)) {
            enforcementStore.unblock(subject);
        }
        enforcementStore.clearChallenge(request.identity());
        log.info("Rate limit reset - Identity: {}, Keys: {}", request.identity(), rules.size());
        return rules.size();
    }

    static void validate(RateLimitRequest request) {
        if (request == null) {
            throw new InvalidRequestException("request is required");
        }
        if (!request.isAuthenticated() && !StringUtils.hasText(request.getIp())) {
            throw new InvalidRequestException("userId or ip is required");
        }
        if (StringUtils.hasText(request.getIp()) && !IpAddresses.isLiteral(request.getIp())) {
            throw new InvalidRequestException("ip is not a valid address: " + request.getIp());
        }
        if ((request.getLatitude() == null) != (request.getLongitude() == null)) {
            throw new InvalidRequestException("latitude and longitude must be given together");
        }
        if (request.hasLocation()
                && (Math.abs(request.getLatitude()) > 90 || Math.abs(request.getLongitude()) > 180)) {
            throw new InvalidRequestException("location out of range");
        }
    }
}
