package com.example.admission.domain.response;

import com.example.admission.common.exception.ActionExecutionException;
import com.example.admission.config.AdmissionProperties;
import com.example.admission.domain.abuse.AbuseAction;
import com.example.admission.domain.abuse.AbuseAnalysisResult;
import com.example.admission.domain.model.RateLimitRequest;
import com.example.admission.domain.rule.IpAddresses;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 오남용 대응 조치 실행
 *
 * BLOCK은 식별자와 IP를 차단 목록에 올리고, CHALLENGE는 추가 인증 마커를,
 * RATE_LIMIT은 더 엄격한 동적 규칙을 켜는 마커를 남긴다. 모두 TTL이 지나면 풀린다.
 * 실행 실패는 로그와 메트릭으로만 남고 호출자에게 전파되지 않는다.
 */
@Slf4j
public class ResponseManager {

    private static final Logger AUDIT = LoggerFactory.getLogger("admission.audit");

    private final EnforcementStore enforcementStore;
    private final AdmissionProperties.Enforcement config;
    private final MeterRegistry meterRegistry;

    public ResponseManager(EnforcementStore enforcementStore,
                           AdmissionProperties.Enforcement config,
                           MeterRegistry meterRegistry) {
        this.enforcementStore = enforcementStore;
        this.config = config;
        this.meterRegistry = meterRegistry;
    }

    /**
     * @return 조치가 적용되었으면 true
     */
    public boolean execute(AbuseAction action, RateLimitRequest request, AbuseAnalysisResult analysis) {
        meterRegistry.counter("admission.abuse.actions", "action", action.name()).increment();
        try {
            apply(action, request, analysis);
            return true;
        } catch (RuntimeException e) {
            ActionExecutionException failure = new ActionExecutionException(action,
                    "Failed to apply " + action + " to " + request.identity(), e);
            log.error(failure.getMessage(), failure);
            meterRegistry.counter("admission.action.failures", "action", action.name()).increment();
            return false;
        }
    }

    private void apply(AbuseAction action, RateLimitRequest request, AbuseAnalysisResult analysis) {
        String identity = request.identity();
        switch (action) {
            case BLOCK -> {
                String reason = String.join(",", analysis.getIndicators());
                for (String subject : blockSubjects(request)) {
                    enforcementStore.block(subject, config.getBlockDuration(), reason);
                }
                AUDIT.warn("action=BLOCK identity={} ip={} risk={} indicators={} duration={}",
                        identity, IpAddresses.fingerprint(request.getIp()), analysis.getRiskScore(), analysis.getIndicators(),
                        config.getBlockDuration());
            }
            case CHALLENGE -> {
                enforcementStore.challenge(identity, config.getChallengeDuration());
                AUDIT.info("action=CHALLENGE identity={} risk={} indicators={}",
                        identity, analysis.getRiskScore(), analysis.getIndicators());
            }
            case RATE_LIMIT -> {
                enforcementStore.throttle(identity, config.getThrottleDuration());
                AUDIT.info("action=RATE_LIMIT identity={} risk={} indicators={}",
                        identity, analysis.getRiskScore(), analysis.getIndicators());
            }
            case MONITOR -> log.info("Monitoring {}: risk={}, indicators={}",
                    identity, analysis.getRiskScore(), analysis.getIndicators());
            case ALLOW -> {
            }
        }
    }

    /**
     * 차단 대상: 식별자, 그리고 IP 지문 (익명 요청이면 둘이 같다)
     */
    public static Set<String> blockSubjects(RateLimitRequest request) {
        Set<String> subjects = new LinkedHashSet<>();
        subjects.add(request.identity());
        if (request.getIp() != null && !request.getIp().isBlank()) {
            subjects.add("ip:" + IpAddresses.fingerprint(request.getIp()));
        }
        return subjects;
    }
}
