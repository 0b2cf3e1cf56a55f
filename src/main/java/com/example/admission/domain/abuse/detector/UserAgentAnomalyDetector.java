package com.example.admission.domain.abuse.detector;

import com.example.admission.config.AbuseDetectionProperties;
import com.example.admission.domain.abuse.AbuseDetectionResult;
import com.example.admission.domain.abuse.AbuseDetector;
import com.example.admission.domain.model.RateLimitRequest;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * User-Agent 이상 탐지: 누락, 자동화 도구 시그니처, IP 하나에서의 잦은 교체
 */
public class UserAgentAnomalyDetector implements AbuseDetector {

    public static final String NAME = "user_agent_anomaly";

    private final AbuseDetectionProperties.UserAgent config;
    private final List<String> signatures;
    private final RecentEvents<String> agentsByIp;

    public UserAgentAnomalyDetector(AbuseDetectionProperties.UserAgent config, Duration historyTtl, long maxKeys) {
        this.config = config;
        this.signatures = config.getBotSignatures().stream()
                .map(s -> s.toLowerCase(Locale.ROOT))
                .toList();
        this.agentsByIp = new RecentEvents<>(historyTtl, maxKeys,
                config.getWindowSeconds() * 1000L, config.getRotationThreshold() * 20);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public AbuseDetectionResult analyze(RateLimitRequest request, long nowMillis) {
        if (!config.isEnabled()) {
            return AbuseDetectionResult.clean(NAME);
        }
        Findings findings = new Findings(NAME);
        String userAgent = request.getUserAgent();

        if (!StringUtils.hasText(userAgent)) {
            findings.signal("missing_user_agent", 4.0, 0.6);
        } else {
            String lower = userAgent.toLowerCase(Locale.ROOT);
            signatures.stream()
                    .filter(lower::contains)
                    .findFirst()
                    .ifPresent(signature -> findings.detail("signature", signature)
                            .signal("automation_user_agent", 6.0, 0.8));
        }

        if (request.getIp() != null) {
            String agent = StringUtils.hasText(userAgent) ? userAgent : "";
            int distinct = RecentEvents.distinctValues(agentsByIp.append(request.getIp(), nowMillis, agent)).size();
            findings.detail("distinctUserAgents", distinct);
            if (distinct >= config.getRotationThreshold()) {
                double confidence = Math.min(1.0, 0.5 + distinct / (2.0 * config.getRotationThreshold()));
                findings.signal("user_agent_rotation", 7.0, confidence);
            }
        }
        return findings.toResult();
    }
}
