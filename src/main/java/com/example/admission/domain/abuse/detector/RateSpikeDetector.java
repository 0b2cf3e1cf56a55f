package com.example.admission.domain.abuse.detector;

import com.example.admission.config.AbuseDetectionProperties;
import com.example.admission.domain.abuse.AbuseDetectionResult;
import com.example.admission.domain.abuse.AbuseDetector;
import com.example.admission.domain.model.RateLimitRequest;

import java.time.Duration;

/**
 * 요청 급증 탐지
 *
 * 짧은 윈도우 안의 요청 수가 임계값의 절반을 넘으면 점수를 매기기 시작한다.
 * 임계값에서 6, 1.5배에서 9가 된다.
 */
public class RateSpikeDetector implements AbuseDetector {

    public static final String NAME = "rate_spike";

    private final AbuseDetectionProperties.RateSpike config;
    private final RecentEvents<String> requests;

    public RateSpikeDetector(AbuseDetectionProperties.RateSpike config, Duration historyTtl, long maxKeys) {
        this.config = config;
        this.requests = new RecentEvents<>(historyTtl, maxKeys,
                config.getWindowSeconds() * 1000L, config.getThreshold() * 2);
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
        int count = requests.append(request.identity(), nowMillis, request.getEndpoint()).size();
        double ratio = count / (double) config.getThreshold();

        Findings findings = new Findings(NAME)
                .detail("requests", count)
                .detail("windowSeconds", config.getWindowSeconds());
        if (ratio >= 0.5) {
            findings.signal("request_rate_spike", ratio * 6.0, Math.min(1.0, ratio));
        }
        return findings.toResult();
    }
}
