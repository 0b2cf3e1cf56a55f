package com.example.admission.domain.abuse.detector;

import com.example.admission.config.AbuseDetectionProperties;
import com.example.admission.domain.abuse.AbuseDetectionResult;
import com.example.admission.domain.abuse.AbuseDetector;
import com.example.admission.domain.model.RateLimitRequest;

import java.time.Duration;
import java.util.List;

/**
 * 스크래핑 탐지: 서로 다른 조회 경로를 대량으로, 기계적으로 일정한 간격으로 읽는 패턴
 */
public class ScrapingDetector implements AbuseDetector {

    public static final String NAME = "scraping";

    private final AbuseDetectionProperties.Scraping config;
    private final RecentEvents<String> reads;

    public ScrapingDetector(AbuseDetectionProperties.Scraping config, Duration historyTtl, long maxKeys) {
        this.config = config;
        this.reads = new RecentEvents<>(historyTtl, maxKeys,
                config.getWindowSeconds() * 1000L, config.getDistinctPathThreshold() * 4);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public AbuseDetectionResult analyze(RateLimitRequest request, long nowMillis) {
        if (!config.isEnabled() || request.getEndpoint() == null || !isRead(request.getMethod())) {
            return AbuseDetectionResult.clean(NAME);
        }
        List<RecentEvents.Event<String>> recent = reads.append(request.identity(), nowMillis, request.getEndpoint());
        int distinct = RecentEvents.distinctValues(recent).size();

        Findings findings = new Findings(NAME).detail("distinctPaths", distinct);
        if (distinct >= config.getDistinctPathThreshold()) {
            double variation = RecentEvents.intervalVariation(recent);
            if (!Double.isNaN(variation) && variation < config.getRegularityThreshold()) {
                findings.detail("intervalVariation", variation);
                findings.signal("machine_regular_reads", 7.0, 0.85);
            } else {
                findings.signal("high_volume_reads", 4.0, 0.6);
            }
        }
        return findings.toResult();
    }

    private static boolean isRead(String method) {
        return method == null || "GET".equalsIgnoreCase(method) || "HEAD".equalsIgnoreCase(method);
    }
}
