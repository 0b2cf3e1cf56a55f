package com.example.admission.domain.abuse.detector;

import com.example.admission.config.AbuseDetectionProperties;
import com.example.admission.domain.abuse.AbuseDetectionResult;
import com.example.admission.domain.abuse.AbuseDetector;
import com.example.admission.domain.model.RateLimitRequest;

import java.time.Duration;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 열거 공격 탐지
 *
 * 같은 경로 템플릿에서 숫자 식별자를 1씩 증가(감소)시키며 접근하거나,
 * IP 하나가 매우 많은 서로 다른 경로에 접근하는 패턴을 찾는다.
 */
public class EnumerationDetector implements AbuseDetector {

    public static final String NAME = "enumeration";

    private static final Pattern NUMERIC_SEGMENT = Pattern.compile("/(\\d{1,18})(?=/|$)");

    private final AbuseDetectionProperties.Enumeration config;
    private final RecentEvents<Long> identifiers;
    private final RecentEvents<String> pathsByIp;

    public EnumerationDetector(AbuseDetectionProperties.Enumeration config, Duration historyTtl, long maxKeys) {
        this.config = config;
        long windowMillis = config.getWindowSeconds() * 1000L;
        this.identifiers = new RecentEvents<>(historyTtl, maxKeys, windowMillis, config.getSequentialThreshold() * 4);
        this.pathsByIp = new RecentEvents<>(historyTtl, maxKeys, windowMillis, config.getDistinctPathThreshold() * 2);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public AbuseDetectionResult analyze(RateLimitRequest request, long nowMillis) {
        String endpoint = request.getEndpoint();
        if (!config.isEnabled() || endpoint == null) {
            return AbuseDetectionResult.clean(NAME);
        }
        Findings findings = new Findings(NAME);

        Long identifier = lastNumericSegment(endpoint);
        if (identifier != null) {
            String template = request.identity() + "|" + NUMERIC_SEGMENT.matcher(endpoint).replaceAll("/{id}");
            int run = sequentialRun(identifiers.append(template, nowMillis, identifier));
            findings.detail("sequentialRun", run);
            if (run >= config.getSequentialThreshold()) {
                double confidence = run >= config.getSequentialThreshold() * 2 ? 0.95 : 0.8;
                findings.signal("sequential_identifier_access", 8.0, confidence);
            }
        }

        if (request.getIp() != null) {
            int distinct = RecentEvents.distinctValues(pathsByIp.append(request.getIp(), nowMillis, endpoint)).size();
            findings.detail("distinctPaths", distinct);
            if (distinct >= config.getDistinctPathThreshold()) {
                findings.signal("path_enumeration", 6.0, 0.7);
            }
        }
        return findings.toResult();
    }

    static Long lastNumericSegment(String endpoint) {
        Matcher matcher = NUMERIC_SEGMENT.matcher(endpoint);
        String last = null;
        while (matcher.find()) {
            last = matcher.group(1);
        }
        return last == null ? null : Long.valueOf(last);
    }

    /**
     * 가장 최근 값부터 거꾸로 센, 같은 방향으로 1씩 변하는 식별자 개수
     */
    static int sequentialRun(List<RecentEvents.Event<Long>> events) {
        if (events.isEmpty()) {
            return 0;
        }
        int run = 1;
        long direction = 0;
        for (int i = events.size() - 1; i > 0; i--) {
            long step = events.get(i).getValue() - events.get(i - 1).getValue();
            if (Math.abs(step) != 1 || (direction != 0 && step != direction)) {
                break;
            }
            direction = step;
            run++;
        }
        return run;
    }
}
