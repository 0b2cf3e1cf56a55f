package com.example.admission.domain.abuse.detector;

import com.example.admission.config.AbuseDetectionProperties;
import com.example.admission.domain.abuse.AbuseDetectionResult;
import com.example.admission.domain.abuse.AbuseDetector;
import com.example.admission.domain.model.RateLimitRequest;
import org.springframework.util.AntPathMatcher;

import java.time.Duration;
import java.util.Locale;
import java.util.Set;

/**
 * 크리덴셜 스터핑 탐지
 *
 * 인증 엔드포인트에서 IP 하나가 여러 계정으로 시도하거나 로그인 실패가 몰리는 경우.
 * 로그인 실패는 recordOutcome 피드백으로만 알 수 있다.
 */
public class CredentialStuffingDetector implements AbuseDetector {

    public static final String NAME = "credential_stuffing";

    private final AbuseDetectionProperties.CredentialStuffing config;
    private final AntPathMatcher pathMatcher = new AntPathMatcher();
    private final RecentEvents<String> accountsByIp;
    private final RecentEvents<Boolean> failuresByIp;

    public CredentialStuffingDetector(AbuseDetectionProperties.CredentialStuffing config, Duration historyTtl, long maxKeys) {
        this.config = config;
        long windowMillis = config.getWindowSeconds() * 1000L;
        this.accountsByIp = new RecentEvents<>(historyTtl, maxKeys, windowMillis, config.getDistinctAccountThreshold() * 10);
        this.failuresByIp = new RecentEvents<>(historyTtl, maxKeys, windowMillis, config.getFailedLoginThreshold() * 2);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public AbuseDetectionResult analyze(RateLimitRequest request, long nowMillis) {
        if (!config.isEnabled() || request.getIp() == null || !isAuthEndpoint(request.getEndpoint())) {
            return AbuseDetectionResult.clean(NAME);
        }
        Findings findings = new Findings(NAME);

        String account = request.isAuthenticated() ? request.getUserId() : null;
        Set<String> accounts = RecentEvents.distinctValues(accountsByIp.append(request.getIp(), nowMillis, account));
        int failures = failuresByIp.recent(request.getIp(), nowMillis).size();
        findings.detail("distinctAccounts", accounts.size())
                .detail("failedLogins", failures);

        if (accounts.size() >= config.getDistinctAccountThreshold()) {
            findings.signal("many_accounts_per_ip", 8.0, 0.85);
        }
        if (failures >= config.getFailedLoginThreshold()) {
            findings.signal("failed_login_burst", 7.0, 0.8);
        }
        if (findings.has("many_accounts_per_ip") && findings.has("failed_login_burst")) {
            findings.escalate(9.5, 0.95);
        }
        return findings.toResult();
    }

    @Override
    public void recordOutcome(RateLimitRequest request, boolean success, long nowMillis) {
        if (!success && request.getIp() != null && isAuthEndpoint(request.getEndpoint())) {
            failuresByIp.append(request.getIp(), nowMillis, Boolean.FALSE);
        }
    }

    boolean isAuthEndpoint(String endpoint) {
        if (endpoint == null) {
            return false;
        }
        String path = endpoint.toLowerCase(Locale.ROOT);
        return config.getAuthEndpoints().stream().anyMatch(pattern -> pathMatcher.match(pattern, path));
    }
}
