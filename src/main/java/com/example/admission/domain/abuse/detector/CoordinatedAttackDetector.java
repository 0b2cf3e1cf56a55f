package com.example.admission.domain.abuse.detector;

import com.example.admission.config.AbuseDetectionProperties;
import com.example.admission.domain.abuse.AbuseDetectionResult;
import com.example.admission.domain.abuse.AbuseDetector;
import com.example.admission.domain.model.RateLimitRequest;
import com.example.admission.domain.rule.IpAddresses;

import java.time.Duration;

/**
 * 분산 공격 탐지
 *
 * 짧은 시간 동안 한 엔드포인트에 같은 User-Agent를 쓰는 많은 IP, 또는 같은 서브넷의 많은 IP가 몰리는 경우.
 * 엔드포인트 기준으로 집계하므로 식별자 단위 탐지기가 놓치는 분산 트래픽을 잡는다.
 */
public class CoordinatedAttackDetector implements AbuseDetector {

    public static final String NAME = "coordinated_attack";

    private final AbuseDetectionProperties.Coordinated config;
    private final RecentEvents<String> ipsByAgent;
    private final RecentEvents<String> ipsBySubnet;

    public CoordinatedAttackDetector(AbuseDetectionProperties.Coordinated config, Duration historyTtl, long maxKeys) {
        this.config = config;
        long windowMillis = config.getWindowSeconds() * 1000L;
        this.ipsByAgent = new RecentEvents<>(historyTtl, maxKeys, windowMillis, config.getDistinctIpThreshold() * 4);
        this.ipsBySubnet = new RecentEvents<>(historyTtl, maxKeys, windowMillis, config.getSubnetIpThreshold() * 4);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public AbuseDetectionResult analyze(RateLimitRequest request, long nowMillis) {
        if (!config.isEnabled() || request.getIp() == null || request.getEndpoint() == null) {
            return AbuseDetectionResult.clean(NAME);
        }
        String endpoint = request.getEndpoint();
        String agent = request.getUserAgent() == null ? "" : request.getUserAgent();

        int sameAgentIps = RecentEvents.distinctValues(
                ipsByAgent.append(endpoint + "|" + agent.hashCode(), nowMillis, request.getIp())).size();
        int subnetIps = RecentEvents.distinctValues(
                ipsBySubnet.append(endpoint + "|" + IpAddresses.subnetOf(request.getIp()), nowMillis, request.getIp())).size();

        Findings findings = new Findings(NAME)
                .detail("sameAgentIps", sameAgentIps)
                .detail("subnetIps", subnetIps);
        if (sameAgentIps >= config.getDistinctIpThreshold()) {
            findings.signal("distributed_same_agent", 7.0, 0.8);
        }
        if (subnetIps >= config.getSubnetIpThreshold()) {
            findings.signal("subnet_swarm", 6.0, 0.7);
        }
        return findings.toResult();
    }
}
