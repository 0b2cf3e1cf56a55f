package com.example.admission.domain.abuse.detector;

import com.example.admission.config.AbuseDetectionProperties;
import com.example.admission.domain.abuse.AbuseDetectionResult;
import com.example.admission.domain.model.RateLimitRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

/**
 * 요청 급증 탐지 테스트
 */
class RateSpikeDetectorTest {

    private static final long T0 = 1_714_564_800_000L;
    private static final RateLimitRequest REQUEST = RateLimitRequest.builder()
            .userId("alice").endpoint("/api/search").build();

    private RateSpikeDetector detector(int threshold) {
        AbuseDetectionProperties.RateSpike config = new AbuseDetectionProperties.RateSpike();
        config.setThreshold(threshold);
        return new RateSpikeDetector(config, Duration.ofMinutes(10), 1_000);
    }

    @Test
    @DisplayName("임계값의 절반 미만은 깨끗함, 절반부터 점수, 임계값에서 6점")
    void scoresByRatio() {
        // given
        RateSpikeDetector detector = detector(10);
        AbuseDetectionResult result = null;

        // when & then
        for (int i = 0; i < 4; i++) {
            result = detector.analyze(REQUEST, T0 + i * 10L);
        }
        assertThat(result.getRiskScore()).isZero();

        result = detector.analyze(REQUEST, T0 + 50);
        assertThat(result.getRiskScore()).isCloseTo(3.0, within(1e-9));

        for (int i = 6; i <= 10; i++) {
            result = detector.analyze(REQUEST, T0 + i * 10L);
        }
        assertThat(result.getIndicators()).containsExactly("request_rate_spike");
        assertThat(result.getRiskScore()).isCloseTo(6.0, within(1e-9));
        assertThat(result.getConfidence()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("윈도우가 지나면 다시 0부터")
    void windowExpires() {
        RateSpikeDetector detector = detector(4);
        for (int i = 0; i < 4; i++) {
            detector.analyze(REQUEST, T0 + i);
        }

        AbuseDetectionResult later = detector.analyze(REQUEST, T0 + Duration.ofSeconds(11).toMillis());

        assertThat(later.getRiskScore()).isZero();
        assertThat(later.getDetails()).containsEntry("requests", 1);
    }
}
