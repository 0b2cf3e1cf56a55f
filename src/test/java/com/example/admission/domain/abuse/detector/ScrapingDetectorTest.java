package com.example.admission.domain.abuse.detector;

import com.example.admission.config.AbuseDetectionProperties;
import com.example.admission.domain.abuse.AbuseDetectionResult;
import com.example.admission.domain.model.RateLimitRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

/**
 * 스크래핑 탐지 테스트
 */
class ScrapingDetectorTest {

    private static final long T0 = 1_714_564_800_000L;

    private ScrapingDetector detector;

    @BeforeEach
    void setUp() {
        AbuseDetectionProperties.Scraping config = new AbuseDetectionProperties.Scraping();
        config.setDistinctPathThreshold(5);
        detector = new ScrapingDetector(config, Duration.ofMinutes(10), 1_000);
    }

    private static RateLimitRequest read(String path, String method) {
        return RateLimitRequest.builder().ip("192.0.2.10").endpoint(path).method(method).build();
    }

    @Test
    @DisplayName("일정한 간격으로 서로 다른 페이지를 읽으면 기계적 스크래핑")
    void machineRegularReads() {
        AbuseDetectionResult result = null;
        for (int i = 0; i < 5; i++) {
            result = detector.analyze(read("/products/" + i, "GET"), T0 + i * 1_000L);
        }

        assertThat(result.getIndicators()).containsExactly("machine_regular_reads");
        assertThat(result.getRiskScore()).isEqualTo(7.0);
        assertThat(result.getDetails()).containsEntry("intervalVariation", 0.0);
    }

    @Test
    @DisplayName("불규칙한 간격의 대량 조회는 약한 신호")
    void irregularHighVolume() {
        long[] offsets = {0, 10, 5_000, 5_020, 60_000};
        AbuseDetectionResult result = null;
        for (int i = 0; i < offsets.length; i++) {
            result = detector.analyze(read("/products/" + i, "GET"), T0 + offsets[i]);
        }

        assertThat(result.getIndicators()).containsExactly("high_volume_reads");
        assertThat(result.getRiskScore()).isEqualTo(4.0);
        assertThat(result.getDetails()).doesNotContainKey("intervalVariation");
    }

    @Test
    @DisplayName("쓰기 요청은 검사하지 않음")
    void writesIgnored() {
        AbuseDetectionResult result = null;
        for (int i = 0; i < 10; i++) {
            result = detector.analyze(read("/products/" + i, "POST"), T0 + i * 1_000L);
        }

        assertThat(result.getRiskScore()).isZero();
    }
}
