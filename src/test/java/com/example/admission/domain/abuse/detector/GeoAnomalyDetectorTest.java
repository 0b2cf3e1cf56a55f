package com.example.admission.domain.abuse.detector;

import com.example.admission.config.AbuseDetectionProperties;
import com.example.admission.domain.abuse.AbuseDetectionResult;
import com.example.admission.domain.model.RateLimitRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

/**
 * 지리적 불가능성 탐지 테스트
 */
class GeoAnomalyDetectorTest {

    private static final long T0 = 1_714_564_800_000L;

    private final GeoAnomalyDetector detector =
            new GeoAnomalyDetector(new AbuseDetectionProperties.Geo(), Duration.ofMinutes(10), 1_000);

    private static RateLimitRequest at(double latitude, double longitude) {
        return RateLimitRequest.builder().userId("alice").ip("198.51.100.7")
                .latitude(latitude).longitude(longitude).build();
    }

    private static RateLimitRequest in(String country) {
        return RateLimitRequest.builder().userId("alice").ip("198.51.100.7").country(country).build();
    }

    @Test
    @DisplayName("서울 → 뉴욕 10분: 불가능한 이동")
    void impossibleTravel() {
        // given
        detector.analyze(at(37.5665, 126.9780), T0);

        // when
        AbuseDetectionResult result = detector.analyze(at(40.7128, -74.0060), T0 + Duration.ofMinutes(10).toMillis());

        // then
        assertThat(result.getIndicators()).containsExactly("impossible_travel");
        assertThat(result.getRiskScore()).isEqualTo(8.0);
        assertThat(result.getConfidence()).isEqualTo(0.9);
        assertThat((Long) result.getDetails().get("distanceKm")).isBetween(10_000L, 12_000L);
    }

    @Test
    @DisplayName("서울 → 부산 3시간: 정상 이동")
    void plausibleTravel() {
        detector.analyze(at(37.5665, 126.9780), T0);

        AbuseDetectionResult result = detector.analyze(at(35.1796, 129.0756), T0 + Duration.ofHours(3).toMillis());

        assertThat(result.getRiskScore()).isZero();
        assertThat(result.getIndicators()).isEmpty();
    }

    @Test
    @DisplayName("좌표 없이 짧은 시간 안의 국가 변경은 약한 신호")
    void countryHop() {
        detector.analyze(in("KR"), T0);

        AbuseDetectionResult hop = detector.analyze(in("US"), T0 + 60_000);
        AbuseDetectionResult slowHop = detector.analyze(in("JP"), T0 + 60_000 + Duration.ofHours(1).toMillis());

        assertThat(hop.getIndicators()).containsExactly("country_hop");
        assertThat(hop.getRiskScore()).isEqualTo(4.0);
        assertThat(slowHop.getIndicators()).isEmpty();
    }

    @Test
    @DisplayName("첫 요청과 위치 정보 없는 요청은 깨끗함")
    void firstSightingIsClean() {
        assertThat(detector.analyze(at(0, 0), T0).getRiskScore()).isZero();
        assertThat(detector.analyze(RateLimitRequest.builder().userId("bob").build(), T0).getRiskScore()).isZero();
    }

    @Test
    @DisplayName("하버사인 거리")
    void haversine() {
        assertThat(GeoAnomalyDetector.haversineKm(0, 0, 0, 1)).isCloseTo(111.19, within(0.1));
        assertThat(GeoAnomalyDetector.haversineKm(10, 10, 10, 10)).isZero();
    }
}
