package com.example.admission.domain.abuse.detector;

import com.example.admission.config.AbuseDetectionProperties;
import com.example.admission.domain.abuse.AbuseDetectionResult;
import com.example.admission.domain.abuse.AbuseDetector;
import com.example.admission.domain.model.RateLimitRequest;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.Value;

import java.time.Duration;

/**
 * 지리적 불가능성 탐지
 *
 * 같은 식별자의 연속된 두 요청 사이 이동 속도가 maxSpeedKmh를 넘으면 불가능한 이동으로 본다.
 * 좌표가 없으면 짧은 시간 안의 국가 변경만 약한 신호로 사용한다.
 */
public class GeoAnomalyDetector implements AbuseDetector {

    public static final String NAME = "geo_anomaly";

    static final double EARTH_RADIUS_KM = 6371.0;
    /** GPS/IP 위치 오차 범위 */
    static final double MIN_DISTANCE_KM = 50.0;

    private final AbuseDetectionProperties.Geo config;
    private final Cache<String, Sighting> lastSightings;

    public GeoAnomalyDetector(AbuseDetectionProperties.Geo config, Duration historyTtl, long maxKeys) {
        this.config = config;
        this.lastSightings = Caffeine.newBuilder()
                .expireAfterAccess(historyTtl)
                .maximumSize(maxKeys)
                .build();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public AbuseDetectionResult analyze(RateLimitRequest request, long nowMillis) {
        if (!config.isEnabled() || (!request.hasLocation() && request.getCountry() == null)) {
            return AbuseDetectionResult.clean(NAME);
        }
        Sighting current = new Sighting(nowMillis, request.getLatitude(), request.getLongitude(), request.getCountry());
        Sighting previous = lastSightings.asMap().put(request.identity(), current);
        if (previous == null) {
            return AbuseDetectionResult.clean(NAME);
        }

        Findings findings = new Findings(NAME);
        long elapsedMillis = Math.max(0, nowMillis - previous.getAt());

        if (current.hasLocation() && previous.hasLocation()) {
            double distanceKm = haversineKm(previous.getLatitude(), previous.getLongitude(),
                    current.getLatitude(), current.getLongitude());
            double elapsedHours = Math.max(elapsedMillis, 1000L) / 3_600_000.0;
            double speedKmh = distanceKm / elapsedHours;
            findings.detail("distanceKm", Math.round(distanceKm))
                    .detail("speedKmh", Math.round(speedKmh));
            if (distanceKm >= MIN_DISTANCE_KM && speedKmh > config.getMaxSpeedKmh()) {
                double confidence = speedKmh > config.getMaxSpeedKmh() * 2 ? 0.9 : 0.7;
                findings.signal("impossible_travel", 8.0, confidence);
            }
        } else if (current.getCountry() != null && previous.getCountry() != null
                && !current.getCountry().equalsIgnoreCase(previous.getCountry())
                && elapsedMillis < config.getCountryHopWindow().toMillis()) {
            findings.detail("fromCountry", previous.getCountry())
                    .detail("toCountry", current.getCountry())
                    .signal("country_hop", 4.0, 0.5);
        }
        return findings.toResult();
    }

    /**
     * 두 좌표 사이 대권 거리 (km)
     */
    static double haversineKm(double lat1, double lon1, double lat2, double lon2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLon = Math.toRadians(lon2 - lon1);
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
                * Math.sin(dLon / 2) * Math.sin(dLon / 2);
        return 2 * EARTH_RADIUS_KM * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
    }

    @Value
    static class Sighting {
        long at;
        Double latitude;
        Double longitude;
        String country;

        boolean hasLocation() {
            return latitude != null && longitude != null;
        }
    }
}
