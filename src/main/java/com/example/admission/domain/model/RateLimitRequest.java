package com.example.admission.domain.model;

import com.example.admission.domain.rule.IpAddresses;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 인바운드 요청 식별 정보 (읽기 전용 입력, 그대로 저장되지 않음)
 *
 * 위치(country, latitude, longitude)와 deviceId는 상위 게이트웨이가 채워주는 선택 값이다.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class RateLimitRequest {

    public static final String ANONYMOUS = "anonymous";

    String userId;
    String ip;
    String endpoint;
    String method;
    String userAgent;
    String tier;
    String deviceId;
    String country;
    Double latitude;
    Double longitude;

    public boolean isAuthenticated() {
        return userId != null && !userId.isBlank();
    }

    /**
     * 사용자 식별자, 없으면 IP 지문 기반 식별자. 저장소 키와 로그에 원본 IP가 남지 않는다.
     */
    public String identity() {
        return isAuthenticated() ? "user:" + userId : "ip:" + IpAddresses.fingerprint(ip);
    }

    public boolean hasLocation() {
        return latitude != null && longitude != null;
    }
}
