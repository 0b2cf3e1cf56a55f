package com.example.admission.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * admission.abuse.* 설정 (탐지기별 임계값)
 */
@Data
@Validated
@ConfigurationProperties(prefix = "admission.abuse")
public class AbuseDetectionProperties {

    private boolean enabled = true;

    /** 탐지기 하나의 최대 실행 시간 */
    @NotNull
    private Duration detectorTimeout = Duration.ofMillis(50);

    /** 전체 분석 soft deadline */
    @NotNull
    private Duration analysisDeadline = Duration.ofMillis(200);

    @Min(1)
    private int threads = 4;

    /** 탐지기 기록 보관 (마지막 접근 기준) */
    @NotNull
    private Duration historyTtl = Duration.ofMinutes(10);

    @Min(1)
    private long maxTrackedKeys = 100_000;

    @Valid
    private RateSpike rateSpike = new RateSpike();
    @Valid
    private Geo geo = new Geo();
    @Valid
    private UserAgent userAgent = new UserAgent();
    @Valid
    private Enumeration enumeration = new Enumeration();
    @Valid
    private CredentialStuffing credentialStuffing = new CredentialStuffing();
    @Valid
    private Scraping scraping = new Scraping();
    @Valid
    private Coordinated coordinated = new Coordinated();

    @Data
    public static class RateSpike {
        private boolean enabled = true;
        @Min(1)
        private long windowSeconds = 10;
        /** windowSeconds 안에서 이 횟수에 도달하면 위험도 6 */
        @Min(1)
        private int threshold = 50;
    }

    @Data
    public static class Geo {
        private boolean enabled = true;
        @DecimalMin("1.0")
        private double maxSpeedKmh = 1000;
        /** 좌표 없이 국가만 바뀐 경우 의심 구간 */
        @NotNull
        private Duration countryHopWindow = Duration.ofMinutes(5);
    }

    @Data
    public static class UserAgent {
        private boolean enabled = true;
        private List<String> botSignatures = new ArrayList<>(List.of(
                "curl", "wget", "python-requests", "python-urllib", "scrapy", "httpclient",
                "okhttp", "go-http-client", "java/", "libwww", "bot", "spider", "crawler", "headless"));
        @Min(1)
        private long windowSeconds = 300;
        /** IP 하나에서 관측된 서로 다른 User-Agent 수 */
        @Min(2)
        private int rotationThreshold = 5;
    }

    @Data
    public static class Enumeration {
        private boolean enabled = true;
        @Min(1)
        private long windowSeconds = 60;
        /** 연속 증가(감소)하는 숫자 식별자 접근 횟수 */
        @Min(3)
        private int sequentialThreshold = 10;
        /** IP 하나가 접근한 서로 다른 경로 수 */
        @Min(1)
        private int distinctPathThreshold = 100;
    }

    @Data
    public static class CredentialStuffing {
        private boolean enabled = true;
        private List<String> authEndpoints = new ArrayList<>(List.of(
                "/**/login", "/**/signin", "/**/auth/**", "/**/token", "/**/session"));
        @Min(1)
        private long windowSeconds = 300;
        @Min(1)
        private int distinctAccountThreshold = 10;
        @Min(1)
        private int failedLoginThreshold = 20;
    }

    @Data
    public static class Scraping {
        private boolean enabled = true;
        @Min(1)
        private long windowSeconds = 300;
        @Min(1)
        private int distinctPathThreshold = 50;
        /** 요청 간격 변동계수가 이 값보다 작으면 기계적 타이밍으로 본다 */
        @DecimalMin("0.0")
        private double regularityThreshold = 0.2;
    }

    @Data
    public static class Coordinated {
        private boolean enabled = true;
        @Min(1)
        private long windowSeconds = 60;
        /** 같은 엔드포인트에 같은 User-Agent로 접근한 서로 다른 IP 수 */
        @Min(2)
        private int distinctIpThreshold = 50;
        /** 같은 서브넷에서 같은 엔드포인트에 접근한 서로 다른 IP 수 */
        @Min(2)
        private int subnetIpThreshold = 20;
    }
}
