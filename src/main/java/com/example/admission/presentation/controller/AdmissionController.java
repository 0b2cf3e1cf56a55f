package com.example.admission.presentation.controller;

import com.example.admission.application.metrics.AdmissionMetricsRecorder;
import com.example.admission.application.service.AdmissionService;
import com.example.admission.config.AdmissionProperties;
import com.example.admission.domain.behavior.BehaviorAnalyzer;
import com.example.admission.domain.model.MetricsSnapshot;
import com.example.admission.domain.model.RateLimitRequest;
import com.example.admission.domain.model.RateLimitResult;
import com.example.admission.domain.model.UserBehaviorProfile;
import com.example.admission.domain.rule.RuleRegistry;
import com.example.admission.domain.rule.RuleSet;
import com.example.admission.domain.rule.RuleSetCodec;
import com.example.admission.presentation.dto.AdmissionDto;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * 입장 제어 REST Controller
 *
 * SOLID 원칙:
 * - Single Responsibility: HTTP 요청 처리만 담당
 * - Dependency Inversion: Service 인터페이스에 의존
 *
 * 운영용 엔드포인트다. 다른 트래픽에 대한 판정을 직접 집행하지 않는다.
 */
@Slf4j
@RestController
@RequestMapping("/api/admission")
@RequiredArgsConstructor
public class AdmissionController {

    private static final MediaType YAML = MediaType.parseMediaType("application/yaml");

    private final AdmissionService admissionService;
    private final AdmissionMetricsRecorder metricsRecorder;
    private final RuleRegistry ruleRegistry;
    private final RuleSetCodec ruleSetCodec;
    private final BehaviorAnalyzer behaviorAnalyzer;
    private final AdmissionProperties properties;

    /**
     * 요청 판정. 거부 시 429(DELAY, BLOCK) 또는 403(CHALLENGE)
     */
    @PostMapping("/check")
    public ResponseEntity<AdmissionDto.CheckResponse> check(@RequestBody RateLimitRequest request) {
        RateLimitResult result = admissionService.check(request);
        return withHeaders(ResponseEntity.status(statusOf(result)), result)
                .body(AdmissionDto.CheckResponse.from(result));
    }

    /**
     * 카운터를 소비하지 않는 상태 조회. 다음 요청이 거부될 상황이어도 200으로 응답하고 판정은 본문에 담는다.
     */
    @GetMapping("/status")
    public ResponseEntity<AdmissionDto.CheckResponse> status(@RequestParam(required = false) String userId,
                                                            @RequestParam(required = false) String ip,
                                                            @RequestParam(required = false) String endpoint,
                                                            @RequestParam(required = false) String method,
                                                            @RequestParam(required = false) String tier) {
        RateLimitRequest request = RateLimitRequest.builder()
                .userId(userId)
                .ip(ip)
                .endpoint(endpoint)
                .method(method)
                .tier(tier)
                .build();
        RateLimitResult result = admissionService.status(request);
        return withHeaders(ResponseEntity.ok(), result).body(AdmissionDto.CheckResponse.from(result));
    }

    private static ResponseEntity.BodyBuilder withHeaders(ResponseEntity.BodyBuilder response, RateLimitResult result) {
        if (result.getLimit() >= 0) {
            response.header("X-RateLimit-Limit", String.valueOf(result.getLimit()))
                    .header("X-RateLimit-Remaining", String.valueOf(result.getRemaining()));
        }
        if (result.getRetryAfterSeconds() != null) {
            response.header("Retry-After", String.valueOf(result.getRetryAfterSeconds()));
        }
        return response;
    }

    @PostMapping("/outcome")
    public ResponseEntity<Void> outcome(@Valid @RequestBody AdmissionDto.OutcomeRequest outcome) {
        admissionService.recordOutcome(outcome.getRequest(), outcome.isSuccess());
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/incident")
    public ResponseEntity<Void> incident(@Valid @RequestBody AdmissionDto.IncidentRequest incident) {
        admissionService.recordSecurityIncident(incident.getUserId(), incident.getType());
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/challenge/complete")
    public ResponseEntity<Void> completeChallenge(@RequestBody RateLimitRequest request) {
        admissionService.completeChallenge(request);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/reset")
    public ResponseEntity<AdmissionDto.ResetResponse> reset(@RequestBody RateLimitRequest request) {
        int resetKeys = admissionService.resetLimits(request);
        return ResponseEntity.ok(AdmissionDto.ResetResponse.builder()
                .identity(request.identity())
                .resetKeys(resetKeys)
                .build());
    }

    @GetMapping("/metrics")
    public ResponseEntity<MetricsSnapshot> metrics(@RequestParam(required = false) Integer top) {
        int topN = top == null ? properties.getMetrics().getTopN() : Math.max(1, top);
        return ResponseEntity.ok(metricsRecorder.snapshot(topN));
    }

    @GetMapping("/rules")
    public ResponseEntity<?> rules(@RequestParam(defaultValue = "json") String format) {
        RuleSet ruleSet = ruleRegistry.current();
        if ("yaml".equalsIgnoreCase(format)) {
            return ResponseEntity.ok().contentType(YAML).body(ruleSetCodec.write(ruleSet.getRules()));
        }
        return ResponseEntity.ok(AdmissionDto.RuleSetResponse.from(ruleSet));
    }

    /**
     * 규칙 전체 교체 (YAML 또는 JSON 목록). 검증 실패 시 400, 기존 규칙 유지
     */
    @PutMapping(value = "/rules", consumes = {"application/yaml", "application/x-yaml", MediaType.TEXT_PLAIN_VALUE, MediaType.APPLICATION_JSON_VALUE})
    public ResponseEntity<AdmissionDto.RuleSetResponse> reloadRules(@RequestBody String document) {
        RuleSet ruleSet = ruleRegistry.reload(ruleSetCodec.read(document));
        log.info("Rules replaced via API - version: {}", ruleSet.getVersion());
        return ResponseEntity.ok(AdmissionDto.RuleSetResponse.from(ruleSet));
    }

    @GetMapping("/trust/{userId}")
    public ResponseEntity<AdmissionDto.TrustResponse> trust(@PathVariable String userId) {
        UserBehaviorProfile profile = behaviorAnalyzer.profile(userId);
        return ResponseEntity.ok(AdmissionDto.TrustResponse.builder()
                .userId(userId)
                .trustScore(behaviorAnalyzer.trustScore(userId))
                .profile(profile)
                .build());
    }

    private static HttpStatus statusOf(RateLimitResult result) {
        if (result.isAllowed()) {
            return HttpStatus.OK;
        }
        return switch (result.getDecision()) {
            case CHALLENGE -> HttpStatus.FORBIDDEN;
            default -> HttpStatus.TOO_MANY_REQUESTS;
        };
    }
}
