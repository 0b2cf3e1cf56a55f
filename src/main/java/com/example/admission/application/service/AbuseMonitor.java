package com.example.admission.application.service;

import com.example.admission.domain.abuse.AbuseAction;
import com.example.admission.domain.abuse.AbuseAnalysisResult;
import com.example.admission.domain.abuse.AbuseDetectionEngine;
import com.example.admission.domain.model.RateLimitRequest;
import com.example.admission.domain.response.ResponseManager;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * 판정 이후 비동기 오남용 분석
 *
 * 분석은 별도 executor에서 돌며 이미 반환된 판정에는 영향을 주지 않는다.
 * 대기열이 가득 차면 해당 요청의 분석은 건너뛴다.
 */
@Slf4j
public class AbuseMonitor {

    private final AbuseDetectionEngine engine;
    private final ResponseManager responseManager;
    private final Executor executor;
    private final boolean enabled;

    public AbuseMonitor(AbuseDetectionEngine engine, ResponseManager responseManager, Executor executor, boolean enabled) {
        this.engine = engine;
        this.responseManager = responseManager;
        this.executor = executor;
        this.enabled = enabled;
    }

    public void submit(RateLimitRequest request) {
        if (!enabled) {
            return;
        }
        try {
            executor.execute(() -> analyzeAndRespond(request));
        } catch (RejectedExecutionException e) {
            log.debug("Abuse analysis skipped for {}: queue full", request.identity());
        }
    }

    /**
     * 분석 후 필요한 조치를 실행한다. 실패는 로그로만 남긴다.
     */
    public AbuseAnalysisResult analyzeAndRespond(RateLimitRequest request) {
        try {
            AbuseAnalysisResult analysis = engine.analyze(request);
            if (analysis.getAction() != AbuseAction.ALLOW) {
                responseManager.execute(analysis.getAction(), request, analysis);
            }
            return analysis;
        } catch (RuntimeException e) {
            log.warn("Abuse analysis failed for {}", request.identity(), e);
            return null;
        }
    }

    public void recordOutcome(RateLimitRequest request, boolean success) {
        if (enabled) {
            engine.recordOutcome(request, success);
        }
    }

    public boolean isEnabled() {
        return enabled;
    }
}
