package com.example.admission.domain.abuse;

import com.example.admission.common.exception.DetectorException;
import com.example.admission.domain.model.RateLimitRequest;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 오남용 탐지 엔진
 *
 * 모든 탐지기를 executor에서 병렬 실행한다. 탐지기별 timeout과 전체 deadline이 있으며
 * 실패하거나 시간을 넘긴 탐지기는 위험도 0으로 처리되어 다른 탐지기 결과에 영향을 주지 않는다.
 *
 * timeout이 나면 탐지기 작업을 취소하고 실행 스레드를 interrupt한다.
 * interrupt에 반응하지 않는 탐지기는 끝날 때까지 스레드를 점유한다.
 */
@Slf4j
public class AbuseDetectionEngine {

    private final List<AbuseDetector> detectors;
    private final AbuseActionPolicy policy;
    private final Executor executor;
    private final Clock clock;
    private final Duration detectorTimeout;
    private final Duration analysisDeadline;

    public AbuseDetectionEngine(List<AbuseDetector> detectors,
                                AbuseActionPolicy policy,
                                Executor executor,
                                Clock clock,
                                Duration detectorTimeout,
                                Duration analysisDeadline) {
        this.detectors = List.copyOf(detectors);
        this.policy = policy;
        this.executor = executor;
        this.clock = clock;
        this.detectorTimeout = detectorTimeout;
        this.analysisDeadline = analysisDeadline;
    }

    public AbuseAnalysisResult analyze(RateLimitRequest request) {
        long nowMillis = clock.millis();

        List<CompletableFuture<AbuseDetectionResult>> futures = new ArrayList<>(detectors.size());
        for (AbuseDetector detector : detectors) {
            futures.add(submit(detector, request, nowMillis));
        }

        awaitDeadline(futures);

        List<AbuseDetectionResult> results = new ArrayList<>(detectors.size());
        for (int i = 0; i < futures.size(); i++) {
            String name = detectors.get(i).name();
            results.add(futures.get(i).getNow(AbuseDetectionResult.failed(name, "analysis deadline exceeded")));
        }

        AbuseAnalysisResult analysis = AbuseAnalysisResult.combine(results, policy);
        if (log.isDebugEnabled()) {
            log.debug("Abuse analysis for {}: risk={}, action={}, indicators={}",
                    request.identity(), analysis.getRiskScore(), analysis.getAction(), analysis.getIndicators());
        }
        return analysis;
    }

    /**
     * 처리 결과를 모든 탐지기에 전달한다. 한 탐지기의 실패는 다른 탐지기에 영향을 주지 않는다.
     */
    public void recordOutcome(RateLimitRequest request, boolean success) {
        long nowMillis = clock.millis();
        for (AbuseDetector detector : detectors) {
            try {
                detector.recordOutcome(request, success, nowMillis);
            } catch (RuntimeException e) {
                log.warn("Detector {} failed to record outcome: {}", detector.name(), e.getMessage());
            }
        }
    }

    public List<String> detectorNames() {
        return detectors.stream().map(AbuseDetector::name).toList();
    }

    private CompletableFuture<AbuseDetectionResult> submit(AbuseDetector detector, RateLimitRequest request, long nowMillis) {
        DetectorTask task = new DetectorTask(detector, request, nowMillis);
        try {
            executor.execute(task);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.completedFuture(failure(detector, e));
        }
        return task.result
                .orTimeout(detectorTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((result, ex) -> {
                    if (ex != null) {
                        task.cancel(true);
                    }
                })
                .exceptionally(ex -> failure(detector, ex));
    }

    private void awaitDeadline(List<CompletableFuture<AbuseDetectionResult>> futures) {
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                    .get(analysisDeadline.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Abuse analysis exceeded deadline of {} ms", analysisDeadline.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Abuse analysis interrupted");
        } catch (ExecutionException e) {
            log.warn("Abuse analysis failed: {}", e.getMessage());
        }
    }

    private AbuseDetectionResult failure(AbuseDetector detector, Throwable ex) {
        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
        String error = cause instanceof TimeoutException
                ? "timed out after " + detectorTimeout.toMillis() + " ms"
                : cause.getClass().getSimpleName() + ": " + cause.getMessage();
        DetectorException failure = new DetectorException(detector.name(), error, cause);
        log.warn("Detector {} failed: {}", failure.getDetector(), failure.getMessage());
        return AbuseDetectionResult.failed(detector.name(), error);
    }

    /**
     * 취소 시 실행 중인 스레드를 interrupt할 수 있도록 FutureTask로 감싼 탐지기 실행
     */
    static final class DetectorTask extends FutureTask<AbuseDetectionResult> {

        private final CompletableFuture<AbuseDetectionResult> result = new CompletableFuture<>();

        DetectorTask(AbuseDetector detector, RateLimitRequest request, long nowMillis) {
            super(() -> detector.analyze(request, nowMillis));
        }

        @Override
        protected void done() {
            if (isCancelled()) {
                result.cancel(false);
                return;
            }
            try {
                result.complete(get());
            } catch (ExecutionException e) {
                result.completeExceptionally(e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                result.completeExceptionally(e);
            }
        }
    }
}
