package com.yunhwan.error.advice.usecase.analysis;

import com.yunhwan.error.advice.common.exception.CircuitOpenException;
import com.yunhwan.error.advice.common.exception.RetryExhaustedException;
import com.yunhwan.error.advice.domain.advice.Advice;
import com.yunhwan.error.advice.domain.analysis.AnalysisRequest;
import com.yunhwan.error.advice.domain.error.CapturedError;
import com.yunhwan.error.advice.domain.error.ErrorFingerprint;
import com.yunhwan.error.advice.domain.error.ErrorFingerprinter;
import com.yunhwan.error.advice.infra.logging.AnalysisEventLogger;
import com.yunhwan.error.advice.infra.metrics.AdvicePipelineMetrics;
import com.yunhwan.error.advice.usecase.analysis.cache.AdviceCache;
import com.yunhwan.error.advice.usecase.analysis.dedup.RecentFingerprintWindow;
import com.yunhwan.error.advice.usecase.analysis.dto.ScheduleResult;
import com.yunhwan.error.advice.usecase.analysis.dto.ScheduleStatus;
import com.yunhwan.error.advice.usecase.analysis.port.AdviceAnalyzer;
import com.yunhwan.error.advice.usecase.analysis.queue.AdmissionResult;
import com.yunhwan.error.advice.usecase.analysis.queue.AnalysisQueue;
import com.yunhwan.error.advice.usecase.analysis.queue.QueueSnapshot;
import com.yunhwan.error.advice.usecase.analysis.retry.RetryPolicy;
import com.yunhwan.error.advice.usecase.analysis.retry.RetryingCallExecutor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.Set;

import static com.yunhwan.error.advice.infra.metrics.MetricsConfig.*;

/**
 * 에러 -> advice 파이프라인 진입점.
 * <p>
 * fingerprint -> cache -> dedup -> queue -> (worker) breaker + retry -> cache 순으로 흐른다.
 * scheduleAnalysis는 fire-and-forget이며 어떤 경우에도 호출자에게 예외를 던지지 않는다.
 */
@Slf4j
@RequiredArgsConstructor
public class AnalysisScheduler {

    private static final String PIPELINE_EXCEPTION_PACKAGE = "com.yunhwan.error.advice.common.exception.";

    // 분석 호출 경로에서 나는 에러를 다시 분석하면 루프가 생긴다
    private static final Set<String> SELF_INFLICTED = Set.of(
            "FingerprintException",
            "QueueOverflowException",
            "CircuitOpenException",
            "RetryExhaustedException",
            "CacheWriteException",
            "RetryableAnalysisException",
            "NonRetryableAnalysisException",
            "AnalysisTimeoutException",
            "RestClientException",
            "RestClientResponseException",
            "ResourceAccessException",
            "HttpClientErrorException",
            "HttpServerErrorException",
            "UnknownHttpStatusCodeException"
    );

    private final ErrorFingerprinter fingerprinter;
    private final AdviceCache adviceCache;
    private final RecentFingerprintWindow recentFingerprints;
    private final AnalysisQueue analysisQueue;
    private final RetryingCallExecutor retryingCallExecutor;
    private final RetryPolicy retryPolicy;
    private final AdviceAnalyzer analyzer;
    private final AnalysisEventLogger eventLogger;
    private final AdvicePipelineMetrics metrics;
    private final Clock clock;

    public ScheduleResult scheduleAnalysis(CapturedError error, String context) {
        try {
            return doSchedule(error, context);
        } catch (RuntimeException e) {
            // 관측 대상 앱의 에러 경로를 막지 않는다
            log.warn("[AnalysisScheduler] scheduling failed. err={}", e.toString());
            metrics.recordResult(RESULT_FAILED);
            return ScheduleResult.of(null, ScheduleStatus.FAILED);
        }
    }

    private ScheduleResult doSchedule(CapturedError error, String context) {
        CapturedError captured = error == null ? CapturedError.of(null, null, null, null) : error;

        if (isSelfInflicted(captured.name())) {
            log.debug("[AnalysisScheduler] skip self-inflicted error. name={}", captured.name());
            metrics.recordResult(RESULT_SKIPPED);
            return ScheduleResult.of(null, ScheduleStatus.SKIPPED);
        }

        ErrorFingerprint fingerprint = fingerprinter.fingerprint(captured);
        String fp = fingerprint.value();

        if (adviceCache.get(fp).isPresent()) {
            metrics.recordResult(RESULT_CACHE_HIT);
            return ScheduleResult.of(fingerprint, ScheduleStatus.CACHED);
        }

        if (!recentFingerprints.tryAcquire(fp)) {
            log.debug("[AnalysisScheduler] duplicate analysis suppressed. fingerprint={}", fp);
            metrics.recordResult(RESULT_DUPLICATE);
            return ScheduleResult.of(fingerprint, ScheduleStatus.DUPLICATE);
        }

        AnalysisRequest request = new AnalysisRequest(fingerprint, captured, context, clock.instant());
        AdmissionResult admission = analysisQueue.schedule(request, () -> analyze(request), () -> onDropped(request));

        if (admission == AdmissionResult.REJECTED) {
            recentFingerprints.release(fp);
            metrics.recordResult(RESULT_REJECTED);
            eventLogger.analysisRejected(fp, analysisQueue.snapshot());
            return ScheduleResult.of(fingerprint, ScheduleStatus.REJECTED);
        }
        return ScheduleResult.of(fingerprint, ScheduleStatus.QUEUED);
    }

    /**
     * worker 스레드에서 실행된다.
     */
    void analyze(AnalysisRequest request) {
        String fp = request.fingerprint().value();
        try {
            // 대기하는 동안 다른 경로로 advice가 채워졌을 수 있다
            if (adviceCache.get(fp).isPresent()) {
                metrics.recordResult(RESULT_CACHE_HIT);
                return;
            }

            AdviceAnalyzer.AnalysisInput input = AdviceAnalyzer.AnalysisInput.from(request);
            Advice advice = retryingCallExecutor.callWithRetry(() -> analyzer.analyze(input), retryPolicy);

            if (advice == null) {
                log.info("[AnalysisScheduler] analyzer returned no advice. fingerprint={}", fp);
                metrics.recordResult(RESULT_NO_ADVICE);
                return;
            }

            adviceCache.set(fp, advice);
            eventLogger.adviceReady(fp, advice, Duration.between(request.submittedAt(), clock.instant()));
            metrics.recordResult(RESULT_SUCCESS);
        } catch (CircuitOpenException e) {
            // 상태 전이는 breaker listener가 한 번만 남긴다. 거절은 카운터로만 집계
            log.debug("[AnalysisScheduler] analysis skipped, circuit not closed. fingerprint={}, state={}",
                    fp, e.getState());
            metrics.recordResult(RESULT_CIRCUIT_OPEN);
        } catch (RetryExhaustedException e) {
            eventLogger.analysisFailed(fp, RESULT_EXHAUSTED, e);
            metrics.recordResult(RESULT_EXHAUSTED);
        } catch (RuntimeException e) {
            eventLogger.analysisFailed(fp, RESULT_FAILED, e);
            metrics.recordResult(RESULT_FAILED);
        } finally {
            recentFingerprints.complete(fp);
        }
    }

    private void onDropped(AnalysisRequest request) {
        recentFingerprints.release(request.fingerprint().value());
        metrics.recordResult(RESULT_REJECTED);
    }

    static boolean isSelfInflicted(String errorName) {
        if (errorName == null) return false;
        if (errorName.startsWith(PIPELINE_EXCEPTION_PACKAGE)) return true;

        int dot = errorName.lastIndexOf('.');
        String simpleName = dot < 0 ? errorName : errorName.substring(dot + 1);
        return SELF_INFLICTED.contains(simpleName);
    }

    public Optional<Advice> findAdvice(String fingerprint) {
        return adviceCache.get(fingerprint);
    }

    public int getQueueLength() {
        return analysisQueue.getQueueLength();
    }

    public long getQueueRejectCount() {
        return analysisQueue.getRejectCount();
    }

    public void resetQueueRejectCount() {
        analysisQueue.resetRejectCount();
    }

    public QueueSnapshot getQueueSnapshot() {
        return analysisQueue.snapshot();
    }

    public int getAdviceCacheLimit() {
        return adviceCache.limit();
    }

    public int getAdviceCacheSize() {
        return adviceCache.size();
    }

    public void clearAdviceCache() {
        adviceCache.clear();
    }

    public int purgeExpiredAdvice() {
        return adviceCache.purgeExpired();
    }

    public boolean startQueueMetrics() {
        return analysisQueue.startMetrics();
    }

    public boolean stopQueueMetrics() {
        return analysisQueue.stopMetrics();
    }

    public void shutdown() {
        analysisQueue.shutdown();
        adviceCache.shutdown();
        log.info("[AnalysisScheduler] shutdown complete.");
    }
}
