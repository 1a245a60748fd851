package com.yunhwan.error.advice.config;

import com.yunhwan.error.advice.domain.error.ErrorFingerprinter;
import com.yunhwan.error.advice.infra.logging.AnalysisEventLogger;
import com.yunhwan.error.advice.infra.metrics.AdvicePipelineMetrics;
import com.yunhwan.error.advice.usecase.analysis.AnalysisScheduler;
import com.yunhwan.error.advice.usecase.analysis.breaker.CircuitBreaker;
import com.yunhwan.error.advice.usecase.analysis.cache.AdviceCache;
import com.yunhwan.error.advice.usecase.analysis.dedup.RecentFingerprintWindow;
import com.yunhwan.error.advice.usecase.analysis.port.AdviceAnalyzer;
import com.yunhwan.error.advice.usecase.analysis.queue.AnalysisQueue;
import com.yunhwan.error.advice.usecase.analysis.retry.BackoffSleeper;
import com.yunhwan.error.advice.usecase.analysis.retry.RetryPolicy;
import com.yunhwan.error.advice.usecase.analysis.retry.RetryableFailures;
import com.yunhwan.error.advice.usecase.analysis.retry.RetryingCallExecutor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class AdvicePipelineConfig {

    static final String BREAKER_NAME = "advice-analyzer";

    @Bean
    public ErrorFingerprinter errorFingerprinter() {
        return new ErrorFingerprinter();
    }

    @Bean(destroyMethod = "shutdown")
    public AdviceCache adviceCache(ErrorAdviceProperties props,
                                   Clock clock,
                                   @Qualifier("adviceTaskScheduler") TaskScheduler scheduler) {
        ErrorAdviceProperties.Cache cache = props.getCache();
        return new AdviceCache(
                PipelineLimits.cacheMaxEntries(props),
                Duration.ofSeconds(cache.getTtlSeconds()),
                cache.getMaxAdviceChars(),
                clock,
                scheduler);
    }

    @Bean
    public CircuitBreaker adviceCircuitBreaker(ErrorAdviceProperties props, Clock clock, AnalysisEventLogger eventLogger) {
        ErrorAdviceProperties.Breaker breaker = props.getBreaker();
        CircuitBreaker circuitBreaker = new CircuitBreaker(
                BREAKER_NAME,
                breaker.getFailureThreshold(),
                Duration.ofMillis(breaker.getRecoveryTimeoutMs()),
                clock,
                RetryableFailures::countsAgainstProvider);
        circuitBreaker.addListener(eventLogger);
        return circuitBreaker;
    }

    @Bean
    public RetryPolicy analysisRetryPolicy(ErrorAdviceProperties props) {
        ErrorAdviceProperties.Retry retry = props.getRetry();
        return new RetryPolicy(retry.getMaxAttempts(), retry.getBaseDelayMs(), retry.getMaxDelayMs(), retry.isJitter());
    }

    @Bean
    public RetryingCallExecutor retryingCallExecutor(CircuitBreaker adviceCircuitBreaker,
                                                     @Qualifier("analysisCallExecutor") ThreadPoolTaskExecutor callExecutor,
                                                     ErrorAdviceProperties props) {
        return new RetryingCallExecutor(
                adviceCircuitBreaker,
                callExecutor.getThreadPoolExecutor(),
                Duration.ofMillis(props.getRetry().getCallTimeoutMs()),
                BackoffSleeper.THREAD_SLEEP);
    }

    @Bean
    public RecentFingerprintWindow recentFingerprintWindow(ErrorAdviceProperties props, Clock clock) {
        ErrorAdviceProperties.Dedup dedup = props.getDedup();
        return new RecentFingerprintWindow(dedup.getCapacity(), Duration.ofMillis(dedup.getWindowMs()), clock);
    }

    @Bean
    public AnalysisQueue analysisQueue(ErrorAdviceProperties props,
                                       @Qualifier("analysisTaskExecutor") ThreadPoolTaskExecutor executor,
                                       @Qualifier("adviceTaskScheduler") TaskScheduler scheduler,
                                       Clock clock) {
        return new AnalysisQueue(
                PipelineLimits.maxConcurrency(props),
                PipelineLimits.maxQueueLength(props),
                executor,
                scheduler,
                clock,
                Duration.ofMillis(props.getQueue().getMetricsIntervalMs()));
    }

    @Bean(destroyMethod = "shutdown")
    public AnalysisScheduler analysisScheduler(ErrorFingerprinter fingerprinter,
                                               AdviceCache adviceCache,
                                               RecentFingerprintWindow recentFingerprintWindow,
                                               AnalysisQueue analysisQueue,
                                               RetryingCallExecutor retryingCallExecutor,
                                               RetryPolicy analysisRetryPolicy,
                                               AdviceAnalyzer adviceAnalyzer,
                                               CircuitBreaker adviceCircuitBreaker,
                                               AnalysisEventLogger eventLogger,
                                               AdvicePipelineMetrics metrics,
                                               Clock clock) {
        metrics.bindGauges(analysisQueue, adviceCache, adviceCircuitBreaker);
        return new AnalysisScheduler(
                fingerprinter,
                adviceCache,
                recentFingerprintWindow,
                analysisQueue,
                retryingCallExecutor,
                analysisRetryPolicy,
                adviceAnalyzer,
                eventLogger,
                metrics,
                clock);
    }
}
