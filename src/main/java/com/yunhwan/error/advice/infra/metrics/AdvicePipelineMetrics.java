package com.yunhwan.error.advice.infra.metrics;

import com.yunhwan.error.advice.usecase.analysis.breaker.CircuitBreaker;
import com.yunhwan.error.advice.usecase.analysis.cache.AdviceCache;
import com.yunhwan.error.advice.usecase.analysis.queue.AnalysisQueue;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static com.yunhwan.error.advice.infra.metrics.MetricsConfig.*;

@Component
public class AdvicePipelineMetrics {

    private final MeterRegistry meterRegistry;
    private final Map<String, Counter> resultCounters = new ConcurrentHashMap<>();

    public AdvicePipelineMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        // baseline (ensure series exists)
        for (String result : ALL_RESULTS) {
            counter(result);
        }
    }

    public void recordResult(String result) {
        counter(result).increment();
    }

    public double resultCount(String result) {
        return counter(result).count();
    }

    public void bindGauges(AnalysisQueue queue, AdviceCache cache, CircuitBreaker breaker) {
        Gauge.builder(METRIC_QUEUE_LENGTH, queue, AnalysisQueue::getQueueLength).register(meterRegistry);
        Gauge.builder(METRIC_QUEUE_ACTIVE, queue, AnalysisQueue::getActiveCount).register(meterRegistry);
        Gauge.builder(METRIC_QUEUE_REJECTS, queue, AnalysisQueue::getRejectCount).register(meterRegistry);
        Gauge.builder(METRIC_CACHE_SIZE, cache, AdviceCache::size).register(meterRegistry);
        Gauge.builder(METRIC_BREAKER_STATE, breaker, b -> b.getState().gaugeValue())
                .tag(TAG_BREAKER, breaker.getName())
                .register(meterRegistry);
    }

    private Counter counter(String result) {
        return resultCounters.computeIfAbsent(result, r -> Counter.builder(METRIC_ANALYSIS)
                .tag(TAG_RESULT, r)
                .register(meterRegistry));
    }
}
