package com.yunhwan.error.advice.app.api.analysis.dto;

import com.yunhwan.error.advice.usecase.analysis.breaker.CircuitBreakerStats;
import com.yunhwan.error.advice.usecase.analysis.queue.QueueSnapshot;

public record AnalysisStatusResponse(
        QueueSnapshot queue,
        int cacheSize,
        int cacheLimit,
        CircuitBreakerStats breaker
) {}
