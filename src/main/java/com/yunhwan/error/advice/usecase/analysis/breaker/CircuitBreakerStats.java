package com.yunhwan.error.advice.usecase.analysis.breaker;

import java.time.Instant;

public record CircuitBreakerStats(
        String name,
        CircuitState state,
        int consecutiveFailures,
        Instant lastFailureTime,
        long successCount,
        long failureCount,
        long rejectionCount,
        int failureThreshold,
        long recoveryTimeoutMs
) {
}
