package com.yunhwan.error.advice.usecase.analysis.queue;

public record QueueSnapshot(
        int activeCount,
        int pendingCount,
        long rejectCount,
        int maxConcurrency,
        int maxQueueLength
) {
}
