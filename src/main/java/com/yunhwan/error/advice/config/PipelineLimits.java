package com.yunhwan.error.advice.config;

import lombok.extern.slf4j.Slf4j;

/**
 * 동시성/대기열/캐시 크기를 safe threshold 이하로 자른다.
 */
@Slf4j
public final class PipelineLimits {

    private PipelineLimits() {}

    public static int clamp(String name, int value, int safeThreshold) {
        if (value > safeThreshold) {
            log.warn("[PipelineLimits] {} {} exceeds safe threshold {}, clamped.", name, value, safeThreshold);
            return safeThreshold;
        }
        return value;
    }

    public static int maxConcurrency(ErrorAdviceProperties props) {
        return clamp("queue.max-concurrency", props.getQueue().getMaxConcurrency(), props.getQueue().getSafeThreshold());
    }

    public static int maxQueueLength(ErrorAdviceProperties props) {
        return clamp("queue.max-queue-length", props.getQueue().getMaxQueueLength(), props.getQueue().getSafeThreshold());
    }

    public static int cacheMaxEntries(ErrorAdviceProperties props) {
        return clamp("cache.max-entries", props.getCache().getMaxEntries(), props.getQueue().getSafeThreshold());
    }
}
