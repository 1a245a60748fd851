package com.yunhwan.error.advice.infra.metrics;

public final class MetricsConfig {

    private MetricsConfig() {}

    // 파이프라인 상태 (gauge)
    public static final String METRIC_QUEUE_LENGTH = "error_advice.queue.length";
    public static final String METRIC_QUEUE_ACTIVE = "error_advice.queue.active";
    public static final String METRIC_QUEUE_REJECTS = "error_advice.queue.rejects";
    public static final String METRIC_CACHE_SIZE = "error_advice.cache.size";
    public static final String METRIC_BREAKER_STATE = "error_advice.breaker.state";

    // 분석 결과 (counter)
    public static final String METRIC_ANALYSIS = "error_advice.analysis";

    // 고카디널리티 금지(fingerprint/에러메시지 제외)
    public static final String TAG_RESULT = "result";
    public static final String TAG_BREAKER = "breaker";

    // 고정 결과값(집계 안정성)
    public static final String RESULT_SUCCESS = "success";
    public static final String RESULT_CACHE_HIT = "cache_hit";
    public static final String RESULT_DUPLICATE = "duplicate";
    public static final String RESULT_REJECTED = "rejected";
    public static final String RESULT_CIRCUIT_OPEN = "circuit_open";
    public static final String RESULT_EXHAUSTED = "exhausted";
    public static final String RESULT_FAILED = "failed";
    public static final String RESULT_NO_ADVICE = "no_advice";
    public static final String RESULT_SKIPPED = "skipped";

    static final String[] ALL_RESULTS = {
            RESULT_SUCCESS, RESULT_CACHE_HIT, RESULT_DUPLICATE, RESULT_REJECTED, RESULT_CIRCUIT_OPEN,
            RESULT_EXHAUSTED, RESULT_FAILED, RESULT_NO_ADVICE, RESULT_SKIPPED
    };
}
