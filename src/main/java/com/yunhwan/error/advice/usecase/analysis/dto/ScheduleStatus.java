package com.yunhwan.error.advice.usecase.analysis.dto;

public enum ScheduleStatus {
    /** 파이프라인 자체 에러라서 분석하지 않음 */
    SKIPPED,
    /** 이미 캐시에 advice가 있음 */
    CACHED,
    /** 같은 fingerprint가 분석 중이거나 방금 끝남 */
    DUPLICATE,
    QUEUED,
    REJECTED,
    FAILED
}
