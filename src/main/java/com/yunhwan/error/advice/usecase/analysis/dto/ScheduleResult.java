package com.yunhwan.error.advice.usecase.analysis.dto;

import com.yunhwan.error.advice.domain.error.ErrorFingerprint;

/**
 * @param fingerprint SKIPPED/FAILED 인 경우 null일 수 있다
 */
public record ScheduleResult(ErrorFingerprint fingerprint, ScheduleStatus status) {

    public static ScheduleResult of(ErrorFingerprint fingerprint, ScheduleStatus status) {
        return new ScheduleResult(fingerprint, status);
    }
}
