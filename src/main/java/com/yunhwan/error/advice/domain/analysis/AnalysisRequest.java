package com.yunhwan.error.advice.domain.analysis;

import com.yunhwan.error.advice.domain.error.CapturedError;
import com.yunhwan.error.advice.domain.error.ErrorFingerprint;

import java.time.Instant;

/**
 * 캐시 miss 시 scheduler가 만들고 queue가 정확히 한 번 소비하는 분석 요청.
 *
 * @param context 이미 민감정보가 제거된 context 문자열
 */
public record AnalysisRequest(
        ErrorFingerprint fingerprint,
        CapturedError error,
        String context,
        Instant submittedAt
) {
}
