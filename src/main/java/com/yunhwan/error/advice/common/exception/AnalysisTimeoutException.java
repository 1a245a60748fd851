package com.yunhwan.error.advice.common.exception;

/**
 * 외부 분석 호출이 call timeout 안에 끝나지 않아 취소된 경우. 재시도 대상.
 */
public class AnalysisTimeoutException extends RetryableAnalysisException {

    public AnalysisTimeoutException(long timeoutMs) {
        super("analysis call timed out after " + timeoutMs + "ms");
    }
}
