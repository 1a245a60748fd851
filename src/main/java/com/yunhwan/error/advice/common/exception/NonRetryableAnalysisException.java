package com.yunhwan.error.advice.common.exception;

/**
 * 재시도해도 의미 없는(영구 실패) 분석 호출 실패.
 * 예: 입력 크기 검증 실패, API 키 누락, 4xx 응답, 응답 형식 오류
 */
public class NonRetryableAnalysisException extends RuntimeException {

    public NonRetryableAnalysisException(String message) {
        super(message);
    }

    public NonRetryableAnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
