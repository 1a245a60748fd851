package com.yunhwan.error.advice.common.exception;

import java.time.Duration;
import java.util.Optional;

/**
 * 재시도 가치가 있는(일시 장애) 분석 호출 실패.
 * 예: 네트워크 오류, 5xx, provider rate limit(429/503)
 * <p>
 * provider가 retry-after 힌트를 주면 {@link #retryAfter()}로 전달한다.
 */
public class RetryableAnalysisException extends RuntimeException {

    private final Duration retryAfter;
    private final boolean rateLimited;

    public RetryableAnalysisException(String message) {
        this(message, null, false, null);
    }

    public RetryableAnalysisException(String message, Throwable cause) {
        this(message, null, false, cause);
    }

    public RetryableAnalysisException(String message, Duration retryAfter, boolean rateLimited, Throwable cause) {
        super(message, cause);
        this.retryAfter = retryAfter;
        this.rateLimited = rateLimited;
    }

    public Optional<Duration> retryAfter() {
        return Optional.ofNullable(retryAfter);
    }

    public boolean isRateLimited() {
        return rateLimited;
    }
}
