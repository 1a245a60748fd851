package com.yunhwan.error.advice.usecase.analysis.retry;

import com.yunhwan.error.advice.common.exception.CircuitOpenException;
import com.yunhwan.error.advice.common.exception.NonRetryableAnalysisException;
import com.yunhwan.error.advice.common.exception.RetryableAnalysisException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.TimeoutException;

/**
 * 실패 분류. 네트워크/타임아웃/provider rate limit 계열만 재시도한다.
 * 보호 장치 이벤트(circuit open)와 검증 계열은 절대 재시도하지 않는다.
 */
public final class RetryableFailures {

    private RetryableFailures() {}

    public static boolean isRetryable(Throwable t) {
        if (t == null) return false;
        if (t instanceof CircuitOpenException) return false;
        if (t instanceof NonRetryableAnalysisException) return false;

        return t instanceof RetryableAnalysisException
                || t instanceof TimeoutException
                || t instanceof IOException
                || t instanceof UncheckedIOException;
    }

    /**
     * breaker가 provider 장애로 셀 실패인지. 입력 검증 같은 비재시도 실패는 세지 않는다.
     */
    public static boolean countsAgainstProvider(Throwable t) {
        return !(t instanceof NonRetryableAnalysisException);
    }
}
