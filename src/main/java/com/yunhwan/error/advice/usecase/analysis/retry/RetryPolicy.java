package com.yunhwan.error.advice.usecase.analysis.retry;

import java.time.Duration;
import java.util.function.DoubleSupplier;

/**
 * 분석 호출 재시도 설정 (불변).
 *
 * @param maxAttempts 총 시도 횟수 (첫 호출 포함)
 * @param baseDelayMs 첫 재시도 대기
 * @param maxDelayMs  대기 상한 (0이면 상한 없음)
 * @param jitter      [0, baseDelayMs) 범위 난수 추가 여부
 */
public record RetryPolicy(
        int maxAttempts,
        long baseDelayMs,
        long maxDelayMs,
        boolean jitter
) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1. value=" + maxAttempts);
        }
        if (baseDelayMs < 0 || maxDelayMs < 0) {
            throw new IllegalArgumentException("delays must be >= 0. base=" + baseDelayMs + ", max=" + maxDelayMs);
        }
    }

    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, 0, 0, false);
    }

    /**
     * failedAttempt(1부터)번째 시도 실패 후 다음 시도까지의 대기.
     * <ul>
     *   <li>기본: min(maxDelay, baseDelay * 2^(failedAttempt-1)) (+ jitter)</li>
     *   <li>rate limit인데 힌트가 없으면 두 배</li>
     *   <li>provider retry-after 힌트가 있으면 계산값을 하한으로 max(계산값, 힌트)</li>
     *   <li>마지막으로 maxDelay 상한 적용</li>
     * </ul>
     */
    public Duration delayFor(int failedAttempt, Duration retryAfterHint, boolean rateLimited, DoubleSupplier random) {
        int exponent = Math.max(0, Math.min(failedAttempt - 1, 30));
        long computed = baseDelayMs << exponent;
        if (computed < 0) computed = Long.MAX_VALUE;
        computed = capped(computed);

        if (jitter && baseDelayMs > 0) {
            computed += (long) (random.getAsDouble() * baseDelayMs);
        }

        long wait = computed;
        if (retryAfterHint != null && !retryAfterHint.isNegative()) {
            wait = Math.max(computed, retryAfterHint.toMillis());
        } else if (rateLimited) {
            wait = computed * 2;
        }
        return Duration.ofMillis(capped(wait));
    }

    private long capped(long ms) {
        return maxDelayMs > 0 ? Math.min(ms, maxDelayMs) : ms;
    }
}
