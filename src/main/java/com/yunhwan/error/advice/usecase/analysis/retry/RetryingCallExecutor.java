package com.yunhwan.error.advice.usecase.analysis.retry;

import com.yunhwan.error.advice.common.exception.AnalysisTimeoutException;
import com.yunhwan.error.advice.common.exception.CircuitOpenException;
import com.yunhwan.error.advice.common.exception.NonRetryableAnalysisException;
import com.yunhwan.error.advice.common.exception.RetryExhaustedException;
import com.yunhwan.error.advice.common.exception.RetryableAnalysisException;
import com.yunhwan.error.advice.usecase.analysis.breaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.DoubleSupplier;

/**
 * circuit breaker를 거쳐 외부 분석 호출을 실행하고, 재시도 가능한 실패만 지수 백오프로 재시도한다.
 * <p>
 * - CircuitOpenException: 즉시 전파 (재시도 예산을 쓰지 않음)
 * - 비재시도 실패: 즉시 전파
 * - maxAttempts 소진: RetryExhaustedException(cause = 마지막 실패)
 * <p>
 * 각 시도는 callTimeout으로 제한되며, 시간 초과 시 호출을 취소하고 재시도 가능 실패로 본다.
 */
@Slf4j
public class RetryingCallExecutor {

    private final CircuitBreaker circuitBreaker;
    private final ExecutorService callExecutor;
    private final Duration callTimeout;
    private final BackoffSleeper sleeper;
    private final DoubleSupplier random;

    public RetryingCallExecutor(CircuitBreaker circuitBreaker,
                                ExecutorService callExecutor,
                                Duration callTimeout,
                                BackoffSleeper sleeper) {
        this(circuitBreaker, callExecutor, callTimeout, sleeper, () -> ThreadLocalRandom.current().nextDouble());
    }

    public RetryingCallExecutor(CircuitBreaker circuitBreaker,
                                ExecutorService callExecutor,
                                Duration callTimeout,
                                BackoffSleeper sleeper,
                                DoubleSupplier random) {
        this.circuitBreaker = circuitBreaker;
        this.callExecutor = callExecutor;
        this.callTimeout = callTimeout == null ? Duration.ZERO : callTimeout;
        this.sleeper = sleeper;
        this.random = random;
    }

    public <T> T callWithRetry(Callable<T> call, RetryPolicy policy) {
        Exception last = null;

        for (int attempt = 1; attempt <= policy.maxAttempts(); attempt++) {
            try {
                return circuitBreaker.execute(() -> invokeWithTimeout(call));
            } catch (CircuitOpenException e) {
                // open 상태 거절은 종료 조건. 다시 두드리지 않는다.
                throw e;
            } catch (Exception e) {
                if (!RetryableFailures.isRetryable(e)) {
                    throw asUnchecked(e);
                }
                last = e;
                if (attempt >= policy.maxAttempts()) {
                    break;
                }

                Duration wait = policy.delayFor(attempt, retryAfterHint(e), isRateLimited(e), random);
                log.info("[RetryingCallExecutor] attempt {}/{} failed, retrying in {}ms. err={}",
                        attempt, policy.maxAttempts(), wait.toMillis(), shortErr(e));
                backoff(wait);
            }
        }

        log.warn("[RetryingCallExecutor] retries exhausted. attempts={}, lastErr={}", policy.maxAttempts(), shortErr(last));
        throw new RetryExhaustedException(policy.maxAttempts(), last);
    }

    private <T> T invokeWithTimeout(Callable<T> call) throws Exception {
        if (callExecutor == null || callTimeout.isZero() || callTimeout.isNegative()) {
            return call.call();
        }

        Future<T> future;
        try {
            future = callExecutor.submit(call);
        } catch (RejectedExecutionException e) {
            // 시간 초과된 호출이 아직 스레드를 잡고 있는 경우. 일시 포화로 보고 재시도한다
            throw new RetryableAnalysisException("analysis call pool saturated", e);
        }
        try {
            return future.get(callTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new AnalysisTimeoutException(callTimeout.toMillis());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception ex) throw ex;
            if (cause instanceof Error err) throw err;
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NonRetryableAnalysisException("interrupted while waiting for analysis call", e);
        } finally {
            // 성공/실패/취소 어떤 경로든 남은 호출을 정리 (완료된 future면 no-op)
            future.cancel(true);
        }
    }

    private void backoff(Duration wait) {
        try {
            sleeper.sleep(wait);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NonRetryableAnalysisException("interrupted during retry backoff", e);
        }
    }

    private static Duration retryAfterHint(Exception e) {
        if (e instanceof RetryableAnalysisException r) {
            return r.retryAfter().orElse(null);
        }
        return null;
    }

    private static boolean isRateLimited(Exception e) {
        return e instanceof RetryableAnalysisException r && r.isRateLimited();
    }

    private static RuntimeException asUnchecked(Exception e) {
        if (e instanceof RuntimeException re) return re;
        return new NonRetryableAnalysisException(e.getClass().getSimpleName() + ": " + e.getMessage(), e);
    }

    private static String shortErr(Exception e) {
        if (e == null) return null;
        String s = e.getClass().getSimpleName() + ": " + (e.getMessage() == null ? "" : e.getMessage());
        return s.length() <= 120 ? s : s.substring(0, 120);
    }
}
