package com.yunhwan.error.advice.common.exception;

/**
 * maxAttempts 만큼 시도했지만 모두 재시도 가능 실패로 끝난 경우.
 * 마지막 실패가 cause로 들어간다.
 */
public class RetryExhaustedException extends RuntimeException {

    private final int attempts;

    public RetryExhaustedException(int attempts, Throwable lastError) {
        super("retries exhausted after " + attempts + " attempts: " + describe(lastError), lastError);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }

    private static String describe(Throwable t) {
        if (t == null) return "unknown";
        String msg = t.getMessage();
        return t.getClass().getSimpleName() + (msg == null ? "" : ": " + msg);
    }
}
