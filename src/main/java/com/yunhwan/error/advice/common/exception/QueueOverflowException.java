package com.yunhwan.error.advice.common.exception;

/**
 * 분석 큐가 가득 차서 요청이 거절된 경우.
 * 호출자에게 던지지 않고 reject 카운터와 로그로만 남긴다.
 */
public class QueueOverflowException extends IllegalStateException {

    private final int activeCount;
    private final int pendingCount;

    public QueueOverflowException(int activeCount, int pendingCount) {
        super("analysis queue full (active=%d, pending=%d)".formatted(activeCount, pendingCount));
        this.activeCount = activeCount;
        this.pendingCount = pendingCount;
    }

    public int activeCount() {
        return activeCount;
    }

    public int pendingCount() {
        return pendingCount;
    }
}
