package com.yunhwan.error.advice.usecase.analysis.retry;

import java.time.Duration;

/**
 * 재시도 사이 대기. 테스트에서는 실제로 자지 않고 대기값만 기록한다.
 */
@FunctionalInterface
public interface BackoffSleeper {

    BackoffSleeper THREAD_SLEEP = delay -> Thread.sleep(delay.toMillis());

    void sleep(Duration delay) throws InterruptedException;
}
