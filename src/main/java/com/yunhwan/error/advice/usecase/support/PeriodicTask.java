package com.yunhwan.error.advice.usecase.support;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ScheduledFuture;

/**
 * 필요할 때만 켜지는 주기 작업 핸들.
 * <p>
 * cache purge / queue metrics 처럼 "일이 생기면 start, 비면 stop" 하는 타이머를
 * 소유 서비스가 명시적으로 켜고 끈다. interval이 0 이하이면 비활성.
 */
@Slf4j
public class PeriodicTask {

    private final String name;
    private final TaskScheduler scheduler;
    private final Clock clock;
    private final Duration interval;
    private final Runnable tick;

    private ScheduledFuture<?> handle;

    public PeriodicTask(String name, TaskScheduler scheduler, Clock clock, Duration interval, Runnable tick) {
        this.name = name;
        this.scheduler = scheduler;
        this.clock = clock;
        this.interval = interval;
        this.tick = tick;
    }

    public boolean isEnabled() {
        return interval != null && !interval.isZero() && !interval.isNegative();
    }

    /**
     * 이미 돌고 있거나 비활성이면 아무것도 하지 않는다.
     *
     * @return 이번 호출로 새로 시작했으면 true
     */
    public synchronized boolean start() {
        if (!isEnabled() || handle != null) {
            return false;
        }
        handle = scheduler.scheduleWithFixedDelay(this::safeTick, clock.instant().plus(interval), interval);
        log.debug("[PeriodicTask] started. name={}, intervalMs={}", name, interval.toMillis());
        return true;
    }

    public synchronized boolean stop() {
        if (handle == null) {
            return false;
        }
        handle.cancel(false);
        handle = null;
        log.debug("[PeriodicTask] stopped. name={}", name);
        return true;
    }

    public synchronized boolean isRunning() {
        return handle != null;
    }

    private void safeTick() {
        try {
            tick.run();
        } catch (Exception e) {
            // 타이머 스레드가 죽으면 이후 tick이 모두 사라진다
            log.warn("[PeriodicTask] tick failed. name={}, err={}", name, e.toString());
        }
    }
}
