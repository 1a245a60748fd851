package com.yunhwan.error.advice.usecase.analysis.queue;

import com.yunhwan.error.advice.common.exception.QueueOverflowException;
import com.yunhwan.error.advice.domain.analysis.AnalysisRequest;
import com.yunhwan.error.advice.usecase.support.PeriodicTask;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * 분석 작업 admission gate.
 * <p>
 * - active < maxConcurrency: 바로 executor로 dispatch
 * - 아니면 pending < maxQueueLength: FIFO 대기
 * - 둘 다 가득이면 reject (rejectCount 증가, 호출자에게 예외 없음)
 * <p>
 * 작업이 끝나면 대기열 맨 앞을 이어서 dispatch 한다. active 카운터가 유일한 동시성 제한이다.
 */
@Slf4j
public class AnalysisQueue {

    private final int maxConcurrency;
    private final int maxQueueLength;
    private final Executor executor;
    private final PeriodicTask metricsTask;

    private final Deque<QueuedAnalysis> pending = new ArrayDeque<>();
    private int active;
    private long rejectCount;

    public AnalysisQueue(int maxConcurrency,
                         int maxQueueLength,
                         Executor executor,
                         TaskScheduler scheduler,
                         Clock clock,
                         Duration metricsInterval) {
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be >= 1. value=" + maxConcurrency);
        }
        if (maxQueueLength < 0) {
            throw new IllegalArgumentException("maxQueueLength must be >= 0. value=" + maxQueueLength);
        }
        this.maxConcurrency = maxConcurrency;
        this.maxQueueLength = maxQueueLength;
        this.executor = executor;
        this.metricsTask = new PeriodicTask("analysis-queue-metrics", scheduler, clock, metricsInterval, this::logMetrics);
    }

    public AdmissionResult schedule(AnalysisRequest request, Runnable job) {
        return schedule(request, job, () -> {});
    }

    /**
     * @param onDropped 이미 대기열에 받아들였던 작업이 executor 거절/종료로 버려질 때 호출.
     *                  즉시 REJECTED를 반환하는 경우에는 호출하지 않는다.
     */
    public AdmissionResult schedule(AnalysisRequest request, Runnable job, Runnable onDropped) {
        QueuedAnalysis queued = new QueuedAnalysis(request, job, onDropped);

        synchronized (this) {
            if (active >= maxConcurrency) {
                if (pending.size() < maxQueueLength) {
                    pending.addLast(queued);
                    metricsTask.start();
                    return AdmissionResult.ACCEPTED;
                }

                rejectCount++;
                QueueOverflowException overflow = new QueueOverflowException(active, pending.size());
                log.warn("[AnalysisQueue] {} fingerprint={}, rejects={}",
                        overflow.getMessage(), fingerprintOf(request), rejectCount);
                return AdmissionResult.REJECTED;
            }
            active++;
            metricsTask.start();
        }

        return dispatch(queued) ? AdmissionResult.ACCEPTED : AdmissionResult.REJECTED;
    }

    public synchronized int getQueueLength() {
        return pending.size();
    }

    public synchronized int getActiveCount() {
        return active;
    }

    public synchronized long getRejectCount() {
        return rejectCount;
    }

    /**
     * 운영자 액션. 그 외에는 reject 카운터가 줄어들지 않는다.
     */
    public synchronized void resetRejectCount() {
        log.info("[AnalysisQueue] reject counter reset. previous={}", rejectCount);
        rejectCount = 0;
    }

    public synchronized QueueSnapshot snapshot() {
        return new QueueSnapshot(active, pending.size(), rejectCount, maxConcurrency, maxQueueLength);
    }

    public boolean startMetrics() {
        return metricsTask.start();
    }

    public boolean stopMetrics() {
        return metricsTask.stop();
    }

    public boolean isMetricsRunning() {
        return metricsTask.isRunning();
    }

    public void shutdown() {
        Deque<QueuedAnalysis> dropped;
        synchronized (this) {
            dropped = new ArrayDeque<>(pending);
            pending.clear();
        }
        metricsTask.stop();
        dropped.forEach(q -> q.onDropped().run());
        if (!dropped.isEmpty()) {
            log.info("[AnalysisQueue] shutdown dropped pending analyses. count={}", dropped.size());
        }
    }

    /**
     * @return executor가 받아들였으면 true. 거절되면 slot을 반납하고 reject로 센다.
     */
    private boolean dispatch(QueuedAnalysis queued) {
        try {
            executor.execute(() -> runAndRelease(queued));
            return true;
        } catch (RejectedExecutionException e) {
            synchronized (this) {
                rejectCount++;
            }
            log.warn("[AnalysisQueue] executor rejected analysis. fingerprint={}, err={}",
                    fingerprintOf(queued.request()), e.toString());
            onFinished();
            return false;
        }
    }

    private void runAndRelease(QueuedAnalysis queued) {
        try {
            queued.job().run();
        } catch (RuntimeException e) {
            log.error("[AnalysisQueue] analysis job failed. fingerprint={}", fingerprintOf(queued.request()), e);
        } finally {
            onFinished();
        }
    }

    private void onFinished() {
        QueuedAnalysis next;
        synchronized (this) {
            next = pending.pollFirst();
            if (next == null) {
                active--;
                if (active == 0) {
                    metricsTask.stop();
                }
                return;
            }
            // slot을 그대로 다음 작업에 넘긴다 (active 변화 없음)
        }

        if (!dispatch(next)) {
            next.onDropped().run();
        }
    }

    private void logMetrics() {
        int length;
        long rejects;
        synchronized (this) {
            length = pending.size();
            rejects = rejectCount;
        }
        log.info("[AnalysisQueue] metrics queueLength={} queueRejects={}", length, rejects);
    }

    private static String fingerprintOf(AnalysisRequest request) {
        return request == null || request.fingerprint() == null ? null : request.fingerprint().value();
    }

    private record QueuedAnalysis(AnalysisRequest request, Runnable job, Runnable onDropped) {
    }
}
