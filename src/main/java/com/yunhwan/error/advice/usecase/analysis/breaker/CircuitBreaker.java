package com.yunhwan.error.advice.usecase.analysis.breaker;

import com.yunhwan.error.advice.common.exception.CircuitOpenException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;

/**
 * 외부 분석 호출 하나만 감시하는 circuit breaker.
 * <p>
 * - CLOSED: 통과. 실패마다 consecutiveFailures 증가, threshold 도달 시 OPEN. 성공 시 0으로 리셋
 * - OPEN: 네트워크 호출 없이 {@link CircuitOpenException}. lastFailureTime + recoveryTimeout 이후 첫 호출이 HALF_OPEN probe
 * - HALF_OPEN: probe 하나만 통과. 성공 -> CLOSED, 실패 -> OPEN (recovery 타이머 재시작)
 * <p>
 * 상태는 모두 이 객체의 monitor 아래에서만 바뀐다. 보호 대상 호출 자체는 lock 밖에서 실행한다.
 */
@Slf4j
public class CircuitBreaker {

    private final String name;
    private final int failureThreshold;
    private final Duration recoveryTimeout;
    private final Clock clock;
    private final Predicate<Throwable> recordsFailure;
    private final List<CircuitStateListener> listeners = new CopyOnWriteArrayList<>();

    private CircuitState state = CircuitState.CLOSED;
    private int consecutiveFailures;
    private Instant lastFailureTime;
    private boolean probeInFlight;

    private long successCount;
    private long failureCount;
    private long rejectionCount;

    public CircuitBreaker(String name, int failureThreshold, Duration recoveryTimeout, Clock clock) {
        this(name, failureThreshold, recoveryTimeout, clock, e -> true);
    }

    /**
     * @param recordsFailure false를 돌려주는 예외(입력 검증 실패 등)는 provider 장애로 세지 않는다
     */
    public CircuitBreaker(String name,
                          int failureThreshold,
                          Duration recoveryTimeout,
                          Clock clock,
                          Predicate<Throwable> recordsFailure) {
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException("failureThreshold must be positive. value=" + failureThreshold);
        }
        if (recoveryTimeout == null || recoveryTimeout.isZero() || recoveryTimeout.isNegative()) {
            throw new IllegalArgumentException("recoveryTimeout must be positive. value=" + recoveryTimeout);
        }
        this.name = name;
        this.failureThreshold = failureThreshold;
        this.recoveryTimeout = recoveryTimeout;
        this.clock = clock;
        this.recordsFailure = recordsFailure;
    }

    public void addListener(CircuitStateListener listener) {
        listeners.add(listener);
    }

    public <T> T execute(Callable<T> call) throws Exception {
        acquirePermission();
        T result;
        try {
            result = call.call();
        } catch (Throwable t) {
            // Error도 실패로 기록해야 HALF_OPEN probe가 남지 않는다
            if (!(t instanceof Exception) || recordsFailure.test(t)) {
                onFailure(t);
            } else {
                releaseProbe();
            }
            throw t;
        }
        onSuccess();
        return result;
    }

    public synchronized CircuitState getState() {
        return state;
    }

    public synchronized CircuitBreakerStats getStats() {
        return new CircuitBreakerStats(
                name,
                state,
                consecutiveFailures,
                lastFailureTime,
                successCount,
                failureCount,
                rejectionCount,
                failureThreshold,
                recoveryTimeout.toMillis()
        );
    }

    /**
     * 운영자 강제 전이.
     * CLOSED는 실패 카운트를 리셋, OPEN은 지금부터 recovery 타이머를 다시 센다.
     */
    public void forceState(CircuitState target) {
        if (target == null) {
            throw new IllegalArgumentException("target state must not be null");
        }
        CircuitState from;
        synchronized (this) {
            from = state;
            state = target;
            probeInFlight = false;
            switch (target) {
                case CLOSED -> consecutiveFailures = 0;
                case OPEN -> lastFailureTime = clock.instant();
                case HALF_OPEN -> { }
            }
        }
        notifyListeners(from, target, "forced");
    }

    public void reset() {
        forceState(CircuitState.CLOSED);
    }

    public String getName() {
        return name;
    }

    private void acquirePermission() {
        CircuitState from = null;
        synchronized (this) {
            if (state == CircuitState.OPEN) {
                if (!recoveryElapsed()) {
                    throw reject();
                }
                from = state;
                state = CircuitState.HALF_OPEN;
                probeInFlight = true;
            } else if (state == CircuitState.HALF_OPEN) {
                if (probeInFlight) {
                    throw reject();
                }
                probeInFlight = true;
            }
        }
        if (from != null) {
            notifyListeners(from, CircuitState.HALF_OPEN, "recovery timeout elapsed");
        }
    }

    private void onSuccess() {
        CircuitState from = null;
        synchronized (this) {
            successCount++;
            consecutiveFailures = 0;
            if (state == CircuitState.HALF_OPEN) {
                from = state;
                state = CircuitState.CLOSED;
                probeInFlight = false;
            }
        }
        if (from != null) {
            notifyListeners(from, CircuitState.CLOSED, "probe succeeded");
        }
    }

    private void onFailure(Throwable e) {
        CircuitState from = null;
        String reason = null;
        synchronized (this) {
            failureCount++;
            consecutiveFailures++;
            lastFailureTime = clock.instant();

            if (state == CircuitState.HALF_OPEN) {
                from = state;
                state = CircuitState.OPEN;
                probeInFlight = false;
                reason = "probe failed: " + e.getClass().getSimpleName();
            } else if (state == CircuitState.CLOSED && consecutiveFailures >= failureThreshold) {
                from = state;
                state = CircuitState.OPEN;
                reason = consecutiveFailures + " consecutive failures";
            }
        }
        if (from != null) {
            notifyListeners(from, CircuitState.OPEN, reason);
        }
    }

    private synchronized void releaseProbe() {
        probeInFlight = false;
    }

    private CircuitOpenException reject() {
        rejectionCount++;
        return new CircuitOpenException(name, state);
    }

    private boolean recoveryElapsed() {
        if (lastFailureTime == null) {
            return true;
        }
        return !clock.instant().isBefore(lastFailureTime.plus(recoveryTimeout));
    }

    private void notifyListeners(CircuitState from, CircuitState to, String reason) {
        log.info("[CircuitBreaker] {}: {} -> {} ({})", name, from, to, reason);
        for (CircuitStateListener listener : listeners) {
            try {
                listener.onStateChange(name, from, to, reason);
            } catch (Exception ex) {
                log.warn("[CircuitBreaker] listener failed. breaker={}, err={}", name, ex.toString());
            }
        }
    }
}
