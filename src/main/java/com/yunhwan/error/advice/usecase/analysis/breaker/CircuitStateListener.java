package com.yunhwan.error.advice.usecase.analysis.breaker;

/**
 * 상태 전이 알림 수신자. 전이 한 번에 정확히 한 번 호출된다.
 */
@FunctionalInterface
public interface CircuitStateListener {

    void onStateChange(String breakerName, CircuitState from, CircuitState to, String reason);
}
