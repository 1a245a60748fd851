package com.yunhwan.error.advice.common.exception;

import com.yunhwan.error.advice.usecase.analysis.breaker.CircuitState;

/**
 * Circuit breaker가 호출을 차단했을 때(네트워크 호출 없음). 재시도하지 않는다.
 */
public class CircuitOpenException extends RuntimeException {

    private final String breakerName;
    private final CircuitState state;

    public CircuitOpenException(String breakerName, CircuitState state) {
        super("Circuit breaker is " + state + " for " + breakerName);
        this.breakerName = breakerName;
        this.state = state;
    }

    public String getBreakerName() {
        return breakerName;
    }

    public CircuitState getState() {
        return state;
    }
}
