package com.yunhwan.error.advice.usecase.analysis.breaker;

/**
 * Circuit breaker 상태.
 * <pre>
 * CLOSED --(연속 실패 >= threshold)--> OPEN
 * OPEN   --(recoveryTimeout 경과 후 첫 호출)--> HALF_OPEN
 * HALF_OPEN --(probe 성공)--> CLOSED
 * HALF_OPEN --(probe 실패)--> OPEN
 * </pre>
 */
public enum CircuitState {
    CLOSED(0),
    HALF_OPEN(1),
    OPEN(2);

    private final int gaugeValue;

    CircuitState(int gaugeValue) {
        this.gaugeValue = gaugeValue;
    }

    public int gaugeValue() {
        return gaugeValue;
    }
}
