package com.yunhwan.error.advice.usecase.analysis.dedup;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * fingerprint별 in-flight / 최근 완료 기록.
 * <p>
 * 같은 fingerprint는 분석 중이거나 완료 후 window 안이면 다시 받지 않는다.
 * capacity를 넘으면 in-flight가 아닌 가장 오래된 항목부터 버린다.
 */
@Slf4j
public class RecentFingerprintWindow {

    private final int capacity;
    private final Duration window;
    private final Clock clock;

    // value: null이면 in-flight, 아니면 완료 시각
    private final LinkedHashMap<String, Instant> entries = new LinkedHashMap<>(16, 0.75f, true);

    public RecentFingerprintWindow(int capacity, Duration window, Clock clock) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1. value=" + capacity);
        }
        this.capacity = capacity;
        this.window = window == null ? Duration.ZERO : window;
        this.clock = clock;
    }

    public synchronized boolean tryAcquire(String fingerprint) {
        if (entries.containsKey(fingerprint)) {
            Instant completedAt = entries.get(fingerprint);
            if (completedAt == null) {
                return false;
            }
            if (clock.instant().isBefore(completedAt.plus(window))) {
                return false;
            }
        }
        entries.put(fingerprint, null);
        evictIfNeeded();
        return true;
    }

    public synchronized void complete(String fingerprint) {
        if (window.isZero() || window.isNegative()) {
            entries.remove(fingerprint);
            return;
        }
        entries.put(fingerprint, clock.instant());
    }

    public synchronized void release(String fingerprint) {
        entries.remove(fingerprint);
    }

    public synchronized boolean isInFlight(String fingerprint) {
        return entries.containsKey(fingerprint) && entries.get(fingerprint) == null;
    }

    public synchronized int size() {
        return entries.size();
    }

    private void evictIfNeeded() {
        Iterator<Map.Entry<String, Instant>> it = entries.entrySet().iterator();
        while (entries.size() > capacity && it.hasNext()) {
            Map.Entry<String, Instant> eldest = it.next();
            if (eldest.getValue() != null) {
                it.remove();
            }
        }
        if (entries.size() > capacity) {
            log.debug("[RecentFingerprintWindow] all entries in flight, over capacity. size={}, capacity={}",
                    entries.size(), capacity);
        }
    }
}
