package com.yunhwan.error.advice.usecase.analysis.cache;

import com.yunhwan.error.advice.common.exception.CacheWriteException;
import com.yunhwan.error.advice.domain.advice.Advice;
import com.yunhwan.error.advice.domain.advice.AdviceCacheEntry;
import com.yunhwan.error.advice.usecase.support.PeriodicTask;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * fingerprint -> advice 캐시 (크기 + TTL 제한, LRU).
 * <p>
 * - maxEntries == 0 이면 캐시 비활성 (get은 항상 miss, set은 no-op)
 * - ttl이 0 이하이면 만료 없음, purge 타이머도 돌지 않음
 * - 만료된 항목은 get 시 miss로 보고 제거
 * - 가득 차면 set 전에 가장 오래 안 쓰인 항목 제거 (get hit / set 모두 recency 갱신)
 * <p>
 * 어떤 연산도 호출자에게 예외를 던지지 않는다.
 */
@Slf4j
public class AdviceCache {

    private final int maxEntries;
    private final Duration ttl;
    private final int maxAdviceChars;
    private final Clock clock;
    private final PeriodicTask purgeTask;

    // accessOrder=true: 순회 순서가 LRU -> MRU
    private final LinkedHashMap<String, AdviceCacheEntry> entries = new LinkedHashMap<>(16, 0.75f, true);

    public AdviceCache(int maxEntries, Duration ttl, int maxAdviceChars, Clock clock, TaskScheduler scheduler) {
        if (maxEntries < 0) {
            throw new IllegalArgumentException("maxEntries must be >= 0. maxEntries=" + maxEntries);
        }
        this.maxEntries = maxEntries;
        this.ttl = ttl == null ? Duration.ZERO : ttl;
        this.maxAdviceChars = maxAdviceChars;
        this.clock = clock;
        this.purgeTask = new PeriodicTask("advice-cache-purge", scheduler, clock,
                isEnabled() && expires() ? this.ttl : Duration.ZERO, this::purgeExpired);
    }

    public boolean isEnabled() {
        return maxEntries > 0;
    }

    public int limit() {
        return maxEntries;
    }

    public synchronized Optional<Advice> get(String fingerprint) {
        if (!isEnabled() || fingerprint == null) {
            return Optional.empty();
        }
        AdviceCacheEntry entry = entries.get(fingerprint);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            entries.remove(fingerprint);
            stopPurgeIfEmpty();
            return Optional.empty();
        }
        return Optional.of(entry.advice());
    }

    public void set(String fingerprint, Advice advice) {
        if (!isEnabled()) {
            return;
        }
        if (fingerprint == null || advice == null) {
            log.warn("[AdviceCache] ignored malformed entry. fingerprintNull={}, adviceNull={}",
                    fingerprint == null, advice == null);
            return;
        }
        try {
            put(fingerprint, advice);
        } catch (Exception e) {
            CacheWriteException failure = new CacheWriteException("advice cache write failed. fingerprint=" + fingerprint, e);
            log.warn("[AdviceCache] {}", failure.getMessage(), failure);
        }
    }

    private synchronized void put(String fingerprint, Advice advice) {
        Advice bounded = advice.truncatedTo(maxAdviceChars);
        if (bounded != advice) {
            log.info("[AdviceCache] advice truncated. fingerprint={}, sizeBefore={}, sizeAfter={}",
                    fingerprint, advice.size(), bounded.size());
        }

        // 덮어쓰기는 용량을 늘리지 않으므로 eviction 불필요
        if (!entries.containsKey(fingerprint)) {
            while (entries.size() >= maxEntries) {
                evictEldest();
            }
        }

        Instant now = clock.instant();
        Instant expiresAt = expires() ? now.plus(ttl) : null;
        entries.put(fingerprint, new AdviceCacheEntry(fingerprint, bounded, now, expiresAt));

        purgeTask.start();
    }

    /**
     * 만료 항목 일괄 제거. 타이머에서 반복 호출해도 안전하다.
     *
     * @return 제거된 항목 수
     */
    public synchronized int purgeExpired() {
        if (!isEnabled() || !expires()) {
            return 0;
        }
        Instant now = clock.instant();
        int removed = 0;
        Iterator<AdviceCacheEntry> it = entries.values().iterator();
        while (it.hasNext()) {
            if (it.next().isExpired(now)) {
                it.remove();
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("[AdviceCache] purged expired entries. removed={}, remaining={}", removed, entries.size());
        }
        stopPurgeIfEmpty();
        return removed;
    }

    public synchronized void clear() {
        entries.clear();
        purgeTask.stop();
    }

    public synchronized int size() {
        return entries.size();
    }

    public boolean isPurgeScheduled() {
        return purgeTask.isRunning();
    }

    /**
     * 종료 시 타이머 정리.
     */
    public void shutdown() {
        purgeTask.stop();
    }

    private void evictEldest() {
        Iterator<Map.Entry<String, AdviceCacheEntry>> it = entries.entrySet().iterator();
        if (it.hasNext()) {
            String key = it.next().getKey();
            it.remove();
            log.debug("[AdviceCache] evicted LRU entry. fingerprint={}", key);
        }
    }

    private void stopPurgeIfEmpty() {
        if (entries.isEmpty()) {
            purgeTask.stop();
        }
    }

    private boolean expires() {
        return !ttl.isZero() && !ttl.isNegative();
    }
}
