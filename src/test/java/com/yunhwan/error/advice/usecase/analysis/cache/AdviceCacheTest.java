package com.yunhwan.error.advice.usecase.analysis.cache;

import com.yunhwan.error.advice.domain.advice.Advice;
import com.yunhwan.error.advice.testsupport.ManualTaskScheduler;
import com.yunhwan.error.advice.testsupport.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

/**
 * advice 캐시의 크기/TTL/LRU 동작과 purge 타이머 수명 검증.
 */
class AdviceCacheTest {

    private final MutableClock clock = MutableClock.startingAt("2025-01-01T00:00:00Z");
    private final ManualTaskScheduler timer = new ManualTaskScheduler();

    @Test
    @DisplayName("저장한 advice는 TTL 전까지 조회되고, TTL이 지나면 miss가 된다")
    void TTL_만료() {
        AdviceCache cache = new AdviceCache(10, Duration.ofSeconds(60), 4_000, clock, timer.scheduler());
        cache.set("fp1", advice("a"));

        clock.advance(Duration.ofSeconds(59));
        assertThat(cache.get("fp1")).contains(advice("a"));

        clock.advance(Duration.ofSeconds(1));
        assertThat(cache.get("fp1")).isEmpty();
        assertThat(cache.size()).isZero();
    }

    @Test
    @DisplayName("용량 초과 시 가장 오래 사용되지 않은 항목이 제거된다 (get도 recency 갱신)")
    void LRU_eviction() {
        AdviceCache cache = new AdviceCache(2, Duration.ZERO, 4_000, clock, timer.scheduler());
        cache.set("fp1", advice("1"));
        cache.set("fp2", advice("2"));

        // fp1을 최근 사용으로 만든다
        cache.get("fp1");
        cache.set("fp3", advice("3"));

        assertThat(cache.get("fp1")).isPresent();
        assertThat(cache.get("fp2")).isEmpty();
        assertThat(cache.get("fp3")).isPresent();
        assertThat(cache.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("같은 키 덮어쓰기는 다른 항목을 밀어내지 않는다")
    void 덮어쓰기는_eviction_없음() {
        AdviceCache cache = new AdviceCache(2, Duration.ZERO, 4_000, clock, timer.scheduler());
        cache.set("fp1", advice("1"));
        cache.set("fp2", advice("2"));

        cache.set("fp2", advice("2-new"));

        assertThat(cache.get("fp1")).isPresent();
        assertThat(cache.get("fp2")).contains(advice("2-new"));
    }

    @Test
    @DisplayName("maxEntries=0이면 캐시가 꺼져 있고 타이머도 돌지 않는다")
    void 캐시_비활성() {
        AdviceCache cache = new AdviceCache(0, Duration.ofSeconds(60), 4_000, clock, timer.scheduler());

        cache.set("fp1", advice("a"));

        assertThat(cache.isEnabled()).isFalse();
        assertThat(cache.get("fp1")).isEmpty();
        assertThat(timer.scheduledCount()).isZero();
    }

    @Test
    @DisplayName("TTL=0이면 만료되지 않고 purge 타이머도 시작하지 않는다")
    void TTL_0_만료없음() {
        AdviceCache cache = new AdviceCache(10, Duration.ZERO, 4_000, clock, timer.scheduler());
        cache.set("fp1", advice("a"));

        clock.advance(Duration.ofDays(365));

        assertThat(cache.get("fp1")).isPresent();
        assertThat(cache.isPurgeScheduled()).isFalse();
        assertThat(cache.purgeExpired()).isZero();
    }

    @Test
    @DisplayName("purge 타이머는 첫 저장 때 켜지고, 비워지면 꺼진다")
    void purge_타이머_수명() {
        AdviceCache cache = new AdviceCache(10, Duration.ofSeconds(60), 4_000, clock, timer.scheduler());
        assertThat(cache.isPurgeScheduled()).isFalse();

        cache.set("fp1", advice("a"));
        cache.set("fp2", advice("b"));
        assertThat(cache.isPurgeScheduled()).isTrue();
        assertThat(timer.scheduledCount()).isEqualTo(1);
        assertThat(timer.lastInterval()).isEqualTo(Duration.ofSeconds(60));

        clock.advance(Duration.ofSeconds(61));
        timer.tickActive();

        assertThat(cache.size()).isZero();
        assertThat(cache.isPurgeScheduled()).isFalse();
        assertThat(timer.activeCount()).isZero();
    }

    @Test
    @DisplayName("purgeExpired는 만료 항목만 제거하고 개수를 돌려준다")
    void 만료항목만_제거() {
        AdviceCache cache = new AdviceCache(10, Duration.ofSeconds(60), 4_000, clock, timer.scheduler());
        cache.set("old", advice("old"));
        clock.advance(Duration.ofSeconds(30));
        cache.set("new", advice("new"));

        clock.advance(Duration.ofSeconds(31));

        assertThat(cache.purgeExpired()).isEqualTo(1);
        assertThat(cache.get("new")).isPresent();
        assertThat(cache.isPurgeScheduled()).isTrue();
    }

    @Test
    @DisplayName("용량 1 캐시에 a, b를 차례로 넣으면 a는 miss, b는 조회된다")
    void 용량_1_시나리오() {
        AdviceCache cache = new AdviceCache(1, Duration.ofSeconds(60), 4_000, clock, timer.scheduler());

        cache.set("a", advice("1"));
        cache.set("b", advice("2"));

        assertThat(cache.get("a")).isEmpty();
        assertThat(cache.get("b")).contains(advice("2"));
    }

    @Test
    @DisplayName("purgeExpired를 연달아 호출해도 두 번째 호출은 아무것도 바꾸지 않는다")
    void purge_멱등() {
        AdviceCache cache = new AdviceCache(10, Duration.ofSeconds(60), 4_000, clock, timer.scheduler());
        cache.set("old", advice("old"));
        clock.advance(Duration.ofSeconds(30));
        cache.set("new", advice("new"));
        clock.advance(Duration.ofSeconds(31));

        cache.purgeExpired();
        int sizeAfterFirst = cache.size();

        assertThat(cache.purgeExpired()).isZero();
        assertThat(cache.size()).isEqualTo(sizeAfterFirst);
    }

    @Test
    @DisplayName("너무 긴 advice는 잘라서 저장한다")
    void advice_길이_상한() {
        AdviceCache cache = new AdviceCache(10, Duration.ZERO, 20, clock, timer.scheduler());

        cache.set("fp1", new Advice("s".repeat(50), "a".repeat(50), "m"));

        assertThat(cache.get("fp1")).get().satisfies(a -> assertThat(a.size()).isLessThanOrEqualTo(20));
    }

    @Test
    @DisplayName("clear는 모든 항목과 타이머를 정리하고, null 입력은 예외 없이 무시한다")
    void clear_및_비정상_입력() {
        AdviceCache cache = new AdviceCache(10, Duration.ofSeconds(60), 4_000, clock, timer.scheduler());
        cache.set("fp1", advice("a"));

        assertThatCode(() -> {
            cache.set(null, advice("x"));
            cache.set("fp2", null);
            cache.get(null);
        }).doesNotThrowAnyException();

        cache.clear();

        assertThat(cache.size()).isZero();
        assertThat(cache.isPurgeScheduled()).isFalse();
    }

    private static Advice advice(String s) {
        return new Advice("summary-" + s, "action-" + s, "test-model");
    }
}
