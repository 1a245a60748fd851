package com.yunhwan.error.advice.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * error-advice.* 설정 바인딩/기본값/검증과 safe threshold clamp 검증.
 */
class ErrorAdvicePropertiesTest {

    private final ApplicationContextRunner contextRunner =
            new ApplicationContextRunner()
                    .withUserConfiguration(TestConfig.class);

    @Test
    @DisplayName("설정이 없으면 기본값을 쓴다")
    void 기본값() {
        contextRunner.run(ctx -> {
            ErrorAdviceProperties props = ctx.getBean(ErrorAdviceProperties.class);

            assertThat(props.getQueue().getMaxConcurrency()).isEqualTo(5);
            assertThat(props.getQueue().getMaxQueueLength()).isEqualTo(100);
            assertThat(props.getCache().getMaxEntries()).isEqualTo(50);
            assertThat(props.getCache().getTtlSeconds()).isEqualTo(86_400);
            assertThat(props.getRetry().getMaxAttempts()).isEqualTo(3);
            assertThat(props.getBreaker().getFailureThreshold()).isEqualTo(5);
            assertThat(props.getAnalyzer().getType()).isEqualTo("stub");
            assertThat(props.getAnalyzer().getApiKey()).isNull();
        });
    }

    @Test
    @DisplayName("kebab-case 설정값이 중첩 그룹에 바인딩된다")
    void 바인딩() {
        contextRunner
                .withPropertyValues(
                        "error-advice.queue.max-concurrency=2",
                        "error-advice.queue.max-queue-length=0",
                        "error-advice.cache.ttl-seconds=0",
                        "error-advice.retry.jitter=false",
                        "error-advice.breaker.recovery-timeout-ms=1000",
                        "error-advice.dedup.window-ms=0",
                        "error-advice.analyzer.type=openai",
                        "error-advice.analyzer.api-key=sk-test"
                )
                .run(ctx -> {
                    ErrorAdviceProperties props = ctx.getBean(ErrorAdviceProperties.class);

                    assertThat(props.getQueue().getMaxConcurrency()).isEqualTo(2);
                    assertThat(props.getQueue().getMaxQueueLength()).isZero();
                    assertThat(props.getCache().getTtlSeconds()).isZero();
                    assertThat(props.getRetry().isJitter()).isFalse();
                    assertThat(props.getBreaker().getRecoveryTimeoutMs()).isEqualTo(1_000);
                    assertThat(props.getDedup().getWindowMs()).isZero();
                    assertThat(props.getAnalyzer().getType()).isEqualTo("openai");
                    assertThat(props.getAnalyzer().getApiKey()).isEqualTo("sk-test");
                });
    }

    @Test
    @DisplayName("동시성 0, 음수 대기열처럼 범위를 벗어난 값이면 기동에 실패한다")
    void 검증_실패() {
        contextRunner
                .withPropertyValues(
                        "error-advice.queue.max-concurrency=0",
                        "error-advice.queue.max-queue-length=-1"
                )
                .run(ctx -> assertThat(ctx).hasFailed());
    }

    @Test
    @DisplayName("safe threshold를 넘는 크기는 threshold로 잘린다")
    void safe_threshold_clamp() {
        ErrorAdviceProperties props = new ErrorAdviceProperties();
        props.getQueue().setSafeThreshold(10);
        props.getQueue().setMaxConcurrency(50);
        props.getQueue().setMaxQueueLength(3);
        props.getCache().setMaxEntries(11);

        assertThat(PipelineLimits.maxConcurrency(props)).isEqualTo(10);
        assertThat(PipelineLimits.maxQueueLength(props)).isEqualTo(3);
        assertThat(PipelineLimits.cacheMaxEntries(props)).isEqualTo(10);
    }

    @Configuration
    @EnableConfigurationProperties(ErrorAdviceProperties.class)
    static class TestConfig {
    }
}
