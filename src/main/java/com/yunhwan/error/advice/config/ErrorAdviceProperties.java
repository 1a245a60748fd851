package com.yunhwan.error.advice.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@Getter
@Setter
@Validated
@Component
@ConfigurationProperties(prefix = "error-advice")
public class ErrorAdviceProperties {

    @Valid
    private Queue queue = new Queue();
    @Valid
    private Cache cache = new Cache();
    @Valid
    private Retry retry = new Retry();
    @Valid
    private Breaker breaker = new Breaker();
    @Valid
    private Dedup dedup = new Dedup();
    @Valid
    private Analyzer analyzer = new Analyzer();

    @Getter @Setter
    public static class Queue {
        @Min(1)
        private int maxConcurrency = 5;
        @Min(0)
        private int maxQueueLength = 100;
        /**
         * 동시성/대기열/캐시 상한. 설정값이 이보다 크면 경고 후 잘라낸다.
         */
        @Min(1)
        private int safeThreshold = 1000;
        /**
         * 0이면 주기 metrics 로그 비활성
         */
        @Min(0)
        private long metricsIntervalMs = 60_000;
    }

    @Getter @Setter
    public static class Cache {
        /**
         * 0이면 캐시 비활성
         */
        @Min(0)
        private int maxEntries = 50;
        /**
         * 0이면 만료 없음
         */
        @Min(0)
        private long ttlSeconds = 86_400;
        @Min(1)
        private int maxAdviceChars = 4_000;
    }

    @Getter @Setter
    public static class Retry {
        @Min(1)
        private int maxAttempts = 3;
        @Min(0)
        private long baseDelayMs = 100;
        /**
         * 0이면 상한 없음
         */
        @Min(0)
        private long maxDelayMs = 2_000;
        private boolean jitter = true;
        /**
         * 시도 1회 제한 시간. 0이면 제한 없음
         */
        @Min(0)
        private long callTimeoutMs = 10_000;
    }

    @Getter @Setter
    public static class Breaker {
        @Min(1)
        private int failureThreshold = 5;
        @Min(1)
        private long recoveryTimeoutMs = 30_000;
    }

    @Getter @Setter
    public static class Dedup {
        @Min(0)
        private long windowMs = 5_000;
        @Min(1)
        private int capacity = 500;
    }

    @Getter @Setter
    public static class Analyzer {
        /**
         * stub | openai
         */
        @NotNull
        private String type = "stub";
        private String baseUrl = "https://api.openai.com/v1";
        private String apiKey;
        private String model = "gpt-4o";
        @Min(1)
        private int maxTokens = 2_048;
        @Min(1)
        private long connectTimeoutMs = 3_000;
        @Min(1)
        private long readTimeoutMs = 10_000;
    }
}
