package com.yunhwan.error.advice.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
public class AnalysisSchedulingConfig {

    @Bean
    public TaskScheduler adviceTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2); // cache purge + queue metrics
        scheduler.setThreadNamePrefix("advice-timer-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.initialize();
        return scheduler;
    }

    /**
     * 동시 실행 수는 AnalysisQueue가 제한한다. 내부 큐는 완료 직후 다음 작업을 넘길 때의 여유분.
     */
    @Bean
    public ThreadPoolTaskExecutor analysisTaskExecutor(ErrorAdviceProperties props) {
        int concurrency = PipelineLimits.maxConcurrency(props);
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(concurrency);
        executor.setMaxPoolSize(concurrency);
        executor.setQueueCapacity(concurrency);
        executor.setThreadNamePrefix("analysis-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    /**
     * 취소된 blocking 호출은 read timeout까지 스레드를 잡고 있으므로 worker당 시도 횟수만큼 여유를 둔다.
     */
    @Bean
    public ThreadPoolTaskExecutor analysisCallExecutor(ErrorAdviceProperties props) {
        int concurrency = PipelineLimits.maxConcurrency(props);
        int capacity = concurrency * props.getRetry().getMaxAttempts();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(concurrency);
        executor.setMaxPoolSize(capacity);
        executor.setQueueCapacity(capacity);
        executor.setThreadNamePrefix("analysis-call-");
        executor.initialize();
        return executor;
    }
}
