package com.tracemap.config;

import java.time.Clock;
import java.util.concurrent.ThreadPoolExecutor;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class ExecutorConfig {

    /**
     * Pool the per-cell range queries run on. Bounded queue; a rejected query fails its cell only.
     */
    @Bean(name = "traceQueryExecutor")
    public ThreadPoolTaskExecutor traceQueryExecutor(AppProperties appProperties) {
        int threads = appProperties.getFetch().getQueryThreads();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(threads * 32);
        executor.setThreadNamePrefix("trace-query-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
