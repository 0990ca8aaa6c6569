package com.volarb.config;

import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pool for batch backtests. Each task is one complete, independent engine run.
 */
@Configuration
public class AsyncConfig {

    @Value("${volarb.async.core-pool-size:4}")
    private int corePoolSize;

    @Value("${volarb.async.max-pool-size:8}")
    private int maxPoolSize;

    @Value("${volarb.async.queue-capacity:100}")
    private int queueCapacity;

    @Bean("backtestExecutor")
    public ThreadPoolTaskExecutor backtestExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("backtest-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }
}
