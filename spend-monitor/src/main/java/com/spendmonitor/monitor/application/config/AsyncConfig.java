package com.spendmonitor.monitor.application.config;

import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Pool for alert fan-out. One thread more than the device parallelism so the broadcast
 * never waits behind device pushes.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "dispatchExecutor")
    public ThreadPoolTaskExecutor dispatchExecutor(SpendMonitorProperties properties) {
        var threads = properties.dispatch().deviceParallelism() + 1;
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("dispatch-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
