package com.dfsoptimizer.config;

import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pool for simulation chunks. The engine submits one wave of chunks per pool-size
 * threads and waits for the wave, so the queue never holds more than a wave.
 */
@Configuration
public class AsyncConfig {

    @Value("${dfs.async.simulation-pool-size:#{T(java.lang.Runtime).getRuntime().availableProcessors()}}")
    private int simulationPoolSize;

    @Value("${dfs.async.queue-capacity:256}")
    private int queueCapacity;

    @Bean("simulationExecutor")
    public ThreadPoolTaskExecutor simulationExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(simulationPoolSize);
        executor.setMaxPoolSize(simulationPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("sim-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }
}
