package com.purchasingpower.codegraph.configuration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pool running per-source analysis units.
 *
 * One unit per source; units for different sources run concurrently, units
 * for the same source serialize on the per-source lock.
 */
@Slf4j
@Configuration
public class AsyncConfig {

    @Bean(name = "analysisExecutor")
    public ThreadPoolTaskExecutor analysisExecutor(AnalysisProperties properties) {
        ExecutorProperties pool = properties.getExecutor();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        executor.setCorePoolSize(pool.getCorePoolSize());
        executor.setMaxPoolSize(Math.max(pool.getCorePoolSize(), pool.getMaxPoolSize()));
        executor.setQueueCapacity(pool.getQueueCapacity());
        executor.setThreadNamePrefix("analysis-");

        // Wait for running builds on shutdown
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);

        executor.initialize();

        log.info("✅ Analysis executor configured: core={}, max={}, queue={}",
                executor.getCorePoolSize(),
                executor.getMaxPoolSize(),
                pool.getQueueCapacity());

        return executor;
    }
}
