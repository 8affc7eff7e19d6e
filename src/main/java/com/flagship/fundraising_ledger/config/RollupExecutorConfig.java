package com.flagship.fundraising_ledger.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

/**
 * Thread pool for club-wide rollup sub-fetches, and the clock used for
 * allocation dates.
 */
@Configuration
public class RollupExecutorConfig {

    @Value("${rollup.fetch.pool-size:10}")
    private int poolSize;

    @Value("${rollup.fetch.queue-capacity:500}")
    private int queueCapacity;

    @Bean(name = "rollupFetchExecutor")
    public ThreadPoolTaskExecutor rollupFetchExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("rollup-fetch-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.setTaskDecorator(new MdcTaskDecorator());
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
