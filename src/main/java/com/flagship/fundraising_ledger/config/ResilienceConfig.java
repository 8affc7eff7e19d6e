package com.flagship.fundraising_ledger.config;

import com.flagship.fundraising_ledger.exception.ResourceNotFoundException;
import com.flagship.fundraising_ledger.recalc.RecalculationCoordinator;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Retry policy for summary recomputes.
 *
 * Backoff doubles from recalculation.retry.initial-backoff-ms. A missing
 * node is not retried: it will not appear on a later attempt.
 */
@Configuration
@Slf4j
public class ResilienceConfig {

    @Value("${recalculation.retry.max-attempts:3}")
    private int maxAttempts;

    @Value("${recalculation.retry.initial-backoff-ms:200}")
    private long initialBackoffMs;

    @Value("${recalculation.retry.multiplier:2.0}")
    private double multiplier;

    @Bean
    public RetryRegistry retryRegistry() {
        RetryConfig recalculation = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(initialBackoffMs, multiplier))
                .ignoreExceptions(ResourceNotFoundException.class, IllegalArgumentException.class)
                .build();

        RetryRegistry registry = RetryRegistry.ofDefaults();
        registry.addConfiguration(RecalculationCoordinator.RETRY_NAME, recalculation);
        registry.retry(RecalculationCoordinator.RETRY_NAME, recalculation);

        log.info("Recompute retry: maxAttempts={}, initialBackoff={}ms, multiplier={}",
                maxAttempts, initialBackoffMs, multiplier);
        return registry;
    }
}
