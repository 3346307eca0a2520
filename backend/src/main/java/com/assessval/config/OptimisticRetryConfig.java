package com.assessval.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.retry.support.RetryTemplate;

/**
 * Retry policy for tracked updates. Only optimistic-lock failures are retried;
 * every other exception propagates on the first attempt.
 */
@Configuration
public class OptimisticRetryConfig {

    @Bean
    public RetryTemplate optimisticRetryTemplate(ValuationProperties properties) {
        return buildRetryTemplate(properties.getConcurrency());
    }

    public static RetryTemplate buildRetryTemplate(ValuationProperties.Concurrency concurrency) {
        return RetryTemplate.builder()
            .maxAttempts(Math.max(1, concurrency.getMaxUpdateAttempts()))
            .fixedBackoff(Math.max(1, concurrency.getBackoffMillis()))
            .retryOn(OptimisticLockingFailureException.class)
            .traversingCauses()
            .build();
    }
}
