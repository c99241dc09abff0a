package com.smurthy.ai.insights.config;

import org.springframework.ai.retry.TransientAiException;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;

import java.util.Map;

/**
 * Retry for chat model calls. Address provider lookups are never retried.
 */
@Configuration
public class RetryConfig {

    @Bean
    public RetryTemplate retryTemplate() {
        RetryTemplate retryTemplate = new RetryTemplate();

        ExponentialBackOffPolicy backOffPolicy = new ExponentialBackOffPolicy();
        backOffPolicy.setInitialInterval(1000); // Initial wait time: 1 second
        backOffPolicy.setMultiplier(2);         // Double the wait time on each retry
        backOffPolicy.setMaxInterval(8000);     // Max wait time: 8 seconds
        retryTemplate.setBackOffPolicy(backOffPolicy);

        SimpleRetryPolicy retryPolicy = new SimpleRetryPolicy(3, Map.of(TransientAiException.class, true));
        retryTemplate.setRetryPolicy(retryPolicy);

        return retryTemplate;
    }
}
