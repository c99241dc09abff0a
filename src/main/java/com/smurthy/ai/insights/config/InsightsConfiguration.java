package com.smurthy.ai.insights.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Main configuration class
 */
@Configuration
public class InsightsConfiguration {

    // address freshness and record timestamps
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
