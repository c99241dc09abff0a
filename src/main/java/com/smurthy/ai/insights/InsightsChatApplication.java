package com.smurthy.ai.insights;

import com.smurthy.ai.insights.config.InsightsProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(InsightsProperties.class)
public class InsightsChatApplication {

    public static void main(String[] args) {
        SpringApplication.run(InsightsChatApplication.class, args);
    }

}
