package com.smurthy.ai.insights.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Configuration properties for the chat insights service
 */
@ConfigurationProperties(prefix = "insights")
public record InsightsProperties(
        @DefaultValue Chat chat,
        @DefaultValue Address address,
        @DefaultValue Registry registry,
        @DefaultValue WebSearch webSearch,
        @DefaultValue Documents documents
) {

    /**
     * Properties with every value at its documented default.
     */
    public static InsightsProperties defaults() {
        return new InsightsProperties(
                new Chat(5, 20, 20),
                new Address(90),
                new Registry(true, 1,
                        "https://data.cms.gov/data-api/v1/dataset/f6f6505c-e8b0-4d57-b258-e2b94133aaf2/data",
                        10, 10000, 15000),
                new WebSearch(true, 2, "https://www.bing.com/search", 5, 10000, 10000),
                new Documents(5, 0.3));
    }

    /**
     * Limits applied by the intent matchers and handlers.
     */
    public record Chat(
            @DefaultValue("5") int defaultTopLimit,
            @DefaultValue("20") int maxTopLimit,
            @DefaultValue("20") int paperSearchLimit
    ) {
    }

    /**
     * Address cache policy. Cached addresses older than {@code cacheDays} are refreshed.
     */
    public record Address(
            @DefaultValue("90") int cacheDays
    ) {
    }

    /**
     * CMS Hospital Enrollments data API (structured registry lookups).
     */
    public record Registry(
            @DefaultValue("true") boolean enabled,
            @DefaultValue("1") int priority,
            @DefaultValue("https://data.cms.gov/data-api/v1/dataset/f6f6505c-e8b0-4d57-b258-e2b94133aaf2/data") String url,
            @DefaultValue("10") int maxResults,
            @DefaultValue("10000") int connectTimeoutMs,
            @DefaultValue("15000") int readTimeoutMs
    ) {
    }

    /**
     * Free-text web search returning an RSS result feed.
     */
    public record WebSearch(
            @DefaultValue("true") boolean enabled,
            @DefaultValue("2") int priority,
            @DefaultValue("https://www.bing.com/search") String url,
            @DefaultValue("5") int maxResults,
            @DefaultValue("10000") int connectTimeoutMs,
            @DefaultValue("10000") int readTimeoutMs
    ) {
    }

    /**
     * Retrieval settings for document questions.
     */
    public record Documents(
            @DefaultValue("5") int topK,
            @DefaultValue("0.3") double similarityThreshold
    ) {
    }
}
