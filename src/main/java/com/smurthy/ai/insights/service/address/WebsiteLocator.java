package com.smurthy.ai.insights.service.address;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Finds the most likely official website of an organization from web search results.
 */
public class WebsiteLocator {

    private static final Logger log = LoggerFactory.getLogger(WebsiteLocator.class);

    // Directories and social networks, never an organization's own site
    private static final List<String> SKIP_DOMAINS = List.of(
            "facebook.com", "twitter.com", "linkedin.com", "wikipedia.org",
            "yelp.com", "healthgrades.com", "vitals.com", "google.com");

    private final WebSearchClient searchClient;
    private final int maxResults;

    public WebsiteLocator(WebSearchClient searchClient, int maxResults) {
        this.searchClient = searchClient;
        this.maxResults = maxResults;
    }

    /**
     * Searches for the organization's website. Search failures are logged and reported as empty.
     */
    public Optional<String> findWebsite(String organizationName, String state) {
        String query = buildQuery(organizationName, state);
        log.info("Searching for HCO website: {}", query);
        try {
            Optional<String> website = selectBest(searchClient.search(query, maxResults), organizationName);
            if (website.isEmpty()) {
                log.warn("Could not find website URL for: {}", organizationName);
            }
            return website;
        } catch (Exception e) {
            log.error("Website search failed for '{}': {}", organizationName, e.getMessage(), e);
            return Optional.empty();
        }
    }

    /**
     * Scores each result and returns the best URL with its query string removed.
     */
    public Optional<String> selectBest(List<SearchResult> results, String organizationName) {
        String bestUrl = null;
        int bestScore = Integer.MIN_VALUE;

        for (int rank = 0; rank < results.size(); rank++) {
            SearchResult result = results.get(rank);
            String url = result.url();
            if (url == null || !url.startsWith("http")) {
                continue;
            }
            String lowerUrl = url.toLowerCase(Locale.ROOT);
            if (SKIP_DOMAINS.stream().anyMatch(lowerUrl::contains)) {
                continue;
            }

            int score = score(rank, host(url), result.title(), organizationName);
            log.debug("Website candidate {} scored {}", url, score);
            if (score > bestScore) {
                bestScore = score;
                bestUrl = url;
            }
        }

        if (bestUrl == null) {
            return Optional.empty();
        }
        int query = bestUrl.indexOf('?');
        return Optional.of(query >= 0 ? bestUrl.substring(0, query) : bestUrl);
    }

    int score(int rank, String host, String title, String organizationName) {
        int score = (10 - rank) * 10;

        String lowerName = organizationName.toLowerCase(Locale.ROOT);
        boolean nameInHost = Arrays.stream(lowerName.split("\\s+"))
                .map(word -> word.replace("-", ""))
                .filter(word -> word.length() > 3)
                .anyMatch(host::contains);
        if (nameInHost) {
            score += 50;
        }

        if (host.endsWith(".org")) {
            score += 30;
        } else if (host.endsWith(".edu")) {
            score += 25;
        } else if (host.endsWith(".com")) {
            score += 20;
        }

        if (title != null && title.toLowerCase(Locale.ROOT).contains(lowerName)) {
            score += 20;
        }
        return score;
    }

    static String buildQuery(String organizationName, String state) {
        String name = organizationName.trim();
        if (state != null && !state.isBlank()) {
            return String.format("\"%s\" %s hospital official website", name, state.toUpperCase(Locale.ROOT));
        }
        return String.format("\"%s\" hospital official website", name);
    }

    private static String host(String url) {
        try {
            String host = URI.create(url).getHost();
            if (host != null) {
                return host.toLowerCase(Locale.ROOT);
            }
        } catch (IllegalArgumentException e) {
            log.debug("Unparseable URL {}: {}", url, e.getMessage());
        }
        String[] parts = url.split("/");
        return parts.length > 2 ? parts[2].toLowerCase(Locale.ROOT) : "";
    }
}
