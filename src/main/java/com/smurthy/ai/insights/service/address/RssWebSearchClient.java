package com.smurthy.ai.insights.service.address;

import com.rometools.rome.feed.synd.SyndEntry;
import com.rometools.rome.feed.synd.SyndFeed;
import com.rometools.rome.io.FeedException;
import com.rometools.rome.io.SyndFeedInput;
import com.rometools.rome.io.XmlReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URI;
import java.util.List;

/**
 * Web search backed by a search engine's RSS result feed.
 */
public class RssWebSearchClient implements WebSearchClient {

    private static final Logger log = LoggerFactory.getLogger(RssWebSearchClient.class);

    private final RestClient restClient;
    private final String searchUrl;

    public RssWebSearchClient(RestClient restClient, String searchUrl) {
        this.restClient = restClient;
        this.searchUrl = searchUrl;
    }

    @Override
    public List<SearchResult> search(String query, int maxResults) {
        URI uri = UriComponentsBuilder.fromUriString(searchUrl)
                .queryParam("q", query)
                .queryParam("format", "rss")
                .encode()
                .build()
                .toUri();

        byte[] body = restClient.get().uri(uri).retrieve().body(byte[].class);
        if (body == null || body.length == 0) {
            log.warn("Empty search feed for query: {}", query);
            return List.of();
        }

        List<SearchResult> results = parseFeed(body).getEntries().stream()
                .limit(maxResults)
                .map(RssWebSearchClient::toSearchResult)
                .toList();
        log.debug("Retrieved {} search results for query: {}", results.size(), query);
        return results;
    }

    private static SyndFeed parseFeed(byte[] body) {
        try {
            return new SyndFeedInput().build(new XmlReader(new ByteArrayInputStream(body)));
        } catch (FeedException | IOException | IllegalArgumentException e) {
            throw new IllegalStateException("Unreadable search feed: " + e.getMessage(), e);
        }
    }

    private static SearchResult toSearchResult(SyndEntry entry) {
        String snippet = entry.getDescription() != null ? entry.getDescription().getValue() : "";
        return new SearchResult(entry.getTitle(), snippet, entry.getLink());
    }
}
