package com.smurthy.ai.insights.service.address;

import java.util.List;

/**
 * Free-text web search. Results are returned in rank order.
 */
public interface WebSearchClient {

    List<SearchResult> search(String query, int maxResults);
}
