package com.smurthy.ai.insights.service.address;

import com.smurthy.ai.insights.config.InsightsProperties;
import com.smurthy.ai.insights.model.AddressData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Address lookup by parsing web search snippets.
 *
 * Priority: 2 (fallback when the registry has no usable match)
 */
public class WebSearchAddressProvider implements AddressLookupProvider {

    private static final Logger log = LoggerFactory.getLogger(WebSearchAddressProvider.class);

    private final WebSearchClient searchClient;
    private final SnippetAddressParser parser;
    private final InsightsProperties.WebSearch properties;

    public WebSearchAddressProvider(WebSearchClient searchClient, SnippetAddressParser parser,
                                    InsightsProperties.WebSearch properties) {
        this.searchClient = searchClient;
        this.parser = parser;
        this.properties = properties;
    }

    @Override
    public Optional<AddressData> lookup(String organizationName, String state) {
        String query = buildQuery(organizationName, state);
        log.info("Searching web for HCO address: {}", query);

        List<SearchResult> results = searchClient.search(query, properties.maxResults());
        if (results.isEmpty()) {
            log.warn("No search results found for: {}", organizationName);
            return Optional.empty();
        }

        Optional<AddressData> address = parser.parse(results, state);
        if (address.isEmpty()) {
            log.warn("Could not parse address from search results for: {}", organizationName);
        }
        return address;
    }

    static String buildQuery(String organizationName, String state) {
        String name = organizationName.trim();
        if (state != null && !state.isBlank()) {
            return String.format("\"%s\" %s hospital address location", name, state.toUpperCase(Locale.ROOT));
        }
        return String.format("\"%s\" hospital address location", name);
    }

    @Override
    public boolean isEnabled() {
        return properties.enabled();
    }

    @Override
    public String getProviderName() {
        return "Web Search";
    }

    @Override
    public int getPriority() {
        return properties.priority();
    }
}
