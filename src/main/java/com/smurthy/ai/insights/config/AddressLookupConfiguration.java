package com.smurthy.ai.insights.config;

import com.smurthy.ai.insights.repository.HcoRepository;
import com.smurthy.ai.insights.service.address.AddressFreshnessPolicy;
import com.smurthy.ai.insights.service.address.AddressLookupProvider;
import com.smurthy.ai.insights.service.address.AddressResolutionService;
import com.smurthy.ai.insights.service.address.CmsRegistryAddressProvider;
import com.smurthy.ai.insights.service.address.CompositeAddressLookupProvider;
import com.smurthy.ai.insights.service.address.ProviderHealthTracker;
import com.smurthy.ai.insights.service.address.RegistryCandidateScorer;
import com.smurthy.ai.insights.service.address.RssWebSearchClient;
import com.smurthy.ai.insights.service.address.SnippetAddressParser;
import com.smurthy.ai.insights.service.address.WebSearchAddressProvider;
import com.smurthy.ai.insights.service.address.WebSearchClient;
import com.smurthy.ai.insights.service.address.WebsiteLocator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Clock;
import java.util.List;

/**
 * Address lookup providers and the resolution workflow.
 *
 * Each provider gets its own RestClient so that connect and read timeouts can be set per provider.
 */
@Configuration
public class AddressLookupConfiguration {

    @Bean
    public WebSearchClient webSearchClient(InsightsProperties properties) {
        InsightsProperties.WebSearch webSearch = properties.webSearch();
        RestClient restClient = RestClient.builder()
                .requestFactory(requestFactory(webSearch.connectTimeoutMs(), webSearch.readTimeoutMs()))
                .defaultHeader("User-Agent", "Mozilla/5.0 (compatible; insights-chat)")
                .build();
        return new RssWebSearchClient(restClient, webSearch.url());
    }

    @Bean
    public CmsRegistryAddressProvider cmsRegistryAddressProvider(InsightsProperties properties) {
        InsightsProperties.Registry registry = properties.registry();
        RestClient restClient = RestClient.builder()
                .requestFactory(requestFactory(registry.connectTimeoutMs(), registry.readTimeoutMs()))
                .build();
        return new CmsRegistryAddressProvider(restClient, registry, new RegistryCandidateScorer());
    }

    @Bean
    public WebSearchAddressProvider webSearchAddressProvider(WebSearchClient webSearchClient, InsightsProperties properties) {
        return new WebSearchAddressProvider(webSearchClient, new SnippetAddressParser(), properties.webSearch());
    }

    @Bean
    public ProviderHealthTracker providerHealthTracker() {
        return new ProviderHealthTracker();
    }

    @Bean
    public CompositeAddressLookupProvider compositeAddressLookupProvider(List<AddressLookupProvider> providers,
                                                                         ProviderHealthTracker healthTracker) {
        return new CompositeAddressLookupProvider(providers, healthTracker);
    }

    @Bean
    public AddressResolutionService addressResolutionService(HcoRepository hcoRepository,
                                                             CompositeAddressLookupProvider addressProvider,
                                                             WebSearchClient webSearchClient,
                                                             InsightsProperties properties,
                                                             Clock clock) {
        return new AddressResolutionService(
                hcoRepository,
                new AddressFreshnessPolicy(clock, properties.address().cacheDays()),
                addressProvider,
                new WebsiteLocator(webSearchClient, properties.webSearch().maxResults()),
                clock);
    }

    private static SimpleClientHttpRequestFactory requestFactory(int connectTimeoutMs, int readTimeoutMs) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(connectTimeoutMs);
        factory.setReadTimeout(readTimeoutMs);
        return factory;
    }
}
