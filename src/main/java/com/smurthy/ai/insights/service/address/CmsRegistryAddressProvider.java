package com.smurthy.ai.insights.service.address;

import com.fasterxml.jackson.databind.JsonNode;
import com.smurthy.ai.insights.config.InsightsProperties;
import com.smurthy.ai.insights.model.AddressData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Address lookup against the CMS Hospital Enrollments data API.
 *
 * FREE: official government data, no API key required.
 *
 * Priority: 1 (structured data, tried before web search)
 *
 * Configure with:
 *   insights.registry.enabled=true
 *   insights.registry.url=https://data.cms.gov/data-api/v1/dataset/.../data
 */
public class CmsRegistryAddressProvider implements AddressLookupProvider {

    private static final Logger log = LoggerFactory.getLogger(CmsRegistryAddressProvider.class);

    private static final String NAME_FIELD = "ORGANIZATION NAME";
    private static final String STATE_FIELD = "ENROLLMENT STATE";

    private final RestClient restClient;
    private final InsightsProperties.Registry properties;
    private final RegistryCandidateScorer scorer;

    public CmsRegistryAddressProvider(RestClient restClient, InsightsProperties.Registry properties,
                                      RegistryCandidateScorer scorer) {
        this.restClient = restClient;
        this.properties = properties;
        this.scorer = scorer;
    }

    @Override
    public Optional<AddressData> lookup(String organizationName, String state) {
        String searchName = organizationName.trim();
        log.info("Searching CMS Hospital Enrollments API for: {}", searchName);

        JsonNode response = restClient.get()
                .uri(buildUri(searchName, state))
                .retrieve()
                .body(JsonNode.class);

        if (response == null || !response.isArray()) {
            log.warn("Unexpected response format from CMS API for: {}", searchName);
            return Optional.empty();
        }

        List<RegistryCandidate> candidates = new ArrayList<>();
        response.forEach(row -> candidates.add(RegistryCandidate.fromJson(row)));
        log.debug("Retrieved {} results from CMS API", candidates.size());

        return scorer.bestMatch(candidates, searchName, state)
                .map(RegistryCandidate::toAddress)
                .filter(AddressData::isUsable);
    }

    URI buildUri(String searchName, String state) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(properties.url());
        addFilter(builder, NAME_FIELD, "CONTAINS", searchName);
        if (state != null && !state.isBlank()) {
            addFilter(builder, STATE_FIELD, "=", state.toUpperCase(Locale.ROOT));
        }
        builder.queryParam("limit", properties.maxResults())
                .queryParam("offset", 0);
        return builder.encode().build().toUri();
    }

    private static void addFilter(UriComponentsBuilder builder, String field, String operator, String value) {
        String prefix = "filter[" + field + "][condition]";
        builder.queryParam(prefix + "[path]", field)
                .queryParam(prefix + "[operator]", operator)
                .queryParam(prefix + "[value]", value);
    }

    @Override
    public boolean isEnabled() {
        return properties.enabled();
    }

    @Override
    public String getProviderName() {
        return "CMS Registry";
    }

    @Override
    public int getPriority() {
        return properties.priority();
    }
}
