package com.smurthy.ai.insights.service.address;

import com.smurthy.ai.insights.model.AddressData;

import java.util.Optional;

/**
 * A source of organization addresses. Multiple implementations are tried in priority order
 * by {@link CompositeAddressLookupProvider}.
 */
public interface AddressLookupProvider {

    /**
     * Looks up the address of an organization.
     *
     * @param organizationName display name of the organization
     * @param state            expected two-letter state code, may be null
     * @return the best address found, or empty if this provider has none
     */
    Optional<AddressData> lookup(String organizationName, String state);

    /**
     * Check if the provider is configured enabled in the system
     */
    boolean isEnabled();

    /**
     * Get the name of this provider (e.g., "CMS Registry", "Web Search")
     */
    String getProviderName();

    /**
     * Get the priority of this provider (lower number = higher priority)
     */
    int getPriority();
}
