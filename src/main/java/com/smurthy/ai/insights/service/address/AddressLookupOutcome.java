package com.smurthy.ai.insights.service.address;

import com.smurthy.ai.insights.model.OrganizationRecord;

/**
 * Result of an address lookup request.
 *
 * @param requestedName the name as asked for
 * @param organization  the matched organization with the address to show, null when not found
 * @param source        where the address came from
 * @param providerName  name of the resolving provider when {@code source} is PROVIDER
 * @param websiteUrl    the organization's website, null when none was found
 */
public record AddressLookupOutcome(
        String requestedName,
        OrganizationRecord organization,
        AddressSource source,
        String providerName,
        String websiteUrl
) {

    public static AddressLookupOutcome notFound(String requestedName) {
        return new AddressLookupOutcome(requestedName, null, AddressSource.NONE, null, null);
    }

    public boolean organizationFound() {
        return organization != null;
    }

    public boolean hasAddress() {
        return source != AddressSource.NONE;
    }
}
