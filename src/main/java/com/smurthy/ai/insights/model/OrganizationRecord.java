package com.smurthy.ai.insights.model;

import java.time.Instant;

/**
 * A healthcare organization (HCO) as stored in the analytics store.
 * Address fields are optional and maintained by the address lookup workflow.
 */
public record OrganizationRecord(
        String id,
        String name,
        String state,
        String region,
        int treatedPatients,
        int ghostPatients,
        String address,
        String city,
        String zipCode,
        Instant addressLastUpdated
) {

    /**
     * Share of eligible patients that were not treated: ghost / (ghost + treated).
     * Zero when the organization has no patients at all.
     */
    public double leakageRate() {
        int total = ghostPatients + treatedPatients;
        return total > 0 ? (double) ghostPatients / total : 0.0;
    }

    public boolean hasAddress() {
        return hasText(address) || hasText(city);
    }

    /**
     * Returns a copy carrying the non-empty fields of the resolved address.
     */
    public OrganizationRecord withAddress(AddressData resolved, Instant updatedAt) {
        return new OrganizationRecord(
                id,
                name,
                hasText(resolved.state()) ? resolved.state() : state,
                region,
                treatedPatients,
                ghostPatients,
                hasText(resolved.street()) ? resolved.street() : address,
                hasText(resolved.city()) ? resolved.city() : city,
                hasText(resolved.zipCode()) ? resolved.zipCode() : zipCode,
                updatedAt
        );
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
