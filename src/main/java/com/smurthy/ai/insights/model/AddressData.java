package com.smurthy.ai.insights.model;

/**
 * Address components resolved by a lookup provider. Street and ZIP code may be absent.
 */
public record AddressData(
        String street,
        String city,
        String state,
        String zipCode
) {

    /**
     * At least city and state are required for an address to be usable.
     */
    public boolean isUsable() {
        return city != null && !city.isBlank() && state != null && !state.isBlank();
    }
}
