package com.smurthy.ai.insights.service.address;

import com.fasterxml.jackson.databind.JsonNode;
import com.smurthy.ai.insights.model.AddressData;

/**
 * One enrollment row returned by the hospital registry.
 */
public record RegistryCandidate(
        String organizationName,
        String state,
        String street,
        String city,
        String zipCode
) {

    static RegistryCandidate fromJson(JsonNode row) {
        return new RegistryCandidate(
                text(row, "ORGANIZATION NAME"),
                text(row, "ENROLLMENT STATE"),
                text(row, "ADDRESS LINE 1"),
                text(row, "CITY"),
                text(row, "ZIP CODE"));
    }

    public AddressData toAddress() {
        return new AddressData(street, city, state, zipCode);
    }

    private static String text(JsonNode row, String field) {
        JsonNode value = row.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
