package com.smurthy.ai.insights.service.address;

import java.util.Locale;
import java.util.Set;

/**
 * Two-letter codes accepted as a US state in parsed addresses (50 states plus DC).
 */
final class UsStates {

    static final Set<String> CODES = Set.of(
            "AL", "AK", "AZ", "AR", "CA", "CO", "CT", "DE", "FL", "GA",
            "HI", "ID", "IL", "IN", "IA", "KS", "KY", "LA", "ME", "MD",
            "MA", "MI", "MN", "MS", "MO", "MT", "NE", "NV", "NH", "NJ",
            "NM", "NY", "NC", "ND", "OH", "OK", "OR", "PA", "RI", "SC",
            "SD", "TN", "TX", "UT", "VT", "VA", "WA", "WV", "WI", "WY", "DC"
    );

    private UsStates() {
    }

    static boolean isValid(String code) {
        return code != null && CODES.contains(code.toUpperCase(Locale.ROOT));
    }
}
