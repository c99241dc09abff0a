package com.smurthy.ai.insights.service.address;

import com.smurthy.ai.insights.model.AddressData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts US address components from free-text search snippets.
 *
 * Patterns are tried in order: full street/city/state/zip, street and zip with a city/state
 * anywhere in the text, then a bare "located in City, ST". A match whose state is not a valid
 * US code falls through to the next pattern.
 */
public class SnippetAddressParser {

    private static final Logger log = LoggerFactory.getLogger(SnippetAddressParser.class);

    // "123 Main St, Los Angeles, CA 90015"
    private static final Pattern FULL_ADDRESS = Pattern.compile(
            "(\\d+\\s+[A-Za-z0-9\\s,.]+?),\\s*([A-Za-z\\s]+),\\s*([A-Z]{2})\\s+(\\d{5}(?:-\\d{4})?)",
            Pattern.CASE_INSENSITIVE);

    // "123 Main Street 90015"
    private static final Pattern STREET_ZIP = Pattern.compile(
            "(\\d+\\s+[A-Za-z0-9\\s,.]+?)\\s+(\\d{5}(?:-\\d{4})?)",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern CITY_STATE = Pattern.compile(
            "([A-Za-z\\s]+),\\s*([A-Z]{2})",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern LOCATED_IN = Pattern.compile(
            "(?:located\\s+in|address[:\\s]+|in\\s+)([A-Za-z\\s]+),\\s*([A-Z]{2})",
            Pattern.CASE_INSENSITIVE);

    /**
     * Returns the first address found in any of the results, in result order.
     */
    public Optional<AddressData> parse(List<SearchResult> results, String expectedState) {
        for (SearchResult result : results) {
            Optional<AddressData> address = parse(result.combinedText(), expectedState);
            if (address.isPresent()) {
                return address;
            }
        }
        return Optional.empty();
    }

    public Optional<AddressData> parse(String text, String expectedState) {
        Matcher full = FULL_ADDRESS.matcher(text);
        if (full.find()) {
            String state = full.group(3).toUpperCase(Locale.ROOT);
            if (UsStates.isValid(state)) {
                if (expectedState != null && !state.equalsIgnoreCase(expectedState)) {
                    log.debug("State mismatch: found {}, expected {}", state, expectedState);
                }
                return Optional.of(new AddressData(full.group(1).trim(), full.group(2).trim(), state, full.group(4)));
            }
        }

        Matcher streetZip = STREET_ZIP.matcher(text);
        if (streetZip.find()) {
            Matcher cityState = CITY_STATE.matcher(text);
            if (cityState.find()) {
                String state = cityState.group(2).toUpperCase(Locale.ROOT);
                if (UsStates.isValid(state)) {
                    return Optional.of(new AddressData(
                            streetZip.group(1).trim(), cityState.group(1).trim(), state, streetZip.group(2)));
                }
            }
        }

        Matcher locatedIn = LOCATED_IN.matcher(text);
        if (locatedIn.find()) {
            String state = locatedIn.group(2).toUpperCase(Locale.ROOT);
            if (UsStates.isValid(state)) {
                return Optional.of(new AddressData(null, locatedIn.group(1).trim(), state, null));
            }
        }

        return Optional.empty();
    }
}
