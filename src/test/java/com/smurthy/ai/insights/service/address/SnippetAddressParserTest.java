package com.smurthy.ai.insights.service.address;

import com.smurthy.ai.insights.model.AddressData;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SnippetAddressParserTest {

    private final SnippetAddressParser parser = new SnippetAddressParser();

    @Test
    @DisplayName("Should parse a full street, city, state and zip")
    void testFullAddress() {
        assertThat(parser.parse("Tyrone Hospital - 187 Hospital Drive, Tyrone, PA 16686", "PA"))
                .contains(new AddressData("187 Hospital Drive", "Tyrone", "PA", "16686"));
    }

    @Test
    @DisplayName("Should combine a street and zip with a city and state found elsewhere")
    void testStreetZipWithCityState() {
        assertThat(parser.parse("500 University Drive 17033. Hershey, PA", "PA"))
                .contains(new AddressData("500 University Drive", "Hershey", "PA", "17033"));
    }

    @Test
    @DisplayName("Should fall back to a bare city and state")
    void testLocatedIn() {
        assertThat(parser.parse("The hospital is located in Tyrone, PA", null))
                .contains(new AddressData(null, "Tyrone", "PA", null));
    }

    @Test
    @DisplayName("Should reject matches with an invalid state code")
    void testInvalidState() {
        assertThat(parser.parse("123 Main St, Springfield, ZZ 12345", null)).isEmpty();
    }

    @Test
    @DisplayName("Should keep an address from another state than expected")
    void testStateMismatch() {
        assertThat(parser.parse("187 Hospital Drive, Tyrone, PA 16686", "OH"))
                .map(AddressData::state)
                .contains("PA");
    }

    @Test
    @DisplayName("Should use the first result that contains an address")
    void testResultsInOrder() {
        List<SearchResult> results = List.of(
                new SearchResult("Tyrone Hospital", "Compassionate care close to home", "https://www.tyronehospital.org/"),
                new SearchResult("Contact us", "187 Hospital Drive, Tyrone, PA 16686", "https://www.tyronehospital.org/contact"),
                new SearchResult("Directions", "1 Other Road, Altoona, PA 16601", "https://example.org/"));

        assertThat(parser.parse(results, "PA"))
                .contains(new AddressData("187 Hospital Drive", "Tyrone", "PA", "16686"));
    }
}
