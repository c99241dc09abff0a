package com.smurthy.ai.insights.service.address;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WebsiteLocatorTest {

    @Mock
    private WebSearchClient searchClient;

    private WebsiteLocator locator;

    @BeforeEach
    void setUp() {
        locator = new WebsiteLocator(searchClient, 5);
    }

    @Test
    @DisplayName("Should prefer an organization domain named after the HCO and strip the query")
    void testSelectBest() {
        List<SearchResult> results = List.of(
                new SearchResult("Best hospitals in PA", "", "https://www.findcare.com/listing/123?ref=1"),
                new SearchResult("Tyrone Hospital | Home", "", "https://www.tyronehospital.org/?utm=x"),
                new SearchResult("Tyrone Hospital", "", "https://www.facebook.com/tyronehospital"));

        assertThat(locator.selectBest(results, "Tyrone Hospital")).contains("https://www.tyronehospital.org/");
    }

    @Test
    @DisplayName("Should skip directories and non-http links")
    void testSkipDomains() {
        List<SearchResult> results = List.of(
                new SearchResult("Tyrone Hospital", "", "https://www.yelp.com/biz/tyrone-hospital"),
                new SearchResult("Tyrone Hospital", "", "ftp://tyronehospital.org/"));

        assertThat(locator.selectBest(results, "Tyrone Hospital")).isEmpty();
    }

    @Test
    @DisplayName("Should add the domain bonus only for name words longer than three letters")
    void testScore() {
        assertThat(locator.score(0, "www.tyronehospital.org", null, "Tyrone Hospital")).isEqualTo(100 + 50 + 30);
        assertThat(locator.score(2, "www.abc.edu", null, "ABC Med")).isEqualTo(80 + 25);
        assertThat(locator.score(1, "www.example.com", "Tyrone Hospital", "Tyrone Hospital")).isEqualTo(90 + 20 + 20);
    }

    @Test
    @DisplayName("Should search with the quoted name and state")
    void testFindWebsite() {
        when(searchClient.search("\"Tyrone Hospital\" PA hospital official website", 5))
                .thenReturn(List.of(new SearchResult("Tyrone Hospital", "", "https://www.tyronehospital.org/")));

        assertThat(locator.findWebsite("Tyrone Hospital", "pa")).contains("https://www.tyronehospital.org/");
    }

    @Test
    @DisplayName("Should report a failed search as no website")
    void testSearchFailure() {
        when(searchClient.search("\"Tyrone Hospital\" hospital official website", 5))
                .thenThrow(new IllegalStateException("Unreadable search feed"));

        assertThat(locator.findWebsite("Tyrone Hospital", null)).isEmpty();
    }
}
