package com.smurthy.ai.insights.service.address;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.allOf;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class RssWebSearchClientTest {

    private static final String SEARCH_URL = "https://www.bing.com/search";

    private static final String FEED = """
            <?xml version="1.0" encoding="utf-8"?>
            <rss version="2.0">
              <channel>
                <title>Bing: Tyrone Hospital</title>
                <link>https://www.bing.com/search?q=Tyrone+Hospital</link>
                <description>Search results</description>
                <item>
                  <title>Tyrone Hospital | Home</title>
                  <link>https://www.tyronehospital.org/</link>
                  <description>187 Hospital Drive, Tyrone, PA 16686</description>
                </item>
                <item>
                  <title>Tyrone Hospital - Facebook</title>
                  <link>https://www.facebook.com/tyronehospital</link>
                  <description>Community hospital</description>
                </item>
              </channel>
            </rss>
            """;

    private MockRestServiceServer server;
    private RssWebSearchClient client;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        client = new RssWebSearchClient(builder.build(), SEARCH_URL);
    }

    @Test
    @DisplayName("Should map feed entries to search results up to the limit")
    void testSearch() {
        server.expect(requestTo(allOf(startsWith(SEARCH_URL + "?q="), containsString("format=rss"))))
                .andRespond(withSuccess(FEED, MediaType.APPLICATION_XML));

        List<SearchResult> results = client.search("\"Tyrone Hospital\" PA", 1);

        assertThat(results).containsExactly(new SearchResult(
                "Tyrone Hospital | Home", "187 Hospital Drive, Tyrone, PA 16686", "https://www.tyronehospital.org/"));
        server.verify();
    }

    @Test
    @DisplayName("Should reject a body that is not a feed")
    void testUnreadableFeed() {
        server.expect(requestTo(startsWith(SEARCH_URL)))
                .andRespond(withSuccess("<html><body>blocked</body></html>", MediaType.TEXT_HTML));

        assertThatThrownBy(() -> client.search("Tyrone Hospital", 5))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageStartingWith("Unreadable search feed");
    }
}
