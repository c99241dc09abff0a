package com.smurthy.ai.insights.service.address;

import com.smurthy.ai.insights.config.InsightsProperties;
import com.smurthy.ai.insights.model.AddressData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class CmsRegistryAddressProviderTest {

    private static final InsightsProperties.Registry PROPERTIES = InsightsProperties.defaults().registry();

    private MockRestServiceServer server;
    private CmsRegistryAddressProvider provider;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        provider = new CmsRegistryAddressProvider(builder.build(), PROPERTIES, new RegistryCandidateScorer());
    }

    @Test
    @DisplayName("Should filter by name and upper-cased state")
    void testBuildUri() {
        String query = URLDecoder.decode(provider.buildUri("Tyrone Hospital", "pa").getRawQuery(), StandardCharsets.UTF_8);

        assertThat(query)
                .contains("filter[ORGANIZATION NAME][condition][path]=ORGANIZATION NAME")
                .contains("filter[ORGANIZATION NAME][condition][operator]=CONTAINS")
                .contains("filter[ORGANIZATION NAME][condition][value]=Tyrone Hospital")
                .contains("filter[ENROLLMENT STATE][condition][value]=PA")
                .contains("limit=10")
                .contains("offset=0");
    }

    @Test
    @DisplayName("Should omit the state filter when the state is unknown")
    void testBuildUriWithoutState() {
        String query = URLDecoder.decode(provider.buildUri("Tyrone Hospital", null).getRawQuery(), StandardCharsets.UTF_8);

        assertThat(query).doesNotContain("ENROLLMENT STATE");
    }

    @Test
    @DisplayName("Should return the address of the best scoring row")
    void testLookup() {
        // Given
        server.expect(requestTo(startsWith(PROPERTIES.url())))
                .andExpect(method(org.springframework.http.HttpMethod.GET))
                .andRespond(withSuccess("""
                        [
                          {"ORGANIZATION NAME": "PENN HIGHLANDS TYRONE", "ENROLLMENT STATE": "PA",
                           "ADDRESS LINE 1": "1 OTHER ROAD", "CITY": "ALTOONA", "ZIP CODE": "16601"},
                          {"ORGANIZATION NAME": "TYRONE HOSPITAL", "ENROLLMENT STATE": "PA",
                           "ADDRESS LINE 1": "187 HOSPITAL DRIVE", "CITY": "TYRONE", "ZIP CODE": "16686"}
                        ]
                        """, MediaType.APPLICATION_JSON));

        // When / Then
        assertThat(provider.lookup("Tyrone Hospital", "PA"))
                .contains(new AddressData("187 HOSPITAL DRIVE", "TYRONE", "PA", "16686"));
        server.verify();
    }

    @Test
    @DisplayName("Should find nothing in a non-array response")
    void testUnexpectedResponse() {
        server.expect(requestTo(startsWith(PROPERTIES.url())))
                .andRespond(withSuccess("{\"message\": \"dataset not found\"}", MediaType.APPLICATION_JSON));

        assertThat(provider.lookup("Tyrone Hospital", "PA")).isEmpty();
    }

    @Test
    @DisplayName("Should let HTTP failures propagate to the provider chain")
    void testServerError() {
        server.expect(requestTo(startsWith(PROPERTIES.url()))).andRespond(withServerError());

        assertThatThrownBy(() -> provider.lookup("Tyrone Hospital", "PA"))
                .isInstanceOf(RestClientException.class);
    }

    @Test
    @DisplayName("Should report the configured name, priority and switch")
    void testMetadata() {
        assertThat(provider.getProviderName()).isEqualTo("CMS Registry");
        assertThat(provider.getPriority()).isEqualTo(1);
        assertThat(provider.isEnabled()).isTrue();
    }
}
