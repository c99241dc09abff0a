package com.smurthy.ai.insights.chat.handlers;

import com.smurthy.ai.insights.chat.ChatReply;
import com.smurthy.ai.insights.chat.MatchResult;
import com.smurthy.ai.insights.config.InsightsProperties;
import com.smurthy.ai.insights.model.OrganizationRecord;
import com.smurthy.ai.insights.repository.HcoRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TopHcosHandlerTest {

    @Mock
    private HcoRepository hcoRepository;

    private TopHcosHandler handler;

    @BeforeEach
    void setUp() {
        handler = new TopHcosHandler(hcoRepository, InsightsProperties.defaults().chat());
    }

    @Test
    @DisplayName("Should extract the requested count")
    void testMatchesWithCount() {
        assertThat(handler.matches("top 3 HCOs with highest ghost patients"))
                .contains(MatchResult.of(TopHcosHandler.LIMIT, 3));
    }

    @Test
    @DisplayName("Should default to 5 when no count is given")
    void testMatchesDefaultCount() {
        assertThat(handler.matches("top hcos by ghost patients"))
                .contains(MatchResult.of(TopHcosHandler.LIMIT, 5));
    }

    @Test
    @DisplayName("Should clamp the count into [1, 20]")
    void testMatchesClamped() {
        assertThat(handler.matches("show me top 50 hcos ghost patients"))
                .contains(MatchResult.of(TopHcosHandler.LIMIT, 20));
        assertThat(handler.matches("top 0 hcos ghost patients"))
                .contains(MatchResult.of(TopHcosHandler.LIMIT, 1));
    }

    @Test
    @DisplayName("Should match regardless of case")
    void testMatchesCaseInsensitive() {
        assertThat(handler.matches("TOP 10 HCOS BY GHOST PATIENTS"))
                .contains(MatchResult.of(TopHcosHandler.LIMIT, 10));
    }

    @Test
    @DisplayName("Should not match unrelated messages")
    void testNoMatch() {
        assertThat(handler.matches("show contract templates")).isEmpty();
        assertThat(handler.matches("what is the address of Tyrone Hospital?")).isEmpty();
    }

    @Test
    @DisplayName("Should list organizations in store order with address links")
    void testHandleRendersRanking() {
        // Given
        when(hcoRepository.findTopByGhostPatients(3)).thenReturn(List.of(
                hco("Tyrone Hospital", "PA", 700, 300),
                hco("Mercy Medical", "OH", 1000, 250),
                hco("Lakeside Clinic", "MI", 50, 50)));

        // When
        ChatReply reply = handler.handle(MatchResult.of(TopHcosHandler.LIMIT, 3));

        // Then
        assertThat(reply).isInstanceOf(ChatReply.Text.class);
        String text = reply.messages().get(0);
        assertThat(text).startsWith("Here are the top 3 HCOs with the highest ghost patients:");
        assertThat(text).contains(
                "1. **[Tyrone Hospital](#lookup-address:Tyrone%20Hospital)** (PA) - 300 ghost patients (30.0% leakage rate)");
        assertThat(text.indexOf("Tyrone Hospital")).isLessThan(text.indexOf("Mercy Medical"));
        assertThat(text.indexOf("Mercy Medical")).isLessThan(text.indexOf("Lakeside Clinic"));
        assertThat(text).contains("3. **[Lakeside Clinic](#lookup-address:Lakeside%20Clinic)** (MI) - 50 ghost patients (50.0% leakage rate)");
    }

    @Test
    @DisplayName("Should report when there is no data")
    void testHandleEmpty() {
        when(hcoRepository.findTopByGhostPatients(5)).thenReturn(List.of());

        assertThat(handler.handle(MatchResult.of(TopHcosHandler.LIMIT, 5)).messages())
                .containsExactly("No HCO data found.");
    }

    private static OrganizationRecord hco(String name, String state, int treated, int ghost) {
        return new OrganizationRecord(name.toLowerCase(Locale.ROOT), name, state, "East", treated, ghost,
                null, null, null, null);
    }
}
