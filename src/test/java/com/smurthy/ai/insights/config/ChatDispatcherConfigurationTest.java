package com.smurthy.ai.insights.config;

import com.smurthy.ai.insights.chat.ChatDispatcher;
import com.smurthy.ai.insights.chat.IntentHandler;
import com.smurthy.ai.insights.repository.HcoRepository;
import com.smurthy.ai.insights.repository.PatientRepository;
import com.smurthy.ai.insights.service.address.AddressResolutionService;
import com.smurthy.ai.insights.service.contract.ContractSimulationService;
import com.smurthy.ai.insights.service.documents.DocumentQaService;
import com.smurthy.ai.insights.service.papers.PaperReconciliationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Routing tests against the handler list the application actually wires.
 */
@ExtendWith(MockitoExtension.class)
class ChatDispatcherConfigurationTest {

    @Mock
    private HcoRepository hcoRepository;

    @Mock
    private PatientRepository patientRepository;

    @Mock
    private AddressResolutionService addressResolutionService;

    @Mock
    private PaperReconciliationService paperReconciliationService;

    @Mock
    private DocumentQaService documentQaService;

    @Mock
    private ContractSimulationService contractSimulationService;

    private ChatDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        dispatcher = new ChatDispatcherConfiguration().chatDispatcher(hcoRepository, patientRepository,
                addressResolutionService, paperReconciliationService, documentQaService,
                contractSimulationService, InsightsProperties.defaults());
    }

    @Test
    @DisplayName("Should register the handlers in priority order")
    void testHandlerOrder() {
        assertThat(dispatcher.getHandlers())
                .extracting(IntentHandler::getIntentName)
                .containsExactly("TopHcos", "HcoAddress", "PaperReconciliation", "DocumentQuestion",
                        "ContractSimulation", "ContractTemplates", "PatientOutcomes", "PatientStats");
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource(delimiter = '|', value = {
            "top 5 HCOs with highest ghost patients | TopHcos",
            "What is the address of Tyrone Hospital? | HcoAddress",
            "Find papers by Kahraman E | PaperReconciliation",
            "What do the documents say about CRS management? | DocumentQuestion",
            "what is the expected rebate for toxicity contract | ContractSimulation",
            "show contract templates | ContractTemplates",
            "how many patients had toxicity events | PatientOutcomes",
            "toxicity rate by patient age | PatientOutcomes",
            "patient statistics | PatientStats"
    })
    @DisplayName("Should route each message to the first matching handler")
    void testRouting(String message, String expectedIntent) {
        // Given the wired dispatcher

        // When
        Optional<String> intent = firstMatchingIntent(message);

        // Then
        assertThat(intent).contains(expectedIntent);
    }

    @Test
    @DisplayName("Should leave small talk to the fallback handler")
    void testSmallTalkFallsThrough() {
        // Given
        String message = "hello there";

        // When
        Optional<String> intent = firstMatchingIntent(message);

        // Then
        assertThat(intent).isEmpty();
        assertThat(dispatcher.dispatch(message).messages().get(0)).startsWith("Hello!");
    }

    private Optional<String> firstMatchingIntent(String message) {
        return dispatcher.getHandlers().stream()
                .filter(handler -> handler.matches(message).isPresent())
                .findFirst()
                .map(IntentHandler::getIntentName);
    }
}
