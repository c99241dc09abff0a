package com.smurthy.ai.insights.config;

import com.smurthy.ai.insights.chat.ChatDispatcher;
import com.smurthy.ai.insights.chat.IntentHandler;
import com.smurthy.ai.insights.chat.handlers.ContractSimulationHandler;
import com.smurthy.ai.insights.chat.handlers.ContractTemplatesHandler;
import com.smurthy.ai.insights.chat.handlers.DocumentQuestionHandler;
import com.smurthy.ai.insights.chat.handlers.GeneralChatHandler;
import com.smurthy.ai.insights.chat.handlers.HcoAddressHandler;
import com.smurthy.ai.insights.chat.handlers.PaperReconciliationHandler;
import com.smurthy.ai.insights.chat.handlers.PatientOutcomesHandler;
import com.smurthy.ai.insights.chat.handlers.PatientStatsHandler;
import com.smurthy.ai.insights.chat.handlers.TopHcosHandler;
import com.smurthy.ai.insights.repository.ContractRepository;
import com.smurthy.ai.insights.repository.HcoRepository;
import com.smurthy.ai.insights.repository.PaperRepository;
import com.smurthy.ai.insights.repository.PatientRepository;
import com.smurthy.ai.insights.service.address.AddressResolutionService;
import com.smurthy.ai.insights.service.contract.ContractSimulationService;
import com.smurthy.ai.insights.service.documents.ChatClientDocumentQaService;
import com.smurthy.ai.insights.service.documents.DocumentQaService;
import com.smurthy.ai.insights.service.papers.PaperComparator;
import com.smurthy.ai.insights.service.papers.PaperReconciliationService;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.vectorstore.VectorStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;

import java.util.List;

/**
 * Builds the intent handlers and the dispatcher that routes chat messages to them.
 */
@Configuration
public class ChatDispatcherConfiguration {

    @Bean
    public PaperReconciliationService paperReconciliationService(PaperRepository paperRepository,
                                                                 InsightsProperties properties) {
        return new PaperReconciliationService(paperRepository, new PaperComparator(),
                properties.chat().paperSearchLimit());
    }

    @Bean
    public ContractSimulationService contractSimulationService(ContractRepository contractRepository,
                                                               PatientRepository patientRepository) {
        return new ContractSimulationService(contractRepository, patientRepository);
    }

    @Bean
    public DocumentQaService documentQaService(ChatClient.Builder chatClientBuilder, VectorStore vectorStore,
                                               RetryTemplate retryTemplate, InsightsProperties properties) {
        return new ChatClientDocumentQaService(chatClientBuilder, vectorStore, retryTemplate,
                properties.documents().topK(), properties.documents().similarityThreshold());
    }

    /**
     * Handlers in priority order. Specific patterns come before the general ones they overlap
     * with: contract simulation before template listing, patient outcomes before patient stats.
     */
    @Bean
    public ChatDispatcher chatDispatcher(HcoRepository hcoRepository,
                                         PatientRepository patientRepository,
                                         AddressResolutionService addressResolutionService,
                                         PaperReconciliationService paperReconciliationService,
                                         DocumentQaService documentQaService,
                                         ContractSimulationService contractSimulationService,
                                         InsightsProperties properties) {
        List<IntentHandler> handlers = List.of(
                new TopHcosHandler(hcoRepository, properties.chat()),
                new HcoAddressHandler(addressResolutionService),
                new PaperReconciliationHandler(paperReconciliationService),
                new DocumentQuestionHandler(documentQaService),
                new ContractSimulationHandler(contractSimulationService),
                new ContractTemplatesHandler(contractSimulationService),
                new PatientOutcomesHandler(patientRepository),
                new PatientStatsHandler(patientRepository));
        return new ChatDispatcher(handlers, new GeneralChatHandler());
    }
}
