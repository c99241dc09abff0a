package com.smurthy.ai.insights.chat.handlers;

import com.smurthy.ai.insights.chat.ChatReply;
import com.smurthy.ai.insights.chat.IntentHandler;
import com.smurthy.ai.insights.chat.MatchResult;
import com.smurthy.ai.insights.model.ContractTemplate;
import com.smurthy.ai.insights.service.contract.ContractSimulationService;
import com.smurthy.ai.insights.service.contract.SimulationResult;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Expected rebate for an outcome-based contract.
 *
 * Must be registered before {@link ContractTemplatesHandler}: "what's the expected rebate for
 * the survival contract" also matches the template listing pattern.
 *
 * Examples:
 * - "what's the expected rebate for 12-month survival"
 * - "simulate toxicity contract"
 */
public class ContractSimulationHandler implements IntentHandler {

    public static final String TEMPLATE = "template";

    private static final Pattern PATTERN = Pattern.compile(
            "(?:simulate|rebate|expected|calculate).*(?:12-month|survival|toxicity|retreatment)",
            Pattern.CASE_INSENSITIVE);

    private final ContractSimulationService simulationService;

    public ContractSimulationHandler(ContractSimulationService simulationService) {
        this.simulationService = simulationService;
    }

    @Override
    public String getIntentName() {
        return "ContractSimulation";
    }

    @Override
    public Optional<MatchResult> matches(String message) {
        if (!PATTERN.matcher(message).find()) {
            return Optional.empty();
        }
        return Optional.of(MatchResult.of(TEMPLATE, SimulatedTemplate.resolve(message)));
    }

    @Override
    public ChatReply handle(MatchResult params) {
        String templateId = params.getEnum(TEMPLATE, SimulatedTemplate.class).templateId();

        Optional<ContractTemplate> template = simulationService.findTemplate(templateId);
        if (template.isEmpty()) {
            return ChatReply.text(String.format("Contract template '%s' not found.", templateId));
        }

        return simulationService.simulateWithDefaults(template.get())
                .map(ContractSimulationHandler::format)
                .map(ChatReply::text)
                .orElseGet(() -> ChatReply.text("Unable to simulate contract. Please check if patient data is available."));
    }

    private static String format(SimulationResult result) {
        ContractTemplate template = result.template();
        return String.join("\n",
                String.format("**Contract Simulation: %s**\n", template.name()),
                String.format("**Outcome Type:** %s", template.outcome().code()),
                String.format(Locale.US, "**Patient Cohort:** %,d patients\n", result.totalPatients()),
                "**Outcome Results:**",
                String.format(Locale.US, "- Failures: %,d patients (%.1f%%)", result.failureCount(), result.failureRate()),
                String.format(Locale.US, "- Successes: %,d patients (%.1f%%)\n", result.successCount(), result.successRate()),
                "**Financial Exposure:**",
                String.format(Locale.US, "- Expected rebate: $%,.2f", result.totalRebate()),
                String.format(Locale.US, "- Low estimate (-20%%): $%,.2f", result.lowRebate()),
                String.format(Locale.US, "- High estimate (+20%%): $%,.2f", result.highRebate()),
                String.format(Locale.US, "- Average per patient: $%,.2f", result.averageRebatePerPatient()));
    }
}
