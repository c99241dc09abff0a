package com.smurthy.ai.insights.chat.handlers;

import com.smurthy.ai.insights.chat.ChatReply;
import com.smurthy.ai.insights.chat.IntentHandler;
import com.smurthy.ai.insights.chat.MatchResult;
import com.smurthy.ai.insights.model.ContractTemplate;
import com.smurthy.ai.insights.service.contract.ContractSimulationService;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Lists the available contract templates, e.g. "show contract templates".
 */
public class ContractTemplatesHandler implements IntentHandler {

    private static final Pattern PATTERN =
            Pattern.compile("(?:show|list|what|get).*(?:contract|template)s?", Pattern.CASE_INSENSITIVE);

    private final ContractSimulationService simulationService;

    public ContractTemplatesHandler(ContractSimulationService simulationService) {
        this.simulationService = simulationService;
    }

    @Override
    public String getIntentName() {
        return "ContractTemplates";
    }

    @Override
    public Optional<MatchResult> matches(String message) {
        return PATTERN.matcher(message).find() ? Optional.of(MatchResult.empty()) : Optional.empty();
    }

    @Override
    public ChatReply handle(MatchResult params) {
        List<ContractTemplate> templates = simulationService.listTemplates();
        if (templates.isEmpty()) {
            return ChatReply.text("No contract templates found.");
        }

        List<String> lines = new ArrayList<>();
        lines.add(String.format("Here are the available contract templates (%d total):\n", templates.size()));
        for (int i = 0; i < templates.size(); i++) {
            ContractTemplate template = templates.get(i);
            lines.add(String.format("%d. **%s**\n   - Outcome: %s\n   - Default rebate: %d%%\n   - Time window: %d months",
                    i + 1,
                    template.name(),
                    template.outcome().code(),
                    template.defaultRebatePercent(),
                    template.defaultTimeWindowMonths()));
        }
        return ChatReply.text(String.join("\n", lines));
    }
}
