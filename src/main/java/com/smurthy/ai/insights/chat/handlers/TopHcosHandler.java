package com.smurthy.ai.insights.chat.handlers;

import com.smurthy.ai.insights.chat.ActionToken;
import com.smurthy.ai.insights.chat.ChatReply;
import com.smurthy.ai.insights.chat.IntentHandler;
import com.smurthy.ai.insights.chat.MatchResult;
import com.smurthy.ai.insights.chat.TextParams;
import com.smurthy.ai.insights.config.InsightsProperties;
import com.smurthy.ai.insights.model.OrganizationRecord;
import com.smurthy.ai.insights.repository.HcoRepository;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * "Top N HCOs by ghost patients".
 *
 * Examples:
 * - "show me top 5 HCOs with highest ghost patients"
 * - "top hcos by ghost patients" (defaults to 5)
 */
public class TopHcosHandler implements IntentHandler {

    public static final String LIMIT = "limit";

    private static final Pattern PATTERN =
            Pattern.compile("top\\s+(\\d+)?\\s*hcos?.*(?:ghost|patients?)", Pattern.CASE_INSENSITIVE);

    private final HcoRepository hcoRepository;
    private final int defaultLimit;
    private final int maxLimit;

    public TopHcosHandler(HcoRepository hcoRepository, InsightsProperties.Chat chatProperties) {
        this.hcoRepository = hcoRepository;
        this.defaultLimit = chatProperties.defaultTopLimit();
        this.maxLimit = chatProperties.maxTopLimit();
    }

    @Override
    public String getIntentName() {
        return "TopHcos";
    }

    @Override
    public Optional<MatchResult> matches(String message) {
        Matcher matcher = PATTERN.matcher(message);
        if (!matcher.find()) {
            return Optional.empty();
        }
        int limit = TextParams.clampedCount(matcher.group(1), defaultLimit, maxLimit);
        return Optional.of(MatchResult.of(LIMIT, limit));
    }

    @Override
    public ChatReply handle(MatchResult params) {
        int limit = params.getInt(LIMIT, defaultLimit);
        List<OrganizationRecord> hcos = hcoRepository.findTopByGhostPatients(limit);

        if (hcos.isEmpty()) {
            return ChatReply.text("No HCO data found.");
        }

        List<String> lines = new ArrayList<>();
        lines.add(String.format("Here are the top %d HCOs with the highest ghost patients:\n", hcos.size()));

        for (int i = 0; i < hcos.size(); i++) {
            OrganizationRecord hco = hcos.get(i);
            lines.add(String.format(Locale.US, "%d. **%s** (%s) - %,d ghost patients (%.1f%% leakage rate)",
                    i + 1,
                    ActionToken.lookupAddress(hco.name()).toMarkdown(hco.name()),
                    hco.state() != null ? hco.state() : "??",
                    hco.ghostPatients(),
                    hco.leakageRate() * 100));
        }

        return ChatReply.text(String.join("\n", lines));
    }
}
