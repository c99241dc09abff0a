package com.smurthy.ai.insights.chat.handlers;

import com.smurthy.ai.insights.chat.ChatReply;
import com.smurthy.ai.insights.chat.FallbackHandler;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Keyword replies for messages no intent handler recognised.
 */
public class GeneralChatHandler implements FallbackHandler {

    private static final Pattern GREETING = Pattern.compile("\\b(?:hello|hi)\\b");

    private static final String SUGGESTIONS =
            "- 'Show me top 5 HCOs with highest ghost patients'\n"
                    + "- 'Show contract templates'\n"
                    + "- 'What's the expected rebate for 12-month survival?'\n";

    @Override
    public ChatReply handle(String message) {
        String lower = message.toLowerCase(Locale.ROOT);

        if (lower.contains("help")) {
            return ChatReply.text("I'm here to help! You can ask me about:\n\n"
                    + "**Data Insights:**\n"
                    + SUGGESTIONS
                    + "- 'Patient statistics' or 'Show patient demographics'\n"
                    + "- 'How many patients had toxicity events?'\n"
                    + "- 'What is the address of <HCO name>?'\n"
                    + "- 'Find papers by <author>'\n\n"
                    + "**Dashboard Features:**\n"
                    + "- Cohort analysis and metrics\n"
                    + "- Contract simulation\n"
                    + "- Ghost radar features");
        }
        if (lower.contains("dashboard")) {
            return ChatReply.text("The dashboard provides comprehensive analytics including cohort analysis, "
                    + "contract simulation, and ghost radar features. You can navigate between "
                    + "different sections using the sidebar.");
        }
        if (lower.contains("cohort")) {
            return ChatReply.text("The Cohort Overview shows key metrics like retention rates, engagement scores, "
                    + "and user growth. You can filter by different time periods to analyze trends.");
        }
        if (lower.contains("contract") && !lower.contains("simulate")) {
            return ChatReply.text("The Contract Simulator allows you to model different contract scenarios and "
                    + "see projected outcomes. You can ask me 'show contract templates' or "
                    + "'what's the expected rebate for 12-month survival?'");
        }
        if (lower.contains("ghost") || lower.contains("radar")) {
            return ChatReply.text("Ghost Radar helps identify inactive or at-risk users. It uses advanced analytics "
                    + "to detect patterns that might indicate user churn.");
        }
        if (GREETING.matcher(lower).find()) {
            return ChatReply.text("Hello! How can I assist you today?");
        }
        if (lower.contains("thank")) {
            return ChatReply.text("You're welcome! Feel free to ask if you need anything else.");
        }
        return ChatReply.text("I understand. Is there anything specific you'd like to know? You can ask me:\n"
                + SUGGESTIONS
                + "- 'Patient statistics' or 'How many patients had toxicity?'\n"
                + "- Or ask about dashboard features");
    }
}
