package com.smurthy.ai.insights.chat;

import java.util.Optional;

/**
 * One supported intent: a pattern matcher paired with the routine that answers it.
 */
public interface IntentHandler {

    /**
     * Short name used in routing logs.
     */
    String getIntentName();

    /**
     * Decides whether the text belongs to this intent and extracts its parameters.
     * Must be side-effect free.
     */
    Optional<MatchResult> matches(String message);

    /**
     * Executes the intent with the parameters produced by {@link #matches(String)}.
     */
    ChatReply handle(MatchResult params);
}
