package com.smurthy.ai.insights.chat;

/**
 * Answers messages that no intent handler matched.
 */
@FunctionalInterface
public interface FallbackHandler {

    ChatReply handle(String message);
}
