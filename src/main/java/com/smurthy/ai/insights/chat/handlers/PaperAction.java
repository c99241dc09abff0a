package com.smurthy.ai.insights.chat.handlers;

/**
 * Step of the paper reconciliation flow requested by a message.
 */
public enum PaperAction {
    SEARCH,
    FETCH_EXTERNAL,
    UPDATE_INTERNAL
}
