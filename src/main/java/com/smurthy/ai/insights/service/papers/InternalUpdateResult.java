package com.smurthy.ai.insights.service.papers;

/**
 * Result of merging external papers into the internal set.
 */
public record InternalUpdateResult(String authorName, Action action, int count) {

    public enum Action {
        /** No external papers were found, nothing was written. */
        NOTHING_EXTERNAL,
        /** The internal set was empty; {@code count} papers were inserted. */
        INSERTED,
        /** {@code count} existing internal papers received changed fields. */
        UPDATED
    }
}
