package com.smurthy.ai.insights.service.papers;

/**
 * Outcome of comparing one field of an internal paper against its external counterpart.
 */
public enum DiffStatus {
    IDENTICAL,
    /** Empty internally, present externally. */
    MISSING_INTERNAL,
    /** Present on both sides with different values. */
    DIFFERENT
}
