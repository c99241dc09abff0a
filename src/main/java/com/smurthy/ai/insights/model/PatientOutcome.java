package com.smurthy.ai.insights.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Clinical outcomes a contract can be tied to, with the patient flag column that records each.
 */
public enum PatientOutcome {

    TWELVE_MONTH_SURVIVAL("12-month-survival", "has_event_12_month"),
    TOXICITY("toxicity", "has_toxicity_30_day"),
    RETREATMENT("retreatment", "has_retreatment_18_month");

    private final String code;
    private final String flagColumn;

    PatientOutcome(String code, String flagColumn) {
        this.code = code;
        this.flagColumn = flagColumn;
    }

    public String code() {
        return code;
    }

    public String flagColumn() {
        return flagColumn;
    }

    public static Optional<PatientOutcome> fromCode(String code) {
        return Arrays.stream(values())
                .filter(outcome -> outcome.code.equalsIgnoreCase(code))
                .findFirst();
    }
}
