package com.smurthy.ai.insights.model;

/**
 * An outcome-based contract template.
 */
public record ContractTemplate(
        String templateId,
        String name,
        String description,
        PatientOutcome outcome,
        int defaultTimeWindowMonths,
        int defaultRebatePercent
) {
}
