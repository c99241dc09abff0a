package com.smurthy.ai.insights.service.contract;

import com.smurthy.ai.insights.model.ContractTemplate;

/**
 * Projected rebate exposure of an outcome-based contract over the current patient cohort.
 * Rates are percentages rounded to one decimal; amounts are in dollars.
 */
public record SimulationResult(
        ContractTemplate template,
        int rebatePercent,
        double therapyPrice,
        long totalPatients,
        long failureCount,
        double failureRate,
        double rebatePerPatient,
        double totalRebate,
        double lowRebate,
        double highRebate,
        double averageRebatePerPatient
) {

    public long successCount() {
        return totalPatients - failureCount;
    }

    public double successRate() {
        return Math.round((100 - failureRate) * 10) / 10.0;
    }
}
