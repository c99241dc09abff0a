package com.smurthy.ai.insights.model;

import java.util.Map;

/**
 * Aggregated cohort statistics. Distributions map a label to a patient count.
 */
public record PatientStats(
        long totalPatients,
        long averageAge,
        long malePercent,
        double averagePriorLines,
        Map<String, Long> payerDistribution,
        Map<String, Long> regionDistribution,
        Map<String, Long> ageBuckets,
        long toxicityCount,
        long event12MonthCount,
        long retreatment18MonthCount
) {

    public long femalePercent() {
        return 100 - malePercent;
    }

    public long percentOf(long count) {
        return totalPatients > 0 ? Math.round(count * 100.0 / totalPatients) : 0;
    }
}
