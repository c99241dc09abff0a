package com.smurthy.ai.insights.repository;

import com.smurthy.ai.insights.model.PatientOutcome;
import com.smurthy.ai.insights.model.PatientStats;

import java.util.Optional;

public interface PatientRepository {

    long countAll();

    long countWithOutcome(PatientOutcome outcome);

    /**
     * Cohort statistics, or empty when there are no patients.
     */
    Optional<PatientStats> loadStats();
}
