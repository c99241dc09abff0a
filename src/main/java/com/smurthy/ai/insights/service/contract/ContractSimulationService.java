package com.smurthy.ai.insights.service.contract;

import com.smurthy.ai.insights.model.ContractTemplate;
import com.smurthy.ai.insights.repository.ContractRepository;
import com.smurthy.ai.insights.repository.PatientRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Contract template access and rebate exposure simulation.
 */
public class ContractSimulationService {

    private static final Logger log = LoggerFactory.getLogger(ContractSimulationService.class);

    public static final double DEFAULT_THERAPY_PRICE = 150_000;

    // -20% / +20% sensitivity
    private static final double LOW_FACTOR = 0.8;
    private static final double HIGH_FACTOR = 1.2;

    private final ContractRepository contractRepository;
    private final PatientRepository patientRepository;

    public ContractSimulationService(ContractRepository contractRepository, PatientRepository patientRepository) {
        this.contractRepository = contractRepository;
        this.patientRepository = patientRepository;
    }

    public List<ContractTemplate> listTemplates() {
        return contractRepository.findAllTemplates();
    }

    public Optional<ContractTemplate> findTemplate(String templateId) {
        return contractRepository.findTemplate(templateId);
    }

    /**
     * Simulates a template with its default rebate and the default therapy price.
     */
    public Optional<SimulationResult> simulateWithDefaults(ContractTemplate template) {
        return simulate(template, template.defaultRebatePercent(), DEFAULT_THERAPY_PRICE);
    }

    /**
     * Every patient flagged with the template's outcome is a failure that triggers a rebate of
     * {@code therapyPrice * rebatePercent / 100}. Empty when there are no patients.
     */
    public Optional<SimulationResult> simulate(ContractTemplate template, int rebatePercent, double therapyPrice) {
        long totalPatients = patientRepository.countAll();
        if (totalPatients == 0) {
            log.warn("No patients available to simulate template {}", template.templateId());
            return Optional.empty();
        }

        long failureCount = patientRepository.countWithOutcome(template.outcome());
        double failureRate = Math.round(failureCount * 1000.0 / totalPatients) / 10.0;

        double rebatePerPatient = therapyPrice * rebatePercent / 100;
        double totalRebate = failureCount * rebatePerPatient;

        log.info("Simulated {}: {} of {} patients failed, total rebate {}",
                template.templateId(), failureCount, totalPatients, totalRebate);

        return Optional.of(new SimulationResult(
                template,
                rebatePercent,
                therapyPrice,
                totalPatients,
                failureCount,
                failureRate,
                rebatePerPatient,
                totalRebate,
                totalRebate * LOW_FACTOR,
                totalRebate * HIGH_FACTOR,
                totalRebate / totalPatients));
    }
}
