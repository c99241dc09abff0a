package com.smurthy.ai.insights.service.contract;

import com.smurthy.ai.insights.model.ContractTemplate;
import com.smurthy.ai.insights.model.PatientOutcome;
import com.smurthy.ai.insights.repository.ContractRepository;
import com.smurthy.ai.insights.repository.PatientRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ContractSimulationServiceTest {

    private static final ContractTemplate SURVIVAL = new ContractTemplate(
            "survival-12m", "12-Month Survival", "Rebate on death or escalation",
            PatientOutcome.TWELVE_MONTH_SURVIVAL, 12, 50);

    @Mock
    private ContractRepository contractRepository;

    @Mock
    private PatientRepository patientRepository;

    private ContractSimulationService service;

    @BeforeEach
    void setUp() {
        service = new ContractSimulationService(contractRepository, patientRepository);
    }

    @Test
    @DisplayName("Should compute rebate exposure from the failure count")
    void testSimulate() {
        // Given
        when(patientRepository.countAll()).thenReturn(100L);
        when(patientRepository.countWithOutcome(PatientOutcome.TWELVE_MONTH_SURVIVAL)).thenReturn(25L);

        // When
        SimulationResult result = service.simulateWithDefaults(SURVIVAL).orElseThrow();

        // Then
        assertThat(result.failureRate()).isEqualTo(25.0);
        assertThat(result.successCount()).isEqualTo(75);
        assertThat(result.successRate()).isEqualTo(75.0);
        assertThat(result.rebatePerPatient()).isEqualTo(75_000.0);
        assertThat(result.totalRebate()).isEqualTo(1_875_000.0);
        assertThat(result.lowRebate()).isCloseTo(1_500_000.0, within(0.001));
        assertThat(result.highRebate()).isCloseTo(2_250_000.0, within(0.001));
        assertThat(result.averageRebatePerPatient()).isEqualTo(18_750.0);
    }

    @Test
    @DisplayName("Should round the failure rate to one decimal")
    void testFailureRateRounding() {
        when(patientRepository.countAll()).thenReturn(3L);
        when(patientRepository.countWithOutcome(PatientOutcome.TWELVE_MONTH_SURVIVAL)).thenReturn(1L);

        SimulationResult result = service.simulate(SURVIVAL, 20, 100_000).orElseThrow();

        assertThat(result.failureRate()).isEqualTo(33.3);
        assertThat(result.successRate()).isEqualTo(66.7);
        assertThat(result.totalRebate()).isEqualTo(20_000.0);
    }

    @Test
    @DisplayName("Should not simulate an empty cohort")
    void testNoPatients() {
        when(patientRepository.countAll()).thenReturn(0L);

        assertThat(service.simulateWithDefaults(SURVIVAL)).isEmpty();

        verify(patientRepository).countAll();
        verifyNoMoreInteractions(patientRepository);
    }

    @Test
    @DisplayName("Should look templates up through the repository")
    void testFindTemplate() {
        when(contractRepository.findTemplate("survival-12m")).thenReturn(Optional.of(SURVIVAL));

        assertThat(service.findTemplate("survival-12m")).contains(SURVIVAL);
    }
}
