package com.kreasipositif.ipcacorrection.engine;

import com.kreasipositif.ipcacorrection.config.CorrectionProperties;
import com.kreasipositif.ipcacorrection.domain.CorrectionProposal;
import com.kreasipositif.ipcacorrection.domain.ProposalType;
import com.kreasipositif.ipcacorrection.domain.Scenario;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static com.kreasipositif.ipcacorrection.support.CostAccountFixtures.at;
import static org.assertj.core.api.Assertions.assertThat;

class CorrectionValidatorTest {

    private final CorrectionValidator validator = new CorrectionValidator(new CorrectionProperties());

    // ─── Valid sets ──────────────────────────────────────────────────────────────

    @Test
    @DisplayName("VALID — distinct dates with sane rates produce no findings")
    void validate_cleanSet() {
        var report = validator.validate(List.of(
                proposal("p1", ProposalType.IPCA_ADDITION, "2023-03-16", "1050000", "1.05"),
                proposal("p2", ProposalType.IPCA_UPDATE, "2024-03-16", "1081500", "1.03")));

        assertThat(report.isValid()).isTrue();
        assertThat(report.getValidatedCount()).isEqualTo(2);
        assertThat(report.getWarnings()).isEmpty();
        assertThat(report.getErrors()).isEmpty();
    }

    @Test
    @DisplayName("VALID — signed adjustments may be negative")
    void validate_negativeDuplicateAdjustmentIsAllowed() {
        var report = validator.validate(List.of(
                proposal("p1", ProposalType.DUPLICATA_ADJUSTMENT, "2023-03-28", "-54075", null)));

        assertThat(report.isValid()).isTrue();
        assertThat(report.getErrors()).isEmpty();
    }

    // ─── Warnings ────────────────────────────────────────────────────────────────

    @Test
    @DisplayName("WARNING — two proposals on the same date overlap")
    void validate_sameDateIsAnOverlap() {
        var report = validator.validate(List.of(
                proposal("p1", ProposalType.IPCA_ADDITION, "2024-03-16", "1050000", "1.05"),
                proposal("p2", ProposalType.IPCA_UPDATE, "2024-03-16", "1081500", "1.03")));

        assertThat(report.isValid()).isTrue();
        assertThat(report.getWarnings()).anyMatch(w -> w.startsWith("Temporal overlap"));
    }

    @Test
    void validate_reactivationIsNotPartOfTheOverlapCheck() {
        var report = validator.validate(List.of(
                proposal("p1", ProposalType.COMPENSATION, "2025-01-20", "51500", "1"),
                proposal("p2", ProposalType.REACTIVATION, "2025-01-20", "50000", null)));

        assertThat(report.getWarnings()).noneMatch(w -> w.startsWith("Temporal overlap"));
    }

    @Test
    void validate_rateOutsideBoundsAndNeutralRateAreWarned() {
        var report = validator.validate(List.of(
                proposal("p1", ProposalType.IPCA_ADDITION, "2023-03-16", "2500000", "2.5"),
                proposal("p2", ProposalType.IPCA_ADDITION, "2024-03-16", "2500000", "1")));

        assertThat(report.isValid()).isTrue();
        assertThat(report.getWarnings()).hasSize(2);
        assertThat(report.getWarnings().get(0)).contains("outside");
        assertThat(report.getWarnings().get(1)).contains("neutral rate");
    }

    @Test
    void validate_zeroValueIsOnlyAWarning() {
        var report = validator.validate(List.of(
                proposal("p1", ProposalType.IPCA_ADDITION, "2023-03-16", "0", "1.05")));

        assertThat(report.isValid()).isTrue();
        assertThat(report.getWarnings()).singleElement().asString().contains("zero corrected value");
    }

    // ─── Errors ──────────────────────────────────────────────────────────────────

    @Test
    @DisplayName("INVALID — negative corrected balance")
    void validate_negativeBalanceIsAnError() {
        var report = validator.validate(List.of(
                proposal("p1", ProposalType.IPCA_ADDITION, "2023-03-16", "-10", "1.05")));

        assertThat(report.isValid()).isFalse();
        assertThat(report.getErrors()).singleElement().asString().contains("negative corrected value");
    }

    @Test
    @DisplayName("INVALID — proposal whose rate could not be found")
    void validate_unresolvableProposalIsAnError() {
        var unresolvable = proposal("p1", ProposalType.IPCA_ADDITION, "2024-01-16", "0", null).toBuilder()
                .error("Taxa IPCA não encontrada para 12/2023")
                .build();

        var report = validator.validate(List.of(unresolvable));

        assertThat(report.isValid()).isFalse();
        assertThat(report.getErrors()).singleElement().asString().contains("Taxa IPCA não encontrada");
    }

    // ─── Helpers ─────────────────────────────────────────────────────────────────

    private CorrectionProposal proposal(String id, ProposalType type, String date, String value, String rate) {
        return CorrectionProposal.builder()
                .id(id)
                .type(type)
                .scenario(Scenario.CENARIO_0)
                .targetDate(at(date))
                .targetPeriod(date.substring(5, 7) + "/" + date.substring(0, 4))
                .baseValue(BigDecimal.ZERO)
                .currentValue(BigDecimal.ZERO)
                .proposedValue(new BigDecimal(value))
                .impact(BigDecimal.ZERO)
                .rateApplied(rate == null ? null : new BigDecimal(rate))
                .build();
    }
}
