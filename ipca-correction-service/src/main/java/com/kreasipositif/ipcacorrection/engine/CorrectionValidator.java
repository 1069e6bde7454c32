package com.kreasipositif.ipcacorrection.engine;

import com.kreasipositif.ipcacorrection.config.CorrectionProperties;
import com.kreasipositif.ipcacorrection.domain.CorrectionProposal;
import com.kreasipositif.ipcacorrection.domain.ProposalType;
import com.kreasipositif.ipcacorrection.domain.ValidationReport;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Sanity checks over a set of proposals before it is approved or applied.
 */
@Component
@RequiredArgsConstructor
public class CorrectionValidator {

    /** Signed adjustments and flag changes whose values are not balances. */
    private static final Set<ProposalType> VALUE_EXEMPT = EnumSet.of(
            ProposalType.REACTIVATION,
            ProposalType.DUPLICATA_REMOVAL,
            ProposalType.DUPLICATA_ADJUSTMENT,
            ProposalType.CORRECTION_DATE_CHANGE);

    private final CorrectionProperties properties;

    public ValidationReport validate(List<CorrectionProposal> proposals) {
        ValidationReport.ValidationReportBuilder report = ValidationReport.builder()
                .validatedCount(proposals.size());
        boolean valid = true;

        List<CorrectionProposal> dated = proposals.stream()
                .filter(p -> p.getType() != ProposalType.REACTIVATION && p.getTargetDate() != null)
                .sorted(Comparator.comparing(CorrectionProposal::getTargetDate))
                .toList();
        for (int i = 0; i + 1 < dated.size(); i++) {
            CorrectionProposal current = dated.get(i);
            CorrectionProposal next = dated.get(i + 1);
            if (!current.getTargetDate().isBefore(next.getTargetDate())) {
                report.warning("Temporal overlap: %s %s and %s %s share %s".formatted(
                        current.getType(), current.getTargetPeriod(),
                        next.getType(), next.getTargetPeriod(), next.getTargetDate()));
            }
        }

        for (CorrectionProposal proposal : proposals) {
            if (proposal.isUnresolvable()) {
                report.error("%s %s cannot be computed: %s".formatted(
                        proposal.getType(), proposal.getTargetPeriod(), proposal.getError()));
                valid = false;
                continue;
            }
            if (!VALUE_EXEMPT.contains(proposal.getType())) {
                int sign = proposal.getProposedValue().signum();
                if (sign < 0) {
                    report.error("%s %s has a negative corrected value %s".formatted(
                            proposal.getType(), proposal.getTargetPeriod(), proposal.getProposedValue()));
                    valid = false;
                } else if (sign == 0) {
                    report.warning("%s %s has a zero corrected value".formatted(
                            proposal.getType(), proposal.getTargetPeriod()));
                }
            }
            checkRate(proposal, report);
        }
        return report.valid(valid).build();
    }

    private void checkRate(CorrectionProposal proposal, ValidationReport.ValidationReportBuilder report) {
        BigDecimal rate = proposal.getRateApplied();
        if (rate == null || proposal.getType() == ProposalType.CORRECTION_DATE_CHANGE) {
            return;
        }
        if (rate.compareTo(properties.getSaneRateMin()) < 0 || rate.compareTo(properties.getSaneRateMax()) > 0) {
            report.warning("%s %s uses rate %s outside [%s, %s]".formatted(
                    proposal.getType(), proposal.getTargetPeriod(), rate,
                    properties.getSaneRateMin(), properties.getSaneRateMax()));
        }
        if (proposal.getType().isIndexProposal() && rate.compareTo(BigDecimal.ONE) == 0) {
            report.warning("%s %s uses a neutral rate of 1.0".formatted(
                    proposal.getType(), proposal.getTargetPeriod()));
        }
    }
}
