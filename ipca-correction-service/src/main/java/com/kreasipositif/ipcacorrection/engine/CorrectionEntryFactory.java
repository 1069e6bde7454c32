package com.kreasipositif.ipcacorrection.engine;

import com.kreasipositif.ipcacorrection.domain.CorrectionEntryType;
import com.kreasipositif.ipcacorrection.domain.CorrectionProposal;
import com.kreasipositif.ipcacorrection.domain.CostAccount;
import com.kreasipositif.ipcacorrection.domain.MonetaryCorrection;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Turns approved proposals into timeline entries.
 */
@Component
@RequiredArgsConstructor
public class CorrectionEntryFactory {

    static final String SUB_TYPE_RETIFICACAO = "RETIFICACAO";
    static final String SUB_TYPE_COMPENSACAO = "COMPENSACAO";
    static final String SUB_TYPE_VIGENTE = "VIGENTE";

    private static final DateTimeFormatter OBSERVATION_DATE = DateTimeFormatter.ofPattern("dd/MM/yyyy");

    private final Clock clock;

    /** IPCA entry for a missing anniversary, dated on the proposal's target date. */
    public MonetaryCorrection gapEntry(CostAccount account, CorrectionProposal proposal) {
        return fromRoot(account, proposal, CorrectionEntryType.IPCA, SUB_TYPE_RETIFICACAO)
                .correctionDate(proposal.getTargetDate())
                .build();
    }

    /** IPCA entry for the anniversary of the current year. */
    public MonetaryCorrection currentYearEntry(CostAccount account, CorrectionProposal proposal) {
        return fromRoot(account, proposal, CorrectionEntryType.IPCA, SUB_TYPE_VIGENTE)
                .correctionDate(proposal.getTargetDate())
                .build();
    }

    /** Rectification carrying a compensation, dated now. */
    public MonetaryCorrection compensationEntry(CostAccount account, CorrectionProposal proposal) {
        return fromRoot(account, proposal, CorrectionEntryType.RETIFICACAO, SUB_TYPE_COMPENSACAO)
                .correctionDate(clock.instant())
                .rateApplied(BigDecimal.ONE)
                .build();
    }

    /**
     * Rectification that takes {@code |total|} off the balance after duplicated entries were removed.
     * Amount fields are copied from the last remaining entry, or from the root when none is left.
     */
    public MonetaryCorrection duplicateAdjustmentEntry(CostAccount account, BigDecimal total,
                                                       List<String> removedPeriods) {
        BigDecimal lastValue = account.currentValue();
        BigDecimal newValue = lastValue.subtract(total.abs());
        MonetaryCorrection.MonetaryCorrectionBuilder builder = account.lastCorrection()
                .map(MonetaryCorrection::toBuilder)
                .orElseGet(() -> rootAmounts(account));
        return builder
                .type(CorrectionEntryType.RETIFICACAO)
                .subType(SUB_TYPE_COMPENSACAO)
                .correctionDate(clock.instant())
                .creationDate(clock.instant())
                .recognizedValueWithOverhead(newValue)
                .originalValueBeforeCorrection(lastValue)
                .differenceValue(total)
                .rateApplied(BigDecimal.ONE)
                .active(true)
                .transfer(false)
                .observation("Ajuste por remoção de duplicata(s): %s - Aplicado em %s"
                        .formatted(String.join(", ", removedPeriods), today()))
                .build();
    }

    private MonetaryCorrection.MonetaryCorrectionBuilder fromRoot(CostAccount account, CorrectionProposal proposal,
                                                                  CorrectionEntryType type, String subType) {
        return rootAmounts(account)
                .type(type)
                .subType(subType)
                .creationDate(clock.instant())
                .recognizedValueWithOverhead(proposal.getProposedValue())
                .originalValueBeforeCorrection(proposal.getCurrentValue())
                .differenceValue(proposal.getProposedValue().subtract(proposal.getCurrentValue()))
                .rateApplied(proposal.getRateApplied())
                .accumulatedIndex(BigDecimal.ZERO)
                .accumulatedIndexAmount(BigDecimal.ZERO)
                .active(true)
                .transfer(false)
                .observation("%s - Aplicado em %s".formatted(proposal.getDescription(), today()));
    }

    private MonetaryCorrection.MonetaryCorrectionBuilder rootAmounts(CostAccount account) {
        return MonetaryCorrection.builder()
                .contractCode(account.getContractCode())
                .fieldCode(account.getFieldCode())
                .recognizedValue(account.getRecognizedValue())
                .overheadTotal(account.getOverheadTotal())
                .overheadExploration(account.getOverheadExploration())
                .overheadProduction(account.getOverheadProduction())
                .recognizedValueExploration(account.getRecognizedValueExploration())
                .recognizedValueProduction(account.getRecognizedValueProduction())
                .launchTotalValue(account.getLaunchTotalValue())
                .nonRecognizedValue(account.getNonRecognizedValue())
                .recoverableValue(account.getRecoverableValue())
                .nonRecoverableValue(account.getNonRecoverableValue())
                .launchCount(account.getLaunchCount())
                .shipmentPhase(account.getShipmentPhase());
    }

    String today() {
        return LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC).format(OBSERVATION_DATE);
    }
}
