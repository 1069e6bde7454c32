package com.kreasipositif.ipcacorrection.service;

import com.kreasipositif.ipcacorrection.analysis.AnniversaryCalendar;
import com.kreasipositif.ipcacorrection.domain.CorrectionEntryType;
import com.kreasipositif.ipcacorrection.domain.CostAccount;
import com.kreasipositif.ipcacorrection.domain.Gap;
import com.kreasipositif.ipcacorrection.domain.GapAnalysisResult;
import com.kreasipositif.ipcacorrection.domain.Scenario;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Comparator;

/**
 * Picks the correction scenario from what the analysis found.
 */
@Component
@RequiredArgsConstructor
public class ScenarioClassifier {

    private final AnniversaryCalendar calendar;

    public Scenario classify(CostAccount account, GapAnalysisResult analysis) {
        boolean recovery = account.correctionsOrEmpty().stream()
                .anyMatch(c -> c.getType() == CorrectionEntryType.RECUPERACAO);
        boolean indexAfterGap = analysis.hasGaps() && hasIndexCorrectionAfterEarliestGap(account, analysis);
        return classify(analysis.hasGaps(), analysis.hasOutOfPeriod(), recovery, analysis.hasDuplicates(),
                indexAfterGap);
    }

    /**
     * Decision table; duplicates take precedence over everything else.
     */
    public static Scenario classify(boolean gaps, boolean outOfPeriod, boolean recovery, boolean duplicates,
                                    boolean indexAfterEarliestGap) {
        if (duplicates) {
            return Scenario.CENARIO_DUPLICATAS;
        }
        if (gaps && !outOfPeriod && !recovery && !indexAfterEarliestGap) {
            return Scenario.CENARIO_0;
        }
        if (gaps && (outOfPeriod || indexAfterEarliestGap) && !recovery) {
            return Scenario.CENARIO_1;
        }
        if ((gaps || outOfPeriod) && recovery) {
            return Scenario.CENARIO_2;
        }
        if (outOfPeriod && !gaps) {
            return Scenario.CENARIO_CORRECAO_FORA_APENAS;
        }
        return Scenario.CENARIO_COMPLEXO;
    }

    private boolean hasIndexCorrectionAfterEarliestGap(CostAccount account, GapAnalysisResult analysis) {
        Instant threshold = analysis.getGaps().stream()
                .map(Gap::period)
                .min(Comparator.naturalOrder())
                .map(calendar::lateWindowStart)
                .orElseThrow();
        return account.correctionsOrEmpty().stream()
                .filter(c -> c.isIndexCorrection())
                .anyMatch(c -> c.effectiveDate().filter(d -> d.isAfter(threshold)).isPresent());
    }
}
