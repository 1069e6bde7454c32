package com.kreasipositif.ipcacorrection.service;

import com.kreasipositif.ipcacorrection.analysis.GapAnalyzer;
import com.kreasipositif.ipcacorrection.config.CorrectionProperties;
import com.kreasipositif.ipcacorrection.domain.CostAccount;
import com.kreasipositif.ipcacorrection.domain.CostAccountFilter;
import com.kreasipositif.ipcacorrection.domain.Gap;
import com.kreasipositif.ipcacorrection.domain.GapAnalysisResult;
import com.kreasipositif.ipcacorrection.domain.Money;
import com.kreasipositif.ipcacorrection.dto.FinancialImpactEstimate;
import com.kreasipositif.ipcacorrection.dto.GapSurveyReport;
import com.kreasipositif.ipcacorrection.dto.GapSurveyReport.AccountFindings;
import com.kreasipositif.ipcacorrection.repository.CostAccountRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Runs the gap analysis across every cost account matching a filter.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GapSurveyService {

    private static final int TOP_CONTRACTS = 5;
    private static final int TOP_YEARS = 3;

    private final CostAccountRepository costAccountRepository;
    private final GapAnalyzer gapAnalyzer;
    private final CorrectionProperties properties;
    private final Clock clock;

    // ─── Public API ──────────────────────────────────────────────────────────────

    public GapSurveyReport survey(CostAccountFilter filter) {
        List<CostAccount> accounts = costAccountRepository.findAll(filter);
        log.info("Surveying {} cost account(s) for filter {}", accounts.size(), filter);

        int withGaps = 0;
        int totalGaps = 0;
        int withOutOfPeriod = 0;
        int totalOutOfPeriod = 0;
        int withDuplicates = 0;
        int totalDuplicates = 0;
        Map<Integer, Integer> gapsByYear = new TreeMap<>();
        Map<String, Integer> gapsByContract = new TreeMap<>();
        Map<String, Integer> outOfPeriodByContract = new TreeMap<>();
        BigDecimal impactedValue = BigDecimal.ZERO;
        List<AccountFindings> findings = new ArrayList<>();

        for (CostAccount account : accounts) {
            GapAnalysisResult analysis = gapAnalyzer.analyze(account);
            String contract = account.getContractCode() != null ? account.getContractCode() : "N/A";

            if (analysis.hasGaps()) {
                withGaps++;
                totalGaps += analysis.getGaps().size();
                impactedValue = impactedValue.add(account.currentValue());
                gapsByContract.merge(contract, analysis.getGaps().size(), Integer::sum);
                analysis.getGaps().forEach(g -> gapsByYear.merge(g.getYear(), 1, Integer::sum));
            }
            if (analysis.hasOutOfPeriod()) {
                withOutOfPeriod++;
                totalOutOfPeriod += analysis.getOutOfPeriodCorrections().size();
                outOfPeriodByContract.merge(contract, analysis.getOutOfPeriodCorrections().size(), Integer::sum);
            }
            if (analysis.hasDuplicates()) {
                withDuplicates++;
                totalDuplicates += analysis.getDuplicates().size();
            }
            if (analysis.hasGaps() || analysis.hasOutOfPeriod() || analysis.hasDuplicates()) {
                findings.add(AccountFindings.builder()
                        .entityId(account.getId())
                        .contractCode(account.getContractCode())
                        .fieldCode(account.getFieldCode())
                        .recognitionDate(account.getRecognitionDate())
                        .currentValue(account.currentValue())
                        .gaps(analysis.getGaps())
                        .outOfPeriod(analysis.getOutOfPeriodCorrections())
                        .duplicates(analysis.getDuplicates())
                        .build());
            }
        }

        log.info("Survey done: {} account(s) with gaps ({} gaps), {} with late corrections, {} with duplicates",
                withGaps, totalGaps, withOutOfPeriod, withDuplicates);

        return GapSurveyReport.builder()
                .analyzedAt(clock.instant())
                .filter(filter)
                .statistics(GapSurveyReport.Statistics.builder()
                        .totalAnalyzed(accounts.size())
                        .withGaps(withGaps)
                        .totalGaps(totalGaps)
                        .withOutOfPeriod(withOutOfPeriod)
                        .totalOutOfPeriod(totalOutOfPeriod)
                        .withDuplicates(withDuplicates)
                        .totalDuplicates(totalDuplicates)
                        .gapsByYear(gapsByYear)
                        .gapsByContract(gapsByContract)
                        .outOfPeriodByContract(outOfPeriodByContract)
                        .totalImpactedValue(impactedValue)
                        .build())
                .accounts(findings)
                .build();
    }

    public FinancialImpactEstimate estimateFinancialImpact(GapSurveyReport report) {
        return estimateFinancialImpact(report, properties.getEstimatedImpactRate());
    }

    /**
     * Σ gap base × {@code rate}, per contract and per anniversary year.
     */
    public FinancialImpactEstimate estimateFinancialImpact(GapSurveyReport report, BigDecimal rate) {
        Map<String, BigDecimal> byContract = new TreeMap<>();
        Map<Integer, BigDecimal> byYear = new TreeMap<>();
        BigDecimal total = BigDecimal.ZERO;
        for (AccountFindings account : report.getAccounts()) {
            String contract = account.getContractCode() != null ? account.getContractCode() : "N/A";
            for (Gap gap : account.getGaps()) {
                BigDecimal impact = Money.multiply(gap.getBaseValue(), rate);
                total = total.add(impact);
                byContract.merge(contract, impact, BigDecimal::add);
                byYear.merge(gap.getYear(), impact, BigDecimal::add);
            }
        }
        BigDecimal impacted = report.getStatistics().getTotalImpactedValue();
        BigDecimal percent = Money.isPositive(impacted)
                ? total.multiply(BigDecimal.valueOf(100)).divide(impacted, Money.SCALE, Money.ROUNDING)
                : BigDecimal.ZERO;
        return FinancialImpactEstimate.builder()
                .estimatedRate(rate)
                .totalEstimatedImpact(total)
                .impactByContract(byContract)
                .impactByYear(byYear)
                .percentOfImpactedValue(percent)
                .build();
    }

    /** Plain-text executive summary of a survey. */
    public String summarize(GapSurveyReport report) {
        GapSurveyReport.Statistics stats = report.getStatistics();
        FinancialImpactEstimate estimate = estimateFinancialImpact(report);
        StringBuilder text = new StringBuilder()
                .append("IPCA/IGPM gap survey at ").append(report.getAnalyzedAt()).append('\n')
                .append("Cost accounts analyzed: ").append(stats.getTotalAnalyzed()).append('\n')
                .append("With gaps: ").append(stats.getWithGaps())
                .append(" (").append(stats.getTotalGaps()).append(" gaps)\n")
                .append("With late corrections: ").append(stats.getWithOutOfPeriod())
                .append(" (").append(stats.getTotalOutOfPeriod()).append(" corrections)\n")
                .append("With duplicates: ").append(stats.getWithDuplicates())
                .append(" (").append(stats.getTotalDuplicates()).append(" entries)\n")
                .append("Impacted balance: R$ ").append(stats.getTotalImpactedValue().setScale(2, Money.ROUNDING).toPlainString()).append('\n')
                .append("Estimated impact at ").append(estimate.getEstimatedRate().toPlainString()).append(": R$ ")
                .append(estimate.getTotalEstimatedImpact().setScale(2, Money.ROUNDING).toPlainString()).append('\n');

        text.append("Top contracts by gaps:\n");
        top(stats.getGapsByContract(), TOP_CONTRACTS).forEach((contract, count) ->
                text.append("  ").append(contract).append(": ").append(count).append('\n'));
        text.append("Top years by gaps:\n");
        top(stats.getGapsByYear(), TOP_YEARS).forEach((year, count) ->
                text.append("  ").append(year).append(": ").append(count).append('\n'));
        return text.toString();
    }

    // ─── Internal helpers ────────────────────────────────────────────────────────

    private static <K> Map<K, Integer> top(Map<K, Integer> counts, int limit) {
        Map<K, Integer> top = new LinkedHashMap<>();
        counts.entrySet().stream()
                .sorted(Map.Entry.<K, Integer>comparingByValue(Comparator.reverseOrder()))
                .limit(limit)
                .forEach(e -> top.put(e.getKey(), e.getValue()));
        return top;
    }
}
