package com.kreasipositif.ipcacorrection.service;

import com.kreasipositif.ipcacorrection.domain.CostAccount;
import com.kreasipositif.ipcacorrection.domain.CostAccountFilter;
import com.kreasipositif.ipcacorrection.repository.memory.InMemoryCostAccountRepository;
import com.kreasipositif.ipcacorrection.support.FixedClockConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.util.Map;

import static com.kreasipositif.ipcacorrection.support.CostAccountFixtures.account;
import static com.kreasipositif.ipcacorrection.support.CostAccountFixtures.duplicatedCorrection;
import static com.kreasipositif.ipcacorrection.support.CostAccountFixtures.gapWithRecovery;
import static com.kreasipositif.ipcacorrection.support.CostAccountFixtures.singleGap;
import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
@Import(FixedClockConfig.class)
class GapSurveyServiceTests {

    @Autowired
    private GapSurveyService surveyService;

    @Autowired
    private InMemoryCostAccountRepository accounts;

    @BeforeEach
    void setUp() {
        accounts.clear();
        accounts.putSource(singleGap("A1"));
        CostAccount recovered = gapWithRecovery("S2");
        recovered.setContractCode("CT-002");
        accounts.putSource(recovered);
        accounts.putSource(duplicatedCorrection("DUP1"));
        accounts.putSource(account("N1", "2024-06-10", "1000000"));
    }

    // ─── Survey ───────────────────────────────────────────────────────────────

    @Test
    void surveyCountsFindingsAcrossAccounts() {
        var report = surveyService.survey(CostAccountFilter.all());
        var stats = report.getStatistics();

        assertThat(stats.getTotalAnalyzed()).isEqualTo(4);
        assertThat(stats.getWithGaps()).isEqualTo(2);
        assertThat(stats.getTotalGaps()).isEqualTo(2);
        assertThat(stats.getGapsByYear()).containsExactly(Map.entry(2023, 1), Map.entry(2024, 1));
        assertThat(stats.getGapsByContract()).containsOnly(Map.entry("CT-001", 1), Map.entry("CT-002", 1));
        assertThat(stats.getWithDuplicates()).isEqualTo(1);
        assertThat(stats.getWithOutOfPeriod()).isZero();
        assertThat(stats.getTotalImpactedValue()).isEqualByComparingTo("1000000");
        assertThat(report.getAccounts()).extracting(a -> a.getEntityId())
                .containsExactlyInAnyOrder("A1", "S2", "DUP1");
    }

    @Test
    void filterRestrictsSurveyToContract() {
        var report = surveyService.survey(CostAccountFilter.builder().contractCode("CT-002").build());

        assertThat(report.getStatistics().getTotalAnalyzed()).isEqualTo(1);
        assertThat(report.getStatistics().getWithGaps()).isEqualTo(1);
        assertThat(report.getAccounts()).singleElement()
                .satisfies(a -> assertThat(a.getEntityId()).isEqualTo("S2"));
    }

    // ─── Impact estimate ──────────────────────────────────────────────────────

    @Test
    void estimateAppliesRateToEveryGapBase() {
        var report = surveyService.survey(CostAccountFilter.all());

        var estimate = surveyService.estimateFinancialImpact(report, new BigDecimal("0.09"));

        assertThat(estimate.getTotalEstimatedImpact()).isEqualByComparingTo("180000");
        assertThat(estimate.getImpactByYear().get(2023)).isEqualByComparingTo("90000");
        assertThat(estimate.getImpactByContract().get("CT-001")).isEqualByComparingTo("90000");
        assertThat(estimate.getPercentOfImpactedValue()).isEqualByComparingTo("18");
    }

    @Test
    void defaultEstimateUsesConfiguredRate() {
        var estimate = surveyService.estimateFinancialImpact(surveyService.survey(CostAccountFilter.all()));

        assertThat(estimate.getEstimatedRate()).isEqualByComparingTo("0.045");
        assertThat(estimate.getTotalEstimatedImpact()).isEqualByComparingTo("90000");
    }

    @Test
    void summaryListsHeadlineNumbers() {
        var summary = surveyService.summarize(surveyService.survey(CostAccountFilter.all()));

        assertThat(summary)
                .contains("Cost accounts analyzed: 4")
                .contains("With gaps: 2 (2 gaps)")
                .contains("With duplicates: 1 (1 entries)")
                .contains("Impacted balance: R$ 1000000.00")
                .contains("  2023: 1");
    }
}
