package com.kreasipositif.ipcacorrection.analysis;

import com.kreasipositif.ipcacorrection.domain.CorrectionEntryType;
import com.kreasipositif.ipcacorrection.domain.Gap;
import com.kreasipositif.ipcacorrection.domain.GapPriority;
import com.kreasipositif.ipcacorrection.domain.IndexType;
import com.kreasipositif.ipcacorrection.support.FixedClockConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;

import static com.kreasipositif.ipcacorrection.support.CostAccountFixtures.account;
import static com.kreasipositif.ipcacorrection.support.CostAccountFixtures.duplicatedCorrection;
import static com.kreasipositif.ipcacorrection.support.CostAccountFixtures.gapWithLaterCorrection;
import static com.kreasipositif.ipcacorrection.support.CostAccountFixtures.ipca;
import static com.kreasipositif.ipcacorrection.support.CostAccountFixtures.recovery;
import static com.kreasipositif.ipcacorrection.support.CostAccountFixtures.rectification;
import static com.kreasipositif.ipcacorrection.support.CostAccountFixtures.singleGap;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration tests for {@link GapAnalyzer} with "now" pinned at 2025-01-20 and the test rate table.
 */
@SpringBootTest
@ActiveProfiles("test")
@Import(FixedClockConfig.class)
class GapAnalyzerTests {

    @Autowired
    private GapAnalyzer analyzer;

    // ─── Gaps ─────────────────────────────────────────────────────────────────

    @Test
    void contextLoads() {
        assertThat(analyzer).isNotNull();
    }

    @Test
    @DisplayName("Never corrected → one gap at the first anniversary, based on the recognised value")
    void uncorrectedAccountHasGapAtFirstAnniversary() {
        var result = analyzer.analyze(singleGap("A1"));

        assertThat(result.getGaps()).singleElement().satisfies(gap -> {
            assertThat(gap.periodLabel()).isEqualTo("09/2024");
            assertThat(gap.ratePeriod().toString()).isEqualTo("2024-08");
            assertThat(gap.getBaseValue()).isEqualByComparingTo("1000000");
            assertThat(gap.getDeadline()).isEqualTo(Instant.parse("2024-09-19T23:59:59Z"));
            assertThat(gap.getPriority()).isEqualTo(GapPriority.BAIXA);
        });
        assertThat(result.hasOutOfPeriod()).isFalse();
        assertThat(result.hasDuplicates()).isFalse();
    }

    @Test
    @DisplayName("December recognition → anniversaries fall in January")
    void decemberRecognitionRollsOverToJanuary() {
        var result = analyzer.analyze(account("D1", "2022-12-05", "1000000"));

        assertThat(result.getGaps()).extracting(Gap::periodLabel).containsExactly("01/2024", "01/2025");
    }

    @Test
    void anniversaryNotYetReachedIsNotAGap() {
        var result = analyzer.analyze(account("N1", "2024-06-10", "1000000"));

        assertThat(result.hasGaps()).isFalse();
        assertThat(result.hasOutOfPeriod()).isFalse();
    }

    @Test
    @DisplayName("Fully recovered balance → gap skipped")
    void zeroBaseIsSkipped() {
        var result = analyzer.analyze(account("R1", "2023-08-15", "1000000",
                recovery("2024-05-02", "1000000")));

        assertThat(result.hasGaps()).isFalse();
    }

    @Test
    void lateCorrectionTwelveMonthsAfterAnniversaryDoesNotCount() {
        var result = analyzer.analyze(gapWithLaterCorrection("S1"));

        assertThat(result.getGaps()).extracting(Gap::periodLabel).containsExactly("03/2023");
        assertThat(result.hasOutOfPeriod()).isFalse();
    }

    @Test
    void analyzingTwiceGivesTheSameResult() {
        var account = gapWithLaterCorrection("S1");

        var first = analyzer.analyze(account);
        var second = analyzer.analyze(account);

        assertThat(second.getGaps()).isEqualTo(first.getGaps());
        assertThat(second.getOutOfPeriodCorrections()).isEqualTo(first.getOutOfPeriodCorrections());
        assertThat(account.getCorrections()).hasSize(1);
    }

    // ─── Out-of-period corrections ────────────────────────────────────────────

    @Test
    @DisplayName("Correction applied after the deadline → out-of-period with the intervening rectification")
    void lateCorrectionIsReportedWithInterveningChange() {
        var account = account("L1", "2022-02-10", "1000000",
                rectification("2023-05-02", "1000000", "900000"),
                ipca("2023-07-10", "900000", "1.05"));

        var result = analyzer.analyze(account);

        assertThat(result.getOutOfPeriodCorrections()).singleElement().satisfies(late -> {
            assertThat(late.anniversary().toString()).isEqualTo("2023-03");
            assertThat(late.appliedPeriod().toString()).isEqualTo("2023-07");
            assertThat(late.getDelayDays()).isEqualTo(112);
            assertThat(late.getIndexType()).isEqualTo(IndexType.IPCA);
            assertThat(late.getExpectedRate()).isEqualByComparingTo("1.05");
            assertThat(late.isNeedsAdjustment()).isFalse();
            assertThat(late.hadInterveningChanges()).isTrue();
            assertThat(late.getInterveningChanges()).singleElement().satisfies(change -> {
                assertThat(change.getType()).isEqualTo(CorrectionEntryType.RETIFICACAO);
                assertThat(change.getImpact()).isEqualByComparingTo("-100000");
                assertThat(change.getImpactPercent()).isEqualByComparingTo("-10");
            });
            assertThat(late.getBaseValueBeforeChanges()).isEqualByComparingTo("1000000");
            assertThat(late.getBaseValueAtApplication()).isEqualByComparingTo("900000");
        });

        assertThat(result.getGaps()).singleElement().satisfies(gap -> {
            assertThat(gap.periodLabel()).isEqualTo("03/2024");
            assertThat(gap.getBaseValue()).isEqualByComparingTo("945000");
        });
    }

    @Test
    void lateCorrectionWithWrongRateNeedsAdjustment() {
        var account = account("L2", "2022-02-10", "1000000",
                ipca("2023-07-10", "1000000", "1.07"));

        var result = analyzer.analyze(account);

        assertThat(result.getOutOfPeriodCorrections()).singleElement().satisfies(late -> {
            assertThat(late.isNeedsAdjustment()).isTrue();
            assertThat(late.getRateDifference()).isEqualByComparingTo("0.02");
            assertThat(late.getBaseValueAtApplication()).isEqualByComparingTo("1000000");
        });
    }

    @Test
    void correctionInTheFollowingMonthCoversTheAnniversary() {
        var account = account("L3", "2023-08-15", "1000000",
                ipca("2024-10-02", "1000000", "1.045"));

        var result = analyzer.analyze(account);

        assertThat(result.hasGaps()).isFalse();
        assertThat(result.getOutOfPeriodCorrections()).singleElement()
                .satisfies(late -> assertThat(late.getDelayDays()).isEqualTo(12));
    }

    // ─── Duplicates ───────────────────────────────────────────────────────────

    @Test
    @DisplayName("Second IPCA in the same month → duplicate pointing at the first")
    void duplicatedIndexEntryIsReported() {
        var result = analyzer.analyze(duplicatedCorrection("DUP1"));

        assertThat(result.hasGaps()).isFalse();
        assertThat(result.getDuplicates()).singleElement().satisfies(dup -> {
            assertThat(dup.getIndex()).isEqualTo(1);
            assertThat(dup.getOriginalIndex()).isEqualTo(0);
            assertThat(dup.periodLabel()).isEqualTo("03/2023");
            assertThat(dup.getDuplicatedValue()).isEqualByComparingTo("52500");
        });
    }
}
