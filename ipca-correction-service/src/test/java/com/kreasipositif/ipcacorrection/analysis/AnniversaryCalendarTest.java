package com.kreasipositif.ipcacorrection.analysis;

import com.kreasipositif.ipcacorrection.config.CorrectionProperties;
import com.kreasipositif.ipcacorrection.domain.GapPriority;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;

import static org.assertj.core.api.Assertions.assertThat;

class AnniversaryCalendarTest {

    private static final Instant NOW = Instant.parse("2025-01-20T12:00:00Z");

    private final AnniversaryCalendar calendar = new AnniversaryCalendar(new CorrectionProperties());

    // ─── Anniversaries ───────────────────────────────────────────────────────────

    @Test
    @DisplayName("Recognised in 08/2023 → first anniversary 09/2024")
    void firstAnniversary_isNextMonthOfFollowingYear() {
        assertThat(calendar.firstAnniversary(YearMonth.of(2023, 8))).isEqualTo(YearMonth.of(2024, 9));
    }

    @Test
    @DisplayName("Recognised in 12/2023 → first anniversary 01/2025")
    void firstAnniversary_decemberRollsOverToJanuaryTwoYearsLater() {
        assertThat(calendar.firstAnniversary(YearMonth.of(2023, 12))).isEqualTo(YearMonth.of(2025, 1));
    }

    @Test
    void anniversaryIn_decemberRecognitionFallsInJanuary() {
        assertThat(calendar.anniversaryIn(2025, YearMonth.of(2023, 12))).isEqualTo(YearMonth.of(2025, 1));
        assertThat(calendar.anniversaryIn(2025, YearMonth.of(2023, 5))).isEqualTo(YearMonth.of(2025, 6));
    }

    @Test
    void ratePeriod_januaryUsesDecemberOfPreviousYear() {
        assertThat(calendar.ratePeriod(YearMonth.of(2024, 1))).isEqualTo(YearMonth.of(2023, 12));
        assertThat(calendar.ratePeriod(YearMonth.of(2024, 9))).isEqualTo(YearMonth.of(2024, 8));
    }

    // ─── Due rule ────────────────────────────────────────────────────────────────

    @Test
    @DisplayName("Current-month anniversary counts only from the cutoff day on")
    void isDue_currentMonthDependsOnCutoffDay() {
        YearMonth anniversary = YearMonth.of(2025, 1);

        assertThat(calendar.isDue(anniversary, LocalDate.of(2025, 1, 18))).isFalse();
        assertThat(calendar.isDue(anniversary, LocalDate.of(2025, 1, 19))).isTrue();
    }

    @Test
    void isDue_pastAndFutureMonths() {
        LocalDate today = LocalDate.of(2025, 1, 2);

        assertThat(calendar.isDue(YearMonth.of(2024, 12), today)).isTrue();
        assertThat(calendar.isDue(YearMonth.of(2025, 2), today)).isFalse();
    }

    @Test
    void deadline_isEndOfCutoffDayInUtc() {
        assertThat(calendar.deadline(YearMonth.of(2024, 9))).isEqualTo(Instant.parse("2024-09-19T23:59:59Z"));
        assertThat(calendar.gapEntryDate(YearMonth.of(2024, 9))).isEqualTo(Instant.parse("2024-09-16T00:00:00Z"));
    }

    // ─── Priority ────────────────────────────────────────────────────────────────

    @Test
    void priority_growsWithAge() {
        assertThat(calendar.priority(YearMonth.of(2020, 3), NOW)).isEqualTo(GapPriority.ALTA);
        assertThat(calendar.priority(YearMonth.of(2023, 3), NOW)).isEqualTo(GapPriority.MEDIA);
        assertThat(calendar.priority(YearMonth.of(2024, 9), NOW)).isEqualTo(GapPriority.BAIXA);
    }
}
