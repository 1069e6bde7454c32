package com.kreasipositif.ipcacorrection.analysis;

import com.kreasipositif.ipcacorrection.config.CorrectionProperties;
import com.kreasipositif.ipcacorrection.domain.GapPriority;
import com.kreasipositif.ipcacorrection.domain.Periods;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;

/**
 * Temporal rules of the yearly correction cycle.
 *
 * <p>A cost account recognised in month M is corrected every year in month M + 1, starting
 * the year after recognition. The rate applied is the one published for the month before
 * the anniversary.
 */
@Component
@RequiredArgsConstructor
public class AnniversaryCalendar {

    private static final double DAYS_PER_YEAR = 365.25;

    private final CorrectionProperties properties;

    public YearMonth firstAnniversary(YearMonth recognition) {
        return recognition.plusYears(1).plusMonths(1);
    }

    /** Anniversary month for a given year; a December recognition is corrected in January. */
    public YearMonth anniversaryIn(int year, YearMonth recognition) {
        return YearMonth.of(year, recognition.plusMonths(1).getMonth());
    }

    /**
     * Whether an anniversary has been reached on {@code today}. In its own month it counts
     * from the cutoff day on.
     */
    public boolean isDue(YearMonth anniversary, LocalDate today) {
        YearMonth current = YearMonth.from(today);
        if (anniversary.isBefore(current)) {
            return true;
        }
        if (anniversary.isAfter(current)) {
            return false;
        }
        return today.getDayOfMonth() >= properties.getAnniversaryCutoffDay();
    }

    public YearMonth ratePeriod(YearMonth anniversary) {
        return anniversary.plusMonths(properties.getRateMonthOffset());
    }

    /** Last instant at which a correction still counts as applied on time. */
    public Instant deadline(YearMonth anniversary) {
        return Periods.endOfDay(anniversary, properties.getDeadlineDay());
    }

    /** Date given to corrections inserted for a missing anniversary. */
    public Instant gapEntryDate(YearMonth anniversary) {
        return Periods.startOfDay(anniversary, properties.getGapEntryDay());
    }

    /** Day before the entry date; late corrections are searched after it. */
    public Instant lateWindowStart(YearMonth anniversary) {
        return Periods.startOfDay(anniversary, properties.getGapEntryDay() - 1);
    }

    public Instant currentYearDueDate(YearMonth anniversary) {
        return Periods.startOfDay(anniversary, properties.getCurrentYearDueDay());
    }

    public long monthsBetween(YearMonth from, YearMonth to) {
        return ChronoUnit.MONTHS.between(from, to);
    }

    public GapPriority priority(YearMonth anniversary, Instant now) {
        long days = ChronoUnit.DAYS.between(gapEntryDate(anniversary), now);
        double years = days / DAYS_PER_YEAR;
        if (years > properties.getPriorityHighYears()) {
            return GapPriority.ALTA;
        }
        if (years > properties.getPriorityMediumYears()) {
            return GapPriority.MEDIA;
        }
        return GapPriority.BAIXA;
    }
}
