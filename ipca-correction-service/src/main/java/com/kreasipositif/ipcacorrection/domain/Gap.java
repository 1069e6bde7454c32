package com.kreasipositif.ipcacorrection.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.YearMonth;

/**
 * An anniversary for which no IPCA/IGPM correction was ever applied.
 */
@Value
@Builder
public class Gap {

    int year;
    int month;
    int rateYear;
    int rateMonth;
    BigDecimal baseValue;
    Instant deadline;
    GapPriority priority;

    public YearMonth period() {
        return YearMonth.of(year, month);
    }

    public YearMonth ratePeriod() {
        return YearMonth.of(rateYear, rateMonth);
    }

    /** "MM/YYYY" label of the anniversary. */
    public String periodLabel() {
        return Periods.label(period());
    }

    public String gapKey() {
        return "gap_%04d%02d".formatted(year, month);
    }
}
