package com.kreasipositif.ipcacorrection.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.YearMonth;

/**
 * A second IPCA/IGPM entry for a year-month that already had one.
 */
@Value
@Builder
public class DuplicateCorrection {

    int index;
    int originalIndex;
    int year;
    int month;
    BigDecimal duplicatedValue;
    MonetaryCorrection duplicatedCorrection;
    Instant originalEntryDate;

    public YearMonth period() {
        return YearMonth.of(year, month);
    }

    public String periodLabel() {
        return Periods.label(period());
    }
}
