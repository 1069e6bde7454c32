package com.kreasipositif.ipcacorrection.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.YearMonth;
import java.util.List;

/**
 * An index correction that exists but was applied after its anniversary deadline.
 */
@Value
@Builder
public class OutOfPeriodCorrection {

    int anniversaryYear;
    int anniversaryMonth;
    int appliedYear;
    int appliedMonth;
    Instant deadline;
    Instant appliedAt;
    long delayDays;
    IndexType indexType;
    BigDecimal appliedRate;
    /** Historical rate for the anniversary's rate period; null when unknown. */
    BigDecimal expectedRate;
    BigDecimal rateDifference;
    boolean needsAdjustment;
    @Singular
    List<InterveningChange> interveningChanges;
    BigDecimal baseValueBeforeChanges;
    BigDecimal baseValueAtApplication;

    public YearMonth anniversary() {
        return YearMonth.of(anniversaryYear, anniversaryMonth);
    }

    public YearMonth appliedPeriod() {
        return YearMonth.of(appliedYear, appliedMonth);
    }

    public boolean hadInterveningChanges() {
        return !interveningChanges.isEmpty();
    }
}
