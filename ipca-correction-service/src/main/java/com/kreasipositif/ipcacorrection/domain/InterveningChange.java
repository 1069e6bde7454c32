package com.kreasipositif.ipcacorrection.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A non-index event that changed the balance between a deadline and a late correction.
 */
@Value
@Builder
public class InterveningChange {

    CorrectionEntryType type;
    Instant appliedAt;
    BigDecimal valueBefore;
    BigDecimal valueAfter;
    BigDecimal impact;
    BigDecimal impactPercent;
}
