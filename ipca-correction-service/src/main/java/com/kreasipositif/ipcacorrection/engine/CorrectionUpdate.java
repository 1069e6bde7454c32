package com.kreasipositif.ipcacorrection.engine;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.YearMonth;

/**
 * Replacement values for the index entry of one period.
 */
@Value
@Builder
public class CorrectionUpdate {

    YearMonth period;
    BigDecimal newValue;
    /** Base the new value was computed from; keeps value == base × rate on the rewritten entry. */
    BigDecimal newBase;
    String observation;
    Instant updatedAt;
}
