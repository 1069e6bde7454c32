package com.kreasipositif.ipcacorrection.dto;

import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Rough impact of the gaps in a survey at a single average rate.
 */
@Getter
@Builder
public class FinancialImpactEstimate {

    private final BigDecimal estimatedRate;
    private final BigDecimal totalEstimatedImpact;
    private final Map<String, BigDecimal> impactByContract;
    private final Map<Integer, BigDecimal> impactByYear;
    /** Estimated impact as a percentage of the impacted balances; zero when nothing is impacted. */
    private final BigDecimal percentOfImpactedValue;
}
