package com.kreasipositif.ipcacorrection.dto;

import com.kreasipositif.ipcacorrection.domain.CostAccountFilter;
import com.kreasipositif.ipcacorrection.domain.DuplicateCorrection;
import com.kreasipositif.ipcacorrection.domain.Gap;
import com.kreasipositif.ipcacorrection.domain.OutOfPeriodCorrection;
import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Findings of a gap analysis run over many cost accounts.
 */
@Getter
@Builder
public class GapSurveyReport {

    private final Instant analyzedAt;
    private final CostAccountFilter filter;
    private final Statistics statistics;
    /** Only accounts with at least one finding. */
    private final List<AccountFindings> accounts;

    @Getter
    @Builder
    public static class Statistics {
        private final int totalAnalyzed;
        private final int withGaps;
        private final int totalGaps;
        private final int withOutOfPeriod;
        private final int totalOutOfPeriod;
        private final int withDuplicates;
        private final int totalDuplicates;
        /** Anniversary year to number of gaps, ascending. */
        private final Map<Integer, Integer> gapsByYear;
        private final Map<String, Integer> gapsByContract;
        private final Map<String, Integer> outOfPeriodByContract;
        /** Sum of the current balances of accounts with gaps. */
        private final BigDecimal totalImpactedValue;
    }

    @Getter
    @Builder
    public static class AccountFindings {
        private final String entityId;
        private final String contractCode;
        private final String fieldCode;
        private final Instant recognitionDate;
        private final BigDecimal currentValue;
        private final List<Gap> gaps;
        private final List<OutOfPeriodCorrection> outOfPeriod;
        private final List<DuplicateCorrection> duplicates;
    }
}
