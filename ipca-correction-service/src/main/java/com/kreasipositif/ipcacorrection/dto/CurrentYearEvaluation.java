package com.kreasipositif.ipcacorrection.dto;

import com.kreasipositif.ipcacorrection.domain.CorrectionProposal;
import com.kreasipositif.ipcacorrection.domain.FinancialImpact;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.util.List;

/**
 * Result of checking whether the current year's correction is due.
 */
@Getter
@Builder
public class CurrentYearEvaluation {

    private final String entityId;
    private final boolean applicable;
    private final String reason;
    /** Present only when a session was opened. */
    private final String sessionId;
    private final Instant anniversaryDate;
    private final List<CorrectionProposal> proposals;
    private final FinancialImpact financialImpact;
}
