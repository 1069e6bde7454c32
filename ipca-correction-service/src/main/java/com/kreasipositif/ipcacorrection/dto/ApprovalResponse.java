package com.kreasipositif.ipcacorrection.dto;

import com.kreasipositif.ipcacorrection.domain.CorrectionProposal;
import com.kreasipositif.ipcacorrection.domain.SessionStatus;
import com.kreasipositif.ipcacorrection.domain.ValidationReport;
import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.List;

/**
 * Final preview of an approved selection.
 */
@Getter
@Builder
public class ApprovalResponse {

    private final String sessionId;
    private final SessionStatus status;
    private final int approvedCount;
    private final List<CorrectionProposal> approvedProposals;
    /** Compensation impacts when a compensation is approved, otherwise IPCA addition and update impacts. */
    private final BigDecimal totalFinancialImpact;
    private final ValidationReport validationReport;
    private final boolean readyToApply;
}
