package com.kreasipositif.ipcacorrection.dto;

import com.kreasipositif.ipcacorrection.domain.CorrectionProposal;
import com.kreasipositif.ipcacorrection.domain.FinancialImpact;
import com.kreasipositif.ipcacorrection.domain.Scenario;
import com.kreasipositif.ipcacorrection.domain.SessionStatus;
import com.kreasipositif.ipcacorrection.domain.ValidationReport;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

@Getter
@Builder
public class ProposalGenerationResponse {

    private final String sessionId;
    private final SessionStatus status;
    private final Scenario scenario;
    private final List<CorrectionProposal> proposals;
    private final FinancialImpact financialImpact;
    private final ValidationReport validationReport;
}
