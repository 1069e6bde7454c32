package com.kreasipositif.ipcacorrection.dto;

import com.kreasipositif.ipcacorrection.domain.FinancialImpact;
import com.kreasipositif.ipcacorrection.domain.Scenario;
import com.kreasipositif.ipcacorrection.domain.SessionStatus;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;

@Getter
@Builder
public class SessionStatusResponse {

    private final String sessionId;
    private final String entityId;
    private final String userId;
    private final SessionStatus status;
    private final Scenario scenario;
    private final int gapsCount;
    private final int outOfPeriodCount;
    private final int duplicatesCount;
    private final int proposalsCount;
    private final int approvedCount;
    private final FinancialImpact financialImpact;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final Instant appliedAt;
    private final String correctedEntityId;
    private final String errorMessage;
}
