package com.kreasipositif.ipcacorrection.dto;

import com.kreasipositif.ipcacorrection.domain.Scenario;
import com.kreasipositif.ipcacorrection.domain.SessionStatus;
import lombok.Builder;
import lombok.Getter;

/**
 * Summary returned when a correction session is opened.
 */
@Getter
@Builder
public class AnalysisStartResponse {

    private final String sessionId;
    private final String entityId;
    private final SessionStatus status;
    private final Scenario scenario;
    private final int gapsCount;
    private final int outOfPeriodCount;
    private final int duplicatesCount;
    /** False for scenarios that are only reported. */
    private final boolean autoCorrectable;
}
