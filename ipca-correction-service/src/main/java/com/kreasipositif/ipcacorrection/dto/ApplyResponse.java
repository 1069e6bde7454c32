package com.kreasipositif.ipcacorrection.dto;

import com.kreasipositif.ipcacorrection.domain.SessionStatus;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;

@Getter
@Builder
public class ApplyResponse {

    private final String sessionId;
    private final SessionStatus status;
    private final boolean success;
    private final Instant appliedAt;
    private final String correctedEntityId;
    private final int appliedCount;
    private final int entriesAdded;
    private final int entriesUpdated;
    private final int entriesRemoved;
    private final boolean reactivated;
    /** Set when {@link #success} is false. */
    private final String errorMessage;
}
