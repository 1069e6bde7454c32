package com.kreasipositif.ipcacorrection.engine;

import com.kreasipositif.ipcacorrection.domain.CorrectionProposal;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Whether the anniversary of the current year is due for a cost account, and what to add if so.
 */
@Value
@Builder
public class CurrentYearAssessment {

    boolean applicable;
    String reason;
    /** Due date of the anniversary examined; null when no anniversary could be derived. */
    Instant anniversaryDate;
    @Singular
    List<CorrectionProposal> proposals;

    static CurrentYearAssessment notApplicable(String reason, Instant anniversaryDate) {
        return CurrentYearAssessment.builder()
                .applicable(false)
                .reason(reason)
                .anniversaryDate(anniversaryDate)
                .build();
    }
}
