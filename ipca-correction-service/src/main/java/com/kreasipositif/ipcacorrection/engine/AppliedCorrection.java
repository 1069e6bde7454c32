package com.kreasipositif.ipcacorrection.engine;

import com.kreasipositif.ipcacorrection.domain.CostAccount;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of applying an approved proposal set; the corrected copy is already persisted.
 */
@Value
@Builder
public class AppliedCorrection {

    CostAccount correctedAccount;
    int entriesAdded;
    int entriesUpdated;
    int entriesRemoved;
    boolean reactivated;
}
