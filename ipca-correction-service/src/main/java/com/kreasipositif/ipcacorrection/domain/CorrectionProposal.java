package com.kreasipositif.ipcacorrection.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * A single change the engine suggests; nothing is written until it is approved and applied.
 */
@Value
@Builder(toBuilder = true)
public class CorrectionProposal {

    String id;
    ProposalType type;
    Scenario scenario;
    Instant targetDate;
    /** "MM/YYYY", or a marker such as COMPENSACAO, REATIVACAO, AJUSTE, CHANGE_ORDER. */
    String targetPeriod;
    /** Base the rate was applied to, when the proposal is a rate application. */
    BigDecimal baseValue;
    BigDecimal currentValue;
    BigDecimal proposedValue;
    BigDecimal impact;
    BigDecimal rateApplied;
    String rateReferencePeriod;
    String description;
    @Singular
    List<String> dependencies;
    @Singular("businessRule")
    List<String> businessRulesApplied;
    /** Timeline index a duplicate removal deletes. */
    Integer indexToRemove;
    @Singular
    List<CascadeStep> cascadeSteps;
    /** Non-null when the proposal cannot be computed, e.g. the rate is missing. */
    String error;

    public boolean isUnresolvable() {
        return error != null;
    }
}
