package com.kreasipositif.ipcacorrection.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class FinancialImpact {

    BigDecimal totalImpact;
    BigDecimal totalAdditions;
    BigDecimal totalUpdates;
    BigDecimal totalRemove;
    BigDecimal totalCompensation;
    int proposalsCount;
}
