package com.kreasipositif.ipcacorrection.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One rate applied while cascading a value through later corrections.
 */
@Value
@Builder
public class CascadeStep {

    String period;
    BigDecimal rate;
    BigDecimal valueBefore;
    BigDecimal valueAfter;

    public BigDecimal increment() {
        return valueAfter.subtract(valueBefore);
    }
}
