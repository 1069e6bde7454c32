package com.kreasipositif.ipcacorrection.engine;

import com.kreasipositif.ipcacorrection.domain.CascadeStep;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

@Value
@Builder
public class CascadeResult {

    BigDecimal initialValue;
    BigDecimal finalValue;
    @Singular
    List<CascadeStep> steps;
}
