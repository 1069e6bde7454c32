package com.kreasipositif.ipcacorrection.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Findings over a proposal set; warnings never block, errors mark the set invalid.
 */
@Value
@Builder
public class ValidationReport {

    boolean valid;
    int validatedCount;
    @Singular
    List<String> warnings;
    @Singular
    List<String> errors;
}
