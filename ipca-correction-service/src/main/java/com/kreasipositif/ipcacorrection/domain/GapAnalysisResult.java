package com.kreasipositif.ipcacorrection.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class GapAnalysisResult {

    @Singular
    List<Gap> gaps;

    @Singular
    List<OutOfPeriodCorrection> outOfPeriodCorrections;

    @Singular
    List<DuplicateCorrection> duplicates;

    public boolean hasGaps() {
        return !gaps.isEmpty();
    }

    public boolean hasOutOfPeriod() {
        return !outOfPeriodCorrections.isEmpty();
    }

    public boolean hasDuplicates() {
        return !duplicates.isEmpty();
    }
}
