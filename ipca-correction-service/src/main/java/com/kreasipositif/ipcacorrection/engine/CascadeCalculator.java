package com.kreasipositif.ipcacorrection.engine;

import com.kreasipositif.ipcacorrection.domain.CascadeStep;
import com.kreasipositif.ipcacorrection.domain.Money;
import com.kreasipositif.ipcacorrection.domain.MonetaryCorrection;
import com.kreasipositif.ipcacorrection.domain.Periods;

import java.math.BigDecimal;
import java.util.List;

/**
 * Carries a value through the rates of a sequence of corrections: B × r1 × r2 × ... × rn.
 */
public final class CascadeCalculator {

    private CascadeCalculator() {
    }

    /**
     * @param initialValue value to carry forward
     * @param corrections  corrections whose rates apply, in application order
     */
    public static CascadeResult cascade(BigDecimal initialValue, List<MonetaryCorrection> corrections) {
        CascadeResult.CascadeResultBuilder result = CascadeResult.builder().initialValue(initialValue);
        BigDecimal running = Money.round(initialValue);
        for (MonetaryCorrection correction : corrections) {
            BigDecimal next = Money.multiply(running, correction.rateOrOne());
            result.step(CascadeStep.builder()
                    .period(correction.period().map(Periods::label).orElse("?"))
                    .rate(correction.rateOrOne())
                    .valueBefore(running)
                    .valueAfter(next)
                    .build());
            running = next;
        }
        return result.finalValue(running).build();
    }
}
