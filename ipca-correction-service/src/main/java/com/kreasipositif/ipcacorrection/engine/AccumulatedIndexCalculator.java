package com.kreasipositif.ipcacorrection.engine;

import com.kreasipositif.ipcacorrection.domain.Money;
import com.kreasipositif.ipcacorrection.domain.MonetaryCorrection;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Re-derives the running amounts carried by IPCA/IGPM entries after a timeline changed.
 *
 * <p>The first index entry seeds each amount with its own value times its rate; every later
 * one multiplies the running amounts by its rate. The accumulated index compounds the rates
 * and the accumulated amount sums the differences. Other entries pass through untouched.
 */
public final class AccumulatedIndexCalculator {

    private AccumulatedIndexCalculator() {
    }

    public static List<MonetaryCorrection> rederive(List<MonetaryCorrection> timeline) {
        List<MonetaryCorrection> result = new ArrayList<>(timeline.size());
        Running running = null;
        for (MonetaryCorrection entry : timeline) {
            if (!entry.isIndexCorrection()) {
                result.add(entry);
                continue;
            }
            BigDecimal rate = entry.rateOrOne();
            BigDecimal difference = Money.orZero(entry.getDifferenceValue());
            running = running == null
                    ? new Running(
                            Money.multiply(entry.getLaunchTotalValue(), rate),
                            Money.multiply(entry.getNonRecognizedValue(), rate),
                            Money.multiply(entry.getRecoverableValue(), rate),
                            Money.multiply(entry.getNonRecoverableValue(), rate),
                            Money.round(rate),
                            Money.round(difference))
                    : new Running(
                            Money.multiply(running.launchTotal(), rate),
                            Money.multiply(running.nonRecognized(), rate),
                            Money.multiply(running.recoverable(), rate),
                            Money.multiply(running.nonRecoverable(), rate),
                            Money.multiply(running.index(), rate),
                            Money.round(running.amount().add(difference)));
            result.add(entry.toBuilder()
                    .launchTotalValue(running.launchTotal())
                    .nonRecognizedValue(running.nonRecognized())
                    .recoverableValue(running.recoverable())
                    .nonRecoverableValue(running.nonRecoverable())
                    .accumulatedIndex(running.index())
                    .accumulatedIndexAmount(running.amount())
                    .build());
        }
        return result;
    }

    private record Running(BigDecimal launchTotal, BigDecimal nonRecognized, BigDecimal recoverable,
                           BigDecimal nonRecoverable, BigDecimal index, BigDecimal amount) {
    }
}
