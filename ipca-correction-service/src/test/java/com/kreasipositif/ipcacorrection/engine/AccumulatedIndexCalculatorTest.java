package com.kreasipositif.ipcacorrection.engine;

import org.junit.jupiter.api.Test;

import java.util.List;

import static com.kreasipositif.ipcacorrection.support.CostAccountFixtures.ipca;
import static com.kreasipositif.ipcacorrection.support.CostAccountFixtures.rectification;
import static org.assertj.core.api.Assertions.assertThat;

class AccumulatedIndexCalculatorTest {

    @Test
    void rederive_compoundsRatesAndSumsDifferences() {
        var first = ipca("2023-03-16", "1000000", "1.05");
        var adjustment = rectification("2023-09-01", "1050000", "1040000");
        var second = ipca("2024-03-16", "1040000", "1.03");

        var result = AccumulatedIndexCalculator.rederive(List.of(first, adjustment, second));

        assertThat(result.get(0).getAccumulatedIndex()).isEqualByComparingTo("1.05");
        assertThat(result.get(0).getAccumulatedIndexAmount()).isEqualByComparingTo("50000");
        assertThat(result.get(0).getLaunchTotalValue()).isEqualByComparingTo("1050000");

        assertThat(result.get(1)).isSameAs(adjustment);

        assertThat(result.get(2).getAccumulatedIndex()).isEqualByComparingTo("1.0815");
        assertThat(result.get(2).getAccumulatedIndexAmount()).isEqualByComparingTo("81200");
        assertThat(result.get(2).getLaunchTotalValue()).isEqualByComparingTo("1081500");
        assertThat(result.get(2).getRecognizedValueWithOverhead()).isEqualByComparingTo("1071200");
    }

    @Test
    void rederive_leavesTimelinesWithoutIndexEntriesUntouched() {
        var only = rectification("2023-09-01", "100", "90");

        assertThat(AccumulatedIndexCalculator.rederive(List.of(only))).containsExactly(only);
    }
}
