package com.kreasipositif.ipcacorrection.engine;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static com.kreasipositif.ipcacorrection.support.CostAccountFixtures.ipca;
import static org.assertj.core.api.Assertions.assertThat;

class CascadeCalculatorTest {

    @Test
    void cascade_multipliesThroughEveryRateAndRecordsIncrements() {
        var result = CascadeCalculator.cascade(new BigDecimal("50000"), List.of(
                ipca("2024-03-16", "1000000", "1.03"),
                ipca("2025-03-16", "1030000", "1.05")));

        assertThat(result.getFinalValue()).isEqualByComparingTo("54075");
        assertThat(result.getSteps()).hasSize(2);
        assertThat(result.getSteps().get(0).getPeriod()).isEqualTo("03/2024");
        assertThat(result.getSteps().get(0).increment()).isEqualByComparingTo("1500");
        assertThat(result.getSteps().get(1).getValueBefore()).isEqualByComparingTo("51500");
        assertThat(result.getSteps().get(1).increment()).isEqualByComparingTo("2575");
    }

    @Test
    void cascade_withoutLaterCorrectionsKeepsTheInitialValue() {
        var result = CascadeCalculator.cascade(new BigDecimal("50000"), List.of());

        assertThat(result.getFinalValue()).isEqualByComparingTo("50000");
        assertThat(result.getSteps()).isEmpty();
    }
}
