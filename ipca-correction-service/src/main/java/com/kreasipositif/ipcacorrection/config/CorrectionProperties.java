package com.kreasipositif.ipcacorrection.config;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;

/**
 * Binds the {@code correction} section from application.yml.
 * Holds the anniversary calendar rules, tolerances and persistence switches.
 */
@Getter
@Setter
@Component
@Validated
@ConfigurationProperties(prefix = "correction")
public class CorrectionProperties {

    /** Which adapters back the repositories: "mongo" or "memory". */
    @NotBlank
    private String persistence = "mongo";

    /** Day of the anniversary month from which the current-month anniversary counts as due. */
    @Min(1)
    @Max(28)
    private int anniversaryCutoffDay = 19;

    /** Day of the anniversary month whose end (23:59:59 UTC) is the application deadline. */
    @Min(1)
    @Max(28)
    private int deadlineDay = 19;

    /** Day of the anniversary month on which inserted gap corrections are dated. */
    @Min(1)
    @Max(28)
    private int gapEntryDay = 16;

    /** Day of the anniversary month after which the current-year correction is due. */
    @Min(1)
    @Max(28)
    private int currentYearDueDay = 16;

    /** Month offset between the anniversary and the rate reference period. */
    @Min(-12)
    @Max(0)
    private int rateMonthOffset = -1;

    /** Late corrections applied this many months (or more) after the anniversary are ignored. */
    @Min(1)
    private int maxLagMonths = 12;

    /** Tolerance under which an applied rate matches the historical one. */
    @NotNull
    @DecimalMin("0")
    private BigDecimal rateTolerance = new BigDecimal("0.0001");

    /** Rates outside [saneRateMin, saneRateMax] are flagged in validation reports. */
    @NotNull
    private BigDecimal saneRateMin = new BigDecimal("0.5");

    @NotNull
    private BigDecimal saneRateMax = new BigDecimal("2.0");

    /** Gap older than this many years is high priority. */
    @Min(0)
    private double priorityHighYears = 3.0;

    /** Gap older than this many years is medium priority. */
    @Min(0)
    private double priorityMediumYears = 1.0;

    /** Appended to the source id to form the id of a corrected record. */
    @NotBlank
    private String correctedIdSuffix = "_corrigida";

    /** Average rate used for survey-level financial impact estimates. */
    @NotNull
    private BigDecimal estimatedImpactRate = new BigDecimal("0.045");
}
