package com.kreasipositif.ipcacorrection.domain;

import lombok.Builder;
import lombok.Value;
import org.springframework.data.mongodb.core.mapping.Field;
import org.springframework.data.mongodb.core.mapping.FieldType;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.Objects;
import java.util.Optional;

/**
 * One entry of a cost account's correction timeline ({@code correcoesMonetarias}).
 *
 * <p>Entries are immutable; every rebuild produces new instances through {@link #toBuilder()}.
 */
@Value
@Builder(toBuilder = true)
public class MonetaryCorrection {

    @Field("tipo")
    CorrectionEntryType type;

    @Field("subTipo")
    String subType;

    @Field("contratoCpp")
    String contractCode;

    @Field("campo")
    String fieldCode;

    @Field("dataCorrecao")
    Instant correctionDate;

    @Field("dataCriacaoCorrecao")
    Instant creationDate;

    @Field(name = "valorReconhecido", targetType = FieldType.DECIMAL128)
    BigDecimal recognizedValue;

    @Field(name = "valorReconhecidoComOH", targetType = FieldType.DECIMAL128)
    BigDecimal recognizedValueWithOverhead;

    @Field(name = "valorReconhecidoComOhOriginal", targetType = FieldType.DECIMAL128)
    BigDecimal originalValueBeforeCorrection;

    @Field(name = "diferencaValor", targetType = FieldType.DECIMAL128)
    BigDecimal differenceValue;

    @Field(name = "taxaCorrecao", targetType = FieldType.DECIMAL128)
    BigDecimal rateApplied;

    @Field(name = "igpmAcumulado", targetType = FieldType.DECIMAL128)
    BigDecimal accumulatedIndex;

    @Field(name = "igpmAcumuladoReais", targetType = FieldType.DECIMAL128)
    BigDecimal accumulatedIndexAmount;

    @Field(name = "valorLancamentoTotal", targetType = FieldType.DECIMAL128)
    BigDecimal launchTotalValue;

    @Field(name = "valorNaoReconhecido", targetType = FieldType.DECIMAL128)
    BigDecimal nonRecognizedValue;

    @Field(name = "valorReconhecivel", targetType = FieldType.DECIMAL128)
    BigDecimal recoverableValue;

    @Field(name = "valorNaoPassivelRecuperacao", targetType = FieldType.DECIMAL128)
    BigDecimal nonRecoverableValue;

    @Field(name = "overHeadTotal", targetType = FieldType.DECIMAL128)
    BigDecimal overheadTotal;

    @Field(name = "overHeadExploracao", targetType = FieldType.DECIMAL128)
    BigDecimal overheadExploration;

    @Field(name = "overHeadProducao", targetType = FieldType.DECIMAL128)
    BigDecimal overheadProduction;

    @Field(name = "valorReconhecidoExploracao", targetType = FieldType.DECIMAL128)
    BigDecimal recognizedValueExploration;

    @Field(name = "valorReconhecidoProducao", targetType = FieldType.DECIMAL128)
    BigDecimal recognizedValueProduction;

    @Field(name = "valorRecuperado", targetType = FieldType.DECIMAL128)
    BigDecimal recoveredValue;

    @Field(name = "valorRecuperadoTotal", targetType = FieldType.DECIMAL128)
    BigDecimal recoveredValueTotal;

    @Field("quantidadeLancamento")
    Integer launchCount;

    @Field("faseRemessa")
    Integer shipmentPhase;

    /** Missing on some legacy entries; read as active. */
    @Field("ativo")
    Boolean active;

    @Field("transferencia")
    Boolean transfer;

    @Field("observacao")
    String observation;

    public MonetaryCorrection(CorrectionEntryType type, String subType, String contractCode, String fieldCode,
                              Instant correctionDate, Instant creationDate, BigDecimal recognizedValue,
                              BigDecimal recognizedValueWithOverhead, BigDecimal originalValueBeforeCorrection,
                              BigDecimal differenceValue, BigDecimal rateApplied, BigDecimal accumulatedIndex,
                              BigDecimal accumulatedIndexAmount, BigDecimal launchTotalValue,
                              BigDecimal nonRecognizedValue, BigDecimal recoverableValue,
                              BigDecimal nonRecoverableValue, BigDecimal overheadTotal,
                              BigDecimal overheadExploration, BigDecimal overheadProduction,
                              BigDecimal recognizedValueExploration, BigDecimal recognizedValueProduction,
                              BigDecimal recoveredValue, BigDecimal recoveredValueTotal, Integer launchCount,
                              Integer shipmentPhase, Boolean active, Boolean transfer, String observation) {
        this.type = Objects.requireNonNull(type, "correction type is required");
        this.subType = subType;
        this.contractCode = contractCode;
        this.fieldCode = fieldCode;
        this.correctionDate = correctionDate;
        this.creationDate = creationDate;
        this.recognizedValue = recognizedValue;
        this.recognizedValueWithOverhead = Money.orZero(recognizedValueWithOverhead);
        this.originalValueBeforeCorrection = originalValueBeforeCorrection;
        this.differenceValue = differenceValue;
        this.rateApplied = rateApplied;
        this.accumulatedIndex = accumulatedIndex;
        this.accumulatedIndexAmount = accumulatedIndexAmount;
        this.launchTotalValue = launchTotalValue;
        this.nonRecognizedValue = nonRecognizedValue;
        this.recoverableValue = recoverableValue;
        this.nonRecoverableValue = nonRecoverableValue;
        this.overheadTotal = overheadTotal;
        this.overheadExploration = overheadExploration;
        this.overheadProduction = overheadProduction;
        this.recognizedValueExploration = recognizedValueExploration;
        this.recognizedValueProduction = recognizedValueProduction;
        this.recoveredValue = recoveredValue;
        this.recoveredValueTotal = recoveredValueTotal;
        this.launchCount = launchCount;
        this.shipmentPhase = shipmentPhase;
        this.active = active == null ? Boolean.TRUE : active;
        this.transfer = transfer == null ? Boolean.FALSE : transfer;
        this.observation = observation;
    }

    /** Correction date, falling back to the creation date for legacy entries. */
    public Optional<Instant> effectiveDate() {
        return Optional.ofNullable(correctionDate != null ? correctionDate : creationDate);
    }

    /** Year-month of the effective date in UTC. */
    public Optional<YearMonth> period() {
        return effectiveDate().map(d -> YearMonth.from(d.atZone(ZoneOffset.UTC)));
    }

    public boolean isIndexCorrection() {
        return type.isIndexCorrection();
    }

    /** Rate recorded on the entry, 1.0 when absent. */
    public BigDecimal rateOrOne() {
        return rateApplied == null ? BigDecimal.ONE : rateApplied;
    }
}
