package com.kreasipositif.ipcacorrection.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;
import org.springframework.data.mongodb.core.mapping.FieldType;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Cost account (CCO) as stored in {@code conta_custo_oleo_entity}.
 *
 * <p>Corrected copies share the same shape and live in a separate collection; they carry
 * {@link #sourceEntityId}, {@link #correctionSessionId} and {@link #correctedAt}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "conta_custo_oleo_entity")
public class CostAccount {

    @Id
    private String id;

    @Field("contratoCpp")
    private String contractCode;

    @Field("campo")
    private String fieldCode;

    @Field("remessa")
    private Integer shipmentNumber;

    @Field("faseRemessa")
    private Integer shipmentPhase;

    @Field("exercicio")
    private Integer fiscalYear;

    @Field("periodo")
    private Integer fiscalPeriod;

    @Field("origemDosGastos")
    private String expenseOrigin;

    @Field("dataReconhecimento")
    private Instant recognitionDate;

    @Field("dataLancamento")
    private Instant launchDate;

    @Field("flgRecuperado")
    private boolean recovered;

    @Field(name = "valorReconhecido", targetType = FieldType.DECIMAL128)
    private BigDecimal recognizedValue;

    @Field(name = "valorReconhecidoComOH", targetType = FieldType.DECIMAL128)
    private BigDecimal recognizedValueWithOverhead;

    @Field(name = "overHeadTotal", targetType = FieldType.DECIMAL128)
    private BigDecimal overheadTotal;

    @Field(name = "overHeadExploracao", targetType = FieldType.DECIMAL128)
    private BigDecimal overheadExploration;

    @Field(name = "overHeadProducao", targetType = FieldType.DECIMAL128)
    private BigDecimal overheadProduction;

    @Field(name = "valorReconhecidoExploracao", targetType = FieldType.DECIMAL128)
    private BigDecimal recognizedValueExploration;

    @Field(name = "valorReconhecidoProducao", targetType = FieldType.DECIMAL128)
    private BigDecimal recognizedValueProduction;

    @Field(name = "valorLancamentoTotal", targetType = FieldType.DECIMAL128)
    private BigDecimal launchTotalValue;

    @Field(name = "valorNaoReconhecido", targetType = FieldType.DECIMAL128)
    private BigDecimal nonRecognizedValue;

    @Field(name = "valorReconhecivel", targetType = FieldType.DECIMAL128)
    private BigDecimal recoverableValue;

    @Field(name = "valorNaoPassivelRecuperacao", targetType = FieldType.DECIMAL128)
    private BigDecimal nonRecoverableValue;

    @Field("quantidadeLancamento")
    private Integer launchCount;

    @Field("correcoesMonetarias")
    @Builder.Default
    private List<MonetaryCorrection> corrections = new ArrayList<>();

    @Field("idOrigem")
    private String sourceEntityId;

    @Field("idSessaoCorrecao")
    private String correctionSessionId;

    @Field("dataCorrecaoAplicada")
    private Instant correctedAt;

    /** Balance after the last correction, or the recognized value when nothing was corrected yet. */
    public BigDecimal currentValue() {
        if (corrections == null || corrections.isEmpty()) {
            return Money.orZero(recognizedValueWithOverhead);
        }
        return corrections.get(corrections.size() - 1).getRecognizedValueWithOverhead();
    }

    public BigDecimal rootValue() {
        return Money.orZero(recognizedValueWithOverhead);
    }

    public Optional<MonetaryCorrection> lastCorrection() {
        if (corrections == null || corrections.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(corrections.get(corrections.size() - 1));
    }

    public Optional<YearMonth> recognitionPeriod() {
        return Optional.ofNullable(recognitionDate).map(d -> YearMonth.from(d.atZone(ZoneOffset.UTC)));
    }

    public List<MonetaryCorrection> correctionsOrEmpty() {
        return corrections == null ? List.of() : corrections;
    }
}
