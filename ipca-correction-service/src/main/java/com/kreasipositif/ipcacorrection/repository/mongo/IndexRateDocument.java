package com.kreasipositif.ipcacorrection.repository.mongo;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Field;

import java.math.BigDecimal;

/**
 * Monthly index entry as published in {@code ipca_entity} and {@code igpm_entity}.
 */
@Getter
@Setter
@NoArgsConstructor
public class IndexRateDocument {

    @Id
    private String id;

    @Field("anoReferencia")
    private Integer year;

    @Field("mesReferencia")
    private Integer month;

    /** Percentage for the month, e.g. 4.5. */
    @Field("valor")
    private BigDecimal percent;
}
