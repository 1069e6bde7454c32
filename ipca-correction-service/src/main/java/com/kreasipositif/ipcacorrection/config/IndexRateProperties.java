package com.kreasipositif.ipcacorrection.config;

import com.kreasipositif.ipcacorrection.domain.IndexType;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Binds the {@code index-rates} section from application.yml.
 * Monthly IPCA/IGPM percentages used when rates are not read from MongoDB.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "index-rates")
public class IndexRateProperties {

    private List<IndexRateEntry> entries = new ArrayList<>();

    @Getter
    @Setter
    public static class IndexRateEntry {
        /** Index the rate belongs to: IPCA or IGPM. */
        private IndexType type;
        /** Reference year, e.g. 2024. */
        private int year;
        /** Reference month, 1-12. */
        private int month;
        /** Monthly accumulated percentage, e.g. 4.5 for a 1.045 factor. */
        private BigDecimal percent;
    }
}
