package com.kreasipositif.ipcacorrection.repository.memory;

import com.kreasipositif.ipcacorrection.config.IndexRateProperties;
import com.kreasipositif.ipcacorrection.domain.IndexType;
import com.kreasipositif.ipcacorrection.domain.Money;
import com.kreasipositif.ipcacorrection.repository.RateRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Rate lookup over the {@code index-rates} table from application.yml.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "correction", name = "persistence", havingValue = "memory")
public class ConfiguredRateRepository implements RateRepository {

    private final IndexRateProperties indexRateProperties;

    /**
     * Lazily-computed index keyed by {@code type + ":" + yyyy-MM}. Built once on first access.
     */
    private volatile Map<String, BigDecimal> rateIndex;

    @Override
    public Optional<BigDecimal> findFactor(IndexType indexType, YearMonth period) {
        BigDecimal factor = getRateIndex().get(buildKey(indexType, period));
        if (factor == null) {
            log.debug("No configured {} rate for {}", indexType, period);
        }
        return Optional.ofNullable(factor);
    }

    private Map<String, BigDecimal> getRateIndex() {
        if (rateIndex == null) {
            synchronized (this) {
                if (rateIndex == null) {
                    rateIndex = indexRateProperties.getEntries().stream()
                            .collect(Collectors.toMap(
                                    e -> buildKey(e.getType(), YearMonth.of(e.getYear(), e.getMonth())),
                                    e -> Money.factorFromPercent(e.getPercent()),
                                    (first, second) -> second
                            ));
                    log.info("Configured rate index built with {} entries", rateIndex.size());
                }
            }
        }
        return rateIndex;
    }

    private static String buildKey(IndexType type, YearMonth period) {
        return type + ":" + period;
    }
}
