package com.kreasipositif.ipcacorrection.repository;

import com.kreasipositif.ipcacorrection.domain.IndexType;

import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.Optional;

/**
 * Historical IPCA/IGPM factors by reference month.
 */
public interface RateRepository {

    /**
     * @return the factor (1 + percent / 100), or empty when the month has no published rate
     */
    Optional<BigDecimal> findFactor(IndexType indexType, YearMonth period);
}
