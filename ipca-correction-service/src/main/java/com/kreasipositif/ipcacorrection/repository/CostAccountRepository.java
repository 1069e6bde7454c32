package com.kreasipositif.ipcacorrection.repository;

import com.kreasipositif.ipcacorrection.domain.CostAccount;
import com.kreasipositif.ipcacorrection.domain.CostAccountFilter;

import java.util.List;
import java.util.Optional;

/**
 * Access to source cost accounts and their corrected copies.
 *
 * <p>Source records are read-only here; every write goes to the corrected store.
 */
public interface CostAccountRepository {

    Optional<CostAccount> findById(String id);

    Optional<CostAccount> findCorrectedBySourceId(String sourceId);

    /** Matching source records sorted by contract, field and recognition date. */
    List<CostAccount> findAll(CostAccountFilter filter);

    /** Stores a corrected copy, replacing any previous copy with the same id. */
    CostAccount saveCorrected(CostAccount corrected);
}
