package com.kreasipositif.ipcacorrection.repository.memory;

import com.kreasipositif.ipcacorrection.domain.CostAccount;
import com.kreasipositif.ipcacorrection.domain.CostAccountFilter;
import com.kreasipositif.ipcacorrection.repository.CostAccountOrdering;
import com.kreasipositif.ipcacorrection.repository.CostAccountRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-backed cost account store for local runs and tests.
 */
@Slf4j
@Repository
@ConditionalOnProperty(prefix = "correction", name = "persistence", havingValue = "memory")
public class InMemoryCostAccountRepository implements CostAccountRepository {

    private final Map<String, CostAccount> sources = new ConcurrentHashMap<>();
    private final Map<String, CostAccount> corrected = new ConcurrentHashMap<>();

    @Override
    public Optional<CostAccount> findById(String id) {
        return Optional.ofNullable(sources.get(id)).map(a -> a.toBuilder().build());
    }

    @Override
    public Optional<CostAccount> findCorrectedBySourceId(String sourceId) {
        return corrected.values().stream()
                .filter(c -> sourceId.equals(c.getSourceEntityId()))
                .findFirst();
    }

    @Override
    public List<CostAccount> findAll(CostAccountFilter filter) {
        return sources.values().stream()
                .filter(filter::matches)
                .sorted(CostAccountOrdering.BY_CONTRACT_FIELD_RECOGNITION)
                .toList();
    }

    @Override
    public CostAccount saveCorrected(CostAccount account) {
        corrected.put(account.getId(), account);
        log.debug("Corrected cost account stored: id={}, source={}", account.getId(), account.getSourceEntityId());
        return account;
    }

    /** Seeds a source record. */
    public void putSource(CostAccount account) {
        sources.put(account.getId(), account.toBuilder()
                .corrections(new ArrayList<>(account.correctionsOrEmpty()))
                .build());
    }

    public Optional<CostAccount> findCorrectedById(String id) {
        return Optional.ofNullable(corrected.get(id));
    }

    public void clear() {
        sources.clear();
        corrected.clear();
    }
}
