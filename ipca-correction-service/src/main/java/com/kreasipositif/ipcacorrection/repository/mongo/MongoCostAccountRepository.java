package com.kreasipositif.ipcacorrection.repository.mongo;

import com.kreasipositif.ipcacorrection.domain.CostAccount;
import com.kreasipositif.ipcacorrection.domain.CostAccountFilter;
import com.kreasipositif.ipcacorrection.repository.CostAccountRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Cost accounts in {@code conta_custo_oleo_entity}; corrected copies in
 * {@code conta_custo_oleo_corrigida_entity}.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "correction", name = "persistence", havingValue = "mongo", matchIfMissing = true)
public class MongoCostAccountRepository implements CostAccountRepository {

    static final String SOURCE_COLLECTION = "conta_custo_oleo_entity";
    static final String CORRECTED_COLLECTION = "conta_custo_oleo_corrigida_entity";

    private final MongoTemplate mongoTemplate;

    @Override
    public Optional<CostAccount> findById(String id) {
        return Optional.ofNullable(mongoTemplate.findById(id, CostAccount.class, SOURCE_COLLECTION));
    }

    @Override
    public Optional<CostAccount> findCorrectedBySourceId(String sourceId) {
        Query query = Query.query(Criteria.where("idOrigem").is(sourceId))
                .with(Sort.by(Sort.Direction.DESC, "dataCorrecaoAplicada"));
        return Optional.ofNullable(mongoTemplate.findOne(query, CostAccount.class, CORRECTED_COLLECTION));
    }

    @Override
    public List<CostAccount> findAll(CostAccountFilter filter) {
        Criteria criteria = new Criteria();
        if (filter.getEntityId() != null) {
            criteria.and("_id").is(filter.getEntityId());
        }
        if (filter.getContractCode() != null) {
            criteria.and("contratoCpp").is(filter.getContractCode());
        }
        if (filter.getFieldCode() != null) {
            criteria.and("campo").is(filter.getFieldCode());
        }
        if (filter.getExpenseOrigin() != null) {
            criteria.and("origemDosGastos").is(filter.getExpenseOrigin());
        }
        Query query = Query.query(criteria)
                .with(Sort.by("contratoCpp", "campo", "dataReconhecimento"));
        List<CostAccount> accounts = mongoTemplate.find(query, CostAccount.class, SOURCE_COLLECTION);
        log.debug("Loaded {} cost accounts for filter {}", accounts.size(), filter);
        return accounts;
    }

    @Override
    public CostAccount saveCorrected(CostAccount corrected) {
        CostAccount saved = mongoTemplate.save(corrected, CORRECTED_COLLECTION);
        log.info("Corrected cost account saved: id={}, source={}", saved.getId(), saved.getSourceEntityId());
        return saved;
    }
}
