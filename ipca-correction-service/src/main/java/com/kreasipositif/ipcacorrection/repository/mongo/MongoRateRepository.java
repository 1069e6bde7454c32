package com.kreasipositif.ipcacorrection.repository.mongo;

import com.kreasipositif.ipcacorrection.domain.IndexType;
import com.kreasipositif.ipcacorrection.domain.Money;
import com.kreasipositif.ipcacorrection.repository.RateRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.Optional;

@Slf4j
@Repository
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "correction", name = "persistence", havingValue = "mongo", matchIfMissing = true)
public class MongoRateRepository implements RateRepository {

    private final MongoTemplate mongoTemplate;

    @Override
    public Optional<BigDecimal> findFactor(IndexType indexType, YearMonth period) {
        Query query = Query.query(Criteria.where("anoReferencia").is(period.getYear())
                .and("mesReferencia").is(period.getMonthValue()));
        IndexRateDocument rate = mongoTemplate.findOne(query, IndexRateDocument.class, collectionFor(indexType));
        if (rate == null || rate.getPercent() == null) {
            log.warn("No {} rate published for {}", indexType, period);
            return Optional.empty();
        }
        return Optional.of(Money.factorFromPercent(rate.getPercent()));
    }

    private static String collectionFor(IndexType indexType) {
        return switch (indexType) {
            case IPCA -> "ipca_entity";
            case IGPM -> "igpm_entity";
        };
    }
}
