package com.kreasipositif.ipcacorrection.repository.mongo;

import com.kreasipositif.ipcacorrection.domain.CorrectionSession;
import com.kreasipositif.ipcacorrection.domain.SessionStatus;
import com.kreasipositif.ipcacorrection.repository.CorrectionSessionStore;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "correction", name = "persistence", havingValue = "mongo", matchIfMissing = true)
public class MongoCorrectionSessionStore implements CorrectionSessionStore {

    private final CorrectionSessionMongoRepository repository;

    @Override
    public CorrectionSession save(CorrectionSession session) {
        return repository.save(session);
    }

    @Override
    public Optional<CorrectionSession> findById(String sessionId) {
        return repository.findById(sessionId);
    }

    @Override
    public List<CorrectionSession> findByStatus(SessionStatus status) {
        return repository.findByStatusOrderByCreatedAtAsc(status);
    }
}
