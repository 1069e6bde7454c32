package com.kreasipositif.ipcacorrection.repository.memory;

import com.kreasipositif.ipcacorrection.domain.CorrectionSession;
import com.kreasipositif.ipcacorrection.domain.SessionStatus;
import com.kreasipositif.ipcacorrection.repository.CorrectionSessionStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
@ConditionalOnProperty(prefix = "correction", name = "persistence", havingValue = "memory")
public class InMemoryCorrectionSessionStore implements CorrectionSessionStore {

    private final Map<String, CorrectionSession> sessions = new ConcurrentHashMap<>();

    @Override
    public CorrectionSession save(CorrectionSession session) {
        sessions.put(session.getId(), session);
        return session;
    }

    @Override
    public Optional<CorrectionSession> findById(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    @Override
    public List<CorrectionSession> findByStatus(SessionStatus status) {
        return sessions.values().stream()
                .filter(s -> s.getStatus() == status)
                .sorted(Comparator.comparing(CorrectionSession::getCreatedAt))
                .toList();
    }

    public void clear() {
        sessions.clear();
    }
}
