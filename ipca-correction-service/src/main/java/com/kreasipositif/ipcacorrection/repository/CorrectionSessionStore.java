package com.kreasipositif.ipcacorrection.repository;

import com.kreasipositif.ipcacorrection.domain.CorrectionSession;
import com.kreasipositif.ipcacorrection.domain.SessionStatus;

import java.util.List;
import java.util.Optional;

public interface CorrectionSessionStore {

    CorrectionSession save(CorrectionSession session);

    Optional<CorrectionSession> findById(String sessionId);

    List<CorrectionSession> findByStatus(SessionStatus status);
}
