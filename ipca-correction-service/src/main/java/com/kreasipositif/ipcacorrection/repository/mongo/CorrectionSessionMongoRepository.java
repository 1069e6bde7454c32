package com.kreasipositif.ipcacorrection.repository.mongo;

import com.kreasipositif.ipcacorrection.domain.CorrectionSession;
import com.kreasipositif.ipcacorrection.domain.SessionStatus;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface CorrectionSessionMongoRepository extends MongoRepository<CorrectionSession, String> {

    List<CorrectionSession> findByStatusOrderByCreatedAtAsc(SessionStatus status);
}
