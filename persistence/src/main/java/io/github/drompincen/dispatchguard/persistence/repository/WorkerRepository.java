package io.github.drompincen.dispatchguard.persistence.repository;

import io.github.drompincen.dispatchguard.persistence.document.WorkerDocument;
import io.github.drompincen.dispatchguard.protocol.api.WorkerStatus;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface WorkerRepository extends MongoRepository<WorkerDocument, String> {
    Optional<WorkerDocument> findByWorkerNumber(String workerNumber);
    List<WorkerDocument> findByStatus(WorkerStatus status);
    List<WorkerDocument> findByStatusAndWorksiteId(WorkerStatus status, String worksiteId);
}
