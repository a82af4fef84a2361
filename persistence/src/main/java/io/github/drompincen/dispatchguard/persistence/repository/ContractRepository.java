package io.github.drompincen.dispatchguard.persistence.repository;

import io.github.drompincen.dispatchguard.persistence.document.ContractDocument;
import io.github.drompincen.dispatchguard.protocol.api.ContractStatus;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface ContractRepository extends MongoRepository<ContractDocument, String>, ContractRepositoryCustom {
    Optional<ContractDocument> findByContractNumber(String contractNumber);
    List<ContractDocument> findByStatus(ContractStatus status);
    List<ContractDocument> findByWorksiteId(String worksiteId);
    List<ContractDocument> findByStatusAndDispatchEndDateBefore(ContractStatus status, LocalDate date);
    long countByStatus(ContractStatus status);
    long countByStatusAndDispatchEndDateBefore(ContractStatus status, LocalDate date);

    /** Contracts of the worker whose dispatch period intersects {@code [start, end]}. */
    @Query("{ 'workerIds': ?0, 'status': { $in: ?3 }, 'dispatchStartDate': { $lte: ?2 }, 'dispatchEndDate': { $gte: ?1 } }")
    List<ContractDocument> findOverlapping(String workerId, LocalDate start, LocalDate end, Collection<ContractStatus> statuses);

    @Query("{ 'status': ?0, 'dispatchStartDate': { $lte: ?1 }, 'dispatchEndDate': { $gte: ?1 } }")
    List<ContractDocument> findCovering(ContractStatus status, LocalDate date);
}
