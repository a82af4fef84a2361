package io.github.drompincen.dispatchguard.persistence.repository;

import io.github.drompincen.dispatchguard.persistence.document.WorksiteDocument;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;

import java.util.List;
import java.util.Optional;

public interface WorksiteRepository extends MongoRepository<WorksiteDocument, String> {
    Optional<WorksiteDocument> findByWorksiteKey(String worksiteKey);
    List<WorksiteDocument> findByActiveTrue();
    long countByActiveTrue();

    /**
     * Active worksites missing the client responsible, client complaint or dispatch responsible name.
     * Null, empty and whitespace-only values count as missing.
     */
    @Query(value = "{ 'active': true, '$or': ["
            + "{ 'clientResponsibleName': { $in: [null, /^\\s*$/] } },"
            + "{ 'clientComplaintName': { $in: [null, /^\\s*$/] } },"
            + "{ 'dispatchResponsibleName': { $in: [null, /^\\s*$/] } } ] }", count = true)
    long countIncompleteActive();
}
