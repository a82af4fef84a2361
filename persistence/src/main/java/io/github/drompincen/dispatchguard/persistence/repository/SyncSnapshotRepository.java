package io.github.drompincen.dispatchguard.persistence.repository;

import io.github.drompincen.dispatchguard.persistence.document.SyncSnapshotDocument;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;

import java.util.List;

public interface SyncSnapshotRepository extends MongoRepository<SyncSnapshotDocument, String> {

    /** Snapshot headers, newest first, without the entity payload. */
    @Query(value = "{}", fields = "{ 'entities': 0 }", sort = "{ 'createdAt': -1 }")
    List<SyncSnapshotDocument> findAllHeaders();
}
