package io.github.drompincen.dispatchguard.runtime.sync;

import io.github.drompincen.dispatchguard.protocol.api.SyncEntityType;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A store collection that can be reconciled against an external batch.
 *
 * @param <D> the persisted document type
 */
public interface SyncTarget<D> {

    SyncEntityType entityType();

    Class<D> documentType();

    List<TrackedField<D>> trackedFields();

    /** Natural key of a source row, or {@code null} when the row has none. */
    String naturalKey(Map<String, Object> source);

    String naturalKey(D document);

    String displayName(D document);

    String status(D document);

    String id(D document);

    Instant modifiedAt(D document);

    void touch(D document, Instant now);

    /**
     * Builds a new document from a source row.
     *
     * @throws IllegalArgumentException when the row cannot be turned into an entity
     */
    D create(String key, Map<String, Object> source, Instant now);

    List<D> findAll();

    Optional<D> findByKey(String key);

    D save(D document);
}
