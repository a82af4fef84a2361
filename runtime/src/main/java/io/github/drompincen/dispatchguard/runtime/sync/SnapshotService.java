package io.github.drompincen.dispatchguard.runtime.sync;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.dispatchguard.persistence.document.SyncSnapshotDocument;
import io.github.drompincen.dispatchguard.persistence.repository.SyncSnapshotRepository;
import io.github.drompincen.dispatchguard.protocol.api.RollbackResult;
import io.github.drompincen.dispatchguard.protocol.api.SnapshotInfo;
import io.github.drompincen.dispatchguard.protocol.api.SyncEntityType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Takes full-collection snapshots before a sync run mutates the store, and restores them.
 */
@Service
public class SnapshotService {

    private static final Logger log = LoggerFactory.getLogger(SnapshotService.class);
    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final TypeReference<Map<String, Object>> ENTITY_MAP = new TypeReference<>() {};

    private final SyncSnapshotRepository snapshotRepository;
    private final Map<SyncEntityType, SyncTarget<?>> targets = new EnumMap<>(SyncEntityType.class);
    private final ObjectMapper objectMapper;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public SnapshotService(SyncSnapshotRepository snapshotRepository, List<SyncTarget<?>> targets,
                           ObjectMapper objectMapper, TransactionTemplate transactionTemplate, Clock clock) {
        this.snapshotRepository = snapshotRepository;
        targets.forEach(t -> this.targets.put(t.entityType(), t));
        this.objectMapper = objectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
    }

    /** Copies every document of the target's collection and returns the new snapshot id. */
    public String snapshot(SyncTarget<?> target) {
        Instant now = clock.instant();
        String collection = target.entityType().collectionName();
        String snapshotId = "sync_" + collection + "_" + STAMP.format(now.atZone(clock.getZone()))
                + "_" + UUID.randomUUID().toString().substring(0, 8);

        List<Map<String, Object>> entities = target.findAll().stream()
                .map(doc -> objectMapper.convertValue(doc, ENTITY_MAP))
                .toList();

        SyncSnapshotDocument snapshot = new SyncSnapshotDocument();
        snapshot.setSnapshotId(snapshotId);
        snapshot.setCollectionName(collection);
        snapshot.setEntityType(target.entityType());
        snapshot.setCreatedAt(now);
        snapshot.setEntityCount(entities.size());
        snapshot.setEntities(entities);
        snapshotRepository.save(snapshot);

        log.info("Snapshot {} taken of {} ({} entities)", snapshotId, collection, entities.size());
        return snapshotId;
    }

    public List<SnapshotInfo> listSnapshots() {
        return snapshotRepository.findAllHeaders().stream()
                .map(s -> new SnapshotInfo(s.getSnapshotId(), s.getCollectionName(), s.getEntityType(),
                        s.getEntityCount(), s.getCreatedAt()))
                .toList();
    }

    /**
     * Overwrites every entity listed in the snapshot with its snapshotted values, in one transaction.
     * Entities created after the snapshot are left in place.
     */
    public RollbackResult rollback(String snapshotId) {
        Optional<SyncSnapshotDocument> found = snapshotRepository.findById(snapshotId);
        if (found.isEmpty()) {
            log.warn("Rollback requested for unknown snapshot {}", snapshotId);
            return new RollbackResult(snapshotId, false, 0);
        }
        SyncSnapshotDocument snapshot = found.get();
        SyncTarget<?> target = targets.get(snapshot.getEntityType());
        if (target == null) {
            throw new IllegalStateException("No sync target registered for " + snapshot.getEntityType());
        }
        List<Map<String, Object>> entities = snapshot.getEntities() != null ? snapshot.getEntities() : List.of();
        try {
            Integer restored = transactionTemplate.execute(status -> restore(target, entities));
            int count = restored != null ? restored : 0;
            log.info("Rolled back {} from snapshot {} ({} entities restored)",
                    snapshot.getCollectionName(), snapshotId, count);
            return new RollbackResult(snapshotId, true, count);
        } catch (RuntimeException e) {
            log.error("Rollback from snapshot {} failed: {}", snapshotId, e.getMessage(), e);
            throw e;
        }
    }

    private <D> int restore(SyncTarget<D> target, List<Map<String, Object>> entities) {
        int restored = 0;
        for (Map<String, Object> entity : entities) {
            D document = objectMapper.convertValue(entity, target.documentType());
            target.save(document);
            restored++;
        }
        return restored;
    }
}
