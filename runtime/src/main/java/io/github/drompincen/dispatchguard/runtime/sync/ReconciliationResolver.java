package io.github.drompincen.dispatchguard.runtime.sync;

import io.github.drompincen.dispatchguard.protocol.api.ConflictStrategy;
import io.github.drompincen.dispatchguard.protocol.api.FieldConflict;
import io.github.drompincen.dispatchguard.protocol.api.RollbackResult;
import io.github.drompincen.dispatchguard.protocol.api.SnapshotInfo;
import io.github.drompincen.dispatchguard.protocol.api.StoreOnlyRecord;
import io.github.drompincen.dispatchguard.protocol.api.SyncAnalysis;
import io.github.drompincen.dispatchguard.protocol.api.SyncConflict;
import io.github.drompincen.dispatchguard.protocol.api.SyncEntityType;
import io.github.drompincen.dispatchguard.protocol.api.SyncResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Reconciles an external batch of workers or worksites with the store.
 * {@link #analyze} is read-only; {@link #resolve} snapshots the collection and then applies
 * every planned create and update in a single transaction.
 */
@Service
public class ReconciliationResolver {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationResolver.class);
    private static final List<String> SOURCE_MODIFIED_KEYS = List.of("updatedAt", "modifiedAt");

    private final Map<SyncEntityType, SyncTarget<?>> targets = new EnumMap<>(SyncEntityType.class);
    private final SnapshotService snapshotService;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public ReconciliationResolver(List<SyncTarget<?>> targets, SnapshotService snapshotService,
                                  TransactionTemplate transactionTemplate, Clock clock) {
        targets.forEach(t -> this.targets.put(t.entityType(), t));
        this.snapshotService = snapshotService;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
    }

    // --- analyze ---

    public SyncAnalysis analyze(SyncEntityType entityType, List<Map<String, Object>> sourceBatch, String sourceType) {
        SyncAnalysis analysis = analyze(target(entityType), sourceBatch != null ? sourceBatch : List.of(), sourceType);
        log.info("Analyzed {} {} rows from {}: {} to create, {} to update, {} unchanged, {} store-only",
                analysis.sourceCount(), entityType.collectionName(), sourceType, analysis.toCreate().size(),
                analysis.toUpdate().size(), analysis.unchanged().size(), analysis.storeOnly().size());
        return analysis;
    }

    private <D> SyncAnalysis analyze(SyncTarget<D> target, List<Map<String, Object>> batch, String sourceType) {
        Instant analyzedAt = clock.instant();
        Map<String, D> stored = new LinkedHashMap<>();
        for (D doc : target.findAll()) {
            String key = target.naturalKey(doc);
            if (key != null) {
                stored.putIfAbsent(key, doc);
            }
        }

        List<Map<String, Object>> toCreate = new ArrayList<>();
        List<SyncConflict> toUpdate = new ArrayList<>();
        List<String> unchanged = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        int skippedRows = 0;

        for (Map<String, Object> row : batch) {
            String key = row != null ? target.naturalKey(row) : null;
            if (key == null) {
                skippedRows++;
                continue;
            }
            if (!seen.add(key)) {
                warnings.add("Duplicate key " + key + " in source batch; first occurrence kept");
                continue;
            }
            D existing = stored.get(key);
            if (existing == null) {
                toCreate.add(new LinkedHashMap<>(row));
                continue;
            }
            List<FieldConflict> conflicts = compare(target, row, existing);
            if (conflicts.isEmpty()) {
                unchanged.add(key);
            } else {
                toUpdate.add(new SyncConflict(target.entityType(), key, target.displayName(existing),
                        target.id(existing), new LinkedHashMap<>(row), sourceModifiedAt(row), conflicts));
            }
        }

        List<StoreOnlyRecord> storeOnly = new ArrayList<>();
        stored.forEach((key, doc) -> {
            if (!seen.contains(key)) {
                storeOnly.add(new StoreOnlyRecord(key, target.displayName(doc), target.status(doc)));
            }
        });

        return new SyncAnalysis(UUID.randomUUID().toString(), sourceType, target.entityType(), batch.size(),
                stored.size(), toCreate, toUpdate, unchanged, storeOnly, skippedRows, warnings, analyzedAt);
    }

    static <D> List<FieldConflict> compare(SyncTarget<D> target, Map<String, Object> row, D stored) {
        List<FieldConflict> conflicts = new ArrayList<>();
        for (TrackedField<D> field : target.trackedFields()) {
            Object sourceValue = field.sourceValue(row);
            if (sourceValue == null) continue;
            Object storeValue = field.storeValue(stored);
            if (!ValueNormalizer.sameValue(sourceValue, storeValue)) {
                conflicts.add(new FieldConflict(field.field(), field.label(), sourceValue, storeValue,
                        field.recommended(), field.severity(),
                        storeValue == null ? field.label() + " is empty in the store"
                                : field.label() + " differs between source and store"));
            }
        }
        return conflicts;
    }

    private Instant sourceModifiedAt(Map<String, Object> row) {
        for (String key : SOURCE_MODIFIED_KEYS) {
            Instant at = ValueNormalizer.toInstant(row.get(key), clock.getZone());
            if (at != null) return at;
        }
        return null;
    }

    // --- resolve ---

    /**
     * Applies an analysis. {@code strategy} may be null, in which case each field's recommended
     * strategy is used; {@code overrides} map a natural key to the strategy for that record.
     */
    public SyncResult resolve(SyncAnalysis analysis, ConflictStrategy strategy,
                              Map<String, ConflictStrategy> overrides) {
        SyncTarget<?> target = target(analysis.entityType());
        Map<String, ConflictStrategy> manual = overrides != null ? overrides : Map.of();

        String snapshotId = snapshotService.snapshot(target);
        Outcome outcome = new Outcome();
        try {
            transactionTemplate.executeWithoutResult(status -> apply(target, analysis, strategy, manual, outcome));
        } catch (RuntimeException e) {
            log.error("Sync of {} failed and was rolled back (snapshot {}): {}",
                    analysis.entityType().collectionName(), snapshotId, e.getMessage(), e);
            throw e;
        }

        log.info("Sync of {} committed: {} created, {} updated, {} skipped, {} pending, {} errors",
                analysis.entityType().collectionName(), outcome.created, outcome.updated, outcome.skipped,
                outcome.pending, outcome.errors.size());
        return new SyncResult(true, outcome.created, outcome.updated, outcome.skipped, outcome.resolved,
                outcome.pending, List.copyOf(outcome.errors), List.copyOf(outcome.warnings), snapshotId,
                clock.instant());
    }

    private <D> void apply(SyncTarget<D> target, SyncAnalysis analysis, ConflictStrategy strategy,
                           Map<String, ConflictStrategy> overrides, Outcome outcome) {
        Instant now = clock.instant();

        for (Map<String, Object> row : analysis.toCreate()) {
            String key = target.naturalKey(row);
            D created;
            try {
                created = target.create(key, row, now);
            } catch (IllegalArgumentException e) {
                outcome.errors.add("Row " + key + ": " + e.getMessage());
                continue;
            }
            target.save(created);
            outcome.created++;
        }

        for (SyncConflict conflict : analysis.toUpdate()) {
            Optional<D> current = target.findByKey(conflict.entityKey());
            if (current.isEmpty()) {
                outcome.warnings.add("Record " + conflict.entityKey() + " is no longer in the store; skipped");
                outcome.skipped++;
                continue;
            }
            D doc = current.get();
            ConflictStrategy recordStrategy = overrides.getOrDefault(conflict.entityKey(), strategy);
            Instant sourceTime = conflict.sourceModifiedAt() != null ? conflict.sourceModifiedAt() : analysis.analyzedAt();
            Instant storeTime = target.modifiedAt(doc);

            int written = 0;
            boolean pending = false;
            try {
                for (FieldConflict fc : conflict.conflicts()) {
                    ConflictStrategy effective = recordStrategy != null ? recordStrategy : fc.recommended();
                    if (!sourceWins(effective, sourceTime, storeTime)) {
                        pending |= effective == ConflictStrategy.MANUAL;
                        continue;
                    }
                    TrackedField<D> field = trackedField(target, fc.field());
                    field.apply(doc, fc.sourceValue());
                    written++;
                }
            } catch (IllegalArgumentException e) {
                outcome.errors.add("Record " + conflict.entityKey() + ": " + e.getMessage());
                continue;
            }

            if (written > 0) {
                target.touch(doc, now);
                target.save(doc);
                outcome.updated++;
            }
            if (pending) {
                outcome.pending++;
            } else {
                outcome.resolved++;
                if (written == 0) outcome.skipped++;
            }
        }
    }

    static boolean sourceWins(ConflictStrategy strategy, Instant sourceTime, Instant storeTime) {
        return switch (strategy) {
            case SOURCE_WINS -> true;
            case DB_WINS, MANUAL -> false;
            case NEWEST_WINS -> storeTime == null || sourceTime.isAfter(storeTime);
        };
    }

    private static <D> TrackedField<D> trackedField(SyncTarget<D> target, String name) {
        return target.trackedFields().stream()
                .filter(f -> f.field().equals(name))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown field " + name));
    }

    // --- snapshots ---

    public List<SnapshotInfo> listSnapshots() {
        return snapshotService.listSnapshots();
    }

    public RollbackResult rollback(String snapshotId) {
        return snapshotService.rollback(snapshotId);
    }

    private SyncTarget<?> target(SyncEntityType entityType) {
        SyncTarget<?> target = targets.get(entityType);
        if (target == null) {
            throw new IllegalArgumentException("No sync target registered for " + entityType);
        }
        return target;
    }

    private static final class Outcome {
        int created;
        int updated;
        int skipped;
        int resolved;
        int pending;
        final List<String> errors = new ArrayList<>();
        final List<String> warnings = new ArrayList<>();
    }
}
