package io.github.drompincen.dispatchguard.protocol.api;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Read-only classification of a source batch against the store. Nothing in
 * {@code storeOnly} is ever deleted by a later resolve.
 */
public record SyncAnalysis(
        String analysisId,
        String sourceType,
        SyncEntityType entityType,
        int sourceCount,
        int storeCount,
        List<Map<String, Object>> toCreate,
        List<SyncConflict> toUpdate,
        List<String> unchanged,
        List<StoreOnlyRecord> storeOnly,
        int skippedRows,
        List<String> warnings,
        Instant analyzedAt
) {
    public int conflictCount() {
        return toUpdate.stream().mapToInt(c -> c.conflicts().size()).sum();
    }
}
