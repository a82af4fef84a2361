package io.github.drompincen.dispatchguard.protocol.api;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/** All field divergences found for one natural key. */
public record SyncConflict(
        SyncEntityType entityType,
        String entityKey,
        String entityName,
        String storeRecordId,
        Map<String, Object> sourceRecord,
        Instant sourceModifiedAt,
        List<FieldConflict> conflicts
) {
    public Severity maxSeverity() {
        Severity max = null;
        for (FieldConflict c : conflicts) {
            max = Severity.mostSevere(max, c.severity());
        }
        return max != null ? max : Severity.LOW;
    }
}
