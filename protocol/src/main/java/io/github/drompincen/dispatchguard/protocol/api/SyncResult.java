package io.github.drompincen.dispatchguard.protocol.api;

import java.time.Instant;
import java.util.List;

public record SyncResult(
        boolean success,
        int created,
        int updated,
        int skipped,
        int conflictsResolved,
        int conflictsPending,
        List<String> errors,
        List<String> warnings,
        String snapshotId,
        Instant executedAt
) {}
