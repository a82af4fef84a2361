package io.github.drompincen.dispatchguard.protocol.api;

import java.time.Instant;

public record SnapshotInfo(
        String snapshotId,
        String collectionName,
        SyncEntityType entityType,
        int entityCount,
        Instant createdAt
) {}
