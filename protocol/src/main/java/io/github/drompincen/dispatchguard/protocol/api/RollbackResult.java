package io.github.drompincen.dispatchguard.protocol.api;

public record RollbackResult(
        String snapshotId,
        boolean found,
        int restored
) {}
