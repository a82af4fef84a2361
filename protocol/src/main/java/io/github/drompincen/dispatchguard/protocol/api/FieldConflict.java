package io.github.drompincen.dispatchguard.protocol.api;

public record FieldConflict(
        String field,
        String label,
        Object sourceValue,
        Object storeValue,
        ConflictStrategy recommended,
        Severity severity,
        String reason
) {}
