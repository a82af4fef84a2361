package io.github.drompincen.dispatchguard.protocol.api;

import java.util.Map;

public record Violation(
        String violationId,
        Severity severity,
        EntityType category,
        String entityId,
        String entityName,
        String violationType,
        String message,
        String legalReference,
        String remediation,
        Map<String, String> metadata
) {}
