package io.github.drompincen.dispatchguard.protocol.api;

import java.time.Instant;
import java.util.Map;

/**
 * One proactive alert. {@code remainingDays} is negative for things already
 * overdue and {@code null} when the alert is not date-driven.
 */
public record Alert(
        AlertType type,
        Severity priority,
        String title,
        String message,
        EntityType entityType,
        String entityId,
        String entityName,
        Integer remainingDays,
        Map<String, Object> metadata,
        Instant createdAt
) {}
