package io.github.drompincen.dispatchguard.protocol.api;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

public record DailyDigest(
        LocalDate date,
        Map<Severity, Integer> counts,
        int actionRequired,
        int expiringThisWeek,
        int unassignedWorkers,
        int expiredContracts,
        List<Alert> topPriorities,
        List<CheckFailure> checkFailures,
        Instant generatedAt
) {}
