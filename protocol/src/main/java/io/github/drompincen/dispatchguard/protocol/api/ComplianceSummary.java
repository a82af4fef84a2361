package io.github.drompincen.dispatchguard.protocol.api;

import java.time.Instant;

public record ComplianceSummary(
        int quickScore,
        long activeContracts,
        long expiredButActive,
        long incompleteWorksites,
        ComplianceStatus status,
        Instant generatedAt
) {
    public enum ComplianceStatus {
        COMPLIANT, ISSUES_FOUND
    }
}
