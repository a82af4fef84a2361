package io.github.drompincen.dispatchguard.protocol.api;

import java.time.LocalDate;

/**
 * Filters applied to an audit run. Contracts are matched on dispatch start
 * {@code >= periodStart}, dispatch end {@code <= periodEnd}, worksite and status;
 * {@code null} disables a filter.
 */
public record AuditScope(
        LocalDate periodStart,
        LocalDate periodEnd,
        String worksiteId,
        ContractStatus contractStatus,
        Coverage coverage
) {
    public enum Coverage {
        FULL, CONTRACTS_ONLY
    }

    public static AuditScope full() {
        return new AuditScope(null, null, null, null, Coverage.FULL);
    }

    public static AuditScope full(LocalDate periodStart, LocalDate periodEnd, String worksiteId) {
        return new AuditScope(periodStart, periodEnd, worksiteId, null, Coverage.FULL);
    }

    public static AuditScope contractsOnly(ContractStatus status, String worksiteId) {
        return new AuditScope(null, null, worksiteId, status, Coverage.CONTRACTS_ONLY);
    }

    public boolean includesWorksitesAndWorkers() {
        return coverage != Coverage.CONTRACTS_ONLY;
    }
}
