package io.github.drompincen.dispatchguard.protocol.api;

import java.time.Instant;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public record ComplianceReport(
        String reportId,
        Instant generatedAt,
        LocalDate periodStart,
        LocalDate periodEnd,
        AuditScope.Coverage scope,
        int totalEntitiesAudited,
        int complianceScore,
        List<Violation> violations,
        List<Violation> warnings,
        CategoryStats contracts,
        CategoryStats worksites,
        int workersAudited,
        List<CheckFailure> checkFailures
) {
    public record CategoryStats(int audited, int compliant) {
        public double complianceRate() {
            if (audited == 0) return 100.0;
            return Math.round(compliant * 1000.0 / audited) / 10.0;
        }
    }

    /** Violation counts per severity; warnings are not included. */
    public Map<Severity, Long> bySeverity() {
        Map<Severity, Long> counts = new EnumMap<>(Severity.class);
        for (Severity s : Severity.values()) {
            if (s != Severity.INFO) counts.put(s, 0L);
        }
        for (Violation v : violations) {
            counts.merge(v.severity(), 1L, Long::sum);
        }
        return counts;
    }
}
