package io.github.drompincen.dispatchguard.runtime.scheduler;

import io.github.drompincen.dispatchguard.protocol.api.AuditScope;
import io.github.drompincen.dispatchguard.protocol.api.ComplianceReport;
import io.github.drompincen.dispatchguard.protocol.api.DailyDigest;
import io.github.drompincen.dispatchguard.runtime.alert.AlertSweeper;
import io.github.drompincen.dispatchguard.runtime.compliance.ComplianceAuditor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Runs the daily alert digest and the weekly full audit, logging their outcome. */
@Component
@ConditionalOnProperty(prefix = "dispatchguard.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ComplianceScheduler {

    private static final Logger log = LoggerFactory.getLogger(ComplianceScheduler.class);

    private final AlertSweeper alertSweeper;
    private final ComplianceAuditor complianceAuditor;

    public ComplianceScheduler(AlertSweeper alertSweeper, ComplianceAuditor complianceAuditor) {
        this.alertSweeper = alertSweeper;
        this.complianceAuditor = complianceAuditor;
    }

    @Scheduled(cron = "${dispatchguard.scheduler.daily-sweep-cron:0 0 6 * * *}")
    public void dailySweep() {
        try {
            DailyDigest digest = alertSweeper.dailyDigest();
            log.info("Daily digest {}: {} alerts, {} action required, {} expiring this week, {} unassigned workers",
                    digest.date(), digest.counts().values().stream().mapToInt(Integer::intValue).sum(),
                    digest.actionRequired(), digest.expiringThisWeek(), digest.unassignedWorkers());
            if (!digest.checkFailures().isEmpty()) {
                log.warn("Daily digest ran with {} failed checks: {}", digest.checkFailures().size(), digest.checkFailures());
            }
        } catch (Exception e) {
            log.error("Daily alert sweep failed", e);
        }
    }

    @Scheduled(cron = "${dispatchguard.scheduler.weekly-audit-cron:0 0 7 * * MON}")
    public void weeklyAudit() {
        try {
            ComplianceReport report = complianceAuditor.audit(AuditScope.full());
            log.info("Weekly audit {}: score {} over {} entities, {} violations, {} warnings",
                    report.reportId(), report.complianceScore(), report.totalEntitiesAudited(),
                    report.violations().size(), report.warnings().size());
            if (!report.checkFailures().isEmpty()) {
                log.warn("Weekly audit ran with {} failed checks: {}", report.checkFailures().size(), report.checkFailures());
            }
        } catch (Exception e) {
            log.error("Weekly compliance audit failed", e);
        }
    }
}
