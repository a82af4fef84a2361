package io.github.drompincen.dispatchguard.runtime.compliance;

import io.github.drompincen.dispatchguard.persistence.document.ContractDocument;
import io.github.drompincen.dispatchguard.persistence.document.WorksiteDocument;
import io.github.drompincen.dispatchguard.persistence.document.WorkerDocument;
import io.github.drompincen.dispatchguard.persistence.repository.ContractRepository;
import io.github.drompincen.dispatchguard.persistence.repository.WorksiteRepository;
import io.github.drompincen.dispatchguard.persistence.repository.WorkerRepository;
import io.github.drompincen.dispatchguard.protocol.api.AuditScope;
import io.github.drompincen.dispatchguard.protocol.api.CheckFailure;
import io.github.drompincen.dispatchguard.protocol.api.ComplianceReport;
import io.github.drompincen.dispatchguard.protocol.api.ComplianceSummary;
import io.github.drompincen.dispatchguard.protocol.api.ContractStatus;
import io.github.drompincen.dispatchguard.protocol.api.EntityType;
import io.github.drompincen.dispatchguard.protocol.api.LegalReferences;
import io.github.drompincen.dispatchguard.protocol.api.Severity;
import io.github.drompincen.dispatchguard.protocol.api.ValidationIssue;
import io.github.drompincen.dispatchguard.protocol.api.ValidationResult;
import io.github.drompincen.dispatchguard.protocol.api.Violation;
import io.github.drompincen.dispatchguard.protocol.api.WorkerStatus;
import io.github.drompincen.dispatchguard.runtime.rules.Nationalities;
import io.github.drompincen.dispatchguard.runtime.rules.WorksiteField;
import io.github.drompincen.dispatchguard.runtime.validation.ContractValidationService;
import io.github.drompincen.dispatchguard.runtime.validation.ContractValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Audits contracts, worksites and workers and aggregates the findings into a scored
 * {@link ComplianceReport}. Read-only; each pass is isolated so one failing pass does
 * not abort the others.
 */
@Service
public class ComplianceAuditor {

    private static final Logger log = LoggerFactory.getLogger(ComplianceAuditor.class);

    static final int CUTOFF_WARNING_DAYS = 30;
    static final int VISA_WARNING_DAYS = 30;
    private static final DateTimeFormatter REPORT_ID_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    private final ContractRepository contractRepository;
    private final WorksiteRepository worksiteRepository;
    private final WorkerRepository workerRepository;
    private final ContractValidationService validationService;
    private final Clock clock;

    public ComplianceAuditor(ContractRepository contractRepository,
                             WorksiteRepository worksiteRepository,
                             WorkerRepository workerRepository,
                             ContractValidationService validationService,
                             Clock clock) {
        this.contractRepository = contractRepository;
        this.worksiteRepository = worksiteRepository;
        this.workerRepository = workerRepository;
        this.validationService = validationService;
        this.clock = clock;
    }

    public ComplianceReport audit(AuditScope requested) {
        AuditScope scope = requested != null ? requested : AuditScope.full();
        LocalDate today = LocalDate.now(clock);
        Audit audit = new Audit(today);

        runPass("contracts", audit, () -> auditContracts(scope, audit));
        if (scope.includesWorksitesAndWorkers()) {
            runPass("worksites", audit, () -> auditWorksites(scope, audit));
            runPass("workers", audit, () -> auditWorkers(scope, audit));
        }

        int total = audit.contractsAudited + audit.worksitesAudited + audit.workersAudited;
        int score = score(audit.violations, audit.warnings.size(), total);

        String prefix = scope.includesWorksitesAndWorkers() ? "AUDIT-" : "CONTRACT-AUDIT-";
        ComplianceReport report = new ComplianceReport(
                prefix + LocalDateTime.now(clock).format(REPORT_ID_FORMAT),
                Instant.now(clock),
                scope.periodStart(),
                scope.periodEnd() != null ? scope.periodEnd() : today,
                scope.coverage(),
                total,
                score,
                List.copyOf(audit.violations),
                List.copyOf(audit.warnings),
                new ComplianceReport.CategoryStats(audit.contractsAudited, audit.contractsCompliant),
                new ComplianceReport.CategoryStats(audit.worksitesAudited, audit.worksitesCompliant),
                audit.workersAudited,
                List.copyOf(audit.checkFailures));
        log.info("Audit {} finished: {} entities, score {}, {} violations, {} warnings, {} failed checks",
                report.reportId(), total, score, report.violations().size(), report.warnings().size(),
                report.checkFailures().size());
        return report;
    }

    public ComplianceReport auditContracts(ContractStatus status, String worksiteId) {
        return audit(AuditScope.contractsOnly(status, worksiteId));
    }

    /** Dashboard estimate built from repository counts only. */
    public ComplianceSummary summary() {
        LocalDate today = LocalDate.now(clock);
        long activeContracts = contractRepository.countByStatus(ContractStatus.ACTIVE);
        long expiredButActive = contractRepository.countByStatusAndDispatchEndDateBefore(ContractStatus.ACTIVE, today);
        long incompleteWorksites = worksiteRepository.countIncompleteActive();
        long activeWorksites = worksiteRepository.countByActiveTrue();

        long total = activeContracts + activeWorksites;
        int quickScore = 100;
        if (total > 0) {
            double issues = expiredButActive * 20.0 + incompleteWorksites * 10.0;
            quickScore = clampScore(100.0 - issues / total * 100.0);
        }
        ComplianceSummary.ComplianceStatus status = expiredButActive == 0 && incompleteWorksites == 0
                ? ComplianceSummary.ComplianceStatus.COMPLIANT
                : ComplianceSummary.ComplianceStatus.ISSUES_FOUND;
        return new ComplianceSummary(quickScore, activeContracts, expiredButActive, incompleteWorksites,
                status, Instant.now(clock));
    }

    static int score(List<Violation> violations, int warningCount, int audited) {
        if (audited == 0) {
            return 100;
        }
        double penalty = violations.stream().mapToInt(v -> v.severity().weight()).sum() + warningCount;
        double reduction = Math.max(0.0, Math.min(100.0, penalty / (audited * 20.0) * 100.0));
        return clampScore(100.0 - reduction);
    }

    private static int clampScore(double raw) {
        return Math.max(0, Math.min(100, (int) Math.floor(raw)));
    }

    private void runPass(String name, Audit audit, Runnable pass) {
        int violationMark = audit.violations.size();
        int warningMark = audit.warnings.size();
        try {
            pass.run();
        } catch (RuntimeException e) {
            log.warn("Audit pass '{}' failed: {}", name, e.getMessage(), e);
            audit.violations.subList(violationMark, audit.violations.size()).clear();
            audit.warnings.subList(warningMark, audit.warnings.size()).clear();
            audit.checkFailures.add(CheckFailure.of(name, e));
        }
    }

    private void auditContracts(AuditScope scope, Audit audit) {
        List<ContractDocument> contracts = contractRepository.findInScope(scope);
        for (ContractDocument contract : contracts) {
            int violationMark = audit.violations.size();
            int warningMark = audit.warnings.size();
            try {
                auditContract(contract, audit);
            } catch (RuntimeException e) {
                log.warn("Audit of contract {} failed: {}", contract.getId(), e.getMessage(), e);
                audit.violations.subList(violationMark, audit.violations.size()).clear();
                audit.warnings.subList(warningMark, audit.warnings.size()).clear();
                audit.checkFailures.add(CheckFailure.of("contract:" + contract.getId(), e));
            }
        }
    }

    private void auditContract(ContractDocument contract, Audit audit) {
        ValidationResult validation = validationService.validate(contract);
        for (ValidationIssue error : validation.errors()) {
            audit.violations.add(fromIssue(contract, error, Severity.HIGH));
        }
        for (ValidationIssue warning : validation.warnings()) {
            audit.warnings.add(fromIssue(contract, warning, Severity.LOW));
        }
        checkExpiredButActive(contract, audit);
        checkDuration(contract, audit);
        audit.contractsAudited++;
        if (validation.valid()) {
            audit.contractsCompliant++;
        }
    }

    private void checkExpiredButActive(ContractDocument contract, Audit audit) {
        LocalDate end = contract.getDispatchEndDate();
        if (contract.getStatus() == ContractStatus.ACTIVE && end != null && end.isBefore(audit.today)) {
            audit.violations.add(new Violation(
                    "CONTRACT-" + contract.getId() + "-EXPIRED_ACTIVE",
                    Severity.CRITICAL, EntityType.CONTRACT, contract.getId(), contract.getContractNumber(),
                    "EXPIRED_CONTRACT_ACTIVE",
                    "Contract ended on " + end + " but is still ACTIVE",
                    null,
                    "Renew the contract or set its status to EXPIRED",
                    Map.of("dispatchEndDate", end.toString())));
        }
    }

    private void checkDuration(ContractDocument contract, Audit audit) {
        LocalDate start = contract.getDispatchStartDate();
        LocalDate end = contract.getDispatchEndDate();
        if (start == null || end == null) {
            return;
        }
        long days = ChronoUnit.DAYS.between(start, end);
        if (days > ContractValidator.MAX_DURATION_DAYS) {
            audit.violations.add(new Violation(
                    "CONTRACT-" + contract.getId() + "-DURATION_EXCEEDED",
                    Severity.CRITICAL, EntityType.CONTRACT, contract.getId(), contract.getContractNumber(),
                    "DURATION_EXCEEDED",
                    "Contract period of " + days + " days exceeds 3 years",
                    LegalReferences.DISPATCH_ACT_ART_40_2,
                    "Shorten the contract period to 3 years or less",
                    Map.of("durationDays", String.valueOf(days))));
        }
    }

    private void auditWorksites(AuditScope scope, Audit audit) {
        List<WorksiteDocument> worksites = scope.worksiteId() != null
                ? worksiteRepository.findById(scope.worksiteId()).filter(WorksiteDocument::isActive).stream().toList()
                : worksiteRepository.findByActiveTrue();
        int compliant = 0;
        for (WorksiteDocument worksite : worksites) {
            List<Violation> found = new ArrayList<>();
            String name = worksite.displayName();
            for (WorksiteField field : WorksiteField.missingFields(worksite)) {
                found.add(new Violation(
                        "WORKSITE-" + worksite.getId() + "-" + field.key(),
                        field.auditSeverity(), EntityType.WORKSITE, worksite.getId(), name,
                        "MISSING_REQUIRED_FIELD",
                        field.label() + " is not set",
                        LegalReferences.DISPATCH_ACT_ART_26,
                        "Set " + field.label() + " on the worksite",
                        Map.of("field", field.key())));
            }
            LocalDate cutoff = worksite.getCutoffDate();
            if (cutoff != null) {
                long daysUntil = ChronoUnit.DAYS.between(audit.today, cutoff);
                if (daysUntil < 0) {
                    found.add(new Violation(
                            "WORKSITE-" + worksite.getId() + "-CUTOFF_DATE_PASSED",
                            Severity.CRITICAL, EntityType.WORKSITE, worksite.getId(), name,
                            "CUTOFF_DATE_PASSED",
                            "Cutoff date " + cutoff + " has passed",
                            LegalReferences.DISPATCH_ACT_ART_40_2,
                            "Set a new cutoff date or end the dispatch",
                            Map.of("cutoffDate", cutoff.toString())));
                } else if (daysUntil <= CUTOFF_WARNING_DAYS) {
                    audit.warnings.add(new Violation(
                            "WORKSITE-" + worksite.getId() + "-CUTOFF_DATE_SOON",
                            Severity.HIGH, EntityType.WORKSITE, worksite.getId(), name,
                            "CUTOFF_DATE_APPROACHING",
                            daysUntil + " days until the cutoff date",
                            null,
                            "Plan the end of the dispatch period",
                            Map.of("cutoffDate", cutoff.toString(), "daysUntil", String.valueOf(daysUntil))));
                }
            }
            if (found.isEmpty()) {
                compliant++;
            } else {
                audit.violations.addAll(found);
            }
        }
        audit.worksitesAudited = worksites.size();
        audit.worksitesCompliant = compliant;
    }

    private void auditWorkers(AuditScope scope, Audit audit) {
        List<WorkerDocument> workers = scope.worksiteId() != null
                ? workerRepository.findByStatusAndWorksiteId(WorkerStatus.ACTIVE, scope.worksiteId())
                : workerRepository.findByStatus(WorkerStatus.ACTIVE);
        for (WorkerDocument worker : workers) {
            if (!Nationalities.isForeign(worker.getNationality())) {
                continue;
            }
            Map<String, String> metadata = Map.of("workerNumber", String.valueOf(worker.getWorkerNumber()));
            LocalDate expiry = worker.getVisaExpiryDate();
            if (expiry != null) {
                long daysUntil = ChronoUnit.DAYS.between(audit.today, expiry);
                if (daysUntil < 0) {
                    audit.violations.add(new Violation(
                            "WORKER-" + worker.getId() + "-VISA_EXPIRED",
                            Severity.CRITICAL, EntityType.WORKER, worker.getId(), worker.getFullName(),
                            "VISA_EXPIRED",
                            "Residence permit expired " + (-daysUntil) + " days ago",
                            LegalReferences.IMMIGRATION_CONTROL_ACT,
                            "Confirm the residence permit renewal",
                            metadata));
                } else if (daysUntil <= VISA_WARNING_DAYS) {
                    audit.warnings.add(new Violation(
                            "WORKER-" + worker.getId() + "-VISA_EXPIRING",
                            Severity.HIGH, EntityType.WORKER, worker.getId(), worker.getFullName(),
                            "VISA_EXPIRING",
                            daysUntil + " days until the residence permit expires",
                            null,
                            "Start the renewal procedure",
                            metadata));
                }
            } else if (worker.getVisaType() == null || worker.getVisaType().isBlank()) {
                audit.warnings.add(new Violation(
                        "WORKER-" + worker.getId() + "-NO_VISA_INFO",
                        Severity.MEDIUM, EntityType.WORKER, worker.getId(), worker.getFullName(),
                        "MISSING_VISA_INFO",
                        "No residence permit information on record",
                        null,
                        "Register the visa type and expiry date",
                        metadata));
            }
        }
        audit.workersAudited = workers.size();
    }

    private static Violation fromIssue(ContractDocument contract, ValidationIssue issue, Severity severity) {
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("field", issue.field());
        if (issue.value() != null) {
            metadata.put("value", issue.value());
        }
        String remediation = issue.suggestion() != null
                ? issue.suggestion()
                : severity == Severity.HIGH ? "Enter " + issue.label() : null;
        return new Violation(
                "CONTRACT-" + contract.getId() + "-" + issue.code().name(),
                severity, EntityType.CONTRACT, contract.getId(), contract.getContractNumber(),
                issue.code().name(),
                issue.message(),
                issue.code().legalReference(),
                remediation,
                metadata);
    }

    /** Mutable accumulator for one audit run. */
    private static final class Audit {
        final LocalDate today;
        final List<Violation> violations = new ArrayList<>();
        final List<Violation> warnings = new ArrayList<>();
        final List<CheckFailure> checkFailures = new ArrayList<>();
        int contractsAudited;
        int contractsCompliant;
        int worksitesAudited;
        int worksitesCompliant;
        int workersAudited;

        Audit(LocalDate today) {
            this.today = today;
        }
    }
}
