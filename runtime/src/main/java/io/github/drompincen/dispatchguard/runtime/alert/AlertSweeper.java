package io.github.drompincen.dispatchguard.runtime.alert;

import io.github.drompincen.dispatchguard.persistence.document.ContractDocument;
import io.github.drompincen.dispatchguard.persistence.document.WorksiteDocument;
import io.github.drompincen.dispatchguard.persistence.document.WorkerDocument;
import io.github.drompincen.dispatchguard.persistence.repository.ContractRepository;
import io.github.drompincen.dispatchguard.persistence.repository.WorksiteRepository;
import io.github.drompincen.dispatchguard.persistence.repository.WorkerRepository;
import io.github.drompincen.dispatchguard.protocol.api.Alert;
import io.github.drompincen.dispatchguard.protocol.api.AlertSummary;
import io.github.drompincen.dispatchguard.protocol.api.AlertType;
import io.github.drompincen.dispatchguard.protocol.api.CheckFailure;
import io.github.drompincen.dispatchguard.protocol.api.ContractStatus;
import io.github.drompincen.dispatchguard.protocol.api.DailyDigest;
import io.github.drompincen.dispatchguard.protocol.api.EntityType;
import io.github.drompincen.dispatchguard.protocol.api.Severity;
import io.github.drompincen.dispatchguard.protocol.api.WorkerStatus;
import io.github.drompincen.dispatchguard.runtime.rules.WorksiteField;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Runs the proactive threshold checks and buckets their alerts by priority.
 * Read-only; every check is isolated and reported in {@code checkFailures} if it fails.
 */
@Service
public class AlertSweeper {

    private static final Logger log = LoggerFactory.getLogger(AlertSweeper.class);

    /** Days before the contract end on which an expiry alert fires, with its priority. */
    static final Map<Integer, Severity> EXPIRY_MILESTONES = milestones();
    static final int EXPIRY_WINDOW_DAYS = 30;
    static final int CUTOFF_WINDOW_DAYS = 90;
    static final int VISA_WINDOW_DAYS = 60;
    static final int TOP_PRIORITIES = 10;
    static final int WEEK_DAYS = 7;

    static final Comparator<Alert> BY_REMAINING_DAYS =
            Comparator.comparing(Alert::remainingDays, Comparator.nullsLast(Comparator.naturalOrder()));

    private final ContractRepository contractRepository;
    private final WorksiteRepository worksiteRepository;
    private final WorkerRepository workerRepository;
    private final Clock clock;

    public AlertSweeper(ContractRepository contractRepository,
                        WorksiteRepository worksiteRepository,
                        WorkerRepository workerRepository,
                        Clock clock) {
        this.contractRepository = contractRepository;
        this.worksiteRepository = worksiteRepository;
        this.workerRepository = workerRepository;
        this.clock = clock;
    }

    public AlertSummary sweep() {
        LocalDate today = LocalDate.now(clock);
        Instant now = Instant.now(clock);

        Map<String, Supplier<List<Alert>>> checks = new LinkedHashMap<>();
        checks.put("contract-expiring", () -> checkExpiringContracts(today, now));
        checks.put("contract-expired", () -> checkExpiredContracts(today, now));
        checks.put("worker-unassigned", () -> checkUnassignedWorkers(today, now));
        checks.put("worksite-incomplete", () -> checkIncompleteWorksites(now));
        checks.put("cutoff-approaching", () -> checkApproachingCutoffDates(today, now));
        checks.put("document-expiring", () -> checkExpiringDocuments(today, now));

        List<Alert> alerts = new ArrayList<>();
        List<CheckFailure> failures = new ArrayList<>();
        checks.forEach((name, check) -> {
            try {
                alerts.addAll(check.get());
            } catch (RuntimeException e) {
                log.warn("Alert check '{}' failed: {}", name, e.getMessage(), e);
                failures.add(CheckFailure.of(name, e));
            }
        });

        Map<Severity, List<Alert>> buckets = new EnumMap<>(Severity.class);
        for (Severity s : Severity.values()) {
            buckets.put(s, new ArrayList<>());
        }
        for (Alert alert : alerts) {
            buckets.get(alert.priority()).add(alert);
        }
        buckets.get(Severity.CRITICAL).sort(BY_REMAINING_DAYS);
        buckets.get(Severity.HIGH).sort(BY_REMAINING_DAYS);

        AlertSummary summary = new AlertSummary(
                List.copyOf(buckets.get(Severity.CRITICAL)),
                List.copyOf(buckets.get(Severity.HIGH)),
                List.copyOf(buckets.get(Severity.MEDIUM)),
                List.copyOf(buckets.get(Severity.LOW)),
                List.copyOf(buckets.get(Severity.INFO)),
                List.copyOf(failures),
                now);
        log.info("Alert sweep: {} critical, {} high, {} medium, {} low, {} failed checks",
                summary.critical().size(), summary.high().size(), summary.medium().size(),
                summary.low().size(), failures.size());
        return summary;
    }

    public DailyDigest dailyDigest() {
        AlertSummary summary = sweep();
        LocalDate today = LocalDate.now(clock);
        List<CheckFailure> failures = new ArrayList<>(summary.checkFailures());

        int expiringThisWeek = 0;
        try {
            LocalDate weekEnd = today.plusDays(WEEK_DAYS);
            expiringThisWeek = (int) contractRepository.findByStatus(ContractStatus.ACTIVE).stream()
                    .map(ContractDocument::getDispatchEndDate)
                    .filter(end -> end != null && !end.isBefore(today) && !end.isAfter(weekEnd))
                    .count();
        } catch (RuntimeException e) {
            log.warn("Digest count 'expiring-this-week' failed: {}", e.getMessage(), e);
            failures.add(CheckFailure.of("expiring-this-week", e));
        }

        int unassigned = (int) summary.high().stream().filter(a -> a.type() == AlertType.WORKER_UNASSIGNED).count();
        int expired = (int) summary.critical().stream().filter(a -> a.type() == AlertType.CONTRACT_EXPIRED).count();

        List<Alert> urgent = new ArrayList<>(summary.critical());
        urgent.addAll(summary.high());
        List<Alert> top = List.copyOf(urgent.subList(0, Math.min(TOP_PRIORITIES, urgent.size())));

        return new DailyDigest(today, summary.counts(), summary.actionRequired(), expiringThisWeek,
                unassigned, expired, top, List.copyOf(failures), Instant.now(clock));
    }

    /** Alerts of a fresh sweep that target one entity, most severe first. */
    public List<Alert> alertsFor(EntityType entityType, String entityId) {
        return sweep().all().stream()
                .filter(a -> a.entityType() == entityType && a.entityId() != null && a.entityId().equals(entityId))
                .toList();
    }

    List<Alert> checkExpiringContracts(LocalDate today, Instant now) {
        List<Alert> alerts = new ArrayList<>();
        List<ContractDocument> active = contractRepository.findByStatus(ContractStatus.ACTIVE);
        for (Map.Entry<Integer, Severity> milestone : EXPIRY_MILESTONES.entrySet()) {
            int days = milestone.getKey();
            if (days > EXPIRY_WINDOW_DAYS) {
                continue;
            }
            LocalDate target = today.plusDays(days);
            for (ContractDocument contract : active) {
                if (!target.equals(contract.getDispatchEndDate())) {
                    continue;
                }
                Map<String, Object> metadata = new LinkedHashMap<>();
                metadata.put("worksiteName", contract.getWorksiteName());
                metadata.put("endDate", contract.getDispatchEndDate().toString());
                metadata.put("workers", contract.getNumberOfWorkers());
                alerts.add(new Alert(AlertType.CONTRACT_EXPIRING, milestone.getValue(),
                        "Contract expiring: " + contract.getContractNumber(),
                        (days == 1 ? "Expires tomorrow" : "Expires within " + days + " days") + ": "
                                + contract.getWorksiteName(),
                        EntityType.CONTRACT, contract.getId(), contract.getContractNumber(),
                        days, metadata, now));
            }
        }
        return alerts;
    }

    List<Alert> checkExpiredContracts(LocalDate today, Instant now) {
        List<Alert> alerts = new ArrayList<>();
        for (ContractDocument contract : contractRepository.findByStatusAndDispatchEndDateBefore(ContractStatus.ACTIVE, today)) {
            int daysExpired = (int) ChronoUnit.DAYS.between(contract.getDispatchEndDate(), today);
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("worksiteName", contract.getWorksiteName());
            metadata.put("endDate", contract.getDispatchEndDate().toString());
            metadata.put("daysExpired", daysExpired);
            metadata.put("suggestedActions", List.of("Renew the contract", "Set the status to EXPIRED"));
            alerts.add(new Alert(AlertType.CONTRACT_EXPIRED, Severity.CRITICAL,
                    "Expired contract: " + contract.getContractNumber(),
                    "Expired " + daysExpired + " days ago; renew it or update its status",
                    EntityType.CONTRACT, contract.getId(), contract.getContractNumber(),
                    -daysExpired, metadata, now));
        }
        return alerts;
    }

    List<Alert> checkUnassignedWorkers(LocalDate today, Instant now) {
        Set<String> assigned = new HashSet<>();
        for (ContractDocument contract : contractRepository.findCovering(ContractStatus.ACTIVE, today)) {
            if (contract.getWorkerIds() != null) {
                assigned.addAll(contract.getWorkerIds());
            }
        }
        List<Alert> alerts = new ArrayList<>();
        for (WorkerDocument worker : workerRepository.findByStatus(WorkerStatus.ACTIVE)) {
            if (assigned.contains(worker.getId())) {
                continue;
            }
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("workerNumber", worker.getWorkerNumber());
            metadata.put("companyName", worker.getCompanyName());
            metadata.put("lastWorksiteId", worker.getWorksiteId());
            alerts.add(new Alert(AlertType.WORKER_UNASSIGNED, Severity.HIGH,
                    "Unassigned worker: " + worker.getFullName(),
                    "Worker " + worker.getWorkerNumber() + " has no active contract",
                    EntityType.WORKER, worker.getId(), worker.getFullName(),
                    null, metadata, now));
        }
        return alerts;
    }

    List<Alert> checkIncompleteWorksites(Instant now) {
        List<Alert> alerts = new ArrayList<>();
        for (WorksiteDocument worksite : worksiteRepository.findByActiveTrue()) {
            List<WorksiteField> missing = WorksiteField.missingFields(worksite).stream()
                    .filter(WorksiteField::isAlerted)
                    .toList();
            if (missing.isEmpty()) {
                continue;
            }
            Severity priority = Severity.LOW;
            for (WorksiteField field : missing) {
                priority = Severity.mostSevere(priority, field.alertPriority());
            }
            List<String> labels = missing.stream().map(WorksiteField::label).toList();
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("missingFields", labels);
            metadata.put("impact", "Compliant contract documents may not be producible");
            alerts.add(new Alert(AlertType.WORKSITE_INCOMPLETE, priority,
                    "Worksite information missing: " + worksite.getCompanyName(),
                    "Missing: " + String.join(", ", labels),
                    EntityType.WORKSITE, worksite.getId(), worksite.displayName(),
                    null, metadata, now));
        }
        return alerts;
    }

    List<Alert> checkApproachingCutoffDates(LocalDate today, Instant now) {
        LocalDate horizon = today.plusDays(CUTOFF_WINDOW_DAYS);
        List<WorksiteDocument> approaching = worksiteRepository.findByActiveTrue().stream()
                .filter(w -> w.getCutoffDate() != null
                        && !w.getCutoffDate().isBefore(today) && !w.getCutoffDate().isAfter(horizon))
                .toList();
        if (approaching.isEmpty()) {
            return List.of();
        }
        Map<String, Long> activeByWorksite = contractRepository.findByStatus(ContractStatus.ACTIVE).stream()
                .filter(c -> c.getWorksiteId() != null)
                .collect(Collectors.groupingBy(ContractDocument::getWorksiteId, Collectors.counting()));

        List<Alert> alerts = new ArrayList<>();
        for (WorksiteDocument worksite : approaching) {
            int remaining = (int) ChronoUnit.DAYS.between(today, worksite.getCutoffDate());
            Severity priority = remaining <= 30 ? Severity.CRITICAL : remaining <= 60 ? Severity.HIGH : Severity.MEDIUM;
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("cutoffDate", worksite.getCutoffDate().toString());
            metadata.put("activeContracts", activeByWorksite.getOrDefault(worksite.getId(), 0L));
            metadata.put("daysRemaining", remaining);
            alerts.add(new Alert(AlertType.LEGAL_LIMIT_APPROACHING, priority,
                    "Cutoff date approaching: " + worksite.getCompanyName(),
                    "Cutoff date " + worksite.getCutoffDate() + " in " + remaining + " days",
                    EntityType.WORKSITE, worksite.getId(), worksite.displayName(),
                    remaining, metadata, now));
        }
        return alerts;
    }

    List<Alert> checkExpiringDocuments(LocalDate today, Instant now) {
        LocalDate horizon = today.plusDays(VISA_WINDOW_DAYS);
        List<Alert> alerts = new ArrayList<>();
        for (WorkerDocument worker : workerRepository.findByStatus(WorkerStatus.ACTIVE)) {
            LocalDate expiry = worker.getVisaExpiryDate();
            if (expiry == null || expiry.isBefore(today) || expiry.isAfter(horizon)) {
                continue;
            }
            int remaining = (int) ChronoUnit.DAYS.between(today, expiry);
            Severity priority = remaining <= 14 ? Severity.CRITICAL : remaining <= 30 ? Severity.HIGH : Severity.MEDIUM;
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("workerNumber", worker.getWorkerNumber());
            metadata.put("visaType", worker.getVisaType());
            metadata.put("visaExpiryDate", expiry.toString());
            alerts.add(new Alert(AlertType.DOCUMENT_EXPIRING, priority,
                    "Residence permit expiring: " + worker.getFullName(),
                    "Expires " + expiry + " (" + remaining + " days left)",
                    EntityType.WORKER, worker.getId(), worker.getFullName(),
                    remaining, metadata, now));
        }
        return alerts;
    }

    private static Map<Integer, Severity> milestones() {
        Map<Integer, Severity> m = new LinkedHashMap<>();
        m.put(1, Severity.CRITICAL);
        m.put(7, Severity.HIGH);
        m.put(15, Severity.HIGH);
        m.put(30, Severity.MEDIUM);
        return Collections.unmodifiableMap(m);
    }
}
