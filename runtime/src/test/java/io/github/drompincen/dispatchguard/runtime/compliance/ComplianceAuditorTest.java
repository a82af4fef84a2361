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
import io.github.drompincen.dispatchguard.protocol.api.Violation;
import io.github.drompincen.dispatchguard.protocol.api.WorkerStatus;
import io.github.drompincen.dispatchguard.runtime.settings.DispatchSettingsProvider;
import io.github.drompincen.dispatchguard.runtime.support.Fixtures;
import io.github.drompincen.dispatchguard.runtime.validation.ContractValidationService;
import io.github.drompincen.dispatchguard.runtime.validation.ContractValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.dao.DataAccessResourceFailureException;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static io.github.drompincen.dispatchguard.runtime.support.Fixtures.TODAY;
import static io.github.drompincen.dispatchguard.runtime.support.Fixtures.completeWorksite;
import static io.github.drompincen.dispatchguard.runtime.support.Fixtures.validContract;
import static io.github.drompincen.dispatchguard.runtime.support.Fixtures.worker;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ComplianceAuditorTest {

    @Mock
    private ContractRepository contractRepository;
    @Mock
    private WorksiteRepository worksiteRepository;
    @Mock
    private WorkerRepository workerRepository;
    @Mock
    private DispatchSettingsProvider settingsProvider;

    private ComplianceAuditor auditor;

    @BeforeEach
    void setUp() {
        ContractValidationService validationService = new ContractValidationService(new ContractValidator(),
                contractRepository, worksiteRepository, workerRepository, settingsProvider);
        auditor = new ComplianceAuditor(contractRepository, worksiteRepository, workerRepository,
                validationService, Fixtures.clock());
        when(worksiteRepository.findById("ws1")).thenReturn(Optional.of(completeWorksite("ws1")));
        when(contractRepository.findInScope(any())).thenReturn(List.of());
        when(worksiteRepository.findByActiveTrue()).thenReturn(List.of());
        when(workerRepository.findByStatus(WorkerStatus.ACTIVE)).thenReturn(List.of());
    }

    @Test
    void cleanDataScoresFullMarks() {
        when(contractRepository.findInScope(any())).thenReturn(List.of(validContract("c1")));
        when(worksiteRepository.findByActiveTrue()).thenReturn(List.of(completeWorksite("ws1")));
        when(workerRepository.findByStatus(WorkerStatus.ACTIVE)).thenReturn(List.of(worker("w1", WorkerStatus.ACTIVE)));

        ComplianceReport report = auditor.audit(AuditScope.full());

        assertThat(report.reportId()).isEqualTo("AUDIT-20240601-090000");
        assertThat(report.periodEnd()).isEqualTo(TODAY);
        assertThat(report.totalEntitiesAudited()).isEqualTo(3);
        assertThat(report.complianceScore()).isEqualTo(100);
        assertThat(report.violations()).isEmpty();
        assertThat(report.warnings()).isEmpty();
        assertThat(report.contracts()).isEqualTo(new ComplianceReport.CategoryStats(1, 1));
        assertThat(report.worksites()).isEqualTo(new ComplianceReport.CategoryStats(1, 1));
        assertThat(report.workersAudited()).isEqualTo(1);
        assertThat(report.checkFailures()).isEmpty();
    }

    @Test
    void validatorErrorsBecomeHighViolationsWithCitation() {
        ContractDocument contract = validContract("c1");
        contract.setWorkContent(null);
        contract.setSafetyMeasures(null);
        when(contractRepository.findInScope(any())).thenReturn(List.of(contract));

        ComplianceReport report = auditor.audit(AuditScope.contractsOnly(ContractStatus.ACTIVE, null));

        assertThat(report.reportId()).startsWith("CONTRACT-AUDIT-");
        assertThat(report.violations()).hasSize(1);
        Violation violation = report.violations().get(0);
        assertThat(violation.severity()).isEqualTo(Severity.HIGH);
        assertThat(violation.category()).isEqualTo(EntityType.CONTRACT);
        assertThat(violation.violationType()).isEqualTo("REQUIRED_FIELD_MISSING");
        assertThat(violation.legalReference()).isEqualTo(LegalReferences.DISPATCH_ACT_ART_26);
        assertThat(violation.metadata()).containsEntry("field", "workContent");
        assertThat(report.warnings()).extracting(Violation::severity).containsExactly(Severity.LOW);
        assertThat(report.contracts()).isEqualTo(new ComplianceReport.CategoryStats(1, 0));
    }

    @Test
    void expiredButActiveContractIsCritical() {
        ContractDocument contract = validContract("c1");
        contract.setDispatchStartDate(LocalDate.of(2023, 4, 1));
        contract.setDispatchEndDate(LocalDate.of(2024, 3, 31));
        when(contractRepository.findInScope(any())).thenReturn(List.of(contract));

        ComplianceReport report = auditor.audit(AuditScope.contractsOnly(null, null));

        assertThat(report.violations()).extracting(Violation::violationType).containsExactly("EXPIRED_CONTRACT_ACTIVE");
        assertThat(report.bySeverity()).containsEntry(Severity.CRITICAL, 1L);
        assertThat(report.complianceScore()).isZero();
    }

    @Test
    void overlongContractGetsDurationViolationAsWell() {
        ContractDocument contract = validContract("c1");
        contract.setDispatchStartDate(LocalDate.of(2024, 4, 1));
        contract.setDispatchEndDate(LocalDate.of(2027, 4, 30));
        when(worksiteRepository.findById("ws1")).thenReturn(Optional.of(worksiteWithCutoff(LocalDate.of(2030, 1, 1))));
        when(contractRepository.findInScope(any())).thenReturn(List.of(contract));

        ComplianceReport report = auditor.audit(AuditScope.contractsOnly(null, null));

        assertThat(report.violations()).extracting(Violation::violationType)
                .containsExactly("DURATION_EXCEEDS_LIMIT", "DURATION_EXCEEDED");
        assertThat(report.violations().get(1).severity()).isEqualTo(Severity.CRITICAL);
        assertThat(report.violations().get(1).legalReference()).isEqualTo(LegalReferences.DISPATCH_ACT_ART_40_2);
    }

    @Test
    void eachMissingWorksiteFieldIsItsOwnViolation() {
        WorksiteDocument worksite = completeWorksite("ws2");
        worksite.setClientResponsibleName(null);
        worksite.setClientComplaintName(" ");
        when(worksiteRepository.findByActiveTrue()).thenReturn(List.of(worksite));

        ComplianceReport report = auditor.audit(AuditScope.full());

        assertThat(report.violations()).extracting(Violation::violationId)
                .containsExactly("WORKSITE-ws2-clientResponsibleName", "WORKSITE-ws2-clientComplaintName");
        assertThat(report.violations()).allMatch(v -> v.severity() == Severity.HIGH);
        assertThat(report.worksites()).isEqualTo(new ComplianceReport.CategoryStats(1, 0));
    }

    @Test
    void cutoffDateChecks() {
        WorksiteDocument passed = worksiteWithCutoff(TODAY.minusDays(1));
        passed.setId("ws-passed");
        WorksiteDocument soon = worksiteWithCutoff(TODAY.plusDays(10));
        soon.setId("ws-soon");
        when(worksiteRepository.findByActiveTrue()).thenReturn(List.of(passed, soon));

        ComplianceReport report = auditor.audit(AuditScope.full());

        assertThat(report.violations()).extracting(Violation::violationType).containsExactly("CUTOFF_DATE_PASSED");
        assertThat(report.violations().get(0).severity()).isEqualTo(Severity.CRITICAL);
        assertThat(report.warnings()).extracting(Violation::violationType).containsExactly("CUTOFF_DATE_APPROACHING");
        assertThat(report.warnings().get(0).severity()).isEqualTo(Severity.HIGH);
        assertThat(report.worksites()).isEqualTo(new ComplianceReport.CategoryStats(2, 1));
    }

    @Test
    void foreignWorkerDocumentChecks() {
        WorkerDocument expired = foreignWorker("w1", TODAY.minusDays(3), "Engineer");
        WorkerDocument expiring = foreignWorker("w2", TODAY.plusDays(20), "Engineer");
        WorkerDocument unknown = foreignWorker("w3", null, null);
        WorkerDocument domestic = worker("w4", WorkerStatus.ACTIVE);
        domestic.setNationality("日本");
        when(workerRepository.findByStatus(WorkerStatus.ACTIVE)).thenReturn(List.of(expired, expiring, unknown, domestic));

        ComplianceReport report = auditor.audit(AuditScope.full());

        assertThat(report.violations()).extracting(Violation::violationType, Violation::severity)
                .containsExactly(tuple("VISA_EXPIRED", Severity.CRITICAL));
        assertThat(report.violations().get(0).legalReference()).isEqualTo(LegalReferences.IMMIGRATION_CONTROL_ACT);
        assertThat(report.warnings()).extracting(Violation::violationType, Violation::severity).containsExactly(
                tuple("VISA_EXPIRING", Severity.HIGH),
                tuple("MISSING_VISA_INFO", Severity.MEDIUM));
        assertThat(report.workersAudited()).isEqualTo(4);
    }

    @Test
    void failingPassIsIsolated() {
        when(contractRepository.findInScope(any())).thenReturn(List.of(validContract("c1")));
        when(worksiteRepository.findByActiveTrue()).thenThrow(new DataAccessResourceFailureException("mongo down"));
        when(workerRepository.findByStatus(WorkerStatus.ACTIVE)).thenReturn(List.of(worker("w1", WorkerStatus.ACTIVE)));

        ComplianceReport report = auditor.audit(AuditScope.full());

        assertThat(report.checkFailures()).containsExactly(new CheckFailure("worksites", "mongo down"));
        assertThat(report.contracts().audited()).isEqualTo(1);
        assertThat(report.workersAudited()).isEqualTo(1);
        assertThat(report.worksites().audited()).isZero();
        assertThat(report.totalEntitiesAudited()).isEqualTo(2);
    }

    @Test
    void contractWithNullWorkerIdIsReportedNotFatal() {
        ContractDocument expired = validContract("c1");
        expired.setDispatchStartDate(LocalDate.of(2023, 4, 1));
        expired.setDispatchEndDate(LocalDate.of(2024, 3, 31));
        ContractDocument malformed = validContract("c2");
        malformed.setWorkerIds(Arrays.asList((String) null));
        when(contractRepository.findInScope(any())).thenReturn(List.of(expired, malformed));

        ComplianceReport report = auditor.audit(AuditScope.contractsOnly(null, null));

        assertThat(report.checkFailures()).isEmpty();
        assertThat(report.contracts().audited()).isEqualTo(2);
        assertThat(report.violations())
                .extracting(Violation::entityId, Violation::violationType, Violation::severity)
                .containsExactlyInAnyOrder(
                        tuple("c1", "EXPIRED_CONTRACT_ACTIVE", Severity.CRITICAL),
                        tuple("c2", "WORKER_NOT_FOUND", Severity.HIGH));
        verify(workerRepository, never()).findById(null);
    }

    @Test
    void failingContractDoesNotDiscardOtherContracts() {
        ContractDocument expired = validContract("c1");
        expired.setDispatchStartDate(LocalDate.of(2023, 4, 1));
        expired.setDispatchEndDate(LocalDate.of(2024, 3, 31));
        ContractDocument broken = validContract("c2");
        broken.setWorkerIds(List.of("w9"));
        when(workerRepository.findById("w9")).thenReturn(Optional.of(worker("w9", WorkerStatus.ACTIVE)));
        when(contractRepository.findOverlapping(eq("w9"), any(), any(), anyList()))
                .thenThrow(new DataAccessResourceFailureException("socket timeout"));
        when(contractRepository.findInScope(any())).thenReturn(List.of(expired, broken));

        ComplianceReport report = auditor.audit(AuditScope.contractsOnly(null, null));

        assertThat(report.violations()).extracting(Violation::violationType).containsExactly("EXPIRED_CONTRACT_ACTIVE");
        assertThat(report.checkFailures()).containsExactly(new CheckFailure("contract:c2", "socket timeout"));
        assertThat(report.contracts().audited()).isEqualTo(1);
        assertThat(report.complianceScore()).isZero();
    }

    @Test
    void failureWithoutMessageIsNamedByType() {
        ContractDocument broken = validContract("c2");
        broken.setWorkerIds(List.of("w9"));
        when(workerRepository.findById("w9")).thenThrow(new IllegalStateException());
        when(contractRepository.findInScope(any())).thenReturn(List.of(broken));

        ComplianceReport report = auditor.audit(AuditScope.contractsOnly(null, null));

        assertThat(report.checkFailures()).containsExactly(new CheckFailure("contract:c2", "IllegalStateException"));
    }

    @Test
    void contractsOnlyScopeSkipsWorksitesAndWorkers() {
        auditor.audit(AuditScope.contractsOnly(ContractStatus.ACTIVE, "ws1"));

        verify(worksiteRepository, never()).findByActiveTrue();
        verify(workerRepository, never()).findByStatus(any());
    }

    @Test
    void reauditingUnchangedDataGivesSameFindings() {
        WorksiteDocument worksite = completeWorksite("ws2");
        worksite.setPlantAddress(null);
        ContractDocument contract = validContract("c1");
        contract.setOvertimeRate(null);
        contract.setHourlyRate(new BigDecimal("880"));
        when(contractRepository.findInScope(any())).thenReturn(List.of(contract));
        when(worksiteRepository.findByActiveTrue()).thenReturn(List.of(worksite));

        ComplianceReport first = auditor.audit(AuditScope.full());
        ComplianceReport second = auditor.audit(AuditScope.full());

        assertThat(second.violations()).isEqualTo(first.violations());
        assertThat(second.warnings()).isEqualTo(first.warnings());
        assertThat(second.complianceScore()).isEqualTo(first.complianceScore());
    }

    @Test
    void scoreWeighsViolationsBySeverity() {
        Violation medium = new Violation("v1", Severity.MEDIUM, EntityType.WORKSITE, "ws1", "ws", "X",
                "m", null, null, Map.of());
        Violation critical = new Violation("v2", Severity.CRITICAL, EntityType.WORKSITE, "ws1", "ws", "X",
                "m", null, null, Map.of());

        assertThat(ComplianceAuditor.score(List.of(), 0, 0)).isEqualTo(100);
        assertThat(ComplianceAuditor.score(List.of(medium), 0, 2)).isEqualTo(87);
        assertThat(ComplianceAuditor.score(List.of(medium), 3, 2)).isEqualTo(80);
        assertThat(ComplianceAuditor.score(List.of(medium, critical), 3, 2)).isEqualTo(30);
        assertThat(ComplianceAuditor.score(List.of(critical, critical), 0, 1)).isZero();
    }

    @Test
    void summaryUsesCountsOnly() {
        when(contractRepository.countByStatus(ContractStatus.ACTIVE)).thenReturn(18L);
        when(contractRepository.countByStatusAndDispatchEndDateBefore(ContractStatus.ACTIVE, TODAY)).thenReturn(0L);
        when(worksiteRepository.countIncompleteActive()).thenReturn(1L);
        when(worksiteRepository.countByActiveTrue()).thenReturn(2L);

        ComplianceSummary summary = auditor.summary();

        assertThat(summary.quickScore()).isEqualTo(50);
        assertThat(summary.status()).isEqualTo(ComplianceSummary.ComplianceStatus.ISSUES_FOUND);
        verify(contractRepository, never()).findInScope(any());
    }

    @Test
    void summaryOfEmptyStoreIsCompliant() {
        ComplianceSummary summary = auditor.summary();

        assertThat(summary.quickScore()).isEqualTo(100);
        assertThat(summary.status()).isEqualTo(ComplianceSummary.ComplianceStatus.COMPLIANT);
    }

    private WorksiteDocument worksiteWithCutoff(LocalDate cutoff) {
        WorksiteDocument worksite = completeWorksite("ws1");
        worksite.setCutoffDate(cutoff);
        return worksite;
    }

    private WorkerDocument foreignWorker(String id, LocalDate visaExpiry, String visaType) {
        WorkerDocument w = worker(id, WorkerStatus.ACTIVE);
        w.setNationality("Vietnam");
        w.setVisaExpiryDate(visaExpiry);
        w.setVisaType(visaType);
        return w;
    }
}
