package io.github.drompincen.dispatchguard.runtime.sync;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.github.drompincen.dispatchguard.persistence.document.SyncSnapshotDocument;
import io.github.drompincen.dispatchguard.persistence.document.WorkerDocument;
import io.github.drompincen.dispatchguard.persistence.document.WorksiteDocument;
import io.github.drompincen.dispatchguard.persistence.repository.SyncSnapshotRepository;
import io.github.drompincen.dispatchguard.persistence.repository.WorkerRepository;
import io.github.drompincen.dispatchguard.persistence.repository.WorksiteRepository;
import io.github.drompincen.dispatchguard.protocol.api.RollbackResult;
import io.github.drompincen.dispatchguard.protocol.api.SnapshotInfo;
import io.github.drompincen.dispatchguard.protocol.api.SyncEntityType;
import io.github.drompincen.dispatchguard.protocol.api.WorkerStatus;
import io.github.drompincen.dispatchguard.runtime.support.Fixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.SimpleTransactionStatus;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static io.github.drompincen.dispatchguard.runtime.support.Fixtures.completeWorksite;
import static io.github.drompincen.dispatchguard.runtime.support.Fixtures.worker;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class SnapshotServiceTest {

    @Mock
    private SyncSnapshotRepository snapshotRepository;
    @Mock
    private WorkerRepository workerRepository;
    @Mock
    private WorksiteRepository worksiteRepository;
    @Mock
    private PlatformTransactionManager transactionManager;

    private WorkerSyncTarget workerTarget;
    private SnapshotService service;

    @BeforeEach
    void setUp() {
        when(transactionManager.getTransaction(any())).thenReturn(new SimpleTransactionStatus());
        when(workerRepository.save(any(WorkerDocument.class))).thenAnswer(inv -> inv.getArgument(0));
        workerTarget = new WorkerSyncTarget(workerRepository);
        ObjectMapper mapper = new ObjectMapper().findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        service = new SnapshotService(snapshotRepository,
                List.of(workerTarget, new WorksiteSyncTarget(worksiteRepository)),
                mapper, new TransactionTemplate(transactionManager), Fixtures.clock());
    }

    @Test
    void snapshotCopiesTheWholeCollection() {
        WorkerDocument w1 = worker("w1", WorkerStatus.ACTIVE);
        w1.setHourlyRate(new BigDecimal("1500"));
        w1.setUpdatedAt(Instant.parse("2024-05-01T00:00:00Z"));
        when(workerRepository.findAll()).thenReturn(List.of(w1, worker("w2", WorkerStatus.RESIGNED)));

        String snapshotId = service.snapshot(workerTarget);

        assertThat(snapshotId).matches("sync_workers_20240601_090000_[0-9a-f]{8}");
        ArgumentCaptor<SyncSnapshotDocument> saved = ArgumentCaptor.forClass(SyncSnapshotDocument.class);
        verify(snapshotRepository).save(saved.capture());
        SyncSnapshotDocument snapshot = saved.getValue();
        assertThat(snapshot.getSnapshotId()).isEqualTo(snapshotId);
        assertThat(snapshot.getCollectionName()).isEqualTo("workers");
        assertThat(snapshot.getEntityType()).isEqualTo(SyncEntityType.WORKER);
        assertThat(snapshot.getEntityCount()).isEqualTo(2);
        assertThat(snapshot.getEntities().get(0))
                .containsEntry("id", "w1")
                .containsEntry("workerNumber", "Ew1")
                .containsEntry("status", "ACTIVE")
                .containsEntry("updatedAt", "2024-05-01T00:00:00Z");
    }

    @Test
    void worksiteSnapshotsReadBackWithoutDerivedProperties() {
        WorksiteDocument site = completeWorksite("ws1");
        when(worksiteRepository.findAll()).thenReturn(List.of(site));

        service.snapshot(new WorksiteSyncTarget(worksiteRepository));

        ArgumentCaptor<SyncSnapshotDocument> saved = ArgumentCaptor.forClass(SyncSnapshotDocument.class);
        verify(snapshotRepository).save(saved.capture());
        assertThat(saved.getValue().getEntities().get(0))
                .containsEntry("worksiteKey", "kainan_okayama_ws1")
                .containsEntry("active", true)
                .doesNotContainKey("displayName");
    }

    @Test
    void rollbackOfUnknownSnapshotReportsNotFound() {
        when(snapshotRepository.findById("missing")).thenReturn(Optional.empty());

        RollbackResult result = service.rollback("missing");

        assertThat(result.found()).isFalse();
        assertThat(result.restored()).isZero();
        verify(transactionManager, never()).getTransaction(any());
    }

    @Test
    void rollbackRestoresListedEntitiesInOneTransaction() {
        SyncSnapshotDocument snapshot = new SyncSnapshotDocument();
        snapshot.setSnapshotId("sync_workers_20240601_090000_abcd1234");
        snapshot.setCollectionName("workers");
        snapshot.setEntityType(SyncEntityType.WORKER);
        snapshot.setEntityCount(1);
        snapshot.setEntities(List.of(Map.of(
                "id", "w1",
                "workerNumber", "Ew1",
                "fullName", "Original Name",
                "status", "ACTIVE",
                "hourlyRate", 1500,
                "updatedAt", "2024-05-01T00:00:00Z")));
        when(snapshotRepository.findById(snapshot.getSnapshotId())).thenReturn(Optional.of(snapshot));

        RollbackResult result = service.rollback(snapshot.getSnapshotId());

        assertThat(result.found()).isTrue();
        assertThat(result.restored()).isEqualTo(1);
        ArgumentCaptor<WorkerDocument> restored = ArgumentCaptor.forClass(WorkerDocument.class);
        verify(workerRepository).save(restored.capture());
        assertThat(restored.getValue().getId()).isEqualTo("w1");
        assertThat(restored.getValue().getFullName()).isEqualTo("Original Name");
        assertThat(restored.getValue().getHourlyRate()).isEqualByComparingTo("1500");
        assertThat(restored.getValue().getUpdatedAt()).isEqualTo(Instant.parse("2024-05-01T00:00:00Z"));
        verify(transactionManager).commit(any());
    }

    @Test
    void listSnapshotsMapsHeaders() {
        SyncSnapshotDocument header = new SyncSnapshotDocument();
        header.setSnapshotId("sync_worksites_20240601_090000_0000ffff");
        header.setCollectionName("worksites");
        header.setEntityType(SyncEntityType.WORKSITE);
        header.setEntityCount(12);
        header.setCreatedAt(Fixtures.clock().instant());
        when(snapshotRepository.findAllHeaders()).thenReturn(List.of(header));

        assertThat(service.listSnapshots())
                .extracting(SnapshotInfo::snapshotId, SnapshotInfo::entityType, SnapshotInfo::entityCount)
                .containsExactly(tuple(
                        "sync_worksites_20240601_090000_0000ffff", SyncEntityType.WORKSITE, 12));
    }
}
