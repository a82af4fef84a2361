package io.github.drompincen.dispatchguard.runtime.sync;

import io.github.drompincen.dispatchguard.persistence.document.WorkerDocument;
import io.github.drompincen.dispatchguard.persistence.repository.WorkerRepository;
import io.github.drompincen.dispatchguard.protocol.api.ConflictStrategy;
import io.github.drompincen.dispatchguard.protocol.api.Severity;
import io.github.drompincen.dispatchguard.protocol.api.SyncEntityType;
import io.github.drompincen.dispatchguard.protocol.api.WorkerStatus;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static io.github.drompincen.dispatchguard.runtime.sync.ValueNormalizer.asText;

/** Workers keyed by employee number. */
@Component
public class WorkerSyncTarget implements SyncTarget<WorkerDocument> {

    static final List<TrackedField<WorkerDocument>> FIELDS = List.of(
            new TrackedField<WorkerDocument>("fullName", "氏名", ValueKind.TEXT, Severity.HIGH,
                    ConflictStrategy.NEWEST_WINS, WorkerDocument::getFullName,
                    (w, v) -> w.setFullName(asText(v))),
            new TrackedField<WorkerDocument>("fullNameKana", "氏名（カナ）", ValueKind.TEXT, Severity.MEDIUM,
                    ConflictStrategy.NEWEST_WINS, WorkerDocument::getFullNameKana,
                    (w, v) -> w.setFullNameKana(asText(v))),
            new TrackedField<WorkerDocument>("companyName", "派遣先", ValueKind.TEXT, Severity.HIGH,
                    ConflictStrategy.NEWEST_WINS, WorkerDocument::getCompanyName,
                    (w, v) -> w.setCompanyName(asText(v))),
            new TrackedField<WorkerDocument>("department", "配属先", ValueKind.TEXT, Severity.MEDIUM,
                    ConflictStrategy.NEWEST_WINS, WorkerDocument::getDepartment,
                    (w, v) -> w.setDepartment(asText(v))),
            new TrackedField<WorkerDocument>("lineName", "ライン", ValueKind.TEXT, Severity.MEDIUM,
                    ConflictStrategy.NEWEST_WINS, WorkerDocument::getLineName,
                    (w, v) -> w.setLineName(asText(v))),
            new TrackedField<WorkerDocument>("hourlyRate", "時給", ValueKind.DECIMAL, Severity.HIGH,
                    ConflictStrategy.SOURCE_WINS, WorkerDocument::getHourlyRate,
                    (w, v) -> w.setHourlyRate(ValueNormalizer.requireDecimal(v, "hourlyRate"))),
            new TrackedField<WorkerDocument>("status", "ステータス", ValueKind.STATUS, Severity.CRITICAL,
                    ConflictStrategy.MANUAL, WorkerDocument::getStatus,
                    (w, v) -> w.setStatus(parseStatus(v)))
    );

    private final WorkerRepository workerRepository;

    public WorkerSyncTarget(WorkerRepository workerRepository) {
        this.workerRepository = workerRepository;
    }

    @Override public SyncEntityType entityType() { return SyncEntityType.WORKER; }
    @Override public Class<WorkerDocument> documentType() { return WorkerDocument.class; }
    @Override public List<TrackedField<WorkerDocument>> trackedFields() { return FIELDS; }

    @Override
    public String naturalKey(Map<String, Object> source) {
        return ValueNormalizer.key(source.get("workerNumber"));
    }

    @Override public String naturalKey(WorkerDocument document) { return document.getWorkerNumber(); }
    @Override public String displayName(WorkerDocument document) { return document.getFullName(); }
    @Override public String id(WorkerDocument document) { return document.getId(); }
    @Override public Instant modifiedAt(WorkerDocument document) { return document.getUpdatedAt(); }
    @Override public void touch(WorkerDocument document, Instant now) { document.setUpdatedAt(now); }

    @Override
    public String status(WorkerDocument document) {
        return document.getStatus() == null ? null : document.getStatus().name();
    }

    @Override
    public WorkerDocument create(String key, Map<String, Object> source, Instant now) {
        WorkerDocument worker = new WorkerDocument();
        worker.setWorkerNumber(key);
        for (TrackedField<WorkerDocument> field : FIELDS) {
            Object value = field.sourceValue(source);
            if (value != null) {
                field.apply(worker, value);
            }
        }
        if (worker.getFullName() == null) {
            throw new IllegalArgumentException("fullName is required");
        }
        if (worker.getStatus() == null) {
            worker.setStatus(WorkerStatus.ACTIVE);
        }
        worker.setBillingRate(ValueNormalizer.requireDecimal(
                ValueNormalizer.normalize(source.get("billingRate"), ValueKind.DECIMAL), "billingRate"));
        worker.setNationality(asText(ValueNormalizer.normalize(source.get("nationality"), ValueKind.TEXT)));
        worker.setVisaType(asText(ValueNormalizer.normalize(source.get("visaType"), ValueKind.TEXT)));
        worker.setVisaExpiryDate(ValueNormalizer.requireDate(
                ValueNormalizer.normalize(source.get("visaExpiryDate"), ValueKind.DATE), "visaExpiryDate"));
        worker.setCreatedAt(now);
        worker.setUpdatedAt(now);
        return worker;
    }

    @Override public List<WorkerDocument> findAll() { return workerRepository.findAll(); }
    @Override public Optional<WorkerDocument> findByKey(String key) { return workerRepository.findByWorkerNumber(key); }
    @Override public WorkerDocument save(WorkerDocument document) { return workerRepository.save(document); }

    private static WorkerStatus parseStatus(Object value) {
        try {
            return WorkerStatus.valueOf(asText(value));
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new IllegalArgumentException("status: unknown worker status '" + value + "'", e);
        }
    }
}
