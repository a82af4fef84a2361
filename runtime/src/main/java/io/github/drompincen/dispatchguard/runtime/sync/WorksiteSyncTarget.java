package io.github.drompincen.dispatchguard.runtime.sync;

import io.github.drompincen.dispatchguard.persistence.document.WorksiteDocument;
import io.github.drompincen.dispatchguard.persistence.repository.WorksiteRepository;
import io.github.drompincen.dispatchguard.protocol.api.ConflictStrategy;
import io.github.drompincen.dispatchguard.protocol.api.Severity;
import io.github.drompincen.dispatchguard.protocol.api.SyncEntityType;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static io.github.drompincen.dispatchguard.runtime.sync.ValueNormalizer.asText;

/** Worksites keyed by {@code worksiteKey}, or {@code companyName_plantName} when the source has no key. */
@Component
public class WorksiteSyncTarget implements SyncTarget<WorksiteDocument> {

    static final List<TrackedField<WorksiteDocument>> FIELDS = List.of(
            new TrackedField<WorksiteDocument>("companyAddress", "派遣先住所", ValueKind.TEXT, Severity.MEDIUM,
                    ConflictStrategy.NEWEST_WINS, WorksiteDocument::getCompanyAddress,
                    (w, v) -> w.setCompanyAddress(asText(v))),
            new TrackedField<WorksiteDocument>("plantAddress", "工場住所", ValueKind.TEXT, Severity.MEDIUM,
                    ConflictStrategy.NEWEST_WINS, WorksiteDocument::getPlantAddress,
                    (w, v) -> w.setPlantAddress(asText(v))),
            new TrackedField<WorksiteDocument>("clientResponsibleName", "派遣先責任者", ValueKind.TEXT, Severity.HIGH,
                    ConflictStrategy.NEWEST_WINS, WorksiteDocument::getClientResponsibleName,
                    (w, v) -> w.setClientResponsibleName(asText(v))),
            new TrackedField<WorksiteDocument>("cutoffDate", "抵触日", ValueKind.DATE, Severity.HIGH,
                    ConflictStrategy.SOURCE_WINS, WorksiteDocument::getCutoffDate,
                    (w, v) -> w.setCutoffDate(ValueNormalizer.requireDate(v, "cutoffDate")))
    );

    private final WorksiteRepository worksiteRepository;

    public WorksiteSyncTarget(WorksiteRepository worksiteRepository) {
        this.worksiteRepository = worksiteRepository;
    }

    @Override public SyncEntityType entityType() { return SyncEntityType.WORKSITE; }
    @Override public Class<WorksiteDocument> documentType() { return WorksiteDocument.class; }
    @Override public List<TrackedField<WorksiteDocument>> trackedFields() { return FIELDS; }

    @Override
    public String naturalKey(Map<String, Object> source) {
        String key = ValueNormalizer.key(source.get("worksiteKey"));
        if (key != null) return key;
        String company = ValueNormalizer.key(source.get("companyName"));
        String plant = ValueNormalizer.key(source.get("plantName"));
        if (company == null && plant == null) return null;
        return ((company == null ? "" : company) + "_" + (plant == null ? "" : plant)).replace(' ', '_');
    }

    @Override public String naturalKey(WorksiteDocument document) { return document.getWorksiteKey(); }
    @Override public String displayName(WorksiteDocument document) { return document.displayName(); }
    @Override public String status(WorksiteDocument document) { return document.isActive() ? "ACTIVE" : "INACTIVE"; }
    @Override public String id(WorksiteDocument document) { return document.getId(); }
    @Override public Instant modifiedAt(WorksiteDocument document) { return document.getUpdatedAt(); }
    @Override public void touch(WorksiteDocument document, Instant now) { document.setUpdatedAt(now); }

    @Override
    public WorksiteDocument create(String key, Map<String, Object> source, Instant now) {
        String company = text(source, "companyName");
        if (company == null) {
            throw new IllegalArgumentException("companyName is required");
        }
        WorksiteDocument worksite = new WorksiteDocument();
        worksite.setWorksiteKey(key);
        worksite.setCompanyName(company);
        worksite.setPlantName(text(source, "plantName"));
        for (TrackedField<WorksiteDocument> field : FIELDS) {
            Object value = field.sourceValue(source);
            if (value != null) {
                field.apply(worksite, value);
            }
        }
        worksite.setClientResponsibleDepartment(text(source, "clientResponsibleDepartment"));
        worksite.setClientComplaintName(text(source, "clientComplaintName"));
        worksite.setDispatchResponsibleName(text(source, "dispatchResponsibleName"));
        worksite.setDispatchComplaintName(text(source, "dispatchComplaintName"));
        worksite.setActive(true);
        worksite.setCreatedAt(now);
        worksite.setUpdatedAt(now);
        return worksite;
    }

    @Override public List<WorksiteDocument> findAll() { return worksiteRepository.findAll(); }
    @Override public Optional<WorksiteDocument> findByKey(String key) { return worksiteRepository.findByWorksiteKey(key); }
    @Override public WorksiteDocument save(WorksiteDocument document) { return worksiteRepository.save(document); }

    private static String text(Map<String, Object> source, String field) {
        return asText(ValueNormalizer.normalize(source.get(field), ValueKind.TEXT));
    }
}
