package io.github.drompincen.dispatchguard.runtime.rules;

import io.github.drompincen.dispatchguard.persistence.document.WorksiteDocument;
import io.github.drompincen.dispatchguard.protocol.api.Severity;

import java.util.Arrays;
import java.util.List;
import java.util.function.Function;

/**
 * Worksite fields a dispatch relationship cannot run without. Each carries the
 * severity used by the audit and, for the subset the alert sweep watches, the alert priority.
 */
public enum WorksiteField {
    CLIENT_RESPONSIBLE_NAME("clientResponsibleName", "派遣先責任者", Severity.HIGH, Severity.HIGH,
            WorksiteDocument::getClientResponsibleName),
    CLIENT_RESPONSIBLE_DEPARTMENT("clientResponsibleDepartment", "派遣先責任者部署", Severity.MEDIUM, null,
            WorksiteDocument::getClientResponsibleDepartment),
    CLIENT_COMPLAINT_NAME("clientComplaintName", "派遣先苦情処理担当", Severity.HIGH, Severity.MEDIUM,
            WorksiteDocument::getClientComplaintName),
    DISPATCH_RESPONSIBLE_NAME("dispatchResponsibleName", "派遣元責任者", Severity.HIGH, Severity.MEDIUM,
            WorksiteDocument::getDispatchResponsibleName),
    DISPATCH_COMPLAINT_NAME("dispatchComplaintName", "派遣元苦情処理担当", Severity.MEDIUM, null,
            WorksiteDocument::getDispatchComplaintName),
    COMPANY_ADDRESS("companyAddress", "会社住所", Severity.MEDIUM, Severity.LOW,
            WorksiteDocument::getCompanyAddress),
    PLANT_ADDRESS("plantAddress", "工場住所", Severity.MEDIUM, null,
            WorksiteDocument::getPlantAddress);

    private final String key;
    private final String label;
    private final Severity auditSeverity;
    private final Severity alertPriority;
    private final Function<WorksiteDocument, String> getter;

    WorksiteField(String key, String label, Severity auditSeverity, Severity alertPriority,
                  Function<WorksiteDocument, String> getter) {
        this.key = key;
        this.label = label;
        this.auditSeverity = auditSeverity;
        this.alertPriority = alertPriority;
        this.getter = getter;
    }

    public String key() { return key; }
    public String label() { return label; }
    public Severity auditSeverity() { return auditSeverity; }
    public Severity alertPriority() { return alertPriority; }

    public boolean isMissing(WorksiteDocument worksite) {
        String value = getter.apply(worksite);
        return value == null || value.isBlank();
    }

    public boolean isAlerted() {
        return alertPriority != null;
    }

    public static List<WorksiteField> missingFields(WorksiteDocument worksite) {
        return Arrays.stream(values()).filter(f -> f.isMissing(worksite)).toList();
    }
}
