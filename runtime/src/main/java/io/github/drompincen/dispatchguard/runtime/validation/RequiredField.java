package io.github.drompincen.dispatchguard.runtime.validation;

import io.github.drompincen.dispatchguard.persistence.document.ContractDocument;

import java.util.function.Function;

/**
 * The 16 items an individual dispatch contract must state under 労働者派遣法第26条.
 * Declaration order is the order issues are reported in.
 */
public enum RequiredField {
    WORK_CONTENT("workContent", "業務の内容", FieldKind.TEXT, 5, ContractDocument::getWorkContent),
    RESPONSIBILITY_LEVEL("responsibilityLevel", "責任の程度", FieldKind.TEXT, 2, ContractDocument::getResponsibilityLevel),
    WORKSITE_NAME("worksiteName", "派遣先事業所名", FieldKind.TEXT, 2, ContractDocument::getWorksiteName),
    WORKSITE_ADDRESS("worksiteAddress", "事業所住所", FieldKind.TEXT, 5, ContractDocument::getWorksiteAddress),
    SUPERVISOR_NAME("supervisorName", "指揮命令者", FieldKind.TEXT, 2, ContractDocument::getSupervisorName),
    WORK_DAYS("workDays", "就業日", FieldKind.LIST, 1, ContractDocument::getWorkDays),
    WORK_START_TIME("workStartTime", "始業時刻", FieldKind.TIME, 0, ContractDocument::getWorkStartTime),
    WORK_END_TIME("workEndTime", "終業時刻", FieldKind.TIME, 0, ContractDocument::getWorkEndTime),
    BREAK_TIME_MINUTES("breakTimeMinutes", "休憩時間", FieldKind.INTEGER, 0, ContractDocument::getBreakTimeMinutes),
    SAFETY_MEASURES("safetyMeasures", "安全衛生", FieldKind.OPTIONAL_TEXT, 0, ContractDocument::getSafetyMeasures),
    DISPATCH_COMPLAINT_CONTACT("dispatchComplaintContact", "派遣元苦情処理担当", FieldKind.CONTACT, 0, ContractDocument::getDispatchComplaintContact),
    CLIENT_COMPLAINT_CONTACT("clientComplaintContact", "派遣先苦情処理担当", FieldKind.CONTACT, 0, ContractDocument::getClientComplaintContact),
    TERMINATION_MEASURES("terminationMeasures", "契約解除の措置", FieldKind.OPTIONAL_TEXT, 0, ContractDocument::getTerminationMeasures),
    DISPATCH_MANAGER("dispatchManager", "派遣元責任者", FieldKind.CONTACT, 0, ContractDocument::getDispatchManager),
    CLIENT_MANAGER("clientManager", "派遣先責任者", FieldKind.CONTACT, 0, ContractDocument::getClientManager),
    HOURLY_RATE("hourlyRate", "派遣料金", FieldKind.DECIMAL, 0, ContractDocument::getHourlyRate);

    private final String key;
    private final String label;
    private final FieldKind kind;
    private final int minLength;
    private final Function<ContractDocument, Object> getter;

    RequiredField(String key, String label, FieldKind kind, int minLength,
                  Function<ContractDocument, Object> getter) {
        this.key = key;
        this.label = label;
        this.kind = kind;
        this.minLength = minLength;
        this.getter = getter;
    }

    public String key() { return key; }
    public String label() { return label; }
    public FieldKind kind() { return kind; }
    public int minLength() { return minLength; }

    public Object valueOf(ContractDocument contract) {
        return getter.apply(contract);
    }
}
