package io.github.drompincen.dispatchguard.protocol.api;

public record ValidationSummary(
        String contractId,
        String contractNumber,
        String worksiteName,
        ValidationResult validation,
        ValidationStatus status,
        String recommendation
) {
    public enum ValidationStatus {
        VALID, INVALID
    }
}
