package io.github.drompincen.dispatchguard.protocol.api;

public record ValidationIssue(
        String field,
        ValidationCode code,
        String label,
        IssueLevel level,
        String message,
        String value,
        String suggestion
) {
    public static ValidationIssue error(String field, ValidationCode code, String label, String message) {
        return new ValidationIssue(field, code, label, IssueLevel.ERROR, message, null, null);
    }

    public static ValidationIssue warning(String field, ValidationCode code, String label, String message) {
        return new ValidationIssue(field, code, label, IssueLevel.WARNING, message, null, null);
    }

    public ValidationIssue withValue(Object value) {
        return new ValidationIssue(field, code, label, level, message,
                value != null ? value.toString() : null, suggestion);
    }

    public ValidationIssue withSuggestion(String suggestion) {
        return new ValidationIssue(field, code, label, level, message, value, suggestion);
    }
}
