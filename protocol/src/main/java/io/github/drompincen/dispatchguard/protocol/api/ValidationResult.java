package io.github.drompincen.dispatchguard.protocol.api;

import java.util.List;

/**
 * Outcome of validating one contract. {@code valid} is true exactly when
 * {@code errors} is empty; {@code score} is always within 0..100.
 */
public record ValidationResult(
        boolean valid,
        List<ValidationIssue> errors,
        List<ValidationIssue> warnings,
        int fieldsChecked,
        int fieldsValid,
        int score
) {
    public ValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public int errorCount() {
        return errors.size();
    }

    public int warningCount() {
        return warnings.size();
    }

    public boolean hasCode(ValidationCode code) {
        return errors.stream().anyMatch(i -> i.code() == code)
                || warnings.stream().anyMatch(i -> i.code() == code);
    }
}
