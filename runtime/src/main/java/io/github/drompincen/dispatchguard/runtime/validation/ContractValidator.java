package io.github.drompincen.dispatchguard.runtime.validation;

import io.github.drompincen.dispatchguard.persistence.document.ContractDocument;
import io.github.drompincen.dispatchguard.persistence.document.WorksiteDocument;
import io.github.drompincen.dispatchguard.persistence.document.WorkerDocument;
import io.github.drompincen.dispatchguard.protocol.api.ContactInfo;
import io.github.drompincen.dispatchguard.protocol.api.IssueLevel;
import io.github.drompincen.dispatchguard.protocol.api.ValidationCode;
import io.github.drompincen.dispatchguard.protocol.api.ValidationIssue;
import io.github.drompincen.dispatchguard.protocol.api.ValidationResult;
import io.github.drompincen.dispatchguard.protocol.api.WorkerStatus;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Validates one contract against the fixed rule catalog: the 16 required items,
 * the dispatch period, the worksite cutoff date, worker availability, overtime
 * limits and rates. Pure: everything it needs arrives through the arguments.
 */
@Component
public class ContractValidator {

    public static final int FIELDS_CHECKED = RequiredField.values().length;
    public static final long MAX_DURATION_DAYS = 365L * 3;
    public static final long LONG_DURATION_DAYS = 365L;
    public static final BigDecimal DAILY_OVERTIME_LIMIT = new BigDecimal("4");
    public static final BigDecimal MONTHLY_OVERTIME_LIMIT = new BigDecimal("45");
    public static final BigDecimal OVERTIME_PREMIUM = new BigDecimal("1.25");
    public static final BigDecimal MIN_HOURLY_RATE = new BigDecimal("900");

    public ValidationResult validate(ContractDocument contract, ValidationContext context) {
        if (contract == null) {
            return notFound(null);
        }
        if (context == null) {
            context = ValidationContext.none();
        }

        List<ValidationIssue> errors = new ArrayList<>();
        List<ValidationIssue> warnings = new ArrayList<>();

        int fieldsValid = checkRequiredFields(contract, errors, warnings);
        checkDispatchPeriod(contract, errors, warnings);
        checkWorksite(contract, context, errors, warnings);
        checkWorkers(contract, context, errors, warnings);
        checkOvertime(contract, errors, warnings);
        checkRates(contract, warnings);

        int score = score(fieldsValid, errors.size(), warnings.size());
        return new ValidationResult(errors.isEmpty(), errors, warnings, FIELDS_CHECKED, fieldsValid, score);
    }

    public static ValidationResult notFound(String contractId) {
        String message = contractId != null ? "Contract " + contractId + " not found" : "Contract not found";
        ValidationIssue issue = ValidationIssue.error("contractId", ValidationCode.CONTRACT_NOT_FOUND, "契約ID", message);
        return new ValidationResult(false, List.of(issue), List.of(), 0, 0, 0);
    }

    static int score(int fieldsValid, int errors, int warnings) {
        double raw = 100.0 * fieldsValid / FIELDS_CHECKED - 10.0 * errors - 2.0 * warnings;
        int floored = (int) Math.floor(raw);
        return Math.max(0, Math.min(100, floored));
    }

    private int checkRequiredFields(ContractDocument contract, List<ValidationIssue> errors,
                                    List<ValidationIssue> warnings) {
        int valid = 0;
        for (RequiredField field : RequiredField.values()) {
            Object value = field.valueOf(contract);
            ValidationIssue issue = checkField(field, value);
            if (issue == null) {
                valid++;
            } else if (issue.level() == IssueLevel.ERROR) {
                errors.add(issue);
            } else {
                warnings.add(issue);
            }
        }
        return valid;
    }

    private ValidationIssue checkField(RequiredField field, Object value) {
        return switch (field.kind()) {
            case TEXT -> checkText(field, value);
            case OPTIONAL_TEXT -> isBlank(value)
                    ? ValidationIssue.warning(field.key(), ValidationCode.OPTIONAL_FIELD_MISSING, field.label(),
                            field.label() + " should be stated")
                    : null;
            case LIST -> value instanceof Collection<?> list && list.size() >= Math.max(1, field.minLength())
                    ? null : missing(field);
            case CONTACT -> checkContact(field, value);
            case TIME -> value == null ? missing(field) : null;
            case INTEGER -> value == null ? missing(field)
                    : ((Number) value).longValue() < 0 ? invalid(field, value) : null;
            case DECIMAL -> value == null ? missing(field)
                    : ((BigDecimal) value).signum() <= 0 ? invalid(field, value) : null;
        };
    }

    private ValidationIssue checkText(RequiredField field, Object value) {
        if (isBlank(value)) {
            return missing(field);
        }
        if (value.toString().strip().length() < field.minLength()) {
            return ValidationIssue.warning(field.key(), ValidationCode.FIELD_TOO_SHORT, field.label(),
                            field.label() + " is too short (at least " + field.minLength() + " characters recommended)")
                    .withValue(value);
        }
        return null;
    }

    private ValidationIssue checkContact(RequiredField field, Object value) {
        if (!(value instanceof ContactInfo contact) || contact.isEmpty()) {
            return missing(field);
        }
        if (!contact.hasNameOrDepartment()) {
            return ValidationIssue.warning(field.key(), ValidationCode.INCOMPLETE_CONTACT_INFO, field.label(),
                            field.label() + " is incomplete")
                    .withSuggestion("Enter the person's name and department");
        }
        return null;
    }

    private void checkDispatchPeriod(ContractDocument contract, List<ValidationIssue> errors,
                                     List<ValidationIssue> warnings) {
        LocalDate start = contract.getDispatchStartDate();
        LocalDate end = contract.getDispatchEndDate();
        if (start == null) {
            errors.add(ValidationIssue.error("dispatchStartDate", ValidationCode.REQUIRED_FIELD_MISSING,
                    "派遣開始日", "派遣開始日 is required"));
            return;
        }
        if (end == null) {
            errors.add(ValidationIssue.error("dispatchEndDate", ValidationCode.REQUIRED_FIELD_MISSING,
                    "派遣終了日", "派遣終了日 is required"));
            return;
        }
        if (!end.isAfter(start)) {
            errors.add(ValidationIssue.error("dispatchEndDate", ValidationCode.INVALID_DATE_RANGE, "派遣終了日",
                            "Dispatch end date must be after the start date")
                    .withValue(start + " -> " + end));
        }
        long days = ChronoUnit.DAYS.between(start, end);
        if (days > MAX_DURATION_DAYS) {
            errors.add(ValidationIssue.error("dispatchEndDate", ValidationCode.DURATION_EXCEEDS_LIMIT, "派遣期間",
                            "Dispatch period may not exceed 3 years (" + ValidationCode.DURATION_EXCEEDS_LIMIT.legalReference() + ")")
                    .withValue(days + " days"));
        } else if (days > LONG_DURATION_DAYS) {
            warnings.add(ValidationIssue.warning("dispatchEndDate", ValidationCode.LONG_DURATION, "派遣期間",
                    "Dispatch period is " + days + " days (about " + days / 30 + " months)"));
        }
    }

    private void checkWorksite(ContractDocument contract, ValidationContext context, List<ValidationIssue> errors,
                               List<ValidationIssue> warnings) {
        if (context.worksiteId() == null) {
            return;
        }
        WorksiteDocument worksite = context.worksite();
        if (worksite == null) {
            errors.add(ValidationIssue.error("worksiteId", ValidationCode.WORKSITE_NOT_FOUND, "派遣先",
                            "Worksite " + context.worksiteId() + " not found")
                    .withValue(context.worksiteId()));
            return;
        }
        if (isBlank(worksite.getClientResponsibleName())) {
            warnings.add(ValidationIssue.warning("worksite", ValidationCode.WORKSITE_INCOMPLETE, "派遣先設定",
                            "Worksite " + worksite.displayName() + " has no client responsible person")
                    .withSuggestion("Update the worksite record"));
        }
        LocalDate cutoff = worksite.getCutoffDate();
        LocalDate end = contract.getDispatchEndDate();
        if (cutoff != null && end != null && end.isAfter(cutoff)) {
            errors.add(ValidationIssue.error("dispatchEndDate", ValidationCode.EXCEEDS_CUTOFF_DATE, "抵触日",
                            "Dispatch end date is after the worksite cutoff date " + cutoff)
                    .withValue("end " + end + ", cutoff " + cutoff));
        }
    }

    private void checkWorkers(ContractDocument contract, ValidationContext context, List<ValidationIssue> errors,
                              List<ValidationIssue> warnings) {
        boolean periodKnown = contract.getDispatchStartDate() != null && contract.getDispatchEndDate() != null;
        for (String workerId : context.workerIds()) {
            WorkerDocument worker = context.workers().get(workerId);
            if (worker == null) {
                errors.add(ValidationIssue.error("workerIds", ValidationCode.WORKER_NOT_FOUND, "派遣労働者",
                                workerId.isBlank() ? "Worker list contains a blank id" : "Worker " + workerId + " not found")
                        .withValue(workerId));
                continue;
            }
            if (worker.getStatus() == WorkerStatus.RESIGNED) {
                errors.add(ValidationIssue.error("workerIds", ValidationCode.WORKER_RESIGNED, "派遣労働者の状態",
                                "Worker " + worker.getFullName() + " has resigned")
                        .withValue(workerId));
                continue;
            }
            if (periodKnown) {
                List<ContractDocument> overlaps = context.overlapsFor(workerId);
                if (!overlaps.isEmpty()) {
                    warnings.add(ValidationIssue.warning("workerIds", ValidationCode.WORKER_OVERLAP, "契約重複",
                                    "Worker " + worker.getFullName() + " already has an overlapping contract ("
                                            + overlaps.get(0).getContractNumber() + ")")
                            .withValue(workerId));
                }
            }
        }
    }

    private void checkOvertime(ContractDocument contract, List<ValidationIssue> errors, List<ValidationIssue> warnings) {
        BigDecimal daily = contract.getOvertimeMaxHoursDay();
        BigDecimal monthly = contract.getOvertimeMaxHoursMonth();
        if (daily != null && daily.compareTo(DAILY_OVERTIME_LIMIT) > 0) {
            warnings.add(ValidationIssue.warning("overtimeMaxHoursDay", ValidationCode.HIGH_DAILY_OVERTIME,
                            "時間外労働（日）", "Daily overtime cap of " + daily.toPlainString()
                                    + "h exceeds the usual 4h")
                    .withValue(daily.toPlainString()));
        }
        if (monthly != null && monthly.compareTo(MONTHLY_OVERTIME_LIMIT) > 0) {
            errors.add(ValidationIssue.error("overtimeMaxHoursMonth", ValidationCode.EXCEEDS_MONTHLY_LIMIT,
                            "時間外労働（月）", "Monthly overtime cap of " + monthly.toPlainString()
                                    + "h exceeds the statutory 45h (" + ValidationCode.EXCEEDS_MONTHLY_LIMIT.legalReference() + ")")
                    .withValue(monthly.toPlainString()));
        }
    }

    private void checkRates(ContractDocument contract, List<ValidationIssue> warnings) {
        BigDecimal hourly = contract.getHourlyRate();
        BigDecimal overtime = contract.getOvertimeRate();
        if (hourly == null || hourly.signum() <= 0) {
            return;
        }
        if (overtime != null && overtime.signum() > 0) {
            BigDecimal minimum = hourly.multiply(OVERTIME_PREMIUM);
            if (overtime.compareTo(minimum) < 0) {
                String rounded = minimum.setScale(0, RoundingMode.HALF_UP).toPlainString();
                warnings.add(ValidationIssue.warning("overtimeRate", ValidationCode.LOW_OVERTIME_RATE, "時間外単価",
                                "Overtime rate " + overtime.toPlainString() + " is below 1.25x the hourly rate")
                        .withValue(overtime.toPlainString())
                        .withSuggestion("Recommended: at least " + rounded + " yen"));
            }
        }
        if (hourly.compareTo(MIN_HOURLY_RATE) < 0) {
            warnings.add(ValidationIssue.warning("hourlyRate", ValidationCode.LOW_HOURLY_RATE, "時給",
                            "Hourly rate " + hourly.toPlainString() + " yen may be below the minimum wage")
                    .withValue(hourly.toPlainString()));
        }
    }

    private static ValidationIssue missing(RequiredField field) {
        return ValidationIssue.error(field.key(), ValidationCode.REQUIRED_FIELD_MISSING, field.label(),
                field.label() + " is required (" + ValidationCode.REQUIRED_FIELD_MISSING.legalReference() + ")");
    }

    private static ValidationIssue invalid(RequiredField field, Object value) {
        return ValidationIssue.error(field.key(), ValidationCode.INVALID_VALUE, field.label(),
                        field.label() + " must be a positive number")
                .withValue(value);
    }

    static boolean isBlank(Object value) {
        return value == null || value.toString().isBlank();
    }
}
