package io.github.drompincen.dispatchguard.protocol.api;

/**
 * Machine-readable validation outcome codes. Codes that stem from a statutory
 * requirement carry the citation of the article they enforce.
 */
public enum ValidationCode {
    CONTRACT_NOT_FOUND(null),
    REQUIRED_FIELD_MISSING(LegalReferences.DISPATCH_ACT_ART_26),
    OPTIONAL_FIELD_MISSING(null),
    FIELD_TOO_SHORT(null),
    INCOMPLETE_CONTACT_INFO(null),
    INVALID_VALUE(null),
    INVALID_DATE_RANGE(null),
    DURATION_EXCEEDS_LIMIT(LegalReferences.DISPATCH_ACT_ART_40_2),
    LONG_DURATION(null),
    WORKSITE_NOT_FOUND(null),
    WORKSITE_INCOMPLETE(null),
    EXCEEDS_CUTOFF_DATE(LegalReferences.DISPATCH_ACT_ART_40_2),
    WORKER_NOT_FOUND(null),
    WORKER_RESIGNED(null),
    WORKER_OVERLAP(null),
    HIGH_DAILY_OVERTIME(null),
    EXCEEDS_MONTHLY_LIMIT(LegalReferences.LABOR_STANDARDS_ACT_ART_36),
    LOW_OVERTIME_RATE(null),
    LOW_HOURLY_RATE(null);

    private final String legalReference;

    ValidationCode(String legalReference) {
        this.legalReference = legalReference;
    }

    /** Citation of the enforced article, or {@code null} for business rules. */
    public String legalReference() {
        return legalReference;
    }

    public boolean isStatutory() {
        return legalReference != null;
    }
}
