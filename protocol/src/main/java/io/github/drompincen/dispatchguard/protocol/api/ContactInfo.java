package io.github.drompincen.dispatchguard.protocol.api;

/** Person block embedded in contracts for managers and complaint contacts. */
public record ContactInfo(
        String name,
        String department,
        String position,
        String phone
) {
    public boolean hasNameOrDepartment() {
        return (name != null && !name.isBlank()) || (department != null && !department.isBlank());
    }

    public boolean isEmpty() {
        return !hasNameOrDepartment()
                && (position == null || position.isBlank())
                && (phone == null || phone.isBlank());
    }
}
