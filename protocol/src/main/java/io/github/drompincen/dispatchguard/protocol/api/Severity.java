package io.github.drompincen.dispatchguard.protocol.api;

/**
 * Ordered severity shared by audit violations, alert priorities and sync conflicts.
 * Declaration order is significance order: {@code CRITICAL} is the most severe.
 */
public enum Severity {
    CRITICAL(20),
    HIGH(10),
    MEDIUM(5),
    LOW(2),
    INFO(0);

    private final int weight;

    Severity(int weight) {
        this.weight = weight;
    }

    /** Penalty points used by the compliance score. */
    public int weight() {
        return weight;
    }

    public boolean isMoreSevereThan(Severity other) {
        return other == null || ordinal() < other.ordinal();
    }

    public static Severity mostSevere(Severity a, Severity b) {
        if (a == null) return b;
        return b != null && b.isMoreSevereThan(a) ? b : a;
    }
}
