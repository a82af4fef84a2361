package io.github.drompincen.dispatchguard.protocol.api;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public record AlertSummary(
        List<Alert> critical,
        List<Alert> high,
        List<Alert> medium,
        List<Alert> low,
        List<Alert> info,
        List<CheckFailure> checkFailures,
        Instant generatedAt
) {
    public List<Alert> bucket(Severity priority) {
        return switch (priority) {
            case CRITICAL -> critical;
            case HIGH -> high;
            case MEDIUM -> medium;
            case LOW -> low;
            case INFO -> info;
        };
    }

    public Map<Severity, Integer> counts() {
        Map<Severity, Integer> counts = new EnumMap<>(Severity.class);
        for (Severity s : Severity.values()) {
            counts.put(s, bucket(s).size());
        }
        return counts;
    }

    /** Alerts that need someone to act; informational alerts are excluded. */
    public int total() {
        return critical.size() + high.size() + medium.size() + low.size();
    }

    public int actionRequired() {
        return critical.size() + high.size();
    }

    /** All alerts, most severe bucket first. */
    public List<Alert> all() {
        List<Alert> all = new ArrayList<>();
        for (Severity s : Severity.values()) {
            all.addAll(bucket(s));
        }
        return all;
    }
}
