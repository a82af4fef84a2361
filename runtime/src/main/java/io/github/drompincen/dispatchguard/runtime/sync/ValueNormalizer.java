package io.github.drompincen.dispatchguard.runtime.sync;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.Date;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Normalises raw source and store values into comparable form.
 * A {@code null} result means the value carries no opinion and is never reported as a conflict.
 */
public final class ValueNormalizer {

    private static final Set<String> EMPTY_MARKERS = Set.of("", "0", "nan", "none", "null");

    private ValueNormalizer() {}

    public static Object normalize(Object raw, ValueKind kind) {
        if (raw == null) return null;
        return switch (kind) {
            case TEXT -> text(raw);
            case DECIMAL -> decimal(raw);
            case DATE -> date(raw);
            case STATUS -> {
                String s = raw instanceof Enum<?> e ? e.name() : text(raw);
                yield s == null ? null : s.toUpperCase(Locale.ROOT);
            }
        };
    }

    /**
     * Natural-key form of a raw value: stripped, {@code null} only when blank. Empty markers such
     * as "0" or "none" are valid keys here.
     */
    public static String key(Object raw) {
        if (raw == null) return null;
        String s = raw.toString().strip();
        return s.isEmpty() ? null : s;
    }

    /** Value equality where decimals compare by numeric value regardless of scale. */
    public static boolean sameValue(Object a, Object b) {
        if (a instanceof BigDecimal x && b instanceof BigDecimal y) {
            return x.compareTo(y) == 0;
        }
        return Objects.equals(a, b);
    }

    public static BigDecimal requireDecimal(Object value, String field) {
        if (value == null || value instanceof BigDecimal) return (BigDecimal) value;
        throw new IllegalArgumentException(field + ": not a number '" + value + "'");
    }

    public static LocalDate requireDate(Object value, String field) {
        if (value == null || value instanceof LocalDate) return (LocalDate) value;
        throw new IllegalArgumentException(field + ": not a date '" + value + "'");
    }

    public static String asText(Object value) {
        return value == null ? null : value.toString();
    }

    /**
     * Reads a source modification timestamp. Accepts instants, dates, epoch millis and ISO strings;
     * local date-times are interpreted in {@code zone}. Unreadable values yield {@code null}.
     */
    public static Instant toInstant(Object raw, ZoneId zone) {
        if (raw == null) return null;
        if (raw instanceof Instant i) return i;
        if (raw instanceof Date d) return d.toInstant();
        if (raw instanceof LocalDateTime ldt) return ldt.atZone(zone).toInstant();
        if (raw instanceof Number n) return Instant.ofEpochMilli(n.longValue());
        String s = raw.toString().strip();
        if (s.isEmpty()) return null;
        try {
            return Instant.parse(s);
        } catch (DateTimeParseException notInstant) {
            try {
                return LocalDateTime.parse(s).atZone(zone).toInstant();
            } catch (DateTimeParseException notLocal) {
                return null;
            }
        }
    }

    private static String text(Object raw) {
        String s = raw.toString().strip();
        return EMPTY_MARKERS.contains(s.toLowerCase(Locale.ROOT)) ? null : s;
    }

    private static Object decimal(Object raw) {
        BigDecimal value;
        if (raw instanceof BigDecimal bd) {
            value = bd;
        } else if (raw instanceof Double d) {
            if (d.isNaN() || d.isInfinite()) return null;
            value = BigDecimal.valueOf(d);
        } else if (raw instanceof Float f) {
            if (f.isNaN() || f.isInfinite()) return null;
            value = BigDecimal.valueOf(f.doubleValue());
        } else if (raw instanceof Number n) {
            value = new BigDecimal(n.toString());
        } else {
            String s = text(raw);
            if (s == null) return null;
            try {
                value = new BigDecimal(s.replace(",", ""));
            } catch (NumberFormatException e) {
                return s;
            }
        }
        return value.signum() == 0 ? null : value;
    }

    private static Object date(Object raw) {
        if (raw instanceof LocalDate d) return d;
        if (raw instanceof LocalDateTime dt) return dt.toLocalDate();
        String s = text(raw);
        if (s == null) return null;
        String iso = s.replace('/', '-');
        if (iso.length() > 10 && iso.charAt(10) == 'T') {
            iso = iso.substring(0, 10);
        }
        try {
            return LocalDate.parse(iso);
        } catch (DateTimeParseException e) {
            return s;
        }
    }
}
