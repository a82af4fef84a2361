package io.github.drompincen.dispatchguard.runtime.sync;

import io.github.drompincen.dispatchguard.protocol.api.ConflictStrategy;
import io.github.drompincen.dispatchguard.protocol.api.Severity;

import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * One row of a target's compare-field table. The source record carries the value under
 * {@link #field()}; the setter receives the normalised value.
 */
public record TrackedField<D>(
        String field,
        String label,
        ValueKind kind,
        Severity severity,
        ConflictStrategy recommended,
        Function<D, Object> getter,
        BiConsumer<D, Object> setter
) {
    public Object sourceValue(Map<String, Object> source) {
        return ValueNormalizer.normalize(source.get(field), kind);
    }

    public Object storeValue(D document) {
        return ValueNormalizer.normalize(getter.apply(document), kind);
    }

    public void apply(D document, Object normalizedValue) {
        setter.accept(document, normalizedValue);
    }
}
