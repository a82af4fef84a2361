package io.github.drompincen.dispatchguard.runtime.rules;

import java.util.Set;

public final class Nationalities {

    private static final Set<String> DOMESTIC = Set.of("日本", "日本人", "japan", "japanese");

    private Nationalities() {}

    /** True when a nationality is recorded and it is not Japanese. */
    public static boolean isForeign(String nationality) {
        if (nationality == null || nationality.isBlank()) {
            return false;
        }
        return !DOMESTIC.contains(nationality.strip().toLowerCase());
    }
}
