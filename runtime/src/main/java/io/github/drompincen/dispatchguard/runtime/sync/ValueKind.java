package io.github.drompincen.dispatchguard.runtime.sync;

/** How a tracked field is normalised before source and store values are compared. */
public enum ValueKind {
    TEXT,
    DECIMAL,
    DATE,
    STATUS
}
