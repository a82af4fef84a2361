package io.github.drompincen.dispatchguard.runtime.validation;

/** How a required contract field is checked for presence and shape. */
public enum FieldKind {
    TEXT,
    OPTIONAL_TEXT,
    LIST,
    CONTACT,
    TIME,
    INTEGER,
    DECIMAL
}
