package io.github.drompincen.dispatchguard.protocol.api;

/** A sub-check that failed to run; the surrounding audit or sweep still completed. */
public record CheckFailure(
        String check,
        String message
) {
    /** Uses the exception's message, or its type when it carries none. */
    public static CheckFailure of(String check, Throwable cause) {
        String message = cause.getMessage();
        return new CheckFailure(check, message != null ? message : cause.getClass().getSimpleName());
    }
}
