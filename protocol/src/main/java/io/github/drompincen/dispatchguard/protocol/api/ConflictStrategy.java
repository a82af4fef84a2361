package io.github.drompincen.dispatchguard.protocol.api;

/**
 * How a field divergence between an external source and the store is settled.
 *
 * <p>SOURCE_WINS overwrites the stored value, DB_WINS keeps it, NEWEST_WINS keeps
 * whichever side was modified last and MANUAL leaves the field pending until a
 * person decides.
 */
public enum ConflictStrategy {
    SOURCE_WINS,
    DB_WINS,
    NEWEST_WINS,
    MANUAL
}
