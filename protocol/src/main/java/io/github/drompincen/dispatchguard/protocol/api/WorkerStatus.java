package io.github.drompincen.dispatchguard.protocol.api;

public enum WorkerStatus {
    ACTIVE, ON_LEAVE, RESIGNED
}
