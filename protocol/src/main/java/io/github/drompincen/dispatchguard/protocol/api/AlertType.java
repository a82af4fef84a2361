package io.github.drompincen.dispatchguard.protocol.api;

public enum AlertType {
    CONTRACT_EXPIRING,
    CONTRACT_EXPIRED,
    WORKER_UNASSIGNED,
    WORKSITE_INCOMPLETE,
    LEGAL_LIMIT_APPROACHING,
    DOCUMENT_EXPIRING
}
