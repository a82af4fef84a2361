package io.github.drompincen.dispatchguard.protocol.api;

public enum ContractStatus {
    DRAFT, ACTIVE, EXPIRED, TERMINATED
}
