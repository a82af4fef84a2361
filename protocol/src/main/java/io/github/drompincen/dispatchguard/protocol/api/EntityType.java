package io.github.drompincen.dispatchguard.protocol.api;

public enum EntityType {
    CONTRACT, WORKSITE, WORKER
}
