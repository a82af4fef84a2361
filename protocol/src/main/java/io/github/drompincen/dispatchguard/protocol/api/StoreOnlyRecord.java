package io.github.drompincen.dispatchguard.protocol.api;

public record StoreOnlyRecord(
        String key,
        String name,
        String status
) {}
