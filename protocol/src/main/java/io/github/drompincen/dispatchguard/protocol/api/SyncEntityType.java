package io.github.drompincen.dispatchguard.protocol.api;

public enum SyncEntityType {
    WORKER("workers"),
    WORKSITE("worksites");

    private final String collectionName;

    SyncEntityType(String collectionName) {
        this.collectionName = collectionName;
    }

    public String collectionName() {
        return collectionName;
    }
}
