package io.github.drompincen.dispatchguard.persistence.document;

import io.github.drompincen.dispatchguard.protocol.api.SyncEntityType;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/** Copy of a collection taken right before a sync run mutates it. */
@Document(collection = "sync_snapshots")
public class SyncSnapshotDocument {

    @Id
    private String snapshotId;
    private String collectionName;
    private SyncEntityType entityType;
    @Indexed
    private Instant createdAt;
    private int entityCount;
    private List<Map<String, Object>> entities;

    public SyncSnapshotDocument() {}

    public String getSnapshotId() { return snapshotId; }
    public void setSnapshotId(String snapshotId) { this.snapshotId = snapshotId; }

    public String getCollectionName() { return collectionName; }
    public void setCollectionName(String collectionName) { this.collectionName = collectionName; }

    public SyncEntityType getEntityType() { return entityType; }
    public void setEntityType(SyncEntityType entityType) { this.entityType = entityType; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public int getEntityCount() { return entityCount; }
    public void setEntityCount(int entityCount) { this.entityCount = entityCount; }

    public List<Map<String, Object>> getEntities() { return entities; }
    public void setEntities(List<Map<String, Object>> entities) { this.entities = entities; }
}
