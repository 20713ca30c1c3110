package com.pipeline.factor.model;

import java.io.Serializable;
import java.sql.Timestamp;
import java.util.Objects;

/**
 * 帧行键：实体标识 + 时间戳。
 * 先按实体标识、再按时间戳排序，保证同一实体内按时间升序。
 */
public final class FrameKey implements Comparable<FrameKey>, Serializable {

    /** 实体标识字段名（排序和过滤时引用） */
    public static final String ENTITY_ID_FIELD = "entity_id";

    /** 时间戳字段名（排序和过滤时引用） */
    public static final String TIMESTAMP_FIELD = "timestamp";

    private final String entityId;
    private final Timestamp timestamp;

    public FrameKey(String entityId, Timestamp timestamp) {
        if (entityId == null || entityId.isBlank()) {
            throw new IllegalArgumentException("Entity id must not be null or blank");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("Timestamp must not be null for entity: " + entityId);
        }
        this.entityId = entityId;
        this.timestamp = new Timestamp(timestamp.getTime());
    }

    public static FrameKey of(String entityId, Timestamp timestamp) {
        return new FrameKey(entityId, timestamp);
    }

    public static FrameKey of(String entityId, long epochMillis) {
        return new FrameKey(entityId, new Timestamp(epochMillis));
    }

    public String getEntityId() { return entityId; }

    public Timestamp getTimestamp() { return new Timestamp(timestamp.getTime()); }

    public long getTime() { return timestamp.getTime(); }

    @Override
    public int compareTo(FrameKey other) {
        int cmp = entityId.compareTo(other.entityId);
        if (cmp != 0) return cmp;
        return Long.compare(timestamp.getTime(), other.timestamp.getTime());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FrameKey)) return false;
        FrameKey that = (FrameKey) o;
        return entityId.equals(that.entityId) && timestamp.getTime() == that.timestamp.getTime();
    }

    @Override
    public int hashCode() {
        return Objects.hash(entityId, timestamp.getTime());
    }

    @Override
    public String toString() {
        return "(" + entityId + ", " + timestamp + ")";
    }
}
