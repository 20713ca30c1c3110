package com.pipeline.factor.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * 排序指令：字段引用 + 排序方向。
 * 字段可以是 {@link FrameKey#ENTITY_ID_FIELD}、{@link FrameKey#TIMESTAMP_FIELD} 或任意数据列。
 */
public final class SortDirective implements Serializable {

    public enum Direction { ASC, DESC }

    private final String field;
    private final Direction direction;

    public SortDirective(String field, Direction direction) {
        if (field == null || field.isBlank()) {
            throw new IllegalArgumentException("Sort field must not be null or blank");
        }
        this.field = field;
        this.direction = Objects.requireNonNull(direction, "direction");
    }

    public static SortDirective asc(String field) {
        return new SortDirective(field, Direction.ASC);
    }

    public static SortDirective desc(String field) {
        return new SortDirective(field, Direction.DESC);
    }

    public String getField() { return field; }
    public Direction getDirection() { return direction; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SortDirective)) return false;
        SortDirective that = (SortDirective) o;
        return field.equals(that.field) && direction == that.direction;
    }

    @Override
    public int hashCode() {
        return Objects.hash(field, direction);
    }

    @Override
    public String toString() {
        return field + " " + direction;
    }
}
