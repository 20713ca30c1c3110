package com.pipeline.factor.model;

import java.io.Serializable;
import java.util.Map;
import java.util.Objects;

/**
 * 行过滤条件：列 + 比较运算符 + 比较值。
 *
 * 数值之间按 double 比较；其余可比较类型按 compareTo 比较；
 * 单元格缺失时只有 NE 条件成立。
 */
public final class RowFilter implements Serializable {

    public enum Operator { EQ, NE, GT, GE, LT, LE }

    private final String column;
    private final Operator operator;
    private final Object value;

    public RowFilter(String column, Operator operator, Object value) {
        if (column == null || column.isBlank()) {
            throw new IllegalArgumentException("Filter column must not be null or blank");
        }
        this.column = column;
        this.operator = Objects.requireNonNull(operator, "operator");
        this.value = value;
    }

    public static RowFilter eq(String column, Object value) { return new RowFilter(column, Operator.EQ, value); }
    public static RowFilter ne(String column, Object value) { return new RowFilter(column, Operator.NE, value); }
    public static RowFilter gt(String column, Object value) { return new RowFilter(column, Operator.GT, value); }
    public static RowFilter ge(String column, Object value) { return new RowFilter(column, Operator.GE, value); }
    public static RowFilter lt(String column, Object value) { return new RowFilter(column, Operator.LT, value); }
    public static RowFilter le(String column, Object value) { return new RowFilter(column, Operator.LE, value); }

    public String getColumn() { return column; }
    public Operator getOperator() { return operator; }
    public Object getValue() { return value; }

    public boolean test(Map<String, Object> row) {
        Object cell = (row == null) ? null : row.get(column);
        if (cell == null || value == null) {
            return operator == Operator.NE && !Objects.equals(cell, value);
        }

        int cmp;
        if (cell instanceof Number && value instanceof Number) {
            cmp = Double.compare(((Number) cell).doubleValue(), ((Number) value).doubleValue());
        } else if (cell instanceof Comparable && cell.getClass().isInstance(value)) {
            @SuppressWarnings("unchecked")
            Comparable<Object> comparable = (Comparable<Object>) cell;
            cmp = comparable.compareTo(value);
        } else {
            boolean equal = Objects.equals(String.valueOf(cell), String.valueOf(value));
            return (operator == Operator.EQ && equal) || (operator == Operator.NE && !equal);
        }

        switch (operator) {
            case EQ: return cmp == 0;
            case NE: return cmp != 0;
            case GT: return cmp > 0;
            case GE: return cmp >= 0;
            case LT: return cmp < 0;
            case LE: return cmp <= 0;
            default: return false;
        }
    }

    @Override
    public String toString() {
        return column + " " + operator + " " + value;
    }
}
