package com.pipeline.factor.model;

import java.io.Serializable;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.BiPredicate;

/**
 * 时序数据帧，以 (实体标识, 时间戳) 为键的多列数据集合。
 *
 * 行按 {@link FrameKey} 排序存放，键唯一；每行是列名到值的有序映射，
 * 缺失值以 null 表示。帧记录出现过的全部列名（列并集）。
 *
 * 原始输入帧、管道中间帧、因子帧和结果帧共用此结构。
 */
public class TimeSeriesFrame implements Serializable {

    private final TreeMap<FrameKey, Map<String, Object>> rows = new TreeMap<>();
    private final LinkedHashSet<String> columns = new LinkedHashSet<>();

    public TimeSeriesFrame() {}

    public static TimeSeriesFrame empty() {
        return new TimeSeriesFrame();
    }

    /**
     * 写入一行，键已存在时整行替换（upsert）。
     *
     * @return 是否替换了已有行
     */
    public boolean putRow(FrameKey key, Map<String, Object> values) {
        Map<String, Object> row = new LinkedHashMap<>();
        if (values != null) {
            row.putAll(values);
        }
        columns.addAll(row.keySet());
        return rows.put(key, row) != null;
    }

    /**
     * 追加一行，键已存在时保留首次出现的行。
     *
     * @return 是否实际写入
     */
    public boolean appendRow(FrameKey key, Map<String, Object> values) {
        if (rows.containsKey(key)) {
            return false;
        }
        putRow(key, values);
        return true;
    }

    /** 设置单个单元格的值，行不存在时创建 */
    public void setValue(FrameKey key, String column, Object value) {
        rows.computeIfAbsent(key, k -> new LinkedHashMap<>()).put(column, value);
        columns.add(column);
    }

    public boolean containsKey(FrameKey key) {
        return rows.containsKey(key);
    }

    /** @return 只读行视图；键不存在返回null */
    public Map<String, Object> getRow(FrameKey key) {
        Map<String, Object> row = rows.get(key);
        return row == null ? null : Collections.unmodifiableMap(row);
    }

    public Object getValue(FrameKey key, String column) {
        Map<String, Object> row = rows.get(key);
        return row == null ? null : row.get(column);
    }

    /** @return 数值型单元格的值；缺失或非数值返回null */
    public Double getDouble(FrameKey key, String column) {
        Object value = getValue(key, column);
        return (value instanceof Number) ? ((Number) value).doubleValue() : null;
    }

    /** 按键序的只读行视图 */
    public NavigableMap<FrameKey, Map<String, Object>> rows() {
        return Collections.unmodifiableNavigableMap(rows);
    }

    public Set<FrameKey> keys() {
        return Collections.unmodifiableSet(rows.keySet());
    }

    public Set<String> getColumns() {
        return Collections.unmodifiableSet(columns);
    }

    public Set<String> entityIds() {
        Set<String> ids = new TreeSet<>();
        for (FrameKey key : rows.keySet()) {
            ids.add(key.getEntityId());
        }
        return ids;
    }

    /**
     * 按实体分组的键列表，实体按标识升序，组内按时间升序。
     */
    public Map<String, List<FrameKey>> keysByEntity() {
        Map<String, List<FrameKey>> grouped = new LinkedHashMap<>();
        for (FrameKey key : rows.keySet()) {
            grouped.computeIfAbsent(key.getEntityId(), id -> new ArrayList<>()).add(key);
        }
        return grouped;
    }

    /** 全部不重复的时间戳，升序 */
    public List<Timestamp> timestamps() {
        TreeSet<Long> times = new TreeSet<>();
        for (FrameKey key : rows.keySet()) {
            times.add(key.getTime());
        }
        List<Timestamp> result = new ArrayList<>(times.size());
        for (Long t : times) {
            result.add(new Timestamp(t));
        }
        return result;
    }

    public Timestamp minTimestamp() {
        return rows.keySet().stream().map(FrameKey::getTime).min(Long::compare)
                .map(Timestamp::new).orElse(null);
    }

    public Timestamp maxTimestamp() {
        return rows.keySet().stream().map(FrameKey::getTime).max(Long::compare)
                .map(Timestamp::new).orElse(null);
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    /** 深拷贝：行映射各自复制，修改副本不影响原帧 */
    public TimeSeriesFrame copy() {
        TimeSeriesFrame copy = new TimeSeriesFrame();
        copy.columns.addAll(columns);
        for (Map.Entry<FrameKey, Map<String, Object>> entry : rows.entrySet()) {
            copy.rows.put(entry.getKey(), new LinkedHashMap<>(entry.getValue()));
        }
        return copy;
    }

    /** 保留满足条件的行 */
    public TimeSeriesFrame filter(BiPredicate<FrameKey, Map<String, Object>> predicate) {
        TimeSeriesFrame result = new TimeSeriesFrame();
        for (Map.Entry<FrameKey, Map<String, Object>> entry : rows.entrySet()) {
            if (predicate.test(entry.getKey(), Collections.unmodifiableMap(entry.getValue()))) {
                result.putRow(entry.getKey(), entry.getValue());
            }
        }
        return result;
    }

    /** 列投影，只保留指定列 */
    public TimeSeriesFrame select(Collection<String> selected) {
        TimeSeriesFrame result = new TimeSeriesFrame();
        for (String column : selected) {
            if (columns.contains(column)) {
                result.columns.add(column);
            }
        }
        for (Map.Entry<FrameKey, Map<String, Object>> entry : rows.entrySet()) {
            Map<String, Object> projected = new LinkedHashMap<>();
            for (String column : selected) {
                if (entry.getValue().containsKey(column)) {
                    projected.put(column, entry.getValue().get(column));
                }
            }
            result.rows.put(entry.getKey(), projected);
        }
        return result;
    }

    /** 每个实体只保留最近的 n 行 */
    public TimeSeriesFrame tail(int n) {
        TimeSeriesFrame result = new TimeSeriesFrame();
        if (n <= 0) {
            return result;
        }
        for (List<FrameKey> keys : keysByEntity().values()) {
            for (FrameKey key : keys.subList(Math.max(0, keys.size() - n), keys.size())) {
                result.putRow(key, rows.get(key));
            }
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TimeSeriesFrame)) return false;
        TimeSeriesFrame that = (TimeSeriesFrame) o;
        return rows.equals(that.rows) && columns.equals(that.columns);
    }

    @Override
    public int hashCode() {
        return rows.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("TimeSeriesFrame{size=").append(rows.size())
                .append(", columns=").append(columns);
        int shown = 0;
        for (Map.Entry<FrameKey, Map<String, Object>> entry : rows.entrySet()) {
            if (shown++ >= 10) {
                sb.append(", ...");
                break;
            }
            sb.append(", ").append(entry.getKey()).append('=').append(entry.getValue());
        }
        return sb.append('}').toString();
    }
}
