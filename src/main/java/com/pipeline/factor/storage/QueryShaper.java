package com.pipeline.factor.storage;

import com.pipeline.factor.model.DataQuery;
import com.pipeline.factor.model.FrameKey;
import com.pipeline.factor.model.SortDirective;
import com.pipeline.factor.model.TimeSeriesFrame;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * 在内存中对帧应用查询描述：范围过滤 → 排序截取 → 列投影。
 */
final class QueryShaper {

    private QueryShaper() {}

    static TimeSeriesFrame shape(DataQuery query, TimeSeriesFrame frame) {
        TimeSeriesFrame selected = frame.filter(query::matches);

        if (query.getLimit() != null && selected.size() > query.getLimit()) {
            List<Map.Entry<FrameKey, Map<String, Object>>> entries = new ArrayList<>(selected.rows().entrySet());
            if (query.getOrder() != null) {
                entries.sort(comparator(query.getOrder()));
            }
            TimeSeriesFrame limited = new TimeSeriesFrame();
            for (Map.Entry<FrameKey, Map<String, Object>> entry : entries.subList(0, query.getLimit())) {
                limited.putRow(entry.getKey(), entry.getValue());
            }
            selected = limited;
        }

        return project(query, selected);
    }

    /** 只做范围过滤和列投影，用于推送新到达的数据 */
    static TimeSeriesFrame filterRows(DataQuery query, TimeSeriesFrame frame) {
        return project(query, frame.filter(query::matches));
    }

    private static TimeSeriesFrame project(DataQuery query, TimeSeriesFrame frame) {
        if (query.getColumns() == null || query.getColumns().isEmpty()) {
            return frame;
        }
        return frame.select(query.getColumns());
    }

    static Comparator<Map.Entry<FrameKey, Map<String, Object>>> comparator(SortDirective order) {
        Comparator<Map.Entry<FrameKey, Map<String, Object>>> cmp;
        String field = order.getField();
        if (FrameKey.TIMESTAMP_FIELD.equals(field)) {
            cmp = Comparator.comparingLong(e -> e.getKey().getTime());
        } else if (FrameKey.ENTITY_ID_FIELD.equals(field)) {
            cmp = Comparator.comparing(e -> e.getKey().getEntityId());
        } else {
            cmp = (a, b) -> compareCells(a.getValue().get(field), b.getValue().get(field));
        }
        if (order.getDirection() == SortDirective.Direction.DESC) {
            cmp = cmp.reversed();
        }
        // 同值时按键序，保证结果稳定
        return cmp.thenComparing(Map.Entry::getKey);
    }

    private static int compareCells(Object a, Object b) {
        if (a == null || b == null) {
            return (a == null) ? ((b == null) ? 0 : -1) : 1;
        }
        if (a instanceof Number && b instanceof Number) {
            return Double.compare(((Number) a).doubleValue(), ((Number) b).doubleValue());
        }
        if (a instanceof Comparable && a.getClass().isInstance(b)) {
            @SuppressWarnings("unchecked")
            Comparable<Object> comparable = (Comparable<Object>) a;
            return comparable.compareTo(b);
        }
        return String.valueOf(a).compareTo(String.valueOf(b));
    }
}
