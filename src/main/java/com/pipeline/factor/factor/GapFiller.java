package com.pipeline.factor.factor;

import com.pipeline.factor.model.FillMethod;
import com.pipeline.factor.model.FrameKey;
import com.pipeline.factor.model.TimeSeriesFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Timestamp;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 缺口填充器。
 * 把结果帧按实体重建到逐日的稠密日历上，再沿指定方向填充缺失值。
 *
 * 规则：
 * - 日历覆盖起止时间之间的每个自然日（含两端）；未配置的端点取帧内最早/最晚时间
 * - 源数据按所在自然日落位，同一天出现多行时保留第一行
 * - 按实体、按列独立填充，同一缺口内最多连续填充 effectiveNumber 个位置，
 *   超出部分保持缺失
 * - 帧为空或为null时原样返回，不抛异常
 */
public class GapFiller {

    private static final Logger log = LoggerFactory.getLogger(GapFiller.class);

    private final Timestamp startTimestamp;
    private final Timestamp endTimestamp;
    private final FillMethod fillMethod;
    private final int effectiveNumber;

    public GapFiller(Timestamp startTimestamp, Timestamp endTimestamp,
                     FillMethod fillMethod, int effectiveNumber) {
        if (fillMethod == null) {
            throw new IllegalArgumentException("Fill method must not be null");
        }
        if (effectiveNumber < 0) {
            throw new IllegalArgumentException("effectiveNumber must be >= 0, got: " + effectiveNumber);
        }
        this.startTimestamp = startTimestamp;
        this.endTimestamp = endTimestamp;
        this.fillMethod = fillMethod;
        this.effectiveNumber = effectiveNumber;
    }

    public TimeSeriesFrame fill(TimeSeriesFrame frame) {
        if (frame == null || frame.isEmpty()) {
            return frame;
        }

        LocalDate startDay = toDay(startTimestamp != null ? startTimestamp : frame.minTimestamp());
        LocalDate endDay = toDay(endTimestamp != null ? endTimestamp : frame.maxTimestamp());
        if (startDay.isAfter(endDay)) {
            log.warn("Gap fill skipped, start day {} is after end day {}", startDay, endDay);
            return frame;
        }

        List<LocalDate> calendar = new ArrayList<>();
        for (LocalDate day = startDay; !day.isAfter(endDay); day = day.plusDays(1)) {
            calendar.add(day);
        }
        List<String> columns = new ArrayList<>(frame.getColumns());

        TimeSeriesFrame result = new TimeSeriesFrame();
        int duplicates = 0;
        for (Map.Entry<String, List<FrameKey>> entry : frame.keysByEntity().entrySet()) {
            String entityId = entry.getKey();

            // 落位到自然日，同日保留第一行
            Map<LocalDate, Map<String, Object>> byDay = new LinkedHashMap<>();
            for (FrameKey key : entry.getValue()) {
                LocalDate day = toDay(key.getTimestamp());
                if (byDay.putIfAbsent(day, frame.getRow(key)) != null) {
                    duplicates++;
                }
            }

            Object[][] values = new Object[columns.size()][calendar.size()];
            for (int d = 0; d < calendar.size(); d++) {
                Map<String, Object> row = byDay.get(calendar.get(d));
                if (row == null) continue;
                for (int c = 0; c < columns.size(); c++) {
                    values[c][d] = row.get(columns.get(c));
                }
            }
            for (Object[] series : values) {
                fillSeries(series);
            }

            for (int d = 0; d < calendar.size(); d++) {
                Map<String, Object> row = new LinkedHashMap<>();
                for (int c = 0; c < columns.size(); c++) {
                    row.put(columns.get(c), values[c][d]);
                }
                result.putRow(FrameKey.of(entityId, Timestamp.valueOf(calendar.get(d).atStartOfDay())), row);
            }
        }

        if (duplicates > 0) {
            log.debug("Gap fill dropped {} duplicate rows on the same day", duplicates);
        }
        return result;
    }

    /**
     * 单列填充，原地修改。
     */
    void fillSeries(Object[] series) {
        if (fillMethod == FillMethod.FFILL) {
            Object last = null;
            int run = 0;
            for (int i = 0; i < series.length; i++) {
                if (!isMissing(series[i])) {
                    last = series[i];
                    run = 0;
                } else if (last != null && run < effectiveNumber) {
                    series[i] = last;
                    run++;
                } else {
                    run++;
                }
            }
        } else {
            Object next = null;
            int run = 0;
            for (int i = series.length - 1; i >= 0; i--) {
                if (!isMissing(series[i])) {
                    next = series[i];
                    run = 0;
                } else if (next != null && run < effectiveNumber) {
                    series[i] = next;
                    run++;
                } else {
                    run++;
                }
            }
        }
    }

    private static boolean isMissing(Object value) {
        return value == null || (value instanceof Double && ((Double) value).isNaN());
    }

    private static LocalDate toDay(Timestamp timestamp) {
        return timestamp.toLocalDateTime().toLocalDate();
    }

    public FillMethod getFillMethod() { return fillMethod; }
    public int getEffectiveNumber() { return effectiveNumber; }
}
