package com.pipeline.factor.operators;

import com.pipeline.factor.core.Scorer;
import com.pipeline.factor.model.FrameKey;
import com.pipeline.factor.model.TimeSeriesFrame;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 截面排名打分器。
 *
 * 在每个时间戳上对所有实体的指定列做百分位排名，得分落在 [0,1]：
 * 升序时最小值得 0、最大值得 1，降序相反；并列取平均名次；
 * 该时刻只有一个有效值时得 1。缺失值不参与排名，得分也缺失。
 */
public class RankScorer implements Scorer {

    private final List<String> columns;
    private final boolean ascending;

    public RankScorer(List<String> columns, boolean ascending) {
        if (columns == null || columns.isEmpty()) {
            throw new IllegalArgumentException("RankScorer requires at least one column");
        }
        this.columns = List.copyOf(columns);
        this.ascending = ascending;
    }

    public RankScorer(String column) {
        this(List.of(column), true);
    }

    @Override
    public TimeSeriesFrame score(TimeSeriesFrame rawFrame) {
        TimeSeriesFrame result = new TimeSeriesFrame();
        if (rawFrame == null || rawFrame.isEmpty()) {
            return result;
        }

        Map<Long, List<FrameKey>> byTime = new HashMap<>();
        for (FrameKey key : rawFrame.keys()) {
            byTime.computeIfAbsent(key.getTime(), t -> new ArrayList<>()).add(key);
        }

        for (List<FrameKey> crossSection : byTime.values()) {
            for (String column : columns) {
                List<FrameKey> present = new ArrayList<>();
                for (FrameKey key : crossSection) {
                    Double v = rawFrame.getDouble(key, column);
                    if (v != null && !v.isNaN()) {
                        present.add(key);
                    } else {
                        result.setValue(key, column, null);
                    }
                }
                present.sort((a, b) -> Double.compare(rawFrame.getDouble(a, column), rawFrame.getDouble(b, column)));

                int n = present.size();
                int i = 0;
                while (i < n) {
                    // 并列区间 [i, j)
                    int j = i + 1;
                    double value = rawFrame.getDouble(present.get(i), column);
                    while (j < n && rawFrame.getDouble(present.get(j), column) == value) {
                        j++;
                    }
                    double averageRank = (i + j - 1) / 2.0;
                    double pct = (n == 1) ? 1.0 : averageRank / (n - 1);
                    double score = ascending ? pct : 1.0 - pct;
                    for (int k = i; k < j; k++) {
                        result.setValue(present.get(k), column, score);
                    }
                    i = j;
                }
            }
        }
        return result;
    }
}
