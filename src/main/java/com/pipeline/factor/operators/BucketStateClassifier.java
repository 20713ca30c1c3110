package com.pipeline.factor.operators;

import com.pipeline.factor.core.StateClassifier;
import com.pipeline.factor.model.FrameKey;

import java.util.List;
import java.util.Map;

/**
 * 分段状态分类器。
 *
 * n 个升序边界把数轴分成 n+1 段，依次对应 n+1 个状态：
 * value &lt; b0 → s0，b0 ≤ value &lt; b1 → s1，…，value ≥ b(n-1) → sn。
 * 列缺失时返回 missingState。
 */
public class BucketStateClassifier implements StateClassifier {

    private final String column;
    private final double[] boundaries;
    private final List<String> states;
    private final String missingState;

    public BucketStateClassifier(String column, double[] boundaries, List<String> states, String missingState) {
        if (column == null || boundaries == null || states == null) {
            throw new IllegalArgumentException("Column, boundaries and states are required");
        }
        if (states.size() != boundaries.length + 1) {
            throw new IllegalArgumentException("Expected " + (boundaries.length + 1)
                    + " states for " + boundaries.length + " boundaries, got: " + states.size());
        }
        for (int i = 1; i < boundaries.length; i++) {
            if (boundaries[i] <= boundaries[i - 1]) {
                throw new IllegalArgumentException("Boundaries must be strictly ascending");
            }
        }
        this.column = column;
        this.boundaries = boundaries.clone();
        this.states = List.copyOf(states);
        this.missingState = missingState;
    }

    @Override
    public String classify(FrameKey key, Map<String, Object> row) {
        Object value = row.get(column);
        if (!(value instanceof Number) || Double.isNaN(((Number) value).doubleValue())) {
            return missingState;
        }
        double v = ((Number) value).doubleValue();
        int bucket = 0;
        while (bucket < boundaries.length && v >= boundaries[bucket]) {
            bucket++;
        }
        return states.get(bucket);
    }
}
