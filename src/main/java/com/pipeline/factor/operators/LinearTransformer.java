package com.pipeline.factor.operators;

import com.pipeline.factor.core.Transformer;
import com.pipeline.factor.model.FrameKey;
import com.pipeline.factor.model.TimeSeriesFrame;

/**
 * 线性变换：column = column * scale + offset，缺失值保持缺失
 */
public class LinearTransformer implements Transformer {

    private final String column;
    private final double scale;
    private final double offset;

    public LinearTransformer(String column, double scale, double offset) {
        if (column == null || column.isBlank()) {
            throw new IllegalArgumentException("Column must not be null or blank");
        }
        this.column = column;
        this.scale = scale;
        this.offset = offset;
    }

    public static LinearTransformer scale(String column, double scale) {
        return new LinearTransformer(column, scale, 0.0);
    }

    public static LinearTransformer shift(String column, double offset) {
        return new LinearTransformer(column, 1.0, offset);
    }

    @Override
    public TimeSeriesFrame transform(TimeSeriesFrame input) {
        TimeSeriesFrame output = input.copy();
        for (FrameKey key : input.keys()) {
            Double value = input.getDouble(key, column);
            if (value != null) {
                output.setValue(key, column, value * scale + offset);
            }
        }
        return output;
    }
}
