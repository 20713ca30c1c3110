package com.pipeline.factor.operators;

import com.pipeline.factor.core.Transformer;
import com.pipeline.factor.model.FrameKey;
import com.pipeline.factor.model.TimeSeriesFrame;

/**
 * 阈值门限转换。
 * 源列取值落在 [lowerLimit, upperLimit] 内时输出列为 1.0，否则为 0.0；
 * 源列缺失时输出列也缺失。常用于过滤因子。
 */
public class ThresholdTransformer implements Transformer {

    private final String sourceColumn;
    private final String outputColumn;
    private final double lowerLimit;
    private final double upperLimit;

    public ThresholdTransformer(String sourceColumn, String outputColumn,
                                double lowerLimit, double upperLimit) {
        if (sourceColumn == null || outputColumn == null) {
            throw new IllegalArgumentException("Source and output columns must not be null");
        }
        if (lowerLimit > upperLimit) {
            throw new IllegalArgumentException("lowerLimit " + lowerLimit
                    + " is greater than upperLimit " + upperLimit);
        }
        this.sourceColumn = sourceColumn;
        this.outputColumn = outputColumn;
        this.lowerLimit = lowerLimit;
        this.upperLimit = upperLimit;
    }

    /** 只设下限 */
    public static ThresholdTransformer above(String sourceColumn, String outputColumn, double lowerLimit) {
        return new ThresholdTransformer(sourceColumn, outputColumn, lowerLimit, Double.POSITIVE_INFINITY);
    }

    /** 只设上限 */
    public static ThresholdTransformer below(String sourceColumn, String outputColumn, double upperLimit) {
        return new ThresholdTransformer(sourceColumn, outputColumn, Double.NEGATIVE_INFINITY, upperLimit);
    }

    @Override
    public TimeSeriesFrame transform(TimeSeriesFrame input) {
        TimeSeriesFrame output = input.copy();
        for (FrameKey key : input.keys()) {
            Double value = input.getDouble(key, sourceColumn);
            if (value == null || value.isNaN()) {
                output.setValue(key, outputColumn, null);
            } else {
                boolean inside = value >= lowerLimit && value <= upperLimit;
                output.setValue(key, outputColumn, inside ? 1.0 : 0.0);
            }
        }
        return output;
    }
}
