package com.pipeline.factor.operators;

import com.pipeline.factor.core.Transformer;
import com.pipeline.factor.model.FrameKey;
import com.pipeline.factor.model.TimeSeriesFrame;

import java.util.Arrays;
import java.util.List;

/**
 * 滑动窗口平滑转换。
 * 按实体独立计算，结果写入输出列，源列保持不变。
 *
 * 参数：
 * - method: SMA（简单移动平均）/ EWMA（指数加权移动平均）/ MEDIAN（中值）
 * - windowSize: 窗口大小，SMA 与 MEDIAN 使用
 * - alpha: EWMA 衰减系数，(0, 1]
 *
 * 当前行源值缺失时输出缺失；窗口内的缺失值不参与计算。
 */
public class MovingAverageTransformer implements Transformer {

    public enum Method { SMA, EWMA, MEDIAN }

    private final String sourceColumn;
    private final String outputColumn;
    private final Method method;
    private final int windowSize;
    private final double alpha;

    public MovingAverageTransformer(String sourceColumn, String outputColumn,
                                    Method method, int windowSize, double alpha) {
        if (sourceColumn == null || outputColumn == null || method == null) {
            throw new IllegalArgumentException("Source column, output column and method are required");
        }
        if (windowSize < 1) {
            throw new IllegalArgumentException("windowSize must be >= 1, got: " + windowSize);
        }
        if (alpha <= 0 || alpha > 1) {
            throw new IllegalArgumentException("alpha must be in (0, 1], got: " + alpha);
        }
        this.sourceColumn = sourceColumn;
        this.outputColumn = outputColumn;
        this.method = method;
        this.windowSize = windowSize;
        this.alpha = alpha;
    }

    public static MovingAverageTransformer sma(String sourceColumn, String outputColumn, int windowSize) {
        return new MovingAverageTransformer(sourceColumn, outputColumn, Method.SMA, windowSize, 0.3);
    }

    public static MovingAverageTransformer ewma(String sourceColumn, String outputColumn, double alpha) {
        return new MovingAverageTransformer(sourceColumn, outputColumn, Method.EWMA, 1, alpha);
    }

    public static MovingAverageTransformer median(String sourceColumn, String outputColumn, int windowSize) {
        return new MovingAverageTransformer(sourceColumn, outputColumn, Method.MEDIAN, windowSize, 0.3);
    }

    @Override
    public TimeSeriesFrame transform(TimeSeriesFrame input) {
        TimeSeriesFrame output = input.copy();
        for (List<FrameKey> keys : input.keysByEntity().values()) {
            Double[] values = new Double[keys.size()];
            for (int i = 0; i < keys.size(); i++) {
                Double v = input.getDouble(keys.get(i), sourceColumn);
                values[i] = (v == null || v.isNaN()) ? null : v;
            }

            Double[] smoothed;
            switch (method) {
                case EWMA:
                    smoothed = exponentialWeightedMovingAverage(values);
                    break;
                case MEDIAN:
                    smoothed = medianFilter(values);
                    break;
                case SMA:
                default:
                    smoothed = simpleMovingAverage(values);
            }

            for (int i = 0; i < keys.size(); i++) {
                output.setValue(keys.get(i), outputColumn, smoothed[i]);
            }
        }
        return output;
    }

    private Double[] simpleMovingAverage(Double[] values) {
        Double[] out = new Double[values.length];
        for (int i = 0; i < values.length; i++) {
            if (values[i] == null) continue;
            double sum = 0;
            int count = 0;
            for (int j = Math.max(0, i - windowSize + 1); j <= i; j++) {
                if (values[j] != null) {
                    sum += values[j];
                    count++;
                }
            }
            out[i] = sum / count;
        }
        return out;
    }

    private Double[] exponentialWeightedMovingAverage(Double[] values) {
        Double[] out = new Double[values.length];
        Double ewma = null;
        for (int i = 0; i < values.length; i++) {
            if (values[i] == null) continue;
            ewma = (ewma == null) ? values[i] : alpha * values[i] + (1 - alpha) * ewma;
            out[i] = ewma;
        }
        return out;
    }

    /**
     * 居中窗口的中值滤波
     */
    private Double[] medianFilter(Double[] values) {
        Double[] out = new Double[values.length];
        for (int i = 0; i < values.length; i++) {
            if (values[i] == null) continue;
            int start = Math.max(0, i - windowSize / 2);
            int end = Math.min(values.length - 1, i + windowSize / 2);

            double[] window = new double[end - start + 1];
            int n = 0;
            for (int j = start; j <= end; j++) {
                if (values[j] != null) {
                    window[n++] = values[j];
                }
            }
            double[] present = Arrays.copyOf(window, n);
            Arrays.sort(present);
            out[i] = present[present.length / 2];
        }
        return out;
    }
}
