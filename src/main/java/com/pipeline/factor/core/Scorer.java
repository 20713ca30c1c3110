package com.pipeline.factor.core;

import com.pipeline.factor.model.TimeSeriesFrame;

/**
 * 打分器：由原始输入帧生成对外使用的标准化结果帧。
 *
 * 打分只读原始帧，不依赖因子帧，因此可以在不重算因子的前提下重新打分。
 * 可以在同一时间戳上做跨实体排名。
 */
@FunctionalInterface
public interface Scorer {

    /**
     * @param rawFrame 原始输入帧
     * @return 结果帧，按惯例取值在 [0,1]，但不强制
     */
    TimeSeriesFrame score(TimeSeriesFrame rawFrame);
}
