package com.pipeline.factor.core;

import com.pipeline.factor.model.TimeSeriesFrame;

/**
 * 有状态累加器：把本周期新算出的管道帧合并进此前持久化的因子帧。
 *
 * 累加器本身不持有帧，状态全部体现在传入的因子帧中。
 * 编排器传入的是因子帧的副本，累加失败时原因子帧保持不变。
 */
@FunctionalInterface
public interface Accumulator {

    /**
     * @param pipeFrame   本周期转换后的管道帧，非空
     * @param factorFrame 此前累积的因子帧副本，可能为空帧
     * @return 合并后的因子帧
     */
    TimeSeriesFrame accumulate(TimeSeriesFrame pipeFrame, TimeSeriesFrame factorFrame);
}
