package com.pipeline.factor.core;

import com.pipeline.factor.model.TimeSeriesFrame;

/**
 * 无状态转换器：因子管道中最小的计算单元。
 *
 * 多个转换器按调用方配置的顺序串联，前一个的输出是后一个的输入。
 * 顺序有语义：转换之间不要求可交换。
 *
 * 实现约定：
 * - 不在两次调用之间保存任何状态
 * - 不修改输入帧，返回新的帧
 * - 不返回null；失败时直接抛出运行时异常，由编排器中止当前计算周期
 */
@FunctionalInterface
public interface Transformer {

    /**
     * 对管道帧执行一次转换。
     *
     * @param input 当前管道帧，非null
     * @return 转换后的新管道帧
     */
    TimeSeriesFrame transform(TimeSeriesFrame input);
}
