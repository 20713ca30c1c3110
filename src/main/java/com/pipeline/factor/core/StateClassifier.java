package com.pipeline.factor.core;

import com.pipeline.factor.model.FrameKey;

import java.util.Map;

/**
 * 状态分类器：把因子帧的一行映射到一个已声明的状态名
 */
@FunctionalInterface
public interface StateClassifier {

    /**
     * @param key 行键
     * @param row 因子帧中该键的只读行
     * @return 状态名，必须是状态因子声明过的状态之一
     */
    String classify(FrameKey key, Map<String, Object> row);
}
