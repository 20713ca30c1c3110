package com.pipeline.factor.core;

/**
 * 转换阶段失败（转换器、打分器或状态分类器）。
 * 因子帧保持周期开始前的状态，本周期不做持久化。
 */
public class TransformException extends FactorException {

    public TransformException(String factorName, String message, Throwable cause) {
        super(factorName, message, cause);
    }
}
