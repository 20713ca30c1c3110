package com.pipeline.factor.core;

/**
 * 构造阶段读取原始数据或已持久化因子失败，不会返回半初始化的因子
 */
public class LoadException extends FactorException {

    public LoadException(String factorName, String message, Throwable cause) {
        super(factorName, message, cause);
    }
}
