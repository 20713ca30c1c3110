package com.pipeline.factor.core;

/**
 * 持久化失败。
 * 抛出时内存中的因子帧已经更新，持久化副本要等下一个成功周期或外部重试才会追上。
 */
public class PersistException extends FactorException {

    public PersistException(String factorName, String message, Throwable cause) {
        super(factorName, message, cause);
    }
}
