package com.pipeline.factor.core;

/**
 * 因子计算异常的基类。
 * 每个异常只中止一个计算周期，因子对象之后仍可继续使用。
 */
public class FactorException extends RuntimeException {

    private final String factorName;

    public FactorException(String factorName, String message, Throwable cause) {
        super("[" + factorName + "] " + message, cause);
        this.factorName = factorName;
    }

    public String getFactorName() { return factorName; }
}
