package com.pipeline.factor.core;

/**
 * 累加器失败，处理方式同 {@link TransformException}
 */
public class AccumulationException extends FactorException {

    public AccumulationException(String factorName, String message, Throwable cause) {
        super(factorName, message, cause);
    }
}
