package com.pipeline.factor.factor;

/**
 * 因子种类，构造时确定，运行期不可变
 */
public enum FactorType {
    /** 结果作为入选门限 */
    FILTER,
    /** 结果为连续取值的打分 */
    SCORE,
    /** 结果为有限状态集合中的一个状态 */
    STATE
}
