package com.pipeline.factor.core;

import com.pipeline.factor.factor.Factor;

/**
 * 具名的因子构造定义。
 * 注册表保存定义，按需绑定数据源和持久化目标创建因子实例。
 */
@FunctionalInterface
public interface FactorDefinition {

    /**
     * 创建并初始化一个因子实例
     *
     * @param dataSource      数据源
     * @param persistenceSink 持久化目标，不持久化的因子可为null
     * @return 已完成预热加载和订阅的因子
     */
    Factor create(DataSource dataSource, PersistenceSink persistenceSink);
}
