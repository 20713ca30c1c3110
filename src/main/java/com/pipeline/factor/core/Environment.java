package com.pipeline.factor.core;

import com.pipeline.factor.storage.AbstractDataStorage;

/**
 * 运行时环境接口，负责组件装配和生命周期。
 *
 * 采用链式配置，将各组件注入后统一启动：
 * <pre>
 * DefaultEnvironment.initialize()
 *     .setDataStorage(dataStorage)
 *     .setFactorRegistry(factorRegistry)
 *     .setDataCollector(dataCollector)
 *     .start();
 * </pre>
 */
public interface Environment {

    /**
     * 配置数据存储，同时作为因子的数据源和持久化目标。
     *
     * @return 当前环境实例，支持链式调用
     */
    Environment setDataStorage(AbstractDataStorage dataStorage);

    /**
     * 配置因子注册表。
     *
     * @return 当前环境实例，支持链式调用
     */
    Environment setFactorRegistry(FactorRegistry factorRegistry);

    /**
     * 配置数据采集器，可选。
     *
     * @return 当前环境实例，支持链式调用
     */
    Environment setDataCollector(DataCollector dataCollector);

    /**
     * 启动运行时环境：校验必要组件后启动数据采集。
     *
     * @throws IllegalStateException 必要组件未配置时抛出
     */
    void start();

    /**
     * 按与启动相反的顺序关闭：先停止采集，再注销因子，最后关闭存储。
     */
    void shutdown();
}
