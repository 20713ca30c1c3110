package com.pipeline.factor.core;

import com.pipeline.factor.factor.Factor;
import com.pipeline.factor.factor.FactorType;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 因子注册表接口。
 *
 * 维护两张表：
 * - 因子定义：名称到构造定义，用于按名称创建因子
 * - 因子实例：名称到已创建的因子
 *
 * 注册表是由应用显式创建的对象，只通过下列方法修改。
 */
public interface FactorRegistry {

    /**
     * 注册因子定义。名称已存在时拒绝注册并返回false。
     *
     * @param name       定义名称
     * @param definition 构造定义
     * @return 注册是否成功
     */
    boolean registerDefinition(String name, FactorDefinition definition);

    /**
     * 按定义名称创建因子，并以同名注册实例。
     *
     * @param name 定义名称
     * @return 新创建的因子
     * @throws IllegalArgumentException 定义不存在或同名实例已存在时抛出
     */
    Factor createFactor(String name, DataSource dataSource, PersistenceSink persistenceSink);

    /**
     * 注册因子实例。名称已存在时拒绝注册并返回false。
     */
    boolean registerFactor(String name, Factor factor);

    /**
     * 注销因子实例，并取消其在自身数据源上的订阅。
     *
     * @return 注销是否成功
     */
    boolean unregisterFactor(String name);

    /**
     * @return 因子实例；未找到返回null
     */
    Factor getFactor(String name);

    /**
     * 批量获取因子实例，不存在的名称不包含在结果中
     */
    Map<String, Factor> getFactors(List<String> names);

    /**
     * @return 全部实例的注册名称
     */
    Set<String> getFactorNames();

    List<Factor> getAllFactors();

    List<Factor> getFactorsByType(FactorType type);
}
