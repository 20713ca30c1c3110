package com.pipeline.factor.core.impl;

import com.pipeline.factor.core.DataSource;
import com.pipeline.factor.core.FactorDefinition;
import com.pipeline.factor.core.FactorRegistry;
import com.pipeline.factor.core.PersistenceSink;
import com.pipeline.factor.factor.Factor;
import com.pipeline.factor.factor.FactorType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * 因子注册表默认实现。
 * 使用ConcurrentHashMap存储定义和实例，支持并发注册和查询。
 */
public class DefaultFactorRegistry implements FactorRegistry {

    private static final Logger log = LoggerFactory.getLogger(DefaultFactorRegistry.class);

    /** 定义表：name -> FactorDefinition */
    private final ConcurrentHashMap<String, FactorDefinition> definitions = new ConcurrentHashMap<>();

    /** 实例表：name -> Factor */
    private final ConcurrentHashMap<String, Factor> factors = new ConcurrentHashMap<>();

    @Override
    public boolean registerDefinition(String name, FactorDefinition definition) {
        if (name == null || name.isBlank()) {
            log.error("Cannot register factor definition with null or blank name");
            return false;
        }
        if (definition == null) {
            log.error("Cannot register null factor definition for name: {}", name);
            return false;
        }
        if (definitions.putIfAbsent(name, definition) != null) {
            log.warn("Factor definition '{}' is already registered, registration rejected.", name);
            return false;
        }
        log.info("Factor definition '{}' registered successfully.", name);
        return true;
    }

    @Override
    public Factor createFactor(String name, DataSource dataSource, PersistenceSink persistenceSink) {
        FactorDefinition definition = definitions.get(name);
        if (definition == null) {
            throw new IllegalArgumentException("Factor definition '" + name + "' is not registered.");
        }
        if (factors.containsKey(name)) {
            throw new IllegalArgumentException("Factor instance '" + name + "' already exists.");
        }

        Factor factor = definition.create(dataSource, persistenceSink);
        if (!registerFactor(name, factor)) {
            // 并发创建时另一个实例先注册，撤销本实例的订阅
            dataSource.removeListener(factor);
            throw new IllegalArgumentException("Factor instance '" + name + "' already exists.");
        }
        return factor;
    }

    @Override
    public boolean registerFactor(String name, Factor factor) {
        if (name == null || name.isBlank()) {
            log.error("Cannot register factor with null or blank name");
            return false;
        }
        if (factor == null) {
            log.error("Cannot register null factor for name: {}", name);
            return false;
        }
        if (factors.putIfAbsent(name, factor) != null) {
            log.warn("Factor '{}' is already registered, registration rejected.", name);
            return false;
        }
        log.info("Factor '{}' ({}) registered successfully.", name, factor.getFactorType());
        return true;
    }

    @Override
    public boolean unregisterFactor(String name) {
        if (name == null || name.isBlank()) {
            return false;
        }
        Factor removed = factors.remove(name);
        if (removed == null) {
            log.warn("Factor '{}' not found, nothing to unregister.", name);
            return false;
        }
        // 同一实例仍以其他名称注册时保留订阅
        if (!factors.containsValue(removed)) {
            removed.getDataSource().removeListener(removed);
        }
        log.info("Factor '{}' unregistered successfully.", name);
        return true;
    }

    @Override
    public Factor getFactor(String name) {
        return name == null ? null : factors.get(name);
    }

    @Override
    public Map<String, Factor> getFactors(List<String> names) {
        if (names == null || names.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, Factor> result = new LinkedHashMap<>();
        for (String name : names) {
            Factor factor = factors.get(name);
            if (factor != null) {
                result.put(name, factor);
            }
        }
        return result;
    }

    @Override
    public Set<String> getFactorNames() {
        return new LinkedHashSet<>(factors.keySet());
    }

    @Override
    public List<Factor> getAllFactors() {
        return new ArrayList<>(factors.values());
    }

    @Override
    public List<Factor> getFactorsByType(FactorType type) {
        return factors.values().stream()
                .filter(f -> f.getFactorType() == type)
                .collect(Collectors.toList());
    }

    public int getDefinitionCount() {
        return definitions.size();
    }
}
