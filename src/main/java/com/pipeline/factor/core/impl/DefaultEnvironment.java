package com.pipeline.factor.core.impl;

import com.pipeline.factor.core.DataCollector;
import com.pipeline.factor.core.Environment;
import com.pipeline.factor.core.FactorRegistry;
import com.pipeline.factor.storage.AbstractDataStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 运行时环境默认实现。
 * 管理存储、注册表和采集器的生命周期，控制系统启停。
 */
public class DefaultEnvironment implements Environment {

    private static final Logger log = LoggerFactory.getLogger(DefaultEnvironment.class);

    private AbstractDataStorage dataStorage;
    private FactorRegistry factorRegistry;
    private DataCollector dataCollector;

    private final AtomicBoolean running = new AtomicBoolean(false);

    private DefaultEnvironment() {}

    public static DefaultEnvironment initialize() {
        log.info("Initializing factor engine environment...");
        return new DefaultEnvironment();
    }

    @Override
    public DefaultEnvironment setDataStorage(AbstractDataStorage dataStorage) {
        this.dataStorage = dataStorage;
        return this;
    }

    @Override
    public DefaultEnvironment setFactorRegistry(FactorRegistry factorRegistry) {
        this.factorRegistry = factorRegistry;
        return this;
    }

    @Override
    public DefaultEnvironment setDataCollector(DataCollector dataCollector) {
        this.dataCollector = dataCollector;
        return this;
    }

    @Override
    public void start() {
        validateComponents();

        if (!running.compareAndSet(false, true)) {
            log.warn("Environment is already running, ignoring duplicate start.");
            return;
        }

        log.info("Starting factor engine environment with {} registered factors.",
                factorRegistry.getAllFactors().size());

        if (dataCollector != null) {
            dataCollector.start();
        } else {
            log.info("No data collector configured, factors will only react to direct appends.");
        }

        log.info("Factor engine environment started successfully.");
    }

    @Override
    public void shutdown() {
        if (!running.compareAndSet(true, false)) {
            log.warn("Environment is not running, ignoring shutdown.");
            return;
        }

        log.info("Shutting down factor engine environment...");

        if (dataCollector != null) {
            dataCollector.stop();
        }

        for (String name : factorRegistry.getFactorNames()) {
            factorRegistry.unregisterFactor(name);
        }

        dataStorage.shutdown();

        log.info("Factor engine environment shut down successfully.");
    }

    private void validateComponents() {
        if (dataStorage == null) throw new IllegalStateException("DataStorage is required");
        if (factorRegistry == null) throw new IllegalStateException("FactorRegistry is required");
    }

    public AbstractDataStorage getDataStorage() { return dataStorage; }
    public FactorRegistry getFactorRegistry() { return factorRegistry; }
    public DataCollector getDataCollector() { return dataCollector; }
    public boolean isRunning() { return running.get(); }
}
