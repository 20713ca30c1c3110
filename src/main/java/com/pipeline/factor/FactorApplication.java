package com.pipeline.factor;

import com.pipeline.factor.collector.KafkaDataCollector;
import com.pipeline.factor.core.FactorRegistry;
import com.pipeline.factor.core.impl.DefaultEnvironment;
import com.pipeline.factor.core.impl.DefaultFactorRegistry;
import com.pipeline.factor.factor.FactorConfig;
import com.pipeline.factor.factor.FilterFactor;
import com.pipeline.factor.factor.ScoreFactor;
import com.pipeline.factor.operators.MovingAverageTransformer;
import com.pipeline.factor.operators.RankScorer;
import com.pipeline.factor.operators.UpsertAccumulator;
import com.pipeline.factor.storage.AbstractDataStorage;
import com.pipeline.factor.storage.SQLiteDataStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CountDownLatch;

/**
 * 系统启动引导类。
 * 一条命令完成全部初始化：创建存储、注册因子定义、创建启用的因子、启动采集。
 *
 * 用法：java -jar pipeline-factor.jar [配置文件路径]
 */
public class FactorApplication {

    private static final Logger log = LoggerFactory.getLogger(FactorApplication.class);

    private DefaultEnvironment environment;
    private final CountDownLatch stopped = new CountDownLatch(1);

    public void start(AppConfig config) {
        log.info("=== Factor Computation Engine ===");
        log.info("Starting with config: {}", config);

        // 1. 初始化存储层
        SQLiteDataStorage dataStorage = new SQLiteDataStorage(config.getStorageRoot());

        // 2. 注册内置因子定义并创建启用的因子
        DefaultFactorRegistry factorRegistry = new DefaultFactorRegistry();
        registerBuiltinDefinitions(factorRegistry, config);
        for (String name : config.getEnabledFactors()) {
            factorRegistry.createFactor(name, dataStorage, dataStorage);
        }

        // 3. 组装运行时环境
        environment = DefaultEnvironment.initialize()
                .setDataStorage(dataStorage)
                .setFactorRegistry(factorRegistry);
        if (config.isKafkaEnabled()) {
            environment.setDataCollector(createCollector(config, dataStorage));
        }

        // 注册JVM关闭钩子
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown hook triggered, performing graceful shutdown...");
            shutdown();
        }, "shutdown-hook"));

        environment.start();

        log.info("=== Engine started successfully ===");
    }

    public void shutdown() {
        if (environment != null && environment.isRunning()) {
            environment.shutdown();
        }
        stopped.countDown();
        log.info("=== Engine shut down ===");
    }

    /** 阻塞直到引擎关闭 */
    public void awaitShutdown() throws InterruptedException {
        stopped.await();
    }

    private KafkaDataCollector createCollector(AppConfig config, AbstractDataStorage dataStorage) {
        return new KafkaDataCollector(
                config.getKafkaBootstrapServers(),
                config.getKafkaInputTopic(),
                config.getKafkaGroupId(),
                dataStorage,
                config.getCollectorProvider(),
                config.getCollectorSchema(),
                config.getCollectorLevel()
        );
    }

    /**
     * 注册系统预置的因子定义，均基于采集的默认数据表
     */
    static void registerBuiltinDefinitions(FactorRegistry factorRegistry, AppConfig config) {
        factorRegistry.registerDefinition("close_ma5", (dataSource, sink) -> {
            FactorConfig factorConfig = baseConfig("close_ma5", config);
            factorConfig.setTransformers(List.of(MovingAverageTransformer.sma("close", "ma5", 5)));
            factorConfig.setAccumulator(new UpsertAccumulator());
            return FilterFactor.create(factorConfig, dataSource, sink);
        });

        factorRegistry.registerDefinition("close_rank", (dataSource, sink) -> {
            FactorConfig factorConfig = baseConfig("close_rank", config);
            factorConfig.setColumns(List.of("close"));
            return ScoreFactor.create(factorConfig, new RankScorer("close"), dataSource, sink);
        });

        log.info("Registered built-in factor definitions: close_ma5, close_rank");
    }

    private static FactorConfig baseConfig(String factorName, AppConfig config) {
        FactorConfig factorConfig = new FactorConfig(factorName, config.getCollectorSchema());
        factorConfig.setProvider(config.getCollectorProvider());
        factorConfig.setLevel(config.getCollectorLevel());
        return factorConfig;
    }

    /**
     * 应用入口
     */
    public static void main(String[] args) throws InterruptedException {
        AppConfig config = (args.length > 0) ? AppConfig.load(args[0]) : AppConfig.loadDefaults();
        FactorApplication app = new FactorApplication();
        app.start(config);
        app.awaitShutdown();
    }
}
