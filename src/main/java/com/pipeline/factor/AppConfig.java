package com.pipeline.factor;

import com.pipeline.factor.model.IntervalLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

/**
 * 应用配置类。
 * 对应配置文件中的进程级参数，单个因子的参数见 FactorConfig。
 */
public class AppConfig {

    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    public static final String DEFAULT_RESOURCE = "factor-engine.properties";

    // ---- 存储 ----
    private String storageRoot = "data/storage";

    // ---- Kafka ----
    private boolean kafkaEnabled = false;
    private String kafkaBootstrapServers = "localhost:9092";
    private String kafkaInputTopic = "factor-raw-data";
    private String kafkaGroupId = "factor-engine";

    // ---- 采集默认目标表 ----
    private String collectorProvider = "eastmoney";
    private String collectorSchema = "kdata";
    private IntervalLevel collectorLevel = IntervalLevel.LEVEL_1DAY;

    // ---- 启动时创建的因子 ----
    private List<String> enabledFactors = Collections.emptyList();

    /**
     * 从文件加载配置，失败时记录警告并使用默认值
     */
    public static AppConfig load(String configPath) {
        try (InputStream in = new FileInputStream(configPath)) {
            return fromStream(in);
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to load config from {}, using defaults. Error: {}", configPath, e.getMessage());
            return new AppConfig();
        }
    }

    /**
     * 从类路径上的 factor-engine.properties 加载配置
     */
    public static AppConfig loadDefaults() {
        try (InputStream in = AppConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                log.warn("Resource {} not found on classpath, using defaults.", DEFAULT_RESOURCE);
                return new AppConfig();
            }
            return fromStream(in);
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to load config resource {}, using defaults. Error: {}", DEFAULT_RESOURCE, e.getMessage());
            return new AppConfig();
        }
    }

    static AppConfig fromStream(InputStream in) throws IOException {
        Properties props = new Properties();
        props.load(in);
        return fromProperties(props);
    }

    static AppConfig fromProperties(Properties props) {
        AppConfig config = new AppConfig();
        config.storageRoot = props.getProperty("storage.root", config.storageRoot);
        config.kafkaEnabled = Boolean.parseBoolean(
                props.getProperty("kafka.enabled", String.valueOf(config.kafkaEnabled)));
        config.kafkaBootstrapServers = props.getProperty(
                "kafka.bootstrap.servers", config.kafkaBootstrapServers);
        config.kafkaInputTopic = props.getProperty("kafka.input.topic", config.kafkaInputTopic);
        config.kafkaGroupId = props.getProperty("kafka.group.id", config.kafkaGroupId);
        config.collectorProvider = props.getProperty("collector.provider", config.collectorProvider);
        config.collectorSchema = props.getProperty("collector.schema", config.collectorSchema);
        config.collectorLevel = IntervalLevel.of(
                props.getProperty("collector.level", config.collectorLevel.getValue()));

        String factors = props.getProperty("factors.enabled", "");
        List<String> names = new ArrayList<>();
        for (String name : factors.split(",")) {
            if (!name.isBlank()) {
                names.add(name.trim());
            }
        }
        config.enabledFactors = Collections.unmodifiableList(names);
        return config;
    }

    // ---- Getters ----
    public String getStorageRoot() { return storageRoot; }
    public boolean isKafkaEnabled() { return kafkaEnabled; }
    public String getKafkaBootstrapServers() { return kafkaBootstrapServers; }
    public String getKafkaInputTopic() { return kafkaInputTopic; }
    public String getKafkaGroupId() { return kafkaGroupId; }
    public String getCollectorProvider() { return collectorProvider; }
    public String getCollectorSchema() { return collectorSchema; }
    public IntervalLevel getCollectorLevel() { return collectorLevel; }
    public List<String> getEnabledFactors() { return enabledFactors; }

    @Override
    public String toString() {
        return "AppConfig{storageRoot='" + storageRoot + "'"
                + ", kafka=" + (kafkaEnabled ? "'" + kafkaBootstrapServers + "/" + kafkaInputTopic + "'" : "disabled")
                + ", collector=" + collectorProvider + "/" + collectorSchema + "/" + collectorLevel.getValue()
                + ", factors=" + enabledFactors + "}";
    }
}
