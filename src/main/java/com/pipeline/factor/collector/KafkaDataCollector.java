package com.pipeline.factor.collector;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pipeline.factor.core.DataCollector;
import com.pipeline.factor.model.FrameKey;
import com.pipeline.factor.model.IntervalLevel;
import com.pipeline.factor.model.TimeSeriesFrame;
import com.pipeline.factor.storage.AbstractDataStorage;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.errors.WakeupException;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Kafka数据采集消费者。
 * 从Kafka Topic实时消费行情等原始观测数据，按目标表分组后追加进存储；
 * 存储在写入后同步通知订阅的因子重新计算，因此所有重算都发生在采集线程上。
 *
 * 消息格式约定（JSON）：
 * {"entityId":"stock_sz_000338","timestamp":1708128000000,"values":{"close":12.5},
 *  "provider":"eastmoney","schema":"kdata","level":"1d"}
 * provider、schema、level 可省略，省略时使用采集器的默认值；values 不能为空。
 */
public class KafkaDataCollector implements DataCollector, Runnable {

    private static final Logger log = LoggerFactory.getLogger(KafkaDataCollector.class);

    private final String bootstrapServers;
    private final String topic;
    private final String groupId;
    private final AbstractDataStorage dataStorage;
    private final String defaultProvider;
    private final String defaultSchema;
    private final IntervalLevel defaultLevel;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AtomicBoolean running = new AtomicBoolean(false);

    private volatile KafkaConsumer<String, String> consumer;

    public KafkaDataCollector(String bootstrapServers, String topic, String groupId,
                              AbstractDataStorage dataStorage,
                              String defaultProvider, String defaultSchema, IntervalLevel defaultLevel) {
        if (dataStorage == null) {
            throw new IllegalArgumentException("DataStorage must not be null");
        }
        this.bootstrapServers = bootstrapServers;
        this.topic = topic;
        this.groupId = groupId;
        this.dataStorage = dataStorage;
        this.defaultProvider = defaultProvider;
        this.defaultSchema = defaultSchema;
        this.defaultLevel = defaultLevel;
    }

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            log.warn("KafkaDataCollector is already running.");
            return;
        }

        Properties props = new Properties();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ConsumerConfig.GROUP_ID_CONFIG, groupId);
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "latest");
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "true");
        props.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, "10000");

        consumer = new KafkaConsumer<>(props);
        consumer.subscribe(Collections.singletonList(topic));

        Thread collectorThread = new Thread(this, "kafka-data-collector");
        collectorThread.setDaemon(true);
        collectorThread.start();

        log.info("KafkaDataCollector started. Topic: {}, Group: {}, default target: {}/{}/{}",
                topic, groupId, defaultProvider, defaultSchema, defaultLevel);
    }

    @Override
    public void run() {
        try {
            while (running.get()) {
                ConsumerRecords<String, String> records = consumer.poll(Duration.ofMillis(100));
                if (!records.isEmpty()) {
                    handleRecords(records);
                }
            }
        } catch (WakeupException e) {
            if (running.get()) {
                log.error("KafkaDataCollector woken up unexpectedly", e);
            }
        } catch (Exception e) {
            log.error("KafkaDataCollector encountered fatal error", e);
        } finally {
            running.set(false);
            consumer.close();
            log.info("KafkaDataCollector stopped.");
        }
    }

    /**
     * 处理一批消息：逐条解析，按目标表分组，每组追加一次。
     * 单条消息解析失败只记录日志并跳过。
     *
     * @return 成功追加的行数
     */
    public int handleRecords(Iterable<ConsumerRecord<String, String>> records) {
        Map<Target, TimeSeriesFrame> batches = new LinkedHashMap<>();
        for (ConsumerRecord<String, String> record : records) {
            Observation observation;
            try {
                observation = parse(record.value());
            } catch (RuntimeException e) {
                log.error("Failed to parse Kafka record at offset {}: {}", record.offset(), e.getMessage());
                continue;
            }
            batches.computeIfAbsent(observation.target, t -> new TimeSeriesFrame())
                    .putRow(observation.key, observation.values);
        }

        int appended = 0;
        for (Map.Entry<Target, TimeSeriesFrame> batch : batches.entrySet()) {
            Target target = batch.getKey();
            try {
                dataStorage.appendData(target.provider, target.schema, target.level, batch.getValue());
                appended += batch.getValue().size();
            } catch (RuntimeException e) {
                log.error("Failed to append {} rows to {}: {}", batch.getValue().size(), target, e.getMessage(), e);
            }
        }
        log.debug("Handled Kafka batch: {} rows appended to {} tables", appended, batches.size());
        return appended;
    }

    /**
     * 解析单条JSON消息
     *
     * @throws IllegalArgumentException 消息不合法时抛出
     */
    Observation parse(String json) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("Empty message");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed JSON: " + e.getOriginalMessage(), e);
        }

        String entityId = root.path("entityId").asText(null);
        if (entityId == null || entityId.isBlank()) {
            throw new IllegalArgumentException("Missing entityId");
        }
        JsonNode timestampNode = root.get("timestamp");
        if (timestampNode == null || !timestampNode.canConvertToLong()) {
            throw new IllegalArgumentException("Missing or non-numeric timestamp for entity " + entityId);
        }

        JsonNode valuesNode = root.path("values");
        // 空行会在按键 upsert 时覆盖掉已有观测
        if (!valuesNode.isObject() || valuesNode.size() == 0) {
            throw new IllegalArgumentException("Missing or empty values for entity " + entityId);
        }
        Map<String, Object> values = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = valuesNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode node = field.getValue();
            if (node.isNull()) {
                values.put(field.getKey(), null);
            } else if (node.isNumber()) {
                values.put(field.getKey(), node.doubleValue());
            } else if (node.isBoolean()) {
                values.put(field.getKey(), node.booleanValue());
            } else {
                values.put(field.getKey(), node.asText());
            }
        }

        String provider = root.path("provider").asText(defaultProvider);
        String schema = root.path("schema").asText(defaultSchema);
        String levelText = root.path("level").asText(null);
        IntervalLevel level = (levelText == null) ? defaultLevel : IntervalLevel.of(levelText);
        if (provider == null || schema == null) {
            throw new IllegalArgumentException("No provider/schema for entity " + entityId);
        }

        return new Observation(new Target(provider, schema, level),
                FrameKey.of(entityId, timestampNode.asLong()), values);
    }

    @Override
    public void stop() {
        if (running.compareAndSet(true, false)) {
            KafkaConsumer<String, String> current = consumer;
            if (current != null) {
                current.wakeup();
            }
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    /** 一条解析后的观测 */
    static final class Observation {
        final Target target;
        final FrameKey key;
        final Map<String, Object> values;

        Observation(Target target, FrameKey key, Map<String, Object> values) {
            this.target = target;
            this.key = key;
            this.values = values;
        }
    }

    /** 目标数据表 (provider, schema, level) */
    static final class Target {
        final String provider;
        final String schema;
        final IntervalLevel level;

        Target(String provider, String schema, IntervalLevel level) {
            this.provider = provider;
            this.schema = schema;
            this.level = level;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Target)) return false;
            Target other = (Target) o;
            return provider.equals(other.provider) && schema.equals(other.schema) && level == other.level;
        }

        @Override
        public int hashCode() {
            return Objects.hash(provider, schema, level);
        }

        @Override
        public String toString() {
            return provider + "/" + schema + "/" + (level == null ? "-" : level.getValue());
        }
    }
}
