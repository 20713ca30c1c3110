package com.pipeline.factor.storage;

import com.pipeline.factor.core.DataChangeListener;
import com.pipeline.factor.core.DataSource;
import com.pipeline.factor.core.PersistenceSink;
import com.pipeline.factor.model.DataQuery;
import com.pipeline.factor.model.FrameKey;
import com.pipeline.factor.model.IntervalLevel;
import com.pipeline.factor.model.TimeSeriesFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 数据存储公共部分：订阅管理与追加数据后的同步推送。
 *
 * 数据表由 (provider, schema, level) 唯一确定，level 为null的表用于持久化因子。
 * 追加数据时按订阅查询过滤新行，非空才回调监听器；
 * 监听器重算失败只记录日志，不影响其他订阅者。
 */
public abstract class AbstractDataStorage implements DataSource, PersistenceSink {

    private static final Logger log = LoggerFactory.getLogger(AbstractDataStorage.class);

    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();

    /**
     * 追加原始数据（按键 upsert），写入成功后同步通知订阅者。
     */
    public void appendData(String provider, String schema, IntervalLevel level, TimeSeriesFrame added) {
        if (added == null || added.isEmpty()) {
            return;
        }
        writeTable(tableName(provider, schema, level), added);
        fireDataChanged(provider, schema, level, added);
    }

    @Override
    public void write(TimeSeriesFrame frame, String schema, String provider) {
        if (frame == null || frame.isEmpty()) {
            return;
        }
        writeTable(tableName(provider, schema, null), frame);
    }

    @Override
    public TimeSeriesFrame query(DataQuery query) {
        TimeSeriesFrame raw = readTable(tableName(query.getProvider(), query.getDataSchema(), query.getLevel()), query);
        return QueryShaper.shape(query, raw);
    }

    @Override
    public void onChange(DataQuery query, DataChangeListener listener) {
        if (query == null || listener == null) {
            throw new IllegalArgumentException("Query and listener must not be null");
        }
        subscriptions.add(new Subscription(query, listener));
        log.info("Listener {} subscribed to {}", listener, query);
    }

    @Override
    public boolean removeListener(DataChangeListener listener) {
        return subscriptions.removeIf(s -> s.listener == listener);
    }

    public int getSubscriptionCount() {
        return subscriptions.size();
    }

    protected void fireDataChanged(String provider, String schema, IntervalLevel level, TimeSeriesFrame added) {
        for (Subscription subscription : subscriptions) {
            if (!subscription.query.isSameSource(provider, schema, level)) {
                continue;
            }
            TimeSeriesFrame relevant = QueryShaper.filterRows(subscription.query, added);
            if (relevant.isEmpty()) {
                continue;
            }
            try {
                subscription.listener.onDataChanged(relevant);
                for (Map.Entry<String, List<FrameKey>> entry : relevant.keysByEntity().entrySet()) {
                    TimeSeriesFrame entityRows = relevant.filter((k, row) -> k.getEntityId().equals(entry.getKey()));
                    subscription.listener.onEntityDataChanged(entry.getKey(), entityRows);
                }
            } catch (RuntimeException e) {
                log.error("Listener {} failed to handle {} new rows of {}/{}: {}",
                        subscription.listener, relevant.size(), provider, schema, e.getMessage(), e);
            }
        }
    }

    /**
     * 数据表名：provider_schema[_level]，非字母数字字符替换为下划线
     */
    static String tableName(String provider, String schema, IntervalLevel level) {
        if (provider == null || schema == null) {
            throw new IllegalArgumentException("Provider and schema must not be null");
        }
        String name = "t_" + provider + "_" + schema + (level == null ? "" : "_" + level.getValue());
        return name.replaceAll("[^a-zA-Z0-9_]", "_");
    }

    /** 释放存储资源，默认无操作 */
    public void shutdown() {
    }

    /** 按键 upsert 写入整张表 */
    protected abstract void writeTable(String tableName, TimeSeriesFrame frame);

    /**
     * 读取数据表，可只按查询的时间范围和实体标识预过滤，其余形状由调用方处理
     */
    protected abstract TimeSeriesFrame readTable(String tableName, DataQuery query);

    private static final class Subscription {
        private final DataQuery query;
        private final DataChangeListener listener;

        private Subscription(DataQuery query, DataChangeListener listener) {
            this.query = query;
            this.listener = listener;
        }
    }
}
