package com.pipeline.factor.storage;

import com.pipeline.factor.model.DataQuery;
import com.pipeline.factor.model.FrameKey;
import com.pipeline.factor.model.TimeSeriesFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Timestamp;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 内存数据存储，不落盘。用于试运行和测试。
 */
public class InMemoryDataStorage extends AbstractDataStorage {

    private static final Logger log = LoggerFactory.getLogger(InMemoryDataStorage.class);

    /** 数据表：tableName -> 帧 */
    private final ConcurrentHashMap<String, TimeSeriesFrame> tables = new ConcurrentHashMap<>();

    @Override
    protected void writeTable(String tableName, TimeSeriesFrame frame) {
        tables.compute(tableName, (name, existing) -> {
            TimeSeriesFrame target = (existing == null) ? new TimeSeriesFrame() : existing;
            for (Map.Entry<FrameKey, Map<String, Object>> entry : frame.rows().entrySet()) {
                target.putRow(entry.getKey(), entry.getValue());
            }
            return target;
        });
        log.debug("Wrote {} rows to in-memory table '{}'", frame.size(), tableName);
    }

    @Override
    protected TimeSeriesFrame readTable(String tableName, DataQuery query) {
        TimeSeriesFrame table = tables.get(tableName);
        return (table == null) ? new TimeSeriesFrame() : table.copy();
    }

    @Override
    public TimeSeriesFrame loadRecent(String provider, String schema, int window) {
        TimeSeriesFrame table = tables.get(tableName(provider, schema, null));
        return (table == null) ? new TimeSeriesFrame() : table.tail(window);
    }

    @Override
    public TimeSeriesFrame loadFull(String provider, String schema, Timestamp startTimestamp) {
        TimeSeriesFrame table = tables.get(tableName(provider, schema, null));
        if (table == null) {
            return new TimeSeriesFrame();
        }
        return table.filter((key, row) -> startTimestamp == null || !key.getTimestamp().before(startTimestamp));
    }

    public int tableCount() {
        return tables.size();
    }
}
