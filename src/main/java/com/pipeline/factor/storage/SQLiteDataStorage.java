package com.pipeline.factor.storage;

import com.pipeline.factor.model.DataQuery;
import com.pipeline.factor.model.FrameKey;
import com.pipeline.factor.model.TimeSeriesFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 基于SQLite的数据存储实现。
 *
 * 核心设计：
 * - 一个数据库文件，每个 (provider, schema, level) 一张表
 * - 长表结构：(entity_id, timestamp, field, num_value, text_value)，
 *   主键 (entity_id, timestamp, field)，列集合可随周期变化
 * - 按键 upsert：先删除该键的全部字段再插入，整批在一个事务内完成
 * - WAL 日志模式
 *
 * 数值（含布尔，按 1.0/0.0 保存）写入 num_value，其余类型以字符串写入 text_value；
 * 缺失值不写入，读回时为缺失。
 */
public class SQLiteDataStorage extends AbstractDataStorage {

    private static final Logger log = LoggerFactory.getLogger(SQLiteDataStorage.class);

    private static final String DB_FILE = "factor.db";

    /** 存储根目录 */
    private final String storageRoot;

    private final Connection connection;

    /** 已确认存在的表 */
    private final Set<String> knownTables = ConcurrentHashMap.newKeySet();

    public SQLiteDataStorage(String storageRoot) {
        this.storageRoot = storageRoot;

        // 确保存储目录存在
        File dir = new File(storageRoot);
        if (!dir.exists() && !dir.mkdirs()) {
            throw new IllegalStateException("Failed to create storage directory: " + storageRoot);
        }

        String dbPath = storageRoot + File.separator + DB_FILE;
        try {
            connection = DriverManager.getConnection("jdbc:sqlite:" + dbPath);
            connection.setAutoCommit(true);
            try (Statement stmt = connection.createStatement()) {
                stmt.execute("PRAGMA journal_mode=WAL");
                stmt.execute("PRAGMA synchronous=NORMAL");
                stmt.execute("PRAGMA cache_size=10000");
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to open SQLite database at " + dbPath, e);
        }
        log.info("SQLiteDataStorage initialized at: {}", dbPath);
    }

    // ==================== 写入 ====================

    @Override
    protected synchronized void writeTable(String tableName, TimeSeriesFrame frame) {
        try {
            ensureTableExists(tableName);
            connection.setAutoCommit(false);
            String deleteSql = "DELETE FROM " + tableName + " WHERE entity_id = ? AND timestamp = ?";
            String insertSql = "INSERT INTO " + tableName
                    + " (entity_id, timestamp, field, num_value, text_value) VALUES (?, ?, ?, ?, ?)";
            try (PreparedStatement delete = connection.prepareStatement(deleteSql);
                 PreparedStatement insert = connection.prepareStatement(insertSql)) {
                for (Map.Entry<FrameKey, Map<String, Object>> entry : frame.rows().entrySet()) {
                    FrameKey key = entry.getKey();
                    delete.setString(1, key.getEntityId());
                    delete.setLong(2, key.getTime());
                    delete.addBatch();

                    for (Map.Entry<String, Object> cell : entry.getValue().entrySet()) {
                        Object value = cell.getValue();
                        if (value == null) continue;
                        insert.setString(1, key.getEntityId());
                        insert.setLong(2, key.getTime());
                        insert.setString(3, cell.getKey());
                        if (value instanceof Number) {
                            insert.setDouble(4, ((Number) value).doubleValue());
                            insert.setNull(5, java.sql.Types.VARCHAR);
                        } else if (value instanceof Boolean) {
                            insert.setDouble(4, ((Boolean) value) ? 1.0 : 0.0);
                            insert.setNull(5, java.sql.Types.VARCHAR);
                        } else {
                            insert.setNull(4, java.sql.Types.REAL);
                            insert.setString(5, value.toString());
                        }
                        insert.addBatch();
                    }
                }
                delete.executeBatch();
                insert.executeBatch();
            }
            connection.commit();
            log.debug("Upserted {} rows into '{}'", frame.size(), tableName);
        } catch (SQLException e) {
            rollbackQuietly(tableName);
            throw new IllegalStateException("Failed to write " + frame.size() + " rows to table '"
                    + tableName + "'", e);
        } finally {
            try {
                connection.setAutoCommit(true);
            } catch (SQLException e) {
                log.warn("Failed to restore auto-commit after writing '{}': {}", tableName, e.getMessage());
            }
        }
    }

    private void rollbackQuietly(String tableName) {
        try {
            connection.rollback();
        } catch (SQLException e) {
            log.error("Rollback failed for table '{}': {}", tableName, e.getMessage(), e);
        }
    }

    // ==================== 读取 ====================

    @Override
    protected synchronized TimeSeriesFrame readTable(String tableName, DataQuery query) {
        TimeSeriesFrame result = new TimeSeriesFrame();
        if (!tableExists(tableName)) {
            return result;
        }

        StringBuilder sql = new StringBuilder("SELECT entity_id, timestamp, field, num_value, text_value FROM ")
                .append(tableName).append(" WHERE timestamp >= ? AND timestamp <= ?");
        List<String> entityIds = query.getEntityIds();
        boolean byEntity = entityIds != null && !entityIds.isEmpty();
        if (byEntity) {
            sql.append(" AND entity_id IN (").append("?,".repeat(entityIds.size() - 1)).append("?)");
        }
        sql.append(" ORDER BY entity_id, timestamp");

        try (PreparedStatement stmt = connection.prepareStatement(sql.toString())) {
            stmt.setLong(1, query.getStartTimestamp() == null ? Long.MIN_VALUE : query.getStartTimestamp().getTime());
            stmt.setLong(2, query.getEndTimestamp() == null ? Long.MAX_VALUE : query.getEndTimestamp().getTime());
            if (byEntity) {
                for (int i = 0; i < entityIds.size(); i++) {
                    stmt.setString(3 + i, entityIds.get(i));
                }
            }
            readInto(stmt, result);
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to query table '" + tableName + "' with " + query, e);
        }
        return result;
    }

    @Override
    public synchronized TimeSeriesFrame loadRecent(String provider, String schema, int window) {
        TimeSeriesFrame result = new TimeSeriesFrame();
        String tableName = tableName(provider, schema, null);
        if (window <= 0 || !tableExists(tableName)) {
            return result;
        }

        String sql = "WITH entity_keys AS (SELECT DISTINCT entity_id, timestamp FROM " + tableName + "), "
                + "ranked AS (SELECT entity_id, timestamp, "
                + "ROW_NUMBER() OVER (PARTITION BY entity_id ORDER BY timestamp DESC) AS rn FROM entity_keys) "
                + "SELECT t.entity_id, t.timestamp, t.field, t.num_value, t.text_value FROM " + tableName + " t "
                + "JOIN ranked r ON t.entity_id = r.entity_id AND t.timestamp = r.timestamp "
                + "WHERE r.rn <= ? ORDER BY t.entity_id, t.timestamp";
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setInt(1, window);
            readInto(stmt, result);
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to load recent " + window + " rows from '" + tableName + "'", e);
        }
        log.debug("Loaded {} recent rows (window {}) from '{}'", result.size(), window, tableName);
        return result;
    }

    @Override
    public synchronized TimeSeriesFrame loadFull(String provider, String schema, Timestamp startTimestamp) {
        TimeSeriesFrame result = new TimeSeriesFrame();
        String tableName = tableName(provider, schema, null);
        if (!tableExists(tableName)) {
            return result;
        }

        String sql = "SELECT entity_id, timestamp, field, num_value, text_value FROM " + tableName
                + " WHERE timestamp >= ? ORDER BY entity_id, timestamp";
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setLong(1, startTimestamp == null ? Long.MIN_VALUE : startTimestamp.getTime());
            readInto(stmt, result);
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to load rows from '" + tableName + "'", e);
        }
        log.debug("Loaded {} rows since {} from '{}'", result.size(), startTimestamp, tableName);
        return result;
    }

    // ==================== 内部工具方法 ====================

    private void readInto(PreparedStatement stmt, TimeSeriesFrame result) throws SQLException {
        try (ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                FrameKey key = FrameKey.of(rs.getString("entity_id"), rs.getLong("timestamp"));
                double num = rs.getDouble("num_value");
                Object value = rs.wasNull() ? rs.getString("text_value") : (Object) num;
                result.setValue(key, rs.getString("field"), value);
            }
        }
    }

    private void ensureTableExists(String tableName) throws SQLException {
        if (knownTables.contains(tableName)) {
            return;
        }
        String sql = "CREATE TABLE IF NOT EXISTS " + tableName + " ("
                + "entity_id TEXT NOT NULL, "
                + "timestamp INTEGER NOT NULL, "
                + "field TEXT NOT NULL, "
                + "num_value REAL, "
                + "text_value TEXT, "
                + "PRIMARY KEY (entity_id, timestamp, field))";
        try (Statement stmt = connection.createStatement()) {
            stmt.execute(sql);
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_" + tableName + "_ts ON " + tableName + " (timestamp)");
        }
        knownTables.add(tableName);
    }

    private boolean tableExists(String tableName) {
        if (knownTables.contains(tableName)) {
            return true;
        }
        try (PreparedStatement stmt = connection.prepareStatement(
                "SELECT name FROM sqlite_master WHERE type='table' AND name=?")) {
            stmt.setString(1, tableName);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    knownTables.add(tableName);
                    return true;
                }
                return false;
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to check table '" + tableName + "'", e);
        }
    }

    public String getStorageRoot() { return storageRoot; }

    /** 关闭连接 */
    @Override
    public synchronized void shutdown() {
        try {
            connection.close();
            log.info("SQLiteDataStorage shut down.");
        } catch (SQLException e) {
            log.error("Failed to close SQLite connection: {}", e.getMessage(), e);
        }
    }
}
