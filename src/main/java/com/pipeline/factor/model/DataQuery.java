package com.pipeline.factor.model;

import java.io.Serializable;
import java.sql.Timestamp;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 数据查询描述：数据来源 + 实体范围 + 时间范围 + 结果形状。
 *
 * 实体标识约定为 {entityType}_{exchange}_{code}，如 stock_sz_000338。
 * 指定了 entityIds 时只按标识精确匹配；否则依次按实体类型、交易所、代码过滤，
 * 未设置的条件不参与过滤。
 *
 * 结果帧始终按 (实体标识, 时间戳) 排列；order 只决定 limit 截取时保留哪些行，
 * 不会改变结果帧的行序。
 */
public class DataQuery implements Serializable {
    /** 数据提供方 */
    private String provider;
    /** 数据模式（表）名 */
    private String dataSchema;
    /** 数据粒度；为null表示无粒度区分的数据（如持久化的因子） */
    private IntervalLevel level;

    // ---- 实体范围 ----
    private List<String> entityIds;
    private String entityType;
    private List<String> exchanges;
    private List<String> codes;

    // ---- 时间范围（闭区间，null表示不限） ----
    private Timestamp startTimestamp;
    private Timestamp endTimestamp;

    // ---- 结果形状 ----
    private List<String> columns;
    private List<RowFilter> filters;
    private SortDirective order;
    private Integer limit;

    public DataQuery() {}

    public DataQuery(String provider, String dataSchema, IntervalLevel level) {
        this.provider = provider;
        this.dataSchema = dataSchema;
        this.level = level;
    }

    /** 是否指向同一张数据表 */
    public boolean isSameSource(String provider, String dataSchema, IntervalLevel level) {
        return Objects.equals(this.provider, provider)
                && Objects.equals(this.dataSchema, dataSchema)
                && this.level == level;
    }

    public boolean matchesEntity(String entityId) {
        if (entityIds != null && !entityIds.isEmpty()) {
            return entityIds.contains(entityId);
        }
        boolean scoped = entityType != null
                || (exchanges != null && !exchanges.isEmpty())
                || (codes != null && !codes.isEmpty());
        if (!scoped) {
            return true;
        }

        String[] parts = entityId.split("_", 3);
        if (parts.length != 3) {
            return false;
        }
        if (entityType != null && !entityType.equals(parts[0])) {
            return false;
        }
        if (exchanges != null && !exchanges.isEmpty() && !exchanges.contains(parts[1])) {
            return false;
        }
        return codes == null || codes.isEmpty() || codes.contains(parts[2]);
    }

    public boolean matchesTime(Timestamp timestamp) {
        if (startTimestamp != null && timestamp.before(startTimestamp)) {
            return false;
        }
        return endTimestamp == null || !timestamp.after(endTimestamp);
    }

    /** 实体、时间与全部过滤条件同时满足 */
    public boolean matches(FrameKey key, Map<String, Object> row) {
        if (!matchesEntity(key.getEntityId()) || !matchesTime(key.getTimestamp())) {
            return false;
        }
        if (filters != null) {
            for (RowFilter filter : filters) {
                if (!filter.test(row)) {
                    return false;
                }
            }
        }
        return true;
    }

    public String getProvider() { return provider; }
    public void setProvider(String provider) { this.provider = provider; }
    public String getDataSchema() { return dataSchema; }
    public void setDataSchema(String dataSchema) { this.dataSchema = dataSchema; }
    public IntervalLevel getLevel() { return level; }
    public void setLevel(IntervalLevel level) { this.level = level; }
    public List<String> getEntityIds() { return entityIds; }
    public void setEntityIds(List<String> entityIds) { this.entityIds = entityIds; }
    public String getEntityType() { return entityType; }
    public void setEntityType(String entityType) { this.entityType = entityType; }
    public List<String> getExchanges() { return exchanges; }
    public void setExchanges(List<String> exchanges) { this.exchanges = exchanges; }
    public List<String> getCodes() { return codes; }
    public void setCodes(List<String> codes) { this.codes = codes; }
    public Timestamp getStartTimestamp() { return startTimestamp; }
    public void setStartTimestamp(Timestamp startTimestamp) { this.startTimestamp = startTimestamp; }
    public Timestamp getEndTimestamp() { return endTimestamp; }
    public void setEndTimestamp(Timestamp endTimestamp) { this.endTimestamp = endTimestamp; }
    public List<String> getColumns() { return columns; }
    public void setColumns(List<String> columns) { this.columns = columns; }
    public List<RowFilter> getFilters() { return filters; }
    public void setFilters(List<RowFilter> filters) { this.filters = filters; }
    public SortDirective getOrder() { return order; }
    public void setOrder(SortDirective order) { this.order = order; }
    public Integer getLimit() { return limit; }
    public void setLimit(Integer limit) { this.limit = limit; }

    @Override
    public String toString() {
        return "DataQuery{provider='" + provider + "', schema='" + dataSchema + "', level=" + level
                + ", start=" + startTimestamp + ", end=" + endTimestamp + "}";
    }
}
