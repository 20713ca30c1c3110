package com.pipeline.factor.factor;

import com.pipeline.factor.core.Accumulator;
import com.pipeline.factor.core.Transformer;
import com.pipeline.factor.model.DataQuery;
import com.pipeline.factor.model.FillMethod;
import com.pipeline.factor.model.IntervalLevel;
import com.pipeline.factor.model.RowFilter;
import com.pipeline.factor.model.SortDirective;
import com.pipeline.factor.model.ValidationResult;

import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 因子配置，构造时一次性提供，之后不再修改。
 */
public class FactorConfig {
    /** 因子名称（必选），也是注册表中的默认名称 */
    private String factorName;
    /** 因子持久化的模式名，默认与因子名称相同 */
    private String factorSchema;
    /** 原始数据模式名（必选） */
    private String dataSchema;

    // ---- 实体范围 ----
    private List<String> entityIds;
    private String entityType = "stock";
    private List<String> exchanges;
    private List<String> codes;

    // ---- 时间范围 ----
    /** 设置后同时作为起止时间 */
    private Timestamp theTimestamp;
    private Timestamp startTimestamp;
    private Timestamp endTimestamp;
    private IntervalLevel level = IntervalLevel.LEVEL_1DAY;

    // ---- 结果形状 ----
    private List<String> columns;
    private List<RowFilter> filters;
    private SortDirective order;
    private Integer limit;

    // ---- 数据来源 ----
    /** 原始数据提供方 */
    private String provider = "eastmoney";
    /** 因子持久化所用的提供方 */
    private String factorProvider = "factor";
    /** 构造完成后是否立即加载数据并计算一次 */
    private boolean autoLoad = true;
    /** 试运行模式下每个实体加载的历史因子行数 */
    private int validWindow = 250;

    // ---- 缺口填充 ----
    private boolean keepAllTimestamp = false;
    private FillMethod fillMethod = FillMethod.FFILL;
    /** 单个缺口内最多连续填充的周期数 */
    private int effectiveNumber = 10;

    // ---- 计算管道 ----
    private List<Transformer> transformers = new ArrayList<>();
    private Accumulator accumulator;
    private boolean needPersist = true;
    /** true: 只加载最近 validWindow 行因子；false: 加载起始时间以来的全部因子 */
    private boolean dryRun = false;

    // ---- 状态因子 ----
    private int shortStateWindow = 5;
    private int longStateWindow = 20;

    public FactorConfig() {}

    public FactorConfig(String factorName, String dataSchema) {
        this.factorName = factorName;
        this.dataSchema = dataSchema;
    }

    /**
     * 校验配置。持久化相关的检查只在 needPersist 时进行。
     */
    public ValidationResult validate() {
        ValidationResult result = new ValidationResult();
        result.check(factorName != null && !factorName.isBlank(), "factorName is required")
                .check(dataSchema != null && !dataSchema.isBlank(), "dataSchema is required")
                .check(provider != null && !provider.isBlank(), "provider is required")
                .check(level != null, "level is required")
                .check(validWindow >= 0, "validWindow must be >= 0, got: " + validWindow)
                .check(effectiveNumber >= 0, "effectiveNumber must be >= 0, got: " + effectiveNumber)
                .check(fillMethod != null, "fillMethod is required")
                .check(limit == null || limit >= 0, "limit must be >= 0, got: " + limit)
                .check(shortStateWindow > 0, "shortStateWindow must be > 0, got: " + shortStateWindow)
                .check(longStateWindow > 0, "longStateWindow must be > 0, got: " + longStateWindow);

        Timestamp start = getEffectiveStartTimestamp();
        Timestamp end = getEffectiveEndTimestamp();
        if (start != null && end != null && start.after(end)) {
            result.addError("startTimestamp " + start + " is after endTimestamp " + end);
        }
        if (transformers != null && transformers.stream().anyMatch(Objects::isNull)) {
            result.addError("transformers must not contain null");
        }
        if (needPersist && (factorProvider == null || factorProvider.isBlank())) {
            result.addError("factorProvider is required when needPersist is enabled");
        }
        if (keepAllTimestamp && (start == null || end == null)) {
            result.addWarning("keepAllTimestamp without start/end timestamps, "
                    + "the calendar will span the result frame");
        }
        if (shortStateWindow > longStateWindow) {
            result.addWarning("shortStateWindow " + shortStateWindow
                    + " is larger than longStateWindow " + longStateWindow);
        }
        return result;
    }

    /** 由配置生成原始数据查询 */
    public DataQuery toDataQuery() {
        DataQuery query = new DataQuery(provider, dataSchema, level);
        query.setEntityIds(entityIds);
        query.setEntityType(entityType);
        query.setExchanges(exchanges);
        query.setCodes(codes);
        query.setStartTimestamp(getEffectiveStartTimestamp());
        query.setEndTimestamp(getEffectiveEndTimestamp());
        query.setColumns(columns);
        query.setFilters(filters);
        query.setOrder(order);
        query.setLimit(limit);
        return query;
    }

    public Timestamp getEffectiveStartTimestamp() {
        return theTimestamp != null ? theTimestamp : startTimestamp;
    }

    public Timestamp getEffectiveEndTimestamp() {
        return theTimestamp != null ? theTimestamp : endTimestamp;
    }

    public String getEffectiveFactorSchema() {
        return (factorSchema == null || factorSchema.isBlank()) ? factorName : factorSchema;
    }

    public String getFactorName() { return factorName; }
    public void setFactorName(String factorName) { this.factorName = factorName; }
    public String getFactorSchema() { return factorSchema; }
    public void setFactorSchema(String factorSchema) { this.factorSchema = factorSchema; }
    public String getDataSchema() { return dataSchema; }
    public void setDataSchema(String dataSchema) { this.dataSchema = dataSchema; }
    public List<String> getEntityIds() { return entityIds; }
    public void setEntityIds(List<String> entityIds) { this.entityIds = entityIds; }
    public String getEntityType() { return entityType; }
    public void setEntityType(String entityType) { this.entityType = entityType; }
    public List<String> getExchanges() { return exchanges; }
    public void setExchanges(List<String> exchanges) { this.exchanges = exchanges; }
    public List<String> getCodes() { return codes; }
    public void setCodes(List<String> codes) { this.codes = codes; }
    public Timestamp getTheTimestamp() { return theTimestamp; }
    public void setTheTimestamp(Timestamp theTimestamp) { this.theTimestamp = theTimestamp; }
    public Timestamp getStartTimestamp() { return startTimestamp; }
    public void setStartTimestamp(Timestamp startTimestamp) { this.startTimestamp = startTimestamp; }
    public Timestamp getEndTimestamp() { return endTimestamp; }
    public void setEndTimestamp(Timestamp endTimestamp) { this.endTimestamp = endTimestamp; }
    public IntervalLevel getLevel() { return level; }
    public void setLevel(IntervalLevel level) { this.level = level; }
    public List<String> getColumns() { return columns; }
    public void setColumns(List<String> columns) { this.columns = columns; }
    public List<RowFilter> getFilters() { return filters; }
    public void setFilters(List<RowFilter> filters) { this.filters = filters; }
    public SortDirective getOrder() { return order; }
    public void setOrder(SortDirective order) { this.order = order; }
    public Integer getLimit() { return limit; }
    public void setLimit(Integer limit) { this.limit = limit; }
    public String getProvider() { return provider; }
    public void setProvider(String provider) { this.provider = provider; }
    public String getFactorProvider() { return factorProvider; }
    public void setFactorProvider(String factorProvider) { this.factorProvider = factorProvider; }
    public boolean isAutoLoad() { return autoLoad; }
    public void setAutoLoad(boolean autoLoad) { this.autoLoad = autoLoad; }
    public int getValidWindow() { return validWindow; }
    public void setValidWindow(int validWindow) { this.validWindow = validWindow; }
    public boolean isKeepAllTimestamp() { return keepAllTimestamp; }
    public void setKeepAllTimestamp(boolean keepAllTimestamp) { this.keepAllTimestamp = keepAllTimestamp; }
    public FillMethod getFillMethod() { return fillMethod; }
    public void setFillMethod(FillMethod fillMethod) { this.fillMethod = fillMethod; }
    public int getEffectiveNumber() { return effectiveNumber; }
    public void setEffectiveNumber(int effectiveNumber) { this.effectiveNumber = effectiveNumber; }
    public List<Transformer> getTransformers() { return transformers; }
    public void setTransformers(List<Transformer> transformers) { this.transformers = transformers; }
    public Accumulator getAccumulator() { return accumulator; }
    public void setAccumulator(Accumulator accumulator) { this.accumulator = accumulator; }
    public boolean isNeedPersist() { return needPersist; }
    public void setNeedPersist(boolean needPersist) { this.needPersist = needPersist; }
    public boolean isDryRun() { return dryRun; }
    public void setDryRun(boolean dryRun) { this.dryRun = dryRun; }
    public int getShortStateWindow() { return shortStateWindow; }
    public void setShortStateWindow(int shortStateWindow) { this.shortStateWindow = shortStateWindow; }
    public int getLongStateWindow() { return longStateWindow; }
    public void setLongStateWindow(int longStateWindow) { this.longStateWindow = longStateWindow; }

    @Override
    public String toString() {
        return "FactorConfig{name='" + factorName + "', dataSchema='" + dataSchema
                + "', provider='" + provider + "', level=" + level
                + ", transformers=" + (transformers == null ? 0 : transformers.size())
                + ", accumulator=" + (accumulator != null)
                + ", needPersist=" + needPersist + ", dryRun=" + dryRun + "}";
    }
}
