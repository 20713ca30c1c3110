package com.pipeline.factor.factor;

import com.pipeline.factor.core.AccumulationException;
import com.pipeline.factor.core.Accumulator;
import com.pipeline.factor.core.DataChangeListener;
import com.pipeline.factor.core.DataSource;
import com.pipeline.factor.core.FactorException;
import com.pipeline.factor.core.LoadException;
import com.pipeline.factor.core.PersistException;
import com.pipeline.factor.core.PersistenceSink;
import com.pipeline.factor.core.TransformException;
import com.pipeline.factor.core.Transformer;
import com.pipeline.factor.model.DataQuery;
import com.pipeline.factor.model.FrameKey;
import com.pipeline.factor.model.SortDirective;
import com.pipeline.factor.model.TimeSeriesFrame;
import com.pipeline.factor.model.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 因子：计算管道的编排器。
 *
 * 独占四个帧：
 * - dataFrame：原始输入帧，随数据到达事件增量合并
 * - pipeFrame：本周期的中间结果，不持久化
 * - factorFrame：累积的因子结果，可持久化
 * - resultFrame：对外使用的结果（打分、门限或状态），可按日历补齐
 *
 * 每个计算周期严格按顺序执行：
 *   preCompute（原始帧复制到管道帧）
 *   → doCompute（转换链 → 累加器 → 按种类生成结果帧）
 *   → afterCompute（缺口填充 → 持久化）
 *
 * 转换或累加失败时本周期立即中止：管道帧停在最后一次成功的状态，
 * 因子帧不变，本周期不做持久化。因子种类固定为三个 final 子类，
 * 通过各自的 create 工厂方法构造。
 *
 * 单线程同步执行，实例内部不加锁。
 */
public abstract class Factor implements DataChangeListener {

    private static final Logger log = LoggerFactory.getLogger(Factor.class);

    protected final FactorConfig config;
    protected final String factorName;

    private final DataSource dataSource;
    private final PersistenceSink persistenceSink;
    private final DataQuery dataQuery;
    private final List<Transformer> transformers;
    private final Accumulator accumulator;
    private final GapFiller gapFiller;

    private TimeSeriesFrame dataFrame;
    private TimeSeriesFrame pipeFrame;
    private TimeSeriesFrame factorFrame;
    private TimeSeriesFrame resultFrame;

    private long computeCount;

    Factor(FactorConfig config, DataSource dataSource, PersistenceSink persistenceSink) {
        if (config == null) {
            throw new IllegalArgumentException("FactorConfig must not be null");
        }
        ValidationResult validation = config.validate();
        if (!validation.isValid()) {
            throw new IllegalArgumentException("Invalid factor config '" + config.getFactorName()
                    + "': " + validation.getErrors());
        }
        if (dataSource == null) {
            throw new IllegalArgumentException("DataSource must not be null for factor: "
                    + config.getFactorName());
        }
        if (config.isNeedPersist() && persistenceSink == null) {
            throw new IllegalArgumentException("PersistenceSink is required when needPersist is enabled, factor: "
                    + config.getFactorName());
        }
        for (String warning : validation.getWarnings()) {
            log.warn("Factor '{}': {}", config.getFactorName(), warning);
        }

        this.config = config;
        this.factorName = config.getFactorName();
        this.dataSource = dataSource;
        this.persistenceSink = persistenceSink;
        this.dataQuery = config.toDataQuery();
        this.transformers = (config.getTransformers() == null)
                ? Collections.emptyList()
                : List.copyOf(config.getTransformers());
        this.accumulator = config.getAccumulator();
        this.gapFiller = config.isKeepAllTimestamp()
                ? new GapFiller(config.getEffectiveStartTimestamp(), config.getEffectiveEndTimestamp(),
                        config.getFillMethod(), config.getEffectiveNumber())
                : null;
    }

    /**
     * 构造后的初始化：预热加载因子帧、加载原始帧、按需首次计算、订阅数据变化。
     * 由各子类的工厂方法调用，首次计算失败时不订阅，异常直接抛给调用方。
     */
    final void initialize() {
        long startTime = System.currentTimeMillis();

        factorFrame = warmStart();

        try {
            dataFrame = dataSource.query(dataQuery);
        } catch (RuntimeException e) {
            throw new LoadException(factorName, "Failed to load raw data with " + dataQuery, e);
        }
        if (dataFrame == null) {
            dataFrame = TimeSeriesFrame.empty();
        }

        if (config.isAutoLoad()) {
            onDataLoaded(dataFrame);
        }

        dataSource.onChange(dataQuery, this);

        log.info("Factor '{}' ({}) initialized in {}ms. Raw rows: {}, warm-start factor rows: {}",
                factorName, getFactorType(), System.currentTimeMillis() - startTime,
                dataFrame.size(), factorFrame.size());
    }

    /**
     * 预热加载已持久化的因子帧。
     * 试运行只读最近 validWindow 行，否则读取起始时间以来的全部因子。
     */
    private TimeSeriesFrame warmStart() {
        if (!config.isNeedPersist()) {
            return TimeSeriesFrame.empty();
        }
        String schema = config.getEffectiveFactorSchema();
        TimeSeriesFrame loaded;
        try {
            if (config.isDryRun()) {
                loaded = dataSource.loadRecent(config.getFactorProvider(), schema, config.getValidWindow());
            } else {
                loaded = dataSource.loadFull(config.getFactorProvider(), schema,
                        config.getEffectiveStartTimestamp());
            }
        } catch (RuntimeException e) {
            throw new LoadException(factorName, "Failed to load persisted factor frame from schema '"
                    + schema + "'", e);
        }
        log.debug("Factor '{}' warm start ({} mode) loaded {} rows",
                factorName, config.isDryRun() ? "dry-run" : "full", loaded == null ? 0 : loaded.size());
        return loaded == null ? TimeSeriesFrame.empty() : loaded;
    }

    /**
     * 执行一个完整的计算周期。
     */
    public void compute() {
        long startTime = System.currentTimeMillis();
        preCompute();
        doCompute();
        afterCompute();
        computeCount++;
        log.debug("Factor '{}' compute #{} finished in {}ms. Pipe rows: {}, factor rows: {}, result rows: {}",
                factorName, computeCount, System.currentTimeMillis() - startTime,
                sizeOf(pipeFrame), sizeOf(factorFrame), sizeOf(resultFrame));
    }

    protected void preCompute() {
        pipeFrame = (dataFrame == null) ? null : dataFrame.copy();
    }

    protected void doCompute() {
        // 无状态转换
        if (hasRows(pipeFrame) && !transformers.isEmpty()) {
            for (int i = 0; i < transformers.size(); i++) {
                Transformer transformer = transformers.get(i);
                TimeSeriesFrame output;
                try {
                    output = transformer.transform(pipeFrame);
                } catch (FactorException e) {
                    throw e;
                } catch (RuntimeException e) {
                    throw new TransformException(factorName, "Transformer #" + i + " ("
                            + transformer.getClass().getSimpleName() + ") failed: " + e.getMessage(), e);
                }
                if (output == null) {
                    throw new TransformException(factorName, "Transformer #" + i + " ("
                            + transformer.getClass().getSimpleName() + ") returned null", null);
                }
                pipeFrame = output;
            }
        }

        // 有状态累加；未配置累加器时因子帧由本周期结果整体替换
        if (accumulator == null) {
            factorFrame = (pipeFrame == null) ? TimeSeriesFrame.empty() : pipeFrame.copy();
        } else if (hasRows(pipeFrame)) {
            TimeSeriesFrame merged;
            try {
                merged = accumulator.accumulate(pipeFrame, factorFrame.copy());
            } catch (FactorException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new AccumulationException(factorName, "Accumulator ("
                        + accumulator.getClass().getSimpleName() + ") failed: " + e.getMessage(), e);
            }
            if (merged == null) {
                throw new AccumulationException(factorName, "Accumulator ("
                        + accumulator.getClass().getSimpleName() + ") returned null", null);
            }
            factorFrame = merged;
        }

        resultFrame = deriveResult(resultFrame);
    }

    /**
     * 按因子种类生成结果帧，在转换和累加完成后调用。
     *
     * @param previous 上一周期的结果帧，可能为null
     * @return 本周期的结果帧
     */
    abstract TimeSeriesFrame deriveResult(TimeSeriesFrame previous);

    public abstract FactorType getFactorType();

    protected void afterCompute() {
        fillGap();

        if (config.isNeedPersist()) {
            persistResult();
        }
    }

    /**
     * 缺口填充，尽力而为：任何异常只记录日志，保留未填充的结果帧。
     */
    protected void fillGap() {
        if (gapFiller == null || resultFrame == null || resultFrame.isEmpty()) {
            return;
        }
        try {
            resultFrame = gapFiller.fill(resultFrame);
        } catch (RuntimeException e) {
            log.warn("Factor '{}' gap fill failed, keeping unfilled result frame: {}",
                    factorName, e.getMessage(), e);
        }
    }

    protected void persistResult() {
        if (factorFrame == null || factorFrame.isEmpty()) {
            log.debug("Factor '{}' has no factor rows to persist", factorName);
            return;
        }
        String schema = config.getEffectiveFactorSchema();
        try {
            persistenceSink.write(factorFrame, schema, config.getFactorProvider());
        } catch (RuntimeException e) {
            throw new PersistException(factorName, "Failed to persist " + factorFrame.size()
                    + " rows to schema '" + schema + "'", e);
        }
    }

    // ==================== 数据变化回调 ====================

    @Override
    public void onDataLoaded(TimeSeriesFrame data) {
        compute();
    }

    /**
     * 新数据按键合并进原始帧后重新计算
     */
    @Override
    public void onDataChanged(TimeSeriesFrame added) {
        if (added == null || added.isEmpty()) {
            return;
        }
        if (dataFrame == null) {
            dataFrame = TimeSeriesFrame.empty();
        }
        for (Map.Entry<FrameKey, Map<String, Object>> entry : added.rows().entrySet()) {
            dataFrame.putRow(entry.getKey(), entry.getValue());
        }
        log.debug("Factor '{}' received {} new rows, recomputing", factorName, added.size());
        compute();
    }

    // ==================== 查询 ====================

    /**
     * 最近一次持久化的因子行（任意实体），无记录返回null
     */
    public Map.Entry<FrameKey, Map<String, Object>> getLatestSavedRecord() {
        DataQuery query = new DataQuery(config.getFactorProvider(), config.getEffectiveFactorSchema(), null);
        query.setOrder(SortDirective.desc(FrameKey.TIMESTAMP_FIELD));
        query.setLimit(1);
        TimeSeriesFrame latest = dataSource.query(query);
        if (latest == null || latest.isEmpty()) {
            return null;
        }
        return latest.rows().firstEntry();
    }

    public String getFactorName() { return factorName; }
    public DataSource getDataSource() { return dataSource; }
    public FactorConfig getConfig() { return config; }
    public DataQuery getDataQuery() { return dataQuery; }
    public List<Transformer> getTransformers() { return new ArrayList<>(transformers); }
    public Accumulator getAccumulator() { return accumulator; }
    public long getComputeCount() { return computeCount; }

    // 供外部渲染等只读访问，调用方不应修改返回的帧
    public TimeSeriesFrame getDataFrame() { return dataFrame; }
    public TimeSeriesFrame getPipeFrame() { return pipeFrame; }
    public TimeSeriesFrame getFactorFrame() { return factorFrame; }
    public TimeSeriesFrame getResultFrame() { return resultFrame; }

    static boolean hasRows(TimeSeriesFrame frame) {
        return frame != null && !frame.isEmpty();
    }

    private static int sizeOf(TimeSeriesFrame frame) {
        return frame == null ? 0 : frame.size();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{name='" + factorName + "', result="
                + (resultFrame == null ? "null" : resultFrame.size() + " rows") + "}";
    }
}
