package com.pipeline.factor.factor;

import com.pipeline.factor.core.DataSource;
import com.pipeline.factor.core.PersistenceSink;
import com.pipeline.factor.model.TimeSeriesFrame;

/**
 * 过滤因子：结果帧即因子帧的副本，作为入选门限使用。
 */
public final class FilterFactor extends Factor {

    private FilterFactor(FactorConfig config, DataSource dataSource, PersistenceSink persistenceSink) {
        super(config, dataSource, persistenceSink);
    }

    /**
     * @param persistenceSink 持久化目标；needPersist 关闭时可为null
     */
    public static FilterFactor create(FactorConfig config, DataSource dataSource,
                                      PersistenceSink persistenceSink) {
        FilterFactor factor = new FilterFactor(config, dataSource, persistenceSink);
        factor.initialize();
        return factor;
    }

    @Override
    TimeSeriesFrame deriveResult(TimeSeriesFrame previous) {
        TimeSeriesFrame factorFrame = getFactorFrame();
        return factorFrame == null ? null : factorFrame.copy();
    }

    @Override
    public FactorType getFactorType() {
        return FactorType.FILTER;
    }
}
