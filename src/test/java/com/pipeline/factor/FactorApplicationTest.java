package com.pipeline.factor;

import com.pipeline.factor.core.impl.DefaultFactorRegistry;
import com.pipeline.factor.factor.Factor;
import com.pipeline.factor.factor.FactorType;
import com.pipeline.factor.model.IntervalLevel;
import com.pipeline.factor.model.TimeSeriesFrame;
import com.pipeline.factor.storage.InMemoryDataStorage;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static com.pipeline.factor.Frames.key;
import static com.pipeline.factor.Frames.row;
import static org.assertj.core.api.Assertions.assertThat;

class FactorApplicationTest {

    @Test
    void builtinDefinitionsComputeOnCollectedTable() {
        AppConfig config = AppConfig.fromProperties(new Properties());
        InMemoryDataStorage storage = new InMemoryDataStorage();
        TimeSeriesFrame raw = new TimeSeriesFrame();
        raw.putRow(key("stock_sz_000001", "2024-01-02"), row("close", 10.0, "open", 9.0));
        raw.putRow(key("stock_sz_000002", "2024-01-02"), row("close", 20.0, "open", 21.0));
        storage.appendData("eastmoney", "kdata", IntervalLevel.LEVEL_1DAY, raw);

        DefaultFactorRegistry registry = new DefaultFactorRegistry();
        FactorApplication.registerBuiltinDefinitions(registry, config);
        Factor ma = registry.createFactor("close_ma5", storage, storage);
        Factor rank = registry.createFactor("close_rank", storage, storage);

        assertThat(ma.getFactorType()).isEqualTo(FactorType.FILTER);
        assertThat(ma.getFactorFrame().getDouble(key("stock_sz_000001", "2024-01-02"), "ma5")).isEqualTo(10.0);
        assertThat(rank.getFactorType()).isEqualTo(FactorType.SCORE);
        assertThat(rank.getResultFrame().getDouble(key("stock_sz_000002", "2024-01-02"), "close")).isEqualTo(1.0);
        assertThat(rank.getDataFrame().getColumns()).containsExactly("close");
    }
}
