package com.pipeline.factor.storage;

import com.pipeline.factor.factor.FactorConfig;
import com.pipeline.factor.factor.FilterFactor;
import com.pipeline.factor.model.DataQuery;
import com.pipeline.factor.model.IntervalLevel;
import com.pipeline.factor.model.TimeSeriesFrame;
import com.pipeline.factor.operators.UpsertAccumulator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static com.pipeline.factor.Frames.day;
import static com.pipeline.factor.Frames.key;
import static com.pipeline.factor.Frames.row;
import static org.assertj.core.api.Assertions.assertThat;

class SQLiteDataStorageTest {

    @TempDir
    Path tempDir;

    private SQLiteDataStorage storage;

    @BeforeEach
    void setUp() {
        storage = new SQLiteDataStorage(tempDir.resolve("db").toString());
    }

    @AfterEach
    void tearDown() {
        storage.shutdown();
    }

    @Test
    void writtenRowsReadBackWithTypes() {
        TimeSeriesFrame frame = new TimeSeriesFrame();
        frame.putRow(key("stock_sz_000001", "2024-01-02"), row("close", 10.5, "name", "PingAn", "gate", true));
        storage.appendData("eastmoney", "kdata", IntervalLevel.LEVEL_1DAY, frame);

        TimeSeriesFrame read = storage.query(new DataQuery("eastmoney", "kdata", IntervalLevel.LEVEL_1DAY));

        assertThat(read.size()).isEqualTo(1);
        assertThat(read.getValue(key("stock_sz_000001", "2024-01-02"), "close")).isEqualTo(10.5);
        assertThat(read.getValue(key("stock_sz_000001", "2024-01-02"), "name")).isEqualTo("PingAn");
        assertThat(read.getValue(key("stock_sz_000001", "2024-01-02"), "gate")).isEqualTo(1.0);
    }

    @Test
    void upsertReplacesWholeRow() {
        TimeSeriesFrame first = new TimeSeriesFrame();
        first.putRow(key("e1", "2024-01-01"), row("v", 1.0, "extra", 5.0));
        storage.write(first, "ma", "factor");

        TimeSeriesFrame second = new TimeSeriesFrame();
        second.putRow(key("e1", "2024-01-01"), row("v", 2.0));
        second.putRow(key("e2", "2024-01-01"), row("v", 3.0));
        storage.write(second, "ma", "factor");

        TimeSeriesFrame read = storage.loadFull("factor", "ma", null);
        assertThat(read.size()).isEqualTo(2);
        assertThat(read.getRow(key("e1", "2024-01-01"))).containsOnlyKeys("v").containsEntry("v", 2.0);
        assertThat(read.getDouble(key("e2", "2024-01-01"), "v")).isEqualTo(3.0);
    }

    @Test
    void queryFiltersByTimeAndEntity() {
        TimeSeriesFrame frame = new TimeSeriesFrame();
        frame.putRow(key("stock_sz_000001", "2024-01-01"), row("close", 1.0));
        frame.putRow(key("stock_sz_000001", "2024-01-02"), row("close", 2.0));
        frame.putRow(key("stock_sz_000002", "2024-01-02"), row("close", 3.0));
        storage.appendData("eastmoney", "kdata", IntervalLevel.LEVEL_1DAY, frame);

        DataQuery query = new DataQuery("eastmoney", "kdata", IntervalLevel.LEVEL_1DAY);
        query.setEntityIds(List.of("stock_sz_000001"));
        query.setStartTimestamp(day("2024-01-02"));

        TimeSeriesFrame read = storage.query(query);

        assertThat(read.keys()).containsExactly(key("stock_sz_000001", "2024-01-02"));
    }

    @Test
    void loadRecentKeepsLastRowsPerEntity() {
        TimeSeriesFrame frame = new TimeSeriesFrame();
        for (int d = 1; d <= 5; d++) {
            frame.putRow(key("e1", "2024-01-0" + d), row("v", (double) d, "w", (double) -d));
            frame.putRow(key("e2", "2024-01-0" + d), row("v", (double) d * 10));
        }
        storage.write(frame, "ma", "factor");

        TimeSeriesFrame recent = storage.loadRecent("factor", "ma", 2);

        assertThat(recent.keys()).containsExactly(
                key("e1", "2024-01-04"), key("e1", "2024-01-05"),
                key("e2", "2024-01-04"), key("e2", "2024-01-05"));
        assertThat(recent.getDouble(key("e1", "2024-01-05"), "w")).isEqualTo(-5.0);
        assertThat(storage.loadRecent("factor", "ma", 0).isEmpty()).isTrue();
        assertThat(storage.loadRecent("factor", "missing", 3).isEmpty()).isTrue();
    }

    @Test
    void loadFullStartsAtTimestamp() {
        TimeSeriesFrame frame = new TimeSeriesFrame();
        frame.putRow(key("e1", "2024-01-01"), row("v", 1.0));
        frame.putRow(key("e1", "2024-01-02"), row("v", 2.0));
        storage.write(frame, "ma", "factor");

        assertThat(storage.loadFull("factor", "ma", day("2024-01-02")).keys())
                .containsExactly(key("e1", "2024-01-02"));
    }

    @Test
    void dataSurvivesReopen() {
        TimeSeriesFrame frame = new TimeSeriesFrame();
        frame.putRow(key("e1", "2024-01-01"), row("v", 1.0));
        storage.write(frame, "ma", "factor");
        storage.shutdown();

        storage = new SQLiteDataStorage(tempDir.resolve("db").toString());

        assertThat(storage.loadFull("factor", "ma", null).getDouble(key("e1", "2024-01-01"), "v")).isEqualTo(1.0);
    }

    @Test
    void factorPersistsAndWarmStartsFromSqlite() {
        TimeSeriesFrame raw = new TimeSeriesFrame();
        raw.putRow(key("stock_sz_000001", "2024-01-02"), row("close", 10.0));
        storage.appendData("eastmoney", "kdata", IntervalLevel.LEVEL_1DAY, raw);
        FactorConfig config = new FactorConfig("close_copy", "kdata");
        config.setAccumulator(new UpsertAccumulator());
        FilterFactor.create(config, storage, storage);

        TimeSeriesFrame more = new TimeSeriesFrame();
        more.putRow(key("stock_sz_000001", "2024-01-03"), row("close", 11.0));
        storage.appendData("eastmoney", "kdata", IntervalLevel.LEVEL_1DAY, more);

        FactorConfig restarted = new FactorConfig("close_copy", "kdata");
        restarted.setAutoLoad(false);
        FilterFactor reloaded = FilterFactor.create(restarted, storage, storage);

        assertThat(reloaded.getFactorFrame().size()).isEqualTo(2);
        assertThat(reloaded.getLatestSavedRecord().getKey()).isEqualTo(key("stock_sz_000001", "2024-01-03"));
    }
}
