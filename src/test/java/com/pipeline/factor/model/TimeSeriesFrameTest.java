package com.pipeline.factor.model;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.pipeline.factor.Frames.day;
import static com.pipeline.factor.Frames.key;
import static com.pipeline.factor.Frames.row;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TimeSeriesFrameTest {

    private TimeSeriesFrame frame;

    @BeforeEach
    void setUp() {
        frame = new TimeSeriesFrame();
        frame.putRow(key("stock_sz_000002", "2024-01-02"), row("close", 20.0));
        frame.putRow(key("stock_sz_000001", "2024-01-03"), row("close", 11.0));
        frame.putRow(key("stock_sz_000001", "2024-01-02"), row("close", 10.0, "volume", 100.0));
    }

    @Test
    void rowsAreOrderedByEntityThenTime() {
        assertThat(frame.keys()).containsExactly(
                key("stock_sz_000001", "2024-01-02"),
                key("stock_sz_000001", "2024-01-03"),
                key("stock_sz_000002", "2024-01-02"));
        assertThat(frame.keysByEntity()).containsOnlyKeys("stock_sz_000001", "stock_sz_000002");
        assertThat(frame.keysByEntity().get("stock_sz_000001")).hasSize(2);
    }

    @Test
    void putRowReplacesWholeRowAndKeepsColumnUnion() {
        boolean replaced = frame.putRow(key("stock_sz_000001", "2024-01-02"), row("close", 10.5));

        assertThat(replaced).isTrue();
        assertThat(frame.getRow(key("stock_sz_000001", "2024-01-02"))).containsOnlyKeys("close");
        assertThat(frame.getColumns()).containsExactly("close", "volume");
        assertThat(frame.size()).isEqualTo(3);
    }

    @Test
    void appendRowKeepsFirstOccurrence() {
        assertThat(frame.appendRow(key("stock_sz_000002", "2024-01-02"), row("close", 99.0))).isFalse();
        assertThat(frame.getDouble(key("stock_sz_000002", "2024-01-02"), "close")).isEqualTo(20.0);
    }

    @Test
    void copyIsDeep() {
        TimeSeriesFrame copy = frame.copy();
        copy.setValue(key("stock_sz_000002", "2024-01-02"), "close", 0.0);

        assertThat(frame.getDouble(key("stock_sz_000002", "2024-01-02"), "close")).isEqualTo(20.0);
        assertThat(copy).isNotEqualTo(frame);
        assertThat(frame.copy()).isEqualTo(frame);
    }

    @Test
    void rowViewsAreReadOnly() {
        assertThatThrownBy(() -> frame.getRow(key("stock_sz_000002", "2024-01-02")).put("close", 1.0))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> frame.rows().clear())
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void tailKeepsLastRowsPerEntity() {
        TimeSeriesFrame tail = frame.tail(1);

        assertThat(tail.keys()).containsExactly(
                key("stock_sz_000001", "2024-01-03"),
                key("stock_sz_000002", "2024-01-02"));
        assertThat(frame.tail(0).isEmpty()).isTrue();
    }

    @Test
    void selectProjectsColumns() {
        TimeSeriesFrame selected = frame.select(List.of("volume", "missing"));

        assertThat(selected.getColumns()).containsExactly("volume");
        assertThat(selected.size()).isEqualTo(3);
        assertThat(selected.getValue(key("stock_sz_000001", "2024-01-02"), "volume")).isEqualTo(100.0);
        assertThat(selected.getRow(key("stock_sz_000002", "2024-01-02"))).isEmpty();
    }

    @Test
    void timeRangeAndEntities() {
        assertThat(frame.minTimestamp()).isEqualTo(day("2024-01-02"));
        assertThat(frame.maxTimestamp()).isEqualTo(day("2024-01-03"));
        assertThat(frame.timestamps()).containsExactly(day("2024-01-02"), day("2024-01-03"));
        assertThat(frame.entityIds()).containsExactly("stock_sz_000001", "stock_sz_000002");
        assertThat(new TimeSeriesFrame().minTimestamp()).isNull();
    }

    @Test
    void getDoubleIgnoresNonNumericCells() {
        frame.setValue(key("stock_sz_000001", "2024-01-02"), "name", "Vanke");

        assertThat(frame.getDouble(key("stock_sz_000001", "2024-01-02"), "name")).isNull();
        assertThat(frame.getDouble(key("stock_sz_000009", "2024-01-02"), "close")).isNull();
    }
}
