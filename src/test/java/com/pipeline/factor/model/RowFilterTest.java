package com.pipeline.factor.model;

import org.junit.jupiter.api.Test;

import static com.pipeline.factor.Frames.row;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RowFilterTest {

    @Test
    void numbersCompareAsDoubles() {
        assertThat(RowFilter.eq("close", 10).test(row("close", 10.0))).isTrue();
        assertThat(RowFilter.gt("close", 10L).test(row("close", 10.5))).isTrue();
        assertThat(RowFilter.ge("close", 10).test(row("close", 10.0))).isTrue();
        assertThat(RowFilter.lt("close", 10).test(row("close", 10.0))).isFalse();
        assertThat(RowFilter.le("close", 10).test(row("close", 9.99))).isTrue();
        assertThat(RowFilter.ne("close", 10).test(row("close", 11.0))).isTrue();
    }

    @Test
    void stringsCompareLexicographically() {
        assertThat(RowFilter.eq("name", "abc").test(row("name", "abc"))).isTrue();
        assertThat(RowFilter.gt("name", "abc").test(row("name", "abd"))).isTrue();
    }

    @Test
    void missingCellOnlySatisfiesNotEqual() {
        assertThat(RowFilter.eq("close", 10).test(row("open", 10.0))).isFalse();
        assertThat(RowFilter.gt("close", 10).test(row("close", null))).isFalse();
        assertThat(RowFilter.ne("close", 10).test(row())).isTrue();
    }

    @Test
    void columnIsRequired() {
        assertThatThrownBy(() -> RowFilter.eq(" ", 1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
