package com.pipeline.factor.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static com.pipeline.factor.Frames.day;
import static com.pipeline.factor.Frames.key;
import static com.pipeline.factor.Frames.row;
import static org.assertj.core.api.Assertions.assertThat;

class DataQueryTest {

    @Test
    void unscopedQueryMatchesAnyEntity() {
        DataQuery query = new DataQuery("eastmoney", "kdata", IntervalLevel.LEVEL_1DAY);

        assertThat(query.matchesEntity("anything")).isTrue();
    }

    @Test
    void entityScopeFollowsTypeExchangeCodeConvention() {
        DataQuery query = new DataQuery("eastmoney", "kdata", IntervalLevel.LEVEL_1DAY);
        query.setEntityType("stock");
        query.setExchanges(List.of("sz"));

        assertThat(query.matchesEntity("stock_sz_000338")).isTrue();
        assertThat(query.matchesEntity("stock_sh_600000")).isFalse();
        assertThat(query.matchesEntity("coin_sz_btc")).isFalse();
        assertThat(query.matchesEntity("malformed")).isFalse();

        query.setCodes(List.of("000001"));
        assertThat(query.matchesEntity("stock_sz_000338")).isFalse();
        assertThat(query.matchesEntity("stock_sz_000001")).isTrue();
    }

    @Test
    void explicitEntityIdsTakePrecedence() {
        DataQuery query = new DataQuery("eastmoney", "kdata", IntervalLevel.LEVEL_1DAY);
        query.setEntityType("stock");
        query.setEntityIds(List.of("coin_binance_btc"));

        assertThat(query.matchesEntity("coin_binance_btc")).isTrue();
        assertThat(query.matchesEntity("stock_sz_000338")).isFalse();
    }

    @Test
    void timeRangeIsInclusive() {
        DataQuery query = new DataQuery();
        query.setStartTimestamp(day("2024-01-02"));
        query.setEndTimestamp(day("2024-01-04"));

        assertThat(query.matchesTime(day("2024-01-01"))).isFalse();
        assertThat(query.matchesTime(day("2024-01-02"))).isTrue();
        assertThat(query.matchesTime(day("2024-01-04"))).isTrue();
        assertThat(query.matchesTime(day("2024-01-05"))).isFalse();
    }

    @Test
    void matchesAppliesAllFilters() {
        DataQuery query = new DataQuery();
        query.setFilters(List.of(RowFilter.gt("close", 10), RowFilter.le("volume", 500)));

        assertThat(query.matches(key("e1", "2024-01-02"), row("close", 12.0, "volume", 500.0))).isTrue();
        assertThat(query.matches(key("e1", "2024-01-02"), row("close", 9.0, "volume", 100.0))).isFalse();
        assertThat(query.matches(key("e1", "2024-01-02"), row("close", 12.0))).isFalse();
    }

    @Test
    void sameSourceComparesProviderSchemaAndLevel() {
        DataQuery query = new DataQuery("eastmoney", "kdata", IntervalLevel.LEVEL_1DAY);

        assertThat(query.isSameSource("eastmoney", "kdata", IntervalLevel.LEVEL_1DAY)).isTrue();
        assertThat(query.isSameSource("eastmoney", "kdata", IntervalLevel.LEVEL_1HOUR)).isFalse();
        assertThat(query.isSameSource("eastmoney", "kdata", null)).isFalse();
        assertThat(query.isSameSource("sina", "kdata", IntervalLevel.LEVEL_1DAY)).isFalse();
    }
}
