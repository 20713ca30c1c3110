package com.pipeline.factor.factor;

import com.pipeline.factor.core.TransformException;
import com.pipeline.factor.model.IntervalLevel;
import com.pipeline.factor.model.TimeSeriesFrame;
import com.pipeline.factor.operators.LinearTransformer;
import com.pipeline.factor.operators.RankScorer;
import com.pipeline.factor.storage.InMemoryDataStorage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.pipeline.factor.Frames.key;
import static com.pipeline.factor.Frames.row;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScoreFactorTest {

    private InMemoryDataStorage storage;

    @BeforeEach
    void setUp() {
        storage = new InMemoryDataStorage();
        TimeSeriesFrame raw = new TimeSeriesFrame();
        raw.putRow(key("stock_sz_000001", "2024-01-02"), row("close", 10.0));
        raw.putRow(key("stock_sz_000002", "2024-01-02"), row("close", 30.0));
        raw.putRow(key("stock_sz_000003", "2024-01-02"), row("close", 20.0));
        storage.appendData("eastmoney", "kdata", IntervalLevel.LEVEL_1DAY, raw);
    }

    @Test
    void scoresRawFrameAfterPipeline() {
        FactorConfig config = new FactorConfig("close_rank", "kdata");
        config.setTransformers(List.of(LinearTransformer.scale("close", -1.0)));

        ScoreFactor factor = ScoreFactor.create(config, new RankScorer("close"), storage, storage);

        TimeSeriesFrame result = factor.getResultFrame();
        assertThat(factor.getFactorType()).isEqualTo(FactorType.SCORE);
        assertThat(result.getDouble(key("stock_sz_000001", "2024-01-02"), "close")).isEqualTo(0.0);
        assertThat(result.getDouble(key("stock_sz_000002", "2024-01-02"), "close")).isEqualTo(1.0);
        assertThat(result.getDouble(key("stock_sz_000003", "2024-01-02"), "close")).isEqualTo(0.5);
        assertThat(factor.getFactorFrame().getDouble(key("stock_sz_000001", "2024-01-02"), "close"))
                .isEqualTo(-10.0);
    }

    @Test
    void scoresFollowNewData() {
        ScoreFactor factor = ScoreFactor.create(new FactorConfig("close_rank", "kdata"),
                new RankScorer("close"), storage, storage);

        TimeSeriesFrame added = new TimeSeriesFrame();
        added.putRow(key("stock_sz_000001", "2024-01-02"), row("close", 40.0));
        storage.appendData("eastmoney", "kdata", IntervalLevel.LEVEL_1DAY, added);

        assertThat(factor.getResultFrame().getDouble(key("stock_sz_000001", "2024-01-02"), "close"))
                .isEqualTo(1.0);
    }

    @Test
    void emptyPipeFrameKeepsPreviousScores() {
        FactorConfig config = new FactorConfig("nothing", "kdata");
        config.setEntityIds(List.of("stock_sz_999999"));

        ScoreFactor factor = ScoreFactor.create(config, new RankScorer("close"), storage, storage);

        assertThat(factor.getResultFrame()).isNull();
        assertThat(factor.getComputeCount()).isEqualTo(1);
    }

    @Test
    void scorerFailureAbortsCycle() {
        FactorConfig config = new FactorConfig("bad_score", "kdata");

        assertThatThrownBy(() -> ScoreFactor.create(config, raw -> {
            throw new ArithmeticException("division by zero");
        }, storage, storage))
                .isInstanceOf(TransformException.class)
                .hasMessageContaining("Scorer");
        assertThat(storage.getSubscriptionCount()).isZero();
    }

    @Test
    void scorerIsRequired() {
        assertThatThrownBy(() -> ScoreFactor.create(new FactorConfig("s", "kdata"), null, storage, storage))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
