package com.pipeline.factor.factor;

import com.pipeline.factor.core.DataSource;
import com.pipeline.factor.core.FactorException;
import com.pipeline.factor.core.PersistenceSink;
import com.pipeline.factor.core.Scorer;
import com.pipeline.factor.core.TransformException;
import com.pipeline.factor.model.TimeSeriesFrame;

/**
 * 打分因子。
 *
 * 在转换和累加之后，用打分器对原始帧打分生成结果帧。
 * 打分与因子值解耦：更换打分器不需要重算因子。
 * 管道帧为空的周期不重新打分，保留上一周期的结果。
 */
public final class ScoreFactor extends Factor {

    private final Scorer scorer;

    private ScoreFactor(FactorConfig config, Scorer scorer, DataSource dataSource,
                        PersistenceSink persistenceSink) {
        super(config, dataSource, persistenceSink);
        if (scorer == null) {
            throw new IllegalArgumentException("Scorer must not be null for score factor: "
                    + config.getFactorName());
        }
        this.scorer = scorer;
    }

    public static ScoreFactor create(FactorConfig config, Scorer scorer, DataSource dataSource,
                                     PersistenceSink persistenceSink) {
        ScoreFactor factor = new ScoreFactor(config, scorer, dataSource, persistenceSink);
        factor.initialize();
        return factor;
    }

    @Override
    TimeSeriesFrame deriveResult(TimeSeriesFrame previous) {
        if (!hasRows(getPipeFrame())) {
            return previous;
        }
        TimeSeriesFrame scored;
        try {
            scored = scorer.score(getDataFrame());
        } catch (FactorException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new TransformException(factorName, "Scorer ("
                    + scorer.getClass().getSimpleName() + ") failed: " + e.getMessage(), e);
        }
        if (scored == null) {
            throw new TransformException(factorName, "Scorer ("
                    + scorer.getClass().getSimpleName() + ") returned null", null);
        }
        return scored;
    }

    public Scorer getScorer() { return scorer; }

    @Override
    public FactorType getFactorType() {
        return FactorType.SCORE;
    }
}
