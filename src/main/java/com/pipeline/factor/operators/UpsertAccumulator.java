package com.pipeline.factor.operators;

import com.pipeline.factor.core.Accumulator;
import com.pipeline.factor.model.FrameKey;
import com.pipeline.factor.model.TimeSeriesFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * 按键 upsert 的累加器。
 *
 * - 两边都有的键：整行替换为管道帧的行
 * - 只在管道帧中的键：追加
 * - 只在因子帧中的键：保留
 *
 * 列取并集，被替换的行只带管道帧中的列。
 */
public class UpsertAccumulator implements Accumulator {

    private static final Logger log = LoggerFactory.getLogger(UpsertAccumulator.class);

    @Override
    public TimeSeriesFrame accumulate(TimeSeriesFrame pipeFrame, TimeSeriesFrame factorFrame) {
        TimeSeriesFrame merged = (factorFrame == null) ? new TimeSeriesFrame() : factorFrame.copy();
        int replaced = 0;
        for (Map.Entry<FrameKey, Map<String, Object>> entry : pipeFrame.rows().entrySet()) {
            if (merged.putRow(entry.getKey(), entry.getValue())) {
                replaced++;
            }
        }
        log.debug("Upsert merged {} rows ({} replaced, {} appended), total {}",
                pipeFrame.size(), replaced, pipeFrame.size() - replaced, merged.size());
        return merged;
    }
}
