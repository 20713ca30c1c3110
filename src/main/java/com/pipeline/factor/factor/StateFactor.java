package com.pipeline.factor.factor;

import com.pipeline.factor.core.DataSource;
import com.pipeline.factor.core.FactorException;
import com.pipeline.factor.core.PersistenceSink;
import com.pipeline.factor.core.StateClassifier;
import com.pipeline.factor.core.TransformException;
import com.pipeline.factor.model.FrameKey;
import com.pipeline.factor.model.TimeSeriesFrame;

import java.sql.Timestamp;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 状态因子。
 *
 * 声明一组有限的状态名，由状态分类器把因子帧的每一行映射为其中一个状态，
 * 结果帧的 {@link #STATE_COLUMN} 列保存该状态。
 * 分类结果不在声明范围内时本周期中止。
 */
public final class StateFactor extends Factor {

    public static final String STATE_COLUMN = "state";

    private final List<String> states;
    private final StateClassifier classifier;

    private StateFactor(FactorConfig config, List<String> states, StateClassifier classifier,
                        DataSource dataSource, PersistenceSink persistenceSink) {
        super(config, dataSource, persistenceSink);
        if (states == null || states.isEmpty()) {
            throw new IllegalArgumentException("States must not be empty for state factor: "
                    + config.getFactorName());
        }
        if (new LinkedHashSet<>(states).size() != states.size() || states.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("States must be unique and non-null, got: " + states);
        }
        if (classifier == null) {
            throw new IllegalArgumentException("StateClassifier must not be null for state factor: "
                    + config.getFactorName());
        }
        this.states = List.copyOf(states);
        this.classifier = classifier;
    }

    public static StateFactor create(FactorConfig config, List<String> states, StateClassifier classifier,
                                     DataSource dataSource, PersistenceSink persistenceSink) {
        StateFactor factor = new StateFactor(config, states, classifier, dataSource, persistenceSink);
        factor.initialize();
        return factor;
    }

    @Override
    TimeSeriesFrame deriveResult(TimeSeriesFrame previous) {
        TimeSeriesFrame factorFrame = getFactorFrame();
        TimeSeriesFrame result = new TimeSeriesFrame();
        if (factorFrame == null) {
            return result;
        }
        for (Map.Entry<FrameKey, Map<String, Object>> entry : factorFrame.rows().entrySet()) {
            String state;
            try {
                state = classifier.classify(entry.getKey(), entry.getValue());
            } catch (FactorException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new TransformException(factorName, "State classifier failed at "
                        + entry.getKey() + ": " + e.getMessage(), e);
            }
            if (state == null || !states.contains(state)) {
                throw new TransformException(factorName, "State '" + state + "' at " + entry.getKey()
                        + " is not one of the declared states " + states, null);
            }
            result.setValue(entry.getKey(), STATE_COLUMN, state);
        }
        return result;
    }

    /**
     * @return 指定实体在指定时刻的状态；无结果返回null
     */
    public String getState(Timestamp timestamp, String entityId) {
        TimeSeriesFrame result = getResultFrame();
        if (result == null) {
            return null;
        }
        Object state = result.getValue(FrameKey.of(entityId, timestamp), STATE_COLUMN);
        return state == null ? null : state.toString();
    }

    /**
     * 短周期状态：每个实体最近 shortStateWindow 行中的主导状态
     */
    public Map<String, String> getShortState() {
        return dominantStates(config.getShortStateWindow());
    }

    /**
     * 长周期状态：每个实体最近 longStateWindow 行中的主导状态
     */
    public Map<String, String> getLongState() {
        return dominantStates(config.getLongStateWindow());
    }

    /**
     * 出现次数最多的状态；次数相同时取最近出现的那个。
     */
    private Map<String, String> dominantStates(int window) {
        TimeSeriesFrame result = getResultFrame();
        if (result == null || result.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, String> summary = new LinkedHashMap<>();
        for (Map.Entry<String, List<FrameKey>> entry : result.tail(window).keysByEntity().entrySet()) {
            Map<String, Integer> counts = new HashMap<>();
            Map<String, Integer> lastSeen = new HashMap<>();
            List<FrameKey> keys = entry.getValue();
            for (int i = 0; i < keys.size(); i++) {
                Object value = result.getValue(keys.get(i), STATE_COLUMN);
                if (value == null) continue;
                String state = value.toString();
                counts.merge(state, 1, Integer::sum);
                lastSeen.put(state, i);
            }
            String dominant = null;
            for (Map.Entry<String, Integer> count : counts.entrySet()) {
                if (dominant == null
                        || count.getValue() > counts.get(dominant)
                        || (count.getValue().equals(counts.get(dominant))
                            && lastSeen.get(count.getKey()) > lastSeen.get(dominant))) {
                    dominant = count.getKey();
                }
            }
            if (dominant != null) {
                summary.put(entry.getKey(), dominant);
            }
        }
        return summary;
    }

    public List<String> getStates() { return states; }

    @Override
    public FactorType getFactorType() {
        return FactorType.STATE;
    }
}
