package com.pipeline.factor.operators;

import org.junit.jupiter.api.Test;

import java.util.List;

import static com.pipeline.factor.Frames.key;
import static com.pipeline.factor.Frames.row;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BucketStateClassifierTest {

    private final BucketStateClassifier classifier = new BucketStateClassifier(
            "v", new double[]{0.0, 10.0}, List.of("down", "flat", "up"), "unknown");

    @Test
    void mapsValuesToBuckets() {
        assertThat(classifier.classify(key("e1", "2024-01-01"), row("v", -1.0))).isEqualTo("down");
        assertThat(classifier.classify(key("e1", "2024-01-01"), row("v", 0.0))).isEqualTo("flat");
        assertThat(classifier.classify(key("e1", "2024-01-01"), row("v", 9.9))).isEqualTo("flat");
        assertThat(classifier.classify(key("e1", "2024-01-01"), row("v", 10.0))).isEqualTo("up");
    }

    @Test
    void missingValueGivesMissingState() {
        assertThat(classifier.classify(key("e1", "2024-01-01"), row("v", null))).isEqualTo("unknown");
        assertThat(classifier.classify(key("e1", "2024-01-01"), row("v", Double.NaN))).isEqualTo("unknown");
    }

    @Test
    void rejectsMismatchedStatesAndBoundaries() {
        assertThatThrownBy(() -> new BucketStateClassifier("v", new double[]{1.0}, List.of("a"), "x"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BucketStateClassifier("v", new double[]{2.0, 1.0}, List.of("a", "b", "c"), "x"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
