package com.pipeline.factor.core.impl;

import com.pipeline.factor.factor.Factor;
import com.pipeline.factor.factor.FactorConfig;
import com.pipeline.factor.factor.FactorType;
import com.pipeline.factor.factor.FilterFactor;
import com.pipeline.factor.factor.ScoreFactor;
import com.pipeline.factor.operators.RankScorer;
import com.pipeline.factor.storage.InMemoryDataStorage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DefaultFactorRegistryTest {

    private DefaultFactorRegistry registry;
    private InMemoryDataStorage storage;

    @BeforeEach
    void setUp() {
        registry = new DefaultFactorRegistry();
        storage = new InMemoryDataStorage();
        registry.registerDefinition("copy", (dataSource, sink) ->
                FilterFactor.create(new FactorConfig("copy", "kdata"), dataSource, sink));
        registry.registerDefinition("rank", (dataSource, sink) ->
                ScoreFactor.create(new FactorConfig("rank", "kdata"), new RankScorer("close"), dataSource, sink));
    }

    @Test
    void duplicateDefinitionIsRejected() {
        boolean registered = registry.registerDefinition("copy", (dataSource, sink) -> null);

        assertThat(registered).isFalse();
        assertThat(registry.getDefinitionCount()).isEqualTo(2);
        assertThat(registry.registerDefinition(" ", (dataSource, sink) -> null)).isFalse();
        assertThat(registry.registerDefinition("none", null)).isFalse();
    }

    @Test
    void createFactorBuildsAndRegistersInstance() {
        Factor factor = registry.createFactor("copy", storage, storage);

        assertThat(registry.getFactor("copy")).isSameAs(factor);
        assertThat(storage.getSubscriptionCount()).isEqualTo(1);
        assertThatThrownBy(() -> registry.createFactor("copy", storage, storage))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> registry.createFactor("unknown", storage, storage))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void lookupsByNameAndType() {
        registry.createFactor("copy", storage, storage);
        registry.createFactor("rank", storage, storage);

        assertThat(registry.getAllFactors()).hasSize(2);
        assertThat(registry.getFactors(List.of("rank", "missing"))).containsOnlyKeys("rank");
        assertThat(registry.getFactorsByType(FactorType.SCORE))
                .extracting(Factor::getFactorName).containsExactly("rank");
        assertThat(registry.getFactorsByType(FactorType.STATE)).isEmpty();
        assertThat(registry.getFactor("missing")).isNull();
    }

    @Test
    void registerFactorRejectsDuplicates() {
        Factor factor = FilterFactor.create(new FactorConfig("manual", "kdata"), storage, storage);

        assertThat(registry.registerFactor("manual", factor)).isTrue();
        assertThat(registry.registerFactor("manual", factor)).isFalse();
        assertThat(registry.registerFactor("other", null)).isFalse();
    }

    @Test
    void unregisterRemovesSubscription() {
        registry.createFactor("copy", storage, storage);

        assertThat(registry.unregisterFactor("copy")).isTrue();
        assertThat(registry.unregisterFactor("copy")).isFalse();
        assertThat(registry.getFactor("copy")).isNull();
        assertThat(storage.getSubscriptionCount()).isZero();
    }

    @Test
    void unregisterByAliasRemovesSubscription() {
        Factor factor = FilterFactor.create(new FactorConfig("copy", "kdata"), storage, storage);
        registry.registerFactor("alias", factor);

        assertThat(registry.getFactorNames()).containsExactly("alias");
        assertThat(registry.unregisterFactor("alias")).isTrue();
        assertThat(storage.getSubscriptionCount()).isZero();
    }

    @Test
    void subscriptionKeptWhileInstanceHasAnotherName() {
        Factor factor = FilterFactor.create(new FactorConfig("copy", "kdata"), storage, storage);
        registry.registerFactor("first", factor);
        registry.registerFactor("second", factor);

        registry.unregisterFactor("first");

        assertThat(storage.getSubscriptionCount()).isEqualTo(1);
        registry.unregisterFactor("second");
        assertThat(storage.getSubscriptionCount()).isZero();
    }
}
