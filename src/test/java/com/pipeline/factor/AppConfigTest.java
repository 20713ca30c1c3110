package com.pipeline.factor;

import com.pipeline.factor.model.IntervalLevel;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class AppConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void loadsPropertiesFile() throws IOException {
        AppConfig config;
        try (InputStream in = getClass().getClassLoader().getResourceAsStream("factor-engine-test.properties")) {
            config = AppConfig.fromStream(in);
        }

        assertThat(config.getStorageRoot()).isEqualTo("target/test-storage");
        assertThat(config.isKafkaEnabled()).isTrue();
        assertThat(config.getKafkaBootstrapServers()).isEqualTo("broker:9093");
        assertThat(config.getKafkaInputTopic()).isEqualTo("quotes");
        assertThat(config.getKafkaGroupId()).isEqualTo("factor-test");
        assertThat(config.getCollectorProvider()).isEqualTo("joinquant");
        assertThat(config.getCollectorLevel()).isEqualTo(IntervalLevel.LEVEL_1HOUR);
        assertThat(config.getEnabledFactors()).containsExactly("close_ma5", "close_rank");
    }

    @Test
    void missingFileFallsBackToDefaults() {
        AppConfig config = AppConfig.load(tempDir.resolve("absent.properties").toString());

        assertThat(config.getStorageRoot()).isEqualTo("data/storage");
        assertThat(config.isKafkaEnabled()).isFalse();
        assertThat(config.getCollectorSchema()).isEqualTo("kdata");
        assertThat(config.getEnabledFactors()).isEmpty();
    }

    @Test
    void bundledDefaultsEnableBuiltinFactors() {
        AppConfig config = AppConfig.loadDefaults();

        assertThat(config.getEnabledFactors()).containsExactly("close_ma5", "close_rank");
        assertThat(config.getCollectorLevel()).isEqualTo(IntervalLevel.LEVEL_1DAY);
    }
}
