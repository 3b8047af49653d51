package com.crowdsentinel.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link EngineConfigLoader}.
 */
class EngineConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should load the bundled default configuration")
    void shouldLoadDefaultResource() {
        EngineConfig config = EngineConfigLoader.fromClasspath(EngineConfigLoader.DEFAULT_RESOURCE);

        assertThat(config.getAlert().getPolicy()).isEqualTo(AlertSettings.POLICY_THRESHOLD);
        assertThat(config.getNormalization().getTimeZone()).isEqualTo("Asia/Kolkata");
        assertThat(config.getNormalization().getTime().getPeakWindows()).hasSize(3);
        assertThat(config.getHistoryCapacity()).isEqualTo(288);
    }

    @Test
    @DisplayName("Should merge a partial file over defaults")
    void shouldMergePartialConfigOverDefaults() {
        EngineConfig config = EngineConfigLoader.fromClasspath("test-engine.yml");

        assertThat(config.getAlert().getPolicy()).isEqualTo(AlertSettings.POLICY_HOLD);
        assertThat(config.getAlert().getHoldSeconds()).isEqualTo(120);
        assertThat(config.getNormalization().usesSampleTime()).isTrue();
        assertThat(config.getNormalization().getEvent().getCalendar())
                .singleElement()
                .satisfies(e -> assertThat(e.getIntensity()).isEqualTo(0.9));
        assertThat(config.getBlend().getPhysical()).isEqualTo(0.6);
        assertThat(config.getHistoryCapacity()).isEqualTo(12);
    }

    @Test
    @DisplayName("Should fail validation for an inconsistent file")
    void shouldFailForInvalidConfig() {
        assertThatThrownBy(() -> EngineConfigLoader.fromClasspath("invalid-engine.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Engine configuration validation failed")
                .hasMessageContaining("Unknown alert policy")
                .hasMessageContaining("historyCapacity");
    }

    @Test
    @DisplayName("Should reject duplicate keys as malformed")
    void shouldRejectDuplicateKeys() {
        assertThatThrownBy(() -> EngineConfigLoader.fromClasspath("malformed-engine.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Malformed engine configuration");
    }

    @Test
    @DisplayName("Should throw for a missing classpath resource")
    void shouldThrowForMissingResource() {
        assertThatThrownBy(() -> EngineConfigLoader.fromClasspath("nonexistent.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Classpath resource not found");
    }

    @Test
    @DisplayName("Should throw for a missing file")
    void shouldThrowForMissingFile() {
        String missing = tempDir.resolve("missing.yml").toString();

        assertThatThrownBy(() -> EngineConfigLoader.fromFile(missing))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Engine config file not found");
    }

    @Test
    @DisplayName("An empty file should yield the defaults")
    void shouldUseDefaultsForEmptyFile() throws IOException {
        Path empty = Files.writeString(tempDir.resolve("empty.yml"), "");

        EngineConfig config = EngineConfigLoader.fromFile(empty.toString());

        assertThat(config.getAlert().getPolicy()).isEqualTo(AlertSettings.POLICY_THRESHOLD);
        assertThat(config.getHistoryCapacity()).isEqualTo(EngineConfig.DEFAULT_HISTORY_CAPACITY);
    }
}
