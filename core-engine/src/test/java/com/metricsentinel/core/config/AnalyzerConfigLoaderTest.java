package com.metricsentinel.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AnalyzerConfigLoader}.
 */
class AnalyzerConfigLoaderTest {

    @Test
    @DisplayName("Should load test config from classpath")
    void shouldLoadFromClasspath() {
        AnalyzerConfig config = AnalyzerConfigLoader.fromClasspath("test-analyzer.yml");

        assertThat(config.getWindowSize()).isEqualTo(50);
        assertThat(config.getSensitivity()).isEqualTo(2.5);
        assertThat(config.getMinDataPoints()).isEqualTo(20);
        assertThat(config.isEnableTrendAnalysis()).isFalse();
        assertThat(config.isEnableSeasonalityDetection()).isTrue();
        assertThat(config.getSeasonalityPeriod()).isEqualTo(12);
        assertThat(config.getHistoryCapacity()).isEqualTo(AnalyzerConfig.DEFAULT_HISTORY_CAPACITY);
    }

    @Test
    @DisplayName("Should keep unrecognized keys as extensions")
    void shouldKeepExtensions() {
        AnalyzerConfig config = AnalyzerConfigLoader.fromClasspath("test-analyzer.yml");

        assertThat(config.getExtensions()).containsExactly(Map.entry("alertChannel", "ops-pager"));
    }

    @Test
    @DisplayName("Should load the bundled default config")
    void shouldLoadBundledDefaults() {
        AnalyzerConfig config = AnalyzerConfigLoader.fromClasspath(AnalyzerConfigLoader.DEFAULT_RESOURCE);

        assertThat(config.getWindowSize()).isEqualTo(100);
        assertThat(config.getSensitivity()).isEqualTo(2.0);
        assertThat(config.getMinDataPoints()).isEqualTo(10);
        assertThat(config.getExtensions()).isEmpty();
    }

    @Test
    @DisplayName("Should fall back to defaults for an empty document")
    void shouldUseDefaultsForEmptyDocument() {
        AnalyzerConfig config = AnalyzerConfigLoader.fromClasspath("empty-analyzer.yml");

        assertThat(config.getWindowSize()).isEqualTo(AnalyzerConfig.DEFAULT_WINDOW_SIZE);
        assertThat(config.isEnableTrendAnalysis()).isTrue();
    }

    @Test
    @DisplayName("Should report every invalid option at once")
    void shouldCollectAllErrors() {
        assertThatThrownBy(() -> AnalyzerConfigLoader.fromClasspath("invalid-analyzer.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("validation failed")
                .hasMessageContaining("sensitivity")
                .hasMessageContaining("enableTrendAnalysis");
    }

    @Test
    @DisplayName("Should throw when classpath resource does not exist")
    void shouldThrowForMissingResource() {
        assertThatThrownBy(() -> AnalyzerConfigLoader.fromClasspath("does-not-exist.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should throw when config file does not exist")
    void shouldThrowForMissingFile() {
        assertThatThrownBy(() -> AnalyzerConfigLoader.fromFile("/no/such/analyzer.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should coerce string-encoded values from a map")
    void shouldCoerceStrings() {
        Map<String, Object> options = new LinkedHashMap<>();
        options.put("windowSize", "30");
        options.put("sensitivity", "3");
        options.put("enableSeasonalityDetection", "false");

        AnalyzerConfig config = AnalyzerConfigLoader.fromMap(options);

        assertThat(config.getWindowSize()).isEqualTo(30);
        assertThat(config.getSensitivity()).isEqualTo(3.0);
        assertThat(config.isEnableSeasonalityDetection()).isFalse();
    }

    @Test
    @DisplayName("Should reject a fractional window size")
    void shouldRejectFractionalInteger() {
        assertThatThrownBy(() -> AnalyzerConfigLoader.fromMap(Map.of("windowSize", 10.5)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("windowSize");
    }

    @Test
    @DisplayName("Should surface builder validation errors")
    void shouldSurfaceRangeErrors() {
        assertThatThrownBy(() -> AnalyzerConfigLoader.fromMap(Map.of("minDataPoints", 0)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("minDataPoints must be > 0");
    }
}
