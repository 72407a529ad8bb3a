package com.metricsentinel.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AnalyzerConfig}.
 */
class AnalyzerConfigTest {

    @Test
    @DisplayName("Should expose documented defaults")
    void shouldExposeDefaults() {
        AnalyzerConfig config = AnalyzerConfig.defaults();

        assertThat(config.getWindowSize()).isEqualTo(100);
        assertThat(config.getSensitivity()).isEqualTo(2.0);
        assertThat(config.getMinDataPoints()).isEqualTo(10);
        assertThat(config.isEnableTrendAnalysis()).isTrue();
        assertThat(config.isEnableSeasonalityDetection()).isTrue();
        assertThat(config.getHistoryCapacity()).isEqualTo(100);
        assertThat(config.getSeasonalityPeriod()).isEqualTo(24);
    }

    @Test
    @DisplayName("Should reject non-positive window size")
    void shouldRejectWindowSize() {
        assertThatThrownBy(() -> AnalyzerConfig.builder().windowSize(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("windowSize");
    }

    @Test
    @DisplayName("Should reject a history capacity above 100")
    void shouldRejectHistoryCapacityAboveLimit() {
        assertThatThrownBy(() -> AnalyzerConfig.builder().historyCapacity(101).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("historyCapacity must be <= 100");

        assertThat(AnalyzerConfig.builder().historyCapacity(100).build().getHistoryCapacity())
                .isEqualTo(AnalyzerConfig.MAX_HISTORY_CAPACITY);
    }

    @Test
    @DisplayName("Should reject NaN and non-positive sensitivity")
    void shouldRejectSensitivity() {
        assertThatThrownBy(() -> AnalyzerConfig.builder().sensitivity(Double.NaN).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> AnalyzerConfig.builder().sensitivity(-1).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("sensitivity");
    }

    @Test
    @DisplayName("Should copy every option through toBuilder")
    void shouldRoundTripThroughBuilder() {
        AnalyzerConfig original = AnalyzerConfig.builder()
                .windowSize(42)
                .sensitivity(3.0)
                .enableTrendAnalysis(false)
                .extension("team", "payments")
                .build();

        AnalyzerConfig copy = original.toBuilder().minDataPoints(5).build();

        assertThat(copy.getWindowSize()).isEqualTo(42);
        assertThat(copy.getSensitivity()).isEqualTo(3.0);
        assertThat(copy.isEnableTrendAnalysis()).isFalse();
        assertThat(copy.getMinDataPoints()).isEqualTo(5);
        assertThat(copy.getExtensions()).containsEntry("team", "payments");
        assertThat(original.getMinDataPoints()).isEqualTo(10);
    }

    @Test
    @DisplayName("Should expose extensions as an unmodifiable map")
    void shouldProtectExtensions() {
        AnalyzerConfig config = AnalyzerConfig.builder().extension("a", 1).build();

        assertThatThrownBy(() -> config.getExtensions().put("b", 2))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
