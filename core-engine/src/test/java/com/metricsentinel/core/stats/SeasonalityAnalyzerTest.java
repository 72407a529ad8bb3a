package com.metricsentinel.core.stats;

import com.metricsentinel.core.model.SeasonalityResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link SeasonalityAnalyzer}.
 */
class SeasonalityAnalyzerTest {

    private final SeasonalityAnalyzer analyzer = new SeasonalityAnalyzer();

    @Test
    @DisplayName("Should detect the period of a sine wave")
    void shouldDetectSineWave() {
        double[] values = sine(24, 96);

        SeasonalityResult result = analyzer.detect(values, 24);

        assertThat(result.hasSeasonality()).isTrue();
        assertThat(result.getPeriod()).isEqualTo(24);
        assertThat(result.getAutocorrelation()).isCloseTo(1.0, within(1e-6));
        assertThat(result.getStrength()).isCloseTo(1.0, within(1e-6));
    }

    @Test
    @DisplayName("Should report anti-correlation at half the period and none at a quarter")
    void shouldDistinguishLags() {
        SeasonalityResult result = analyzer.detect(sine(24, 96), 12);

        assertThat(result.getAutocorrelation()).isLessThan(-0.3);
        assertThat(result.hasSeasonality()).isTrue();
        assertThat(analyzer.detect(sine(24, 96), 6).hasSeasonality()).isFalse();
    }

    @Test
    @DisplayName("Should report negative autocorrelation for an alternating series")
    void shouldDetectAlternation() {
        double[] values = {1, -1, 1, -1, 1, -1, 1, -1, 1, -1};

        SeasonalityResult result = analyzer.detect(values, 1);

        assertThat(result.getAutocorrelation()).isCloseTo(-1.0, within(1e-9));
        assertThat(result.hasSeasonality()).isTrue();
    }

    @Test
    @DisplayName("Should require at least two full periods")
    void shouldRequireTwoPeriods() {
        SeasonalityResult result = analyzer.detect(sine(24, 47), 24);

        assertThat(result.hasSeasonality()).isFalse();
        assertThat(result.getAutocorrelation()).isNull();
        assertThat(result.getPeriod()).isNull();
    }

    @Test
    @DisplayName("Should report zero autocorrelation for a constant series")
    void shouldHandleConstantSeries() {
        double[] values = new double[48];
        Arrays.fill(values, 3.0);

        SeasonalityResult result = analyzer.detect(values, 24);

        assertThat(result.hasSeasonality()).isFalse();
        assertThat(result.getAutocorrelation()).isZero();
    }

    @Test
    @DisplayName("Should reject a non-positive period")
    void shouldRejectPeriod() {
        assertThatThrownBy(() -> analyzer.detect(new double[10], 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("period");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static double[] sine(int period, int length) {
        double[] values = new double[length];
        for (int i = 0; i < length; i++) {
            values[i] = Math.sin(2 * Math.PI * i / period);
        }
        return values;
    }
}
