package com.metricsentinel.core.window;

import com.metricsentinel.core.model.DataPoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link MetricWindow}.
 */
class MetricWindowTest {

    @Test
    @DisplayName("Should evict oldest samples first once full")
    void shouldEvictFifo() {
        MetricWindow window = new MetricWindow(3);
        for (int i = 0; i < 5; i++) {
            window.append(new DataPoint(i, 1_000L + i));
        }

        assertThat(window.size()).isEqualTo(3);
        assertThat(window.values()).containsExactly(2.0, 3.0, 4.0);
        assertThat(window.latest()).contains(new DataPoint(4, 1_004L));
    }

    @Test
    @DisplayName("Should return all samples in arrival order")
    void shouldSnapshotInOrder() {
        MetricWindow window = new MetricWindow(10);
        for (int i = 0; i < 7; i++) {
            window.append(new DataPoint(i, i));
        }

        assertThat(window.snapshot()).extracting(DataPoint::getValue)
                .containsExactly(0.0, 1.0, 2.0, 3.0, 4.0, 5.0, 6.0);
        assertThat(window.latest()).contains(new DataPoint(6, 6));
    }

    @Test
    @DisplayName("Should report an empty window")
    void shouldHandleEmptyWindow() {
        MetricWindow window = new MetricWindow(5);

        assertThat(window.isEmpty()).isTrue();
        assertThat(window.latest()).isEmpty();
        assertThat(window.values()).isEmpty();
        assertThat(window.snapshot()).isEmpty();
    }

    @Test
    @DisplayName("Should reject a non-positive capacity")
    void shouldRejectCapacity() {
        assertThatThrownBy(() -> new MetricWindow(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("capacity");
    }
}
