package com.metricsentinel.core.window;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link MetricWindowStore}.
 */
class MetricWindowStoreTest {

    private MetricWindowStore store;

    @BeforeEach
    void setUp() {
        store = new MetricWindowStore(4);
    }

    @Test
    @DisplayName("Should keep exactly windowSize most recent samples")
    void shouldBoundWindow() {
        for (int i = 1; i <= 10; i++) {
            store.addDataPoint("cpu", i, i);
        }

        MetricWindow window = store.get("cpu").orElseThrow();
        assertThat(window.size()).isEqualTo(4);
        assertThat(window.values()).containsExactly(7.0, 8.0, 9.0, 10.0);
    }

    @Test
    @DisplayName("Should keep metrics independent")
    void shouldPartitionByMetric() {
        store.addDataPoint("cpu", 1, 1);
        store.addDataPoint("mem", 2, 1);
        store.addDataPoint("mem", 3, 2);

        assertThat(store.get("cpu").orElseThrow().size()).isEqualTo(1);
        assertThat(store.get("mem").orElseThrow().size()).isEqualTo(2);
        assertThat(store.get("disk")).isEmpty();
    }

    @Test
    @DisplayName("Should store non-finite values as supplied")
    void shouldNotValidateValues() {
        store.addDataPoint("cpu", Double.NaN, 1);

        assertThat(store.get("cpu").orElseThrow().values()[0]).isNaN();
    }

    @Test
    @DisplayName("Should remove a metric's window")
    void shouldRemove() {
        store.addDataPoint("cpu", 1, 1);

        assertThat(store.remove("cpu")).isTrue();
        assertThat(store.get("cpu")).isEmpty();
        assertThat(store.remove("cpu")).isFalse();
    }

    @Test
    @DisplayName("Should reject a null metric name")
    void shouldRejectNullName() {
        assertThatThrownBy(() -> store.addDataPoint(null, 1, 1))
                .isInstanceOf(NullPointerException.class);
    }
}
