package com.premiumlens.core.analytics;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link FiniteSeries}.
 */
class FiniteSeriesTest {

    @Test
    @DisplayName("Should skip non-finite values and remember source positions")
    void shouldSkipNonFiniteValues() {
        FiniteSeries series = FiniteSeries.of(new double[] { 1, Double.NaN, 3, Double.POSITIVE_INFINITY, 5 });

        assertThat(series.size()).isEqualTo(3);
        assertThat(series.values()).containsExactly(1, 3, 5);
        assertThat(series.index(1)).isEqualTo(2);
        assertThat(series.lastIndex()).isEqualTo(4);
    }

    @Test
    @DisplayName("Should skip null elements of a list")
    void shouldSkipNulls() {
        FiniteSeries series = FiniteSeries.of(Arrays.asList(null, 2.0, null, 4.0));

        assertThat(series.values()).containsExactly(2, 4);
        assertThat(series.index(0)).isEqualTo(1);
    }
}
