package com.premiumlens.core.analytics.trend;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link TrendFitter}.
 */
class TrendFitterTest {

    private static final double EPS = 1e-9;

    @Test
    @DisplayName("Should fit a perfect line with slope 2 and R² 1")
    void shouldFitLinearTrend() {
        TrendFittingResult result = TrendFitter.fit(new double[] { 10, 12, 14, 16, 18 },
                TrendOptions.builder().method(TrendMethod.LINEAR).predictSteps(2).build());

        assertThat(result.getDirection()).isEqualTo(TrendDirection.INCREASING);
        assertThat(result.getCoefficients().get(0)).isCloseTo(10.0, within(EPS));
        assertThat(result.getCoefficients().get(1)).isCloseTo(2.0, within(EPS));
        assertThat(result.getRSquared()).isCloseTo(1.0, within(EPS));
        assertThat(result.getTrendPoints()).hasSize(5);
        assertThat(result.getPredictedPoints()).extracting(TrendPoint::getIndex).containsExactly(5, 6);
        assertThat(result.getPredictedPoints().get(1).getValue()).isCloseTo(22.0, within(EPS));
    }

    @Test
    @DisplayName("Should regress over the finite values in order and keep their original indices")
    void shouldRegressOverCompactedPositions() {
        TrendFittingResult result = TrendFitter.fit(new double[] { 10, Double.NaN, 12, Double.NaN, 14 },
                TrendOptions.builder().method(TrendMethod.LINEAR).predictSteps(1).build());

        assertThat(result.getCoefficients().get(1)).isCloseTo(2.0, within(EPS));
        assertThat(result.getTrendPoints()).extracting(TrendPoint::getIndex).containsExactly(0, 2, 4);
        assertThat(result.getRSquared()).isCloseTo(1.0, within(EPS));
        assertThat(result.getPredictedPoints()).singleElement().satisfies(p -> {
            assertThat(p.getIndex()).isEqualTo(5);
            assertThat(p.getValue()).isCloseTo(16.0, within(EPS));
        });
    }

    @Test
    @DisplayName("Should read a flat series as stable with R² 1")
    void shouldDetectStableSeries() {
        TrendFittingResult result = TrendFitter.fit(new double[] { 5, 5, 5, 5 }, TrendOptions.of(TrendMethod.LINEAR));

        assertThat(result.getDirection()).isEqualTo(TrendDirection.STABLE);
        assertThat(result.getRSquared()).isEqualTo(1.0);
        assertThat(TrendFitter.describe(result)).isEqualTo("趋势平稳，无明显变化");
    }

    @Test
    @DisplayName("Should return an empty stable result for fewer than two finite values")
    void shouldHandleTooFewPoints() {
        TrendFittingResult single = TrendFitter.fit(new double[] { 7 }, TrendOptions.of(TrendMethod.LINEAR));
        TrendFittingResult mostlyNaN = TrendFitter.fit(new double[] { Double.NaN, 3 },
                TrendOptions.of(TrendMethod.EXPONENTIAL));

        assertThat(single.isEmpty()).isTrue();
        assertThat(single.getDirection()).isEqualTo(TrendDirection.STABLE);
        assertThat(single.getRSquared()).isZero();
        assertThat(mostlyNaN.isEmpty()).isTrue();
        assertThat(TrendFitter.changeRate(single)).isNull();
    }

    @Test
    @DisplayName("Should smooth with a centered, shrinking moving-average window")
    void shouldFitMovingAverage() {
        TrendFittingResult result = TrendFitter.fit(new double[] { 1, 2, 3, 4, 5 },
                TrendOptions.builder().method(TrendMethod.MOVING_AVERAGE).window(3).predictSteps(1).build());

        assertThat(result.getTrendPoints()).extracting(TrendPoint::getValue)
                .containsExactly(1.5, 2.0, 3.0, 4.0, 4.5);
        assertThat(result.getDirection()).isEqualTo(TrendDirection.INCREASING);
        assertThat(result.getPredictedPoints()).singleElement()
                .satisfies(p -> assertThat(p.getValue()).isEqualTo(4.5));
    }

    @Test
    @DisplayName("Should smooth exponentially and forecast the last level")
    void shouldFitExponential() {
        TrendFittingResult result = TrendFitter.fit(new double[] { 10, 20 },
                TrendOptions.builder().method(TrendMethod.EXPONENTIAL).alpha(0.5).predictSteps(2).build());

        assertThat(result.getTrendPoints()).extracting(TrendPoint::getValue).containsExactly(10.0, 15.0);
        assertThat(result.getPredictedPoints()).extracting(TrendPoint::getValue).containsExactly(15.0, 15.0);
        assertThat(result.getDirection()).isEqualTo(TrendDirection.INCREASING);
    }

    @Test
    @DisplayName("Should fit a quadratic exactly")
    void shouldFitPolynomial() {
        TrendFittingResult result = TrendFitter.fit(new double[] { 0, 1, 4, 9, 16 },
                TrendOptions.builder().method(TrendMethod.POLYNOMIAL).degree(2).predictSteps(1).build());

        assertThat(result.getCoefficients()).hasSize(3);
        assertThat(result.getCoefficients().get(2)).isCloseTo(1.0, within(1e-6));
        assertThat(result.getRSquared()).isCloseTo(1.0, within(1e-6));
        assertThat(result.getPredictedPoints().get(0).getValue()).isCloseTo(25.0, within(1e-6));
    }

    @Test
    @DisplayName("Should cap the polynomial degree at the number of points minus one")
    void shouldCapPolynomialDegree() {
        TrendFittingResult result = TrendFitter.fit(new double[] { 3, 5 },
                TrendOptions.builder().method(TrendMethod.POLYNOMIAL).degree(4).build());

        assertThat(result.getCoefficients()).hasSize(2);
        assertThat(result.getCoefficients().get(1)).isCloseTo(2.0, within(1e-6));
    }

    @Test
    @DisplayName("Should describe the change rate in bands")
    void shouldDescribeTrend() {
        TrendFittingResult rising = TrendFitter.fit(new double[] { 10, 12, 14, 16, 18 },
                TrendOptions.of(TrendMethod.LINEAR));
        TrendFittingResult falling = TrendFitter.fit(new double[] { 100, 99, 98 },
                TrendOptions.of(TrendMethod.LINEAR));

        assertThat(TrendFitter.changeRate(rising)).isCloseTo(80.0, within(1e-6));
        assertThat(TrendFitter.describe(rising)).isEqualTo("快速上升（80.0%）");
        assertThat(falling.getDirection()).isEqualTo(TrendDirection.DECREASING);
        assertThat(TrendFitter.describe(falling)).isEqualTo("略微下降（-2.0%）");
    }

    @Test
    @DisplayName("Should validate trend options")
    void shouldValidateOptions() {
        assertThatThrownBy(() -> TrendOptions.builder().alpha(0).build())
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("alpha");
        assertThatThrownBy(() -> TrendOptions.builder().window(0).build())
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("window");
        assertThat(TrendOptions.of(TrendMethod.EXPONENTIAL).getAlpha()).isEqualTo(0.3);
    }
}
