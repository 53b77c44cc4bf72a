package com.premiumlens.core.analytics.trend;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of a trend fit.
 *
 * <p>
 * {@code coefficients} are polynomial coefficients in ascending power order
 * (intercept first, then slope for a line); they are empty for the smoothing
 * methods and for an empty result.
 * </p>
 *
 * @since 1.0.0
 */
public final class TrendFittingResult {

    private final TrendMethod method;
    private final List<TrendPoint> trendPoints;
    private final List<TrendPoint> predictedPoints;
    private final double rSquared;
    private final TrendDirection direction;
    private final List<Double> coefficients;

    TrendFittingResult(TrendMethod method, List<TrendPoint> trendPoints, List<TrendPoint> predictedPoints,
            double rSquared, TrendDirection direction, List<Double> coefficients) {
        this.method = Objects.requireNonNull(method, "TrendMethod must not be null");
        this.trendPoints = List.copyOf(trendPoints);
        this.predictedPoints = List.copyOf(predictedPoints);
        this.rSquared = rSquared;
        this.direction = Objects.requireNonNull(direction, "TrendDirection must not be null");
        this.coefficients = List.copyOf(coefficients);
    }

    static TrendFittingResult empty(TrendMethod method) {
        return new TrendFittingResult(method, List.of(), List.of(), 0, TrendDirection.STABLE, List.of());
    }

    public TrendMethod getMethod() {
        return method;
    }

    /**
     * @return fitted values at the positions of the finite input values
     */
    public List<TrendPoint> getTrendPoints() {
        return trendPoints;
    }

    public List<TrendPoint> getPredictedPoints() {
        return predictedPoints;
    }

    public double getRSquared() {
        return rSquared;
    }

    public TrendDirection getDirection() {
        return direction;
    }

    public List<Double> getCoefficients() {
        return coefficients;
    }

    public boolean isEmpty() {
        return trendPoints.isEmpty();
    }

    @Override
    public String toString() {
        return "TrendFittingResult{method=" + method +
                ", points=" + trendPoints.size() +
                ", predicted=" + predictedPoints.size() +
                ", rSquared=" + rSquared +
                ", direction=" + direction +
                ", coefficients=" + coefficients +
                '}';
    }
}
