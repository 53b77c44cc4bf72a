package com.premiumlens.core.analytics.trend;

import com.premiumlens.core.analytics.FiniteSeries;
import org.apache.commons.math3.analysis.polynomials.PolynomialFunction;
import org.apache.commons.math3.fitting.PolynomialCurveFitter;
import org.apache.commons.math3.fitting.WeightedObservedPoints;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.IntToDoubleFunction;

/**
 * Fits a trend to a numeric series.
 *
 * <h3>Input</h3>
 * <p>
 * Non-finite values are skipped. Fewer than two remaining values yield an
 * empty, {@link TrendDirection#STABLE} result with {@code rSquared = 0}.
 * Every method walks the finite values in order: regression takes the
 * compacted position {@code 0..n-1} as x, so a gap does not stretch the
 * slope. Fitted points keep the caller's original index, and forecasts are
 * labelled from the last original index onward.
 * </p>
 *
 * <h3>Direction</h3>
 * <ul>
 * <li>{@link TrendMethod#LINEAR}: slope with {@code |slope| < 0.01} read as
 * stable.</li>
 * <li>Other methods: first vs last fitted value; a relative change under 5%
 * is stable, or an absolute change under 0.01 when the first value is 0.</li>
 * </ul>
 *
 * <h3>Goodness of fit</h3>
 * <p>
 * {@code R² = 1 − SSres / SStot} against the finite input values, 1 when
 * {@code SStot = 0}.
 * </p>
 *
 * @since 1.0.0
 */
public final class TrendFitter {

    private static final Logger LOG = LoggerFactory.getLogger(TrendFitter.class);

    static final double STABLE_SLOPE = 0.01;
    static final double STABLE_RELATIVE_CHANGE = 0.05;

    private TrendFitter() {
        // utility class
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    public static TrendFittingResult fit(double[] series, TrendOptions options) {
        Objects.requireNonNull(options, "TrendOptions must not be null");
        return fit(FiniteSeries.of(series), options);
    }

    public static TrendFittingResult fit(List<Double> series, TrendOptions options) {
        Objects.requireNonNull(options, "TrendOptions must not be null");
        return fit(FiniteSeries.of(series), options);
    }

    /**
     * Overall change between the first and last fitted value, in percent.
     *
     * @return the change, or {@code null} for an empty result or a first
     *         value of 0
     */
    public static Double changeRate(TrendFittingResult result) {
        Objects.requireNonNull(result, "TrendFittingResult must not be null");
        if (result.isEmpty()) {
            return null;
        }
        List<TrendPoint> points = result.getTrendPoints();
        double first = points.get(0).getValue();
        double last = points.get(points.size() - 1).getValue();
        if (first == 0) {
            return null;
        }
        return (last - first) / Math.abs(first) * 100;
    }

    /**
     * One-line summary of a fitted trend, e.g. {@code 稳步上升（12.5%）}.
     * Bands of the absolute change rate: under 5% slight, under 15% steady,
     * under 30% significant, otherwise rapid.
     */
    public static String describe(TrendFittingResult result) {
        Objects.requireNonNull(result, "TrendFittingResult must not be null");
        if (result.getDirection() == TrendDirection.STABLE) {
            return "趋势平稳，无明显变化";
        }
        String direction = result.getDirection() == TrendDirection.INCREASING ? "上升" : "下降";
        Double rate = changeRate(result);
        if (rate == null) {
            return "呈" + direction + "趋势";
        }
        double magnitude = Math.abs(rate);
        String band;
        if (magnitude < 5) {
            band = "略微";
        } else if (magnitude < 15) {
            band = "稳步";
        } else if (magnitude < 30) {
            band = "显著";
        } else {
            band = "快速";
        }
        return band + direction + "（" + String.format(Locale.ROOT, "%.1f", rate) + "%）";
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    static TrendFittingResult fit(FiniteSeries series, TrendOptions options) {
        if (series.size() < 2) {
            LOG.debug("Only {} finite value(s), returning an empty trend", series.size());
            return TrendFittingResult.empty(options.getMethod());
        }
        return switch (options.getMethod()) {
            case LINEAR -> fitLinear(series, options);
            case POLYNOMIAL -> fitPolynomial(series, options);
            case MOVING_AVERAGE -> smoothed(series, options, movingAverage(series, options.getWindow()));
            case EXPONENTIAL -> smoothed(series, options, exponential(series, options.getAlpha()));
        };
    }

    private static TrendFittingResult fitLinear(FiniteSeries series, TrendOptions options) {
        SimpleRegression regression = new SimpleRegression(true);
        for (int i = 0; i < series.size(); i++) {
            regression.addData(i, series.value(i));
        }
        double slope = regression.getSlope();
        double intercept = regression.getIntercept();
        PolynomialFunction line = new PolynomialFunction(new double[] { intercept, slope });

        List<TrendPoint> fitted = evaluate(series, line::value);
        TrendDirection direction = Math.abs(slope) < STABLE_SLOPE
                ? TrendDirection.STABLE
                : slope > 0 ? TrendDirection.INCREASING : TrendDirection.DECREASING;

        return new TrendFittingResult(TrendMethod.LINEAR, fitted,
                extrapolate(series, options.getPredictSteps(), line::value),
                rSquared(series, fitted), direction, List.of(intercept, slope));
    }

    private static TrendFittingResult fitPolynomial(FiniteSeries series, TrendOptions options) {
        // n points determine at most a degree n-1 polynomial
        int degree = Math.min(options.getDegree(), series.size() - 1);
        WeightedObservedPoints observations = new WeightedObservedPoints();
        for (int i = 0; i < series.size(); i++) {
            observations.add(i, series.value(i));
        }
        double[] coefficients = PolynomialCurveFitter.create(degree).fit(observations.toList());
        PolynomialFunction polynomial = new PolynomialFunction(coefficients);

        List<TrendPoint> fitted = evaluate(series, polynomial::value);
        return new TrendFittingResult(TrendMethod.POLYNOMIAL, fitted,
                extrapolate(series, options.getPredictSteps(), polynomial::value),
                rSquared(series, fitted), directionOf(fitted), Arrays.stream(coefficients).boxed().toList());
    }

    private static TrendFittingResult smoothed(FiniteSeries series, TrendOptions options, double[] smooth) {
        List<TrendPoint> fitted = new ArrayList<>(smooth.length);
        for (int i = 0; i < smooth.length; i++) {
            fitted.add(new TrendPoint(series.index(i), smooth[i]));
        }
        double level = smooth[smooth.length - 1];
        return new TrendFittingResult(options.getMethod(), fitted,
                extrapolate(series, options.getPredictSteps(), x -> level),
                rSquared(series, fitted), directionOf(fitted), List.of());
    }

    /**
     * Centered window; near the ends the window shrinks instead of padding.
     */
    static double[] movingAverage(FiniteSeries series, int window) {
        int n = series.size();
        int before = window / 2;
        int after = window - before - 1;
        double[] smooth = new double[n];
        for (int i = 0; i < n; i++) {
            int from = Math.max(0, i - before);
            int to = Math.min(n - 1, i + after);
            double sum = 0;
            for (int j = from; j <= to; j++) {
                sum += series.value(j);
            }
            smooth[i] = sum / (to - from + 1);
        }
        return smooth;
    }

    static double[] exponential(FiniteSeries series, double alpha) {
        double[] smooth = new double[series.size()];
        double ema = series.value(0);
        for (int i = 0; i < smooth.length; i++) {
            ema = alpha * series.value(i) + (1 - alpha) * ema;
            smooth[i] = ema;
        }
        return smooth;
    }

    private static List<TrendPoint> evaluate(FiniteSeries series, IntToDoubleFunction curve) {
        List<TrendPoint> points = new ArrayList<>(series.size());
        for (int i = 0; i < series.size(); i++) {
            points.add(new TrendPoint(series.index(i), curve.applyAsDouble(i)));
        }
        return points;
    }

    private static List<TrendPoint> extrapolate(FiniteSeries series, int steps, IntToDoubleFunction curve) {
        List<TrendPoint> predicted = new ArrayList<>(steps);
        int last = series.lastIndex();
        int lastPosition = series.size() - 1;
        for (int step = 1; step <= steps; step++) {
            predicted.add(new TrendPoint(last + step, curve.applyAsDouble(lastPosition + step)));
        }
        return predicted;
    }

    static double rSquared(FiniteSeries series, List<TrendPoint> fitted) {
        double mean = Arrays.stream(series.values()).average().orElse(0);
        double ssTot = 0;
        double ssRes = 0;
        for (int i = 0; i < series.size(); i++) {
            double actual = series.value(i);
            ssTot += (actual - mean) * (actual - mean);
            double residual = actual - fitted.get(i).getValue();
            ssRes += residual * residual;
        }
        return ssTot == 0 ? 1 : 1 - ssRes / ssTot;
    }

    private static TrendDirection directionOf(List<TrendPoint> fitted) {
        double first = fitted.get(0).getValue();
        double last = fitted.get(fitted.size() - 1).getValue();
        double change = last - first;
        boolean stable = first == 0
                ? Math.abs(change) < STABLE_SLOPE
                : Math.abs(change) / Math.abs(first) < STABLE_RELATIVE_CHANGE;
        if (stable) {
            return TrendDirection.STABLE;
        }
        return change > 0 ? TrendDirection.INCREASING : TrendDirection.DECREASING;
    }
}
