package com.premiumlens.core.analytics.anomaly;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import java.util.Arrays;
import java.util.Objects;

/**
 * Descriptive statistics of a finite series.
 *
 * <p>
 * The standard deviation is the population one. The median and the
 * quartiles take the lower-rank element {@code sorted[⌊n·p⌋]} rather than
 * interpolating; the MAD is the same median of the absolute deviations from
 * the median.
 * </p>
 *
 * @since 1.0.0
 */
public final class SeriesStatistics {

    private static final SeriesStatistics EMPTY = new SeriesStatistics(0, 0, 0, 0, 0, 0, 0, 0, 0);

    private final int count;
    private final double mean;
    private final double stdDev;
    private final double median;
    private final double q1;
    private final double q3;
    private final double mad;
    private final double min;
    private final double max;

    private SeriesStatistics(int count, double mean, double stdDev, double median, double q1, double q3,
            double mad, double min, double max) {
        this.count = count;
        this.mean = mean;
        this.stdDev = stdDev;
        this.median = median;
        this.q1 = q1;
        this.q3 = q3;
        this.mad = mad;
        this.min = min;
        this.max = max;
    }

    /**
     * @param values finite values
     * @return the statistics; all zero for an empty array
     */
    public static SeriesStatistics of(double[] values) {
        Objects.requireNonNull(values, "Values must not be null");
        int n = values.length;
        if (n == 0) {
            return EMPTY;
        }
        DescriptiveStatistics stats = new DescriptiveStatistics(values);
        double[] sorted = stats.getSortedValues();
        double median = sorted[n / 2];

        double[] deviations = Arrays.stream(values).map(v -> Math.abs(v - median)).sorted().toArray();
        return new SeriesStatistics(n, stats.getMean(), Math.sqrt(stats.getPopulationVariance()), median,
                sorted[(int) Math.floor(n * 0.25)], sorted[(int) Math.floor(n * 0.75)], deviations[n / 2],
                stats.getMin(), stats.getMax());
    }

    public int getCount() {
        return count;
    }

    public double getMean() {
        return mean;
    }

    public double getStdDev() {
        return stdDev;
    }

    public double getMedian() {
        return median;
    }

    public double getQ1() {
        return q1;
    }

    public double getQ3() {
        return q3;
    }

    public double getIqr() {
        return q3 - q1;
    }

    public double getMad() {
        return mad;
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    @Override
    public String toString() {
        return "SeriesStatistics{count=" + count +
                ", mean=" + mean +
                ", stdDev=" + stdDev +
                ", median=" + median +
                ", q1=" + q1 +
                ", q3=" + q3 +
                ", mad=" + mad +
                ", min=" + min +
                ", max=" + max +
                '}';
    }
}
