package com.premiumlens.core.analytics;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * The finite values of a numeric series together with their positions in the
 * caller's series. {@code NaN}, infinities and {@code null}s are dropped;
 * results built on top of this class report original positions.
 *
 * @since 1.0.0
 */
public final class FiniteSeries {

    private final double[] values;
    private final int[] indices;

    private FiniteSeries(double[] values, int[] indices) {
        this.values = values;
        this.indices = indices;
    }

    public static FiniteSeries of(double[] series) {
        Objects.requireNonNull(series, "Series must not be null");
        double[] values = new double[series.length];
        int[] indices = new int[series.length];
        int n = 0;
        for (int i = 0; i < series.length; i++) {
            if (Double.isFinite(series[i])) {
                values[n] = series[i];
                indices[n] = i;
                n++;
            }
        }
        return new FiniteSeries(Arrays.copyOf(values, n), Arrays.copyOf(indices, n));
    }

    /**
     * @param series values; {@code null} elements are skipped
     */
    public static FiniteSeries of(List<Double> series) {
        Objects.requireNonNull(series, "Series must not be null");
        double[] raw = new double[series.size()];
        for (int i = 0; i < raw.length; i++) {
            Double value = series.get(i);
            raw[i] = value == null ? Double.NaN : value;
        }
        return of(raw);
    }

    public int size() {
        return values.length;
    }

    public double value(int i) {
        return values[i];
    }

    /**
     * @return position of the {@code i}-th finite value in the source series
     */
    public int index(int i) {
        return indices[i];
    }

    /**
     * @return a copy of the finite values
     */
    public double[] values() {
        return values.clone();
    }

    /**
     * @return source position of the last finite value, or -1 when empty
     */
    public int lastIndex() {
        return indices.length == 0 ? -1 : indices[indices.length - 1];
    }

    @Override
    public String toString() {
        return "FiniteSeries{values=" + Arrays.toString(values) + ", indices=" + Arrays.toString(indices) + '}';
    }
}
