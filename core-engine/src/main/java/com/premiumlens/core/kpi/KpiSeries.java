package com.premiumlens.core.kpi;

import com.premiumlens.core.model.KpiKey;
import com.premiumlens.core.model.KpiResult;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One KPI laid out over weeks, ready for trend fitting or anomaly detection.
 * Undefined values appear as {@code NaN}; the analytics skip them while
 * keeping positions aligned with {@link #getWeeks()}.
 *
 * @since 1.0.0
 */
public final class KpiSeries {

    private final KpiKey key;
    private final List<Integer> weeks;
    private final double[] values;

    private KpiSeries(KpiKey key, List<Integer> weeks, double[] values) {
        this.key = key;
        this.weeks = List.copyOf(weeks);
        this.values = values;
    }

    /**
     * @param byWeek weekly results, typically from
     *               {@link KpiEngine#calculateWeeklySeries}; iteration order
     *               is kept
     * @param key    metric to extract
     * @return the series
     */
    public static KpiSeries extract(Map<Integer, KpiResult> byWeek, KpiKey key) {
        Objects.requireNonNull(byWeek, "Weekly results must not be null");
        Objects.requireNonNull(key, "KPI key must not be null");
        List<Integer> weeks = new ArrayList<>(byWeek.size());
        double[] values = new double[byWeek.size()];
        int i = 0;
        for (Map.Entry<Integer, KpiResult> entry : byWeek.entrySet()) {
            Double value = entry.getValue().get(key);
            weeks.add(entry.getKey());
            values[i++] = value == null ? Double.NaN : value;
        }
        return new KpiSeries(key, weeks, values);
    }

    public KpiKey getKey() {
        return key;
    }

    public List<Integer> getWeeks() {
        return weeks;
    }

    /**
     * @return a copy of the values, positionally aligned with the weeks
     */
    public double[] getValues() {
        return values.clone();
    }

    public int size() {
        return values.length;
    }

    @Override
    public String toString() {
        return "KpiSeries{key=" + key + ", weeks=" + weeks + ", values=" + Arrays.toString(values) + '}';
    }
}
