package com.premiumlens.core.kpi;

import com.premiumlens.core.model.KpiKey;
import com.premiumlens.core.model.KpiResult;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Period-over-period comparison of KPI results.
 *
 * <h3>Judgement</h3>
 * <p>
 * Whether a move is good news follows {@link KpiKey#polarity()}: a rise of a
 * {@code HIGHER_IS_BETTER} metric is better, a rise of a
 * {@code LOWER_IS_BETTER} metric is worse, and {@code NEUTRAL} metrics are
 * never judged.
 * </p>
 *
 * @since 1.0.0
 */
public final class KpiComparator {

    private KpiComparator() {
        // utility class
    }

    /**
     * Compare every metric.
     *
     * @param current  result of the later period; may be {@code null} when
     *                 that period has no data
     * @param previous result of the earlier period; may be {@code null}
     * @return one change per {@link KpiKey}
     */
    public static KpiComparison compare(KpiResult current, KpiResult previous) {
        Map<KpiKey, MetricChange> changes = new EnumMap<>(KpiKey.class);
        for (KpiKey key : KpiKey.values()) {
            changes.put(key, compare(key, current, previous));
        }
        return new KpiComparison(changes);
    }

    /**
     * Compare a single metric.
     */
    public static MetricChange compare(KpiKey key, KpiResult current, KpiResult previous) {
        Objects.requireNonNull(key, "KPI key must not be null");
        Double now = current == null ? null : current.get(key);
        Double before = previous == null ? null : previous.get(key);
        if (now == null || before == null) {
            return new MetricChange(key, now, before, null, null, ChangeDirection.FLAT, false, false);
        }

        double absolute = now - before;
        Double percent = before == 0 ? null : absolute / Math.abs(before) * 100;
        ChangeDirection direction = absolute > 0
                ? ChangeDirection.UP
                : absolute < 0 ? ChangeDirection.DOWN : ChangeDirection.FLAT;

        boolean better = false;
        boolean worsened = false;
        switch (key.polarity()) {
            case HIGHER_IS_BETTER -> {
                better = direction == ChangeDirection.UP;
                worsened = direction == ChangeDirection.DOWN;
            }
            case LOWER_IS_BETTER -> {
                better = direction == ChangeDirection.DOWN;
                worsened = direction == ChangeDirection.UP;
            }
            case NEUTRAL -> {
                // targets are inputs, not performance
            }
        }
        return new MetricChange(key, now, before, absolute, percent, direction, better, worsened);
    }

    /**
     * Compare one metric group by group, e.g. the output of two
     * {@link KpiEngine#calculateByDimension} calls. Groups missing from
     * {@code previous} compare against nothing.
     *
     * @return changes of every group of {@code current}, largest absolute
     *         change first
     */
    public static List<DimensionChange> compareByDimension(KpiKey key, Map<String, KpiResult> current,
            Map<String, KpiResult> previous) {
        Objects.requireNonNull(current, "Current results must not be null");
        Objects.requireNonNull(previous, "Previous results must not be null");
        List<DimensionChange> changes = new ArrayList<>(current.size());
        current.forEach((group, result) -> changes.add(
                new DimensionChange(group, compare(key, result, previous.get(group)))));
        changes.sort(Comparator.comparingDouble((DimensionChange c) -> magnitude(c.getChange())).reversed());
        return changes;
    }

    private static double magnitude(MetricChange change) {
        return change.getAbsoluteChange() == null ? 0 : Math.abs(change.getAbsoluteChange());
    }
}
