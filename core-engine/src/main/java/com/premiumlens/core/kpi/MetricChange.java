package com.premiumlens.core.kpi;

import com.premiumlens.core.model.KpiKey;

import java.util.Objects;

/**
 * Change of one metric between two periods.
 *
 * <p>
 * When either side is undefined both changes are {@code null}, the direction
 * is {@link ChangeDirection#FLAT} and the change is neither better nor worse.
 * The percentage change is relative to {@code |previous|} and is
 * {@code null} when the previous value is 0.
 * </p>
 *
 * @since 1.0.0
 */
public final class MetricChange {

    private final KpiKey key;
    private final Double current;
    private final Double previous;
    private final Double absoluteChange;
    private final Double percentChange;
    private final ChangeDirection direction;
    private final boolean better;
    private final boolean worsened;

    MetricChange(KpiKey key, Double current, Double previous, Double absoluteChange, Double percentChange,
            ChangeDirection direction, boolean better, boolean worsened) {
        this.key = Objects.requireNonNull(key, "KPI key must not be null");
        this.current = current;
        this.previous = previous;
        this.absoluteChange = absoluteChange;
        this.percentChange = percentChange;
        this.direction = Objects.requireNonNull(direction, "Direction must not be null");
        this.better = better;
        this.worsened = worsened;
    }

    public KpiKey getKey() {
        return key;
    }

    public Double getCurrent() {
        return current;
    }

    public Double getPrevious() {
        return previous;
    }

    public Double getAbsoluteChange() {
        return absoluteChange;
    }

    public Double getPercentChange() {
        return percentChange;
    }

    public ChangeDirection getDirection() {
        return direction;
    }

    /**
     * @return {@code true} when the metric moved in its favourable direction
     */
    public boolean isBetter() {
        return better;
    }

    /**
     * @return {@code true} when the metric moved in its unfavourable
     *         direction
     */
    public boolean isWorsened() {
        return worsened;
    }

    @Override
    public String toString() {
        return "MetricChange{key=" + key +
                ", current=" + current +
                ", previous=" + previous +
                ", absoluteChange=" + absoluteChange +
                ", percentChange=" + percentChange +
                ", direction=" + direction +
                ", better=" + better +
                ", worsened=" + worsened +
                '}';
    }
}
