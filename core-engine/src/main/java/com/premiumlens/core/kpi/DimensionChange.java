package com.premiumlens.core.kpi;

import java.util.Objects;

/**
 * Change of one metric for one group of a dimension.
 *
 * @since 1.0.0
 */
public final class DimensionChange {

    private final String group;
    private final MetricChange change;

    DimensionChange(String group, MetricChange change) {
        this.group = Objects.requireNonNull(group, "Group must not be null");
        this.change = Objects.requireNonNull(change, "Change must not be null");
    }

    public String getGroup() {
        return group;
    }

    public MetricChange getChange() {
        return change;
    }

    @Override
    public String toString() {
        return "DimensionChange{group='" + group + "', change=" + change + '}';
    }
}
