package com.premiumlens.core.kpi;

import com.premiumlens.core.model.KpiKey;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Per-metric changes between two {@link com.premiumlens.core.model.KpiResult}s.
 *
 * @since 1.0.0
 */
public final class KpiComparison {

    private final Map<KpiKey, MetricChange> changes;

    KpiComparison(Map<KpiKey, MetricChange> changes) {
        this.changes = Collections.unmodifiableMap(new EnumMap<>(changes));
    }

    public MetricChange get(KpiKey key) {
        Objects.requireNonNull(key, "KPI key must not be null");
        return changes.get(key);
    }

    public Map<KpiKey, MetricChange> asMap() {
        return changes;
    }

    /**
     * @return metrics that moved in their favourable direction
     */
    public List<MetricChange> improvements() {
        return changes.values().stream().filter(MetricChange::isBetter).toList();
    }

    /**
     * @return metrics that moved in their unfavourable direction
     */
    public List<MetricChange> deteriorations() {
        return changes.values().stream().filter(MetricChange::isWorsened).toList();
    }

    @Override
    public String toString() {
        return "KpiComparison" + changes.values();
    }
}
