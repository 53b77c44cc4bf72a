package com.premiumlens.core.analytics.anomaly;

import java.util.Objects;

/**
 * A flagged value.
 *
 * @since 1.0.0
 */
public final class AnomalyPoint {

    private final int index;
    private final double value;
    private final double score;
    private final AnomalyType type;
    private final AnomalyMethod method;

    public AnomalyPoint(int index, double value, double score, AnomalyType type, AnomalyMethod method) {
        this.index = index;
        this.value = value;
        this.score = score;
        this.type = Objects.requireNonNull(type, "AnomalyType must not be null");
        this.method = Objects.requireNonNull(method, "AnomalyMethod must not be null");
    }

    /**
     * @return position in the caller's series
     */
    public int getIndex() {
        return index;
    }

    public double getValue() {
        return value;
    }

    /**
     * @return how anomalous the value is; higher is more anomalous
     */
    public double getScore() {
        return score;
    }

    public AnomalyType getType() {
        return type;
    }

    public AnomalyMethod getMethod() {
        return method;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnomalyPoint that))
            return false;
        return index == that.index
                && Double.compare(value, that.value) == 0
                && Double.compare(score, that.score) == 0
                && type == that.type
                && method == that.method;
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, value, score, type, method);
    }

    @Override
    public String toString() {
        return "AnomalyPoint{index=" + index +
                ", value=" + value +
                ", score=" + score +
                ", type=" + type +
                ", method=" + method +
                '}';
    }
}
