package com.premiumlens.core.analytics.trend;

/**
 * A fitted or predicted value at a position of the source series.
 *
 * @since 1.0.0
 */
public final class TrendPoint {

    private final int index;
    private final double value;

    public TrendPoint(int index, double value) {
        this.index = index;
        this.value = value;
    }

    public int getIndex() {
        return index;
    }

    public double getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TrendPoint that))
            return false;
        return index == that.index && Double.compare(value, that.value) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * index + Double.hashCode(value);
    }

    @Override
    public String toString() {
        return "(" + index + ", " + value + ")";
    }
}
