package com.premiumlens.core.analytics.anomaly;

import java.util.Objects;

/**
 * Counts and statistics of one anomaly scan.
 *
 * @since 1.0.0
 */
public final class AnomalySummary {

    private final int totalPoints;
    private final int anomalyCount;
    private final long highCount;
    private final long lowCount;
    private final SeriesStatistics statistics;

    AnomalySummary(int totalPoints, int anomalyCount, long highCount, long lowCount, SeriesStatistics statistics) {
        this.totalPoints = totalPoints;
        this.anomalyCount = anomalyCount;
        this.highCount = highCount;
        this.lowCount = lowCount;
        this.statistics = Objects.requireNonNull(statistics, "Statistics must not be null");
    }

    /**
     * @return number of finite values scanned
     */
    public int getTotalPoints() {
        return totalPoints;
    }

    public int getAnomalyCount() {
        return anomalyCount;
    }

    /**
     * @return anomalies per 100 points, 0 for an empty series
     */
    public double getAnomalyRate() {
        return totalPoints == 0 ? 0 : anomalyCount * 100.0 / totalPoints;
    }

    public long getHighCount() {
        return highCount;
    }

    public long getLowCount() {
        return lowCount;
    }

    public SeriesStatistics getStatistics() {
        return statistics;
    }

    @Override
    public String toString() {
        return "AnomalySummary{totalPoints=" + totalPoints +
                ", anomalyCount=" + anomalyCount +
                ", high=" + highCount +
                ", low=" + lowCount +
                ", statistics=" + statistics +
                '}';
    }
}
