package com.premiumlens.core.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * Overview of a record set: size, totals and the time span it covers.
 *
 * @since 1.0.0
 */
public final class DatasetStatistics {

    private final int totalRecords;
    private final double totalSignedPremiumYuan;
    private final long totalPolicyCount;
    private final List<Integer> weeks;
    private final List<String> organizations;
    private final LocalDate earliestSnapshot;
    private final LocalDate latestSnapshot;

    DatasetStatistics(int totalRecords, double totalSignedPremiumYuan, long totalPolicyCount,
            List<Integer> weeks, List<String> organizations, LocalDate earliestSnapshot,
            LocalDate latestSnapshot) {
        this.totalRecords = totalRecords;
        this.totalSignedPremiumYuan = totalSignedPremiumYuan;
        this.totalPolicyCount = totalPolicyCount;
        this.weeks = List.copyOf(Objects.requireNonNull(weeks, "weeks must not be null"));
        this.organizations = List.copyOf(Objects.requireNonNull(organizations, "organizations must not be null"));
        this.earliestSnapshot = earliestSnapshot;
        this.latestSnapshot = latestSnapshot;
    }

    @JsonProperty("totalRecords")
    public int getTotalRecords() {
        return totalRecords;
    }

    @JsonProperty("totalSignedPremiumYuan")
    public double getTotalSignedPremiumYuan() {
        return totalSignedPremiumYuan;
    }

    @JsonProperty("totalPolicyCount")
    public long getTotalPolicyCount() {
        return totalPolicyCount;
    }

    /**
     * @return distinct week numbers, ascending
     */
    @JsonProperty("weeks")
    public List<Integer> getWeeks() {
        return weeks;
    }

    /**
     * @return distinct organizations, sorted
     */
    @JsonProperty("organizations")
    public List<String> getOrganizations() {
        return organizations;
    }

    /**
     * @return earliest snapshot date, {@code null} for an empty set
     */
    @JsonProperty("earliestSnapshot")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd")
    public LocalDate getEarliestSnapshot() {
        return earliestSnapshot;
    }

    /**
     * @return latest snapshot date, {@code null} for an empty set
     */
    @JsonProperty("latestSnapshot")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd")
    public LocalDate getLatestSnapshot() {
        return latestSnapshot;
    }

    @Override
    public String toString() {
        return "DatasetStatistics{" +
                "totalRecords=" + totalRecords +
                ", totalSignedPremiumYuan=" + totalSignedPremiumYuan +
                ", totalPolicyCount=" + totalPolicyCount +
                ", weeks=" + weeks +
                ", organizations=" + organizations.size() +
                ", span=" + earliestSnapshot + ".." + latestSnapshot +
                '}';
    }
}
