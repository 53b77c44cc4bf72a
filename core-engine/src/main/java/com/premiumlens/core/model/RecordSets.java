package com.premiumlens.core.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Whole-collection operations on records: de-duplication, merging, grouping
 * and summary statistics. Inputs are never modified.
 *
 * @since 1.0.0
 */
public final class RecordSets {

    private RecordSets() {
        // utility class
    }

    /**
     * Drop records whose natural key was already seen, keeping the first
     * occurrence. The natural key is the snapshot date, year, week and every
     * categorical dimension; two rows that agree on all of them describe the
     * same policy-week cell.
     *
     * @param records source records
     * @return new list in source order
     */
    public static List<InsuranceRecord> deduplicate(Collection<InsuranceRecord> records) {
        Objects.requireNonNull(records, "Records must not be null");
        Set<List<Object>> seen = new HashSet<>();
        List<InsuranceRecord> unique = new ArrayList<>(records.size());
        for (InsuranceRecord record : records) {
            if (seen.add(naturalKey(record))) {
                unique.add(record);
            }
        }
        return unique;
    }

    /**
     * Concatenate several record sets and de-duplicate the result.
     *
     * @param recordSets record sets in priority order
     * @return merged list
     */
    public static List<InsuranceRecord> merge(Collection<? extends Collection<InsuranceRecord>> recordSets) {
        Objects.requireNonNull(recordSets, "Record sets must not be null");
        List<InsuranceRecord> all = new ArrayList<>();
        recordSets.forEach(all::addAll);
        return deduplicate(all);
    }

    /**
     * Partition records by a classifier, preserving first-seen group order and
     * source order within each group.
     *
     * @param records    source records
     * @param classifier group key extractor; keys may be {@code null}
     * @param <K>        key type
     * @return ordered map of key to records
     */
    public static <K> Map<K, List<InsuranceRecord>> groupBy(Collection<InsuranceRecord> records,
            Function<InsuranceRecord, K> classifier) {
        Objects.requireNonNull(records, "Records must not be null");
        Objects.requireNonNull(classifier, "Classifier must not be null");
        Map<K, List<InsuranceRecord>> groups = new LinkedHashMap<>();
        for (InsuranceRecord record : records) {
            groups.computeIfAbsent(classifier.apply(record), k -> new ArrayList<>()).add(record);
        }
        return groups;
    }

    /**
     * @param records source records
     * @return summary statistics; an empty set yields zero totals and no date
     *         span
     */
    public static DatasetStatistics statistics(Collection<InsuranceRecord> records) {
        Objects.requireNonNull(records, "Records must not be null");
        double premium = 0;
        long policies = 0;
        Set<Integer> weeks = new TreeSet<>();
        Set<String> organizations = new TreeSet<>();
        for (InsuranceRecord record : records) {
            premium += record.getSignedPremiumYuan();
            policies += record.getPolicyCount();
            weeks.add(record.getWeekNumber());
            organizations.add(record.getThirdLevelOrganization());
        }
        return new DatasetStatistics(records.size(), premium, policies,
                new ArrayList<>(weeks), new ArrayList<>(organizations),
                records.stream().map(InsuranceRecord::getSnapshotDate).min(Comparator.naturalOrder()).orElse(null),
                records.stream().map(InsuranceRecord::getSnapshotDate).max(Comparator.naturalOrder()).orElse(null));
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static List<Object> naturalKey(InsuranceRecord r) {
        return Arrays.asList(
                r.getSnapshotDate(), r.getPolicyStartYear(), r.getWeekNumber(), r.getChengduBranch(),
                r.getThirdLevelOrganization(), r.getCustomerCategory(), r.getInsuranceType(),
                r.getBusinessTypeCategory(), r.getCoverageType(), r.getRenewalStatus(),
                r.isNewEnergyVehicle(), r.isTransferredVehicle(), r.getVehicleInsuranceGrade(),
                r.getHighwayRiskGrade(), r.getLargeTruckScore(), r.getSmallTruckScore(),
                r.getTerminalSource());
    }
}
