package com.premiumlens.core.filter;

import com.premiumlens.core.model.FilterState;
import com.premiumlens.core.model.InsuranceRecord;
import com.premiumlens.core.model.NewEnergyFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Applies a {@link FilterState} to a record collection.
 *
 * <h3>Semantics</h3>
 * <ul>
 * <li>Each dimension contributes one predicate; a record passes when every
 * non-excluded predicate passes.</li>
 * <li>An empty inclusion set puts no constraint on its dimension.</li>
 * <li>The week predicate uses {@link FilterState#effectiveWeeks()}, so the
 * view mode decides which week selection applies.</li>
 * <li>A non-empty vehicle-grade set rejects records without a grade.</li>
 * <li>{@link NewEnergyFilter#ANY} is pass-through.</li>
 * </ul>
 *
 * <p>
 * Every method is pure: inputs are never modified and results are new lists
 * in source order.
 * </p>
 *
 * @since 1.0.0
 */
public final class FilterEngine {

    private static final Logger LOG = LoggerFactory.getLogger(FilterEngine.class);

    private FilterEngine() {
        // utility class
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Filter on every dimension.
     */
    public static List<InsuranceRecord> filter(Collection<InsuranceRecord> records, FilterState state) {
        return filter(records, state, EnumSet.noneOf(FilterDimension.class));
    }

    /**
     * Filter on every dimension except the excluded ones.
     *
     * @param records  source records; must not be {@code null}
     * @param state    filter selection; must not be {@code null}
     * @param excluded dimensions to skip; must not be {@code null}
     * @return matching records in source order
     */
    public static List<InsuranceRecord> filter(Collection<InsuranceRecord> records, FilterState state,
            Set<FilterDimension> excluded) {
        Objects.requireNonNull(records, "Records must not be null");
        Objects.requireNonNull(state, "FilterState must not be null");
        Objects.requireNonNull(excluded, "Excluded dimensions must not be null");

        Set<FilterDimension> active = EnumSet.allOf(FilterDimension.class);
        active.removeAll(excluded);

        List<InsuranceRecord> matched = records.stream()
                .filter(record -> active.stream().allMatch(d -> matches(record, state, d)))
                .toList();
        LOG.trace("Filtered {} record(s) down to {}", records.size(), matched.size());
        return matched;
    }

    /**
     * Records of a single week, other dimensions as selected. The state's own
     * week selection is replaced.
     */
    public static List<InsuranceRecord> forWeek(Collection<InsuranceRecord> records, FilterState state, int week) {
        return forWeekRange(records, state, week, week);
    }

    /**
     * Records whose week lies in {@code [fromWeek, toWeek]}, other dimensions
     * as selected.
     *
     * @throws IllegalArgumentException if {@code fromWeek > toWeek}
     */
    public static List<InsuranceRecord> forWeekRange(Collection<InsuranceRecord> records, FilterState state,
            int fromWeek, int toWeek) {
        if (fromWeek > toWeek) {
            throw new IllegalArgumentException(
                    "fromWeek must not exceed toWeek, got: " + fromWeek + " > " + toWeek);
        }
        List<InsuranceRecord> others = filter(records, state, EnumSet.of(FilterDimension.WEEK));
        return others.stream()
                .filter(r -> r.getWeekNumber() >= fromWeek && r.getWeekNumber() <= toWeek)
                .toList();
    }

    /**
     * Cascading options: the distinct values of {@code dimension} among the
     * records that pass every other dimension of {@code state}.
     *
     * <p>
     * Years and weeks are returned newest first, text values in natural
     * order and enum values in declaration order; the new-energy flag lists
     * {@code false} before {@code true}.
     * </p>
     *
     * @return sorted distinct values; never contains {@code null}
     */
    public static List<Object> availableValues(Collection<InsuranceRecord> records, FilterState state,
            FilterDimension dimension) {
        Objects.requireNonNull(dimension, "Dimension must not be null");
        List<InsuranceRecord> pool = filter(records, state, EnumSet.of(dimension));
        return switch (dimension) {
            case YEAR -> distinct(pool, InsuranceRecord::getPolicyStartYear, Comparator.reverseOrder());
            case WEEK -> distinct(pool, InsuranceRecord::getWeekNumber, Comparator.reverseOrder());
            case ORGANIZATION -> distinct(pool, InsuranceRecord::getThirdLevelOrganization,
                    Comparator.naturalOrder());
            case INSURANCE_TYPE -> distinct(pool, InsuranceRecord::getInsuranceType, Comparator.naturalOrder());
            case BUSINESS_TYPE -> distinct(pool, InsuranceRecord::getBusinessTypeCategory,
                    Comparator.naturalOrder());
            case COVERAGE_TYPE -> distinct(pool, InsuranceRecord::getCoverageType, Comparator.naturalOrder());
            case CUSTOMER_CATEGORY -> distinct(pool, InsuranceRecord::getCustomerCategory,
                    Comparator.naturalOrder());
            case VEHICLE_GRADE -> distinct(pool, InsuranceRecord::getVehicleInsuranceGrade,
                    Comparator.naturalOrder());
            case TERMINAL_SOURCE -> distinct(pool, InsuranceRecord::getTerminalSource, Comparator.naturalOrder());
            case RENEWAL_STATUS -> distinct(pool, InsuranceRecord::getRenewalStatus, Comparator.naturalOrder());
            case NEW_ENERGY -> distinct(pool, InsuranceRecord::isNewEnergyVehicle, Comparator.naturalOrder());
        };
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    static boolean matches(InsuranceRecord r, FilterState state, FilterDimension dimension) {
        return switch (dimension) {
            case YEAR -> includes(state.getYears(), r.getPolicyStartYear());
            case WEEK -> includes(state.effectiveWeeks(), r.getWeekNumber());
            case ORGANIZATION -> includes(state.getOrganizations(), r.getThirdLevelOrganization());
            case INSURANCE_TYPE -> includes(state.getInsuranceTypes(), r.getInsuranceType());
            case BUSINESS_TYPE -> includes(state.getBusinessTypes(), r.getBusinessTypeCategory());
            case COVERAGE_TYPE -> includes(state.getCoverageTypes(), r.getCoverageType());
            case CUSTOMER_CATEGORY -> includes(state.getCustomerCategories(), r.getCustomerCategory());
            case VEHICLE_GRADE -> includes(state.getVehicleGrades(), r.getVehicleInsuranceGrade());
            case TERMINAL_SOURCE -> includes(state.getTerminalSources(), r.getTerminalSource());
            case RENEWAL_STATUS -> includes(state.getRenewalStatuses(), r.getRenewalStatus());
            case NEW_ENERGY -> switch (state.getNewEnergy()) {
                case ANY -> true;
                case NEW_ENERGY_ONLY -> r.isNewEnergyVehicle();
                case CONVENTIONAL_ONLY -> !r.isNewEnergyVehicle();
            };
        };
    }

    private static <T> boolean includes(Set<T> selection, T value) {
        // a null value never matches a non-empty selection
        return selection.isEmpty() || (value != null && selection.contains(value));
    }

    private static <T> List<Object> distinct(List<InsuranceRecord> pool, Function<InsuranceRecord, T> extractor,
            Comparator<? super T> order) {
        Set<T> values = new TreeSet<>(order);
        for (InsuranceRecord record : pool) {
            T value = extractor.apply(record);
            if (value != null) {
                values.add(value);
            }
        }
        return List.<Object>copyOf(values);
    }
}
