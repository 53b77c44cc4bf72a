package com.premiumlens.core.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable AND-combination of per-dimension inclusion sets.
 *
 * <p>
 * An empty inclusion set means "no constraint" for that dimension. The view
 * mode decides which week selection is in force (see
 * {@link #effectiveWeeks()}) and the data view type decides whether KPI
 * queries report cumulative values or week-over-week deltas.
 * </p>
 *
 * <p>
 * Instances are value objects: {@code equals}/{@code hashCode} cover every
 * field so a filter state can be used as a cache key.
 * </p>
 *
 * @since 1.0.0
 */
public final class FilterState {

    private static final FilterState EMPTY = builder().build();

    private final Set<Integer> years;
    private final Set<Integer> weeks;
    private final Set<String> organizations;
    private final Set<InsuranceType> insuranceTypes;
    private final Set<String> businessTypes;
    private final Set<CoverageType> coverageTypes;
    private final Set<String> customerCategories;
    private final Set<VehicleGrade> vehicleGrades;
    private final Set<String> terminalSources;
    private final Set<RenewalStatus> renewalStatuses;
    private final NewEnergyFilter newEnergy;
    private final ViewMode viewMode;
    private final Integer singleModeWeek;
    private final List<Integer> trendModeWeeks;
    private final DataViewType dataViewType;

    private FilterState(Builder b) {
        this.years = freeze(b.years);
        this.weeks = freeze(b.weeks);
        this.organizations = freeze(b.organizations);
        this.insuranceTypes = freeze(b.insuranceTypes);
        this.businessTypes = freeze(b.businessTypes);
        this.coverageTypes = freeze(b.coverageTypes);
        this.customerCategories = freeze(b.customerCategories);
        this.vehicleGrades = freeze(b.vehicleGrades);
        this.terminalSources = freeze(b.terminalSources);
        this.renewalStatuses = freeze(b.renewalStatuses);
        this.newEnergy = Objects.requireNonNull(b.newEnergy, "newEnergy must not be null");
        this.viewMode = Objects.requireNonNull(b.viewMode, "viewMode must not be null");
        this.singleModeWeek = b.singleModeWeek;
        this.trendModeWeeks = List.copyOf(b.trendModeWeeks);
        this.dataViewType = Objects.requireNonNull(b.dataViewType, "dataViewType must not be null");
    }

    /**
     * @return a filter state that matches every record
     */
    public static FilterState empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return builder pre-populated with this state
     */
    public Builder toBuilder() {
        return new Builder()
                .years(years)
                .weeks(weeks)
                .organizations(organizations)
                .insuranceTypes(insuranceTypes)
                .businessTypes(businessTypes)
                .coverageTypes(coverageTypes)
                .customerCategories(customerCategories)
                .vehicleGrades(vehicleGrades)
                .terminalSources(terminalSources)
                .renewalStatuses(renewalStatuses)
                .newEnergy(newEnergy)
                .viewMode(viewMode)
                .singleModeWeek(singleModeWeek)
                .trendModeWeeks(trendModeWeeks)
                .dataViewType(dataViewType);
    }

    // ---------------------------------------------------------------
    // Derived views
    // ---------------------------------------------------------------

    /**
     * The week selection actually applied when filtering.
     *
     * <ul>
     * <li>{@link ViewMode#SINGLE} with a selected week: that week only.</li>
     * <li>{@link ViewMode#TREND} with selected trend weeks: those weeks.</li>
     * <li>Otherwise the plain {@code weeks} inclusion set.</li>
     * </ul>
     *
     * @return unmodifiable set; empty means no week constraint
     */
    public Set<Integer> effectiveWeeks() {
        if (viewMode == ViewMode.SINGLE && singleModeWeek != null) {
            return Set.of(singleModeWeek);
        }
        if (viewMode == ViewMode.TREND && !trendModeWeeks.isEmpty()) {
            return Collections.unmodifiableSet(new LinkedHashSet<>(trendModeWeeks));
        }
        return weeks;
    }

    /**
     * The week a KPI snapshot is "as of": the selected single week, otherwise
     * the latest effective week.
     *
     * @return reference week, or empty when no week is constrained
     */
    public Optional<Integer> referenceWeek() {
        if (viewMode == ViewMode.SINGLE && singleModeWeek != null) {
            return Optional.of(singleModeWeek);
        }
        return effectiveWeeks().stream().max(Integer::compareTo);
    }

    /**
     * The same filter moved back by one week, used as the comparison period
     * in increment mode. Every week selection is shifted by one and weeks
     * that fall below 1 are dropped.
     *
     * @return the previous-period filter, or empty when this state has no
     *         week constraint or no week survives the shift
     */
    public Optional<FilterState> previousPeriod() {
        if (effectiveWeeks().isEmpty()) {
            return Optional.empty();
        }
        Integer previousSingle = singleModeWeek != null && singleModeWeek > 1 ? singleModeWeek - 1 : null;
        FilterState shifted = toBuilder()
                .weeks(shift(weeks))
                .singleModeWeek(previousSingle)
                .trendModeWeeks(shift(trendModeWeeks).stream().sorted().toList())
                .build();
        if (viewMode == ViewMode.SINGLE && singleModeWeek != null && previousSingle == null) {
            return Optional.empty();
        }
        return shifted.effectiveWeeks().isEmpty() ? Optional.empty() : Optional.of(shifted);
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public Set<Integer> getYears() {
        return years;
    }

    public Set<Integer> getWeeks() {
        return weeks;
    }

    public Set<String> getOrganizations() {
        return organizations;
    }

    public Set<InsuranceType> getInsuranceTypes() {
        return insuranceTypes;
    }

    public Set<String> getBusinessTypes() {
        return businessTypes;
    }

    public Set<CoverageType> getCoverageTypes() {
        return coverageTypes;
    }

    public Set<String> getCustomerCategories() {
        return customerCategories;
    }

    public Set<VehicleGrade> getVehicleGrades() {
        return vehicleGrades;
    }

    public Set<String> getTerminalSources() {
        return terminalSources;
    }

    public Set<RenewalStatus> getRenewalStatuses() {
        return renewalStatuses;
    }

    public NewEnergyFilter getNewEnergy() {
        return newEnergy;
    }

    public ViewMode getViewMode() {
        return viewMode;
    }

    public Integer getSingleModeWeek() {
        return singleModeWeek;
    }

    public List<Integer> getTrendModeWeeks() {
        return trendModeWeeks;
    }

    public DataViewType getDataViewType() {
        return dataViewType;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link FilterState}. Collections are copied on
     * {@link #build()}; {@code null} collections are treated as empty.
     */
    public static class Builder {
        private Collection<Integer> years = Set.of();
        private Collection<Integer> weeks = Set.of();
        private Collection<String> organizations = Set.of();
        private Collection<InsuranceType> insuranceTypes = Set.of();
        private Collection<String> businessTypes = Set.of();
        private Collection<CoverageType> coverageTypes = Set.of();
        private Collection<String> customerCategories = Set.of();
        private Collection<VehicleGrade> vehicleGrades = Set.of();
        private Collection<String> terminalSources = Set.of();
        private Collection<RenewalStatus> renewalStatuses = Set.of();
        private NewEnergyFilter newEnergy = NewEnergyFilter.ANY;
        private ViewMode viewMode = ViewMode.SINGLE;
        private Integer singleModeWeek;
        private Collection<Integer> trendModeWeeks = List.of();
        private DataViewType dataViewType = DataViewType.CURRENT;

        public Builder years(Collection<Integer> v) {
            this.years = orEmpty(v);
            return this;
        }

        public Builder weeks(Collection<Integer> v) {
            this.weeks = orEmpty(v);
            return this;
        }

        public Builder organizations(Collection<String> v) {
            this.organizations = orEmpty(v);
            return this;
        }

        public Builder insuranceTypes(Collection<InsuranceType> v) {
            this.insuranceTypes = orEmpty(v);
            return this;
        }

        public Builder businessTypes(Collection<String> v) {
            this.businessTypes = orEmpty(v);
            return this;
        }

        public Builder coverageTypes(Collection<CoverageType> v) {
            this.coverageTypes = orEmpty(v);
            return this;
        }

        public Builder customerCategories(Collection<String> v) {
            this.customerCategories = orEmpty(v);
            return this;
        }

        public Builder vehicleGrades(Collection<VehicleGrade> v) {
            this.vehicleGrades = orEmpty(v);
            return this;
        }

        public Builder terminalSources(Collection<String> v) {
            this.terminalSources = orEmpty(v);
            return this;
        }

        public Builder renewalStatuses(Collection<RenewalStatus> v) {
            this.renewalStatuses = orEmpty(v);
            return this;
        }

        public Builder newEnergy(NewEnergyFilter v) {
            this.newEnergy = v;
            return this;
        }

        public Builder viewMode(ViewMode v) {
            this.viewMode = v;
            return this;
        }

        public Builder singleModeWeek(Integer v) {
            this.singleModeWeek = v;
            return this;
        }

        public Builder trendModeWeeks(Collection<Integer> v) {
            this.trendModeWeeks = orEmpty(v);
            return this;
        }

        public Builder dataViewType(DataViewType v) {
            this.dataViewType = v;
            return this;
        }

        /**
         * @return a new immutable {@link FilterState}
         * @throws NullPointerException if an enum setting was set to {@code null}
         *                              or a collection contains {@code null}
         */
        public FilterState build() {
            return new FilterState(this);
        }

        private static <T> Collection<T> orEmpty(Collection<T> values) {
            return values != null ? values : List.of();
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static <T> Set<T> freeze(Collection<T> values) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(
                values.stream().map(v -> Objects.requireNonNull(v, "Filter values must not be null")).toList()));
    }

    private static Set<Integer> shift(Collection<Integer> weekValues) {
        return weekValues.stream()
                .map(w -> w - 1)
                .filter(w -> w >= 1)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof FilterState that))
            return false;
        return years.equals(that.years)
                && weeks.equals(that.weeks)
                && organizations.equals(that.organizations)
                && insuranceTypes.equals(that.insuranceTypes)
                && businessTypes.equals(that.businessTypes)
                && coverageTypes.equals(that.coverageTypes)
                && customerCategories.equals(that.customerCategories)
                && vehicleGrades.equals(that.vehicleGrades)
                && terminalSources.equals(that.terminalSources)
                && renewalStatuses.equals(that.renewalStatuses)
                && newEnergy == that.newEnergy
                && viewMode == that.viewMode
                && Objects.equals(singleModeWeek, that.singleModeWeek)
                && trendModeWeeks.equals(that.trendModeWeeks)
                && dataViewType == that.dataViewType;
    }

    @Override
    public int hashCode() {
        return Objects.hash(years, weeks, organizations, insuranceTypes, businessTypes, coverageTypes,
                customerCategories, vehicleGrades, terminalSources, renewalStatuses, newEnergy, viewMode,
                singleModeWeek, trendModeWeeks, dataViewType);
    }

    @Override
    public String toString() {
        return "FilterState{" +
                "years=" + years +
                ", weeks=" + weeks +
                ", organizations=" + organizations +
                ", insuranceTypes=" + insuranceTypes +
                ", businessTypes=" + businessTypes +
                ", coverageTypes=" + coverageTypes +
                ", customerCategories=" + customerCategories +
                ", vehicleGrades=" + vehicleGrades +
                ", terminalSources=" + terminalSources +
                ", renewalStatuses=" + renewalStatuses +
                ", newEnergy=" + newEnergy +
                ", viewMode=" + viewMode +
                ", singleModeWeek=" + singleModeWeek +
                ", trendModeWeeks=" + trendModeWeeks +
                ", dataViewType=" + dataViewType +
                '}';
    }
}
