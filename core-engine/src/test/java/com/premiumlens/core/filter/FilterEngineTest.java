package com.premiumlens.core.filter;

import com.premiumlens.core.model.FilterState;
import com.premiumlens.core.model.InsuranceRecord;
import com.premiumlens.core.model.InsuranceType;
import com.premiumlens.core.model.NewEnergyFilter;
import com.premiumlens.core.model.TestRecords;
import com.premiumlens.core.model.VehicleGrade;
import com.premiumlens.core.model.ViewMode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link FilterEngine}.
 */
class FilterEngineTest {

    private InsuranceRecord tianfu24;
    private InsuranceRecord gaoxin24;
    private InsuranceRecord tianfu25;
    private InsuranceRecord ungraded23;
    private List<InsuranceRecord> records;

    @BeforeEach
    void setUp() {
        tianfu24 = TestRecords.record().build();
        gaoxin24 = TestRecords.record()
                .thirdLevelOrganization("高新")
                .insuranceType(InsuranceType.COMPULSORY)
                .newEnergyVehicle(true)
                .vehicleInsuranceGrade(VehicleGrade.B)
                .build();
        tianfu25 = TestRecords.record().weekNumber(25).build();
        ungraded23 = TestRecords.record().weekNumber(23).policyStartYear(2023).vehicleInsuranceGrade(null).build();
        records = List.of(tianfu24, gaoxin24, tianfu25, ungraded23);
    }

    @Test
    @DisplayName("Should pass every record through an empty filter state")
    void shouldPassEverythingThroughEmptyState() {
        assertThat(FilterEngine.filter(records, FilterState.empty())).containsExactlyElementsOf(records);
    }

    @Test
    @DisplayName("Should AND the dimensions together")
    void shouldCombineDimensions() {
        FilterState state = FilterState.builder()
                .organizations(Set.of("天府"))
                .weeks(Set.of(24, 25))
                .build();

        assertThat(FilterEngine.filter(records, state)).containsExactly(tianfu24, tianfu25);
    }

    @Test
    @DisplayName("Should apply the single-mode week over the plain week set")
    void shouldUseEffectiveWeeks() {
        FilterState state = FilterState.builder()
                .weeks(Set.of(23))
                .viewMode(ViewMode.SINGLE)
                .singleModeWeek(25)
                .build();

        assertThat(FilterEngine.filter(records, state)).containsExactly(tianfu25);
    }

    @Test
    @DisplayName("Should exclude records without a grade when grades are selected")
    void shouldExcludeNullGrade() {
        FilterState state = FilterState.builder().vehicleGrades(Set.of(VehicleGrade.A)).build();

        assertThat(FilterEngine.filter(records, state)).containsExactly(tianfu24, tianfu25);
    }

    @Test
    @DisplayName("Should apply the tri-state new-energy filter")
    void shouldFilterNewEnergy() {
        FilterState only = FilterState.builder().newEnergy(NewEnergyFilter.NEW_ENERGY_ONLY).build();
        FilterState conventional = FilterState.builder().newEnergy(NewEnergyFilter.CONVENTIONAL_ONLY).build();

        assertThat(FilterEngine.filter(records, only)).containsExactly(gaoxin24);
        assertThat(FilterEngine.filter(records, conventional)).doesNotContain(gaoxin24).hasSize(3);
    }

    @Test
    @DisplayName("Should skip excluded dimensions")
    void shouldSkipExcludedDimensions() {
        FilterState state = FilterState.builder()
                .organizations(Set.of("高新"))
                .insuranceTypes(Set.of(InsuranceType.COMMERCIAL))
                .build();

        assertThat(FilterEngine.filter(records, state)).isEmpty();
        assertThat(FilterEngine.filter(records, state, EnumSet.of(FilterDimension.INSURANCE_TYPE)))
                .containsExactly(gaoxin24);
    }

    @Test
    @DisplayName("Should replace the week selection for single weeks and ranges")
    void shouldSelectWeeks() {
        FilterState state = FilterState.builder().singleModeWeek(24).organizations(Set.of("天府")).build();

        assertThat(FilterEngine.forWeek(records, state, 25)).containsExactly(tianfu25);
        assertThat(FilterEngine.forWeekRange(records, state, 23, 24)).containsExactly(tianfu24, ungraded23);
        assertThatThrownBy(() -> FilterEngine.forWeekRange(records, state, 25, 24))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should list cascading options ignoring the dimension's own selection")
    void shouldListAvailableValues() {
        FilterState state = FilterState.builder()
                .organizations(Set.of("天府"))
                .weeks(Set.of(24))
                .build();

        assertThat(FilterEngine.availableValues(records, state, FilterDimension.ORGANIZATION))
                .containsExactly("天府", "高新");
        assertThat(FilterEngine.availableValues(records, state, FilterDimension.WEEK))
                .containsExactly(25, 24, 23);
        assertThat(FilterEngine.availableValues(records, FilterState.empty(), FilterDimension.YEAR))
                .containsExactly(2024, 2023);
    }

    @Test
    @DisplayName("Should order enum options by declaration and omit missing grades")
    void shouldOrderEnumOptions() {
        assertThat(FilterEngine.availableValues(records, FilterState.empty(), FilterDimension.INSURANCE_TYPE))
                .containsExactly(InsuranceType.COMMERCIAL, InsuranceType.COMPULSORY);
        assertThat(FilterEngine.availableValues(records, FilterState.empty(), FilterDimension.VEHICLE_GRADE))
                .containsExactly(VehicleGrade.A, VehicleGrade.B);
        assertThat(FilterEngine.availableValues(records, FilterState.empty(), FilterDimension.NEW_ENERGY))
                .containsExactly(false, true);
    }
}
