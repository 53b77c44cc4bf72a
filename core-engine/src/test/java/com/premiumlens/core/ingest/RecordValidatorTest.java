package com.premiumlens.core.ingest;

import com.premiumlens.core.config.EngineConfig;
import com.premiumlens.core.model.InsuranceRecord;
import com.premiumlens.core.model.InsuranceType;
import com.premiumlens.core.model.RenewalStatus;
import com.premiumlens.core.model.VehicleGrade;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.InstanceOfAssertFactories.STRING;

/**
 * Unit tests for {@link RecordValidator}.
 */
class RecordValidatorTest {

    private RecordValidator validator;
    private Map<CsvColumn, String> row;

    @BeforeEach
    void setUp() {
        validator = new RecordValidator(EngineConfig.defaults(), IngestFixtures.CLOCK);
        row = IngestFixtures.validRow();
    }

    @Test
    @DisplayName("Should accept a clean row without warnings")
    void shouldAcceptCleanRow() {
        RowOutcome outcome = validate();

        assertThat(outcome.isValid()).isTrue();
        assertThat(outcome.getWarnings()).isEmpty();
        InsuranceRecord record = outcome.getRecord().orElseThrow();
        assertThat(record.getSnapshotDate()).isEqualTo(LocalDate.of(2024, 6, 15));
        assertThat(record.getWeekNumber()).isEqualTo(24);
        assertThat(record.getInsuranceType()).isEqualTo(InsuranceType.COMMERCIAL);
        assertThat(record.getRenewalStatus()).isEqualTo(RenewalStatus.RENEWAL);
        assertThat(record.getVehicleInsuranceGrade()).isEqualTo(VehicleGrade.A);
        assertThat(record.getHighwayRiskGrade()).isNull();
        assertThat(record.getSignedPremiumYuan()).isEqualTo(100_000);
        assertThat(record.getPremiumPlanYuan()).isEqualTo(500_000.0);
    }

    // ------------------------------------------------------------------
    // Categorical values
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Should resolve a configured alias silently")
    void shouldResolveAlias() {
        row.put(CsvColumn.INSURANCE_TYPE, "交强保险");

        RowOutcome outcome = validate();

        assertThat(outcome.getRecord().orElseThrow().getInsuranceType()).isEqualTo(InsuranceType.COMPULSORY);
        assertThat(outcome.getWarnings()).isEmpty();
    }

    @Test
    @DisplayName("Should correct a near miss with a warning")
    void shouldCorrectNearMiss() {
        row.put(CsvColumn.INSURANCE_TYPE, "商业线");

        RowOutcome outcome = validate();

        assertThat(outcome.getRecord().orElseThrow().getInsuranceType()).isEqualTo(InsuranceType.COMMERCIAL);
        assertThat(outcome.getWarnings()).singleElement(STRING)
                .contains("insurance_type")
                .contains("corrected to \"商业险\"");
    }

    @Test
    @DisplayName("Should default an unknown value with a warning")
    void shouldDefaultUnknownValue() {
        row.put(CsvColumn.RENEWAL_STATUS, "不知道");

        RowOutcome outcome = validate();

        assertThat(outcome.getRecord().orElseThrow().getRenewalStatus()).isEqualTo(RenewalStatus.NEW);
        assertThat(outcome.getWarnings()).singleElement(STRING).contains("defaulted to \"新保\"");
    }

    @Test
    @DisplayName("Should default a blank categorical value silently")
    void shouldDefaultBlankValueSilently() {
        row.put(CsvColumn.INSURANCE_TYPE, " ");

        RowOutcome outcome = validate();

        assertThat(outcome.getRecord().orElseThrow().getInsuranceType()).isEqualTo(InsuranceType.COMMERCIAL);
        assertThat(outcome.getWarnings()).isEmpty();
    }

    @Test
    @DisplayName("Should leave an unknown grade empty with a warning and accept lower case")
    void shouldHandleGrades() {
        row.put(CsvColumn.VEHICLE_INSURANCE_GRADE, "Z");
        row.put(CsvColumn.HIGHWAY_RISK_GRADE, "b");

        RowOutcome outcome = validate();

        InsuranceRecord record = outcome.getRecord().orElseThrow();
        assertThat(record.getVehicleInsuranceGrade()).isNull();
        assertThat(record.getHighwayRiskGrade()).hasToString("B");
        assertThat(outcome.getWarnings()).singleElement(STRING).contains("unknown grade \"Z\"");
    }

    // ------------------------------------------------------------------
    // Booleans
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Should read non-canonical booleans with a warning")
    void shouldReadNonCanonicalBooleans() {
        row.put(CsvColumn.IS_NEW_ENERGY_VEHICLE, "是");
        row.put(CsvColumn.IS_TRANSFERRED_VEHICLE, "NO");

        RowOutcome outcome = validate();

        InsuranceRecord record = outcome.getRecord().orElseThrow();
        assertThat(record.isNewEnergyVehicle()).isTrue();
        assertThat(record.isTransferredVehicle()).isFalse();
        assertThat(outcome.getWarnings()).hasSize(2).allMatch(w -> w.contains("non-canonical boolean"));
    }

    @Test
    @DisplayName("Should default an unrecognized boolean to False with a warning")
    void shouldDefaultUnrecognizedBoolean() {
        row.put(CsvColumn.IS_NEW_ENERGY_VEHICLE, "maybe");

        RowOutcome outcome = validate();

        assertThat(outcome.isValid()).isTrue();
        assertThat(outcome.getRecord().orElseThrow().isNewEnergyVehicle()).isFalse();
        assertThat(outcome.getWarnings()).singleElement(STRING).contains("unrecognized boolean");
    }

    // ------------------------------------------------------------------
    // Numbers and cross-field rules
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Should parse thousands separators and treat blanks as zero")
    void shouldParseNumbers() {
        row.put(CsvColumn.SIGNED_PREMIUM_YUAN, "1,200");
        row.put(CsvColumn.MATURED_PREMIUM_YUAN, "");
        row.put(CsvColumn.PREMIUM_PLAN_YUAN, "");

        InsuranceRecord record = validate().getRecord().orElseThrow();

        assertThat(record.getSignedPremiumYuan()).isEqualTo(1_200);
        assertThat(record.getMaturedPremiumYuan()).isZero();
        assertThat(record.getPremiumPlanYuan()).isNull();
    }

    @Test
    @DisplayName("Should accept a negative marginal contribution")
    void shouldAcceptNegativeContribution() {
        row.put(CsvColumn.MARGINAL_CONTRIBUTION_AMOUNT_YUAN, "-2500.5");

        assertThat(validate().getRecord().orElseThrow().getMarginalContributionAmountYuan()).isEqualTo(-2500.5);
    }

    @Test
    @DisplayName("Should quote the literal of a non-numeric value")
    void shouldRejectNonNumeric() {
        row.put(CsvColumn.SIGNED_PREMIUM_YUAN, "abc");

        RowOutcome outcome = validate();

        assertThat(outcome.isValid()).isFalse();
        assertThat(outcome.getRecord()).isEmpty();
        assertThat(outcome.getErrors()).singleElement(STRING)
                .isEqualTo("signed_premium_yuan: invalid number \"abc\"");
    }

    @Test
    @DisplayName("Should reject fractional counts and out-of-range weeks")
    void shouldRejectIntegerViolations() {
        row.put(CsvColumn.POLICY_COUNT, "1.5");
        row.put(CsvColumn.WEEK_NUMBER, "0");

        RowOutcome outcome = validate();

        assertThat(outcome.getErrors()).hasSize(2);
        assertThat(outcome.getErrors()).anyMatch(e -> e.startsWith("policy_count: must be an integer"));
        assertThat(outcome.getErrors()).anyMatch(e -> e.startsWith("week_number: 0 is below the minimum 1"));
    }

    @Test
    @DisplayName("Should reject a count too large to store and quote its literal")
    void shouldRejectOversizedCount() {
        row.put(CsvColumn.POLICY_COUNT, "1e30");
        row.put(CsvColumn.CLAIM_CASE_COUNT, "2147483648");

        RowOutcome outcome = validate();

        assertThat(outcome.isValid()).isFalse();
        assertThat(outcome.getErrors()).containsExactlyInAnyOrder(
                "policy_count: \"1e30\" is above the maximum 2147483647",
                "claim_case_count: \"2147483648\" is above the maximum 2147483647");
    }

    @Test
    @DisplayName("Should accept the largest storable count")
    void shouldAcceptLargestCount() {
        row.put(CsvColumn.POLICY_COUNT, "2,147,483,647");

        RowOutcome outcome = validate();

        assertThat(outcome.getErrors()).isEmpty();
        assertThat(outcome.getRecord()).hasValueSatisfying(
                r -> assertThat(r.getPolicyCount()).isEqualTo(2_147_483_647L));
    }

    @Test
    @DisplayName("Should reject matured premium above signed premium")
    void shouldRejectMaturedAboveSigned() {
        row.put(CsvColumn.SIGNED_PREMIUM_YUAN, "1000");
        row.put(CsvColumn.MATURED_PREMIUM_YUAN, "2000");

        assertThat(validate().getErrors()).singleElement(STRING)
                .isEqualTo("matured_premium_yuan: 2000 exceeds signed_premium_yuan 1000");
    }

    @Test
    @DisplayName("Should report every error of a row, not just the first")
    void shouldAccumulateErrors() {
        row.put(CsvColumn.SNAPSHOT_DATE, "");
        row.put(CsvColumn.THIRD_LEVEL_ORGANIZATION, "");
        row.put(CsvColumn.CLAIM_CASE_COUNT, "-1");
        row.put(CsvColumn.IS_NEW_ENERGY_VEHICLE, "Y");

        RowOutcome outcome = validate();

        assertThat(outcome.getErrors()).hasSize(3);
        assertThat(outcome.getWarnings()).hasSize(1);
    }

    // ------------------------------------------------------------------
    // Dates
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Should reject malformed, impossible and out-of-window dates")
    void shouldRejectBadDates() {
        assertThat(errorFor(CsvColumn.SNAPSHOT_DATE, "2024/06/15")).contains("expected YYYY-MM-DD");
        assertThat(errorFor(CsvColumn.SNAPSHOT_DATE, "2024-02-30")).contains("is not a calendar date");
        assertThat(errorFor(CsvColumn.SNAPSHOT_DATE, "2025-01-01")).contains("is outside");
        assertThat(errorFor(CsvColumn.SNAPSHOT_DATE, "2019-12-31")).contains("is outside");
    }

    @Test
    @DisplayName("Should normalize free text before storing it")
    void shouldNormalizeText() {
        row.put(CsvColumn.THIRD_LEVEL_ORGANIZATION, "  天府 ");
        row.put(CsvColumn.TERMINAL_SOURCE, "０１０１柜面");

        InsuranceRecord record = validate().getRecord().orElseThrow();

        assertThat(record.getThirdLevelOrganization()).isEqualTo("天府");
        assertThat(record.getTerminalSource()).isEqualTo("0101柜面");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private RowOutcome validate() {
        return validator.validate(row::get);
    }

    private String errorFor(CsvColumn column, String value) {
        row.put(column, value);
        RowOutcome outcome = validate();
        assertThat(outcome.getErrors()).hasSize(1);
        return outcome.getErrors().get(0);
    }
}
