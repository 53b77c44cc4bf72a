package com.premiumlens.core.ingest;

import com.premiumlens.core.config.EngineConfig;
import com.premiumlens.core.model.Branch;
import com.premiumlens.core.model.CoverageType;
import com.premiumlens.core.model.HighwayRiskGrade;
import com.premiumlens.core.model.InsuranceRecord;
import com.premiumlens.core.model.InsuranceType;
import com.premiumlens.core.model.LabeledValue;
import com.premiumlens.core.model.RenewalStatus;
import com.premiumlens.core.model.TruckScore;
import com.premiumlens.core.model.VehicleGrade;
import com.premiumlens.core.normalize.RecordNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Turns the raw cell values of one CSV row into an {@link InsuranceRecord}.
 *
 * <h3>Error accumulation</h3>
 * <p>
 * Every field is checked even after an earlier field failed, so a rejected
 * row reports all of its problems at once. <em>Errors</em> reject the row;
 * <em>warnings</em> flag a value that was repaired or defaulted and keep the
 * row.
 * </p>
 *
 * <h3>Categorical values</h3>
 * <p>
 * Resolution order: canonical label, alias table from the
 * {@link EngineConfig}, closest label by Levenshtein similarity (with a
 * warning), and finally the column default (with a warning). A blank value
 * takes the default silently. Optional grade columns map blank and unknown
 * values to {@code null}; unknown ones warn.
 * </p>
 *
 * <p>
 * Instances are immutable and may be shared between threads.
 * </p>
 *
 * @since 1.0.0
 */
public class RecordValidator {

    private static final Logger LOG = LoggerFactory.getLogger(RecordValidator.class);

    static final LocalDate EARLIEST_SNAPSHOT = LocalDate.of(2020, 1, 1);
    static final double MAX_PREMIUM_YUAN = 10_000_000;
    static final int MIN_YEAR = 2020;
    static final int MAX_YEAR = 2030;
    static final int MIN_WEEK = 1;
    static final int MAX_WEEK = 105;
    static final long MAX_COUNT = Integer.MAX_VALUE;

    private static final Pattern ISO_DATE = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    private static final Set<String> TRUTHY = Set.of("true", "1", "yes", "y", "是");
    private static final Set<String> FALSY = Set.of("false", "0", "no", "n", "否");

    private final EngineConfig config;
    private final Clock clock;

    /**
     * @param config engine configuration supplying alias tables and the
     *               fuzzy-match threshold
     * @param clock  source of "today" for the snapshot date upper bound
     */
    public RecordValidator(EngineConfig config, Clock clock) {
        this.config = Objects.requireNonNull(config, "EngineConfig must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
    }

    /**
     * Validate one row.
     *
     * @param cells accessor returning the raw cell of a column; a missing cell
     *              may be returned as {@code null} or empty
     * @return the outcome, never {@code null}
     */
    public RowOutcome validate(Function<CsvColumn, String> cells) {
        Objects.requireNonNull(cells, "Cell accessor must not be null");
        Row row = new Row(cells);

        LocalDate snapshotDate = row.date(CsvColumn.SNAPSHOT_DATE);
        long year = row.requiredInteger(CsvColumn.POLICY_START_YEAR, MIN_YEAR, MAX_YEAR);
        long week = row.requiredInteger(CsvColumn.WEEK_NUMBER, MIN_WEEK, MAX_WEEK);

        Branch branch = row.category(CsvColumn.CHENGDU_BRANCH, Branch.class, Branch.CHENGDU);
        InsuranceType insuranceType = row.category(CsvColumn.INSURANCE_TYPE, InsuranceType.class,
                InsuranceType.COMMERCIAL);
        CoverageType coverageType = row.category(CsvColumn.COVERAGE_TYPE, CoverageType.class, CoverageType.FULL);
        RenewalStatus renewalStatus = row.category(CsvColumn.RENEWAL_STATUS, RenewalStatus.class,
                RenewalStatus.NEW);

        String organization = row.requiredText(CsvColumn.THIRD_LEVEL_ORGANIZATION);
        String customer = row.requiredText(CsvColumn.CUSTOMER_CATEGORY_3);
        String business = row.requiredText(CsvColumn.BUSINESS_TYPE_CATEGORY);
        String terminal = row.requiredText(CsvColumn.TERMINAL_SOURCE);

        boolean newEnergy = row.bool(CsvColumn.IS_NEW_ENERGY_VEHICLE);
        boolean transferred = row.bool(CsvColumn.IS_TRANSFERRED_VEHICLE);

        VehicleGrade vehicleGrade = row.grade(CsvColumn.VEHICLE_INSURANCE_GRADE, VehicleGrade.class);
        HighwayRiskGrade highwayGrade = row.grade(CsvColumn.HIGHWAY_RISK_GRADE, HighwayRiskGrade.class);
        TruckScore largeTruck = row.grade(CsvColumn.LARGE_TRUCK_SCORE, TruckScore.class);
        TruckScore smallTruck = row.grade(CsvColumn.SMALL_TRUCK_SCORE, TruckScore.class);

        Double signed = row.number(CsvColumn.SIGNED_PREMIUM_YUAN, 0.0, MAX_PREMIUM_YUAN);
        Double matured = row.number(CsvColumn.MATURED_PREMIUM_YUAN, 0.0, MAX_PREMIUM_YUAN);
        long policyCount = row.count(CsvColumn.POLICY_COUNT);
        long claimCount = row.count(CsvColumn.CLAIM_CASE_COUNT);
        Double claimPayment = row.number(CsvColumn.REPORTED_CLAIM_PAYMENT_YUAN, 0.0, null);
        Double expense = row.number(CsvColumn.EXPENSE_AMOUNT_YUAN, 0.0, null);
        Double beforeDiscount = row.number(CsvColumn.COMMERCIAL_PREMIUM_BEFORE_DISCOUNT_YUAN, 0.0, null);
        Double premiumPlan = row.optionalNumber(CsvColumn.PREMIUM_PLAN_YUAN, 0.0);
        Double contribution = row.number(CsvColumn.MARGINAL_CONTRIBUTION_AMOUNT_YUAN, null, null);

        if (signed != null && matured != null && matured > signed) {
            row.error(String.format(Locale.ROOT,
                    "matured_premium_yuan: %s exceeds signed_premium_yuan %s",
                    plain(matured), plain(signed)));
        }

        if (!row.errors.isEmpty()) {
            LOG.trace("Row rejected: {}", row.errors);
            return new RowOutcome(null, row.errors, row.warnings);
        }

        InsuranceRecord record = InsuranceRecord.builder()
                .snapshotDate(snapshotDate)
                .policyStartYear((int) year)
                .weekNumber((int) week)
                .chengduBranch(branch)
                .thirdLevelOrganization(organization)
                .customerCategory(customer)
                .insuranceType(insuranceType)
                .businessTypeCategory(business)
                .coverageType(coverageType)
                .renewalStatus(renewalStatus)
                .newEnergyVehicle(newEnergy)
                .transferredVehicle(transferred)
                .vehicleInsuranceGrade(vehicleGrade)
                .highwayRiskGrade(highwayGrade)
                .largeTruckScore(largeTruck)
                .smallTruckScore(smallTruck)
                .terminalSource(terminal)
                .signedPremiumYuan(signed)
                .maturedPremiumYuan(matured)
                .policyCount(policyCount)
                .claimCaseCount(claimCount)
                .reportedClaimPaymentYuan(claimPayment)
                .expenseAmountYuan(expense)
                .commercialPremiumBeforeDiscountYuan(beforeDiscount)
                .premiumPlanYuan(premiumPlan)
                .marginalContributionAmountYuan(contribution)
                .build();
        return new RowOutcome(record, row.errors, row.warnings);
    }

    // ---------------------------------------------------------------
    // Per-row state
    // ---------------------------------------------------------------

    /**
     * Cell access plus the error and warning sinks of the row being
     * validated.
     */
    private final class Row {
        private final Function<CsvColumn, String> cells;
        private final List<String> errors = new ArrayList<>();
        private final List<String> warnings = new ArrayList<>();

        Row(Function<CsvColumn, String> cells) {
            this.cells = cells;
        }

        void error(String message) {
            errors.add(message);
        }

        void warning(String message) {
            warnings.add(message);
        }

        String raw(CsvColumn column) {
            String value = cells.apply(column);
            return value == null ? "" : value.strip();
        }

        LocalDate date(CsvColumn column) {
            String value = raw(column);
            if (value.isEmpty()) {
                error(column.header() + ": required");
                return null;
            }
            if (!ISO_DATE.matcher(value).matches()) {
                error(column.header() + ": invalid date \"" + value + "\", expected YYYY-MM-DD");
                return null;
            }
            LocalDate date;
            try {
                date = LocalDate.parse(value);
            } catch (DateTimeParseException e) {
                error(column.header() + ": \"" + value + "\" is not a calendar date");
                return null;
            }
            LocalDate today = LocalDate.now(clock);
            if (date.isBefore(EARLIEST_SNAPSHOT) || date.isAfter(today)) {
                error(column.header() + ": " + date + " is outside [" + EARLIEST_SNAPSHOT + ", " + today + "]");
                return null;
            }
            return date;
        }

        String requiredText(CsvColumn column) {
            String value = RecordNormalizer.normalizeText(raw(column));
            if (value.isEmpty()) {
                error(column.header() + ": required");
            }
            return value;
        }

        long requiredInteger(CsvColumn column, long min, long max) {
            if (raw(column).isEmpty()) {
                error(column.header() + ": required");
                return 0;
            }
            Double value = parse(column, true, (double) min, (double) max);
            return value == null ? 0 : value.longValue();
        }

        long count(CsvColumn column) {
            Double value = parse(column, true, 0.0, (double) MAX_COUNT);
            return value == null ? 0 : value.longValue();
        }

        Double number(CsvColumn column, Double min, Double max) {
            return parse(column, false, min, max);
        }

        Double optionalNumber(CsvColumn column, Double min) {
            if (raw(column).isEmpty()) {
                return null;
            }
            return parse(column, false, min, null);
        }

        /**
         * @return parsed value (0 for a blank cell), or {@code null} when an
         *         error was recorded
         */
        Double parse(CsvColumn column, boolean integer, Double min, Double max) {
            String value = raw(column);
            if (value.isEmpty()) {
                return 0.0;
            }
            String compact = value.replace(",", "");
            if (!DECIMAL.matcher(compact).matches()) {
                error(column.header() + ": invalid number \"" + value + "\"");
                return null;
            }
            double number = Double.parseDouble(compact);
            if (!Double.isFinite(number)) {
                error(column.header() + ": invalid number \"" + value + "\"");
                return null;
            }
            boolean valid = true;
            if (integer && number != Math.rint(number)) {
                error(column.header() + ": must be an integer, got \"" + value + "\"");
                valid = false;
            }
            if (min != null && number < min) {
                error(column.header() + ": " + plain(number) + " is below the minimum " + plain(min));
                valid = false;
            }
            if (max != null && number > max) {
                error(column.header() + ": \"" + value + "\" is above the maximum " + plain(max));
                valid = false;
            }
            return valid ? number : null;
        }

        boolean bool(CsvColumn column) {
            String value = raw(column);
            if (value.equals("True")) {
                return true;
            }
            if (value.equals("False")) {
                return false;
            }
            String token = value.toLowerCase(Locale.ROOT);
            if (TRUTHY.contains(token)) {
                warning(column.header() + ": non-canonical boolean \"" + value + "\" read as True");
                return true;
            }
            if (FALSY.contains(token)) {
                warning(column.header() + ": non-canonical boolean \"" + value + "\" read as False");
                return false;
            }
            warning(column.header() + ": unrecognized boolean \"" + value + "\", defaulted to False");
            return false;
        }

        <E extends Enum<E> & LabeledValue> E category(CsvColumn column, Class<E> type, E defaultValue) {
            String value = RecordNormalizer.normalizeText(raw(column));
            if (value.isEmpty()) {
                return defaultValue;
            }
            Optional<E> exact = LabeledValue.fromLabel(type, value);
            if (exact.isPresent()) {
                return exact.get();
            }
            Map<String, String> aliases = config.aliasesFor(column.header());
            String aliased = aliases.get(value);
            if (aliased != null) {
                Optional<E> viaAlias = LabeledValue.fromLabel(type, aliased);
                if (viaAlias.isPresent()) {
                    return viaAlias.get();
                }
            }

            Set<String> candidates = new LinkedHashSet<>();
            Arrays.stream(type.getEnumConstants()).map(LabeledValue::label).forEach(candidates::add);
            candidates.addAll(aliases.keySet());
            Optional<E> fuzzy = FuzzyMatcher.bestMatch(value, candidates, config.getFuzzyMatchThreshold())
                    .map(match -> aliases.getOrDefault(match, match))
                    .flatMap(label -> LabeledValue.fromLabel(type, label));
            if (fuzzy.isPresent()) {
                warning(column.header() + ": \"" + value + "\" corrected to \"" + fuzzy.get().label() + "\"");
                return fuzzy.get();
            }

            warning(column.header() + ": unknown value \"" + value + "\", defaulted to \""
                    + defaultValue.label() + "\"");
            return defaultValue;
        }

        <E extends Enum<E> & LabeledValue> E grade(CsvColumn column, Class<E> type) {
            String value = RecordNormalizer.normalizeText(raw(column));
            if (value.isEmpty()) {
                return null;
            }
            Optional<E> grade = LabeledValue.fromLabel(type, value.toUpperCase(Locale.ROOT));
            if (grade.isEmpty()) {
                warning(column.header() + ": unknown grade \"" + value + "\", left empty");
                return null;
            }
            return grade.get();
        }
    }

    private static String plain(double value) {
        return value == Math.rint(value) && Math.abs(value) < 1e15
                ? String.valueOf((long) value)
                : String.valueOf(value);
    }
}
