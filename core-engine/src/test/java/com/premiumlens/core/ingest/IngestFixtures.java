package com.premiumlens.core.ingest;

import com.premiumlens.core.config.EngineConfig;
import com.premiumlens.core.config.EngineConfigLoader;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.Map;

/**
 * Shared inputs for the ingest tests.
 */
final class IngestFixtures {

    /** Late enough that every fixture date lies in the past. */
    static final Clock CLOCK = Clock.fixed(Instant.parse("2024-12-31T00:00:00Z"), ZoneOffset.UTC);

    private IngestFixtures() {
        // utility class
    }

    static EngineConfig testConfig() {
        return EngineConfigLoader.fromClasspath("test-engine.yml");
    }

    static byte[] sampleWeek() {
        try (InputStream is = IngestFixtures.class.getClassLoader()
                .getResourceAsStream("fixtures/sample-week.csv")) {
            if (is == null) {
                throw new IllegalStateException("fixtures/sample-week.csv missing from the test classpath");
            }
            return is.readAllBytes();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * @return cells of a clean, fully valid row keyed by column
     */
    static Map<CsvColumn, String> validRow() {
        Map<CsvColumn, String> row = new EnumMap<>(CsvColumn.class);
        row.put(CsvColumn.SNAPSHOT_DATE, "2024-06-15");
        row.put(CsvColumn.POLICY_START_YEAR, "2024");
        row.put(CsvColumn.BUSINESS_TYPE_CATEGORY, "非营业客车");
        row.put(CsvColumn.CHENGDU_BRANCH, "成都");
        row.put(CsvColumn.THIRD_LEVEL_ORGANIZATION, "天府");
        row.put(CsvColumn.CUSTOMER_CATEGORY_3, "非营业个人客车");
        row.put(CsvColumn.INSURANCE_TYPE, "商业险");
        row.put(CsvColumn.IS_NEW_ENERGY_VEHICLE, "False");
        row.put(CsvColumn.COVERAGE_TYPE, "主全");
        row.put(CsvColumn.IS_TRANSFERRED_VEHICLE, "False");
        row.put(CsvColumn.RENEWAL_STATUS, "续保");
        row.put(CsvColumn.VEHICLE_INSURANCE_GRADE, "A");
        row.put(CsvColumn.HIGHWAY_RISK_GRADE, "");
        row.put(CsvColumn.LARGE_TRUCK_SCORE, "");
        row.put(CsvColumn.SMALL_TRUCK_SCORE, "");
        row.put(CsvColumn.TERMINAL_SOURCE, "直销");
        row.put(CsvColumn.SIGNED_PREMIUM_YUAN, "100000");
        row.put(CsvColumn.MATURED_PREMIUM_YUAN, "80000");
        row.put(CsvColumn.POLICY_COUNT, "10");
        row.put(CsvColumn.CLAIM_CASE_COUNT, "2");
        row.put(CsvColumn.REPORTED_CLAIM_PAYMENT_YUAN, "20000");
        row.put(CsvColumn.EXPENSE_AMOUNT_YUAN, "15000");
        row.put(CsvColumn.COMMERCIAL_PREMIUM_BEFORE_DISCOUNT_YUAN, "120000");
        row.put(CsvColumn.PREMIUM_PLAN_YUAN, "500000");
        row.put(CsvColumn.MARGINAL_CONTRIBUTION_AMOUNT_YUAN, "10000");
        row.put(CsvColumn.WEEK_NUMBER, "24");
        return row;
    }
}
