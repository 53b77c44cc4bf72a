package com.premiumlens.batch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.premiumlens.core.config.EngineConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * End-to-end tests for {@link PremiumLensImport#run}.
 */
class PremiumLensImportTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-12-31T00:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path dir;

    private final ObjectMapper mapper = new ObjectMapper();
    private ByteArrayOutputStream stdout;
    private Map<String, String> env;

    @BeforeEach
    void setUp() {
        stdout = new ByteArrayOutputStream();
        env = new HashMap<>();
    }

    @Test
    @DisplayName("Should import a file and write the report to REPORT_PATH")
    void shouldWriteReportFile() throws IOException {
        Path csv = Files.write(dir.resolve("week24.csv"), ImportMetricsTest.sampleWeek());
        Path reportPath = dir.resolve("reports").resolve("import.json");
        env.put("REPORT_PATH", reportPath.toString());
        env.put("IMPORT_MODE", "sequential");

        int code = run(csv.toString());

        assertThat(code).isEqualTo(PremiumLensImport.EXIT_OK);
        assertThat(stdout.size()).isZero();

        JsonNode report = mapper.readTree(reportPath.toFile());
        assertThat(report.get("generated_at").asText()).isEqualTo("2024-12-31T00:00:00Z");
        assertThat(report.get("mode").asText()).isEqualTo("SEQUENTIAL");

        JsonNode file = report.get("files").get(0);
        assertThat(file.get("status").asText()).isEqualTo("imported");
        assertThat(file.get("encoding").asText()).isEqualTo("utf-8");
        assertThat(file.get("stats").get("validRows").asInt()).isEqualTo(4);
        assertThat(file.get("errors").get(0).get("row").asInt()).isEqualTo(5);
        assertThat(file.get("warning_count").asInt()).isEqualTo(1);
        assertThat(file.has("failure")).isFalse();

        JsonNode totals = report.get("totals");
        assertThat(totals.get("total_rows").asInt()).isEqualTo(5);
        assertThat(totals.get("valid_rows").asInt()).isEqualTo(4);
        assertThat(totals.get("invalid_rows").asInt()).isEqualTo(1);

        assertThat(report.get("kpi_week").asInt()).isEqualTo(25);
        assertThat(report.get("kpi").get("policy_count").asLong()).isEqualTo(3);
        assertThat(report.get("formula_keys")).hasSize(22);
    }

    @Test
    @DisplayName("Should take the KPI snapshot from the latest week instead of summing weeks")
    void shouldSnapshotLatestWeek() throws IOException {
        Path csv = Files.write(dir.resolve("weeks.csv"), ImportMetricsTest.sampleWeek());

        int code = run(csv.toString());

        assertThat(code).isEqualTo(PremiumLensImport.EXIT_OK);
        JsonNode report = mapper.readTree(stdout.toString(StandardCharsets.UTF_8));
        assertThat(report.get("totals").get("valid_rows").asInt()).isEqualTo(4);
        assertThat(report.get("kpi_week").asInt()).isEqualTo(25);
        JsonNode kpi = report.get("kpi");
        assertThat(kpi.get("signed_premium").asDouble()).isCloseTo(3.0, within(1e-9));
        assertThat(kpi.get("policy_count").asLong()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should take the KPI snapshot from KPI_WEEK when it is set")
    void shouldSnapshotConfiguredWeek() throws IOException {
        Path csv = Files.write(dir.resolve("weeks.csv"), ImportMetricsTest.sampleWeek());
        env.put("KPI_WEEK", "24");

        int code = run(csv.toString());

        assertThat(code).isEqualTo(PremiumLensImport.EXIT_OK);
        JsonNode report = mapper.readTree(stdout.toString(StandardCharsets.UTF_8));
        assertThat(report.get("kpi_week").asInt()).isEqualTo(24);
        JsonNode kpi = report.get("kpi");
        assertThat(kpi.get("signed_premium").asDouble()).isCloseTo(15.12, within(1e-9));
        assertThat(kpi.get("policy_count").asLong()).isEqualTo(16);
    }

    @Test
    @DisplayName("Should import a directory in parallel and print the report")
    void shouldImportDirectoryInParallel() throws IOException {
        Files.write(dir.resolve("a.csv"), ImportMetricsTest.sampleWeek());
        Files.write(dir.resolve("b.csv"), ImportMetricsTest.sampleWeek());
        Files.writeString(dir.resolve("readme.txt"), "not a csv");
        env.put("IMPORT_THREADS", "2");

        int code = run(dir.toString());

        assertThat(code).isEqualTo(PremiumLensImport.EXIT_OK);
        JsonNode report = mapper.readTree(stdout.toString(StandardCharsets.UTF_8));
        assertThat(report.get("mode").asText()).isEqualTo("PARALLEL");
        assertThat(report.get("files")).hasSize(2);
        assertThat(report.get("totals").get("valid_rows").asInt()).isEqualTo(8);
        assertThat(report.get("totals").get("duplicates_removed").asInt()).isEqualTo(4);
        assertThat(report.get("totals").get("records").asInt()).isEqualTo(4);
    }

    @Test
    @DisplayName("Should exit with 1 when no file yields a valid row")
    void shouldFailWithoutValidRows() throws IOException {
        Path headerOnly = Files.write(dir.resolve("header.csv"), ImportMetricsTest.headerOnly());
        Path empty = Files.write(dir.resolve("empty.csv"), new byte[0]);

        int code = run(headerOnly.toString(), empty.toString());

        assertThat(code).isEqualTo(PremiumLensImport.EXIT_NO_DATA);
        JsonNode report = mapper.readTree(stdout.toString(StandardCharsets.UTF_8));
        assertThat(report.get("kpi").isNull()).isTrue();
        assertThat(report.get("kpi_week").isNull()).isTrue();
        assertThat(report.get("files").get(0).get("status").asText()).isEqualTo("empty");
        assertThat(report.get("files").get(1).get("status").asText()).isEqualTo("failed");
        assertThat(report.get("files").get(1).has("stats")).isFalse();
    }

    @Test
    @DisplayName("Should exit with 2 on configuration errors")
    void shouldRejectBadConfiguration() throws IOException {
        Path csv = Files.write(dir.resolve("week24.csv"), ImportMetricsTest.sampleWeek());

        assertThat(run()).isEqualTo(PremiumLensImport.EXIT_CONFIG_ERROR);
        assertThat(run(dir.resolve("missing.csv").toString())).isEqualTo(PremiumLensImport.EXIT_CONFIG_ERROR);

        env.put("IMPORT_THREADS", "lots");
        assertThat(run(csv.toString())).isEqualTo(PremiumLensImport.EXIT_CONFIG_ERROR);

        env.clear();
        env.put("PREMIUM_LENS_CONFIG_PATH", dir.resolve("absent.yml").toString());
        assertThat(run(csv.toString())).isEqualTo(PremiumLensImport.EXIT_CONFIG_ERROR);
        assertThat(stdout.size()).isZero();
    }

    @Test
    @DisplayName("Should apply environment overrides to the engine configuration")
    void shouldOverrideEngineSettings() {
        ImportConfig config = new ImportConfig.Builder().chunkSize(50).maxReportedErrors(3).build();

        EngineConfig engineConfig = PremiumLensImport.loadEngineConfig(config);

        assertThat(engineConfig.getIngest().getChunkSize()).isEqualTo(50);
        assertThat(engineConfig.getIngest().getMaxReportedErrors()).isEqualTo(3);
    }

    // ---- Helpers ----

    private int run(String... arguments) {
        PrintStream out = new PrintStream(stdout, true, StandardCharsets.UTF_8);
        return PremiumLensImport.run(List.of(arguments), env, out, CLOCK);
    }
}
