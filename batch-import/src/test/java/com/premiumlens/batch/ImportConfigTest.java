package com.premiumlens.batch;

import com.premiumlens.core.ingest.ImportMode;
import com.premiumlens.core.kpi.KpiOptions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ImportConfig}.
 */
class ImportConfigTest {

    @Test
    @DisplayName("Should fall back to defaults for an empty environment")
    void shouldUseDefaults() {
        ImportConfig config = ImportConfig.fromEnvironment(Map.of());

        assertThat(config.getImportMode()).isEqualTo(ImportMode.PARALLEL);
        assertThat(config.getThreads()).isEqualTo(4);
        assertThat(config.getChunkSize()).isEmpty();
        assertThat(config.getMaxReportedErrors()).isEmpty();
        assertThat(config.getEngineConfigPath()).isEmpty();
        assertThat(config.getReportPath()).isEmpty();
        assertThat(config.kpiOptions()).isEqualTo(KpiOptions.defaults());
    }

    @Test
    @DisplayName("Should read every variable")
    void shouldReadEnvironment() {
        ImportConfig config = ImportConfig.fromEnvironment(Map.of(
                "IMPORT_MODE", "Sequential",
                "IMPORT_THREADS", "8",
                "CHUNK_SIZE", "250",
                "MAX_REPORTED_ERRORS", "5",
                "PREMIUM_LENS_CONFIG_PATH", "/etc/premium-lens.yml",
                "REPORT_PATH", "out/report.json",
                "ANNUAL_TARGET_YUAN", "5000000",
                "KPI_YEAR", "2024",
                "KPI_WEEK", " 26 "));

        assertThat(config.getImportMode()).isEqualTo(ImportMode.SEQUENTIAL);
        assertThat(config.getThreads()).isEqualTo(8);
        assertThat(config.getChunkSize()).contains(250);
        assertThat(config.getMaxReportedErrors()).contains(5);
        assertThat(config.getEngineConfigPath()).isEqualTo("/etc/premium-lens.yml");
        assertThat(config.getReportPath()).isEqualTo("out/report.json");

        KpiOptions options = config.kpiOptions();
        assertThat(options.getAnnualTargetYuan()).contains(5_000_000d);
        assertThat(options.getYear()).contains(2024);
        assertThat(options.getCurrentWeekNumber()).contains(26);
    }

    @Test
    @DisplayName("Should treat blank variables as unset")
    void shouldIgnoreBlankValues() {
        ImportConfig config = ImportConfig.fromEnvironment(Map.of("IMPORT_THREADS", "  ", "KPI_WEEK", ""));

        assertThat(config.getThreads()).isEqualTo(4);
        assertThat(config.getKpiWeek()).isEmpty();
    }

    @Test
    @DisplayName("Should report unparseable numbers as a configuration failure")
    void shouldRejectNonNumericValue() {
        assertThatThrownBy(() -> ImportConfig.fromEnvironment(Map.of("IMPORT_THREADS", "many")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Failed to parse numeric environment variable");
    }

    @Test
    @DisplayName("Should reject an unknown import mode")
    void shouldRejectUnknownMode() {
        assertThatThrownBy(() -> ImportConfig.fromEnvironment(Map.of("IMPORT_MODE", "streaming")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("IMPORT_MODE must be 'parallel' or 'sequential', got: 'streaming'");
    }

    @Test
    @DisplayName("Should validate ranges at build time")
    void shouldValidateRanges() {
        assertThatThrownBy(() -> new ImportConfig.Builder().threads(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("threads must be >= 1");
        assertThatThrownBy(() -> new ImportConfig.Builder().chunkSize(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("chunkSize");
        assertThatThrownBy(() -> new ImportConfig.Builder().kpiWeek(54).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("kpiWeek must be in [1, 53]");
        assertThatThrownBy(() -> new ImportConfig.Builder().annualTargetYuan(-1d).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("annualTargetYuan");
        assertThatThrownBy(() -> new ImportConfig.Builder().importMode(null).build())
                .isInstanceOf(NullPointerException.class)
                .hasMessage("importMode required");
    }
}
