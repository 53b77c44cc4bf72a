package com.premiumlens.batch;

import com.premiumlens.core.ingest.ImportMode;
import com.premiumlens.core.kpi.KpiOptions;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Typed, immutable configuration of the batch import runner.
 *
 * <p>
 * Values are resolved from environment variables with defaults, so the runner
 * is configured the same way from a shell, a cron entry or a container.
 * </p>
 *
 * <h3>Variables</h3>
 * <ul>
 * <li>{@code IMPORT_MODE}: {@code parallel} (default) or {@code sequential}</li>
 * <li>{@code IMPORT_THREADS}: worker pool size for parallel mode</li>
 * <li>{@code CHUNK_SIZE}, {@code MAX_REPORTED_ERRORS}: override the engine
 * YAML ingest settings</li>
 * <li>{@code PREMIUM_LENS_CONFIG_PATH}: engine YAML file</li>
 * <li>{@code REPORT_PATH}: JSON report file; stdout when unset</li>
 * <li>{@code ANNUAL_TARGET_YUAN}, {@code KPI_YEAR}, {@code KPI_WEEK}: inputs
 * of the progress metrics</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class ImportConfig {

    // ---------------------------------------------------------------
    // Scheduling
    // ---------------------------------------------------------------
    private final ImportMode importMode;
    private final int threads;

    // ---------------------------------------------------------------
    // Engine overrides
    // ---------------------------------------------------------------
    private final Integer chunkSize;
    private final Integer maxReportedErrors;
    private final String engineConfigPath;

    // ---------------------------------------------------------------
    // Output
    // ---------------------------------------------------------------
    private final String reportPath;

    // ---------------------------------------------------------------
    // KPI inputs
    // ---------------------------------------------------------------
    private final Double annualTargetYuan;
    private final Integer kpiYear;
    private final Integer kpiWeek;

    private ImportConfig(Builder b) {
        this.importMode = b.importMode;
        this.threads = b.threads;
        this.chunkSize = b.chunkSize;
        this.maxReportedErrors = b.maxReportedErrors;
        this.engineConfigPath = b.engineConfigPath;
        this.reportPath = b.reportPath;
        this.annualTargetYuan = b.annualTargetYuan;
        this.kpiYear = b.kpiYear;
        this.kpiWeek = b.kpiWeek;
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build an {@link ImportConfig} from the process environment.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if a numeric value cannot be parsed
     * @throws IllegalArgumentException if a value is out of range
     */
    public static ImportConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Build an {@link ImportConfig} from the given variables.
     *
     * @param env variable map; must not be {@code null}
     * @return fully populated configuration
     * @throws IllegalStateException    if a numeric value cannot be parsed
     * @throws IllegalArgumentException if a value is out of range
     */
    static ImportConfig fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "Environment must not be null");
        try {
            return new Builder()
                    .importMode(parseMode(value(env, "IMPORT_MODE", "parallel")))
                    .threads(Integer.parseInt(value(env, "IMPORT_THREADS", "4")))
                    .chunkSize(optionalInt(env, "CHUNK_SIZE"))
                    .maxReportedErrors(optionalInt(env, "MAX_REPORTED_ERRORS"))
                    .engineConfigPath(value(env, "PREMIUM_LENS_CONFIG_PATH", ""))
                    .reportPath(value(env, "REPORT_PATH", ""))
                    .annualTargetYuan(optionalDouble(env, "ANNUAL_TARGET_YUAN"))
                    .kpiYear(optionalInt(env, "KPI_YEAR"))
                    .kpiWeek(optionalInt(env, "KPI_WEEK"))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    /**
     * Options for the overall KPI snapshot of the imported records.
     *
     * @return options carrying the configured target, year and week
     */
    public KpiOptions kpiOptions() {
        return KpiOptions.builder()
                .annualTargetYuan(annualTargetYuan)
                .year(kpiYear)
                .currentWeekNumber(kpiWeek)
                .build();
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public ImportMode getImportMode() {
        return importMode;
    }

    public int getThreads() {
        return threads;
    }

    public Optional<Integer> getChunkSize() {
        return Optional.ofNullable(chunkSize);
    }

    public Optional<Integer> getMaxReportedErrors() {
        return Optional.ofNullable(maxReportedErrors);
    }

    public String getEngineConfigPath() {
        return engineConfigPath;
    }

    public String getReportPath() {
        return reportPath;
    }

    public Optional<Double> getAnnualTargetYuan() {
        return Optional.ofNullable(annualTargetYuan);
    }

    public Optional<Integer> getKpiYear() {
        return Optional.ofNullable(kpiYear);
    }

    public Optional<Integer> getKpiWeek() {
        return Optional.ofNullable(kpiWeek);
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link ImportConfig}.
     *
     * <p>
     * {@link #build()} checks that the pool size, chunk size and error cap are
     * positive, that the target is a finite non-negative amount and that the
     * week lies in [1, 53].
     * </p>
     */
    public static class Builder {
        private ImportMode importMode = ImportMode.PARALLEL;
        private int threads = 4;
        private Integer chunkSize;
        private Integer maxReportedErrors;
        private String engineConfigPath = "";
        private String reportPath = "";
        private Double annualTargetYuan;
        private Integer kpiYear;
        private Integer kpiWeek;

        public Builder importMode(ImportMode v) {
            this.importMode = v;
            return this;
        }

        public Builder threads(int v) {
            this.threads = v;
            return this;
        }

        public Builder chunkSize(Integer v) {
            this.chunkSize = v;
            return this;
        }

        public Builder maxReportedErrors(Integer v) {
            this.maxReportedErrors = v;
            return this;
        }

        public Builder engineConfigPath(String v) {
            this.engineConfigPath = v;
            return this;
        }

        public Builder reportPath(String v) {
            this.reportPath = v;
            return this;
        }

        public Builder annualTargetYuan(Double v) {
            this.annualTargetYuan = v;
            return this;
        }

        public Builder kpiYear(Integer v) {
            this.kpiYear = v;
            return this;
        }

        public Builder kpiWeek(Integer v) {
            this.kpiWeek = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link ImportConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public ImportConfig build() {
            Objects.requireNonNull(importMode, "importMode required");
            Objects.requireNonNull(engineConfigPath, "engineConfigPath required");
            Objects.requireNonNull(reportPath, "reportPath required");

            if (threads < 1) {
                throw new IllegalArgumentException("threads must be >= 1, got: " + threads);
            }
            if (chunkSize != null && chunkSize < 1) {
                throw new IllegalArgumentException("chunkSize must be >= 1, got: " + chunkSize);
            }
            if (maxReportedErrors != null && maxReportedErrors < 0) {
                throw new IllegalArgumentException(
                        "maxReportedErrors must be >= 0, got: " + maxReportedErrors);
            }
            if (annualTargetYuan != null && (!Double.isFinite(annualTargetYuan) || annualTargetYuan < 0)) {
                throw new IllegalArgumentException(
                        "annualTargetYuan must be a finite value >= 0, got: " + annualTargetYuan);
            }
            if (kpiWeek != null && (kpiWeek < 1 || kpiWeek > 53)) {
                throw new IllegalArgumentException("kpiWeek must be in [1, 53], got: " + kpiWeek);
            }

            return new ImportConfig(this);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String value(Map<String, String> env, String name, String defaultValue) {
        String value = env.get(name);
        return (value != null && !value.isBlank()) ? value.strip() : defaultValue;
    }

    private static Integer optionalInt(Map<String, String> env, String name) {
        String value = value(env, name, null);
        return value == null ? null : Integer.valueOf(value);
    }

    private static Double optionalDouble(Map<String, String> env, String name) {
        String value = value(env, name, null);
        return value == null ? null : Double.valueOf(value);
    }

    private static ImportMode parseMode(String value) {
        try {
            return ImportMode.valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "IMPORT_MODE must be 'parallel' or 'sequential', got: '" + value + "'", e);
        }
    }

    @Override
    public String toString() {
        return "ImportConfig{" +
                "importMode=" + importMode +
                ", threads=" + threads +
                ", chunkSize=" + chunkSize +
                ", maxReportedErrors=" + maxReportedErrors +
                ", engineConfigPath='" + engineConfigPath + '\'' +
                ", reportPath='" + reportPath + '\'' +
                ", annualTargetYuan=" + annualTargetYuan +
                ", kpiYear=" + kpiYear +
                ", kpiWeek=" + kpiWeek +
                '}';
    }
}
