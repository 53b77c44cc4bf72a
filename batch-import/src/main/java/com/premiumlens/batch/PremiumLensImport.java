package com.premiumlens.batch;

import com.premiumlens.core.config.EngineConfig;
import com.premiumlens.core.config.EngineConfigLoader;
import com.premiumlens.core.filter.FilterEngine;
import com.premiumlens.core.ingest.BatchImportResult;
import com.premiumlens.core.ingest.BatchImporter;
import com.premiumlens.core.ingest.CsvRecordParser;
import com.premiumlens.core.ingest.ImportMode;
import com.premiumlens.core.ingest.ImportSource;
import com.premiumlens.core.kpi.KpiEngine;
import com.premiumlens.core.model.FilterState;
import com.premiumlens.core.model.InsuranceRecord;
import com.premiumlens.core.model.KpiResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Main entry point of the batch import runner.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   arguments (files / directories)
 *     → SourceResolver (directories expand to *.csv)
 *     → BatchImporter (parallel or sequential)
 *     → ImportMetrics
 *     → KpiEngine (snapshot week of the merged records)
 *     → ImportReport → JSON (REPORT_PATH or stdout)
 * </pre>
 *
 * <h3>Exit codes</h3>
 * <ul>
 * <li>{@value #EXIT_OK}: at least one file produced valid rows</li>
 * <li>{@value #EXIT_NO_DATA}: no file produced a valid row, or the report
 * could not be written</li>
 * <li>{@value #EXIT_CONFIG_ERROR}: invalid configuration or inputs</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class PremiumLensImport {

    private static final Logger LOG = LoggerFactory.getLogger(PremiumLensImport.class);

    static final int EXIT_OK = 0;
    static final int EXIT_NO_DATA = 1;
    static final int EXIT_CONFIG_ERROR = 2;

    private PremiumLensImport() {
        // entry-point class, not instantiable
    }

    public static void main(String[] args) {
        int code = run(Arrays.asList(args), System.getenv(), System.out, Clock.systemDefaultZone());
        System.exit(code);
    }

    /**
     * Run one import.
     *
     * @param arguments file or directory paths
     * @param env       environment variables
     * @param out       destination of the report when {@code REPORT_PATH} is
     *                  unset
     * @param clock     clock for snapshot-date bounds and the report timestamp
     * @return process exit code
     */
    static int run(List<String> arguments, Map<String, String> env, PrintStream out, Clock clock) {
        // 1. Configuration and inputs
        ImportConfig config;
        EngineConfig engineConfig;
        List<ImportSource> sources;
        try {
            config = ImportConfig.fromEnvironment(env);
            engineConfig = loadEngineConfig(config);
            sources = SourceResolver.resolve(arguments);
        } catch (IllegalArgumentException | IllegalStateException | UncheckedIOException e) {
            LOG.error("Invalid configuration: {}", e.getMessage());
            return EXIT_CONFIG_ERROR;
        }
        if (sources.isEmpty()) {
            LOG.error("No CSV files to import. Usage: batch-import <file-or-directory>...");
            return EXIT_CONFIG_ERROR;
        }
        LOG.info("Starting Premium Lens import of {} file(s) with config: {}", sources.size(), config);

        // 2. Import
        CsvRecordParser parser = new CsvRecordParser(engineConfig, clock);
        BatchImportResult batch = importAll(parser, config, sources);

        // 3. Metrics
        ImportMetrics metrics = new ImportMetrics(new SimpleMeterRegistry());
        batch.getFiles().forEach(metrics::recordFile);

        // 4. KPI snapshot and report
        Integer kpiWeek = snapshotWeek(batch.getRecords(), config).orElse(null);
        KpiResult overall = kpiWeek == null
                ? null
                : KpiEngine.calculate(FilterEngine.forWeek(batch.getRecords(), FilterState.empty(), kpiWeek),
                        config.kpiOptions()).orElse(null);
        ImportReport report = ImportReport.of(batch, kpiWeek, overall, config.getImportMode(), clock.instant());
        try {
            writeReport(report, config, out);
        } catch (IOException e) {
            LOG.error("Failed to write import report to {}: {}", config.getReportPath(), e.getMessage(), e);
            return EXIT_NO_DATA;
        }

        LOG.info("Import summary: {}", metrics.summary());
        if (!batch.isSuccess()) {
            LOG.warn("No file produced a valid row");
            return EXIT_NO_DATA;
        }
        return EXIT_OK;
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    /**
     * Load the engine YAML and apply the environment overrides on top.
     */
    static EngineConfig loadEngineConfig(ImportConfig config) {
        String path = config.getEngineConfigPath();
        EngineConfig engineConfig = path.isBlank()
                ? EngineConfigLoader.load()
                : EngineConfigLoader.fromFile(Path.of(path));

        config.getChunkSize().ifPresent(engineConfig.getIngest()::setChunkSize);
        config.getMaxReportedErrors().ifPresent(engineConfig.getIngest()::setMaxReportedErrors);
        engineConfig.validate();
        return engineConfig;
    }

    /**
     * Week of the KPI snapshot: {@code KPI_WEEK} when set, otherwise the
     * latest week in the records. Each weekly extract is cumulative, so the
     * snapshot never sums more than one week.
     *
     * @return the week, empty when there are no records
     */
    static Optional<Integer> snapshotWeek(List<InsuranceRecord> records, ImportConfig config) {
        if (records.isEmpty()) {
            return Optional.empty();
        }
        if (config.getKpiWeek().isPresent()) {
            return config.getKpiWeek();
        }
        return records.stream().map(InsuranceRecord::getWeekNumber).max(Integer::compare);
    }

    private static BatchImportResult importAll(CsvRecordParser parser, ImportConfig config,
            List<ImportSource> sources) {
        if (config.getImportMode() == ImportMode.SEQUENTIAL) {
            return BatchImporter.sequential(parser).importAll(sources);
        }
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(config.getThreads(), sources.size()));
        try {
            return new BatchImporter(parser, ImportMode.PARALLEL, executor).importAll(sources);
        } finally {
            executor.shutdown();
        }
    }

    private static void writeReport(ImportReport report, ImportConfig config, PrintStream out) throws IOException {
        ReportWriter writer = new ReportWriter();
        if (config.getReportPath().isBlank()) {
            writer.write(report, out);
        } else {
            Path path = Path.of(config.getReportPath());
            writer.write(report, path);
            LOG.info("Import report written to {}", path.toAbsolutePath());
        }
    }
}
