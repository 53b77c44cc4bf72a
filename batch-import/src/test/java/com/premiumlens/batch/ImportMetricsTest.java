package com.premiumlens.batch;

import com.premiumlens.core.ingest.BatchImportResult;
import com.premiumlens.core.ingest.BatchImporter;
import com.premiumlens.core.ingest.CsvRecordParser;
import com.premiumlens.core.ingest.ImportSource;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ImportMetrics}.
 */
class ImportMetricsTest {

    private SimpleMeterRegistry registry;
    private ImportMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new ImportMetrics(registry);
    }

    @Test
    @DisplayName("Should count files by outcome and rows by validity")
    void shouldRecordBatch() throws IOException {
        BatchImportResult batch = BatchImporter.sequential(CsvRecordParser.withDefaults()).importAll(List.of(
                ImportSource.ofBytes("week.csv", sampleWeek()),
                ImportSource.ofBytes("header-only.csv", headerOnly()),
                ImportSource.ofBytes("empty.csv", new byte[0])));

        batch.getFiles().forEach(metrics::recordFile);

        assertThat(metrics.filesProcessed("imported")).isEqualTo(1);
        assertThat(metrics.filesProcessed("empty")).isEqualTo(1);
        assertThat(metrics.filesProcessed("failed")).isEqualTo(1);
        assertThat(metrics.rowsValid()).isEqualTo(4);
        assertThat(metrics.rowsInvalid()).isEqualTo(1);
        assertThat(metrics.parsesTimed()).isEqualTo(2);
        assertThat(registry.find(ImportMetrics.FILES_PROCESSED).counters()).hasSize(3);
        assertThat(metrics.summary()).contains("imported=1", "failed=1", "valid=4", "invalid=1");
    }

    @Test
    @DisplayName("Should report zero for a status never seen")
    void shouldReportZeroForUnknownStatus() {
        assertThat(metrics.filesProcessed("imported")).isZero();
        assertThat(metrics.rowsValid()).isZero();
    }

    // ---- Helpers ----

    static byte[] sampleWeek() throws IOException {
        try (InputStream in = ImportMetricsTest.class.getClassLoader()
                .getResourceAsStream("fixtures/sample-week.csv")) {
            assertThat(in).as("fixtures/sample-week.csv on the test classpath").isNotNull();
            return in.readAllBytes();
        }
    }

    static byte[] headerOnly() throws IOException {
        String text = new String(sampleWeek(), StandardCharsets.UTF_8);
        return text.substring(0, text.indexOf('\n') + 1).getBytes(StandardCharsets.UTF_8);
    }
}
