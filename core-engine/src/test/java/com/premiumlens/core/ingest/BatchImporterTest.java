package com.premiumlens.core.ingest;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link BatchImporter}.
 */
class BatchImporterTest {

    private CsvRecordParser parser;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        parser = new CsvRecordParser(IngestFixtures.testConfig(), IngestFixtures.CLOCK);
        executor = Executors.newFixedThreadPool(3);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("Should import sequentially and merge duplicate rows across files")
    void shouldImportSequentially() {
        BatchImporter importer = BatchImporter.sequential(parser);

        BatchImportResult result = importer.importAll(List.of(
                ImportSource.ofBytes("week-a.csv", IngestFixtures.sampleWeek()),
                ImportSource.ofBytes("week-b.csv", IngestFixtures.sampleWeek())));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getSucceededFiles()).isEqualTo(2);
        assertThat(result.getTotalRows()).isEqualTo(10);
        assertThat(result.getValidRows()).isEqualTo(8);
        assertThat(result.getInvalidRows()).isEqualTo(2);
        assertThat(result.getRecords()).hasSize(4);
        assertThat(result.getDuplicatesRemoved()).isEqualTo(4);
    }

    @Test
    @DisplayName("Should isolate structural and I/O failures to their own file in parallel mode")
    void shouldIsolateFailuresInParallel() {
        BatchImporter importer = new BatchImporter(parser, ImportMode.PARALLEL, executor);
        ImportSource unreadable = new ImportSource() {
            @Override
            public String name() {
                return "unreadable.csv";
            }

            @Override
            public byte[] read() throws IOException {
                throw new IOException("disk on fire");
            }
        };

        BatchImportResult result = importer.importAll(List.of(
                ImportSource.ofBytes("good.csv", IngestFixtures.sampleWeek()),
                ImportSource.ofBytes("wrong-header.csv", "a,b\n1,2\n".getBytes(StandardCharsets.UTF_8)),
                unreadable));

        assertThat(result.getFiles()).extracting(FileImportResult::getSourceName)
                .containsExactly("good.csv", "wrong-header.csv", "unreadable.csv");
        assertThat(result.getFiles().get(0).isSuccess()).isTrue();
        assertThat(result.getFiles().get(1).getFailure().orElseThrow()).contains("missing required column");
        assertThat(result.getFiles().get(2).getFailure()).contains("Failed to read file: disk on fire");
        assertThat(result.getSucceededFiles()).isEqualTo(1);
        assertThat(result.getRecords()).hasSize(4);
    }

    @Test
    @DisplayName("Should give every file its own progress listener")
    void shouldReportProgressPerFile() {
        BatchImporter importer = new BatchImporter(parser, ImportMode.PARALLEL, executor);
        Map<String, AtomicInteger> updates = new ConcurrentHashMap<>();

        importer.importAll(List.of(
                        ImportSource.ofBytes("a.csv", IngestFixtures.sampleWeek()),
                        ImportSource.ofBytes("b.csv", IngestFixtures.sampleWeek())),
                source -> progress -> updates.computeIfAbsent(source.name(), k -> new AtomicInteger())
                        .incrementAndGet());

        assertThat(updates).containsOnlyKeys("a.csv", "b.csv");
        assertThat(updates.get("a.csv").get()).isEqualTo(4);
        assertThat(updates.get("b.csv").get()).isEqualTo(4);
    }

    @Test
    @DisplayName("Should read path-backed sources")
    void shouldReadPathSources(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("week.csv");
        Files.write(file, IngestFixtures.sampleWeek());

        BatchImportResult result = BatchImporter.sequential(parser).importAll(List.of(ImportSource.ofPath(file)));

        assertThat(result.getFiles()).singleElement().satisfies(f -> assertThat(f.isSuccess()).isTrue());
        assertThat(result.getDuplicatesRemoved()).isZero();
    }

    @Test
    @DisplayName("Should report failure when no file yields records")
    void shouldFailWhenNothingImports() {
        BatchImportResult result = BatchImporter.sequential(parser).importAll(List.of(
                ImportSource.ofBytes("empty.csv", new byte[0])));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getRecords()).isEmpty();
    }

    @Test
    @DisplayName("Should require an executor for parallel mode")
    void shouldRequireExecutorForParallel() {
        assertThatThrownBy(() -> new BatchImporter(parser, ImportMode.PARALLEL, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("ExecutorService");
    }
}
