package com.premiumlens.core.ingest;

import com.premiumlens.core.model.InsuranceRecord;
import com.premiumlens.core.model.RecordSets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.function.Function;

/**
 * Imports a batch of CSV files.
 *
 * <h3>Scheduling</h3>
 * <p>
 * In {@link ImportMode#PARALLEL} mode every file becomes one task on the
 * supplied {@link ExecutorService} and the tasks are awaited jointly; in
 * {@link ImportMode#SEQUENTIAL} mode files are parsed one after another on the
 * caller thread. Tasks share nothing mutable: each reads its own buffer and
 * builds its own record list.
 * </p>
 *
 * <h3>Isolation</h3>
 * <p>
 * A structural failure or an I/O error in one file is recorded in that file's
 * {@link FileImportResult} and never affects the others.
 * </p>
 *
 * @since 1.0.0
 */
public class BatchImporter {

    private static final Logger LOG = LoggerFactory.getLogger(BatchImporter.class);

    private final CsvRecordParser parser;
    private final ImportMode mode;
    private final ExecutorService executor;

    /**
     * @param parser   shared, stateless parser
     * @param mode     scheduling mode
     * @param executor worker pool, required for {@link ImportMode#PARALLEL},
     *                 ignored otherwise; the caller owns its lifecycle
     * @throws IllegalArgumentException if parallel mode has no executor
     */
    public BatchImporter(CsvRecordParser parser, ImportMode mode, ExecutorService executor) {
        this.parser = Objects.requireNonNull(parser, "CsvRecordParser must not be null");
        this.mode = Objects.requireNonNull(mode, "ImportMode must not be null");
        if (mode == ImportMode.PARALLEL && executor == null) {
            throw new IllegalArgumentException("Parallel import requires an ExecutorService");
        }
        this.executor = executor;
    }

    /**
     * Sequential importer.
     */
    public static BatchImporter sequential(CsvRecordParser parser) {
        return new BatchImporter(parser, ImportMode.SEQUENTIAL, null);
    }

    /**
     * Import every source without progress reporting.
     */
    public BatchImportResult importAll(List<ImportSource> sources) {
        return importAll(sources, source -> ProgressListener.NONE);
    }

    /**
     * Import every source.
     *
     * @param sources   files to import
     * @param listeners supplies the progress listener of each file
     * @return per-file results plus the merged, de-duplicated records
     */
    public BatchImportResult importAll(List<ImportSource> sources,
            Function<ImportSource, ProgressListener> listeners) {
        Objects.requireNonNull(sources, "Sources must not be null");
        Objects.requireNonNull(listeners, "Listener factory must not be null");
        LOG.info("Importing {} file(s) in {} mode", sources.size(), mode);

        List<FileImportResult> results = switch (mode) {
            case PARALLEL -> importParallel(sources, listeners);
            case SEQUENTIAL -> sources.stream()
                    .map(source -> importOne(source, listeners.apply(source)))
                    .toList();
        };

        List<List<InsuranceRecord>> recordSets = new ArrayList<>();
        int validRows = 0;
        for (FileImportResult result : results) {
            result.getResult().ifPresent(r -> recordSets.add(r.getData()));
            validRows += result.getResult().map(r -> r.getData().size()).orElse(0);
        }
        List<InsuranceRecord> merged = RecordSets.merge(recordSets);

        BatchImportResult batch = new BatchImportResult(results, merged, validRows - merged.size());
        LOG.info("Batch import finished: {}", batch);
        return batch;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private List<FileImportResult> importParallel(List<ImportSource> sources,
            Function<ImportSource, ProgressListener> listeners) {
        List<CompletableFuture<FileImportResult>> tasks = sources.stream()
                .map(source -> {
                    ProgressListener listener = listeners.apply(source);
                    return CompletableFuture.supplyAsync(() -> importOne(source, listener), executor);
                })
                .toList();
        CompletableFuture.allOf(tasks.toArray(new CompletableFuture<?>[0])).join();
        return tasks.stream().map(CompletableFuture::join).toList();
    }

    private FileImportResult importOne(ImportSource source, ProgressListener listener) {
        String name = source.name();
        try {
            byte[] bytes = source.read();
            ParseResult result = parser.parse(bytes, listener);
            LOG.info("Imported {}: {}", name, result.getStats());
            return FileImportResult.parsed(name, result);
        } catch (IngestException e) {
            LOG.warn("Skipping {}: {}", name, e.getMessage());
            return FileImportResult.failed(name, e.getMessage());
        } catch (IOException e) {
            LOG.warn("Failed to read {}: {}", name, e.getMessage());
            return FileImportResult.failed(name, "Failed to read file: " + e.getMessage());
        }
    }
}
