/**
 * CSV ingestion: header check, chunked row parsing with progress reporting,
 * per-row validation with error and warning accumulation, and batch import of
 * several files.
 *
 * <p>
 * Entry points are {@link com.premiumlens.core.ingest.CsvRecordParser} for a
 * single file and {@link com.premiumlens.core.ingest.BatchImporter} for a
 * batch.
 * </p>
 *
 * @since 1.0.0
 */
package com.premiumlens.core.ingest;
