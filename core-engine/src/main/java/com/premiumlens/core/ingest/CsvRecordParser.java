package com.premiumlens.core.ingest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.RuntimeJsonMappingException;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.premiumlens.core.config.EngineConfig;
import com.premiumlens.core.config.IngestSettings;
import com.premiumlens.core.encoding.DecodedText;
import com.premiumlens.core.encoding.EncodingDetector;
import com.premiumlens.core.model.InsuranceRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Parses a weekly CSV extract into validated {@link InsuranceRecord}s.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   bytes
 *     → EncodingDetector (charset scoring, BOM strip)
 *     → header check (all 26 columns, any order; extras ignored)
 *     → rows in chunks of {@code ingest.chunkSize}
 *         → RecordValidator (errors reject the row, warnings keep it)
 *         → ProgressListener after every chunk
 *     → ParseResult
 * </pre>
 *
 * <h3>Failure model</h3>
 * <p>
 * Only structural problems throw: a missing column raises
 * {@link MissingColumnsException} before any row is read, and an empty or
 * unreadable input raises {@link IngestException}. A bad row never stops the
 * parse: a record the tokenizer rejects, such as text after a closing quote,
 * becomes a row error like any validation failure.
 * </p>
 *
 * <p>
 * The parser keeps no state between calls, so one instance may serve several
 * files concurrently.
 * </p>
 *
 * @since 1.0.0
 */
public class CsvRecordParser {

    private static final Logger LOG = LoggerFactory.getLogger(CsvRecordParser.class);

    private final IngestSettings settings;
    private final EncodingDetector encodingDetector;
    private final RecordValidator validator;
    private final CsvMapper csvMapper;

    /**
     * @param config engine configuration; must not be {@code null}
     * @param clock  clock used to bound snapshot dates; must not be
     *               {@code null}
     */
    public CsvRecordParser(EngineConfig config, Clock clock) {
        Objects.requireNonNull(config, "EngineConfig must not be null");
        this.settings = config.getIngest();
        this.encodingDetector = new EncodingDetector(settings.getCandidateEncodings(),
                settings.getEncodingSampleBytes());
        this.validator = new RecordValidator(config, clock);
        this.csvMapper = new CsvMapper();
        this.csvMapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);
    }

    /**
     * Parser with built-in defaults and the system clock.
     *
     * @return a new parser
     */
    public static CsvRecordParser withDefaults() {
        return new CsvRecordParser(EngineConfig.defaults(), Clock.systemDefaultZone());
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Read, decode and parse a file.
     *
     * @param path CSV file
     * @param listener progress port
     * @return parse result
     * @throws IngestException if the file cannot be read or is structurally
     *                         invalid
     */
    public ParseResult parseFile(Path path, ProgressListener listener) {
        Objects.requireNonNull(path, "Path must not be null");
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(path);
        } catch (IOException e) {
            throw new IngestException("Failed to read CSV file: " + path, e);
        }
        LOG.info("Parsing {} ({} bytes)", path, bytes.length);
        return parse(bytes, listener);
    }

    /**
     * Decode and parse a raw byte buffer.
     *
     * @param bytes    full file content
     * @param listener progress port
     * @return parse result carrying the detected encoding
     */
    public ParseResult parse(byte[] bytes, ProgressListener listener) {
        Objects.requireNonNull(bytes, "Byte buffer must not be null");
        Objects.requireNonNull(listener, "ProgressListener must not be null");
        long started = System.nanoTime();
        listener.onProgress(new ParseProgress(0, 0, ParsePhase.DECODING, null));
        DecodedText decoded = encodingDetector.decode(bytes);
        return parseDecoded(decoded.getText(), decoded.getEncoding(), listener, started);
    }

    /**
     * Parse already decoded CSV text.
     *
     * @param text     CSV content, header first
     * @param listener progress port
     * @return parse result with no encoding
     */
    public ParseResult parseText(String text, ProgressListener listener) {
        Objects.requireNonNull(text, "Text must not be null");
        Objects.requireNonNull(listener, "ProgressListener must not be null");
        String body = !text.isEmpty() && text.charAt(0) == '\uFEFF' ? text.substring(1) : text;
        return parseDecoded(body, null, listener, System.nanoTime());
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private ParseResult parseDecoded(String text, String encoding, ProgressListener listener, long started) {
        if (text.isBlank()) {
            throw new IngestException("CSV input is empty");
        }
        long estimatedRows = Math.max(0, text.lines().count() - 1);

        List<InsuranceRecord> data = new ArrayList<>();
        List<RowError> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        int totalRows = 0;
        int invalidRows = 0;

        List<String> records = splitRecords(text);
        if (records.isEmpty()) {
            throw new IngestException("CSV input has no header row");
        }
        Map<CsvColumn, Integer> index;
        try {
            index = resolveHeader(tokenize(records.get(0)));
        } catch (MalformedRowException e) {
            throw new IngestException("Malformed CSV header: " + e.getMessage(), e);
        }

        for (int dataIndex = 0; dataIndex < records.size() - 1; dataIndex++) {
            int rowNumber = dataIndex + 2;
            RowOutcome outcome;
            try {
                String[] cells = tokenize(records.get(dataIndex + 1));
                if (isBlank(cells)) {
                    continue;
                }
                outcome = validator.validate(column -> cell(cells, index.get(column)));
            } catch (MalformedRowException e) {
                LOG.debug("Row {} is malformed: {}", rowNumber, e.getMessage());
                outcome = new RowOutcome(null, List.of("Malformed CSV row: " + e.getMessage()), List.of());
            }
            totalRows++;

            if (outcome.isValid()) {
                data.add(outcome.getRecord().orElseThrow());
            } else {
                invalidRows++;
                if (errors.size() < settings.getMaxReportedErrors()) {
                    errors.add(new RowError(rowNumber, outcome.getErrors()));
                }
            }
            for (String warning : outcome.getWarnings()) {
                if (warnings.size() < settings.getMaxReportedWarnings()) {
                    warnings.add("Row " + rowNumber + ": " + warning);
                }
            }

            if (totalRows % settings.getChunkSize() == 0) {
                listener.onProgress(progress(totalRows, estimatedRows, started));
            }
        }

        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
        listener.onProgress(new ParseProgress(totalRows, totalRows, ParsePhase.COMPLETE, Duration.ZERO));

        ParseStats stats = new ParseStats(totalRows, data.size(), invalidRows);
        if (invalidRows > 0) {
            LOG.warn("Parsed {} row(s): {} valid, {} rejected ({} reported)", totalRows, data.size(),
                    invalidRows, errors.size());
        } else {
            LOG.info("Parsed {} row(s), all valid, in {} ms", totalRows, elapsed.toMillis());
        }
        return new ParseResult(data, errors, warnings, stats, encoding, elapsed);
    }

    private Map<CsvColumn, Integer> resolveHeader(String[] header) {
        Map<String, Integer> positions = new HashMap<>();
        for (int i = 0; i < header.length; i++) {
            String name = header[i] == null ? "" : header[i].strip();
            if (i == 0 && name.startsWith("\uFEFF")) {
                name = name.substring(1);
            }
            positions.putIfAbsent(name, i);
        }

        Map<CsvColumn, Integer> index = new EnumMap<>(CsvColumn.class);
        List<String> missing = new ArrayList<>();
        for (CsvColumn column : CsvColumn.values()) {
            Integer position = positions.get(column.header());
            if (position == null) {
                missing.add(column.header());
            } else {
                index.put(column, position);
            }
        }
        if (!missing.isEmpty()) {
            LOG.warn("Rejecting CSV: missing column(s) {}", missing);
            throw new MissingColumnsException(missing);
        }

        Set<String> extra = new LinkedHashSet<>(positions.keySet());
        extra.removeAll(CsvColumn.headers());
        extra.remove("");
        if (!extra.isEmpty()) {
            LOG.info("Ignoring {} extra column(s): {}", extra.size(), extra);
        }
        return index;
    }

    /**
     * Split CSV text into physical records: line breaks inside quoted cells
     * stay in their record. A trailing line break adds no record.
     */
    static List<String> splitRecords(String text) {
        List<String> records = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '"') {
                quoted = !quoted;
            } else if (!quoted && (c == '\n' || c == '\r')) {
                if (c == '\r' && i + 1 < text.length() && text.charAt(i + 1) == '\n') {
                    i++;
                }
                records.add(current.toString());
                current.setLength(0);
                continue;
            }
            current.append(c);
        }
        if (current.length() > 0) {
            records.add(current.toString());
        }
        return records;
    }

    private String[] tokenize(String record) {
        if (record.isEmpty()) {
            return new String[0];
        }
        try (MappingIterator<String[]> cells = csvMapper.readerFor(String[].class).readValues(record)) {
            return cells.hasNext() ? cells.next() : new String[0];
        } catch (RuntimeJsonMappingException | IOException e) {
            throw new MalformedRowException(rootMessage(e), e);
        }
    }

    private static String rootMessage(Exception e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof JsonProcessingException) {
                return ((JsonProcessingException) t).getOriginalMessage();
            }
        }
        return e.getMessage();
    }

    /** A record the CSV tokenizer rejects. */
    private static final class MalformedRowException extends RuntimeException {

        private static final long serialVersionUID = 1L;

        MalformedRowException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    private static ParseProgress progress(long processed, long estimatedTotal, long started) {
        long elapsedNanos = System.nanoTime() - started;
        long total = Math.max(estimatedTotal, processed);
        Duration remaining = processed == 0
                ? null
                : Duration.ofNanos(elapsedNanos / processed * (total - processed));
        ParseProgress progress = new ParseProgress(processed, total, ParsePhase.PARSING, remaining);
        LOG.debug("{}", progress);
        return progress;
    }

    private static String cell(String[] cells, int position) {
        return position < cells.length ? cells[position] : "";
    }

    private static boolean isBlank(String[] cells) {
        for (String cell : cells) {
            if (cell != null && !cell.isBlank()) {
                return false;
            }
        }
        return true;
    }
}
