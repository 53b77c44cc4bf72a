package com.premiumlens.batch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Renders an {@link ImportReport} as indented JSON with ISO-8601 timestamps.
 */
public class ReportWriter {

    private final ObjectMapper mapper;

    public ReportWriter() {
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * @throws IllegalStateException if the report cannot be serialized
     */
    public String toJson(ImportReport report) {
        Objects.requireNonNull(report, "ImportReport must not be null");
        try {
            return mapper.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize import report: " + e.getMessage(), e);
        }
    }

    /**
     * Write the report to a file, creating missing parent directories.
     */
    public void write(ImportReport report, Path path) throws IOException {
        Objects.requireNonNull(path, "Report path must not be null");
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(path, toJson(report), StandardCharsets.UTF_8);
    }

    /**
     * Print the report; the stream is left open.
     */
    public void write(ImportReport report, PrintStream out) {
        Objects.requireNonNull(out, "Output stream must not be null");
        out.println(toJson(report));
        out.flush();
    }
}
