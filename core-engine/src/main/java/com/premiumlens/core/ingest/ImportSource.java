package com.premiumlens.core.ingest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * One file of a batch import. Content is read lazily by the task that parses
 * it, so every task owns its own buffer.
 *
 * @since 1.0.0
 */
public interface ImportSource {

    /**
     * @return display name used in logs and results
     */
    String name();

    /**
     * @return the full file content
     * @throws IOException if the content cannot be read
     */
    byte[] read() throws IOException;

    /**
     * Source backed by a file on disk.
     */
    static ImportSource ofPath(Path path) {
        Objects.requireNonNull(path, "Path must not be null");
        return new ImportSource() {
            @Override
            public String name() {
                return path.toString();
            }

            @Override
            public byte[] read() throws IOException {
                return Files.readAllBytes(path);
            }
        };
    }

    /**
     * Source backed by an in-memory buffer.
     */
    static ImportSource ofBytes(String name, byte[] content) {
        Objects.requireNonNull(name, "Name must not be null");
        Objects.requireNonNull(content, "Content must not be null");
        byte[] copy = content.clone();
        return new ImportSource() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public byte[] read() {
                return copy.clone();
            }
        };
    }
}
