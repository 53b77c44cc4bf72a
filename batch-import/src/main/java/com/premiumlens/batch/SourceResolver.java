package com.premiumlens.batch;

import com.premiumlens.core.ingest.ImportSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Turns command-line arguments into import sources. A directory argument
 * expands to its {@code *.csv} children (not recursive), sorted by name.
 *
 * @since 1.0.0
 */
final class SourceResolver {

    private static final Logger LOG = LoggerFactory.getLogger(SourceResolver.class);

    private SourceResolver() {
        // utility class
    }

    /**
     * @param arguments file or directory paths
     * @return one source per CSV file, in argument order
     * @throws IllegalArgumentException if an argument names nothing on disk
     * @throws UncheckedIOException     if a directory cannot be listed
     */
    static List<ImportSource> resolve(List<String> arguments) {
        Objects.requireNonNull(arguments, "Arguments must not be null");
        List<ImportSource> sources = new ArrayList<>();
        for (String argument : arguments) {
            Path path = Path.of(argument);
            if (Files.isDirectory(path)) {
                List<Path> children = csvChildren(path);
                LOG.info("Directory {} holds {} CSV file(s)", path, children.size());
                children.forEach(child -> sources.add(ImportSource.ofPath(child)));
            } else if (Files.isRegularFile(path)) {
                sources.add(ImportSource.ofPath(path));
            } else {
                throw new IllegalArgumentException("Input not found: " + argument);
            }
        }
        return sources;
    }

    private static List<Path> csvChildren(Path directory) {
        try (Stream<Path> listing = Files.list(directory)) {
            return listing
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".csv"))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list directory: " + directory, e);
        }
    }
}
