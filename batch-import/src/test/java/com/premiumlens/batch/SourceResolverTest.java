package com.premiumlens.batch;

import com.premiumlens.core.ingest.ImportSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SourceResolver}.
 */
class SourceResolverTest {

    @TempDir
    Path dir;

    @Test
    @DisplayName("Should expand a directory to its CSV files in name order")
    void shouldExpandDirectory() throws IOException {
        Files.writeString(dir.resolve("week25.csv"), "b");
        Files.writeString(dir.resolve("week24.CSV"), "a");
        Files.writeString(dir.resolve("notes.txt"), "skip");
        Files.createDirectory(dir.resolve("archive.csv"));

        List<ImportSource> sources = SourceResolver.resolve(List.of(dir.toString()));

        assertThat(sources).extracting(ImportSource::name)
                .containsExactly(dir.resolve("week24.CSV").toString(), dir.resolve("week25.csv").toString());
    }

    @Test
    @DisplayName("Should keep file arguments in order")
    void shouldKeepFileArguments() throws IOException {
        Path second = Files.writeString(dir.resolve("b.csv"), "b");
        Path first = Files.writeString(dir.resolve("a.csv"), "a");

        List<ImportSource> sources = SourceResolver.resolve(List.of(second.toString(), first.toString()));

        assertThat(sources).extracting(ImportSource::name).containsExactly(second.toString(), first.toString());
        assertThat(new String(sources.get(1).read(), StandardCharsets.UTF_8)).isEqualTo("a");
    }

    @Test
    @DisplayName("Should reject a path that does not exist")
    void shouldRejectMissingPath() {
        String missing = dir.resolve("missing.csv").toString();

        assertThatThrownBy(() -> SourceResolver.resolve(List.of(missing)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Input not found: " + missing);
    }
}
