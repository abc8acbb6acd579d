package com.iplicense.search.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SearchConfigLoaderTest {
    private final SearchConfigLoader loader = new SearchConfigLoader();

    @TempDir
    Path tempDir;

    @Test
    void overridesOnlyKeysPresentInFile() throws IOException {
        Path file = write("""
            weights:
              textual: 2
              recency: 1
              popularity: 1
              quality: 0
            recency:
              half_life_days: 30
            limits:
              max_results_per_entity: 25
            """);

        SearchConfig config = loader.apply(SearchConfig.builder(), file.toString()).build();

        assertEquals(0.5, config.getWeights().textual(), 1e-9);
        assertEquals(0.25, config.getWeights().recency(), 1e-9);
        assertEquals(0.0, config.getWeights().quality(), 1e-9);
        assertEquals(30.0, config.getHalfLifeDays(), 1e-9);
        assertEquals(730.0, config.getMaxAgeDays(), 1e-9);
        assertEquals(25, config.getPerEntityCap());
        assertEquals(20, config.getDefaultPageSize());
    }

    @Test
    void readsStopWords() throws IOException {
        Path file = write("""
            parsing:
              min_query_length: 3
              stop_words: [foo, bar]
            """);

        SearchConfig config = loader.apply(SearchConfig.builder(), file.toString()).build();

        assertEquals(3, config.getMinQueryLength());
        assertThat(config.getStopWords()).containsExactlyInAnyOrder("foo", "bar");
    }

    @Test
    void missingFileKeepsBuilder() {
        SearchConfig config = loader.apply(SearchConfig.builder(), tempDir.resolve("absent.yaml").toString()).build();

        assertEquals(90.0, config.getHalfLifeDays(), 1e-9);
    }

    @Test
    void emptyFileKeepsBuilder() throws IOException {
        Path file = write("");

        SearchConfig config = loader.apply(SearchConfig.builder(), file.toString()).build();

        assertEquals(100, config.getMaxPageSize());
    }

    @Test
    void nonMapRootIsRejected() throws IOException {
        Path file = write("- just\n- a list\n");

        assertThatThrownBy(() -> loader.apply(SearchConfig.builder(), file.toString()))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("root not map");
    }

    @Test
    void nonNumericValueIsRejected() throws IOException {
        Path file = write("""
            recency:
              half_life_days: soon
            """);

        assertThatThrownBy(() -> loader.apply(SearchConfig.builder(), file.toString()))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("not a number");
    }

    @Test
    void invalidValuesFailValidationOnBuild() throws IOException {
        Path file = write("""
            weights:
              textual: 0
              recency: 0
              popularity: 0
              quality: 0
            """);

        SearchConfig.Builder builder = loader.apply(SearchConfig.builder(), file.toString());

        assertThatThrownBy(builder::build)
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("weights must not all be zero");
    }

    private Path write(String content) throws IOException {
        Path file = tempDir.resolve("scoring.yaml");
        Files.writeString(file, content);
        return file;
    }
}
