package com.tradingagent.unit.learning;

import static com.tradingagent.support.TestFixtures.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.tradingagent.exception.PersistenceException;
import com.tradingagent.learning.AdaptiveContext;
import com.tradingagent.learning.JsonFileAdaptiveContextStore;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonFileAdaptiveContextStoreTest {

    @TempDir
    Path tempDir;

    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Test
    @DisplayName("A missing file loads as a fresh context")
    void missingFile() {
        JsonFileAdaptiveContextStore store =
                new JsonFileAdaptiveContextStore(tempDir.resolve("none.json"), objectMapper);

        AdaptiveContext context = store.load();

        assertThat(context.getProviderStats()).isEmpty();
        assertThat(context.getTradesRecorded()).isZero();
    }

    @Test
    @DisplayName("Saved state survives a restart")
    void persistsAcrossInstances() {
        Path file = tempDir.resolve("nested/dir/context.json");
        AdaptiveContext context = new AdaptiveContext();
        context.recordTrade("trend_following", true);
        context.recordTrade("trend_following", false);
        context.recordTrade("trend_following", true);
        context.setTradesRecorded(3);
        context.recalculateWeights();
        context.setUpdatedAt(NOW);

        new JsonFileAdaptiveContextStore(file, objectMapper).save(context);
        AdaptiveContext loaded = new JsonFileAdaptiveContextStore(file, objectMapper).load();

        assertThat(loaded.getProviderStats().get("trend_following").getWins()).isEqualTo(2);
        assertThat(loaded.getProviderWeights()).containsEntry("trend_following", 1.0);
        assertThat(loaded.getTradesRecorded()).isEqualTo(3);
        assertThat(loaded.getUpdatedAt()).isEqualTo(NOW);
        assertThat(Files.exists(file.resolveSibling("context.json.tmp"))).isFalse();
    }

    @Test
    @DisplayName("A corrupt file is reported as a persistence failure")
    void corruptFile() throws IOException {
        Path file = tempDir.resolve("context.json");
        Files.writeString(file, "{not json");

        assertThatThrownBy(() -> new JsonFileAdaptiveContextStore(file, objectMapper).load())
                .isInstanceOf(PersistenceException.class)
                .hasMessageContaining(file.toString());
    }
}
