package com.tradingagent.learning;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradingagent.exception.PersistenceException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Stores the adaptive context as a JSON file. Writes go to a sibling temp file first and
 * are moved into place, so a crash mid-write leaves the previous file intact.
 */
@Component
public class JsonFileAdaptiveContextStore implements AdaptiveContextStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileAdaptiveContextStore.class);

    private final Path path;
    private final ObjectMapper objectMapper;

    @Autowired
    public JsonFileAdaptiveContextStore(
            @Value("${tradingagent.learning.context-file:data/adaptive-context.json}") String path,
            ObjectMapper objectMapper) {
        this(Path.of(path), objectMapper);
    }

    public JsonFileAdaptiveContextStore(Path path, ObjectMapper objectMapper) {
        this.path = path;
        this.objectMapper = objectMapper;
    }

    @Override
    public AdaptiveContext load() {
        if (!Files.exists(path)) {
            log.info("No adaptive context at {}, starting fresh", path);
            return new AdaptiveContext();
        }
        try {
            AdaptiveContext context = objectMapper.readValue(path.toFile(), AdaptiveContext.class);
            log.info("Loaded adaptive context from {} ({} providers)", path, context.getProviderStats().size());
            return context;
        } catch (IOException e) {
            throw new PersistenceException("Failed to read adaptive context from " + path, e);
        }
    }

    @Override
    public void save(AdaptiveContext context) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = path.resolveSibling(path.getFileName() + ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), context);
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new PersistenceException("Failed to write adaptive context to " + path, e);
        }
    }
}
