package in.flipcycle.infrastructure.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import in.flipcycle.domain.history.MemoryEcho;
import in.flipcycle.service.history.InMemoryHistoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

/**
 * Durable history: one MemoryEcho per line, appended. The file is replayed
 * into memory on construction; queries are served from memory.
 *
 * Malformed lines are skipped with a warning so one bad write does not lose
 * the rest of the history.
 */
public final class JsonLinesHistoryStore extends InMemoryHistoryStore {
    private static final Logger log = LoggerFactory.getLogger(JsonLinesHistoryStore.class);
    private static final ObjectMapper MAPPER = JsonMappers.create();

    private final Path file;

    public JsonLinesHistoryStore(Path file) {
        this.file = file;
        reload();
    }

    @Override
    public synchronized void append(MemoryEcho echo) {
        try {
            String line = MAPPER.writeValueAsString(echo) + System.lineSeparator();
            Files.writeString(file, line, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to append echo " + echo.cycleId() + " to " + file, e);
        }
        super.append(echo);
    }

    private void reload() {
        if (!Files.exists(file)) {
            try {
                Path parent = file.toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot create history directory for " + file, e);
            }
            log.info("No history file yet: {}", file);
            return;
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read history " + file, e);
        }
        int loaded = 0;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank()) {
                continue;
            }
            try {
                super.append(MAPPER.readValue(line, MemoryEcho.class));
                loaded++;
            } catch (IOException e) {
                log.warn("Skipping malformed history line {} in {}: {}", i + 1, file, e.getMessage());
            }
        }
        log.info("✅ Loaded {} echoes from {}", loaded, file);
    }
}
