package in.flipcycle.infrastructure.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import in.flipcycle.application.port.output.CycleSnapshotRepository;
import in.flipcycle.domain.cycle.CycleSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * One pretty-printed JSON file per cycle: {dir}/{cycleId}.json.
 *
 * Writes go to a temp file first and are moved into place, so a crash never
 * leaves a half-written snapshot.
 */
public final class JsonFileCycleSnapshotRepository implements CycleSnapshotRepository {
    private static final Logger log = LoggerFactory.getLogger(JsonFileCycleSnapshotRepository.class);
    private static final ObjectMapper MAPPER = JsonMappers.create();

    private final Path directory;

    public JsonFileCycleSnapshotRepository(Path directory) {
        this.directory = directory;
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create snapshot directory " + directory, e);
        }
    }

    @Override
    public synchronized void save(CycleSnapshot snapshot) {
        Path target = fileFor(snapshot.cycleId());
        Path tmp = directory.resolve(snapshot.cycleId() + ".json.tmp");
        try {
            Files.writeString(tmp, MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(snapshot));
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Snapshot saved: {} {} {}", snapshot.cycleId(), snapshot.phase(), snapshot.status());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to save snapshot " + snapshot.cycleId(), e);
        }
    }

    @Override
    public synchronized Optional<CycleSnapshot> findById(String cycleId) {
        Path file = fileFor(cycleId);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        return Optional.of(read(file));
    }

    @Override
    public synchronized List<CycleSnapshot> findAll() {
        List<CycleSnapshot> result = new ArrayList<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*.json")) {
            for (Path file : files) {
                result.add(read(file));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list snapshots in " + directory, e);
        }
        result.sort(Comparator.comparing(CycleSnapshot::startedAt));
        return result;
    }

    private CycleSnapshot read(Path file) {
        try {
            return MAPPER.readValue(Files.readString(file), CycleSnapshot.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read snapshot " + file, e);
        }
    }

    private Path fileFor(String cycleId) {
        return directory.resolve(cycleId + ".json");
    }
}
