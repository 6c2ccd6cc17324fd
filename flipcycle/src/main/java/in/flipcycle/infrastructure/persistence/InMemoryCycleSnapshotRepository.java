package in.flipcycle.infrastructure.persistence;

import in.flipcycle.application.port.output.CycleSnapshotRepository;
import in.flipcycle.domain.cycle.CycleSnapshot;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Snapshot repository kept in memory. Used in paper mode and tests.
 */
public final class InMemoryCycleSnapshotRepository implements CycleSnapshotRepository {

    private final Map<String, CycleSnapshot> snapshots = new ConcurrentHashMap<>();

    @Override
    public void save(CycleSnapshot snapshot) {
        snapshots.put(snapshot.cycleId(), snapshot);
    }

    @Override
    public Optional<CycleSnapshot> findById(String cycleId) {
        return Optional.ofNullable(snapshots.get(cycleId));
    }

    @Override
    public List<CycleSnapshot> findAll() {
        return snapshots.values().stream()
            .sorted(Comparator.comparing(CycleSnapshot::startedAt))
            .toList();
    }
}
