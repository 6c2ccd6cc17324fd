package in.flipcycle.application.port.output;

import in.flipcycle.domain.cycle.CycleSnapshot;

import java.util.List;
import java.util.Optional;

/**
 * Persisted per-cycle state. The storage format belongs to the host
 * application.
 */
public interface CycleSnapshotRepository {

    void save(CycleSnapshot snapshot);

    Optional<CycleSnapshot> findById(String cycleId);

    List<CycleSnapshot> findAll();
}
