package in.flipcycle.infrastructure.persistence;

import in.flipcycle.config.ExitConfig;
import in.flipcycle.config.LadderConfig;
import in.flipcycle.domain.cycle.CycleSnapshot;
import in.flipcycle.domain.cycle.CycleStatus;
import in.flipcycle.domain.cycle.FlipCycle;
import in.flipcycle.domain.cycle.FlipPhase;
import in.flipcycle.domain.ladder.LadderOrder;
import in.flipcycle.domain.ladder.RungStatus;
import in.flipcycle.domain.signal.ScoreBreakdown;
import in.flipcycle.domain.signal.ScoreDecision;
import in.flipcycle.domain.signal.ScoringWeights;
import in.flipcycle.service.ladder.CurvedLadderStrategy;
import in.flipcycle.service.ladder.LadderBuilder;
import in.flipcycle.support.TestSignals;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class JsonFileCycleSnapshotRepositoryTest {

    @TempDir
    Path dir;

    private static FlipCycle deployedCycle(String id, int startOffsetSeconds) {
        ScoreDecision decision = ScoreDecision.accept(ScoreBreakdown.uniform(80, ScoringWeights.defaults()), 60);
        FlipCycle cycle = new FlipCycle(id, TestSignals.btc().immediateExecution(true).build(), decision,
            TestSignals.T0.plusSeconds(startOffsetSeconds));
        cycle.advanceTo(FlipPhase.MEMORY_WEIGHTING, TestSignals.T0);
        cycle.advanceTo(FlipPhase.SPEARHEAD_INVOKED, TestSignals.T0);
        cycle.advanceTo(FlipPhase.LADDER_DEPLOYED, TestSignals.T0);
        LadderBuilder builder = new LadderBuilder(
            new CurvedLadderStrategy(LadderConfig.defaults()), LadderConfig.defaults(), ExitConfig.defaults());
        LadderOrder ladder = builder.build(cycle.signal(), new BigDecimal("100"), TestSignals.T0);
        cycle.updateLadder(ladder.withRung(1, ladder.rung(1).placed("PAPER-7")));
        return cycle;
    }

    @Test
    void testSaveAndReload() {
        JsonFileCycleSnapshotRepository repo = new JsonFileCycleSnapshotRepository(dir.resolve("cycles"));
        CycleSnapshot snapshot = deployedCycle("CYC-1", 0).snapshot();

        repo.save(snapshot);
        Optional<CycleSnapshot> loaded = new JsonFileCycleSnapshotRepository(dir.resolve("cycles")).findById("CYC-1");

        assertTrue(loaded.isPresent());
        CycleSnapshot s = loaded.get();
        assertEquals(FlipPhase.LADDER_DEPLOYED, s.phase());
        assertEquals(CycleStatus.ACTIVE, s.status());
        assertEquals(3, s.rungs().size());
        assertEquals(RungStatus.FILLED, s.rungs().get(0).status());
        assertEquals("PAPER-7", s.rungs().get(1).orderId());
        assertEquals(0, s.avgEntry().compareTo(new BigDecimal("100")));
        assertEquals(snapshot.startedAt(), s.startedAt());
        assertEquals(snapshot, s);
    }

    @Test
    void testOverwriteKeepsOneFilePerCycle() throws Exception {
        Path cycles = dir.resolve("cycles");
        JsonFileCycleSnapshotRepository repo = new JsonFileCycleSnapshotRepository(cycles);
        FlipCycle cycle = deployedCycle("CYC-1", 0);
        repo.save(cycle.snapshot());

        cycle.advanceTo(FlipPhase.CRYSTAL_SCAN, TestSignals.T0.plusSeconds(60));
        repo.save(cycle.snapshot());

        try (Stream<Path> files = Files.list(cycles)) {
            assertEquals(1, files.count());
        }
        assertEquals(FlipPhase.CRYSTAL_SCAN, repo.findById("CYC-1").orElseThrow().phase());
    }

    @Test
    void testFindAllOrderedByStart() {
        JsonFileCycleSnapshotRepository repo = new JsonFileCycleSnapshotRepository(dir);
        repo.save(deployedCycle("CYC-B", 30).snapshot());
        repo.save(deployedCycle("CYC-A", 10).snapshot());

        List<CycleSnapshot> all = repo.findAll();

        assertEquals(List.of("CYC-A", "CYC-B"), all.stream().map(CycleSnapshot::cycleId).toList());
        assertTrue(repo.findById("CYC-C").isEmpty());
    }

    @Test
    void testInMemoryRepository() {
        InMemoryCycleSnapshotRepository repo = new InMemoryCycleSnapshotRepository();
        repo.save(deployedCycle("CYC-1", 0).snapshot());

        assertEquals(1, repo.findAll().size());
        assertTrue(repo.findById("CYC-1").isPresent());
    }
}
