package in.flipcycle.service.history;

import in.flipcycle.domain.history.MemoryEcho;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory history. Single writer, many readers.
 */
public class InMemoryHistoryStore implements HistoryStore {

    private final List<MemoryEcho> echoes = new ArrayList<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    @Override
    public void append(MemoryEcho echo) {
        Objects.requireNonNull(echo, "echo");
        lock.writeLock().lock();
        try {
            echoes.add(echo);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<MemoryEcho> query(String asset, String patternClass, Duration lookback, Instant now) {
        Instant since = now.minus(lookback);
        lock.readLock().lock();
        try {
            return echoes.stream()
                .filter(e -> matches(e, asset, patternClass))
                .filter(e -> e.completedAt() != null && !e.completedAt().isBefore(since))
                .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<MemoryEcho> all() {
        lock.readLock().lock();
        try {
            return List.copyOf(echoes);
        } finally {
            lock.readLock().unlock();
        }
    }

    static boolean matches(MemoryEcho echo, String asset, String patternClass) {
        return (asset != null && asset.equals(echo.asset()))
            || (patternClass != null && patternClass.equals(echo.patternClass()));
    }
}
