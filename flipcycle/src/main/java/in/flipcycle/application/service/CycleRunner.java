package in.flipcycle.application.service;

import in.flipcycle.config.LifecycleConfig;
import in.flipcycle.domain.cycle.FlipCycle;
import in.flipcycle.domain.order.PriceQuote;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Drives one ACTIVE cycle from LADDER_DEPLOYED on the shared scheduler.
 *
 * Timers:
 * - poll (fixed delay): price, fill reconciliation, exit evaluation
 * - cognitive check (fixed delay): live re-score, exit evaluation
 * - crystal scan (once, half the decay window)
 * - decay (once, end of the decay window): cancel unfilled rungs
 *
 * Every task runs under the runner lock, so ticks of one cycle never
 * overlap. A stopped runner ignores late ticks. The *Now() methods run the
 * same tasks on the caller's thread.
 */
public final class CycleRunner {
    private static final Logger log = LoggerFactory.getLogger(CycleRunner.class);

    private final FlipCycle cycle;
    private final LifecycleController controller;
    private final LifecycleConfig config;
    private final ReentrantLock lock = new ReentrantLock();
    private final List<ScheduledFuture<?>> timers = new ArrayList<>();

    // written under the lock, read by monitoring without it
    private volatile boolean stopped;
    private volatile int consecutivePriceFailures;
    private volatile double lastScore;

    CycleRunner(FlipCycle cycle, LifecycleController controller, LifecycleConfig config, double initialScore) {
        this.cycle = cycle;
        this.controller = controller;
        this.config = config;
        this.lastScore = initialScore;
    }

    void start(ScheduledExecutorService scheduler) {
        long poll = config.pollInterval().toMillis();
        long cognitive = config.cognitiveInterval().toMillis();
        synchronized (timers) {
            timers.add(scheduler.scheduleWithFixedDelay(this::pollNow, poll, poll, TimeUnit.MILLISECONDS));
            timers.add(scheduler.scheduleWithFixedDelay(this::cognitiveCheckNow, cognitive, cognitive, TimeUnit.MILLISECONDS));
            timers.add(scheduler.schedule(this::crystalScanNow, config.crystalScanDelay().toMillis(), TimeUnit.MILLISECONDS));
            timers.add(scheduler.schedule(this::decayNow, config.decayWindow().toMillis(), TimeUnit.MILLISECONDS));
        }
        log.info("Runner started for {}: poll {}s, cognitive {}s, crystal scan {}m, decay {}m",
            cycle.cycleId(), config.pollIntervalSeconds(), config.cognitiveIntervalSeconds(),
            config.crystalScanDelay().toMinutes(), config.decayWindowMinutes());
    }

    public void pollNow() {
        run("poll", () -> {
            Optional<PriceQuote> quote = fetch();
            quote.ifPresent(q -> controller.onPriceTick(cycle, q, lastScore));
        });
    }

    public void cognitiveCheckNow() {
        run("cognitive", () -> {
            Optional<PriceQuote> quote = fetch();
            quote.ifPresent(q -> {
                lastScore = controller.rescore(cycle, q);
                controller.onPriceTick(cycle, q, lastScore);
            });
        });
    }

    public void crystalScanNow() {
        run("crystal-scan", () -> controller.crystalScan(cycle));
    }

    public void decayNow() {
        run("decay", () -> controller.decay(cycle));
    }

    /**
     * Cancel all timers. Safe to call from inside a task.
     */
    void stop() {
        stopped = true;
        synchronized (timers) {
            for (ScheduledFuture<?> timer : timers) {
                timer.cancel(false);
            }
            timers.clear();
        }
    }

    public boolean isStopped() {
        return stopped;
    }

    public double lastScore() {
        return lastScore;
    }

    public int consecutivePriceFailures() {
        return consecutivePriceFailures;
    }

    /**
     * Run an operator action under the runner lock.
     */
    <T> T withLock(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private Optional<PriceQuote> fetch() {
        Optional<PriceQuote> quote = controller.fetchQuote(cycle.asset());
        if (quote.isPresent()) {
            if (consecutivePriceFailures > 0) {
                log.info("Price feed recovered for {} after {} failed polls", cycle.asset(), consecutivePriceFailures);
            }
            consecutivePriceFailures = 0;
            return quote;
        }
        consecutivePriceFailures++;
        controller.onPriceFeedFailure(cycle, consecutivePriceFailures);
        return Optional.empty();
    }

    private void run(String task, Runnable body) {
        lock.lock();
        try {
            if (stopped || !cycle.phase().isMonitored()) {
                return;
            }
            body.run();
        } catch (RuntimeException e) {
            log.error("Cycle {} {} task failed: {}", cycle.cycleId(), task, e.getMessage(), e);
            controller.onRunnerFailure(cycle, e);
        } finally {
            lock.unlock();
        }
    }
}
