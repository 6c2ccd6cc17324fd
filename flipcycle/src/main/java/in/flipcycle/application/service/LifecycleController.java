package in.flipcycle.application.service;

import in.flipcycle.application.port.output.AlertNotifier;
import in.flipcycle.application.port.output.CycleSnapshotRepository;
import in.flipcycle.application.port.output.ExchangeConnector;
import in.flipcycle.application.port.output.PriceFeed;
import in.flipcycle.application.port.output.ReserveTransferPort;
import in.flipcycle.application.port.output.RiskSignal;
import in.flipcycle.config.FlipConfig;
import in.flipcycle.config.LifecycleConfig;
import in.flipcycle.domain.common.FlipErrorCode;
import in.flipcycle.domain.common.ValidationResult;
import in.flipcycle.domain.cycle.CycleStatus;
import in.flipcycle.domain.cycle.ExitDecision;
import in.flipcycle.domain.cycle.ExitReason;
import in.flipcycle.domain.cycle.FlipCycle;
import in.flipcycle.domain.cycle.FlipPhase;
import in.flipcycle.domain.cycle.SubmissionResult;
import in.flipcycle.domain.cycle.TrailingStop;
import in.flipcycle.domain.history.MemoryEcho;
import in.flipcycle.domain.ladder.LadderOrder;
import in.flipcycle.domain.ladder.LadderRung;
import in.flipcycle.domain.ladder.RungStatus;
import in.flipcycle.domain.monitoring.AlertLevel;
import in.flipcycle.domain.order.OrderSide;
import in.flipcycle.domain.order.OrderStatus;
import in.flipcycle.domain.order.PriceQuote;
import in.flipcycle.domain.signal.MarketContext;
import in.flipcycle.domain.signal.ScoreDecision;
import in.flipcycle.domain.signal.Signal;
import in.flipcycle.infrastructure.common.RetryPolicy;
import in.flipcycle.infrastructure.common.Sleeper;
import in.flipcycle.infrastructure.metrics.CycleMetrics;
import in.flipcycle.service.exit.ExitMonitor;
import in.flipcycle.service.fill.FillTracker;
import in.flipcycle.service.history.HistoryStore;
import in.flipcycle.service.history.MemoryWeighting;
import in.flipcycle.service.ladder.CurvedLadderStrategy;
import in.flipcycle.service.ladder.LadderBuilder;
import in.flipcycle.service.ladder.LadderConstructionException;
import in.flipcycle.service.ladder.LadderStrategy;
import in.flipcycle.service.scoring.RayScoringStrategy;
import in.flipcycle.service.scoring.ScoringStrategy;
import in.flipcycle.service.scoring.SignalScorer;
import in.flipcycle.service.scoring.SignalValidator;
import in.flipcycle.service.vault.CapitalPool;
import in.flipcycle.service.vault.VaultAllocator;
import in.flipcycle.service.vault.VaultLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * LifecycleController - drives every flip cycle through the nine phases.
 *
 * PHASES:
 * 1. SIGNAL_RECEIVED    validate + score, reject without a cycle
 * 2. MEMORY_WEIGHTING   context multiplier from the history store
 * 3. SPEARHEAD_INVOKED  consensus gate (score, context, capital, cap, asset)
 * 4. LADDER_DEPLOYED    build + place the ladder, start the CycleRunner
 * 5. CRYSTAL_SCAN       mid-flight exposure / decayed score / risk check
 * 6. ASHEN_FLAME        emergency exit
 * 7. WINDMARK           normal exit, optional re-entry
 * 8. GLYPH_LOCK         vault allocation
 * 9. ECHO_IMPRINT       memory echo, COMPLETED, capital released
 *
 * THREADING:
 * Phases 1-4 run on the submitting thread. From phase 4 on, every mutation of
 * a cycle happens on its CycleRunner under the runner lock. Admission to the
 * global cap is atomic in ActiveCycleIndex.
 *
 * FAILURE:
 * Orders that cannot be cancelled or a position that cannot be closed raise
 * the manual-intervention flag (CRITICAL alert). The cycle then keeps its
 * capital and index slot until resolveManualIntervention().
 */
public final class LifecycleController {
    private static final Logger log = LoggerFactory.getLogger(LifecycleController.class);

    private static final int MONEY_SCALE = 8;
    private static final double MILLIS_PER_HOUR = 3_600_000.0;

    private final FlipConfig config;
    private final LifecycleConfig lifecycle;
    private final PriceFeed priceFeed;
    private final ExchangeConnector exchange;
    private final AlertNotifier alerts;
    private final CycleSnapshotRepository snapshots;
    private final HistoryStore history;
    private final RiskSignal riskSignal;
    private final CycleMetrics metrics;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;
    private final Sleeper sleeper;

    private final SignalValidator validator = new SignalValidator();
    private final SignalScorer scorer;
    private final MemoryWeighting memory;
    private final LadderBuilder ladderBuilder;
    private final FillTracker fillTracker;
    private final ExitMonitor exitMonitor;
    private final OrderCanceller canceller;
    private final CapitalPool capitalPool;
    private final VaultAllocator vault;
    private final ActiveCycleIndex index = new ActiveCycleIndex();

    private final Map<String, FlipCycle> cycles = new ConcurrentHashMap<>();
    private final Map<String, CycleRunner> runners = new ConcurrentHashMap<>();
    private final Map<String, BigDecimal> reservedCapital = new ConcurrentHashMap<>();
    private final Map<String, BigDecimal> lastPrices = new ConcurrentHashMap<>();

    private LifecycleController(Builder b) {
        this.config = b.config;
        this.lifecycle = b.config.lifecycle();
        this.priceFeed = b.priceFeed;
        this.exchange = b.exchange;
        this.alerts = b.alerts;
        this.snapshots = b.snapshots;
        this.history = b.history;
        this.riskSignal = b.riskSignal;
        this.metrics = b.metrics;
        this.scheduler = b.scheduler;
        this.clock = b.clock;
        this.sleeper = b.sleeper;

        this.scorer = new SignalScorer(b.scoringStrategy, config.scoring());
        this.memory = new MemoryWeighting(history, lifecycle.memoryLookback());
        this.ladderBuilder = new LadderBuilder(b.ladderStrategy, config.ladder(), config.exit());
        this.fillTracker = new FillTracker(lifecycle.orderTimeout());
        this.fillTracker.addListener(event -> metrics.recordFill(event.asset()));
        this.exitMonitor = new ExitMonitor(config.exit(), config.scoring().cognitiveExitThreshold());
        this.canceller = new OrderCanceller(exchange, lifecycle, sleeper, clock);
        this.capitalPool = b.capitalPool != null ? b.capitalPool : new CapitalPool(lifecycle.initialCapital());
        VaultLedger ledger = b.vaultLedger != null ? b.vaultLedger : new VaultLedger();
        this.vault = new VaultAllocator(ledger, config.vault(), b.reserveTransfer, capitalPool, clock);
    }

    // ═══════════════════════════════════════════════════════════════
    // Phases 1-4: submission
    // ═══════════════════════════════════════════════════════════════

    /**
     * Run a signal through phases 1-4.
     *
     * @return rejected (no cycle), blocked (terminal BLOCKED_* cycle) or
     *         admitted (ladder deployed, runner started)
     */
    public SubmissionResult submit(Signal signal) {
        Instant now = clock.instant();
        log.info("═══ Signal {} received: {} band [{} .. {}] target {} stop {} capital {}",
            signal.signalId(), signal.asset(), signal.entryLow(), signal.entryHigh(),
            signal.targetPrice(), signal.stopPrice(), signal.capital());

        // 1. SIGNAL_RECEIVED
        ValidationResult validation = validator.validate(signal);
        if (!validation.passed()) {
            log.warn("❌ Signal {} rejected: {}", signal.signalId(), validation.reason());
            metrics.recordSubmission("REJECTED");
            return SubmissionResult.rejected(FlipErrorCode.SIGNAL_INVALID, validation.reason(), null);
        }

        MarketContext context = marketContext(signal.asset(), now);
        List<MemoryEcho> echoes = memory.relevantEchoes(signal, now);
        ScoreDecision decision = scorer.score(signal, context, echoes);
        if (!decision.accepted()) {
            log.warn("❌ Signal {} rejected: {}", signal.signalId(), decision.reason());
            metrics.recordSubmission("REJECTED");
            return SubmissionResult.rejected(FlipErrorCode.SCORE_BELOW_THRESHOLD, decision.reason(), decision);
        }

        FlipCycle cycle = new FlipCycle("CYC-" + UUID.randomUUID(), signal, decision, now);
        cycles.put(cycle.cycleId(), cycle);
        metrics.recordPhaseTransition(FlipPhase.SIGNAL_RECEIVED);
        save(cycle);

        // 2. MEMORY_WEIGHTING
        advance(cycle, FlipPhase.MEMORY_WEIGHTING);
        double multiplier = MemoryWeighting.contextMultiplier(echoes);
        cycle.setContextMultiplier(multiplier);
        log.info("Cycle {} context multiplier {} from {} echoes",
            cycle.cycleId(), String.format("%.2f", multiplier), echoes.size());

        // 3. SPEARHEAD_INVOKED
        advance(cycle, FlipPhase.SPEARHEAD_INVOKED);
        SubmissionResult blocked = consensusGate(cycle);
        if (blocked != null) {
            return blocked;
        }

        // 4. LADDER_DEPLOYED
        try {
            return deploy(cycle, context);
        } catch (RuntimeException e) {
            log.error("Cycle {} deployment failed: {}", cycle.cycleId(), e.getMessage(), e);
            flagManualIntervention(cycle, "Deployment failed: " + e.getMessage());
            return new SubmissionResult(cycle.cycleId(), cycle.status(), FlipErrorCode.ORDER_PLACEMENT_FAILED,
                cycle.statusReason(), decision);
        }
    }

    private SubmissionResult consensusGate(FlipCycle cycle) {
        Signal signal = cycle.signal();
        ScoreDecision decision = cycle.scoreDecision();
        double multiplier = cycle.contextMultiplier();

        double adjusted = scorer.adjust(decision.total(), multiplier);
        if (adjusted < config.scoring().rejectionThreshold()) {
            return block(cycle, CycleStatus.BLOCKED_SCORE, FlipErrorCode.SCORE_BELOW_THRESHOLD,
                String.format("History-adjusted score %.1f below threshold %.1f",
                    adjusted, config.scoring().rejectionThreshold()));
        }
        if (multiplier < lifecycle.minContextMultiplier()) {
            return block(cycle, CycleStatus.BLOCKED_CONTEXT, FlipErrorCode.CONTEXT_TOO_WEAK,
                String.format("Context multiplier %.2f below minimum %.2f",
                    multiplier, lifecycle.minContextMultiplier()));
        }
        if (!capitalPool.tryReserve(signal.capital())) {
            return block(cycle, CycleStatus.BLOCKED_CAPITAL, FlipErrorCode.INSUFFICIENT_CAPITAL,
                String.format("Capital %s exceeds available %s", signal.capital(), capitalPool.available()));
        }

        ActiveCycleIndex.Admission admission =
            index.admit(cycle.cycleId(), signal.asset(), lifecycle.maxConcurrentCycles());
        return switch (admission) {
            case ADMITTED -> {
                reservedCapital.put(cycle.cycleId(), signal.capital());
                metrics.setActiveCycles(index.size());
                yield null;
            }
            case AT_CAPACITY -> {
                capitalPool.release(signal.capital(), BigDecimal.ZERO);
                yield block(cycle, CycleStatus.BLOCKED_CAPACITY, FlipErrorCode.MAX_CONCURRENT_CYCLES,
                    String.format("Active cycles at maximum %d", lifecycle.maxConcurrentCycles()));
            }
            case ASSET_ALREADY_ACTIVE -> {
                capitalPool.release(signal.capital(), BigDecimal.ZERO);
                rememberReentryCandidate(signal);
                yield block(cycle, CycleStatus.BLOCKED_DUPLICATE_ASSET, FlipErrorCode.ASSET_ALREADY_ACTIVE,
                    "Asset " + signal.asset() + " already has an active cycle");
            }
        };
    }

    private SubmissionResult block(FlipCycle cycle, CycleStatus status, FlipErrorCode code, String reason) {
        cycle.block(status, reason, clock.instant());
        save(cycle);
        metrics.recordSubmission(status.name());
        log.warn("⛔ Cycle {} {}: {}", cycle.cycleId(), status, reason);
        return SubmissionResult.blocked(cycle.cycleId(), status, code, reason, cycle.scoreDecision());
    }

    // Accepted-by-score duplicate becomes the active cycle's re-entry candidate
    private void rememberReentryCandidate(Signal candidate) {
        index.activeCycleFor(candidate.asset()).map(cycles::get).ifPresent(active -> {
            Signal current = active.reentrySignal();
            if (current == null || candidate.receivedAt().isAfter(current.receivedAt())) {
                active.setReentrySignal(candidate);
                log.info("Cycle {} re-entry candidate: {}", active.cycleId(), candidate.signalId());
            }
        });
    }

    private SubmissionResult deploy(FlipCycle cycle, MarketContext context) {
        advance(cycle, FlipPhase.LADDER_DEPLOYED);
        Instant now = clock.instant();
        Signal signal = cycle.signal();
        BigDecimal market = context.hasPrice() ? context.price() : null;

        if (signal.immediateExecution() && market == null) {
            log.warn("No market price for {}, deploying without the pre-filled rung", signal.asset());
            signal = signal.toBuilder().immediateExecution(false).build();
        }

        LadderOrder ladder;
        try {
            ladder = ladderBuilder.build(signal, market, now);
        } catch (LadderConstructionException e) {
            log.error("Ladder construction failed for {}: {}", cycle.cycleId(), e.getMessage());
            alerts.notify("Ladder construction failed for " + signal.asset() + ": " + e.getMessage(), AlertLevel.MEDIUM);
            exit(cycle, ExitReason.LADDER_FAILED, market);
            return failedDeployment(cycle, e.getMessage());
        }

        ladder = placeLadderOrders(cycle, signal, ladder, market, now);
        cycle.updateLadder(ladder);
        save(cycle);

        if (!ladder.hasFills() && !ladder.hasOpenRungs()) {
            alerts.notify("Every rung order failed for " + signal.asset(), AlertLevel.MEDIUM);
            exit(cycle, ExitReason.LADDER_FAILED, market);
            return failedDeployment(cycle, "All rung orders failed");
        }

        refreshProtectiveOrder(cycle);

        CycleRunner runner = new CycleRunner(cycle, this, lifecycle,
            scorer.adjust(cycle.scoreDecision().total(), cycle.contextMultiplier()));
        runners.put(cycle.cycleId(), runner);
        runner.start(scheduler);

        metrics.recordSubmission("ADMITTED");
        log.info("🚀 Cycle {} deployed: {} rungs for {} (avg entry {}, hardStop {}, takeProfit {})",
            cycle.cycleId(), ladder.size(), signal.asset(), ladder.avgEntry(), ladder.hardStop(), ladder.takeProfit());
        return SubmissionResult.admitted(cycle.cycleId(), cycle.scoreDecision());
    }

    private SubmissionResult failedDeployment(FlipCycle cycle, String reason) {
        metrics.recordSubmission("LADDER_FAILED");
        return new SubmissionResult(cycle.cycleId(), cycle.status(), FlipErrorCode.ORDER_PLACEMENT_FAILED,
            reason, cycle.scoreDecision());
    }

    private LadderOrder placeLadderOrders(FlipCycle cycle, Signal signal, LadderOrder built,
                                          BigDecimal market, Instant now) {
        LadderOrder ladder = built;
        if (signal.immediateExecution()) {
            LadderRung first = ladder.rung(0);
            Optional<String> orderId = placeMarketOrder(signal.asset(), OrderSide.BUY, first.size());
            if (orderId.isPresent()) {
                ladder = ladder.withRung(0, first.withOrderId(orderId.get()));
                metrics.recordFill(signal.asset());
                log.info("Rung 0 of {} executed at market {} (order {})", cycle.cycleId(), market, orderId.get());
            } else {
                log.warn("Market entry failed for {}, resting every rung as a limit order", cycle.cycleId());
                Signal resting = signal.toBuilder().immediateExecution(false).build();
                ladder = ladderBuilder.build(resting, built.size(), null, now);
            }
        }

        for (LadderRung rung : ladder.rungs()) {
            if (rung.status() != RungStatus.PENDING) {
                continue;
            }
            Optional<String> orderId = placeLimitOrder(signal.asset(), OrderSide.BUY, rung.size(), rung.price());
            ladder = ladder.withRung(rung.tier(), orderId.map(rung::placed).orElseGet(rung::failed));
        }
        return ladder;
    }

    // ═══════════════════════════════════════════════════════════════
    // Runner callbacks (runner lock held)
    // ═══════════════════════════════════════════════════════════════

    /**
     * Price fetch bounded by priceTimeoutMs. Empty means skip this tick.
     */
    Optional<PriceQuote> fetchQuote(String asset) {
        try {
            PriceQuote quote = priceFeed.getPrice(asset).get(lifecycle.priceTimeoutMs(), TimeUnit.MILLISECONDS);
            if (quote == null || quote.price() == null || quote.price().signum() <= 0) {
                log.warn("Price feed returned no usable quote for {}", asset);
                return Optional.empty();
            }
            lastPrices.put(asset, quote.price());
            return Optional.of(quote);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        } catch (ExecutionException | TimeoutException e) {
            log.warn("Price poll failed for {}: {}", asset, rootMessage(e));
            return Optional.empty();
        }
    }

    void onPriceFeedFailure(FlipCycle cycle, int consecutiveFailures) {
        metrics.recordPriceFeedFailure(cycle.asset());
        if (consecutiveFailures == lifecycle.priceFailureWarnThreshold()) {
            log.warn("⚠️ {} consecutive price failures for {} (cycle {}), still monitoring",
                consecutiveFailures, cycle.asset(), cycle.cycleId());
            alerts.notify(String.format("[%s] Price feed failing for %s: %d consecutive polls",
                FlipErrorCode.PRICE_FEED_UNAVAILABLE, cycle.asset(), consecutiveFailures), AlertLevel.MEDIUM);
        }
    }

    /**
     * Reconcile fills against the quote, then evaluate exits.
     */
    void onPriceTick(FlipCycle cycle, PriceQuote quote, double score) {
        if (!cycle.phase().isMonitored()) {
            return;
        }
        Instant now = clock.instant();
        BigDecimal price = quote.price();

        LadderOrder before = cycle.ladder();
        LadderOrder after = fillTracker.reconcile(before, price, exchange, now);
        TrailingStop trailingBefore = cycle.trailingStop();
        if (after != before) {
            cycle.updateLadder(after);
            if (after.filledCount() > before.filledCount()) {
                refreshProtectiveOrder(cycle);
            }
        }

        ExitDecision decision = exitMonitor.evaluate(cycle, price, score);
        if (decision.isExit()) {
            exit(cycle, decision.toReason(), price);
            return;
        }
        if (after != before || !cycle.trailingStop().equals(trailingBefore)) {
            save(cycle);
        }
    }

    /**
     * Adjusted live re-score of the cycle's signal at the quoted price.
     */
    double rescore(FlipCycle cycle, PriceQuote quote) {
        MarketContext context = MarketContext.of(quote.price(), quote.change24hPct(), quote.timestamp());
        double score = scorer.rescore(cycle.signal(), context, cycle.contextMultiplier());
        log.debug("Cycle {} re-score {}", cycle.cycleId(), String.format("%.1f", score));
        return score;
    }

    /**
     * Phase 5: overexposure, time-decayed score and external risk.
     */
    void crystalScan(FlipCycle cycle) {
        if (cycle.phase() != FlipPhase.LADDER_DEPLOYED) {
            return;
        }
        advance(cycle, FlipPhase.CRYSTAL_SCAN);
        Instant now = clock.instant();

        double exposure = index.exposure(lifecycle.maxConcurrentCycles());
        double hours = Duration.between(cycle.startedAt(), now).toMillis() / MILLIS_PER_HOUR;
        double decay = Math.max(lifecycle.scoreDecayFloor(), 1.0 - lifecycle.scoreDecayPerHour() * hours);
        double reevaluated = cycle.scoreDecision().total() * decay;
        double risk = assessRisk(cycle.asset());

        log.info("🔮 Crystal scan {}: exposure {} score {} (decay {}) risk {}",
            cycle.cycleId(), String.format("%.2f", exposure), String.format("%.1f", reevaluated),
            String.format("%.2f", decay), String.format("%.2f", risk));

        BigDecimal price = lastPrices.get(cycle.asset());
        if (exposure > lifecycle.overexposureThreshold()) {
            exit(cycle, ExitReason.OVEREXPOSURE, price);
        } else if (reevaluated < scorer.cognitiveExitThreshold()) {
            exit(cycle, ExitReason.COGNITIVE_EXIT, price);
        } else if (risk > lifecycle.riskSignalThreshold()) {
            exit(cycle, ExitReason.RISK_SIGNAL, price);
        }
    }

    /**
     * Decay timer: cancel unfilled rungs. A ladder with no fills ends the
     * cycle.
     */
    void decay(FlipCycle cycle) {
        if (!cycle.phase().isMonitored()) {
            return;
        }
        Instant now = clock.instant();
        LadderOrder reconciled = fillTracker.reconcile(cycle.ladder(), null, exchange, now);
        RungCancellation cancellation = cancelOpenRungs(cycle, reconciled, now);
        LadderOrder ladder = cancellation.ladder();
        boolean newFills = ladder.filledCount() > cycle.ladder().filledCount();
        cycle.updateLadder(ladder);

        if (!ladder.hasFills()) {
            log.info("⌛ Cycle {} ladder decayed with no fills", cycle.cycleId());
            exit(cycle, ExitReason.LADDER_DECAYED, lastPrices.get(cycle.asset()));
            return;
        }
        if (!cancellation.unresolved().isEmpty()) {
            alerts.notify(String.format("Cycle %s: rung orders %s still working after decay",
                cycle.cycleId(), cancellation.unresolved()), AlertLevel.MEDIUM);
        }
        if (newFills) {
            refreshProtectiveOrder(cycle);
        }
        save(cycle);
        log.info("⌛ Cycle {} ladder decayed, holding {} of {} rungs (avg entry {})",
            cycle.cycleId(), ladder.filledCount(), ladder.size(), ladder.avgEntry());
    }

    void onRunnerFailure(FlipCycle cycle, RuntimeException e) {
        if (cycle.isFinished() || cycle.manualIntervention()) {
            return;
        }
        stopRunner(cycle);
        flagManualIntervention(cycle, "Runner failure in " + cycle.phase() + ": " + e.getMessage());
    }

    // ═══════════════════════════════════════════════════════════════
    // Phases 6-9: exit
    // ═══════════════════════════════════════════════════════════════

    private void exit(FlipCycle cycle, ExitReason reason, BigDecimal triggerPrice) {
        if (!cycle.phase().isMonitored()) {
            return;
        }
        stopRunner(cycle);
        Instant now = clock.instant();

        // 6 / 7
        FlipPhase exitPhase = reason.isEmergency() ? FlipPhase.ASHEN_FLAME : FlipPhase.WINDMARK;
        advance(cycle, exitPhase);
        if (reason.isEmergency()) {
            cycle.markStatus(CycleStatus.EMERGENCY_EXIT, reason.name(), now);
        }

        CloseOutcome outcome = closePosition(cycle, triggerPrice, now);
        cycle.recordExit(reason, outcome.exitPrice(), outcome.profit(), now);
        metrics.recordExit(reason, outcome.profit(), Duration.between(cycle.startedAt(), now));
        log.info("Cycle {} exit {} @ {}: P&L {}", cycle.cycleId(), reason, outcome.exitPrice(), outcome.profit());

        if (reason.isEmergency()) {
            alerts.notify(String.format("Emergency exit %s for %s (%s): P&L %s",
                reason, cycle.asset(), cycle.cycleId(), outcome.profit()), AlertLevel.HIGH);
        }
        if (!outcome.problems().isEmpty()) {
            String code = reason.isEmergency() ? "[" + FlipErrorCode.EMERGENCY_EXIT_PARTIAL_FAILURE + "] " : "";
            flagManualIntervention(cycle, code + String.join("; ", outcome.problems()));
            return;
        }

        boolean reentry = exitPhase == FlipPhase.WINDMARK && approveReentry(cycle, reason, now);
        glyphLock(cycle);
        echoImprint(cycle, reentry);
    }

    private record CloseOutcome(BigDecimal exitPrice, BigDecimal profit, List<String> problems) {
    }

    // Cancel everything, reconcile late fills, sell the filled size at market
    private CloseOutcome closePosition(FlipCycle cycle, BigDecimal triggerPrice, Instant now) {
        List<String> problems = new ArrayList<>();

        RungCancellation cancellation = cancelOpenRungs(cycle, cycle.ladder(), now);
        LadderOrder ladder = cancellation.ladder();
        cancellation.unresolved().forEach(id -> problems.add("rung order " + id + " not cancelled"));
        cycle.updateLadder(ladder);

        boolean soldByProtective = false;
        List<String> protective = cycle.protectiveOrderIds();
        if (!protective.isEmpty()) {
            OrderCanceller.Result result = canceller.cancelAll(cycle.cycleId(), protective);
            result.cancelled().forEach(cycle::removeProtectiveOrder);
            for (String orderId : result.failed()) {
                OrderStatus status = orderStatus(orderId);
                switch (status) {
                    case FILLED -> {
                        soldByProtective = true;
                        cycle.removeProtectiveOrder(orderId);
                    }
                    case CANCELLED, REJECTED -> cycle.removeProtectiveOrder(orderId);
                    case OPEN, PARTIAL, UNKNOWN -> problems.add("protective order " + orderId + " not cancelled");
                }
            }
        }

        BigDecimal exitPrice = triggerPrice != null ? triggerPrice : lastKnownPrice(cycle);
        if (soldByProtective) {
            exitPrice = ladder.takeProfit();
            log.info("Cycle {} position already sold by protective order @ {}", cycle.cycleId(), exitPrice);
        } else if (ladder.hasFills()) {
            if (placeMarketExit(cycle, ladder.filledSize()).isEmpty()) {
                problems.add("market exit of " + ladder.filledSize() + " " + cycle.asset() + " not placed");
            }
        }

        return new CloseOutcome(exitPrice, profit(ladder, exitPrice), problems);
    }

    private record RungCancellation(LadderOrder ladder, List<String> unresolved) {
    }

    private RungCancellation cancelOpenRungs(FlipCycle cycle, LadderOrder ladder, Instant now) {
        LadderOrder current = ladder;
        Map<String, Integer> working = new LinkedHashMap<>();
        for (LadderRung rung : ladder.rungs()) {
            if (rung.hasWorkingOrder()) {
                working.put(rung.orderId(), rung.tier());
            } else if (rung.isOpen()) {
                current = current.withRung(rung.tier(), rung.cancelled());
            }
        }
        List<String> unresolved = new ArrayList<>();
        if (working.isEmpty()) {
            return new RungCancellation(current, unresolved);
        }

        OrderCanceller.Result result = canceller.cancelAll(cycle.cycleId(), working.keySet());
        for (String orderId : result.cancelled()) {
            metrics.recordOrderCancellation(true);
            int tier = working.get(orderId);
            current = current.withRung(tier, current.rung(tier).cancelled());
        }
        for (String orderId : result.failed()) {
            metrics.recordOrderCancellation(false);
            int tier = working.get(orderId);
            OrderStatus status = orderStatus(orderId);
            switch (status) {
                case FILLED -> current = fillTracker.onFill(current, tier, now);
                case CANCELLED -> current = current.withRung(tier, current.rung(tier).cancelled());
                case REJECTED -> current = current.withRung(tier, current.rung(tier).failed());
                case OPEN, PARTIAL, UNKNOWN -> unresolved.add(orderId);
            }
        }
        return new RungCancellation(current, unresolved);
    }

    // WINDMARK: re-enter only after a clean, fully filled run
    private boolean approveReentry(FlipCycle cycle, ExitReason reason, Instant now) {
        Signal candidate = cycle.reentrySignal();
        LadderOrder ladder = cycle.ladder();
        if (candidate == null) {
            return false;
        }
        boolean clean = ladder != null && ladder.allFilled() && !reason.isEmergency();
        boolean newer = candidate.receivedAt().isAfter(cycle.signal().receivedAt());
        boolean inWindow = !candidate.receivedAt().isBefore(now.minus(lifecycle.reentryWindow()));
        double match = MemoryWeighting.memoryMatch(echoFor(cycle, now), candidate);
        boolean approved = clean && newer && inWindow && match >= lifecycle.reentryMemoryMatch();

        log.info("🜁 WINDMARK {}: candidate {} clean={} newer={} inWindow={} match={} -> {}",
            cycle.cycleId(), candidate.signalId(), clean, newer, inWindow,
            String.format("%.2f", match), approved ? "RE-ENTER" : "no re-entry");
        return approved;
    }

    // 8. GLYPH_LOCK
    private void glyphLock(FlipCycle cycle) {
        advance(cycle, FlipPhase.GLYPH_LOCK);
        BigDecimal profit = cycle.realizedProfit();
        if (profit.signum() <= 0) {
            return;
        }
        if (profit.compareTo(config.vault().minimumProfit()) >= 0) {
            vault.allocate(cycle.cycleId(), profit)
                .ifPresent(entry -> metrics.recordVaultAllocation(entry.reserveAmount()));
        } else {
            capitalPool.credit(profit);
            log.info("Cycle {} profit {} below vault minimum, credited to working capital", cycle.cycleId(), profit);
        }
    }

    // 9. ECHO_IMPRINT
    private void echoImprint(FlipCycle cycle, boolean reentry) {
        advance(cycle, FlipPhase.ECHO_IMPRINT);
        Instant now = clock.instant();
        MemoryEcho echo = echoFor(cycle, now);
        try {
            history.append(echo);
        } catch (RuntimeException e) {
            log.error("Failed to record echo for {}: {}", cycle.cycleId(), e.getMessage(), e);
            alerts.notify("History append failed for " + cycle.cycleId() + ": " + e.getMessage(), AlertLevel.MEDIUM);
        }

        BigDecimal reserved = reservedCapital.remove(cycle.cycleId());
        if (reserved != null) {
            capitalPool.release(reserved, cycle.realizedProfit().min(BigDecimal.ZERO));
        }
        index.release(cycle.cycleId());
        runners.remove(cycle.cycleId());

        ExitReason reason = cycle.exitReason();
        cycle.markStatus(CycleStatus.COMPLETED, reason != null ? reason.name() : null, now);
        save(cycle);
        metrics.setActiveCycles(index.size());
        log.info("═══ Cycle {} COMPLETED: {} {} P&L {} (success={}) ═══",
            cycle.cycleId(), cycle.asset(), reason, cycle.realizedProfit(), echo.success());

        Signal candidate = cycle.reentrySignal();
        cycle.setReentrySignal(null);
        if (reentry && candidate != null) {
            log.info("Re-entering {} with {}", cycle.asset(), candidate.signalId());
            SubmissionResult result = submit(candidate);
            log.info("Re-entry {} -> {}", candidate.signalId(), result.isAdmitted() ? result.cycleId() : result.reason());
        }
    }

    private MemoryEcho echoFor(FlipCycle cycle, Instant now) {
        LadderOrder ladder = cycle.ladder();
        BigDecimal profit = cycle.realizedProfit();
        double ratio = ladder != null && ladder.filledValue().signum() > 0
            ? profit.doubleValue() / ladder.filledValue().doubleValue()
            : 0.0;
        Signal signal = cycle.signal();
        return new MemoryEcho(cycle.cycleId(), signal.asset(), signal.patternClass(), profit.signum() > 0,
            ratio, signal.emotionalContext(), signal.volatilityContext(), now);
    }

    // ═══════════════════════════════════════════════════════════════
    // Manual intervention
    // ═══════════════════════════════════════════════════════════════

    private void flagManualIntervention(FlipCycle cycle, String reason) {
        cycle.flagManualIntervention(reason, clock.instant());
        save(cycle);
        metrics.recordManualIntervention();
        log.error("🚨 Cycle {} needs manual intervention: {}", cycle.cycleId(), reason);
        alerts.notify(String.format("Cycle %s (%s) needs manual intervention: %s",
            cycle.cycleId(), cycle.asset(), reason), AlertLevel.CRITICAL);
    }

    /**
     * Complete a flagged cycle after the operator closed the position by hand.
     *
     * @param exitPrice price the operator exited at; P&L is computed from it
     * @throws IllegalArgumentException if the cycle is unknown
     * @throws IllegalStateException if the cycle is not flagged
     */
    public FlipCycle resolveManualIntervention(String cycleId, BigDecimal exitPrice) {
        FlipCycle cycle = cycles.get(cycleId);
        if (cycle == null) {
            throw new IllegalArgumentException("Unknown cycle: " + cycleId);
        }
        Objects.requireNonNull(exitPrice, "exitPrice");
        CycleRunner runner = runners.get(cycleId);
        if (runner == null) {
            return resolve(cycle, exitPrice);
        }
        return runner.withLock(() -> resolve(cycle, exitPrice));
    }

    private FlipCycle resolve(FlipCycle cycle, BigDecimal exitPrice) {
        if (!cycle.manualIntervention()) {
            throw new IllegalStateException("Cycle " + cycle.cycleId() + " is not awaiting manual intervention");
        }
        Instant now = clock.instant();
        stopRunner(cycle);

        LadderOrder ladder = cycle.ladder();
        if (ladder != null) {
            LadderOrder settled = ladder;
            for (LadderRung rung : ladder.rungs()) {
                if (rung.isOpen()) {
                    settled = settled.withRung(rung.tier(), rung.cancelled());
                }
            }
            cycle.updateLadder(settled);
            ladder = settled;
        }
        for (String orderId : cycle.protectiveOrderIds()) {
            cycle.removeProtectiveOrder(orderId);
        }

        ExitReason reason = cycle.exitReason() != null ? cycle.exitReason() : ExitReason.MANUAL;
        BigDecimal profit = ladder != null ? profit(ladder, exitPrice) : BigDecimal.ZERO;
        cycle.recordExit(reason, exitPrice, profit, now);
        cycle.clearManualIntervention(now);
        cycle.markStatus(reason.isEmergency() ? CycleStatus.EMERGENCY_EXIT : CycleStatus.ACTIVE,
            "Resolved manually", now);
        log.info("Cycle {} manual intervention resolved @ {}: P&L {}", cycle.cycleId(), exitPrice, profit);

        switch (cycle.phase()) {
            case LADDER_DEPLOYED, CRYSTAL_SCAN -> {
                advance(cycle, FlipPhase.WINDMARK);
                glyphLock(cycle);
                echoImprint(cycle, false);
            }
            case ASHEN_FLAME, WINDMARK -> {
                glyphLock(cycle);
                echoImprint(cycle, false);
            }
            case GLYPH_LOCK -> echoImprint(cycle, false);
            case SIGNAL_RECEIVED, MEMORY_WEIGHTING, SPEARHEAD_INVOKED, ECHO_IMPRINT ->
                throw new IllegalStateException("Cycle " + cycle.cycleId() + " cannot be resolved from " + cycle.phase());
        }
        return cycle;
    }

    // ═══════════════════════════════════════════════════════════════
    // Queries / shutdown
    // ═══════════════════════════════════════════════════════════════

    public Optional<FlipCycle> cycle(String cycleId) {
        return Optional.ofNullable(cycles.get(cycleId));
    }

    public List<FlipCycle> cycles() {
        List<FlipCycle> all = new ArrayList<>(cycles.values());
        all.sort(Comparator.comparing(FlipCycle::startedAt));
        return all;
    }

    public Optional<CycleRunner> runner(String cycleId) {
        return Optional.ofNullable(runners.get(cycleId));
    }

    public int activeCycleCount() {
        return index.size();
    }

    public CapitalPool capitalPool() {
        return capitalPool;
    }

    public VaultLedger vaultLedger() {
        return vault.ledger();
    }

    /**
     * Stop every runner. Cycles keep their state; nothing is cancelled at
     * the exchange.
     */
    public void shutdown() {
        log.info("Stopping {} cycle runners", runners.size());
        for (CycleRunner runner : runners.values()) {
            runner.stop();
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // Helpers
    // ═══════════════════════════════════════════════════════════════

    private void advance(FlipCycle cycle, FlipPhase next) {
        cycle.advanceTo(next, clock.instant());
        metrics.recordPhaseTransition(next);
        save(cycle);
        log.info("Cycle {} → phase {} {}", cycle.cycleId(), next.number(), next);
    }

    private void save(FlipCycle cycle) {
        try {
            snapshots.save(cycle.snapshot());
        } catch (RuntimeException e) {
            log.error("Failed to save snapshot for {}: {}", cycle.cycleId(), e.getMessage(), e);
        }
    }

    private void stopRunner(FlipCycle cycle) {
        CycleRunner runner = runners.get(cycle.cycleId());
        if (runner != null) {
            runner.stop();
        }
    }

    private MarketContext marketContext(String asset, Instant now) {
        Optional<PriceQuote> quote = fetchQuote(asset);
        if (quote.isEmpty()) {
            metrics.recordPriceFeedFailure(asset);
            log.warn("No market price for {} at submission, scoring from the entry band", asset);
            return MarketContext.unavailable(now);
        }
        PriceQuote q = quote.get();
        return MarketContext.of(q.price(), q.change24hPct(), q.timestamp());
    }

    private double assessRisk(String asset) {
        try {
            return MemoryWeighting.clampUnit(riskSignal.assess(asset));
        } catch (RuntimeException e) {
            log.warn("Risk signal failed for {}, treating as no risk: {}", asset, e.getMessage());
            return 0.0;
        }
    }

    private BigDecimal lastKnownPrice(FlipCycle cycle) {
        return fetchQuote(cycle.asset())
            .map(PriceQuote::price)
            .orElseGet(() -> lastPrices.get(cycle.asset()));
    }

    private static BigDecimal profit(LadderOrder ladder, BigDecimal exitPrice) {
        if (!ladder.hasFills() || exitPrice == null) {
            return BigDecimal.ZERO;
        }
        return exitPrice.subtract(ladder.avgEntry()).multiply(ladder.filledSize())
            .setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }

    // Protective take-profit sell sized to the current filled position
    private void refreshProtectiveOrder(FlipCycle cycle) {
        if (!config.exit().protectiveOrdersEnabled()) {
            return;
        }
        LadderOrder ladder = cycle.ladder();
        if (ladder == null || !ladder.hasFills()) {
            return;
        }
        List<String> existing = cycle.protectiveOrderIds();
        if (!existing.isEmpty()) {
            OrderCanceller.Result result = canceller.cancelAll(cycle.cycleId(), existing);
            result.cancelled().forEach(cycle::removeProtectiveOrder);
            if (!result.allCancelled()) {
                log.warn("Cycle {} keeps protective orders {}", cycle.cycleId(), result.failed());
                return;
            }
        }
        placeLimitOrder(cycle.asset(), OrderSide.SELL, ladder.filledSize(), ladder.takeProfit())
            .ifPresent(orderId -> {
                cycle.addProtectiveOrder(orderId);
                log.info("Cycle {} protective sell {} @ {} ({})",
                    cycle.cycleId(), ladder.filledSize(), ladder.takeProfit(), orderId);
            });
    }

    private Optional<String> placeMarketExit(FlipCycle cycle, BigDecimal size) {
        RetryPolicy policy = RetryPolicy.forOrders(lifecycle);
        while (policy.shouldRetry()) {
            Optional<String> orderId = placeMarketOrder(cycle.asset(), OrderSide.SELL, size);
            if (orderId.isPresent()) {
                log.info("Cycle {} market exit {} {} ({})", cycle.cycleId(), size, cycle.asset(), orderId.get());
                return orderId;
            }
            Duration delay = policy.getNextDelay();
            policy.recordFailure();
            if (!policy.shouldRetry()) {
                break;
            }
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        log.error("❌ Cycle {} market exit failed after {} attempts", cycle.cycleId(), policy.getAttemptCount());
        return Optional.empty();
    }

    private Optional<String> placeLimitOrder(String asset, OrderSide side, BigDecimal size, BigDecimal price) {
        return awaitOrder(asset, side, size, () -> exchange.placeLimitOrder(asset, side, size, price));
    }

    private Optional<String> placeMarketOrder(String asset, OrderSide side, BigDecimal size) {
        return awaitOrder(asset, side, size, () -> exchange.placeMarketOrder(asset, side, size));
    }

    private Optional<String> awaitOrder(String asset, OrderSide side, BigDecimal size,
                                        Supplier<CompletableFuture<String>> call) {
        try {
            String orderId = call.get().get(lifecycle.orderTimeoutMs(), TimeUnit.MILLISECONDS);
            metrics.recordOrderPlacement(orderId != null);
            return Optional.ofNullable(orderId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            metrics.recordOrderPlacement(false);
            return Optional.empty();
        } catch (ExecutionException | TimeoutException | RuntimeException e) {
            metrics.recordOrderPlacement(false);
            log.warn("[{}] {} {} {} failed: {}", FlipErrorCode.ORDER_PLACEMENT_FAILED, side, size, asset, rootMessage(e));
            return Optional.empty();
        }
    }

    private OrderStatus orderStatus(String orderId) {
        try {
            OrderStatus status = exchange.getOrderStatus(orderId)
                .get(lifecycle.orderTimeoutMs(), TimeUnit.MILLISECONDS);
            return status != null ? status : OrderStatus.UNKNOWN;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return OrderStatus.UNKNOWN;
        } catch (ExecutionException | TimeoutException | RuntimeException e) {
            log.warn("Order status unavailable for {}: {}", orderId, rootMessage(e));
            return OrderStatus.UNKNOWN;
        }
    }

    private static String rootMessage(Exception e) {
        Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
        return cause.getMessage();
    }

    // ═══════════════════════════════════════════════════════════════
    // Builder
    // ═══════════════════════════════════════════════════════════════

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private FlipConfig config = FlipConfig.defaults();
        private PriceFeed priceFeed;
        private ExchangeConnector exchange;
        private AlertNotifier alerts;
        private CycleSnapshotRepository snapshots;
        private HistoryStore history;
        private ReserveTransferPort reserveTransfer;
        private ScheduledExecutorService scheduler;
        private ScoringStrategy scoringStrategy;
        private LadderStrategy ladderStrategy;
        private RiskSignal riskSignal = RiskSignal.none();
        private CycleMetrics metrics = CycleMetrics.NOOP;
        private CapitalPool capitalPool;
        private VaultLedger vaultLedger;
        private Clock clock = Clock.systemUTC();
        private Sleeper sleeper = Sleeper.SYSTEM;

        public Builder config(FlipConfig config) { this.config = config; return this; }
        public Builder priceFeed(PriceFeed priceFeed) { this.priceFeed = priceFeed; return this; }
        public Builder exchange(ExchangeConnector exchange) { this.exchange = exchange; return this; }
        public Builder alerts(AlertNotifier alerts) { this.alerts = alerts; return this; }
        public Builder snapshots(CycleSnapshotRepository snapshots) { this.snapshots = snapshots; return this; }
        public Builder history(HistoryStore history) { this.history = history; return this; }
        public Builder reserveTransfer(ReserveTransferPort reserveTransfer) { this.reserveTransfer = reserveTransfer; return this; }
        public Builder scheduler(ScheduledExecutorService scheduler) { this.scheduler = scheduler; return this; }
        public Builder scoringStrategy(ScoringStrategy scoringStrategy) { this.scoringStrategy = scoringStrategy; return this; }
        public Builder ladderStrategy(LadderStrategy ladderStrategy) { this.ladderStrategy = ladderStrategy; return this; }
        public Builder riskSignal(RiskSignal riskSignal) { this.riskSignal = riskSignal; return this; }
        public Builder metrics(CycleMetrics metrics) { this.metrics = metrics; return this; }
        public Builder capitalPool(CapitalPool capitalPool) { this.capitalPool = capitalPool; return this; }
        public Builder vaultLedger(VaultLedger vaultLedger) { this.vaultLedger = vaultLedger; return this; }
        public Builder clock(Clock clock) { this.clock = clock; return this; }
        public Builder sleeper(Sleeper sleeper) { this.sleeper = sleeper; return this; }

        public LifecycleController build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(priceFeed, "priceFeed");
            Objects.requireNonNull(exchange, "exchange");
            Objects.requireNonNull(alerts, "alerts");
            Objects.requireNonNull(snapshots, "snapshots");
            Objects.requireNonNull(history, "history");
            Objects.requireNonNull(reserveTransfer, "reserveTransfer");
            Objects.requireNonNull(scheduler, "scheduler");
            if (scoringStrategy == null) {
                scoringStrategy = new RayScoringStrategy(config.scoring());
            }
            if (ladderStrategy == null) {
                ladderStrategy = new CurvedLadderStrategy(config.ladder());
            }
            return new LifecycleController(this);
        }
    }
}
