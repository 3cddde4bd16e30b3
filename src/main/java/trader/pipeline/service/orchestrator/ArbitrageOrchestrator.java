package trader.pipeline.service.orchestrator;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import trader.pipeline.config.EvaluatorProperties;
import trader.pipeline.config.OrchestratorProperties;
import trader.pipeline.event.PipelineEventBus;
import trader.pipeline.model.ConfigUpdate;
import trader.pipeline.model.DailyStats;
import trader.pipeline.model.EventType;
import trader.pipeline.model.ExecutionRequest;
import trader.pipeline.model.Opportunity;
import trader.pipeline.model.OrchestratorStatus;
import trader.pipeline.model.PipelineEvent;
import trader.pipeline.model.RiskAssessment;
import trader.pipeline.model.SettlementReport;
import trader.pipeline.model.Spread;
import trader.pipeline.model.TradeRecord;
import trader.pipeline.model.TradeStatus;
import trader.pipeline.model.TradingMode;
import trader.pipeline.service.evaluator.FeeConfig;
import trader.pipeline.service.evaluator.OpportunityEvaluator;
import trader.pipeline.service.execution.ExecutionEngine;
import trader.pipeline.service.ledger.CapitalLedger;
import trader.pipeline.service.ledger.CapitalReservationException;
import trader.pipeline.service.risk.RiskOracle;
import trader.pipeline.service.scanner.PriceAggregator;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Admits viable opportunities under rate, loss and capital limits and executes them one at a time.
 * <p>
 * Spreads arrive on the scan thread and are evaluated and admitted there. Admitted opportunities are
 * queued in FIFO order and drained by a single trade worker, so at most one trade settles at any time.
 * Every counter below is guarded by {@code stateLock}.
 */
@Slf4j
@Service
public class ArbitrageOrchestrator {

    private static final Duration HOUR = Duration.ofHours(1);

    private final PriceAggregator priceAggregator;
    private final OpportunityEvaluator evaluator;
    private final CapitalLedger capitalLedger;
    private final ExecutionEngine executionEngine;
    private final RiskOracle riskOracle;
    private final PipelineEventBus eventBus;
    private final TradeHistory tradeHistory;
    private final DailyStatsTracker dailyStats;
    private final OrchestratorProperties properties;
    private final Clock clock;
    private final Scheduler tradeScheduler;
    private final MeterRegistry meterRegistry;
    private final Counter viableOpportunitiesCounter;

    private final Object stateLock = new Object();
    private final Sinks.Many<PendingTrade> queue = Sinks.many().unicast().onBackpressureBuffer();
    private final AtomicInteger queueDepth = new AtomicInteger();

    private volatile TradingSettings settings;
    private volatile boolean running;
    private volatile boolean halted;
    private Instant startedAt;
    private int tradesThisHour;
    private Instant hourWindowStart;
    private BigDecimal dailyProfitLoss = BigDecimal.ZERO;
    private boolean dailyLossLimitReached;
    private BigDecimal allTimeProfit = BigDecimal.ZERO;
    private long tradesExecuted;
    private long successfulTrades;
    private Instant lastTradeTime;

    private Disposable worker;
    private Disposable spreadSubscription;

    public ArbitrageOrchestrator(PriceAggregator priceAggregator,
                                 OpportunityEvaluator evaluator,
                                 CapitalLedger capitalLedger,
                                 ExecutionEngine executionEngine,
                                 RiskOracle riskOracle,
                                 PipelineEventBus eventBus,
                                 TradeHistory tradeHistory,
                                 DailyStatsTracker dailyStats,
                                 OrchestratorProperties properties,
                                 EvaluatorProperties evaluatorProperties,
                                 Clock clock,
                                 @Qualifier("tradeScheduler") Scheduler tradeScheduler,
                                 MeterRegistry meterRegistry,
                                 @Qualifier("viableOpportunitiesCounter") Counter viableOpportunitiesCounter) {
        this.priceAggregator = priceAggregator;
        this.evaluator = evaluator;
        this.capitalLedger = capitalLedger;
        this.executionEngine = executionEngine;
        this.riskOracle = riskOracle;
        this.eventBus = eventBus;
        this.tradeHistory = tradeHistory;
        this.dailyStats = dailyStats;
        this.properties = properties;
        this.clock = clock;
        this.tradeScheduler = tradeScheduler;
        this.meterRegistry = meterRegistry;
        this.viableOpportunitiesCounter = viableOpportunitiesCounter;
        this.settings = TradingSettings.builder()
                .mode(properties.getMode())
                .maxTradesPerHour(properties.getMaxTradesPerHour())
                .dailyLossLimit(properties.getDailyLossLimit())
                .enableRiskOracle(properties.isEnableRiskOracle())
                .riskWindow(properties.getRiskWindow())
                .feeConfig(evaluatorProperties.toFeeConfig())
                .build();
        this.hourWindowStart = clock.instant();
    }

    @PostConstruct
    public void init() {
        worker = queue.asFlux()
                .publishOn(tradeScheduler)
                .concatMap(pending -> process(pending)
                        .onErrorResume(error -> {
                            log.error("Trade worker failed on {}: {}", pending.getTrade().getId(), error.getMessage(), error);
                            return Mono.empty();
                        }))
                .subscribe(trade -> log.debug("Trade {} finished as {}", trade.getId(), trade.getStatus()));

        spreadSubscription = priceAggregator.spreads().subscribe(
                this::onSpreads,
                error -> log.error("Orchestrator lost the spread feed: {}", error.getMessage(), error));

        log.info("Orchestrator ready in {} mode, capital {}", settings.getMode(), capitalLedger.getTotalCapital());
        if (properties.isAutoStart()) {
            start();
        }
    }

    @PreDestroy
    public void onDestroy() {
        stop();
        if (spreadSubscription != null) {
            spreadSubscription.dispose();
        }
        if (worker != null) {
            worker.dispose();
        }
    }

    // ---------------------------------------------------------------- admission

    void onSpreads(List<Spread> spreads) {
        if (!running) {
            return;
        }
        FeeConfig feeConfig = settings.getFeeConfig();
        for (Spread spread : spreads) {
            Opportunity opportunity;
            try {
                opportunity = evaluator.evaluate(spread, feeConfig);
            } catch (IllegalArgumentException e) {
                log.debug("Skipping invalid spread for {}: {}", spread.getSymbol(), e.getMessage());
                countRejection("invalid_spread");
                continue;
            }
            if (!evaluator.isViable(opportunity, feeConfig)) {
                countRejection("not_viable");
                continue;
            }
            viableOpportunitiesCounter.increment();
            submit(opportunity);
        }
    }

    /**
     * Runs the admission gates in order (rate limit, loss breaker, capital) and queues the opportunity
     * if all pass. Never throws for a rejected opportunity.
     */
    public AdmissionDecision submit(Opportunity opportunity) {
        AdmissionDecision decision;
        boolean breakerTripped = false;

        synchronized (stateLock) {
            TradingSettings current = settings;
            Instant now = clock.instant();
            rollHourWindow(now);

            if (!running) {
                decision = AdmissionDecision.REJECTED_NOT_RUNNING;
            } else if (tradesThisHour >= current.getMaxTradesPerHour()) {
                decision = AdmissionDecision.REJECTED_RATE_LIMIT;
            } else if (lossLimitBreached(current)) {
                breakerTripped = tripBreaker();
                decision = AdmissionDecision.REJECTED_DAILY_LOSS_LIMIT;
            } else if (capitalLedger.getAvailableCapital().compareTo(current.getFeeConfig().getCapitalAllocation()) < 0) {
                decision = AdmissionDecision.REJECTED_INSUFFICIENT_CAPITAL;
            } else {
                decision = enqueue(opportunity, current, now);
            }
        }

        if (breakerTripped) {
            publishSafetyLimit();
        }
        if (!decision.isAdmitted()) {
            log.debug("Opportunity {} {} rejected: {}", opportunity.getId(), opportunity.getSymbol(), decision);
            countRejection(decision.getReason());
        }
        return decision;
    }

    private AdmissionDecision enqueue(Opportunity opportunity, TradingSettings current, Instant now) {
        TradeRecord trade = TradeRecord.builder()
                .id("TRADE-" + UUID.randomUUID())
                .opportunityId(opportunity.getId())
                .symbol(opportunity.getSymbol())
                .buyVenue(opportunity.getBuyVenue())
                .sellVenue(opportunity.getSellVenue())
                .mode(current.getMode())
                .status(TradeStatus.PENDING)
                .expectedProfit(opportunity.getNetProfit())
                .startedAt(now)
                .build();

        // Counted at admission so one batch cannot overrun the hourly limit
        tradesThisHour++;
        queueDepth.incrementAndGet();
        Sinks.EmitResult result = queue.tryEmitNext(
                new PendingTrade(opportunity, trade, current.getFeeConfig().getCapitalAllocation()));
        if (result.isFailure()) {
            tradesThisHour--;
            queueDepth.decrementAndGet();
            log.error("Trade queue refused {}: {}", trade.getId(), result);
            return AdmissionDecision.REJECTED_NOT_RUNNING;
        }
        log.info("Admitted {} {}: buy {} @ {}, sell {} @ {}, expected profit {}",
                trade.getId(), opportunity.getSymbol(), opportunity.getBuyVenue(), opportunity.getBuyPrice(),
                opportunity.getSellVenue(), opportunity.getSellPrice(), opportunity.getNetProfit());
        return AdmissionDecision.ADMITTED;
    }

    private void rollHourWindow(Instant now) {
        if (Duration.between(hourWindowStart, now).compareTo(HOUR) >= 0) {
            tradesThisHour = 0;
            hourWindowStart = now;
        }
    }

    private boolean lossLimitBreached(TradingSettings current) {
        return dailyLossLimitReached || dailyProfitLoss.compareTo(current.getDailyLossLimit().negate()) < 0;
    }

    private boolean tripBreaker() {
        if (dailyLossLimitReached) {
            return false;
        }
        dailyLossLimitReached = true;
        log.warn("Daily loss limit reached: P&L {} below -{}. Admission closed until the circuit breaker is reset",
                dailyProfitLoss, settings.getDailyLossLimit());
        return true;
    }

    private void countRejection(String reason) {
        meterRegistry.counter("pipeline.opportunities.rejected", "reason", reason).increment();
    }

    // ---------------------------------------------------------------- execution

    private Mono<TradeRecord> process(PendingTrade pending) {
        queueDepth.decrementAndGet();
        if (!running) {
            return Mono.fromSupplier(() -> cancel(pending));
        }
        TradingSettings current = settings;
        return consultRiskOracle(pending.getOpportunity(), current)
                .flatMap(assessment -> assessment.isProceed()
                        ? execute(pending, current.getMode())
                        : Mono.fromSupplier(() -> block(pending, assessment.getRationale())));
    }

    private Mono<RiskAssessment> consultRiskOracle(Opportunity opportunity, TradingSettings current) {
        if (!current.isEnableRiskOracle()) {
            return Mono.just(RiskAssessment.proceed("Risk oracle disabled"));
        }
        return Mono.defer(() -> riskOracle.evaluate(
                        opportunity.getSymbol(),
                        opportunity.getBuyPrice(),
                        opportunity.getSellPrice(),
                        opportunity.getNetProfit(),
                        current.getRiskWindow()))
                .defaultIfEmpty(RiskAssessment.veto("Risk oracle returned no assessment"))
                .onErrorResume(error -> {
                    log.error("Risk oracle failed for {}: {}", opportunity.getSymbol(), error.getMessage());
                    return Mono.just(RiskAssessment.veto("Risk oracle error: " + error.getMessage()));
                });
    }

    private Mono<TradeRecord> execute(PendingTrade pending, TradingMode mode) {
        TradeRecord trade = pending.getTrade();
        return Mono.using(
                        () -> reserve(pending.getReservation()),
                        reserved -> {
                            trade.setStatus(TradeStatus.EXECUTING);
                            return settle(pending.getOpportunity(), trade, mode);
                        },
                        capitalLedger::release)
                .onErrorResume(CapitalReservationException.class, error -> {
                    log.error("Trade {} failed: {}", trade.getId(), error.getMessage());
                    return Mono.just(failure(error.getMessage()));
                })
                .publishOn(tradeScheduler)
                .map(report -> reconcile(pending, report));
    }

    private BigDecimal reserve(BigDecimal amount) {
        if (!capitalLedger.tryReserve(amount)) {
            throw new CapitalReservationException(amount, capitalLedger.getAvailableCapital());
        }
        return amount;
    }

    private Mono<SettlementReport> settle(Opportunity opportunity, TradeRecord trade, TradingMode mode) {
        if (mode == TradingMode.SIMULATION) {
            return Mono.just(SettlementReport.builder()
                    .status(TradeStatus.EXECUTED)
                    .actualProfit(opportunity.getNetProfit())
                    .fees(opportunity.getFees().getTotal().add(opportunity.getSlippageEstimate()))
                    .volume(opportunity.getBuyPrice().multiply(opportunity.getQuantity()))
                    .build());
        }
        return Mono.defer(() -> executionEngine.execute(ExecutionRequest.of(trade.getId(), opportunity)))
                .switchIfEmpty(Mono.fromSupplier(() -> failure("Execution engine returned no settlement report")))
                .onErrorResume(error -> {
                    log.error("Execution of {} failed: {}", trade.getId(), error.getMessage(), error);
                    return Mono.just(failure(error.getMessage()));
                });
    }

    private TradeRecord reconcile(PendingTrade pending, SettlementReport report) {
        TradeRecord trade = pending.getTrade();
        Instant now = clock.instant();
        TradeStatus status = report.getStatus();
        String error = report.getError();
        if (status != TradeStatus.EXECUTED && status != TradeStatus.FAILED && status != TradeStatus.ROLLED_BACK) {
            error = "Unexpected settlement status " + status;
            status = TradeStatus.FAILED;
        }
        BigDecimal profit = report.getActualProfit() != null ? report.getActualProfit() : BigDecimal.ZERO;

        trade.setStatus(status);
        trade.setActualProfit(profit);
        trade.setFees(report.getFees());
        trade.setVolume(report.getVolume());
        trade.setCompletedAt(now);
        trade.setError(error);

        boolean breakerTripped;
        synchronized (stateLock) {
            dailyProfitLoss = dailyProfitLoss.add(profit);
            allTimeProfit = allTimeProfit.add(profit);
            tradesExecuted++;
            if (status == TradeStatus.EXECUTED) {
                successfulTrades++;
            }
            lastTradeTime = now;
            breakerTripped = lossLimitBreached(settings) && tripBreaker();
        }
        if (profit.signum() != 0) {
            capitalLedger.applyProfit(profit);
        }
        dailyStats.recordTrade(trade);
        tradeHistory.add(trade);

        if (status == TradeStatus.EXECUTED) {
            log.info("Trade {} executed: {} profit {}", trade.getId(), trade.getSymbol(), profit);
        } else {
            log.error("Trade {} {}: {} profit {} ({})", trade.getId(), status, trade.getSymbol(), profit, error);
        }
        publish(terminalEventType(status), pending.getOpportunity(), trade, error);
        if (breakerTripped) {
            publishSafetyLimit();
        }
        return trade;
    }

    private TradeRecord cancel(PendingTrade pending) {
        String reason = "Pipeline stopped before execution";
        TradeRecord trade = pending.getTrade();
        trade.setStatus(TradeStatus.CANCELLED);
        trade.setCompletedAt(clock.instant());
        trade.setError(reason);
        dailyStats.recordTrade(trade);
        tradeHistory.add(trade);
        log.info("Trade {} cancelled: pipeline stopped", trade.getId());
        publish(EventType.TRADE_FAILED, pending.getOpportunity(), trade, reason);
        return trade;
    }

    private TradeRecord block(PendingTrade pending, String rationale) {
        TradeRecord trade = pending.getTrade();
        trade.setStatus(TradeStatus.CANCELLED);
        trade.setCompletedAt(clock.instant());
        trade.setError(rationale);
        dailyStats.recordBlocked();
        tradeHistory.add(trade);
        log.warn("Opportunity {} {} blocked by risk oracle: {}",
                pending.getOpportunity().getId(), trade.getSymbol(), rationale);
        publish(EventType.OPPORTUNITY_BLOCKED, pending.getOpportunity(), trade, rationale);
        return trade;
    }

    private static SettlementReport failure(String error) {
        return SettlementReport.builder()
                .status(TradeStatus.FAILED)
                .actualProfit(BigDecimal.ZERO)
                .error(error)
                .build();
    }

    private static EventType terminalEventType(TradeStatus status) {
        switch (status) {
            case EXECUTED:
                return EventType.TRADE_COMPLETED;
            case ROLLED_BACK:
                return EventType.TRADE_ROLLBACK;
            default:
                return EventType.TRADE_FAILED;
        }
    }

    private void publish(EventType type, Opportunity opportunity, TradeRecord trade, String reason) {
        eventBus.publish(PipelineEvent.builder()
                .type(type)
                .timestamp(clock.instant())
                .opportunity(opportunity)
                .trade(trade)
                .reason(reason)
                .build());
    }

    private void publishSafetyLimit() {
        BigDecimal pnl;
        synchronized (stateLock) {
            pnl = dailyProfitLoss;
        }
        eventBus.publish(PipelineEvent.builder()
                .type(EventType.SAFETY_LIMIT)
                .timestamp(clock.instant())
                .reason("Daily loss limit reached: P&L " + pnl.toPlainString())
                .build());
    }

    // ---------------------------------------------------------------- control surface

    /**
     * Starts scanning and admitting. Returns {@code false} if the pipeline was halted by the kill switch.
     */
    public boolean start() {
        synchronized (stateLock) {
            if (halted) {
                log.error("Refusing to start: pipeline was halted by the kill switch");
                return false;
            }
            if (running) {
                log.info("Pipeline already running");
                return true;
            }
            running = true;
            startedAt = clock.instant();
            dailyStats.markRunning(startedAt);
        }
        priceAggregator.start();
        log.info("=== Arbitrage pipeline started in {} mode ===", settings.getMode());
        return true;
    }

    /**
     * Stops scanning and admission. Queued opportunities are cancelled; an in-flight settlement completes.
     */
    public void stop() {
        synchronized (stateLock) {
            if (!running) {
                return;
            }
            running = false;
            dailyStats.markStopped(clock.instant());
        }
        priceAggregator.stop();
        log.info("=== Arbitrage pipeline stopped ({} queued opportunities will be cancelled) ===", queueDepth.get());
    }

    public void emergencyStop(String reason) {
        synchronized (stateLock) {
            halted = true;
        }
        log.error("EMERGENCY STOP: {}", reason);
        stop();
    }

    public void updateConfig(ConfigUpdate update) {
        synchronized (stateLock) {
            TradingSettings current = settings;
            if (update.getMode() != null && update.getMode() != current.getMode() && running) {
                log.error("Rejected mode change from {} to {}: pipeline is running", current.getMode(), update.getMode());
                throw new ModeChangeRejectedException(current.getMode(), update.getMode());
            }
            validate(update);
            if (update.getTotalCapital() != null) {
                capitalLedger.setTotalCapital(update.getTotalCapital());
            }

            TradingSettings.TradingSettingsBuilder next = current.toBuilder();
            FeeConfig.FeeConfigBuilder fees = current.getFeeConfig().toBuilder();
            if (update.getMode() != null) {
                next.mode(update.getMode());
            }
            if (update.getMaxTradesPerHour() != null) {
                next.maxTradesPerHour(update.getMaxTradesPerHour());
            }
            if (update.getDailyLossLimit() != null) {
                next.dailyLossLimit(update.getDailyLossLimit());
            }
            if (update.getEnableRiskOracle() != null) {
                next.enableRiskOracle(update.getEnableRiskOracle());
            }
            if (update.getCapitalAllocation() != null) {
                fees.capitalAllocation(update.getCapitalAllocation());
            }
            if (update.getMinProfitThreshold() != null) {
                fees.minProfitThreshold(update.getMinProfitThreshold());
            }
            if (update.getMinConfidence() != null) {
                fees.minConfidence(update.getMinConfidence());
            }
            if (update.getTakerFeeRate() != null) {
                fees.takerFeeRate(update.getTakerFeeRate());
            }
            if (update.getMaxSlippageRate() != null) {
                fees.maxSlippageRate(update.getMaxSlippageRate());
            }
            if (update.getNetworkFee() != null) {
                fees.networkFee(update.getNetworkFee());
            }
            settings = next.feeConfig(fees.build()).build();
            log.info("Configuration updated: {}", settings);
        }
    }

    private void validate(ConfigUpdate update) {
        requirePositive(update.getTotalCapital(), "totalCapital");
        requirePositive(update.getCapitalAllocation(), "capitalAllocation");
        requireNonNegative(update.getDailyLossLimit(), "dailyLossLimit");
        requireNonNegative(update.getMinProfitThreshold(), "minProfitThreshold");
        requireNonNegative(update.getNetworkFee(), "networkFee");
        requireRate(update.getTakerFeeRate(), "takerFeeRate");
        requireRate(update.getMaxSlippageRate(), "maxSlippageRate");
        if (update.getMaxTradesPerHour() != null && update.getMaxTradesPerHour() < 0) {
            throw new IllegalArgumentException("maxTradesPerHour must not be negative: " + update.getMaxTradesPerHour());
        }
        Double minConfidence = update.getMinConfidence();
        if (minConfidence != null && (minConfidence < 0 || minConfidence > 100)) {
            throw new IllegalArgumentException("minConfidence must be within [0, 100]: " + minConfidence);
        }
    }

    private static void requirePositive(BigDecimal value, String field) {
        if (value != null && value.signum() <= 0) {
            throw new IllegalArgumentException(field + " must be positive: " + value);
        }
    }

    private static void requireNonNegative(BigDecimal value, String field) {
        if (value != null && value.signum() < 0) {
            throw new IllegalArgumentException(field + " must not be negative: " + value);
        }
    }

    private static void requireRate(BigDecimal value, String field) {
        if (value != null && (value.signum() < 0 || value.compareTo(BigDecimal.ONE) >= 0)) {
            throw new IllegalArgumentException(field + " must be a fraction within [0, 1): " + value);
        }
    }

    public OrchestratorStatus getStatus() {
        synchronized (stateLock) {
            Instant now = clock.instant();
            rollHourWindow(now);
            return OrchestratorStatus.builder()
                    .running(running)
                    .halted(halted)
                    .mode(settings.getMode())
                    .uptime(running ? Duration.between(startedAt, now) : Duration.ZERO)
                    .totalCapital(capitalLedger.getTotalCapital())
                    .reservedCapital(capitalLedger.getReservedCapital())
                    .availableCapital(capitalLedger.getAvailableCapital())
                    .dailyProfitLoss(dailyProfitLoss)
                    .dailyLossLimitReached(dailyLossLimitReached)
                    .allTimeProfit(allTimeProfit)
                    .tradesExecuted(tradesExecuted)
                    .winRate(tradesExecuted == 0 ? 0 : successfulTrades * 100.0 / tradesExecuted)
                    .tradesThisHour(tradesThisHour)
                    .queuedOpportunities(queueDepth.get())
                    .lastTradeTime(lastTradeTime)
                    .build();
        }
    }

    public DailyStats getDailyStats() {
        return dailyStats.snapshot(clock.instant());
    }

    /**
     * Re-opens admission after a loss breach. Also zeroes the day's loss accumulator, otherwise the
     * next admission would trip the breaker again.
     */
    public void resetCircuitBreaker() {
        synchronized (stateLock) {
            log.warn("Circuit breaker reset (daily P&L was {})", dailyProfitLoss);
            dailyLossLimitReached = false;
            dailyProfitLoss = BigDecimal.ZERO;
        }
    }

    /**
     * Midnight rollover: returns the closed day's statistics. A tripped breaker stays tripped.
     */
    public DailyStats rollDailyStats() {
        DailyStats closed;
        synchronized (stateLock) {
            dailyProfitLoss = BigDecimal.ZERO;
            closed = dailyStats.roll(clock.instant());
        }
        log.info("Daily stats for {}: {} trades, {} successful, profit {}, uptime {}%",
                closed.getDate(), closed.getTradesExecuted(), closed.getSuccessfulTrades(),
                closed.getTotalProfit(), String.format("%.1f", closed.getUptimePercent()));
        return closed;
    }

    public List<TradeRecord> getRecentTrades(int limit) {
        return tradeHistory.recent(limit);
    }

    public int getQueuedOpportunities() {
        return queueDepth.get();
    }

    public boolean isRunning() {
        return running;
    }

    public boolean isHalted() {
        return halted;
    }

    public TradingMode getMode() {
        return settings.getMode();
    }

    @Value
    @Builder(toBuilder = true)
    static class TradingSettings {
        TradingMode mode;
        int maxTradesPerHour;
        BigDecimal dailyLossLimit;
        boolean enableRiskOracle;
        Duration riskWindow;
        FeeConfig feeConfig;
    }

    @Value
    static class PendingTrade {
        Opportunity opportunity;
        TradeRecord trade;
        BigDecimal reservation;
    }
}
