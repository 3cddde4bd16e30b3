package trader.pipeline.service.orchestrator;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;
import trader.pipeline.config.EvaluatorProperties;
import trader.pipeline.config.OrchestratorProperties;
import trader.pipeline.event.PipelineEventBus;
import trader.pipeline.model.ConfigUpdate;
import trader.pipeline.model.DailyStats;
import trader.pipeline.model.EventType;
import trader.pipeline.model.ExecutionRequest;
import trader.pipeline.model.Opportunity;
import trader.pipeline.model.PipelineEvent;
import trader.pipeline.model.RiskAssessment;
import trader.pipeline.model.SettlementReport;
import trader.pipeline.model.Spread;
import trader.pipeline.model.TradeRecord;
import trader.pipeline.model.TradeStatus;
import trader.pipeline.model.TradingMode;
import trader.pipeline.service.evaluator.OpportunityEvaluator;
import trader.pipeline.service.execution.ExecutionEngine;
import trader.pipeline.service.ledger.CapitalLedger;
import trader.pipeline.service.risk.RiskOracle;
import trader.pipeline.service.scanner.PriceAggregator;
import trader.pipeline.support.MutableClock;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ArbitrageOrchestratorTest {

    private static final Instant START = Instant.parse("2024-03-01T10:15:00Z");

    private final MutableClock clock = new MutableClock(START);
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final PipelineEventBus eventBus = new PipelineEventBus();
    private final OpportunityEvaluator evaluator = new OpportunityEvaluator();
    private final EvaluatorProperties evaluatorProperties = new EvaluatorProperties();
    private final OrchestratorProperties properties = new OrchestratorProperties();
    private final List<PipelineEvent> events = new CopyOnWriteArrayList<>();
    private final Sinks.Many<List<Spread>> spreadFeed = Sinks.many().multicast().directBestEffort();

    private PriceAggregator priceAggregator;
    private ExecutionEngine executionEngine;
    private RiskOracle riskOracle;
    private CapitalLedger ledger;
    private ArbitrageOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        priceAggregator = mock(PriceAggregator.class);
        when(priceAggregator.spreads()).thenReturn(spreadFeed.asFlux());
        executionEngine = mock(ExecutionEngine.class);
        riskOracle = mock(RiskOracle.class);
        properties.setEnableRiskOracle(false);
        eventBus.events().subscribe(events::add);
    }

    @AfterEach
    void tearDown() {
        if (orchestrator != null) {
            orchestrator.onDestroy();
        }
    }

    private ArbitrageOrchestrator newOrchestrator(BigDecimal capital) {
        ledger = new CapitalLedger(capital);
        orchestrator = new ArbitrageOrchestrator(priceAggregator, evaluator, ledger, executionEngine, riskOracle,
                eventBus, new TradeHistory(100), new DailyStatsTracker(START), properties, evaluatorProperties,
                clock, Schedulers.immediate(), registry, registry.counter("pipeline.opportunities.viable"));
        orchestrator.init();
        return orchestrator;
    }

    private double rejections(String reason) {
        return registry.counter("pipeline.opportunities.rejected", "reason", reason).count();
    }

    private ArbitrageOrchestrator started() {
        newOrchestrator(new BigDecimal("10000"));
        assertThat(orchestrator.start()).isTrue();
        return orchestrator;
    }

    @Test
    void rejectsWhenNotRunning() {
        newOrchestrator(new BigDecimal("10000"));

        assertThat(orchestrator.submit(opportunity("BTC"))).isEqualTo(AdmissionDecision.REJECTED_NOT_RUNNING);
        assertThat(registry.counter("pipeline.opportunities.rejected", "reason", "not_running").count()).isEqualTo(1.0);
    }

    @Test
    void simulationTradesExecuteWithExpectedProfit() {
        started();
        Opportunity opportunity = opportunity("BTC");

        assertThat(orchestrator.submit(opportunity)).isEqualTo(AdmissionDecision.ADMITTED);

        TradeRecord trade = orchestrator.getRecentTrades(1).get(0);
        assertThat(trade.getStatus()).isEqualTo(TradeStatus.EXECUTED);
        assertThat(trade.getActualProfit()).isEqualByComparingTo(opportunity.getNetProfit());
        assertThat(ledger.getReservedCapital()).isEqualByComparingTo("0");
        assertThat(ledger.getTotalCapital()).isEqualByComparingTo(new BigDecimal("10000").add(opportunity.getNetProfit()));
        assertThat(orchestrator.getStatus().getDailyProfitLoss()).isEqualByComparingTo(opportunity.getNetProfit());
        assertThat(orchestrator.getStatus().getWinRate()).isEqualTo(100.0);
        assertThat(events).extracting(PipelineEvent::getType).containsExactly(EventType.TRADE_COMPLETED);
        verify(executionEngine, never()).execute(any());
    }

    @Test
    void hourlyRateLimitCountsAdmissions() {
        properties.setMaxTradesPerHour(3);
        started();

        for (int i = 0; i < 3; i++) {
            assertThat(orchestrator.submit(opportunity("BTC"))).isEqualTo(AdmissionDecision.ADMITTED);
        }
        assertThat(orchestrator.submit(opportunity("BTC"))).isEqualTo(AdmissionDecision.REJECTED_RATE_LIMIT);

        clock.advance(Duration.ofMinutes(59));
        assertThat(orchestrator.submit(opportunity("BTC"))).isEqualTo(AdmissionDecision.REJECTED_RATE_LIMIT);

        clock.advance(Duration.ofMinutes(1));
        assertThat(orchestrator.submit(opportunity("BTC"))).isEqualTo(AdmissionDecision.ADMITTED);
        assertThat(orchestrator.getStatus().getTradesThisHour()).isEqualTo(1);
        assertThat(rejections("rate_limit")).isEqualTo(2.0);
    }

    @Test
    void dailyLossBreachClosesAdmissionUntilReset() {
        properties.setMode(TradingMode.PAPER);
        when(executionEngine.execute(any())).thenReturn(Mono.just(SettlementReport.builder()
                .status(TradeStatus.ROLLED_BACK)
                .actualProfit(new BigDecimal("-500.01"))
                .error("sell leg rejected")
                .build()));
        started();

        assertThat(orchestrator.submit(opportunity("BTC"))).isEqualTo(AdmissionDecision.ADMITTED);
        assertThat(orchestrator.getStatus().getDailyProfitLoss()).isEqualByComparingTo("-500.01");
        assertThat(orchestrator.getStatus().isDailyLossLimitReached()).isTrue();

        assertThat(orchestrator.submit(opportunity("ETH"))).isEqualTo(AdmissionDecision.REJECTED_DAILY_LOSS_LIMIT);
        assertThat(orchestrator.submit(opportunity("SOL"))).isEqualTo(AdmissionDecision.REJECTED_DAILY_LOSS_LIMIT);
        assertThat(events).extracting(PipelineEvent::getType)
                .containsExactly(EventType.TRADE_ROLLBACK, EventType.SAFETY_LIMIT);
        assertThat(rejections("daily_loss_limit")).isEqualTo(2.0);

        orchestrator.resetCircuitBreaker();
        when(executionEngine.execute(any())).thenReturn(Mono.just(executed("10")));
        assertThat(orchestrator.submit(opportunity("ETH"))).isEqualTo(AdmissionDecision.ADMITTED);
    }

    @Test
    void lossExactlyAtLimitKeepsAdmissionOpen() {
        properties.setMode(TradingMode.PAPER);
        when(executionEngine.execute(any())).thenReturn(Mono.just(SettlementReport.builder()
                .status(TradeStatus.FAILED)
                .actualProfit(new BigDecimal("-500"))
                .build()));
        started();

        orchestrator.submit(opportunity("BTC"));

        assertThat(orchestrator.getStatus().isDailyLossLimitReached()).isFalse();
        assertThat(orchestrator.submit(opportunity("ETH"))).isEqualTo(AdmissionDecision.ADMITTED);
    }

    @Test
    void midnightRolloverKeepsTrippedBreaker() {
        properties.setMode(TradingMode.PAPER);
        when(executionEngine.execute(any())).thenReturn(Mono.just(SettlementReport.builder()
                .status(TradeStatus.FAILED)
                .actualProfit(new BigDecimal("-600"))
                .build()));
        started();
        orchestrator.submit(opportunity("BTC"));

        clock.set(Instant.parse("2024-03-02T00:00:00Z"));
        DailyStats closed = orchestrator.rollDailyStats();

        assertThat(closed.getTradesExecuted()).isEqualTo(1);
        assertThat(closed.getFailedTrades()).isEqualTo(1);
        assertThat(orchestrator.getStatus().getDailyProfitLoss()).isEqualByComparingTo("0");
        assertThat(orchestrator.getStatus().isDailyLossLimitReached()).isTrue();
        assertThat(orchestrator.getDailyStats().getTradesExecuted()).isZero();
        assertThat(orchestrator.submit(opportunity("ETH"))).isEqualTo(AdmissionDecision.REJECTED_DAILY_LOSS_LIMIT);
    }

    @Test
    void insufficientCapitalIsRejectedAtAdmission() {
        properties.setMode(TradingMode.PAPER);
        Sinks.One<SettlementReport> inFlight = Sinks.one();
        when(executionEngine.execute(any())).thenReturn(inFlight.asMono());
        newOrchestrator(new BigDecimal("1500"));
        orchestrator.start();

        assertThat(orchestrator.submit(opportunity("BTC"))).isEqualTo(AdmissionDecision.ADMITTED);
        assertThat(ledger.getReservedCapital()).isEqualByComparingTo("1000");
        assertThat(orchestrator.submit(opportunity("ETH"))).isEqualTo(AdmissionDecision.REJECTED_INSUFFICIENT_CAPITAL);
        assertThat(rejections("insufficient_capital")).isEqualTo(1.0);

        inFlight.tryEmitValue(executed("5"));
        assertThat(ledger.getReservedCapital()).isEqualByComparingTo("0");
    }

    @Test
    void executesOneTradeAtATimeInAdmissionOrder() {
        properties.setMode(TradingMode.PAPER);
        Sinks.One<SettlementReport> first = Sinks.one();
        Sinks.One<SettlementReport> second = Sinks.one();
        Sinks.One<SettlementReport> third = Sinks.one();
        when(executionEngine.execute(any())).thenReturn(first.asMono(), second.asMono(), third.asMono());
        started();

        orchestrator.submit(opportunity("BTC"));
        orchestrator.submit(opportunity("ETH"));
        orchestrator.submit(opportunity("SOL"));

        verify(executionEngine, times(1)).execute(any());
        assertThat(orchestrator.getQueuedOpportunities()).isEqualTo(2);
        assertThat(ledger.getReservedCapital()).isEqualByComparingTo("1000");

        first.tryEmitValue(executed("1"));
        second.tryEmitValue(executed("2"));
        third.tryEmitValue(executed("3"));

        ArgumentCaptor<ExecutionRequest> requests = ArgumentCaptor.forClass(ExecutionRequest.class);
        verify(executionEngine, times(3)).execute(requests.capture());
        assertThat(requests.getAllValues()).extracting(ExecutionRequest::getSymbol).containsExactly("BTC", "ETH", "SOL");
        assertThat(orchestrator.getQueuedOpportunities()).isZero();
        assertThat(ledger.getReservedCapital()).isEqualByComparingTo("0");
    }

    @Test
    void stopCancelsQueuedButFinishesInFlight() {
        properties.setMode(TradingMode.PAPER);
        Sinks.One<SettlementReport> inFlight = Sinks.one();
        when(executionEngine.execute(any())).thenReturn(inFlight.asMono());
        started();

        orchestrator.submit(opportunity("BTC"));
        orchestrator.submit(opportunity("ETH"));
        orchestrator.submit(opportunity("SOL"));
        orchestrator.stop();
        inFlight.tryEmitValue(executed("7"));

        List<TradeRecord> trades = orchestrator.getRecentTrades(10);
        assertThat(trades).extracting(TradeRecord::getSymbol).containsExactly("SOL", "ETH", "BTC");
        assertThat(trades).extracting(TradeRecord::getStatus)
                .containsExactly(TradeStatus.CANCELLED, TradeStatus.CANCELLED, TradeStatus.EXECUTED);
        verify(executionEngine, times(1)).execute(any());
        verify(priceAggregator).stop();
        assertThat(ledger.getReservedCapital()).isEqualByComparingTo("0");
        assertThat(orchestrator.getDailyStats().getCancelledTrades()).isEqualTo(2);
    }

    @Test
    void cancelledTradesArePublished() {
        properties.setMode(TradingMode.PAPER);
        Sinks.One<SettlementReport> inFlight = Sinks.one();
        when(executionEngine.execute(any())).thenReturn(inFlight.asMono());
        started();

        orchestrator.submit(opportunity("BTC"));
        orchestrator.submit(opportunity("ETH"));
        orchestrator.stop();
        inFlight.tryEmitValue(executed("7"));

        assertThat(events).filteredOn(event -> event.getType() == EventType.TRADE_FAILED)
                .singleElement()
                .satisfies(event -> {
                    assertThat(event.getReason()).isEqualTo("Pipeline stopped before execution");
                    assertThat(event.getTrade().getSymbol()).isEqualTo("ETH");
                    assertThat(event.getTrade().getStatus()).isEqualTo(TradeStatus.CANCELLED);
                    assertThat(event.getOpportunity().getSymbol()).isEqualTo("ETH");
                });
        assertThat(events).filteredOn(event -> event.getType() == EventType.TRADE_COMPLETED).hasSize(1);
    }

    @Test
    void executionErrorReleasesCapitalAndFailsTrade() {
        properties.setMode(TradingMode.LIVE);
        when(executionEngine.execute(any())).thenReturn(Mono.error(new IllegalStateException("venue offline")));
        started();

        orchestrator.submit(opportunity("BTC"));

        TradeRecord trade = orchestrator.getRecentTrades(1).get(0);
        assertThat(trade.getStatus()).isEqualTo(TradeStatus.FAILED);
        assertThat(trade.getError()).contains("venue offline");
        assertThat(ledger.getReservedCapital()).isEqualByComparingTo("0");
        assertThat(ledger.getTotalCapital()).isEqualByComparingTo("10000");
        assertThat(events).extracting(PipelineEvent::getType).containsExactly(EventType.TRADE_FAILED);
    }

    @Test
    void emptySettlementCountsAsFailure() {
        properties.setMode(TradingMode.PAPER);
        when(executionEngine.execute(any())).thenReturn(Mono.empty());
        started();

        orchestrator.submit(opportunity("BTC"));

        assertThat(orchestrator.getRecentTrades(1).get(0).getStatus()).isEqualTo(TradeStatus.FAILED);
        assertThat(orchestrator.getStatus().getWinRate()).isZero();
    }

    @Test
    void riskOracleVetoBlocksWithoutReserving() {
        properties.setEnableRiskOracle(true);
        properties.setMode(TradingMode.PAPER);
        when(riskOracle.evaluate(any(), any(), any(), any(), any()))
                .thenReturn(Mono.just(RiskAssessment.veto("too volatile")));
        started();

        assertThat(orchestrator.submit(opportunity("BTC"))).isEqualTo(AdmissionDecision.ADMITTED);

        verify(executionEngine, never()).execute(any());
        assertThat(ledger.getReservedCapital()).isEqualByComparingTo("0");
        assertThat(events).singleElement().satisfies(event -> {
            assertThat(event.getType()).isEqualTo(EventType.OPPORTUNITY_BLOCKED);
            assertThat(event.getReason()).isEqualTo("too volatile");
        });
        assertThat(orchestrator.getDailyStats().getBlockedOpportunities()).isEqualTo(1);
    }

    @Test
    void riskOracleErrorIsTreatedAsVeto() {
        properties.setEnableRiskOracle(true);
        when(riskOracle.evaluate(any(), any(), any(), any(), any()))
                .thenReturn(Mono.error(new IllegalStateException("oracle down")));
        started();

        orchestrator.submit(opportunity("BTC"));

        assertThat(events).extracting(PipelineEvent::getType).containsExactly(EventType.OPPORTUNITY_BLOCKED);
        assertThat(orchestrator.getStatus().getTradesExecuted()).isZero();
    }

    @Test
    void riskOracleApprovalProceeds() {
        properties.setEnableRiskOracle(true);
        when(riskOracle.evaluate(any(), any(), any(), any(), any()))
                .thenReturn(Mono.just(RiskAssessment.proceed("fine")));
        started();

        orchestrator.submit(opportunity("BTC"));

        verify(riskOracle).evaluate(any(), any(), any(), any(), any());
        assertThat(events).extracting(PipelineEvent::getType).containsExactly(EventType.TRADE_COMPLETED);
    }

    @Test
    void modeCannotChangeWhileRunning() {
        started();
        ConfigUpdate update = ConfigUpdate.builder()
                .mode(TradingMode.LIVE)
                .maxTradesPerHour(7)
                .build();

        assertThatThrownBy(() -> orchestrator.updateConfig(update))
                .isInstanceOf(ModeChangeRejectedException.class);
        assertThat(orchestrator.getMode()).isEqualTo(TradingMode.SIMULATION);

        orchestrator.stop();
        orchestrator.updateConfig(update);
        assertThat(orchestrator.getMode()).isEqualTo(TradingMode.LIVE);
    }

    @Test
    void otherSettingsMayChangeWhileRunning() {
        started();

        orchestrator.updateConfig(ConfigUpdate.builder()
                .maxTradesPerHour(1)
                .totalCapital(new BigDecimal("20000"))
                .build());

        assertThat(ledger.getTotalCapital()).isEqualByComparingTo("20000");
        assertThat(orchestrator.submit(opportunity("BTC"))).isEqualTo(AdmissionDecision.ADMITTED);
        assertThat(orchestrator.submit(opportunity("ETH"))).isEqualTo(AdmissionDecision.REJECTED_RATE_LIMIT);
    }

    @Test
    void invalidConfigurationIsRejectedWhole() {
        started();

        assertThatThrownBy(() -> orchestrator.updateConfig(ConfigUpdate.builder()
                .maxTradesPerHour(1)
                .takerFeeRate(new BigDecimal("1.5"))
                .build()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> orchestrator.updateConfig(ConfigUpdate.builder()
                .capitalAllocation(BigDecimal.ZERO)
                .build()))
                .isInstanceOf(IllegalArgumentException.class);

        assertThat(orchestrator.submit(opportunity("BTC"))).isEqualTo(AdmissionDecision.ADMITTED);
        assertThat(orchestrator.submit(opportunity("ETH"))).isEqualTo(AdmissionDecision.ADMITTED);
    }

    @Test
    void emergencyStopHaltsForGood() {
        started();

        orchestrator.emergencyStop("manual kill");

        assertThat(orchestrator.isRunning()).isFalse();
        assertThat(orchestrator.isHalted()).isTrue();
        assertThat(orchestrator.start()).isFalse();
        assertThat(orchestrator.getStatus().isHalted()).isTrue();
    }

    @Test
    void admitsViableSpreadsFromTheScanFeed() {
        started();

        spreadFeed.tryEmitNext(List.of(spread("BTC", "100", "102"), spread("ETH", "100", "100.3")));

        assertThat(orchestrator.getRecentTrades(10)).extracting(TradeRecord::getSymbol).containsExactly("BTC");
        assertThat(registry.counter("pipeline.opportunities.viable").count()).isEqualTo(1.0);
        assertThat(registry.counter("pipeline.opportunities.rejected", "reason", "not_viable").count()).isEqualTo(1.0);
    }

    private Opportunity opportunity(String symbol) {
        return evaluator.evaluate(spread(symbol, "100", "102"), evaluatorProperties.toFeeConfig());
    }

    private Spread spread(String symbol, String low, String high) {
        return Spread.builder()
                .symbol(symbol)
                .lowVenue("alpha")
                .highVenue("bravo")
                .lowPrice(new BigDecimal(low))
                .highPrice(new BigDecimal(high))
                .spreadPercent(new BigDecimal(high).subtract(new BigDecimal(low)))
                .observedAt(clock.instant())
                .build();
    }

    private static SettlementReport executed(String profit) {
        return SettlementReport.builder()
                .status(TradeStatus.EXECUTED)
                .actualProfit(new BigDecimal(profit))
                .fees(new BigDecimal("5"))
                .volume(new BigDecimal("1000"))
                .build();
    }
}
