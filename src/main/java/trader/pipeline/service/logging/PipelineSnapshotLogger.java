package trader.pipeline.service.logging;

import io.micrometer.observation.annotation.Observed;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import trader.pipeline.model.OrchestratorStatus;
import trader.pipeline.model.PriceQuote;
import trader.pipeline.service.orchestrator.ArbitrageOrchestrator;
import trader.pipeline.service.scanner.PriceAggregator;

import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class PipelineSnapshotLogger {

    private final PriceAggregator priceAggregator;
    private final ArbitrageOrchestrator orchestrator;

    /**
     * Log cached prices and orchestrator status every minute
     */
    @Scheduled(fixedRateString = "${pipeline.snapshot-interval:60000}")
    @Observed(name = "pipeline.snapshot")
    public void logSnapshot() {
        log.info("=== Scheduled pipeline snapshot ===");
        Map<String, List<PriceQuote>> prices = priceAggregator.getAllPrices();
        if (prices.isEmpty()) {
            log.info("No fresh prices cached");
        }
        prices.forEach((venue, quotes) -> quotes.forEach(quote ->
                log.info("{} {}: {}", venue, quote.getSymbol(), quote.getPrice())));

        OrchestratorStatus status = orchestrator.getStatus();
        log.info("Running: {} | mode: {} | capital {} (reserved {}) | daily P&L {} | trades {} | win rate {}%",
                status.isRunning(), status.getMode(), status.getTotalCapital(), status.getReservedCapital(),
                status.getDailyProfitLoss(), status.getTradesExecuted(), String.format("%.1f", status.getWinRate()));
    }
}
