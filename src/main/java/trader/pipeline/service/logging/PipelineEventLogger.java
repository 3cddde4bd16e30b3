package trader.pipeline.service.logging;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import trader.pipeline.event.PipelineEventBus;
import trader.pipeline.model.EventType;
import trader.pipeline.model.Opportunity;
import trader.pipeline.model.PipelineEvent;
import trader.pipeline.model.TradeRecord;
import trader.pipeline.model.TradeStatus;

/**
 * Default telemetry sink: writes trade outcomes and safety events to the application log.
 * Spread batches are too frequent for INFO and go to DEBUG.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PipelineEventLogger {

    private final PipelineEventBus eventBus;

    private Disposable subscription;

    @PostConstruct
    public void init() {
        subscription = eventBus.events().subscribe(
                this::handle,
                error -> log.error("Event logger lost the event feed: {}", error.getMessage(), error));
    }

    @PreDestroy
    public void onDestroy() {
        if (subscription != null) {
            subscription.dispose();
        }
    }

    void handle(PipelineEvent event) {
        switch (event.getType()) {
            case SPREADS:
                log.debug("{} spreads, best {}", event.getSpreads().size(),
                        event.getSpreads().isEmpty() ? "-" : event.getSpreads().get(0));
                break;
            case TRADE_COMPLETED:
                logTrade("TRADE COMPLETED", event);
                break;
            case TRADE_FAILED:
            case TRADE_ROLLBACK:
                logTrade(tradeTitle(event), event);
                break;
            case OPPORTUNITY_BLOCKED:
                log.warn("Opportunity blocked: {} ({})",
                        event.getOpportunity() != null ? event.getOpportunity().getSymbol() : "-", event.getReason());
                break;
            case SAFETY_LIMIT:
                log.warn("!!! SAFETY LIMIT: {} !!!", event.getReason());
                break;
            default:
                log.debug("Event {}", event.getType());
        }
    }

    private static String tradeTitle(PipelineEvent event) {
        if (event.getType() == EventType.TRADE_ROLLBACK) {
            return "TRADE ROLLED BACK";
        }
        boolean cancelled = event.getTrade() != null && event.getTrade().getStatus() == TradeStatus.CANCELLED;
        return cancelled ? "TRADE CANCELLED" : "TRADE FAILED";
    }

    private void logTrade(String title, PipelineEvent event) {
        TradeRecord trade = event.getTrade();
        Opportunity opportunity = event.getOpportunity();
        log.info("=== {} ===", title);
        log.info("Trade: {} ({})", trade.getId(), trade.getMode());
        log.info("Token: {}", trade.getSymbol());
        if (opportunity != null) {
            log.info("Buy {} @ {}", opportunity.getBuyVenue(), opportunity.getBuyPrice());
            log.info("Sell {} @ {}", opportunity.getSellVenue(), opportunity.getSellPrice());
            log.info("Gross spread: {}%", opportunity.getGrossSpreadPercent());
        }
        log.info("Expected profit: {}", trade.getExpectedProfit());
        log.info("Actual profit: {}", trade.getActualProfit());
        if (trade.getError() != null) {
            log.info("Error: {}", trade.getError());
        }
        log.info("--------------------------------------");
    }
}
