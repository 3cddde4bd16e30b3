package trader.pipeline.service.execution;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import trader.pipeline.model.ExecutionRequest;
import trader.pipeline.model.SettlementReport;
import trader.pipeline.model.TradeStatus;

import java.time.Duration;

/**
 * Fills both legs at the quoted prices after a fixed latency. Used for paper trading and as the
 * fallback engine when no exchange adapter is wired in.
 */
@Slf4j
@Service
public class PaperExecutionEngine implements ExecutionEngine {

    @Value("${pipeline.paper.fill-latency:50ms}")
    private Duration fillLatency = Duration.ofMillis(50);

    @Override
    public Mono<SettlementReport> execute(ExecutionRequest request) {
        log.info("[PAPER] Buy {} {} on {} @ {}, sell on {} @ {}",
                request.getQuantity(), request.getSymbol(), request.getBuyVenue(), request.getBuyPrice(),
                request.getSellVenue(), request.getSellPrice());

        return Mono.delay(fillLatency)
                .map(tick -> SettlementReport.builder()
                        .status(TradeStatus.EXECUTED)
                        .actualProfit(request.getExpectedProfit())
                        .fees(request.getEstimatedFees())
                        .volume(request.getBuyPrice().multiply(request.getQuantity()))
                        .build());
    }
}
