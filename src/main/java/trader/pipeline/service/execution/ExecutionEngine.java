package trader.pipeline.service.execution;

import reactor.core.publisher.Mono;
import trader.pipeline.model.ExecutionRequest;
import trader.pipeline.model.SettlementReport;

/**
 * Settles a two-leg swap. May take arbitrarily long; may roll back one leg if the other fails.
 * Failures are signalled either as an error or as a {@code FAILED}/{@code ROLLED_BACK} report.
 */
public interface ExecutionEngine {

    Mono<SettlementReport> execute(ExecutionRequest request);
}
