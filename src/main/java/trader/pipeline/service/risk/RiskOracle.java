package trader.pipeline.service.risk;

import reactor.core.publisher.Mono;
import trader.pipeline.model.RiskAssessment;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Independent pre-trade check that may veto an opportunity before any capital is reserved.
 */
public interface RiskOracle {

    Mono<RiskAssessment> evaluate(String symbol,
                                  BigDecimal buyPrice,
                                  BigDecimal sellPrice,
                                  BigDecimal expectedProfit,
                                  Duration window);
}
