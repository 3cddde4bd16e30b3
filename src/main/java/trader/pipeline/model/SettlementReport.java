package trader.pipeline.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * What the execution engine reports back for one swap. Status is one of
 * {@code EXECUTED}, {@code FAILED} or {@code ROLLED_BACK}.
 */
@Value
@Builder
public class SettlementReport {
    TradeStatus status;
    BigDecimal actualProfit;
    BigDecimal fees;
    BigDecimal volume;
    String error;
}
