package trader.pipeline.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A fully costed spatial arbitrage candidate. Immutable once evaluated.
 * {@code netProfit} is exactly {@code grossProfit - buyFee - sellFee - networkFee - slippageEstimate}.
 */
@Value
@Builder
public class Opportunity {
    String id;
    String symbol;
    String buyVenue;
    String sellVenue;
    BigDecimal buyPrice;
    BigDecimal sellPrice;
    BigDecimal quantity;
    BigDecimal grossProfit;
    Fees fees;
    BigDecimal slippageEstimate;
    BigDecimal netProfit;
    BigDecimal netProfitPercent;
    double confidenceScore;
    BigDecimal grossSpreadPercent;
    Instant createdAt;
}
