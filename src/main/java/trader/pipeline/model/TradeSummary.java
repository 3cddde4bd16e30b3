package trader.pipeline.model;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class TradeSummary {
    String symbol;
    BigDecimal profit;
}
