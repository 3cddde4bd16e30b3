package trader.pipeline.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TradeRecord {
    private String id;
    private String opportunityId;
    private String symbol;
    private String buyVenue;
    private String sellVenue;
    private TradingMode mode;
    private TradeStatus status;
    private BigDecimal expectedProfit;
    private BigDecimal actualProfit;
    private BigDecimal fees;
    private BigDecimal volume;
    private Instant startedAt;
    private Instant completedAt;
    private String error;
}
