package trader.pipeline.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
@Builder
public class DailyStats {
    LocalDate date;
    int tradesExecuted;
    int successfulTrades;
    int failedTrades;
    int rolledBackTrades;
    int cancelledTrades;
    int blockedOpportunities;
    BigDecimal totalProfit;
    BigDecimal totalVolume;
    BigDecimal avgProfit;
    TradeSummary bestTrade;
    TradeSummary worstTrade;
    double uptimePercent;
}
