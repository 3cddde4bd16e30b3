package trader.pipeline.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

@Value
@Builder
public class OrchestratorStatus {
    boolean running;
    boolean halted;
    TradingMode mode;
    Duration uptime;
    BigDecimal totalCapital;
    BigDecimal reservedCapital;
    BigDecimal availableCapital;
    BigDecimal dailyProfitLoss;
    boolean dailyLossLimitReached;
    BigDecimal allTimeProfit;
    long tradesExecuted;
    double winRate;
    int tradesThisHour;
    int queuedOpportunities;
    Instant lastTradeTime;
}
