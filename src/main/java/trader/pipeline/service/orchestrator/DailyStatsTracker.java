package trader.pipeline.service.orchestrator;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import trader.pipeline.model.DailyStats;
import trader.pipeline.model.TradeRecord;
import trader.pipeline.model.TradeStatus;
import trader.pipeline.model.TradeSummary;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Per-day trading statistics. Days are UTC calendar days; {@link #roll} starts a new one.
 */
@Component
public class DailyStatsTracker {

    private LocalDate date;
    private Instant dayStart;
    private int tradesExecuted;
    private int successfulTrades;
    private int failedTrades;
    private int rolledBackTrades;
    private int cancelledTrades;
    private int blockedOpportunities;
    private BigDecimal totalProfit = BigDecimal.ZERO;
    private BigDecimal totalVolume = BigDecimal.ZERO;
    private TradeSummary bestTrade;
    private TradeSummary worstTrade;

    // uptime bookkeeping
    private Duration runningTime = Duration.ZERO;
    private Instant runningSince;

    @Autowired
    public DailyStatsTracker(Clock clock) {
        this(clock.instant());
    }

    public DailyStatsTracker(Instant now) {
        this.date = LocalDate.ofInstant(now, ZoneOffset.UTC);
        this.dayStart = now;
    }

    public synchronized void recordTrade(TradeRecord trade) {
        TradeStatus status = trade.getStatus();
        if (status == TradeStatus.CANCELLED) {
            cancelledTrades++;
            return;
        }
        tradesExecuted++;
        if (status == TradeStatus.EXECUTED) {
            successfulTrades++;
        } else if (status == TradeStatus.ROLLED_BACK) {
            rolledBackTrades++;
        } else {
            failedTrades++;
        }

        BigDecimal profit = trade.getActualProfit() != null ? trade.getActualProfit() : BigDecimal.ZERO;
        totalProfit = totalProfit.add(profit);
        if (status == TradeStatus.EXECUTED && trade.getVolume() != null) {
            totalVolume = totalVolume.add(trade.getVolume());
        }
        if (bestTrade == null || profit.compareTo(bestTrade.getProfit()) > 0) {
            bestTrade = new TradeSummary(trade.getSymbol(), profit);
        }
        if (worstTrade == null || profit.compareTo(worstTrade.getProfit()) < 0) {
            worstTrade = new TradeSummary(trade.getSymbol(), profit);
        }
    }

    public synchronized void recordBlocked() {
        blockedOpportunities++;
    }

    public synchronized void markRunning(Instant now) {
        if (runningSince == null) {
            runningSince = now;
        }
    }

    public synchronized void markStopped(Instant now) {
        if (runningSince != null) {
            runningTime = runningTime.plus(Duration.between(runningSince, now));
            runningSince = null;
        }
    }

    public synchronized DailyStats snapshot(Instant now) {
        Duration elapsed = Duration.between(dayStart, now);
        Duration uptime = runningSince != null ? runningTime.plus(Duration.between(runningSince, now)) : runningTime;
        double uptimePercent = elapsed.isZero() || elapsed.isNegative()
                ? (runningSince != null ? 100.0 : 0.0)
                : Math.min(100.0, uptime.toMillis() * 100.0 / elapsed.toMillis());

        return DailyStats.builder()
                .date(date)
                .tradesExecuted(tradesExecuted)
                .successfulTrades(successfulTrades)
                .failedTrades(failedTrades)
                .rolledBackTrades(rolledBackTrades)
                .cancelledTrades(cancelledTrades)
                .blockedOpportunities(blockedOpportunities)
                .totalProfit(totalProfit)
                .totalVolume(totalVolume)
                .avgProfit(tradesExecuted == 0
                        ? BigDecimal.ZERO
                        : totalProfit.divide(BigDecimal.valueOf(tradesExecuted), MathContext.DECIMAL64))
                .bestTrade(bestTrade)
                .worstTrade(worstTrade)
                .uptimePercent(uptimePercent)
                .build();
    }

    /**
     * Closes the current day and returns its final statistics. A running pipeline keeps accruing uptime
     * into the new day.
     */
    public synchronized DailyStats roll(Instant now) {
        DailyStats closed = snapshot(now);
        boolean running = runningSince != null;

        date = LocalDate.ofInstant(now, ZoneOffset.UTC);
        dayStart = now;
        tradesExecuted = 0;
        successfulTrades = 0;
        failedTrades = 0;
        rolledBackTrades = 0;
        cancelledTrades = 0;
        blockedOpportunities = 0;
        totalProfit = BigDecimal.ZERO;
        totalVolume = BigDecimal.ZERO;
        bestTrade = null;
        worstTrade = null;
        runningTime = Duration.ZERO;
        runningSince = running ? now : null;
        return closed;
    }
}
