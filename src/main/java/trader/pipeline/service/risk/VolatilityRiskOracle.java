package trader.pipeline.service.risk;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import trader.pipeline.config.RiskOracleProperties;
import trader.pipeline.config.ScannerProperties;
import trader.pipeline.model.PriceQuote;
import trader.pipeline.model.RiskAssessment;
import trader.pipeline.model.ScanResult;
import trader.pipeline.service.scanner.PriceAggregator;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Vetoes trades whose sell leg could drift too far during the execution window.
 * <p>
 * Keeps a rolling history of the cross-venue mean price per symbol, one sample per scan cycle,
 * and projects a {@code bandSigmas}-wide volatility band over the window.
 */
@Slf4j
@Service
public class VolatilityRiskOracle implements RiskOracle {

    private final PriceAggregator priceAggregator;
    private final RiskOracleProperties properties;
    private final Duration sampleInterval;
    private final Map<String, Deque<Double>> history = new ConcurrentHashMap<>();

    private Disposable subscription;

    public VolatilityRiskOracle(PriceAggregator priceAggregator,
                                RiskOracleProperties properties,
                                ScannerProperties scannerProperties) {
        this.priceAggregator = priceAggregator;
        this.properties = properties;
        this.sampleInterval = scannerProperties.getInterval();
    }

    @PostConstruct
    public void init() {
        subscription = priceAggregator.scanResults().subscribe(
                this::record,
                error -> log.error("Risk oracle lost the scan feed: {}", error.getMessage(), error));
    }

    @PreDestroy
    public void onDestroy() {
        if (subscription != null) {
            subscription.dispose();
        }
    }

    void record(ScanResult result) {
        Map<String, double[]> sums = new HashMap<>();
        for (List<PriceQuote> quotes : result.getQuotes().values()) {
            for (PriceQuote quote : quotes) {
                double[] sum = sums.computeIfAbsent(quote.getSymbol(), symbol -> new double[2]);
                sum[0] += quote.getPrice().doubleValue();
                sum[1]++;
            }
        }
        sums.forEach((symbol, sum) -> recordPrice(symbol, sum[0] / sum[1]));
    }

    void recordPrice(String symbol, double price) {
        Deque<Double> prices = history.computeIfAbsent(symbol, key -> new ArrayDeque<>());
        synchronized (prices) {
            prices.addLast(price);
            while (prices.size() > properties.getHistorySize()) {
                prices.removeFirst();
            }
        }
    }

    @Override
    public Mono<RiskAssessment> evaluate(String symbol,
                                         BigDecimal buyPrice,
                                         BigDecimal sellPrice,
                                         BigDecimal expectedProfit,
                                         Duration window) {
        return Mono.fromSupplier(() -> assess(symbol, buyPrice, sellPrice, expectedProfit, window));
    }

    RiskAssessment assess(String symbol, BigDecimal buyPrice, BigDecimal sellPrice,
                          BigDecimal expectedProfit, Duration window) {
        double[] returns = returns(symbol);
        if (returns.length + 1 < properties.getMinSamples()) {
            return RiskAssessment.proceed("Insufficient price history for " + symbol + ", proceeding on spread alone");
        }

        double sigmaPerSample = standardDeviation(returns);
        double horizonSamples = Math.max(1.0, (double) window.toMillis() / Math.max(1, sampleInterval.toMillis()));
        double bandFraction = properties.getBandSigmas() * sigmaPerSample * Math.sqrt(horizonSamples);

        double sell = sellPrice.doubleValue();
        double buy = buyPrice.doubleValue();
        double worstCaseSell = sell * (1 - bandFraction);
        double potentialLossPercent = bandFraction * 100;
        double worstCaseProfitPercent = (worstCaseSell - buy) / buy * 100;
        double maxRisk = properties.getMaxRiskPercent();

        if (potentialLossPercent > maxRisk) {
            return RiskAssessment.veto(String.format(
                    "Blocked: potential adverse move %.2f%% exceeds max risk %.2f%%", potentialLossPercent, maxRisk));
        }
        if (worstCaseProfitPercent < -maxRisk) {
            return RiskAssessment.veto(String.format(
                    "Blocked: worst case outcome %.2f%%", worstCaseProfitPercent));
        }
        return RiskAssessment.proceed(String.format(
                "Approved: potential adverse move %.2f%% within %.2f%%, expected profit %s",
                potentialLossPercent, maxRisk, expectedProfit.toPlainString()));
    }

    private double[] returns(String symbol) {
        Deque<Double> prices = history.get(symbol);
        if (prices == null) {
            return new double[0];
        }
        Double[] snapshot;
        synchronized (prices) {
            snapshot = prices.toArray(new Double[0]);
        }
        if (snapshot.length < 2) {
            return new double[0];
        }
        double[] returns = new double[snapshot.length - 1];
        for (int i = 1; i < snapshot.length; i++) {
            returns[i - 1] = snapshot[i] / snapshot[i - 1] - 1;
        }
        return returns;
    }

    private static double standardDeviation(double[] values) {
        double mean = 0;
        for (double value : values) {
            mean += value;
        }
        mean /= values.length;
        double variance = 0;
        for (double value : values) {
            variance += (value - mean) * (value - mean);
        }
        return Math.sqrt(variance / Math.max(1, values.length - 1));
    }
}
