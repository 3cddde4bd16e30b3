package trader.pipeline.service.evaluator;

import org.springframework.stereotype.Component;
import trader.pipeline.model.Fees;
import trader.pipeline.model.Opportunity;
import trader.pipeline.model.Spread;

import java.math.BigDecimal;
import java.math.MathContext;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Turns a raw spread into a fully costed opportunity and decides whether it is worth executing.
 * Stateless and free of I/O: the same spread and config always give the same opportunity.
 */
@Component
public class OpportunityEvaluator {

    public static final double MAX_CONFIDENCE = 99.9;

    private static final BigDecimal HUNDRED = new BigDecimal("100");
    private static final BigDecimal TINY_MARGIN_PERCENT = new BigDecimal("0.2");
    private static final MathContext MC = MathContext.DECIMAL64;

    public Opportunity evaluate(Spread spread, FeeConfig config) {
        BigDecimal buyPrice = spread.getLowPrice();
        BigDecimal sellPrice = spread.getHighPrice();
        if (buyPrice == null || buyPrice.signum() <= 0) {
            throw new IllegalArgumentException("Buy price must be positive for " + spread.getSymbol());
        }
        if (sellPrice == null || sellPrice.compareTo(buyPrice) < 0) {
            throw new IllegalArgumentException("Sell price below buy price for " + spread.getSymbol());
        }

        BigDecimal quantity = config.getCapitalAllocation().divide(buyPrice, MC);

        BigDecimal grossCost = buyPrice.multiply(quantity);
        BigDecimal grossRevenue = sellPrice.multiply(quantity);
        BigDecimal grossProfit = grossRevenue.subtract(grossCost);

        // Both legs cross the book, so both pay the taker rate
        BigDecimal buyFee = grossCost.multiply(config.getTakerFeeRate());
        BigDecimal sellFee = grossRevenue.multiply(config.getTakerFeeRate());
        BigDecimal networkFee = config.getNetworkFee();

        // Worst case on both legs: buy higher and sell lower by the full slippage rate
        BigDecimal slippageCost = grossCost.add(grossRevenue).multiply(config.getMaxSlippageRate());

        BigDecimal netProfit = grossProfit
                .subtract(buyFee)
                .subtract(sellFee)
                .subtract(networkFee)
                .subtract(slippageCost);
        BigDecimal netProfitPercent = netProfit.divide(grossCost, MC).multiply(HUNDRED);

        return Opportunity.builder()
                .id(opportunityId(spread))
                .symbol(spread.getSymbol())
                .buyVenue(spread.getLowVenue())
                .sellVenue(spread.getHighVenue())
                .buyPrice(buyPrice)
                .sellPrice(sellPrice)
                .quantity(quantity)
                .grossProfit(grossProfit)
                .fees(Fees.builder()
                        .maker(BigDecimal.ZERO)
                        .taker(buyFee.add(sellFee))
                        .network(networkFee)
                        .buyFee(buyFee)
                        .sellFee(sellFee)
                        .build())
                .slippageEstimate(slippageCost)
                .netProfit(netProfit)
                .netProfitPercent(netProfitPercent)
                .confidenceScore(confidence(netProfit, netProfitPercent, config.getMinProfitThreshold()))
                .grossSpreadPercent(spread.getSpreadPercent())
                .createdAt(spread.getObservedAt())
                .build();
    }

    public boolean isViable(Opportunity opportunity, FeeConfig config) {
        return opportunity.getNetProfit().signum() > 0
                && opportunity.getNetProfitPercent().compareTo(config.getMinProfitThreshold()) >= 0
                && opportunity.getConfidenceScore() >= config.getMinConfidence();
    }

    /**
     * Evaluates a batch of spreads and keeps only the viable opportunities, in input order.
     */
    public List<Opportunity> analyze(List<Spread> spreads, FeeConfig config) {
        return spreads.stream()
                .map(spread -> evaluate(spread, config))
                .filter(opportunity -> isViable(opportunity, config))
                .collect(Collectors.toList());
    }

    /**
     * Heuristic score in [0, 99.9]. Never 100: a conservative model still cannot claim certainty.
     */
    double confidence(BigDecimal netProfit, BigDecimal netProfitPercent, BigDecimal minProfitThreshold) {
        if (netProfit.signum() <= 0) {
            return 0;
        }
        double confidence = 90;
        if (netProfitPercent.compareTo(minProfitThreshold.multiply(BigDecimal.valueOf(2))) > 0) {
            confidence += 5;
        }
        if (netProfitPercent.compareTo(minProfitThreshold.multiply(BigDecimal.valueOf(4))) > 0) {
            confidence += 4;
        }
        if (netProfitPercent.compareTo(TINY_MARGIN_PERCENT) < 0) {
            confidence -= 20;
        }
        return Math.max(0, Math.min(confidence, MAX_CONFIDENCE));
    }

    private String opportunityId(Spread spread) {
        String key = spread.getSymbol() + '|' + spread.getLowVenue() + '|' + spread.getHighVenue()
                + '|' + spread.getLowPrice().toPlainString() + '|' + spread.getHighPrice().toPlainString()
                + '|' + spread.getObservedAt();
        return "ARB-" + UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8));
    }
}
