package trader.pipeline.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Two-leg swap handed to the execution engine: buy on {@code buyVenue}, sell on {@code sellVenue}.
 */
@Value
@Builder
public class ExecutionRequest {
    String tradeId;
    String symbol;
    String buyVenue;
    String sellVenue;
    BigDecimal buyPrice;
    BigDecimal sellPrice;
    BigDecimal quantity;
    BigDecimal expectedProfit;
    BigDecimal estimatedFees;

    public static ExecutionRequest of(String tradeId, Opportunity opportunity) {
        return ExecutionRequest.builder()
                .tradeId(tradeId)
                .symbol(opportunity.getSymbol())
                .buyVenue(opportunity.getBuyVenue())
                .sellVenue(opportunity.getSellVenue())
                .buyPrice(opportunity.getBuyPrice())
                .sellPrice(opportunity.getSellPrice())
                .quantity(opportunity.getQuantity())
                .expectedProfit(opportunity.getNetProfit())
                .estimatedFees(opportunity.getFees().getTotal().add(opportunity.getSlippageEstimate()))
                .build();
    }
}
