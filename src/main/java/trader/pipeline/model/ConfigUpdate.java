package trader.pipeline.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Partial orchestrator configuration; {@code null} fields are left unchanged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConfigUpdate {
    private TradingMode mode;
    private BigDecimal totalCapital;
    private Integer maxTradesPerHour;
    private BigDecimal dailyLossLimit;
    private Boolean enableRiskOracle;
    private BigDecimal capitalAllocation;
    private BigDecimal minProfitThreshold;
    private Double minConfidence;
    private BigDecimal takerFeeRate;
    private BigDecimal maxSlippageRate;
    private BigDecimal networkFee;
}
