package trader.pipeline.service.evaluator;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Cost model and acceptance thresholds for opportunity evaluation.
 * Rates are fractions (0.001 = 0.1%); {@code minProfitThreshold} is in percent.
 */
@Value
@Builder(toBuilder = true)
public class FeeConfig {
    BigDecimal capitalAllocation;
    BigDecimal takerFeeRate;
    BigDecimal maxSlippageRate;
    BigDecimal networkFee;
    BigDecimal minProfitThreshold;
    double minConfidence;
}
