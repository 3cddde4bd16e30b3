package trader.pipeline.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import trader.pipeline.service.evaluator.FeeConfig;

import java.math.BigDecimal;

@Data
@Configuration
@ConfigurationProperties(prefix = "pipeline.evaluator")
public class EvaluatorProperties {
    private BigDecimal capitalAllocation = new BigDecimal("1000");
    private BigDecimal takerFeeRate = new BigDecimal("0.001");      // 0.1% per leg
    private BigDecimal maxSlippageRate = new BigDecimal("0.001");
    private BigDecimal networkFee = new BigDecimal("1.5");
    private BigDecimal minProfitThreshold = new BigDecimal("0.5");  // percent
    private double minConfidence = 90;

    public FeeConfig toFeeConfig() {
        return FeeConfig.builder()
                .capitalAllocation(capitalAllocation)
                .takerFeeRate(takerFeeRate)
                .maxSlippageRate(maxSlippageRate)
                .networkFee(networkFee)
                .minProfitThreshold(minProfitThreshold)
                .minConfidence(minConfidence)
                .build();
    }
}
