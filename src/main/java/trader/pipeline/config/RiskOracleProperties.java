package trader.pipeline.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "pipeline.risk-oracle")
public class RiskOracleProperties {
    private double maxRiskPercent = 15;
    private int historySize = 120;
    private int minSamples = 10;
    private double bandSigmas = 2.0;
}
