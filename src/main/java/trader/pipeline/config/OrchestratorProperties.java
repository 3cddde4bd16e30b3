package trader.pipeline.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import trader.pipeline.model.TradingMode;

import java.math.BigDecimal;
import java.time.Duration;

@Data
@Configuration
@ConfigurationProperties(prefix = "pipeline.orchestrator")
public class OrchestratorProperties {
    private TradingMode mode = TradingMode.SIMULATION;
    private BigDecimal capital = new BigDecimal("10000");
    private int maxTradesPerHour = 50;
    private BigDecimal dailyLossLimit = new BigDecimal("500");
    private boolean enableRiskOracle = true;
    private Duration riskWindow = Duration.ofSeconds(5);
    private boolean autoStart = false;
    private int tradeHistorySize = 1000;
    private boolean haltOnSafetyLimit = false;
}
