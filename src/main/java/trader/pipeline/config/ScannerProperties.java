package trader.pipeline.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "pipeline.scanner")
public class ScannerProperties {
    private Duration interval = Duration.ofMillis(100);
    private Duration venueTimeout = Duration.ofSeconds(2);
    private BigDecimal significanceFloorPercent = new BigDecimal("0.5");
    private Duration priceCacheTtl = Duration.ofSeconds(5);
    private List<String> symbols = new ArrayList<>(List.of("BTC", "ETH", "SOL", "XRP", "ADA", "DOGE", "MATIC", "AVAX"));
    private List<VenueProperties> venues = new ArrayList<>();

    public Duration timeoutFor(VenueProperties venue) {
        return venue.getTimeout() != null ? venue.getTimeout() : venueTimeout;
    }
}
