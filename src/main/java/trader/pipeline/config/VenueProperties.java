package trader.pipeline.config;

import lombok.Data;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

@Data
public class VenueProperties {
    private String name;
    private VenueType type = VenueType.SIMULATED;
    private boolean enabled = true;
    private String apiUrl;
    private Duration timeout;               // falls back to pipeline.scanner.venue-timeout
    private String symbolParam = "symbols";
    private String symbolField = "symbol";
    private String priceField = "price";
    private Map<String, String> symbols = new HashMap<>();   // pipeline symbol -> venue symbol
    private double simulatedVariancePercent = 1.0;
    private double simulatedFailureRate = 0.0;

    public String venueSymbol(String symbol) {
        return symbols.getOrDefault(symbol, symbol);
    }
}
