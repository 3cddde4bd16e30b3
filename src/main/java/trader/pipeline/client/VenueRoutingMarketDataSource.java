package trader.pipeline.client;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import trader.pipeline.config.VenueProperties;
import trader.pipeline.model.PriceQuote;

import java.time.Duration;
import java.util.List;

@Component
@Primary
@RequiredArgsConstructor
public class VenueRoutingMarketDataSource implements MarketDataSource {

    private final HttpTickerClient httpTickerClient;
    private final SimulatedPriceFeed simulatedPriceFeed;

    @Override
    public Mono<List<PriceQuote>> fetchPrices(VenueProperties venue, List<String> symbols, Duration timeout) {
        switch (venue.getType()) {
            case HTTP:
                return httpTickerClient.fetchPrices(venue, symbols, timeout);
            case SIMULATED:
                return simulatedPriceFeed.fetchPrices(venue, symbols, timeout);
            default:
                return Mono.error(new IllegalArgumentException("Unsupported venue type " + venue.getType()));
        }
    }
}
