package trader.pipeline.client;

import reactor.core.publisher.Mono;
import trader.pipeline.config.VenueProperties;
import trader.pipeline.model.PriceQuote;

import java.time.Duration;
import java.util.List;

/**
 * Per-venue price fetcher. Implementations signal failures through the returned {@link Mono};
 * symbols the venue does not quote are simply absent from the result.
 */
public interface MarketDataSource {

    Mono<List<PriceQuote>> fetchPrices(VenueProperties venue, List<String> symbols, Duration timeout);
}
