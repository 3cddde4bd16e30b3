package trader.pipeline.client;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import trader.pipeline.config.VenueProperties;
import trader.pipeline.model.PriceQuote;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.stream.Collectors;

/**
 * Synthetic venue: a fixed reference price per symbol with a uniform per-venue deviation.
 */
@Slf4j
@Component
public class SimulatedPriceFeed implements MarketDataSource {

    private static final Map<String, BigDecimal> REFERENCE_PRICES = Map.of(
            "BTC", new BigDecimal("42500"),
            "ETH", new BigDecimal("2250"),
            "SOL", new BigDecimal("110"),
            "XRP", new BigDecimal("0.62"),
            "ADA", new BigDecimal("0.61"),
            "DOGE", new BigDecimal("0.092"),
            "MATIC", new BigDecimal("0.87"),
            "AVAX", new BigDecimal("38.5")
    );
    private static final BigDecimal DEFAULT_PRICE = new BigDecimal("100");

    private final Clock clock;
    private final Random random;

    @Autowired
    public SimulatedPriceFeed(Clock clock) {
        this(clock, new Random());
    }

    SimulatedPriceFeed(Clock clock, Random random) {
        this.clock = clock;
        this.random = random;
    }

    @Override
    public Mono<List<PriceQuote>> fetchPrices(VenueProperties venue, List<String> symbols, Duration timeout) {
        return Mono.fromCallable(() -> {
            if (venue.getSimulatedFailureRate() > 0 && nextDouble() < venue.getSimulatedFailureRate()) {
                throw new IllegalStateException("Simulated outage on " + venue.getName());
            }
            Instant now = clock.instant();
            return symbols.stream()
                    .map(symbol -> quote(venue, symbol, now))
                    .collect(Collectors.toList());
        });
    }

    private PriceQuote quote(VenueProperties venue, String symbol, Instant now) {
        double deviation = (nextDouble() - 0.5) * 2 * venue.getSimulatedVariancePercent() / 100;
        BigDecimal price = REFERENCE_PRICES.getOrDefault(symbol, DEFAULT_PRICE)
                .multiply(BigDecimal.valueOf(1 + deviation), MathContext.DECIMAL64);
        return PriceQuote.builder()
                .venue(venue.getName())
                .symbol(symbol)
                .price(price)
                .observedAt(now)
                .latency(Duration.ZERO)
                .build();
    }

    private synchronized double nextDouble() {
        return random.nextDouble();
    }
}
