package trader.pipeline.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;
import trader.pipeline.config.VenueProperties;
import trader.pipeline.model.PriceQuote;

import java.math.BigDecimal;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Reads a JSON ticker endpoint: either a top-level array or an object with a {@code data} array,
 * each element carrying a symbol field and a price field (names configurable per venue).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HttpTickerClient implements MarketDataSource {

    private final WebClient marketDataClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public Mono<List<PriceQuote>> fetchPrices(VenueProperties venue, List<String> symbols, Duration timeout) {
        if (venue.getApiUrl() == null || venue.getApiUrl().isBlank()) {
            return Mono.error(new IllegalStateException("No api-url configured for venue " + venue.getName()));
        }
        return Mono.defer(() -> {
            Instant requestedAt = clock.instant();
            return marketDataClient.get()
                    .uri(buildRequestUri(venue, symbols))
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(timeout)
                    .map(body -> parseResponse(venue, symbols, body, requestedAt));
        });
    }

    private URI buildRequestUri(VenueProperties venue, List<String> symbols) {
        String venueSymbols = symbols.stream()
                .map(venue::venueSymbol)
                .collect(Collectors.joining(","));

        return UriComponentsBuilder.fromHttpUrl(venue.getApiUrl())
                .queryParam(venue.getSymbolParam(), venueSymbols)
                .build()
                .toUri();
    }

    List<PriceQuote> parseResponse(VenueProperties venue, List<String> symbols, String responseBody, Instant requestedAt) {
        JsonNode rootNode;
        try {
            rootNode = objectMapper.readTree(responseBody);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to parse ticker response from " + venue.getName(), e);
        }

        JsonNode tickers = rootNode.isArray() ? rootNode : rootNode.path("data");
        if (!tickers.isArray()) {
            log.warn("Unexpected ticker payload from {}", venue.getName());
            return List.of();
        }

        // venue symbol -> pipeline symbol
        Map<String, String> wanted = new HashMap<>();
        symbols.forEach(symbol -> wanted.put(venue.venueSymbol(symbol), symbol));

        Instant observedAt = clock.instant();
        Duration latency = Duration.between(requestedAt, observedAt);
        List<PriceQuote> quotes = new ArrayList<>();
        for (JsonNode ticker : tickers) {
            String symbol = wanted.get(ticker.path(venue.getSymbolField()).asText());
            JsonNode priceNode = ticker.path(venue.getPriceField());
            if (symbol == null || priceNode.isMissingNode() || priceNode.isNull()) {
                continue;
            }
            BigDecimal price;
            try {
                price = new BigDecimal(priceNode.asText());
            } catch (NumberFormatException e) {
                log.warn("Skipping {} ticker from {}: non-numeric price '{}'",
                        symbol, venue.getName(), priceNode.asText());
                continue;
            }
            quotes.add(PriceQuote.builder()
                    .venue(venue.getName())
                    .symbol(symbol)
                    .price(price)
                    .observedAt(observedAt)
                    .latency(latency)
                    .build());
        }
        return quotes;
    }
}
