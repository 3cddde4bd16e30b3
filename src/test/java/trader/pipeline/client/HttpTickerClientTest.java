package trader.pipeline.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.test.StepVerifier;
import trader.pipeline.config.VenueProperties;
import trader.pipeline.config.VenueType;
import trader.pipeline.model.PriceQuote;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpTickerClientTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    private final HttpTickerClient client = new HttpTickerClient(
            WebClient.create(), new ObjectMapper(), Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void parsesTopLevelArrayAndMapsVenueSymbols() {
        VenueProperties venue = venue();
        venue.setSymbols(Map.of("BTC", "BTCUSDT", "ETH", "ETHUSDT"));
        String body = "[{\"symbol\":\"BTCUSDT\",\"price\":\"42510.5\"},"
                + "{\"symbol\":\"ETHUSDT\",\"price\":2251.25},"
                + "{\"symbol\":\"LTCUSDT\",\"price\":\"70\"}]";

        List<PriceQuote> quotes = client.parseResponse(venue, List.of("BTC", "ETH"), body, NOW);

        assertThat(quotes).extracting(PriceQuote::getSymbol).containsExactly("BTC", "ETH");
        assertThat(quotes.get(0).getPrice()).isEqualByComparingTo("42510.5");
        assertThat(quotes.get(1).getPrice()).isEqualByComparingTo("2251.25");
        assertThat(quotes).allSatisfy(quote -> {
            assertThat(quote.getVenue()).isEqualTo("delta");
            assertThat(quote.getObservedAt()).isEqualTo(NOW);
        });
    }

    @Test
    void parsesDataWrapperWithCustomFieldNames() {
        VenueProperties venue = venue();
        venue.setSymbolField("s");
        venue.setPriceField("p");
        String body = "{\"data\":[{\"s\":\"SOL\",\"p\":\"110.2\"},{\"s\":\"ADA\"}]}";

        List<PriceQuote> quotes = client.parseResponse(venue, List.of("SOL", "ADA"), body, NOW);

        assertThat(quotes).singleElement().satisfies(quote -> {
            assertThat(quote.getSymbol()).isEqualTo("SOL");
            assertThat(quote.getPrice()).isEqualByComparingTo("110.2");
        });
    }

    @Test
    void nonNumericPriceSkipsOnlyThatTicker() {
        String body = "[{\"symbol\":\"BTC\",\"price\":\"N/A\"},{\"symbol\":\"ETH\",\"price\":\"2250\"}]";

        List<PriceQuote> quotes = client.parseResponse(venue(), List.of("BTC", "ETH"), body, NOW);

        assertThat(quotes).singleElement().satisfies(quote -> {
            assertThat(quote.getSymbol()).isEqualTo("ETH");
            assertThat(quote.getPrice()).isEqualByComparingTo("2250");
        });
    }

    @Test
    void unexpectedShapeYieldsNoQuotes() {
        assertThat(client.parseResponse(venue(), List.of("BTC"), "{\"status\":\"ok\"}", NOW)).isEmpty();
    }

    @Test
    void malformedBodyFails() {
        assertThatThrownBy(() -> client.parseResponse(venue(), List.of("BTC"), "not json", NOW))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("delta");
    }

    @Test
    void missingApiUrlFailsTheFetch() {
        VenueProperties venue = venue();
        venue.setApiUrl(null);

        StepVerifier.create(client.fetchPrices(venue, List.of("BTC"), Duration.ofSeconds(1)))
                .expectError(IllegalStateException.class)
                .verify();
    }

    private static VenueProperties venue() {
        VenueProperties venue = new VenueProperties();
        venue.setName("delta");
        venue.setType(VenueType.HTTP);
        venue.setApiUrl("http://localhost:1/ticker");
        return venue;
    }
}
