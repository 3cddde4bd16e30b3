package trader.pipeline.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Widest cross-venue price gap for one symbol at one scan instant.
 * Always {@code highPrice >= lowPrice}; the low venue is the buy leg.
 */
@Value
@Builder
public class Spread {
    String symbol;
    String lowVenue;
    String highVenue;
    BigDecimal lowPrice;
    BigDecimal highPrice;
    BigDecimal spreadPercent;
    Instant observedAt;
}
