package trader.pipeline.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one scan cycle. Venues missing from {@code quotes} are listed in {@code errors}.
 */
@Value
@Builder
public class ScanResult {
    Map<String, List<PriceQuote>> quotes;
    Map<String, String> errors;
    List<Spread> spreads;
    Instant startedAt;
    Duration duration;
}
