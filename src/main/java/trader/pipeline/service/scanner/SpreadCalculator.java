package trader.pipeline.service.scanner;

import org.springframework.stereotype.Component;
import trader.pipeline.model.PriceQuote;
import trader.pipeline.model.Spread;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Derives the widest cross-venue spread per symbol.
 * <p>
 * Quotes are ordered by price, then by venue name; the first entry is the buy leg and the last
 * the sell leg. When several venues share an extreme price the alphabetically first one buys and
 * the alphabetically last one sells. The rule only picks the nominal legs; the spread is the same.
 */
@Component
public class SpreadCalculator {

    private static final BigDecimal HUNDRED = new BigDecimal("100");
    private static final Comparator<PriceQuote> BY_PRICE_THEN_VENUE =
            Comparator.comparing(PriceQuote::getPrice).thenComparing(PriceQuote::getVenue);

    public List<Spread> calculate(Collection<String> symbols,
                                  Collection<List<PriceQuote>> quotesByVenue,
                                  BigDecimal significanceFloorPercent,
                                  Instant observedAt) {
        List<Spread> spreads = new ArrayList<>();

        for (String symbol : symbols) {
            List<PriceQuote> symbolQuotes = new ArrayList<>();
            for (List<PriceQuote> venueQuotes : quotesByVenue) {
                venueQuotes.stream()
                        .filter(quote -> symbol.equals(quote.getSymbol()))
                        .filter(quote -> quote.getPrice() != null && quote.getPrice().signum() > 0)
                        .findFirst()
                        .ifPresent(symbolQuotes::add);
            }

            if (symbolQuotes.size() < 2) {
                continue;
            }

            symbolQuotes.sort(BY_PRICE_THEN_VENUE);
            PriceQuote lowest = symbolQuotes.get(0);
            PriceQuote highest = symbolQuotes.get(symbolQuotes.size() - 1);

            BigDecimal spreadPercent = spreadPercent(lowest.getPrice(), highest.getPrice());
            if (spreadPercent.compareTo(significanceFloorPercent) > 0) {
                spreads.add(Spread.builder()
                        .symbol(symbol)
                        .lowVenue(lowest.getVenue())
                        .highVenue(highest.getVenue())
                        .lowPrice(lowest.getPrice())
                        .highPrice(highest.getPrice())
                        .spreadPercent(spreadPercent)
                        .observedAt(observedAt)
                        .build());
            }
        }

        spreads.sort(Comparator.comparing(Spread::getSpreadPercent).reversed());
        return spreads;
    }

    public BigDecimal spreadPercent(BigDecimal low, BigDecimal high) {
        return high.subtract(low)
                .divide(low, MathContext.DECIMAL64)
                .multiply(HUNDRED);
    }
}
