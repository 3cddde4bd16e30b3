package trader.pipeline.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PriceQuote {
    private String venue;
    private String symbol;
    private BigDecimal price;
    private Instant observedAt;
    private Duration latency;
}
